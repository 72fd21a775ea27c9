package inventory.core.model.auth;

/**
 * Canonical claim names used inside the application.
 *
 * <p>Wire names may differ; see {@link ClaimNameMapping}.
 */
public final class ClaimNames {

    public static final String SUBJECT = "sub";
    public static final String USERNAME = "username";
    public static final String EMAIL = "email";
    public static final String NAME = "name";
    public static final String JWT_ID = "jti";
    public static final String ROLE = "role";
    public static final String ISSUER = "iss";
    public static final String AUDIENCE = "aud";
    public static final String ISSUED_AT = "iat";
    public static final String EXPIRATION = "exp";
    public static final String NOT_BEFORE = "nbf";

    private ClaimNames() {}
}
