package inventory.core.model.auth;

/**
 * Why a Bearer token was rejected.
 */
public enum TokenFailure {
    MALFORMED,
    BAD_SIGNATURE,
    WRONG_ISSUER,
    WRONG_AUDIENCE,
    EXPIRED,
    MISSING_CLAIM,
    INVALID_SECRET
}
