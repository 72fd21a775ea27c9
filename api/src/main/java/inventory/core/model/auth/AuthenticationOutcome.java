package inventory.core.model.auth;

/**
 * Outcome of authenticating a credential-exchange request.
 */
public sealed interface AuthenticationOutcome {

    String API_KEY_SCHEME = "ApiKey";
    String BASIC_SCHEME = "Basic";
    String BEARER_SCHEME = "Bearer";
    String DEFAULT_SCHEME = "Default";

    String scheme();

    /**
     * Credentials resolved to an account.
     */
    record Success(Account account, String scheme) implements AuthenticationOutcome {}

    /**
     * Credentials were presented but rejected.
     *
     * @param reason context error returned to the caller
     */
    record Fail(String scheme, String reason) implements AuthenticationOutcome {}

    /**
     * The scheme expected credentials that were not presented.
     *
     * @param reason optional context error, null to use the scheme's default message
     */
    record Challenge(String scheme, String reason) implements AuthenticationOutcome {}
}
