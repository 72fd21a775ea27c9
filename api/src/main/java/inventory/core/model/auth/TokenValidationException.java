package inventory.core.model.auth;

/**
 * Thrown when a Bearer token is rejected, carrying the failure category.
 */
public class TokenValidationException extends RuntimeException {

    private final TokenFailure failure;

    public TokenValidationException(TokenFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public TokenFailure failure() {
        return failure;
    }
}
