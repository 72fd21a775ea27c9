package inventory.core.model.auth;

public class AccountLookupException extends RuntimeException {

    public AccountLookupException(String message) {
        super(message);
    }

    public AccountLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
