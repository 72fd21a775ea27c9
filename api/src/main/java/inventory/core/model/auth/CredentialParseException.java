package inventory.core.model.auth;

public class CredentialParseException extends RuntimeException {

    public CredentialParseException(String message) {
        super(message);
    }

    public CredentialParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
