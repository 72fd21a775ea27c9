package inventory.core.model.auth;

/**
 * A credential presented by a caller, parsed from request headers.
 *
 * <p>Credentials are transient: they are constructed per request and never persisted.
 */
public sealed interface Credential {

    /**
     * Opaque API key from the {@code ApiKey} header.
     *
     * @param key the API key value
     */
    record ApiKey(String key) implements Credential {
        public ApiKey {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("API key cannot be null or blank");
            }
        }

        @Override
        public String toString() {
            return "ApiKey[key=***]";
        }
    }

    /**
     * Username and password decoded from an {@code Authorization: Basic} header.
     *
     * @param username the account username
     * @param password the plaintext password
     */
    record Basic(String username, String password) implements Credential {
        public Basic {
            if (username == null) {
                throw new IllegalArgumentException("Username cannot be null");
            }
            if (password == null) {
                throw new IllegalArgumentException("Password cannot be null");
            }
        }

        @Override
        public String toString() {
            return "Basic[username=" + username + ", password=***]";
        }
    }

    /**
     * Signed token from an {@code Authorization: Bearer} header.
     *
     * @param token the compact JWS serialization
     */
    record Bearer(String token) implements Credential {
        public Bearer {
            if (token == null || token.isBlank()) {
                throw new IllegalArgumentException("Bearer token cannot be null or blank");
            }
        }

        @Override
        public String toString() {
            return "Bearer[token=***]";
        }
    }
}
