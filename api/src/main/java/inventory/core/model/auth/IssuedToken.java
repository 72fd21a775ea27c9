package inventory.core.model.auth;

import java.time.Instant;

/**
 * A freshly signed Bearer token.
 *
 * @param token     compact JWS serialization
 * @param expiresAt expiry encoded in the {@code exp} claim
 */
public record IssuedToken(String token, Instant expiresAt) {

    @Override
    public String toString() {
        return "IssuedToken[token=***, expiresAt=" + expiresAt + "]";
    }
}
