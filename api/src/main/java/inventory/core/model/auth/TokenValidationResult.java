package inventory.core.model.auth;

import java.time.Instant;

/**
 * Result of validating a Bearer token.
 */
public sealed interface TokenValidationResult {

    /**
     * Token is valid.
     *
     * @param principal normalized principal built from the claims
     * @param expiresAt token expiry
     */
    record Valid(InventoryPrincipal principal, Instant expiresAt) implements TokenValidationResult {}

    /**
     * Token was present but rejected.
     *
     * @param failure the failure category
     * @param reason  human-readable reason, safe to return to clients
     */
    record Invalid(TokenFailure failure, String reason) implements TokenValidationResult {}

    /**
     * No token was presented.
     */
    record NoToken() implements TokenValidationResult {}
}
