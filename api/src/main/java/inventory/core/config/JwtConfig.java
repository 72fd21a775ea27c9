package inventory.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Settings for issuing and validating the API's own Bearer tokens.
 *
 * <p>Values are resolved and checked into {@link JwtSettings} at startup.
 */
@ConfigMapping(prefix = "inventory.auth.jwt")
public interface JwtConfig {

    /**
     * Base64-encoded HMAC-SHA256 key. At least 32 bytes once decoded.
     */
    Optional<String> secretKey();

    /**
     * Value written to and expected in the {@code iss} claim.
     */
    Optional<String> issuer();

    /**
     * Value written to and expected in the {@code aud} claim.
     */
    Optional<String> audience();

    /**
     * Lifetime of issued tokens.
     */
    @WithDefault("60")
    int tokenLifetimeMinutes();
}
