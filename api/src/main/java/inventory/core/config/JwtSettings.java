package inventory.core.config;

import java.time.Duration;
import java.util.Base64;

/**
 * Resolved token settings.
 *
 * @param secretKey base64-encoded signing key
 * @param issuer    issuer claim value
 * @param audience  audience claim value
 * @param lifetime  token lifetime
 */
public record JwtSettings(String secretKey, String issuer, String audience, Duration lifetime) {

    static final int MIN_KEY_BYTES = 32;

    public JwtSettings {
        if (secretKey == null || secretKey.isBlank()) {
            throw new ConfigurationException("Invalid JWT Configuration - missing SecretKey");
        }
        if (issuer == null || issuer.isBlank()) {
            throw new ConfigurationException("Invalid JWT Configuration - missing Issuer");
        }
        if (audience == null || audience.isBlank()) {
            throw new ConfigurationException("Invalid JWT Configuration - missing Audience");
        }
        if (lifetime == null || lifetime.isNegative() || lifetime.isZero()) {
            throw new ConfigurationException("Invalid JWT Configuration - token lifetime must be positive");
        }
        if (decodeSecret(secretKey).length < MIN_KEY_BYTES) {
            throw new ConfigurationException(
                    "Invalid JWT Configuration - SecretKey must decode to at least " + MIN_KEY_BYTES + " bytes");
        }
    }

    public static JwtSettings from(JwtConfig config) {
        return new JwtSettings(
                config.secretKey().orElse(null),
                config.issuer().orElse(null),
                config.audience().orElse(null),
                Duration.ofMinutes(config.tokenLifetimeMinutes()));
    }

    /**
     * Decode a base64 signing key.
     *
     * @throws ConfigurationException if the value is not valid base64
     */
    public static byte[] decodeSecret(String secretKey) {
        try {
            return Base64.getDecoder().decode(secretKey.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("The JWT Secret key is not a valid Base64 string", e);
        }
    }

    public byte[] secretBytes() {
        return decodeSecret(secretKey);
    }

    @Override
    public String toString() {
        return "JwtSettings[issuer=" + issuer + ", audience=" + audience + ", lifetime=" + lifetime + "]";
    }
}
