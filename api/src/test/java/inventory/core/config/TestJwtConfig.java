package inventory.core.config;

import java.util.Optional;

/**
 * Fixed JwtConfig for unit tests.
 */
public record TestJwtConfig(String secret, String iss, String aud, int lifetimeMinutes) implements JwtConfig {

    public static final String SECRET = "+GRnfnxS4Gce0N2wuUwJfuk7miTFzVgqKIFEJLlug3A=";
    public static final String ISSUER = "inventory-test";
    public static final String AUDIENCE = "inventory-test-clients";

    public static TestJwtConfig defaults() {
        return new TestJwtConfig(SECRET, ISSUER, AUDIENCE, 60);
    }

    @Override
    public Optional<String> secretKey() {
        return Optional.ofNullable(secret);
    }

    @Override
    public Optional<String> issuer() {
        return Optional.ofNullable(iss);
    }

    @Override
    public Optional<String> audience() {
        return Optional.ofNullable(aud);
    }

    @Override
    public int tokenLifetimeMinutes() {
        return lifetimeMinutes;
    }
}
