package inventory.core.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JwtSettings")
class JwtSettingsTest {

    @Test
    @DisplayName("should resolve complete configuration")
    void shouldResolveCompleteConfig() {
        final var settings = JwtSettings.from(TestJwtConfig.defaults());

        assertEquals(TestJwtConfig.ISSUER, settings.issuer());
        assertEquals(Duration.ofMinutes(60), settings.lifetime());
        assertEquals(32, settings.secretBytes().length);
    }

    @Test
    @DisplayName("should reject a missing secret")
    void shouldRejectMissingSecret() {
        final var config = new TestJwtConfig(null, "iss", "aud", 60);

        final var e = assertThrows(ConfigurationException.class, () -> JwtSettings.from(config));
        assertTrue(e.getMessage().contains("SecretKey"));
    }

    @Test
    @DisplayName("should reject a secret that is not base64")
    void shouldRejectNonBase64Secret() {
        final var config = new TestJwtConfig("not base64 at all!", "iss", "aud", 60);

        final var e = assertThrows(ConfigurationException.class, () -> JwtSettings.from(config));
        assertEquals("The JWT Secret key is not a valid Base64 string", e.getMessage());
    }

    @Test
    @DisplayName("should reject a secret shorter than 32 bytes")
    void shouldRejectShortSecret() {
        final var config = new TestJwtConfig("c2hvcnQ=", "iss", "aud", 60);

        assertThrows(ConfigurationException.class, () -> JwtSettings.from(config));
    }

    @Test
    @DisplayName("should reject missing issuer, audience and non-positive lifetime")
    void shouldRejectIncompleteConfig() {
        assertThrows(ConfigurationException.class,
                () -> JwtSettings.from(new TestJwtConfig(TestJwtConfig.SECRET, null, "aud", 60)));
        assertThrows(ConfigurationException.class,
                () -> JwtSettings.from(new TestJwtConfig(TestJwtConfig.SECRET, "iss", " ", 60)));
        assertThrows(ConfigurationException.class,
                () -> JwtSettings.from(new TestJwtConfig(TestJwtConfig.SECRET, "iss", "aud", 0)));
    }

    @Test
    @DisplayName("should not print the secret")
    void shouldNotPrintSecret() {
        assertFalse(JwtSettings.from(TestJwtConfig.defaults()).toString().contains(TestJwtConfig.SECRET));
    }
}
