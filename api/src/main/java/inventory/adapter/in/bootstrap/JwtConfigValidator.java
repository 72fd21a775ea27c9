package inventory.adapter.in.bootstrap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import inventory.core.config.ConfigurationException;
import inventory.core.service.auth.TokenService;

/**
 * Resolves the token settings on startup so misconfiguration stops the application.
 *
 * <h2>Failure Behavior</h2>
 * <ul>
 *   <li>Missing secret key, issuer or audience: startup FAILS</li>
 *   <li>Secret key not base64, or shorter than 32 bytes: startup FAILS</li>
 * </ul>
 */
@ApplicationScoped
public class JwtConfigValidator {

    private static final Logger LOG = Logger.getLogger(JwtConfigValidator.class);

    private final TokenService tokenService;

    @Inject
    public JwtConfigValidator(TokenService tokenService) {
        this.tokenService = tokenService;
    }

    void onStart(@Observes StartupEvent event) {
        try {
            final var settings = tokenService.settings();
            LOG.infov(
                    "Token issuance configured: issuer={0}, audience={1}, lifetime={2}",
                    settings.issuer(), settings.audience(), settings.lifetime());
        } catch (ConfigurationException e) {
            LOG.errorv("JWT configuration invalid: {0}", e.getMessage());
            throw e;
        }
    }
}
