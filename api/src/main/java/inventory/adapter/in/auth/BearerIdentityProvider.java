package inventory.adapter.in.auth;

import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.security.AuthenticationFailedException;
import io.quarkus.security.identity.AuthenticationRequestContext;
import io.quarkus.security.identity.IdentityProvider;
import io.quarkus.security.identity.SecurityIdentity;
import io.quarkus.security.runtime.QuarkusSecurityIdentity;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import inventory.core.model.auth.TokenValidationResult;
import inventory.core.service.auth.TokenService;

/**
 * Validates Bearer tokens and builds the security identity.
 *
 * <p>The resulting {@link SecurityIdentity} contains:
 * <ul>
 *   <li>Principal: an {@link inventory.core.model.auth.InventoryPrincipal}</li>
 *   <li>Roles: the token's role claims</li>
 *   <li>Attributes: {@value #ROLES_ATTRIBUTE} in claim order, {@value #CLAIMS_ATTRIBUTE}, {@value #EXPIRES_AT_ATTRIBUTE}</li>
 * </ul>
 */
@ApplicationScoped
public class BearerIdentityProvider implements IdentityProvider<BearerAuthenticationRequest> {

    private static final Logger LOG = Logger.getLogger(BearerIdentityProvider.class);

    public static final String ROLES_ATTRIBUTE = "roles";
    public static final String CLAIMS_ATTRIBUTE = "claims";
    public static final String EXPIRES_AT_ATTRIBUTE = "expiresAt";

    private final TokenService tokenService;

    @Inject
    public BearerIdentityProvider(TokenService tokenService) {
        this.tokenService = tokenService;
    }

    @Override
    public Class<BearerAuthenticationRequest> getRequestType() {
        return BearerAuthenticationRequest.class;
    }

    @Override
    public Uni<SecurityIdentity> authenticate(
            BearerAuthenticationRequest request, AuthenticationRequestContext context) {
        return Uni.createFrom().item(() -> tokenService.validate(request.getToken())).flatMap(result -> {
            if (result instanceof TokenValidationResult.Valid valid) {
                return Uni.createFrom().item(buildIdentity(valid));
            } else if (result instanceof TokenValidationResult.Invalid invalid) {
                LOG.debugv("Bearer validation failed ({0}): {1}", invalid.failure(), invalid.reason());
                return Uni.createFrom().failure(new AuthenticationFailedException(invalid.reason()));
            } else {
                return Uni.createFrom().nullItem();
            }
        });
    }

    private SecurityIdentity buildIdentity(TokenValidationResult.Valid valid) {
        final var principal = valid.principal();
        LOG.debugv("Bearer authenticated: subject={0}, roles={1}", principal.accountId(), principal.roles());
        return QuarkusSecurityIdentity.builder()
                .setPrincipal(principal)
                .addRoles(Set.copyOf(principal.roles()))
                .addAttribute(ROLES_ATTRIBUTE, principal.roles())
                .addAttribute(CLAIMS_ATTRIBUTE, principal.claims())
                .addAttribute(EXPIRES_AT_ATTRIBUTE, valid.expiresAt())
                .build();
    }
}
