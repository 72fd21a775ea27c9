package inventory.adapter.in.rest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.quarkus.security.identity.CurrentIdentityAssociation;
import io.smallrye.mutiny.Uni;

import inventory.adapter.in.auth.BearerIdentityProvider;
import inventory.core.model.auth.InventoryPrincipal;

/**
 * Lets callers introspect their own authentication state.
 */
@Path("/whoami")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class WhoAmIResource {

    private final CurrentIdentityAssociation identityAssociation;

    @Inject
    public WhoAmIResource(CurrentIdentityAssociation identityAssociation) {
        this.identityAssociation = identityAssociation;
    }

    /**
     * Return information about the currently authenticated caller.
     *
     * @return a map containing id, name, roles, and expiresAt
     */
    @GET
    public Uni<Map<String, Object>> whoami() {
        return identityAssociation.getDeferredIdentity().map(identity -> {
            final var result = new LinkedHashMap<String, Object>();
            final var principal = identity.getPrincipal();
            if (principal instanceof InventoryPrincipal inventoryPrincipal) {
                result.put("id", inventoryPrincipal.accountId());
            }
            result.put("name", principal == null ? null : principal.getName());

            final List<String> roles = identity.getAttribute(BearerIdentityProvider.ROLES_ATTRIBUTE);
            result.put("roles", roles == null ? List.of() : roles);

            final Instant expiresAt = identity.getAttribute(BearerIdentityProvider.EXPIRES_AT_ATTRIBUTE);
            if (expiresAt != null) {
                result.put("expiresAt", expiresAt.toString());
            }
            return result;
        });
    }
}
