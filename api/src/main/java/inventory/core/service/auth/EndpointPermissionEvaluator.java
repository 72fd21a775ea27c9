package inventory.core.service.auth;

import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import inventory.core.model.auth.AuthorizationDecision;
import inventory.core.model.auth.EndpointPermissionAction;
import inventory.core.model.auth.Role;
import inventory.core.model.routing.EndpointRoute;
import inventory.core.port.out.RoleRepository;

/**
 * Decides whether a principal's roles grant access to an endpoint.
 *
 * <p>Roles are checked in claim order and the first authorizing role wins. A role
 * that is missing from the store, or whose lookup fails, grants nothing.
 */
@ApplicationScoped
public class EndpointPermissionEvaluator {

    private static final Logger LOG = Logger.getLogger(EndpointPermissionEvaluator.class);

    static final String NO_CLAIMS_MESSAGE =
            "No claims found for the current user. Are you missing an Authorization header?";

    private final RoleRepository roleRepository;

    @Inject
    public EndpointPermissionEvaluator(RoleRepository roleRepository) {
        this.roleRepository = roleRepository;
    }

    /**
     * Evaluate the roles against the route.
     *
     * @param roles role names in claim order
     * @param route the endpoint being called
     * @return Uni with the decision; never fails
     */
    public Uni<AuthorizationDecision> authorize(List<String> roles, EndpointRoute route) {
        if (route.anonymous()) {
            return Uni.createFrom().item(AuthorizationDecision.allow());
        }
        if (roles == null || roles.isEmpty()) {
            return Uni.createFrom().item(AuthorizationDecision.deny(NO_CLAIMS_MESSAGE));
        }
        return checkRole(roles, 0, route.endpointId(), route.verb().requiredAction());
    }

    private Uni<AuthorizationDecision> checkRole(
            List<String> roles, int index, String endpointId, EndpointPermissionAction required) {
        final var roleName = roles.get(index);
        return lookup(roleName).flatMap(role -> {
            if (role.map(r -> r.authorizes(endpointId, required)).orElse(false)) {
                LOG.debugv("Role {0} grants {1} on {2}", roleName, required, endpointId);
                return Uni.createFrom().item(AuthorizationDecision.allow());
            }
            if (index + 1 >= roles.size()) {
                return Uni.createFrom().item(AuthorizationDecision.deny(denialMessage(roleName, endpointId, required)));
            }
            return checkRole(roles, index + 1, endpointId, required);
        });
    }

    private Uni<Optional<Role>> lookup(String roleName) {
        return roleRepository.findByName(roleName).onFailure().recoverWithItem(e -> {
            LOG.warnv(e, "Role lookup failed for {0}; treating it as granting nothing", roleName);
            return Optional.empty();
        });
    }

    static String denialMessage(String role, String endpointId, EndpointPermissionAction action) {
        return "Role '" + role + "' does not have access to endpoint '" + endpointId + "' with action '"
                + action.displayName() + "'.";
    }
}
