package inventory.system.filter;

import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Response;

import io.quarkus.security.AuthenticationFailedException;
import io.quarkus.security.identity.CurrentIdentityAssociation;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;
import org.jboss.resteasy.reactive.server.SimpleResourceInfo;

import inventory.adapter.in.auth.AuthorizationFailureResponder;
import inventory.core.model.auth.AuthenticationOutcome;
import inventory.core.model.auth.AuthorizationDecision;
import inventory.core.model.auth.InventoryPrincipal;
import inventory.core.model.auth.RequestHeaders;
import inventory.core.model.routing.EndpointRoute;
import inventory.core.service.auth.EndpointPermissionEvaluator;
import inventory.core.service.routing.EndpointCatalog;

/**
 * Enforces role-based endpoint access on matched resource methods.
 *
 * <p>Runs after resource matching so the method's catalogued route is known.
 * Only methods catalogued as anonymous pass through. Otherwise the Bearer identity
 * is resolved: no identity or a rejected token yields 401, and a principal whose
 * roles do not grant the endpoint yields 403. Uncatalogued methods are denied to
 * every principal.
 */
public class EndpointAccessFilter {

    private static final Logger LOG = Logger.getLogger(EndpointAccessFilter.class);

    static final String UNREGISTERED_MESSAGE = "No access rule is registered for this endpoint.";

    private final EndpointCatalog catalog;
    private final EndpointPermissionEvaluator evaluator;
    private final CurrentIdentityAssociation identityAssociation;
    private final AuthorizationFailureResponder responder;

    @Inject
    public EndpointAccessFilter(
            EndpointCatalog catalog,
            EndpointPermissionEvaluator evaluator,
            CurrentIdentityAssociation identityAssociation,
            AuthorizationFailureResponder responder) {
        this.catalog = catalog;
        this.evaluator = evaluator;
        this.identityAssociation = identityAssociation;
        this.responder = responder;
    }

    @ServerRequestFilter
    public Uni<Response> filter(ContainerRequestContext requestContext, SimpleResourceInfo resourceInfo) {
        final var route = catalog.lookup(resourceInfo.getResourceClass(), resourceInfo.getMethodName());
        if (route.isPresent() && route.get().anonymous()) {
            return Uni.createFrom().nullItem();
        }

        final var headers = RequestHeaders.of(requestContext.getHeaders());
        return identityAssociation
                .getDeferredIdentity()
                .flatMap(identity -> {
                    if (identity.isAnonymous() || !(identity.getPrincipal() instanceof InventoryPrincipal)) {
                        return Uni.createFrom().item(responder.unauthorized(
                                new AuthenticationOutcome.Challenge(AuthenticationOutcome.BEARER_SCHEME, null),
                                headers));
                    }
                    final var principal = (InventoryPrincipal) identity.getPrincipal();
                    if (route.isEmpty()) {
                        return Uni.createFrom().item(unregistered(principal, resourceInfo));
                    }
                    return authorize(principal, route.get());
                })
                .onFailure(AuthenticationFailedException.class)
                .recoverWithItem(e -> responder.unauthorized(
                        new AuthenticationOutcome.Fail(AuthenticationOutcome.BEARER_SCHEME, e.getMessage()),
                        headers));
    }

    private Response unregistered(InventoryPrincipal principal, SimpleResourceInfo resourceInfo) {
        final var method = resourceInfo.getResourceClass().getSimpleName() + "." + resourceInfo.getMethodName();
        LOG.warnv("Denied {0} on {1}: method has no access rule", principal.getName(), method);
        return responder.forbidden(UNREGISTERED_MESSAGE);
    }

    private Uni<Response> authorize(InventoryPrincipal principal, EndpointRoute route) {
        return evaluator.authorize(principal.roles(), route).map(decision -> {
            if (decision instanceof AuthorizationDecision.Denied denied) {
                LOG.debugv("Denied {0} on {1}: {2}", principal.getName(), route.endpointId(), denied.message());
                return responder.forbidden(denied.message());
            }
            return null;
        });
    }
}
