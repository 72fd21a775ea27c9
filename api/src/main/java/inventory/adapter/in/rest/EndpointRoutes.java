package inventory.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import inventory.core.model.routing.EndpointRoute;
import inventory.core.model.routing.HttpVerb;
import inventory.core.service.routing.EndpointCatalog;

/**
 * Authorization metadata for every resource method.
 *
 * <p>Endpoint identifiers follow {@code Controller/Action[/Param]}, the form role
 * grants are written in.
 */
@ApplicationScoped
public class EndpointRoutes {

    static final String SERVER = "Server";
    static final String ACCOUNT = "Account";

    @Produces
    @ApplicationScoped
    public EndpointCatalog endpointCatalog() {
        return EndpointCatalog.builder()
                .route(AccountResource.class, "provision", EndpointRoute.anonymous(ACCOUNT, "Provision", HttpVerb.GET))
                .route(AccountResource.class, "token", EndpointRoute.anonymous(ACCOUNT, "Token", HttpVerb.POST))
                .route(AccountResource.class, "verify", EndpointRoute.anonymous(ACCOUNT, "Verify", HttpVerb.POST))
                .route(ServerResource.class, "getById", EndpointRoute.of(SERVER, "GetById", HttpVerb.GET, "{Id}"))
                .route(ServerResource.class, "getByFilter", EndpointRoute.of(SERVER, "GetByFilter", HttpVerb.GET))
                .route(ServerResource.class, "post", EndpointRoute.of(SERVER, "Post", HttpVerb.POST))
                .route(ServerResource.class, "patch", EndpointRoute.of(SERVER, "Patch", HttpVerb.PATCH, "{Id}"))
                .route(ServerResource.class, "put", EndpointRoute.of(SERVER, "Put", HttpVerb.PUT, "{Id}"))
                .route(ServerResource.class, "delete", EndpointRoute.of(SERVER, "Delete", HttpVerb.DELETE, "{Id}"))
                .route(ServerResource.class, "options", EndpointRoute.of(SERVER, "Options", HttpVerb.OPTIONS))
                .route(WhoAmIResource.class, "whoami", EndpointRoute.of(ACCOUNT, "WhoAmI", HttpVerb.GET))
                .build();
    }
}
