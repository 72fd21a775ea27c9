package inventory.core.service.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import inventory.core.model.routing.EndpointRoute;
import inventory.core.model.routing.HttpVerb;

@DisplayName("EndpointCatalog")
class EndpointCatalogTest {

    static class Inventory {}

    static class Public {}

    private static final EndpointRoute GET_BY_ID = EndpointRoute.of("Server", "GetById", HttpVerb.GET, "{Id}");

    private final EndpointCatalog catalog = EndpointCatalog.builder()
            .route(Inventory.class, "getById", GET_BY_ID)
            .route(Inventory.class, "delete", EndpointRoute.of("Server", "Delete", HttpVerb.DELETE, "{Id}"))
            .route(Public.class, "token", EndpointRoute.anonymous("Account", "Token", HttpVerb.POST))
            .build();

    @Test
    @DisplayName("should look up routes by class and method")
    void shouldLookUpRoute() {
        assertEquals(GET_BY_ID, catalog.lookup(Inventory.class, "getById").orElseThrow());
        assertTrue(catalog.lookup(Inventory.class, "unknown").isEmpty());
        assertTrue(catalog.lookup(null, "getById").isEmpty());
    }

    @Test
    @DisplayName("should keep the registered verb of anonymous routes")
    void shouldResolveAnonymous() {
        final var route = catalog.lookup(Public.class, "token").orElseThrow();

        assertTrue(route.anonymous());
        assertEquals(HttpVerb.POST, route.verb());
        assertEquals("Account/Token", route.endpointId());
    }

    @Test
    @DisplayName("should not extend anonymous access to unregistered methods of the same class")
    void shouldNotInferAnonymous() {
        assertTrue(catalog.lookup(Public.class, "provision").isEmpty());
    }

    @Test
    @DisplayName("should list registered routes")
    void shouldListRoutes() {
        assertEquals(3, catalog.routes().size());
        assertEquals(1, catalog.routes().stream().filter(EndpointRoute::anonymous).count());
    }

    @Test
    @DisplayName("should reject duplicate registrations")
    void shouldRejectDuplicates() {
        final var builder = EndpointCatalog.builder().route(Inventory.class, "getById", GET_BY_ID);

        assertThrows(IllegalStateException.class, () -> builder.route(Inventory.class, "getById", GET_BY_ID));
    }
}
