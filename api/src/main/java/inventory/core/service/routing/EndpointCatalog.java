package inventory.core.service.routing;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import inventory.core.model.routing.EndpointRoute;

/**
 * Startup-built table of endpoint authorization metadata, keyed by resource
 * class and method name.
 *
 * <p>Anonymous endpoints are registered per method like any other route.
 * A method with no registration has no route and is denied by the access filter.
 */
public final class EndpointCatalog {

    private final Map<Key, EndpointRoute> routes;

    private EndpointCatalog(Map<Key, EndpointRoute> routes) {
        this.routes = Map.copyOf(routes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<EndpointRoute> lookup(Class<?> resourceClass, String methodName) {
        if (resourceClass == null || methodName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(routes.get(new Key(resourceClass, methodName)));
    }

    public Collection<EndpointRoute> routes() {
        return routes.values();
    }

    private record Key(Class<?> resourceClass, String methodName) {}

    public static final class Builder {
        private final Map<Key, EndpointRoute> routes = new HashMap<>();

        private Builder() {}

        public Builder route(Class<?> resourceClass, String methodName, EndpointRoute route) {
            final var previous = routes.putIfAbsent(new Key(resourceClass, methodName), route);
            if (previous != null) {
                throw new IllegalStateException(
                        "Duplicate endpoint registration for " + resourceClass.getSimpleName() + "." + methodName);
            }
            return this;
        }

        public EndpointCatalog build() {
            return new EndpointCatalog(routes);
        }
    }
}
