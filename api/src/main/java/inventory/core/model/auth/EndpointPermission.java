package inventory.core.model.auth;

import java.util.List;

/**
 * A grant binding an endpoint identifier to the actions allowed on it.
 *
 * <p>The endpoint is either a {@code Controller[/Action[/Param]]} identifier or the
 * wildcard {@value #ALL_ENDPOINTS}. Matching is case-insensitive and prefix based,
 * so a grant for {@code Server} covers {@code Server/GetById/Id}.
 *
 * @param endpoint the endpoint identifier or {@code All}
 * @param actions  the actions granted on matching endpoints
 */
public record EndpointPermission(String endpoint, List<EndpointPermissionAction> actions) {

    /**
     * Wildcard endpoint matching every endpoint identifier.
     */
    public static final String ALL_ENDPOINTS = "All";

    public EndpointPermission {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("Endpoint cannot be null or blank");
        }
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public static EndpointPermission of(String endpoint, EndpointPermissionAction... actions) {
        return new EndpointPermission(endpoint, List.of(actions));
    }

    /**
     * Check whether this grant applies to the given endpoint identifier.
     */
    public boolean matches(String endpointId) {
        if (ALL_ENDPOINTS.equalsIgnoreCase(endpoint)) {
            return true;
        }
        if (endpointId == null) {
            return false;
        }
        return endpoint.equalsIgnoreCase(endpointId)
                || endpointId.regionMatches(true, 0, endpoint, 0, endpoint.length());
    }

    /**
     * Check whether any granted action satisfies the required one.
     */
    public boolean allows(EndpointPermissionAction required) {
        return actions.stream().anyMatch(action -> action.satisfies(required));
    }

    /**
     * Check whether this grant explicitly denies access with {@code None}.
     */
    public boolean denies() {
        return actions.contains(EndpointPermissionAction.NONE);
    }
}
