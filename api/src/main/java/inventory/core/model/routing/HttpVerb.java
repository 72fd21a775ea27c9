package inventory.core.model.routing;

import java.util.Locale;

import inventory.core.model.auth.EndpointPermissionAction;

/**
 * HTTP verbs the API serves, each mapped to the action it requires.
 */
public enum HttpVerb {
    GET(EndpointPermissionAction.READ),
    HEAD(EndpointPermissionAction.READ),
    OPTIONS(EndpointPermissionAction.READ),
    POST(EndpointPermissionAction.CREATE),
    PUT(EndpointPermissionAction.UPDATE),
    PATCH(EndpointPermissionAction.UPDATE),
    DELETE(EndpointPermissionAction.DELETE);

    private final EndpointPermissionAction requiredAction;

    HttpVerb(EndpointPermissionAction requiredAction) {
        this.requiredAction = requiredAction;
    }

    public EndpointPermissionAction requiredAction() {
        return requiredAction;
    }

    /**
     * Parse a request method.
     *
     * @throws IllegalArgumentException for any method outside this set
     */
    public static HttpVerb parse(String method) {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("HTTP method cannot be null or blank");
        }
        try {
            return valueOf(method.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported HTTP method: " + method, e);
        }
    }
}
