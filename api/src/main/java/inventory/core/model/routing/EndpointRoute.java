package inventory.core.model.routing;

/**
 * Authorization metadata of one endpoint.
 *
 * @param controller     controller name, e.g. {@code Server}
 * @param action         action name, e.g. {@code GetById}
 * @param verb           HTTP verb the endpoint answers
 * @param parameter      route parameter template such as {@code {Id}}, or null
 * @param anonymous      true when the endpoint needs no authorization
 */
public record EndpointRoute(String controller, String action, HttpVerb verb, String parameter, boolean anonymous) {

    public EndpointRoute {
        if (controller == null || controller.isBlank()) {
            throw new IllegalArgumentException("Controller cannot be null or blank");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("Action cannot be null or blank");
        }
        if (verb == null) {
            throw new IllegalArgumentException("HTTP verb cannot be null");
        }
        if (parameter != null && parameter.isBlank()) {
            parameter = null;
        }
    }

    public static EndpointRoute of(String controller, String action, HttpVerb verb) {
        return new EndpointRoute(controller, action, verb, null, false);
    }

    public static EndpointRoute of(String controller, String action, HttpVerb verb, String parameter) {
        return new EndpointRoute(controller, action, verb, parameter, false);
    }

    public static EndpointRoute anonymous(String controller, String action, HttpVerb verb) {
        return new EndpointRoute(controller, action, verb, null, true);
    }

    /**
     * Identifier matched against role grants: {@code Controller/Action[/Param]} with braces stripped.
     */
    public String endpointId() {
        final var id = new StringBuilder(controller).append('/').append(action);
        if (parameter != null) {
            id.append('/').append(parameter.replace("{", "").replace("}", ""));
        }
        return id.toString();
    }
}
