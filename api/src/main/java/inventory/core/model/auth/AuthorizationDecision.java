package inventory.core.model.auth;

/**
 * Result of evaluating a principal's roles against an endpoint.
 */
public sealed interface AuthorizationDecision {

    static AuthorizationDecision allow() {
        return Allowed.INSTANCE;
    }

    static AuthorizationDecision deny(String message) {
        return new Denied(message);
    }

    default boolean isAllowed() {
        return this instanceof Allowed;
    }

    record Allowed() implements AuthorizationDecision {
        private static final Allowed INSTANCE = new Allowed();
    }

    record Denied(String message) implements AuthorizationDecision {}
}
