package inventory.core.model.auth;

import java.util.Locale;

/**
 * Action a role may perform against an endpoint.
 *
 * <p>{@link #WRITE} is a superset of {@link #READ}, {@link #CREATE}, {@link #UPDATE}
 * and {@link #DELETE}. {@link #NONE} grants nothing.
 */
public enum EndpointPermissionAction {
    READ("Read"),
    CREATE("Create"),
    UPDATE("Update"),
    DELETE("Delete"),
    WRITE("Write"),
    NONE("None");

    private final String displayName;

    EndpointPermissionAction(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Name used in denial messages and stored role definitions (e.g. {@code Read}).
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Check whether holding this action satisfies a requirement for {@code required}.
     *
     * @param required the action the request needs
     * @return true if this action is the required one, or is {@code WRITE}
     */
    public boolean satisfies(EndpointPermissionAction required) {
        if (this == NONE || required == NONE) {
            return false;
        }
        return this == required || this == WRITE;
    }

    /**
     * Parse a stored action name, ignoring case.
     *
     * @throws IllegalArgumentException if the name is not a known action
     */
    public static EndpointPermissionAction fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Endpoint permission action cannot be null or blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown endpoint permission action: " + name, e);
        }
    }

    @Override
    public String toString() {
        return displayName;
    }
}
