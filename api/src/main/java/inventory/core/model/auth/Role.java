package inventory.core.model.auth;

import java.util.List;
import java.util.Locale;

/**
 * A named bundle of endpoint grants.
 *
 * <p>Role names are unique and compared without regard to case; the stored name is
 * always lower case.
 *
 * @param name        unique role name (e.g. "admin", "user")
 * @param description human-readable description
 * @param permissions ordered endpoint grants
 */
public record Role(String name, String description, List<EndpointPermission> permissions) {

    public Role {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Role name cannot be null or blank");
        }
        name = normalizeName(name);
        if (description == null) {
            description = "";
        }
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    /**
     * Normalize a role name for storage and lookup.
     */
    public static String normalizeName(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Check whether this role authorizes {@code required} on the endpoint.
     *
     * <p>A grant containing {@code None} that matches the endpoint overrides any
     * other matching grant on this role.
     *
     * @param endpointId the canonical endpoint identifier
     * @param required   the action required by the HTTP verb
     * @return true if a matching grant allows the action and none denies it
     */
    public boolean authorizes(String endpointId, EndpointPermissionAction required) {
        var allowed = false;
        for (EndpointPermission permission : permissions) {
            if (!permission.matches(endpointId)) {
                continue;
            }
            if (permission.denies()) {
                return false;
            }
            allowed = allowed || permission.allows(required);
        }
        return allowed;
    }

    public Role withPermissions(List<EndpointPermission> newPermissions) {
        return new Role(name, description, newPermissions);
    }
}
