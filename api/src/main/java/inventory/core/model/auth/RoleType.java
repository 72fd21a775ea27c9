package inventory.core.model.auth;

import java.util.List;
import java.util.Locale;

import static inventory.core.model.auth.EndpointPermissionAction.CREATE;
import static inventory.core.model.auth.EndpointPermissionAction.READ;
import static inventory.core.model.auth.EndpointPermissionAction.UPDATE;
import static inventory.core.model.auth.EndpointPermissionAction.WRITE;

/**
 * The closed set of roles an account can be provisioned with.
 *
 * <p>Each type carries the grants used to seed its role the first time an account
 * of that type is created. A role already in storage is left as it is.
 */
public enum RoleType {
    ADMIN("Administrator", List.of(EndpointPermission.of(EndpointPermission.ALL_ENDPOINTS, WRITE))),
    PRIVILEDGED("Priviledged User", List.of(EndpointPermission.of("Server", CREATE, READ, UPDATE))),
    SINGLEENDPOINT("User only one endpoint", List.of(EndpointPermission.of("Server/GetById/Id", READ))),
    USER("Standard User", List.of(EndpointPermission.of("Server", READ))),
    GUEST("Guest User", List.of());

    private final String description;
    private final List<EndpointPermission> defaultPermissions;

    RoleType(String description, List<EndpointPermission> defaultPermissions) {
        this.description = description;
        this.defaultPermissions = defaultPermissions;
    }

    /**
     * Stored role name, e.g. {@code priviledged}.
     */
    public String roleName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Role definition used when the role does not exist yet.
     */
    public Role defaultRole() {
        return new Role(roleName(), description, defaultPermissions);
    }

    /**
     * Parse a role type ignoring case.
     *
     * @throws IllegalArgumentException for names outside the closed set
     */
    public static RoleType fromName(String name) {
        if (name == null || name.isBlank()) {
            return USER;
        }
        for (RoleType type : values()) {
            if (type.name().equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown role name: " + name);
    }
}
