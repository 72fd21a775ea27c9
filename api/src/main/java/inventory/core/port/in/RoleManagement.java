package inventory.core.port.in;

import io.smallrye.mutiny.Uni;

import inventory.core.model.auth.Role;
import inventory.core.model.auth.RoleType;

/**
 * Port for seeding the bootstrap roles accounts are provisioned into.
 */
public interface RoleManagement {

    /**
     * Return the role for {@code type}, creating it with its default grants if absent.
     */
    Uni<Role> ensureRole(RoleType type);
}
