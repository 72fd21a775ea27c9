package inventory.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import inventory.core.model.auth.Role;

/**
 * Port interface for persistent storage of roles.
 *
 * <p>Lookups by name ignore case.
 */
public interface RoleRepository {

    /**
     * Save or update a role.
     *
     * @param role the role to persist
     * @return Uni completing when save is durable
     */
    Uni<Void> save(Role role);

    /**
     * Find a role by name.
     *
     * @param name the role name
     * @return Uni with Optional containing the role if found
     */
    Uni<Optional<Role>> findByName(String name);

    Uni<List<Role>> findAll();
}
