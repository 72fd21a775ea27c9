package inventory.core.service.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import inventory.core.model.auth.Role;
import inventory.core.model.auth.RoleType;
import inventory.core.port.in.RoleManagement;
import inventory.core.port.out.RoleRepository;

/**
 * Seeds bootstrap roles.
 *
 * <p>Bootstrap roles are seeded lazily: the first account provisioned with a
 * {@link RoleType} creates that role with its default grants. Existing roles are
 * never overwritten by seeding.
 */
@ApplicationScoped
public class RoleService implements RoleManagement {

    private static final Logger LOG = Logger.getLogger(RoleService.class);

    private final RoleRepository repository;

    @Inject
    public RoleService(RoleRepository repository) {
        this.repository = repository;
    }

    @Override
    public Uni<Role> ensureRole(RoleType type) {
        return repository.findByName(type.roleName()).flatMap(existing -> {
            if (existing.isPresent()) {
                return Uni.createFrom().item(existing.get());
            }
            final var role = type.defaultRole();
            LOG.infov("Seeding role {0} with {1} grant(s)", role.name(), role.permissions().size());
            return repository.save(role).replaceWith(role);
        });
    }
}
