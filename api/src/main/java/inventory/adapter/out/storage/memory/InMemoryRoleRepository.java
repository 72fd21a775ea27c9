package inventory.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import inventory.core.model.auth.Role;
import inventory.core.port.out.RoleRepository;

/**
 * In-memory implementation of RoleRepository. Keys are normalized role names.
 */
public class InMemoryRoleRepository implements RoleRepository {

    private final Map<String, Role> storage = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> save(Role role) {
        return Uni.createFrom().item(() -> {
            storage.put(role.name(), role);
            return null;
        });
    }

    @Override
    public Uni<Optional<Role>> findByName(String name) {
        return Uni.createFrom().item(() -> name == null
                ? Optional.empty()
                : Optional.ofNullable(storage.get(Role.normalizeName(name))));
    }

    @Override
    public Uni<List<Role>> findAll() {
        return Uni.createFrom().item(() -> new ArrayList<>(storage.values()));
    }
}
