package inventory.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import io.smallrye.mutiny.Uni;

import inventory.core.model.server.Server;
import inventory.core.port.out.ServerRepository;

/**
 * In-memory implementation of ServerRepository with sequential ids.
 */
public class InMemoryServerRepository implements ServerRepository {

    private final Map<Long, Server> storage = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Uni<Server> create(Server server) {
        return Uni.createFrom().item(() -> {
            final var stored = server.withId(sequence.incrementAndGet());
            storage.put(stored.id(), stored);
            return stored;
        });
    }

    @Override
    public Uni<Optional<Server>> findById(long id) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storage.get(id)));
    }

    @Override
    public Uni<List<Server>> findAll() {
        return Uni.createFrom().item(() -> {
            final var all = new ArrayList<>(storage.values());
            all.sort(Comparator.comparing(Server::id));
            return all;
        });
    }

    @Override
    public Uni<Optional<Server>> update(Server server) {
        return Uni.createFrom().item(() -> Optional.ofNullable(
                storage.computeIfPresent(server.id(), (id, existing) -> server)));
    }

    @Override
    public Uni<Boolean> delete(long id) {
        return Uni.createFrom().item(() -> storage.remove(id) != null);
    }
}
