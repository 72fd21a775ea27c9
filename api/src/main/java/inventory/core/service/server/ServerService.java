package inventory.core.service.server;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import inventory.core.model.server.Server;
import inventory.core.model.server.ServerFilter;
import inventory.core.model.server.ServerNotFoundException;
import inventory.core.port.in.ServerManagement;
import inventory.core.port.out.ServerRepository;

@ApplicationScoped
public class ServerService implements ServerManagement {

    private static final Logger LOG = Logger.getLogger(ServerService.class);

    private final ServerRepository repository;

    @Inject
    public ServerService(ServerRepository repository) {
        this.repository = repository;
    }

    @Override
    public Uni<Server> get(long id) {
        return repository.findById(id).map(found -> found.orElseThrow(() -> new ServerNotFoundException(id)));
    }

    @Override
    public Uni<List<Server>> list(ServerFilter filter) {
        final var criteria = filter == null ? ServerFilter.none() : filter;
        return repository.findAll().map(all -> all.stream().filter(criteria::matches).toList());
    }

    @Override
    public Uni<Server> create(Server server) {
        if (server == null || server.name() == null || server.name().isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Server name is required"));
        }
        return repository.create(server).invoke(created -> LOG.infov("Created server {0}", created.id()));
    }

    @Override
    public Uni<Server> replace(long id, Server server) {
        if (server == null || server.name() == null || server.name().isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Server name is required"));
        }
        return repository.update(server.withId(id))
                .map(updated -> updated.orElseThrow(() -> new ServerNotFoundException(id)));
    }

    @Override
    public Uni<Server> patch(long id, Server patch) {
        if (patch == null) {
            return Uni.createFrom().failure(new IllegalArgumentException("Patch body is required"));
        }
        return get(id).flatMap(existing -> repository.update(existing.merge(patch)))
                .map(updated -> updated.orElseThrow(() -> new ServerNotFoundException(id)));
    }

    @Override
    public Uni<Void> delete(long id) {
        return repository.delete(id).map(deleted -> {
            if (!deleted) {
                throw new ServerNotFoundException(id);
            }
            LOG.infov("Deleted server {0}", id);
            return null;
        });
    }
}
