package inventory.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import inventory.core.model.server.Server;

/**
 * Port interface for persistent storage of inventoried servers.
 */
public interface ServerRepository {

    /**
     * Store a new server and assign its identifier.
     *
     * @return Uni with the stored server including its id
     */
    Uni<Server> create(Server server);

    Uni<Optional<Server>> findById(long id);

    Uni<List<Server>> findAll();

    /**
     * Replace an existing server.
     *
     * @return Uni with the stored server, or empty if no server has that id
     */
    Uni<Optional<Server>> update(Server server);

    Uni<Boolean> delete(long id);
}
