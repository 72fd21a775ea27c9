package inventory.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import inventory.core.model.server.Server;
import inventory.core.model.server.ServerFilter;

/**
 * Port for the server inventory.
 *
 * <p>Lookups of unknown ids fail with {@link inventory.core.model.server.ServerNotFoundException}.
 */
public interface ServerManagement {

    Uni<Server> get(long id);

    Uni<List<Server>> list(ServerFilter filter);

    Uni<Server> create(Server server);

    Uni<Server> replace(long id, Server server);

    Uni<Server> patch(long id, Server patch);

    Uni<Void> delete(long id);
}
