package inventory.core.model.server;

import java.util.List;

/**
 * An inventoried server.
 *
 * @param id              identifier assigned on creation
 * @param name            host name
 * @param ipAddress       primary address
 * @param operatingSystem operating system description
 * @param scopes          free-form scope tags
 */
public record Server(Long id, String name, String ipAddress, String operatingSystem, List<String> scopes) {

    public Server {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    public Server withId(long newId) {
        return new Server(newId, name, ipAddress, operatingSystem, scopes);
    }

    /**
     * Apply the non-null fields of {@code patch} over this server.
     */
    public Server merge(Server patch) {
        return new Server(
                id,
                patch.name() != null ? patch.name() : name,
                patch.ipAddress() != null ? patch.ipAddress() : ipAddress,
                patch.operatingSystem() != null ? patch.operatingSystem() : operatingSystem,
                patch.scopes().isEmpty() ? scopes : patch.scopes());
    }
}
