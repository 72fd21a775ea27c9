package inventory.adapter.in.dto;

import java.util.List;

import inventory.core.model.server.Server;

/**
 * DTO for server requests and responses.
 *
 * @param id              identifier, ignored on input
 * @param name            host name
 * @param ipAddress       primary address
 * @param operatingSystem operating system description
 * @param scopes          scope tags
 */
public record ServerDto(Long id, String name, String ipAddress, String operatingSystem, List<String> scopes) {

    public static ServerDto from(Server server) {
        return new ServerDto(server.id(), server.name(), server.ipAddress(), server.operatingSystem(), server.scopes());
    }

    public Server toModel() {
        return new Server(null, name, ipAddress, operatingSystem, scopes);
    }
}
