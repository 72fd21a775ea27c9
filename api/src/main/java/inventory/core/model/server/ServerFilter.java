package inventory.core.model.server;

import java.util.Locale;

/**
 * Optional criteria for listing servers. Null fields match everything.
 */
public record ServerFilter(String name, String ipAddress) {

    public static ServerFilter none() {
        return new ServerFilter(null, null);
    }

    public boolean matches(Server server) {
        if (name != null && !name.isBlank()
                && (server.name() == null || !server.name().toLowerCase(Locale.ROOT).contains(name.toLowerCase(Locale.ROOT)))) {
            return false;
        }
        return ipAddress == null || ipAddress.isBlank() || ipAddress.equals(server.ipAddress());
    }
}
