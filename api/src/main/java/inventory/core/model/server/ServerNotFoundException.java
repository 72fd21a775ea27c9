package inventory.core.model.server;

public class ServerNotFoundException extends RuntimeException {

    public ServerNotFoundException(long id) {
        super("Server " + id + " not found");
    }
}
