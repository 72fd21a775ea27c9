package inventory.adapter.out.storage.memory;

import inventory.core.port.out.AccountRepository;
import inventory.core.port.out.RoleRepository;
import inventory.core.port.out.ServerRepository;
import inventory.spi.StorageProvider;

/**
 * In-memory storage provider.
 *
 * <p>Data is lost on restart. Lowest priority, so any persistent provider on the
 * classpath is preferred.
 */
public class InMemoryStorageProvider implements StorageProvider {

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory storage (non-persistent)";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public AccountRepository createAccountRepository() {
        return new InMemoryAccountRepository();
    }

    @Override
    public RoleRepository createRoleRepository() {
        return new InMemoryRoleRepository();
    }

    @Override
    public ServerRepository createServerRepository() {
        return new InMemoryServerRepository();
    }
}
