package inventory.spi;

import inventory.core.port.out.AccountRepository;
import inventory.core.port.out.RoleRepository;
import inventory.core.port.out.ServerRepository;

/**
 * Service Provider Interface for storage backends.
 *
 * <p>Providers are discovered via ServiceLoader. Configure the preferred
 * provider with inventory.storage.provider, or let the loader select the
 * highest priority available provider.
 *
 * <p>To implement a custom provider, implement this interface and list the
 * class in META-INF/services/inventory.spi.StorageProvider.
 */
public interface StorageProvider {

    /**
     * Short name for configuration (e.g., "memory").
     */
    String name();

    String description();

    /**
     * Higher priority providers are preferred when auto-selecting.
     * The memory provider uses 0.
     */
    int priority();

    default boolean isAvailable() {
        return true;
    }

    AccountRepository createAccountRepository();

    RoleRepository createRoleRepository();

    ServerRepository createServerRepository();
}
