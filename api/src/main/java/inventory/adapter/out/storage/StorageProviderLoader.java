package inventory.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import inventory.core.config.StorageConfig;
import inventory.core.port.out.AccountRepository;
import inventory.core.port.out.RoleRepository;
import inventory.core.port.out.ServerRepository;
import inventory.spi.StorageProvider;
import inventory.spi.StorageProviderException;

/**
 * Discovers and loads storage providers via ServiceLoader.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If inventory.storage.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class StorageProviderLoader {

    private static final Logger LOG = Logger.getLogger(StorageProviderLoader.class);

    private final StorageConfig config;

    private StorageProvider storageProvider;

    @Inject
    public StorageProviderLoader(StorageConfig config) {
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public AccountRepository accountRepository() {
        return getStorageProvider().createAccountRepository();
    }

    @Produces
    @ApplicationScoped
    public RoleRepository roleRepository() {
        return getStorageProvider().createRoleRepository();
    }

    @Produces
    @ApplicationScoped
    public ServerRepository serverRepository() {
        return getStorageProvider().createServerRepository();
    }

    synchronized StorageProvider getStorageProvider() {
        if (storageProvider != null) {
            return storageProvider;
        }

        final List<StorageProvider> providers = new ArrayList<>();
        ServiceLoader.load(StorageProvider.class).forEach(providers::add);

        if (providers.isEmpty()) {
            throw StorageProviderException.noneRegistered();
        }

        LOG.infof(
                "Found %d storage provider(s): %s",
                providers.size(),
                providers.stream().map(StorageProvider::name).toList());

        storageProvider = selectProvider(providers, config.provider().orElse(null));
        LOG.infof("Using storage provider: %s (%s)", storageProvider.name(), storageProvider.description());
        return storageProvider;
    }

    static StorageProvider selectProvider(List<StorageProvider> providers, String configured) {
        final var names = providers.stream().map(StorageProvider::name).toList();
        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> StorageProviderException.notFound(configured, names));
        }

        return providers.stream()
                .filter(StorageProvider::isAvailable)
                .max(Comparator.comparingInt(StorageProvider::priority))
                .orElseThrow(() -> StorageProviderException.noneAvailable(names));
    }
}
