package inventory.spi;

import java.util.List;
import java.util.Optional;

/**
 * Thrown when no storage provider can back the account, role and server repositories.
 */
public class StorageProviderException extends RuntimeException {

    private final String providerName;
    private final List<String> availableProviders;

    private StorageProviderException(String message, String providerName, List<String> availableProviders) {
        super(message);
        this.providerName = providerName;
        this.availableProviders = List.copyOf(availableProviders);
    }

    /**
     * No provider registration was found on the classpath.
     */
    public static StorageProviderException noneRegistered() {
        return new StorageProviderException(
                "No storage providers found. Ensure a provider JAR is on the classpath.", null, List.of());
    }

    /**
     * The provider named by {@code inventory.storage.provider} is not registered.
     */
    public static StorageProviderException notFound(String configured, List<String> registered) {
        return new StorageProviderException(
                "Configured storage provider not found: " + configured + ". Available: " + registered,
                configured,
                registered);
    }

    /**
     * Providers are registered but none reports itself available.
     */
    public static StorageProviderException noneAvailable(List<String> registered) {
        return new StorageProviderException(
                "No available storage providers among " + registered, null, registered);
    }

    /**
     * The configured provider name, when the failure concerns one.
     */
    public Optional<String> providerName() {
        return Optional.ofNullable(providerName);
    }

    public List<String> availableProviders() {
        return availableProviders;
    }
}
