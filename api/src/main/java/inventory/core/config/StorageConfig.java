package inventory.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;

/**
 * Storage backend selection.
 */
@ConfigMapping(prefix = "inventory.storage")
public interface StorageConfig {

    /**
     * Name of the storage provider to use. When empty, the highest priority available provider wins.
     */
    Optional<String> provider();
}
