package bazaar.spi;

import java.util.Optional;

import bazaar.core.port.out.CacheStore;
import bazaar.core.port.out.StorageHealthIndicator;

/**
 * Service Provider Interface for cache stores.
 *
 * <p>Discovered via {@code META-INF/services/bazaar.spi.CacheStoreProvider} and
 * selected with {@code bazaar.storage.cache.provider={name}}, or by priority.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>memory: 0</li>
 *   <li>redis: 10</li>
 * </ul>
 */
public interface CacheStoreProvider {

    String name();

    default String description() {
        return name() + " cache store";
    }

    default int priority() {
        return 0;
    }

    default boolean isAvailable() {
        return true;
    }

    /**
     * Create the cache store.
     *
     * @param config access to configuration properties
     * @return cache store implementation
     * @throws StorageProviderException if initialization fails
     */
    CacheStore createStore(StorageAdapterConfig config);

    default Optional<StorageHealthIndicator> createHealthIndicator(StorageAdapterConfig config) {
        return Optional.empty();
    }
}
