package bazaar.spi;

import java.util.Optional;

import bazaar.core.port.out.CatalogStore;
import bazaar.core.port.out.StorageHealthIndicator;

/**
 * Service Provider Interface for catalog document stores.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} from
 * {@code META-INF/services/bazaar.spi.CatalogStoreProvider}. Select one with
 * {@code bazaar.storage.catalog.provider={name}}; without that setting the
 * available provider with the highest priority wins.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>memory: 0 (fallback default)</li>
 *   <li>cassandra: 10</li>
 * </ul>
 */
public interface CatalogStoreProvider {

    String name();

    default String description() {
        return name() + " catalog store";
    }

    default int priority() {
        return 0;
    }

    /**
     * Check whether this provider can be used, e.g. its driver is on the classpath
     * and it is configured.
     *
     * @return true if usable
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Create the store. Called once at startup; the instance must be thread-safe.
     *
     * @param config access to configuration properties
     * @return store implementation
     * @throws StorageProviderException if initialization fails
     */
    CatalogStore createStore(StorageAdapterConfig config);

    default Optional<StorageHealthIndicator> createHealthIndicator(StorageAdapterConfig config) {
        return Optional.empty();
    }
}
