package bazaar.adapter.out.cache.memory;

import java.util.Optional;

import com.github.benmanes.caffeine.cache.Ticker;
import io.smallrye.mutiny.Uni;

import bazaar.core.model.common.StorageHealth;
import bazaar.core.port.out.CacheStore;
import bazaar.core.port.out.StorageHealthIndicator;
import bazaar.spi.CacheStoreProvider;
import bazaar.spi.StorageAdapterConfig;

/**
 * Local Caffeine cache provider. Entries are not shared between instances.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>bazaar.storage.cache.memory.max-size - Maximum number of entries (default: 10000)</li>
 * </ul>
 */
public class InMemoryCacheStoreProvider implements CacheStoreProvider {

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory cache (single instance)";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public CacheStore createStore(StorageAdapterConfig config) {
        final long maxSize = config.getInt("bazaar.storage.cache.memory.max-size")
                .map(Integer::longValue)
                .orElse(InMemoryCacheStore.DEFAULT_MAX_SIZE);
        return new InMemoryCacheStore(maxSize, Ticker.systemTicker());
    }

    @Override
    public Optional<StorageHealthIndicator> createHealthIndicator(StorageAdapterConfig config) {
        return Optional.of(() -> Uni.createFrom().item(StorageHealth.healthy("cache-memory", 0)));
    }
}
