package bazaar.adapter.out.cache.redis;

import java.util.Optional;

import jakarta.enterprise.inject.spi.CDI;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;

import bazaar.core.model.common.StorageHealth;
import bazaar.core.port.out.CacheStore;
import bazaar.core.port.out.StorageHealthIndicator;
import bazaar.spi.CacheStoreProvider;
import bazaar.spi.StorageAdapterConfig;
import bazaar.spi.StorageProviderException;

/**
 * Redis cache provider.
 *
 * <p>Redis connection is configured via Quarkus Redis properties:
 * <ul>
 *   <li>quarkus.redis.hosts - Redis server URL (default: redis://localhost:6379)</li>
 *   <li>quarkus.redis.password - Redis password (optional)</li>
 *   <li>quarkus.redis.database - Redis database index (default: 0)</li>
 * </ul>
 */
public class RedisCacheStoreProvider implements CacheStoreProvider {

    private ReactiveRedisDataSource dataSource;

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public String description() {
        return "Redis distributed cache";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        try {
            Class.forName("io.quarkus.redis.datasource.ReactiveRedisDataSource");
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    @Override
    public CacheStore createStore(StorageAdapterConfig config) {
        try {
            this.dataSource = CDI.current().select(ReactiveRedisDataSource.class).get();
        } catch (RuntimeException e) {
            throw new StorageProviderException("Failed to obtain Redis data source from CDI", e);
        }
        return new RedisCacheStore(dataSource);
    }

    @Override
    public Optional<StorageHealthIndicator> createHealthIndicator(StorageAdapterConfig config) {
        return Optional.of(() -> {
            if (dataSource == null) {
                return Uni.createFrom().item(StorageHealth.unhealthy("cache-redis", "Data source not initialized"));
            }
            final long start = System.currentTimeMillis();
            return dataSource
                    .value(String.class, String.class)
                    .get(RedisCacheStore.PING_KEY)
                    .map(result -> StorageHealth.healthy("cache-redis", System.currentTimeMillis() - start))
                    .onFailure()
                    .recoverWithItem(e -> StorageHealth.unhealthy("cache-redis", e.getMessage()));
        });
    }
}
