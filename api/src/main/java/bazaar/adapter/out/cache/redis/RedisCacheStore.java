package bazaar.adapter.out.cache.redis;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.set.ReactiveSetCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;

import bazaar.core.port.out.CacheStore;

/**
 * Redis implementation of CacheStore.
 *
 * <p>Values are written with {@code SETEX}; Redis expiry has second granularity,
 * so sub-second TTLs are rounded up to one second. Pattern lookups use
 * {@code KEYS}, which blocks Redis for the duration of the scan.
 */
public class RedisCacheStore implements CacheStore {

    static final String PING_KEY = "bazaar:health:ping";

    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final ReactiveSetCommands<String, String> setCommands;

    public RedisCacheStore(ReactiveRedisDataSource ds) {
        this.valueCommands = ds.value(String.class, String.class);
        this.keyCommands = ds.key(String.class);
        this.setCommands = ds.set(String.class, String.class);
    }

    @Override
    public Uni<String> get(String key) {
        return valueCommands.get(key);
    }

    @Override
    public Uni<Void> set(String key, String value, Duration ttl) {
        return valueCommands.setex(key, seconds(ttl), value);
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return keyCommands.del(key).map(removed -> removed > 0);
    }

    @Override
    public Uni<List<String>> keys(String pattern) {
        return keyCommands.keys(pattern);
    }

    @Override
    public Uni<Long> deleteAll(Collection<String> keys) {
        if (keys.isEmpty()) {
            return Uni.createFrom().item(0L);
        }
        return keyCommands.del(keys.toArray(new String[0])).map(Integer::longValue);
    }

    @Override
    public Uni<Map<String, String>> getMany(Collection<String> keys) {
        if (keys.isEmpty()) {
            return Uni.createFrom().item(Map.of());
        }
        return valueCommands.mget(keys.toArray(new String[0])).map(values -> {
            final Map<String, String> found = new LinkedHashMap<>();
            values.forEach((key, value) -> {
                if (value != null) {
                    found.put(key, value);
                }
            });
            return found;
        });
    }

    @Override
    public Uni<Void> setMany(Map<String, String> entries, Map<String, Duration> ttls) {
        if (entries.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        final List<Uni<Void>> writes = entries.entrySet().stream()
                .map(e -> valueCommands.setex(e.getKey(), seconds(ttls.get(e.getKey())), e.getValue()))
                .toList();
        return Uni.join().all(writes).andFailFast().replaceWithVoid();
    }

    @Override
    public Uni<Void> addToSet(String key, Collection<String> members, Duration ttl) {
        return setCommands.sadd(key, members.toArray(new String[0]))
                .flatMap(added -> keyCommands.expire(key, Duration.ofSeconds(seconds(ttl))))
                .replaceWithVoid();
    }

    @Override
    public Uni<Set<String>> members(String key) {
        return setCommands.smembers(key);
    }

    @Override
    public Uni<Void> ping() {
        return valueCommands.get(PING_KEY).replaceWithVoid();
    }

    private static long seconds(Duration ttl) {
        return Math.max(1L, (ttl.toMillis() + 999) / 1000);
    }
}
