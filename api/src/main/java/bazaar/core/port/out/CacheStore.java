package bazaar.core.port.out;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.smallrye.mutiny.Uni;

/**
 * Port for a key-value cache holding serialized string payloads.
 *
 * <p>Implementations report failures through the returned {@link Uni}; callers
 * decide whether a failure is fatal. Glob patterns follow Redis {@code KEYS}
 * syntax ({@code *}, {@code ?}, {@code [...]}).
 */
public interface CacheStore {

    /**
     * @return the value, or a null item when absent or expired
     */
    Uni<String> get(String key);

    Uni<Void> set(String key, String value, Duration ttl);

    /**
     * @return true if a key was removed
     */
    Uni<Boolean> delete(String key);

    /**
     * List keys matching a glob. Cost is proportional to the total key count.
     *
     * @param pattern glob pattern
     * @return matching keys
     */
    Uni<List<String>> keys(String pattern);

    /**
     * @return number of keys removed
     */
    Uni<Long> deleteAll(Collection<String> keys);

    /**
     * Fetch several keys in one round trip.
     *
     * @param keys keys to read
     * @return present values by key; absent keys are omitted
     */
    Uni<Map<String, String>> getMany(Collection<String> keys);

    /**
     * Write several entries, each with its own TTL.
     *
     * @param entries values by key
     * @param ttls    TTL by key, same key set as {@code entries}
     */
    Uni<Void> setMany(Map<String, String> entries, Map<String, Duration> ttls);

    /**
     * Add members to a set, refreshing its expiry.
     */
    Uni<Void> addToSet(String key, Collection<String> members, Duration ttl);

    Uni<Set<String>> members(String key);

    /**
     * Round-trip check used by the liveness supervisor.
     *
     * @return completes on success, fails when the store is unreachable
     */
    Uni<Void> ping();

    /**
     * Release connections. Called once on shutdown.
     */
    default void close() {}
}
