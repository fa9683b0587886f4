package bazaar.core.cache;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bazaar.core.config.ResiliencyConfig;
import bazaar.core.port.out.CacheMetrics;
import bazaar.core.port.out.CacheStore;
import bazaar.core.util.JsonMappers;

/**
 * Best-effort typed cache over a {@link CacheStore}.
 *
 * <p>No operation fails toward callers. Timeouts, store errors and payloads that
 * no longer deserialize are logged, counted and reported as a miss, {@code false}
 * or {@code 0}. While {@link CacheAvailability} reports the store unavailable,
 * reads and writes are skipped without touching it; deletes are still attempted
 * and a failed delete is remembered so the supervisor can flush on recovery.
 */
@ApplicationScoped
public class ResilientCache {

    private static final Logger LOG = Logger.getLogger(ResilientCache.class);

    private final CacheStore store;
    private final TtlPolicy ttlPolicy;
    private final CacheTimeoutHelper timeouts;
    private final CacheMetrics metrics;
    private final CacheAvailability availability;
    private final ObjectMapper mapper;

    @Inject
    public ResilientCache(
            CacheStore store,
            TtlPolicy ttlPolicy,
            ResiliencyConfig resiliencyConfig,
            CacheMetrics metrics,
            CacheAvailability availability) {
        this(store, ttlPolicy, resiliencyConfig.cache().operationTimeout(), metrics, availability);
    }

    public ResilientCache(
            CacheStore store,
            TtlPolicy ttlPolicy,
            Duration operationTimeout,
            CacheMetrics metrics,
            CacheAvailability availability) {
        this.store = store;
        this.ttlPolicy = ttlPolicy;
        this.metrics = metrics != null ? metrics : CacheMetrics.NOOP;
        this.timeouts = new CacheTimeoutHelper(operationTimeout, this.metrics, store.getClass().getSimpleName());
        this.availability = availability;
        this.mapper = JsonMappers.create();
    }

    public boolean isAvailable() {
        return availability.isAvailable();
    }

    public TtlPolicy ttlPolicy() {
        return ttlPolicy;
    }

    public <T> Uni<Optional<T>> get(String key, Class<T> type) {
        return get(key, mapper.constructType(type));
    }

    public <T> Uni<Optional<T>> get(String key, TypeReference<T> type) {
        return get(key, mapper.getTypeFactory().constructType(type));
    }

    /**
     * Read and deserialize one entry.
     *
     * @param key  cache key
     * @param type target type
     * @param <T>  value type
     * @return the value, or empty on a miss, bypass or any failure
     */
    public <T> Uni<Optional<T>> get(String key, JavaType type) {
        if (!availability.isAvailable()) {
            LOG.debugv("Cache bypass (unavailable): get {0}", key);
            return Uni.createFrom().item(Optional.empty());
        }
        return timeouts.withTimeoutGraceful(tracked(store.get(key)), "get").map(json -> {
            final Optional<T> value = json.flatMap(j -> deserialize(key, j, type));
            recordLookup(key, value.isPresent());
            return value;
        });
    }

    /**
     * Write an entry with the TTL of its namespace.
     *
     * @return true if the store accepted the write
     */
    public Uni<Boolean> set(String key, Object value) {
        return set(key, value, ttlPolicy.ttlFor(key));
    }

    /**
     * Write an entry with an explicit TTL.
     *
     * @return true if the store accepted the write
     */
    public Uni<Boolean> set(String key, Object value, Duration ttl) {
        if (!availability.isAvailable()) {
            LOG.debugv("Cache bypass (unavailable): set {0}", key);
            return Uni.createFrom().item(false);
        }
        final Optional<String> json = serialize(key, value);
        if (json.isEmpty()) {
            return Uni.createFrom().item(false);
        }
        return timeouts.withTimeoutFallback(
                tracked(store.set(key, json.get(), ttl)).replaceWith(true), "set", () -> false);
    }

    public Uni<Boolean> delete(String key) {
        return timeouts.withTimeoutFallback(tracked(store.delete(key)), "delete", () -> {
            availability.markInvalidationLost();
            return false;
        });
    }

    /**
     * Delete exact keys.
     *
     * @return number of keys removed, 0 on failure
     */
    public Uni<Long> deleteAll(Collection<String> keys) {
        if (keys.isEmpty()) {
            return Uni.createFrom().item(0L);
        }
        return timeouts.withTimeoutFallback(tracked(store.deleteAll(keys)), "deleteAll", () -> {
            availability.markInvalidationLost();
            return 0L;
        });
    }

    /**
     * Delete every key matching a glob. Cost grows with the total key count.
     *
     * @param pattern glob pattern
     * @return number of keys removed, 0 on failure
     */
    public Uni<Long> deleteByPattern(String pattern) {
        final Uni<Long> operation = store.keys(pattern).flatMap(keys -> {
            if (keys.isEmpty()) {
                return Uni.createFrom().item(0L);
            }
            LOG.debugv("Deleting {0} keys matching {1}", keys.size(), pattern);
            return store.deleteAll(keys);
        });
        return timeouts.withTimeoutFallback(tracked(operation), "deleteByPattern", () -> {
            availability.markInvalidationLost();
            return 0L;
        });
    }

    public <T> Uni<Map<String, T>> getMany(Collection<String> keys, Class<T> type) {
        return getMany(keys, mapper.constructType(type));
    }

    /**
     * Read several entries in one round trip.
     *
     * @return values by key; missing, undecodable and failed keys are omitted
     */
    public <T> Uni<Map<String, T>> getMany(Collection<String> keys, JavaType type) {
        if (keys.isEmpty() || !availability.isAvailable()) {
            return Uni.createFrom().item(Map.of());
        }
        return timeouts.withTimeoutFallback(tracked(store.getMany(keys)), "getMany", Map::<String, String>of)
                .map(raw -> {
                    final Map<String, T> result = new LinkedHashMap<>();
                    for (String key : keys) {
                        final String json = raw.get(key);
                        final Optional<T> value = json == null ? Optional.empty() : deserialize(key, json, type);
                        value.ifPresent(v -> result.put(key, v));
                        recordLookup(key, value.isPresent());
                    }
                    return result;
                });
    }

    /**
     * Write several entries in one batch.
     *
     * @return true if the store accepted every write
     */
    public Uni<Boolean> setMany(List<CacheWrite> writes) {
        if (writes.isEmpty()) {
            return Uni.createFrom().item(true);
        }
        if (!availability.isAvailable()) {
            return Uni.createFrom().item(false);
        }
        final Map<String, String> entries = new LinkedHashMap<>();
        final Map<String, Duration> ttls = new HashMap<>();
        for (CacheWrite write : writes) {
            serialize(write.key(), write.value()).ifPresent(json -> {
                entries.put(write.key(), json);
                ttls.put(write.key(), write.ttl() != null ? write.ttl() : ttlPolicy.ttlFor(write.key()));
            });
        }
        if (entries.isEmpty()) {
            return Uni.createFrom().item(false);
        }
        final boolean complete = entries.size() == writes.size();
        return timeouts.withTimeoutFallback(
                tracked(store.setMany(entries, ttls)).replaceWith(complete), "setMany", () -> false);
    }

    /**
     * Record a key in an index set. The set expires with the TTL of its own namespace.
     *
     * @return true if recorded
     */
    public Uni<Boolean> addToIndex(String indexKey, String member) {
        if (!availability.isAvailable()) {
            return Uni.createFrom().item(false);
        }
        return timeouts.withTimeoutFallback(
                tracked(store.addToSet(indexKey, List.of(member), ttlPolicy.ttlFor(indexKey))).replaceWith(true),
                "addToIndex",
                () -> false);
    }

    /**
     * Read an index set.
     *
     * @return members, or empty when the index could not be read
     */
    public Uni<Optional<Set<String>>> indexMembers(String indexKey) {
        return timeouts.withTimeoutGraceful(tracked(store.members(indexKey)), "indexMembers");
    }

    private <T> Uni<T> tracked(Uni<T> operation) {
        return operation.invoke(availability::reportSuccess).onFailure().invoke(availability::reportFailure);
    }

    private <T> Optional<T> deserialize(String key, String json, JavaType type) {
        try {
            return Optional.ofNullable(mapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            LOG.warnv("Discarding undecodable cache entry {0}: {1}", key, e.getOriginalMessage());
            metrics.recordFailure("deserialize");
            return Optional.empty();
        }
    }

    private Optional<String> serialize(String key, Object value) {
        try {
            return Optional.of(mapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            LOG.warnv("Cannot serialize value for cache key {0}: {1}", key, e.getOriginalMessage());
            metrics.recordFailure("serialize");
            return Optional.empty();
        }
    }

    private void recordLookup(String key, boolean hit) {
        final String namespace = CacheNamespace.of(key).map(CacheNamespace::prefix).orElse("other");
        if (hit) {
            LOG.debugv("Cache HIT {0}", key);
            metrics.recordHit(namespace);
        } else {
            LOG.debugv("Cache MISS {0}", key);
            metrics.recordMiss(namespace);
        }
    }
}
