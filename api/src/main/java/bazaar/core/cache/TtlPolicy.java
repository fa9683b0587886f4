package bazaar.core.cache;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import bazaar.core.config.CacheConfig;

/**
 * Maps cache keys to expiry durations by namespace.
 *
 * <p>Keys outside every known namespace get the shortest bucket. Bucket
 * durations are checked at construction to be strictly increasing in
 * {@link TtlBucket} order.
 */
@ApplicationScoped
public class TtlPolicy {

    private static final Logger LOG = Logger.getLogger(TtlPolicy.class);

    private final Map<TtlBucket, Duration> durations;

    @Inject
    public TtlPolicy(CacheConfig config) {
        this(fromConfig(config.ttl()));
    }

    /**
     * Create a policy from explicit bucket durations.
     *
     * @param durations a positive duration for every bucket
     * @throws IllegalStateException if a bucket is missing, non-positive or out of order
     */
    public TtlPolicy(Map<TtlBucket, Duration> durations) {
        this.durations = new EnumMap<>(TtlBucket.class);
        this.durations.putAll(durations);
        validate(this.durations);
        LOG.debugv("TTL buckets: {0}", this.durations);
    }

    public static TtlPolicy defaults() {
        final var map = new EnumMap<TtlBucket, Duration>(TtlBucket.class);
        map.put(TtlBucket.ADMIN, Duration.ofMinutes(5));
        map.put(TtlBucket.SEARCH, Duration.ofHours(1));
        map.put(TtlBucket.LISTING, Duration.ofHours(24));
        map.put(TtlBucket.DETAIL, Duration.ofDays(7));
        map.put(TtlBucket.EXTERNAL, Duration.ofDays(14));
        return new TtlPolicy(map);
    }

    public Duration ttlFor(String key) {
        return durations.get(bucketFor(key));
    }

    public TtlBucket bucketFor(String key) {
        return CacheNamespace.of(key).map(CacheNamespace::bucket).orElse(TtlBucket.shortest());
    }

    public Duration ttlFor(TtlBucket bucket) {
        return durations.get(bucket);
    }

    private static Map<TtlBucket, Duration> fromConfig(CacheConfig.TtlConfig ttl) {
        final var map = new EnumMap<TtlBucket, Duration>(TtlBucket.class);
        map.put(TtlBucket.ADMIN, ttl.admin());
        map.put(TtlBucket.SEARCH, ttl.search());
        map.put(TtlBucket.LISTING, ttl.listing());
        map.put(TtlBucket.DETAIL, ttl.detail());
        map.put(TtlBucket.EXTERNAL, ttl.external());
        return map;
    }

    private static void validate(Map<TtlBucket, Duration> durations) {
        Duration previous = Duration.ZERO;
        TtlBucket previousBucket = null;
        for (TtlBucket bucket : TtlBucket.values()) {
            final var current = durations.get(bucket);
            if (current == null) {
                throw new IllegalStateException("No TTL configured for bucket " + bucket);
            }
            if (current.compareTo(previous) <= 0) {
                throw new IllegalStateException(previousBucket == null
                        ? "TTL for " + bucket + " must be positive, got " + current
                        : "TTL for " + bucket + " (" + current + ") must exceed " + previousBucket + " (" + previous
                                + ")");
            }
            previous = current;
            previousBucket = bucket;
        }
    }
}
