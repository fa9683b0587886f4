package bazaar.core.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * One entry of a batched cache write.
 *
 * @param key   cache key
 * @param value value to serialize
 * @param ttl   expiry, null to use the key's namespace TTL
 */
public record CacheWrite(String key, Object value, Duration ttl) {

    public CacheWrite {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    public static CacheWrite of(String key, Object value) {
        return new CacheWrite(key, value, null);
    }
}
