package bazaar.core.cache;

import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Known key prefixes and the expiry bucket each belongs to.
 *
 * <p>A key belongs to a namespace when it equals the prefix or continues it with
 * a {@code :} separator. Where several prefixes match, the longest wins.
 */
public enum CacheNamespace {
    ADMIN("admin", TtlBucket.ADMIN),
    USER("user", TtlBucket.ADMIN),
    AGENTS_SEARCH("agents:search", TtlBucket.SEARCH),
    AGENTS_FEATURED("agents:featured", TtlBucket.SEARCH),
    AGENTS_LIST("agents:list", TtlBucket.LISTING),
    AGENTS_CATEGORY("agents:category", TtlBucket.LISTING),
    AGENTS_COUNT("agents:count", TtlBucket.LISTING),
    AGENTS_DETAIL("agents:detail", TtlBucket.DETAIL),
    INDEX("idx", TtlBucket.LISTING),
    EXTERNAL("external", TtlBucket.EXTERNAL);

    private final String prefix;
    private final TtlBucket bucket;

    CacheNamespace(String prefix, TtlBucket bucket) {
        this.prefix = prefix;
        this.bucket = bucket;
    }

    public String prefix() {
        return prefix;
    }

    public TtlBucket bucket() {
        return bucket;
    }

    /**
     * Check whether a key lives under this namespace.
     *
     * @param key full cache key
     * @return true on an exact or {@code prefix:}-continued match
     */
    public boolean matches(String key) {
        return key.equals(prefix) || (key.startsWith(prefix) && key.charAt(prefix.length()) == ':');
    }

    /**
     * Resolve the most specific namespace of a key.
     *
     * @param key full cache key
     * @return longest matching namespace, empty when none match
     */
    public static Optional<CacheNamespace> of(String key) {
        if (key == null || key.isEmpty()) {
            return Optional.empty();
        }
        return Stream.of(values())
                .filter(ns -> ns.matches(key))
                .max(Comparator.comparingInt(ns -> ns.prefix.length()));
    }
}
