package bazaar.adapter.out.cache.memory;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.smallrye.mutiny.Uni;

import bazaar.core.port.out.CacheStore;

/**
 * Caffeine-backed CacheStore for single-instance deployments and tests.
 *
 * <p>Each entry carries its own TTL. Glob matching follows Redis {@code KEYS}
 * semantics: {@code *}, {@code ?}, {@code [...]} and backslash escapes.
 */
public class InMemoryCacheStore implements CacheStore {

    static final long DEFAULT_MAX_SIZE = 10_000;

    private final Cache<String, Entry> cache;

    public InMemoryCacheStore() {
        this(DEFAULT_MAX_SIZE, Ticker.systemTicker());
    }

    public InMemoryCacheStore(long maxSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .expireAfter(new EntryExpiry())
                .maximumSize(maxSize)
                .ticker(ticker)
                .build();
    }

    /**
     * Value plus the TTL it was written with. {@code value} is a String or, for
     * index sets, a Set of Strings.
     */
    private record Entry(Object value, long ttlNanos) {}

    private static class EntryExpiry implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    @Override
    public Uni<String> get(String key) {
        return Uni.createFrom().item(() -> stringValue(cache.getIfPresent(key)));
    }

    @Override
    public Uni<Void> set(String key, String value, Duration ttl) {
        return Uni.createFrom().item(() -> {
            cache.put(key, new Entry(value, ttl.toNanos()));
            return null;
        });
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return Uni.createFrom().item(() -> cache.asMap().remove(key) != null);
    }

    @Override
    public Uni<List<String>> keys(String pattern) {
        return Uni.createFrom().item(() -> {
            cache.cleanUp();
            final Pattern regex = globToRegex(pattern);
            return cache.asMap().keySet().stream()
                    .filter(k -> regex.matcher(k).matches())
                    .toList();
        });
    }

    @Override
    public Uni<Long> deleteAll(Collection<String> keys) {
        return Uni.createFrom().item(() -> keys.stream()
                .filter(k -> cache.asMap().remove(k) != null)
                .count());
    }

    @Override
    public Uni<Map<String, String>> getMany(Collection<String> keys) {
        return Uni.createFrom().item(() -> {
            final Map<String, String> found = new LinkedHashMap<>();
            for (String key : keys) {
                final String value = stringValue(cache.getIfPresent(key));
                if (value != null) {
                    found.put(key, value);
                }
            }
            return found;
        });
    }

    @Override
    public Uni<Void> setMany(Map<String, String> entries, Map<String, Duration> ttls) {
        return Uni.createFrom().item(() -> {
            entries.forEach((key, value) -> cache.put(key, new Entry(value, ttls.get(key).toNanos())));
            return null;
        });
    }

    @Override
    public Uni<Void> addToSet(String key, Collection<String> members, Duration ttl) {
        return Uni.createFrom().item(() -> {
            cache.asMap().compute(key, (k, existing) -> {
                final Set<String> merged = new LinkedHashSet<>();
                if (existing != null && existing.value() instanceof Set<?> current) {
                    current.forEach(m -> merged.add((String) m));
                }
                merged.addAll(members);
                return new Entry(Set.copyOf(merged), ttl.toNanos());
            });
            return null;
        });
    }

    @Override
    public Uni<Set<String>> members(String key) {
        return Uni.createFrom().item(() -> {
            final Entry entry = cache.getIfPresent(key);
            if (entry == null || !(entry.value() instanceof Set<?> members)) {
                return Set.of();
            }
            final Set<String> result = new LinkedHashSet<>();
            members.forEach(m -> result.add((String) m));
            return result;
        });
    }

    @Override
    public Uni<Void> ping() {
        return Uni.createFrom().voidItem();
    }

    @Override
    public void close() {
        cache.invalidateAll();
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    private static String stringValue(Entry entry) {
        return entry != null && entry.value() instanceof String s ? s : null;
    }

    static Pattern globToRegex(String glob) {
        final StringBuilder regex = new StringBuilder();
        boolean inClass = false;
        for (int i = 0; i < glob.length(); i++) {
            final char c = glob.charAt(i);
            if (c == '\\' && i + 1 < glob.length()) {
                final char escaped = glob.charAt(++i);
                if (!inClass) {
                    regex.append(Pattern.quote(String.valueOf(escaped)));
                } else if (Character.isLetterOrDigit(escaped)) {
                    regex.append(escaped);
                } else {
                    regex.append('\\').append(escaped);
                }
            } else if (inClass) {
                if (c == ']') {
                    inClass = false;
                    regex.append(']');
                } else if (c == '^' && glob.charAt(i - 1) == '[') {
                    regex.append('^');
                } else if (c == '-' || Character.isLetterOrDigit(c)) {
                    regex.append(c);
                } else {
                    regex.append('\\').append(c);
                }
            } else if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else if (c == '[' && glob.indexOf(']', i + 1) > i) {
                inClass = true;
                regex.append('[');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }
}
