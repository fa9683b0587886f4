package bazaar.core.cache;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import bazaar.core.config.CacheConfig;
import bazaar.core.model.catalog.QueryParameters;
import bazaar.core.model.catalog.SortStrategy;
import bazaar.core.util.ContentHash;

/**
 * Builds deterministic cache keys and the glob patterns that target them.
 *
 * <p>Query keys have the form
 * {@code {namespace}:category:{category}:{k1}:{v1}:{k2}:{v2}...} with parameters
 * sorted by name. Once a query carries more than {@code maxPlainParams} non-empty
 * parameters, or the plain key would exceed {@code maxPlainLength} characters,
 * the suffix after the category is replaced by {@code h:{32 hex chars}}. The
 * category segment is always kept in clear so category globs still match.
 *
 * <p>Segment text is percent-escaped for {@code : % * ? [ ] \}, so a value can
 * neither forge a separator nor act as a wildcard in a pattern.
 */
@ApplicationScoped
public class CacheKeyBuilder {

    static final int HASH_HEX_CHARS = 32;
    private static final String CATEGORY_SEGMENT = "category";

    private final int maxPlainParams;
    private final int maxPlainLength;

    @Inject
    public CacheKeyBuilder(CacheConfig config) {
        this(config.keys().maxPlainParams(), config.keys().maxPlainLength());
    }

    public CacheKeyBuilder(int maxPlainParams, int maxPlainLength) {
        this.maxPlainParams = maxPlainParams;
        this.maxPlainLength = maxPlainLength;
    }

    /**
     * Key for a listing page. Queries with a search term use the search namespace.
     *
     * @param params normalized query
     * @return cache key
     */
    public String listingKey(QueryParameters params) {
        final var namespace = params.hasSearchTerm() ? CacheNamespace.AGENTS_SEARCH : CacheNamespace.AGENTS_LIST;
        return build(namespace, params.category(), queryParts(params));
    }

    /**
     * Key for a search page, regardless of whether a term is present.
     *
     * @param params normalized query
     * @return cache key
     */
    public String searchKey(QueryParameters params) {
        return build(CacheNamespace.AGENTS_SEARCH, params.category(), queryParts(params));
    }

    /**
     * Build a category-scoped key from arbitrary parameters.
     *
     * @param namespace target namespace
     * @param category  category kept in clear
     * @param params    remaining parameters; null or blank values are skipped
     * @return cache key
     */
    public String build(CacheNamespace namespace, String category, Map<String, String> params) {
        final SortedMap<String, String> sorted = new TreeMap<>();
        params.forEach((k, v) -> {
            if (k != null && v != null && !v.isEmpty() && !CATEGORY_SEGMENT.equals(k)) {
                sorted.put(k, v);
            }
        });
        final var head = categoryPrefix(namespace, category);

        final var plain = new StringBuilder(head);
        sorted.forEach((k, v) -> plain.append(':').append(escape(k)).append(':').append(escape(v)));

        if (sorted.size() + 1 > maxPlainParams || plain.length() > maxPlainLength) {
            final var normalized = new StringBuilder(CATEGORY_SEGMENT).append('=').append(category);
            sorted.forEach((k, v) -> normalized.append('&').append(k).append('=').append(v));
            return head + ":h:" + ContentHash.sha256Hex(normalized.toString(), HASH_HEX_CHARS);
        }
        return plain.toString();
    }

    public String detailKey(String agentId) {
        return CacheNamespace.AGENTS_DETAIL.prefix() + ":" + escape(agentId);
    }

    public String countKey(String category) {
        return categoryPrefix(CacheNamespace.AGENTS_COUNT, category);
    }

    public String featuredKey(int limit) {
        return CacheNamespace.AGENTS_FEATURED.prefix() + ":limit:" + limit;
    }

    public String userAgentKey(String userId, String agentId) {
        return CacheNamespace.USER.prefix() + ":" + escape(userId) + ":agent:" + escape(agentId) + ":like";
    }

    /**
     * Pattern covering every per-user key derived from one record.
     *
     * @param agentId record id
     * @return glob such as {@code user:*:agent:a1:*}
     */
    public String userAgentPattern(String agentId) {
        return CacheNamespace.USER.prefix() + ":*:agent:" + escape(agentId) + ":*";
    }

    /**
     * Patterns covering every listing, search and category key of one category.
     *
     * @param category exact category
     * @return globs, one per category-scoped namespace
     */
    public List<String> categoryPatterns(String category) {
        return List.of(
                categoryPrefix(CacheNamespace.AGENTS_LIST, category) + ":*",
                categoryPrefix(CacheNamespace.AGENTS_SEARCH, category) + ":*",
                categoryPrefix(CacheNamespace.AGENTS_CATEGORY, category) + ":*");
    }

    public String featuredPattern() {
        return CacheNamespace.AGENTS_FEATURED.prefix() + ":*";
    }

    /**
     * Set recording the listing and search keys written for a category.
     *
     * @param category exact category
     * @return index key
     */
    public String indexKey(String category) {
        return categoryPrefix(CacheNamespace.INDEX, category);
    }

    public List<String> flushPatterns() {
        return List.of("agents:*", CacheNamespace.USER.prefix() + ":*", CacheNamespace.INDEX.prefix() + ":*");
    }

    /**
     * Percent-escape characters with special meaning in keys or glob patterns.
     *
     * @param value raw segment text
     * @return escaped text
     */
    public static String escape(String value) {
        final var out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            switch (c) {
                case '%', ':', '*', '?', '[', ']', '\\' -> out.append('%')
                        .append(String.format(Locale.ROOT, "%02X", (int) c));
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    private static String categoryPrefix(CacheNamespace namespace, String category) {
        final var value = category == null || category.isBlank() ? QueryParameters.ALL_CATEGORIES : category;
        return namespace.prefix() + ":" + CATEGORY_SEGMENT + ":" + escape(value);
    }

    private static Map<String, String> queryParts(QueryParameters params) {
        final Map<String, String> parts = new TreeMap<>();
        if (params.sort() != SortStrategy.NATURAL) {
            parts.put("sort", params.sort().wireName().toLowerCase(Locale.ROOT));
        }
        putNumber(parts, "priceMin", params.priceMin());
        putNumber(parts, "priceMax", params.priceMax());
        putNumber(parts, "ratingMin", params.ratingMin());
        parts.put("tags", joinSorted(params.tags()));
        parts.put("features", joinSorted(params.features()));
        if (params.hasSearchTerm()) {
            parts.put("search", params.searchTerm().toLowerCase(Locale.ROOT));
        }
        parts.put("page", Integer.toString(params.page()));
        parts.put("limit", Integer.toString(params.limit()));
        return parts;
    }

    private static void putNumber(Map<String, String> parts, String name, Double value) {
        if (value != null && !value.isInfinite()) {
            parts.put(name, BigDecimal.valueOf(value).stripTrailingZeros().toPlainString());
        }
    }

    private static String joinSorted(Set<String> values) {
        return values.stream()
                .map(v -> v.toLowerCase(Locale.ROOT))
                .sorted()
                .collect(Collectors.joining(","));
    }
}
