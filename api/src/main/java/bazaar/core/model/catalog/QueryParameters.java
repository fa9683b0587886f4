package bazaar.core.model.catalog;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Normalized listing query.
 *
 * <p>Instances are always consistent: {@code page >= 1}, {@code limit >= 1} and
 * {@code priceMin <= priceMax} when both are present. Raw request values go
 * through {@link #fromRaw}, which coerces rather than rejects.
 *
 * @param category   exact category, {@value #ALL_CATEGORIES} for every category
 * @param sort       ordering strategy
 * @param priceMin   inclusive lower price bound, null when unbounded
 * @param priceMax   inclusive upper price bound, null when unbounded
 * @param ratingMin  minimum average rating, null when unbounded
 * @param tags       category/tag filter, lower-cased
 * @param features   feature filter, lower-cased
 * @param searchTerm free-text term, null when absent
 * @param page       1-based page number
 * @param limit      page size
 */
public record QueryParameters(
        String category,
        SortStrategy sort,
        Double priceMin,
        Double priceMax,
        Double ratingMin,
        Set<String> tags,
        Set<String> features,
        String searchTerm,
        int page,
        int limit) {

    public static final String ALL_CATEGORIES = "All";
    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    public QueryParameters {
        category = normalizeCategory(category);
        sort = sort == null ? SortStrategy.NATURAL : sort;
        if (priceMin != null && priceMax != null && priceMin > priceMax) {
            final Double swap = priceMin;
            priceMin = priceMax;
            priceMax = swap;
        }
        tags = normalizeSet(tags);
        features = normalizeSet(features);
        searchTerm = searchTerm == null || searchTerm.isBlank() ? null : searchTerm.trim();
        page = Math.max(1, page);
        limit = limit < 1 ? DEFAULT_LIMIT : limit;
    }

    /**
     * Query for the first page of every record, in store order.
     *
     * @return default parameters
     */
    public static QueryParameters defaults() {
        return builder().build();
    }

    /**
     * Trim a requested category. Blank and any casing of {@value #ALL_CATEGORIES}
     * become {@value #ALL_CATEGORIES}, so every "all categories" view shares one key.
     *
     * @param category raw category, may be null
     * @return canonical category
     */
    public static String normalizeCategory(String category) {
        if (category == null || category.isBlank() || ALL_CATEGORIES.equalsIgnoreCase(category.trim())) {
            return ALL_CATEGORIES;
        }
        return category.trim();
    }

    public boolean isAllCategories() {
        return ALL_CATEGORIES.equalsIgnoreCase(category);
    }

    public boolean hasSearchTerm() {
        return searchTerm != null;
    }

    /**
     * Parse loosely-typed request values with the default page size limits.
     *
     * @param raw request parameters; a parameter may repeat or carry comma-separated values
     * @return normalized parameters
     * @see #fromRaw(Map, int, int)
     */
    public static QueryParameters fromRaw(Map<String, ? extends Collection<String>> raw) {
        return fromRaw(raw, DEFAULT_LIMIT, MAX_LIMIT);
    }

    /**
     * Parse loosely-typed request values.
     *
     * <p>Recognized parameters: {@code category}, {@code sort} (alias {@code filter}), {@code priceMin},
     * {@code priceMax}, {@code ratingMin} (alias {@code minRating}), {@code tags},
     * {@code features}, {@code search} (alias {@code searchQuery}), {@code page}
     * and {@code limit}. Malformed numbers are treated as absent; a page below 1
     * becomes 1, a non-positive limit becomes {@code defaultLimit} and a limit
     * above {@code maxLimit} is capped.
     *
     * @param raw          request parameters
     * @param defaultLimit page size when absent or invalid
     * @param maxLimit     upper bound on page size
     * @return normalized parameters
     */
    public static QueryParameters fromRaw(
            Map<String, ? extends Collection<String>> raw, int defaultLimit, int maxLimit) {
        final Map<String, ? extends Collection<String>> params = raw == null ? Map.of() : raw;

        final Integer requestedLimit = parseInt(first(params, "limit"));
        int limit = requestedLimit == null || requestedLimit < 1 ? defaultLimit : requestedLimit;
        limit = Math.min(limit, maxLimit);

        final Integer requestedPage = parseInt(first(params, "page"));
        final int page = requestedPage == null ? 1 : Math.max(1, requestedPage);

        String search = first(params, "search");
        if (search == null || search.isBlank()) {
            search = first(params, "searchQuery");
        }
        String sort = first(params, "sort");
        if (sort == null || sort.isBlank()) {
            sort = first(params, "filter");
        }
        String ratingMin = first(params, "ratingMin");
        if (ratingMin == null) {
            ratingMin = first(params, "minRating");
        }

        return builder()
                .category(first(params, "category"))
                .sort(SortStrategy.parse(sort))
                .priceMin(parseDouble(first(params, "priceMin")))
                .priceMax(parseDouble(first(params, "priceMax")))
                .ratingMin(parseDouble(ratingMin))
                .tags(splitAll(params.get("tags")))
                .features(splitAll(params.get("features")))
                .searchTerm(search)
                .page(page)
                .limit(limit)
                .build();
    }

    private static String first(Map<String, ? extends Collection<String>> params, String name) {
        final var values = params.get(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.iterator().next();
    }

    private static Set<String> splitAll(Collection<String> values) {
        final var result = new TreeSet<String>();
        if (values == null) {
            return result;
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            for (String part : value.split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
        }
        return result;
    }

    static Integer parseInt(String value) {
        final Double parsed = parseDouble(value);
        if (parsed == null) {
            return null;
        }
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, Math.floor(parsed)));
    }

    static Double parseDouble(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            final double parsed = Double.parseDouble(value.trim());
            return Double.isNaN(parsed) ? null : parsed;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Set<String> normalizeSet(Set<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        final var result = new TreeSet<String>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                result.add(value.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Set.copyOf(result);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .category(category)
                .sort(sort)
                .priceMin(priceMin)
                .priceMax(priceMax)
                .ratingMin(ratingMin)
                .tags(tags)
                .features(features)
                .searchTerm(searchTerm)
                .page(page)
                .limit(limit);
    }

    public static class Builder {
        private String category = ALL_CATEGORIES;
        private SortStrategy sort = SortStrategy.NATURAL;
        private Double priceMin;
        private Double priceMax;
        private Double ratingMin;
        private Set<String> tags = Set.of();
        private Set<String> features = Set.of();
        private String searchTerm;
        private int page = 1;
        private int limit = DEFAULT_LIMIT;

        private Builder() {}

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder sort(SortStrategy sort) {
            this.sort = sort;
            return this;
        }

        public Builder priceMin(Double priceMin) {
            this.priceMin = priceMin;
            return this;
        }

        public Builder priceMax(Double priceMax) {
            this.priceMax = priceMax;
            return this;
        }

        public Builder ratingMin(Double ratingMin) {
            this.ratingMin = ratingMin;
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder tags(String... tags) {
            this.tags = Set.copyOf(List.of(tags));
            return this;
        }

        public Builder features(Set<String> features) {
            this.features = features;
            return this;
        }

        public Builder features(String... features) {
            this.features = Set.copyOf(List.of(features));
            return this;
        }

        public Builder searchTerm(String searchTerm) {
            this.searchTerm = searchTerm;
            return this;
        }

        public Builder page(int page) {
            this.page = page;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public QueryParameters build() {
            return new QueryParameters(
                    category, sort, priceMin, priceMax, ratingMin, tags, features, searchTerm, page, limit);
        }
    }
}
