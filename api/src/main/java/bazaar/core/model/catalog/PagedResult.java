package bazaar.core.model.catalog;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One page of a filtered and sorted result set.
 *
 * @param items      the records on this page, at most {@code limit}
 * @param total      number of records matching the filters across all pages
 * @param page       1-based page number
 * @param limit      page size
 * @param totalPages {@code ceil(total / limit)}
 * @param <T>        item type
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PagedResult<T>(
        @JsonProperty("items") List<T> items,
        @JsonProperty("total") int total,
        @JsonProperty("page") int page,
        @JsonProperty("limit") int limit,
        @JsonProperty("totalPages") int totalPages) {

    public PagedResult {
        items = items == null ? List.of() : List.copyOf(items);
    }

    /**
     * Slice a fully filtered and sorted list.
     *
     * @param all   every matching item, in final order
     * @param page  1-based page, must be at least 1
     * @param limit page size, must be positive
     * @param <T>   item type
     * @return the requested page, with an empty item list past the end
     */
    public static <T> PagedResult<T> slice(List<T> all, int page, int limit) {
        if (page < 1 || limit < 1) {
            throw new IllegalArgumentException("page and limit must be positive");
        }
        final int total = all.size();
        final long start = (long) (page - 1) * limit;
        final List<T> items = start >= total
                ? List.of()
                : all.subList((int) start, (int) Math.min(start + limit, total));
        final int totalPages = (int) Math.ceil((double) total / limit);
        return new PagedResult<>(items, total, page, limit, totalPages);
    }
}
