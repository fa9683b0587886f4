package bazaar.core.model.catalog;

import java.util.Locale;

/**
 * Ordering applied to a filtered result set.
 *
 * <p>{@link #FREE} restricts the set to free items and keeps store order;
 * {@link #NATURAL} is used for any unrecognized value.
 */
public enum SortStrategy {
    HOT_NOW("HotNow"),
    TOP_RATED("TopRated"),
    NEWEST("Newest"),
    FREE("Free"),
    NATURAL("");

    private final String wireName;

    SortStrategy(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used in request parameters and cache keys.
     *
     * @return e.g. {@code HotNow}, or empty for {@link #NATURAL}
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Parse a request value, case-insensitively.
     *
     * @param value raw sort parameter, may be null
     * @return the matching strategy, {@link #NATURAL} when unknown or absent
     */
    public static SortStrategy parse(String value) {
        if (value == null || value.isBlank()) {
            return NATURAL;
        }
        final var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SortStrategy strategy : values()) {
            if (strategy != NATURAL && strategy.wireName.toLowerCase(Locale.ROOT).equals(normalized)) {
                return strategy;
            }
        }
        return NATURAL;
    }
}
