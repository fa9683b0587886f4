package bazaar.core.cache;

/**
 * Expiry classes, declared from shortest to longest lived.
 */
public enum TtlBucket {
    /** Per-user and admin data that changes with every interaction. */
    ADMIN,
    /** Search results and curated lists. */
    SEARCH,
    /** Paged listings and counts. */
    LISTING,
    /** Single-record views, invalidated explicitly on write. */
    DETAIL,
    /** Data fetched from rate-limited third parties. */
    EXTERNAL;

    public static TtlBucket shortest() {
        return values()[0];
    }
}
