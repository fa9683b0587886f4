package bazaar.core.service.catalog;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;

import bazaar.core.model.catalog.AgentRecord;
import bazaar.core.model.catalog.SortStrategy;

/**
 * Orderings for the listing pipeline. All comparators are used with a stable
 * sort, so records that compare equal keep store order.
 */
public final class AgentSorts {

    private AgentSorts() {}

    /**
     * Comparator for a strategy.
     *
     * @param strategy  requested ordering
     * @param now       reference time for recency
     * @param hotWindow how far back a record still counts as recent
     * @return comparator, empty when store order should be kept
     */
    public static Optional<Comparator<AgentRecord>> forStrategy(
            SortStrategy strategy, Instant now, Duration hotWindow) {
        return switch (strategy) {
            case HOT_NOW -> Optional.of(hotNow(now.minus(hotWindow)));
            case TOP_RATED -> Optional.of(topRated());
            case NEWEST -> Optional.of(newest());
            case FREE, NATURAL -> Optional.empty();
        };
    }

    /**
     * Recent records first (newest, then most popular), then older dated records
     * by popularity, then records without a usable creation date by popularity.
     *
     * @param recentSince records created at or after this instant are recent
     */
    public static Comparator<AgentRecord> hotNow(Instant recentSince) {
        final Comparator<AgentRecord> byTier = Comparator.comparingInt(r -> hotTier(r, recentSince));
        return byTier.thenComparing((a, b) -> {
                    if (hotTier(a, recentSince) != 0) {
                        return 0;
                    }
                    return b.createdAt().compareTo(a.createdAt());
                })
                .thenComparing(Comparator.comparingInt(AgentRecord::popularity).reversed());
    }

    public static Comparator<AgentRecord> topRated() {
        return Comparator.<AgentRecord>comparingDouble(r -> r.rating().average())
                .reversed()
                .thenComparing(Comparator.<AgentRecord>comparingInt(r -> r.rating().count()).reversed());
    }

    /**
     * Creation date descending; records without a usable date sort as the epoch.
     */
    public static Comparator<AgentRecord> newest() {
        return Comparator.<AgentRecord, Instant>comparing(
                        r -> r.createdAt() != null ? r.createdAt() : Instant.EPOCH)
                .reversed();
    }

    private static int hotTier(AgentRecord record, Instant recentSince) {
        if (record.createdAt() == null) {
            return 2;
        }
        return record.createdAt().isBefore(recentSince) ? 1 : 0;
    }
}
