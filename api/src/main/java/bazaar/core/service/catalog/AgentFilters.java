package bazaar.core.service.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

import bazaar.core.model.catalog.AgentRecord;
import bazaar.core.model.catalog.QueryParameters;
import bazaar.core.model.catalog.SortStrategy;

/**
 * Filter stages of the listing pipeline.
 *
 * <p>Stages are independent predicates, so their order does not change the
 * result set; {@link #stagesFor} returns them in a fixed order anyway (free,
 * price, rating, tags, features, search) so the cheapest run first.
 */
public final class AgentFilters {

    private AgentFilters() {}

    /**
     * Build the active stages for a query. Inactive stages are omitted.
     *
     * @param params normalized query
     * @return predicates to AND together
     */
    public static List<Predicate<AgentRecord>> stagesFor(QueryParameters params) {
        final List<Predicate<AgentRecord>> stages = new ArrayList<>();
        if (params.sort() == SortStrategy.FREE) {
            stages.add(free());
        }
        if (params.priceMin() != null || params.priceMax() != null) {
            stages.add(priceRange(params.priceMin(), params.priceMax()));
        }
        if (params.ratingMin() != null) {
            stages.add(ratingAtLeast(params.ratingMin()));
        }
        if (!params.tags().isEmpty()) {
            stages.add(tags(params.tags()));
        }
        if (!params.features().isEmpty()) {
            stages.add(features(params.features()));
        }
        if (params.hasSearchTerm()) {
            stages.add(search(params.searchTerm()));
        }
        return stages;
    }

    public static Predicate<AgentRecord> free() {
        return PriceResolver::isFree;
    }

    public static Predicate<AgentRecord> priceRange(Double min, Double max) {
        return record -> {
            final double price = PriceResolver.effectivePrice(record);
            if (Double.isInfinite(price)) {
                return false;
            }
            return (min == null || price >= min) && (max == null || price <= max);
        };
    }

    public static Predicate<AgentRecord> ratingAtLeast(double min) {
        return record -> record.rating().average() >= min;
    }

    /**
     * Match when the record's category or any of its tags is requested.
     *
     * @param requested lower-cased tags
     */
    public static Predicate<AgentRecord> tags(Set<String> requested) {
        return record -> {
            if (record.category() != null && requested.contains(lower(record.category()))) {
                return true;
            }
            return record.tags().stream().anyMatch(tag -> tag != null && requested.contains(lower(tag)));
        };
    }

    /**
     * Match when any requested feature applies. {@code isfree}/{@code free} and
     * {@code issubscription}/{@code subscription} are derived from the price.
     *
     * @param requested lower-cased feature names
     */
    public static Predicate<AgentRecord> features(Set<String> requested) {
        return record -> requested.stream().anyMatch(feature -> switch (feature) {
            case "isfree", "free" -> PriceResolver.isFree(record);
            case "issubscription", "subscription" -> PriceResolver.isSubscription(record);
            default -> record.features().stream().anyMatch(f -> f != null && lower(f).equals(feature));
        });
    }

    /**
     * Case-insensitive substring match on name, title, description or creator name.
     *
     * @param term search term
     */
    public static Predicate<AgentRecord> search(String term) {
        final String needle = lower(term);
        return record -> contains(record.name(), needle)
                || contains(record.title(), needle)
                || contains(record.description(), needle)
                || (record.creator() != null && contains(record.creator().name(), needle));
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && lower(haystack).contains(needle);
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
