package bazaar.core.service.catalog;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import bazaar.core.model.catalog.AgentRecord;
import bazaar.core.model.catalog.Rating;
import bazaar.core.model.catalog.Review;

/**
 * Keeps embedded reviews ordered and the aggregate rating in step with them.
 */
public final class ReviewAggregator {

    static final Comparator<Review> NEWEST_FIRST = Comparator.comparing(
            Review::createdAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private ReviewAggregator() {}

    /**
     * Replace a record's reviews, re-sorting them and recomputing the rating.
     *
     * @param record  the record
     * @param reviews the complete new review list
     * @return updated copy
     */
    public static AgentRecord withReviews(AgentRecord record, List<Review> reviews) {
        final List<Review> sorted = new ArrayList<>(reviews);
        sorted.sort(NEWEST_FIRST);
        return record.toBuilder().reviews(sorted).rating(rating(sorted)).build();
    }

    /**
     * Mean rating rounded half-up to two decimals.
     *
     * @param reviews reviews to aggregate
     * @return aggregate, {@link Rating#none()} when empty
     */
    public static Rating rating(List<Review> reviews) {
        if (reviews.isEmpty()) {
            return Rating.none();
        }
        final long sum = reviews.stream().mapToLong(Review::rating).sum();
        final double average = BigDecimal.valueOf(sum)
                .divide(BigDecimal.valueOf(reviews.size()), 2, RoundingMode.HALF_UP)
                .doubleValue();
        return new Rating(average, reviews.size());
    }
}
