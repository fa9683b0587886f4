package bazaar.core.service.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import bazaar.core.model.catalog.AgentRecord;
import bazaar.core.model.catalog.Rating;
import bazaar.core.model.catalog.Review;

@DisplayName("ReviewAggregator")
class ReviewAggregatorTest {

    private static Review review(String id, int rating, Instant createdAt) {
        return new Review(id, "user-" + id, "User", rating, "content", createdAt);
    }

    @Test
    @DisplayName("should round the mean half-up to two decimals")
    void shouldRoundMeanHalfUp() {
        final var now = Instant.now();
        final var reviews = List.of(review("1", 5, now), review("2", 4, now), review("3", 4, now));

        assertEquals(new Rating(4.33, 3), ReviewAggregator.rating(reviews));
        assertEquals(
                new Rating(4.67, 3),
                ReviewAggregator.rating(List.of(review("1", 5, now), review("2", 5, now), review("3", 4, now))));
    }

    @Test
    @DisplayName("should report no rating without reviews")
    void shouldReportNoRating() {
        assertEquals(Rating.none(), ReviewAggregator.rating(List.of()));
    }

    @Test
    @DisplayName("should sort reviews newest first and refresh the rating")
    void shouldSortNewestFirst() {
        final var older = review("old", 2, Instant.parse("2024-01-01T00:00:00Z"));
        final var newer = review("new", 4, Instant.parse("2024-02-01T00:00:00Z"));
        final var record = AgentRecord.builder("a1").name("Agent").build();

        final var updated = ReviewAggregator.withReviews(record, List.of(older, newer));

        assertEquals(List.of("new", "old"), updated.reviews().stream().map(Review::id).toList());
        assertEquals(new Rating(3.0, 2), updated.rating());
    }
}
