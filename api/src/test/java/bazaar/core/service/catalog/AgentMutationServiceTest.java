package bazaar.core.service.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import bazaar.adapter.out.cache.memory.InMemoryCacheStore;
import bazaar.adapter.out.storage.memory.InMemoryCatalogStore;
import bazaar.core.cache.CacheAvailability;
import bazaar.core.cache.CacheKeyBuilder;
import bazaar.core.cache.ResilientCache;
import bazaar.core.cache.TtlPolicy;
import bazaar.core.config.CacheConfig.InvalidationMode;
import bazaar.core.model.catalog.AgentPatch;
import bazaar.core.model.catalog.AgentRecord;
import bazaar.core.model.catalog.Creator;
import bazaar.core.model.catalog.QueryParameters;
import bazaar.core.model.catalog.Rating;
import bazaar.core.model.catalog.Review;
import bazaar.core.port.out.CacheMetrics;

@DisplayName("AgentMutationService")
class AgentMutationServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final Duration TIMEOUT = Duration.ofMillis(200);

    private InMemoryCatalogStore store;
    private InMemoryCacheStore cacheStore;
    private CacheKeyBuilder keys;
    private AgentMutationService service;
    private AgentCatalogService reads;

    @BeforeEach
    void setUp() {
        store = new InMemoryCatalogStore(List.of(AgentRecord.builder("a1")
                .name("Writer")
                .category("Tools")
                .createdAt(NOW.minus(Duration.ofDays(3)))
                .build()));
        cacheStore = new InMemoryCacheStore();
        keys = new CacheKeyBuilder(6, 256);
        final var cache = new ResilientCache(
                cacheStore, TtlPolicy.defaults(), TIMEOUT, CacheMetrics.NOOP, new CacheAvailability(3));
        final var coordinator =
                new CacheInvalidationCoordinator(cache, keys, InvalidationMode.PATTERN, CacheMetrics.NOOP);
        final var clock = Clock.fixed(NOW, ZoneOffset.UTC);
        service = new AgentMutationService(store, coordinator, TIMEOUT, clock, () -> "new-id");
        reads = new AgentCatalogService(
                store, cache, keys, new AgentQueryEngine(Duration.ofDays(7), clock), coordinator, TIMEOUT);
    }

    @Nested
    @DisplayName("listing after a write")
    class ListingFreshnessTests {

        private final AgentPatch tool = AgentPatch.builder().name("Hammer").category("Tools").build();

        @Test
        @DisplayName("should refresh the all-categories listing requested in lower case")
        void shouldRefreshLowerCaseAllListing() {
            final var params = QueryParameters.fromRaw(Map.of("category", List.of("all")));
            assertEquals(1, reads.listAgents(params).await().indefinitely().total());

            service.create(tool, Creator.system()).await().indefinitely();

            assertEquals(2, reads.listAgents(params).await().indefinitely().total());
        }

        @Test
        @DisplayName("should not serve a listing whose key could not be indexed")
        void shouldDropUnindexedListing() {
            final var unindexable = new InMemoryCacheStore() {
                @Override
                public Uni<Void> addToSet(String key, Collection<String> members, Duration ttl) {
                    return Uni.createFrom().failure(new IllegalStateException("index write refused"));
                }
            };
            final var cache = new ResilientCache(
                    unindexable, TtlPolicy.defaults(), TIMEOUT, CacheMetrics.NOOP, new CacheAvailability(10));
            final var coordinator =
                    new CacheInvalidationCoordinator(cache, keys, InvalidationMode.INDEXED, CacheMetrics.NOOP);
            final var clock = Clock.fixed(NOW, ZoneOffset.UTC);
            final var writes = new AgentMutationService(store, coordinator, TIMEOUT, clock, () -> "new-id");
            final var indexedReads = new AgentCatalogService(
                    store, cache, keys, new AgentQueryEngine(Duration.ofDays(7), clock), coordinator, TIMEOUT);
            final var firstPage = QueryParameters.builder().category("Tools").limit(1).build();
            final var secondPage = firstPage.toBuilder().page(2).build();

            assertEquals(1, indexedReads.listAgents(firstPage).await().indefinitely().total());
            assertEquals(1, indexedReads.listAgents(secondPage).await().indefinitely().total());

            writes.create(tool, Creator.system()).await().indefinitely();

            assertEquals(2, indexedReads.listAgents(firstPage).await().indefinitely().total());
            assertEquals(2, indexedReads.listAgents(secondPage).await().indefinitely().total());
        }
    }

    @Nested
    @DisplayName("create/update/delete")
    class WriteTests {

        @Test
        @DisplayName("should create a record owned by the caller")
        void shouldCreateRecord() {
            final var created = service.create(
                            AgentPatch.builder().name("Painter").category("Art").build(),
                            new Creator("u1", "Ada", null))
                    .await()
                    .indefinitely();

            assertEquals("new-id", created.id());
            assertEquals("u1", created.creator().id());
            assertTrue(store.getById("new-id").await().indefinitely().isPresent());
        }

        @Test
        @DisplayName("should reject a record without a name")
        void shouldRejectMissingName() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> service.create(AgentPatch.builder().name(" ").build(), Creator.system())
                            .await()
                            .indefinitely());
        }

        @Test
        @DisplayName("should let the writer read its own update")
        void shouldReadOwnUpdate() {
            reads.getAgentDetail("a1", false).await().indefinitely();
            assertTrue(cacheStore.get(keys.detailKey("a1")).await().indefinitely() != null);

            service.update("a1", AgentPatch.builder().description("Improved").build())
                    .await()
                    .indefinitely();

            assertEquals("Improved", reads.getAgentDetail("a1", false).await().indefinitely().description());
        }

        @Test
        @DisplayName("should fail with AgentNotFoundException when updating an unknown id")
        void shouldFailUpdatingUnknownId() {
            assertThrows(
                    AgentNotFoundException.class,
                    () -> service.update("missing", AgentPatch.empty()).await().indefinitely());
        }

        @Test
        @DisplayName("should delete a record and its cached detail")
        void shouldDeleteRecord() {
            reads.getAgentDetail("a1", false).await().indefinitely();

            service.delete("a1").await().indefinitely();

            assertFalse(store.getById("a1").await().indefinitely().isPresent());
            assertThrows(
                    AgentNotFoundException.class,
                    () -> reads.getAgentDetail("a1", false).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("toggleLike()")
    class ToggleLikeTests {

        @Test
        @DisplayName("should like and then unlike")
        void shouldToggle() {
            assertTrue(service.toggleLike("a1", "u1").await().indefinitely());
            assertTrue(store.getById("a1").await().indefinitely().orElseThrow().likes().contains("u1"));

            assertFalse(service.toggleLike("a1", "u1").await().indefinitely());
            assertFalse(store.getById("a1").await().indefinitely().orElseThrow().likes().contains("u1"));
        }

        @Test
        @DisplayName("should refresh the cached like state")
        void shouldRefreshCachedLikeState() {
            assertFalse(reads.isLikedBy(List.of("a1"), "u1").await().indefinitely().get("a1"));

            service.toggleLike("a1", "u1").await().indefinitely();

            assertTrue(reads.isLikedBy(List.of("a1"), "u1").await().indefinitely().get("a1"));
        }

        @Test
        @DisplayName("should require a user")
        void shouldRequireUser() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> service.toggleLike("a1", "").await().indefinitely());
        }
    }

    @Nested
    @DisplayName("reviews")
    class ReviewTests {

        @Test
        @DisplayName("should add a review and recompute the rating")
        void shouldAddReview() {
            final var updated = service.addReview("a1", "u1", null, 4, "  Very useful  ")
                    .await()
                    .indefinitely();

            final Review review = updated.reviews().get(0);
            assertEquals("u1_" + NOW.toEpochMilli(), review.id());
            assertEquals("User", review.userName());
            assertEquals("Very useful", review.content());
            assertEquals(new Rating(4.0, 1), updated.rating());
        }

        @Test
        @DisplayName("should reject ratings outside 1 to 5")
        void shouldRejectInvalidRating() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> service.addReview("a1", "u1", "Ada", 6, "Great tool").await().indefinitely());
            assertThrows(
                    IllegalArgumentException.class,
                    () -> service.addReview("a1", "u1", "Ada", 0, "Great tool").await().indefinitely());
        }

        @Test
        @DisplayName("should reject content that is too short")
        void shouldRejectShortContent() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> service.addReview("a1", "u1", "Ada", 5, " ok ").await().indefinitely());
        }

        @Test
        @DisplayName("should reject a second review by the same user")
        void shouldRejectDuplicateReview() {
            service.addReview("a1", "u1", "Ada", 5, "Great tool").await().indefinitely();

            assertThrows(
                    DuplicateReviewException.class,
                    () -> service.addReview("a1", "u1", "Ada", 3, "Changed my mind")
                            .await()
                            .indefinitely());
        }

        @Test
        @DisplayName("should let only the author or an admin remove a review")
        void shouldCheckRemovalPermission() {
            final var reviewId = service.addReview("a1", "u1", "Ada", 5, "Great tool")
                    .await()
                    .indefinitely()
                    .reviews()
                    .get(0)
                    .id();

            assertThrows(
                    ReviewNotPermittedException.class,
                    () -> service.removeReview("a1", reviewId, "u2", false).await().indefinitely());

            final var updated = service.removeReview("a1", reviewId, "u2", true).await().indefinitely();

            assertTrue(updated.reviews().isEmpty());
            assertEquals(Rating.none(), updated.rating());
        }

        @Test
        @DisplayName("should fail for an unknown review")
        void shouldFailForUnknownReview() {
            assertThrows(
                    ReviewNotFoundException.class,
                    () -> service.removeReview("a1", "nope", "u1", false).await().indefinitely());
        }
    }
}
