package bazaar.core.service.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import bazaar.core.model.catalog.AgentPatch;
import bazaar.core.model.catalog.AgentRecord;
import bazaar.core.model.catalog.Creator;
import bazaar.core.model.catalog.FileMetadata;
import bazaar.core.model.catalog.PriceDetails;
import bazaar.core.model.catalog.Rating;
import bazaar.core.model.catalog.Review;

@DisplayName("AgentRecordMerger")
class AgentRecordMergerTest {

    private static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");
    private static final Creator ACTOR = new Creator("u1", "Ada", null);

    @Nested
    @DisplayName("create()")
    class CreateTests {

        @Test
        @DisplayName("should fill defaults for absent fields")
        void shouldFillDefaults() {
            final var record = AgentRecordMerger.create(
                    "id1", AgentPatch.builder().name("Writer").build(), ACTOR, NOW);

            assertEquals("Writer", record.title());
            assertEquals(AgentRecordMerger.DEFAULT_STATUS, record.status());
            assertEquals(AgentRecordMerger.DEFAULT_VERSION, record.version());
            assertEquals(ACTOR, record.creator());
            assertEquals(NOW, record.createdAt());
            assertEquals(NOW, record.updatedAt());
            assertEquals(0.0, record.priceDetails().basePrice());
            assertEquals("0", record.price());
            assertEquals(Rating.none(), record.rating());
        }

        @Test
        @DisplayName("should derive discount fields and the legacy price")
        void shouldDerivePriceFields() {
            final var patch = AgentPatch.builder()
                    .name("Writer")
                    .basePrice(20.0)
                    .discountedPrice(15.0)
                    .build();

            final var record = AgentRecordMerger.create("id1", patch, ACTOR, NOW);

            assertEquals(25, record.priceDetails().discountPercentage());
            assertEquals("15", record.price());
        }

        @Test
        @DisplayName("should build file metadata from URL shortcuts")
        void shouldBuildFilesFromUrls() {
            final var patch = AgentPatch.builder()
                    .name("Writer")
                    .imageUrl(" https://cdn/img.png ")
                    .downloadUrl("https://cdn/agent.json")
                    .build();

            final var record = AgentRecordMerger.create("id1", patch, ACTOR, NOW);

            assertEquals("https://cdn/img.png", record.image().url());
            assertEquals(AgentRecordMerger.JSON_CONTENT_TYPE, record.jsonFile().contentType());
            assertNull(record.icon());
        }
    }

    @Nested
    @DisplayName("merge()")
    class MergeTests {

        private final AgentRecord existing = AgentRecord.builder("id1")
                .name("Writer")
                .title("Writer Pro")
                .description("Writes")
                .category("Tools")
                .creator(ACTOR)
                .priceDetails(PriceDetails.of(20, 15.0, "EUR", true))
                .price("15")
                .tags("writing")
                .createdAt(CREATED)
                .likes(Set.of("u2"))
                .reviews(List.of(new Review("r1", "u2", "Bob", 5, "Great", CREATED)))
                .rating(new Rating(5.0, 1))
                .image(FileMetadata.ofUrl("https://cdn/old.png", "image/png"))
                .featured(true)
                .build();

        @Test
        @DisplayName("should let present patch values win and keep the rest")
        void shouldPreferPatchValues() {
            final var patch = AgentPatch.builder().description("Writes better").category("Writing").build();

            final var merged = AgentRecordMerger.merge(existing, patch, NOW);

            assertEquals("Writes better", merged.description());
            assertEquals("Writing", merged.category());
            assertEquals("Writer Pro", merged.title());
            assertEquals(Set.of("writing"), merged.tags());
            assertTrue(merged.featured());
        }

        @Test
        @DisplayName("should treat blank strings as absent")
        void shouldIgnoreBlankStrings() {
            final var merged = AgentRecordMerger.merge(
                    existing, AgentPatch.builder().name("  ").category("").build(), NOW);

            assertEquals("Writer", merged.name());
            assertEquals("Tools", merged.category());
        }

        @Test
        @DisplayName("should never replace createdAt and always bump updatedAt")
        void shouldKeepCreatedAt() {
            final var merged = AgentRecordMerger.merge(existing, AgentPatch.empty(), NOW);

            assertEquals(CREATED, merged.createdAt());
            assertEquals(NOW, merged.updatedAt());
        }

        @Test
        @DisplayName("should keep likes, reviews and rating")
        void shouldKeepInteractionData() {
            final var merged = AgentRecordMerger.merge(existing, AgentPatch.builder().name("New").build(), NOW);

            assertEquals(Set.of("u2"), merged.likes());
            assertEquals(1, merged.reviews().size());
            assertEquals(new Rating(5.0, 1), merged.rating());
        }

        @Test
        @DisplayName("should merge price fields individually")
        void shouldMergePriceFields() {
            final var merged = AgentRecordMerger.merge(
                    existing, AgentPatch.builder().discountedPrice(10.0).build(), NOW);

            assertEquals(20.0, merged.priceDetails().basePrice());
            assertEquals(10.0, merged.priceDetails().discountedPrice());
            assertEquals("EUR", merged.priceDetails().currency());
            assertTrue(merged.priceDetails().isSubscription());
            assertEquals("10", merged.price());
        }

        @Test
        @DisplayName("should reset the discount when only the base price changes")
        void shouldResetDiscountOnBasePriceChange() {
            final var undiscounted = existing.toBuilder()
                    .priceDetails(PriceDetails.of(10, 10.0, "USD", false))
                    .build();

            final var merged = AgentRecordMerger.merge(
                    undiscounted, AgentPatch.builder().basePrice(20.0).build(), NOW);

            assertEquals(20.0, merged.priceDetails().basePrice());
            assertEquals(20.0, merged.priceDetails().discountedPrice());
            assertEquals(0, merged.priceDetails().discountPercentage());
            assertEquals("USD", merged.priceDetails().currency());
            assertEquals("20", merged.price());
        }

        @Test
        @DisplayName("should keep an explicit discount sent with a new base price")
        void shouldKeepExplicitDiscountWithBasePrice() {
            final var merged = AgentRecordMerger.merge(
                    existing, AgentPatch.builder().basePrice(40.0).discountedPrice(30.0).build(), NOW);

            assertEquals(40.0, merged.priceDetails().basePrice());
            assertEquals(30.0, merged.priceDetails().discountedPrice());
            assertEquals(25, merged.priceDetails().discountPercentage());
        }

        @Test
        @DisplayName("should fall back to the legacy price for records without price details")
        void shouldFallBackToLegacyPrice() {
            final var legacy = AgentRecord.builder("old").name("Old").price("$9.99").build();

            final var merged = AgentRecordMerger.merge(legacy, AgentPatch.empty(), NOW);

            assertEquals(9.99, merged.priceDetails().basePrice());
        }

        @Test
        @DisplayName("should clear a file when its URL shortcut is blank")
        void shouldClearFileOnBlankUrl() {
            final var merged = AgentRecordMerger.merge(existing, AgentPatch.builder().imageUrl("").build(), NOW);

            assertNull(merged.image());
        }
    }
}
