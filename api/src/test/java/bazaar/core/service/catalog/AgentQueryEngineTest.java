package bazaar.core.service.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import bazaar.core.model.catalog.AgentRecord;
import bazaar.core.model.catalog.PriceDetails;
import bazaar.core.model.catalog.QueryParameters;
import bazaar.core.model.catalog.Rating;
import bazaar.core.model.catalog.SortStrategy;

@DisplayName("AgentQueryEngine")
class AgentQueryEngineTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private AgentQueryEngine engine;
    private AgentRecord a;
    private AgentRecord b;
    private AgentRecord c;

    @BeforeEach
    void setUp() {
        engine = new AgentQueryEngine(Duration.ofDays(7), Clock.fixed(NOW, ZoneOffset.UTC));
        a = AgentRecord.builder("A")
                .name("Alpha")
                .priceDetails(PriceDetails.of(0, null, "USD", false))
                .rating(new Rating(4.5, 10))
                .createdAt(NOW)
                .popularity(5)
                .build();
        b = AgentRecord.builder("B")
                .name("Beta")
                .priceDetails(PriceDetails.of(10, null, "USD", false))
                .rating(new Rating(4.8, 3))
                .createdAt(NOW.minus(Duration.ofDays(10)))
                .popularity(50)
                .build();
        c = AgentRecord.builder("C")
                .name("Gamma")
                .priceDetails(PriceDetails.of(5, null, "USD", false))
                .rating(new Rating(4.8, 7))
                .createdAt(NOW.minus(Duration.ofDays(1)))
                .popularity(1)
                .build();
    }

    private List<String> ids(List<AgentRecord> records) {
        return records.stream().map(AgentRecord::id).toList();
    }

    private List<String> run(QueryParameters params) {
        return ids(engine.filterAndSort(List.of(a, b, c), params));
    }

    /**
     * Mixed-generation catalog: legacy string prices, structured prices, no price
     * at all, missing ratings and random tags and features. Always contains one
     * record, {@code seed}, that passes every stage used in the ordering test.
     */
    private static List<AgentRecord> randomCatalog(Random random, int size) {
        final String[] names = {"Writer", "Coder", "Painter", "Helper", "Analyst", "Bot"};
        final String[] categories = {"Writing", "Code", "Tools", "Art", "Data"};
        final String[] tagPool = {"writing", "code", "tools", "art", "data", "ai"};
        final String[] featurePool = {"api", "offline", "voice", "batch"};
        final String[] legacyPrices = {"0", "Free", "$9.99", "12", "25 USD", "contact us", ""};
        final double[] basePrices = {0, 5, 10, 15, 20, 50};

        final List<AgentRecord> records = new ArrayList<>();
        records.add(AgentRecord.builder("seed")
                .name("Seeded Writer")
                .category("Writing")
                .price("Free")
                .rating(new Rating(4.0, 2))
                .tags("writing")
                .features("api")
                .createdAt(NOW)
                .build());
        for (int i = 0; i < size; i++) {
            final var builder = AgentRecord.builder("r" + i)
                    .name(names[random.nextInt(names.length)] + " " + i)
                    .category(categories[random.nextInt(categories.length)])
                    .tags(pick(random, tagPool))
                    .features(pick(random, featurePool))
                    .createdAt(NOW.minus(Duration.ofDays(random.nextInt(30))));
            final int priceKind = random.nextInt(3);
            if (priceKind == 0) {
                builder.price(legacyPrices[random.nextInt(legacyPrices.length)]);
            } else if (priceKind == 1) {
                final double base = basePrices[random.nextInt(basePrices.length)];
                final Double discounted = random.nextBoolean() ? null : base * random.nextDouble();
                builder.priceDetails(PriceDetails.of(base, discounted, "USD", random.nextBoolean()));
            }
            if (random.nextBoolean()) {
                builder.rating(new Rating(Math.round(random.nextDouble() * 50) / 10.0, 1 + random.nextInt(20)));
            }
            records.add(builder.build());
        }
        return records;
    }

    private static String[] pick(Random random, String[] pool) {
        return Arrays.stream(pool).filter(value -> random.nextInt(3) == 0).toArray(String[]::new);
    }

    private static List<List<Integer>> permutations(int n) {
        final List<List<Integer>> result = new ArrayList<>();
        permute(new ArrayList<>(), n, result);
        return result;
    }

    private static void permute(List<Integer> prefix, int n, List<List<Integer>> out) {
        if (prefix.size() == n) {
            out.add(List.copyOf(prefix));
            return;
        }
        for (int i = 0; i < n; i++) {
            if (!prefix.contains(i)) {
                prefix.add(i);
                permute(prefix, n, out);
                prefix.remove(prefix.size() - 1);
            }
        }
    }

    @Nested
    @DisplayName("sorting")
    class SortingTests {

        @Test
        @DisplayName("Free should keep only free records")
        void freeShouldKeepOnlyFreeRecords() {
            assertEquals(List.of("A"), run(QueryParameters.builder().sort(SortStrategy.FREE).build()));
        }

        @Test
        @DisplayName("TopRated should break rating ties by review count")
        void topRatedShouldBreakTiesByCount() {
            assertEquals(List.of("C", "B", "A"), run(QueryParameters.builder().sort(SortStrategy.TOP_RATED).build()));
        }

        @Test
        @DisplayName("Newest should order by creation date descending")
        void newestShouldOrderByCreationDate() {
            assertEquals(List.of("A", "C", "B"), run(QueryParameters.builder().sort(SortStrategy.NEWEST).build()));
        }

        @Test
        @DisplayName("HotNow should put recent records first, then older ones by popularity")
        void hotNowShouldPreferRecentRecords() {
            final var old = AgentRecord.builder("D")
                    .name("Delta")
                    .createdAt(NOW.minus(Duration.ofDays(30)))
                    .popularity(500)
                    .build();
            final var undated = AgentRecord.builder("E").name("Epsilon").popularity(1000).build();

            final var result = ids(engine.filterAndSort(
                    List.of(undated, old, b, c, a), QueryParameters.builder().sort(SortStrategy.HOT_NOW).build()));

            assertEquals(List.of("A", "C", "D", "B", "E"), result);
        }

        @Test
        @DisplayName("no sort should keep store order")
        void noSortShouldKeepStoreOrder() {
            assertEquals(
                    List.of("C", "A", "B"),
                    ids(engine.filterAndSort(List.of(c, a, b), QueryParameters.defaults())));
        }
    }

    @Nested
    @DisplayName("filtering")
    class FilteringTests {

        @Test
        @DisplayName("should apply price bounds inclusively")
        void shouldApplyPriceBoundsInclusively() {
            assertEquals(List.of("B", "C"), run(QueryParameters.builder().priceMin(5.0).priceMax(10.0).build()));
        }

        @Test
        @DisplayName("should combine filters with the sort")
        void shouldCombineFiltersWithSort() {
            final var params = QueryParameters.builder()
                    .ratingMin(4.6)
                    .sort(SortStrategy.NEWEST)
                    .build();

            assertEquals(List.of("C", "B"), run(params));
        }

        @Test
        @DisplayName("should give the same result for every ordering of the six filter stages")
        void shouldBeIndependentOfStageOrder() {
            final var records = randomCatalog(new Random(20240601L), 300);
            final var params = QueryParameters.builder()
                    .sort(SortStrategy.FREE)
                    .priceMin(0.0)
                    .priceMax(15.0)
                    .ratingMin(1.0)
                    .tags("writing", "code", "tools")
                    .features("api", "free", "offline")
                    .searchTerm("er")
                    .build();
            final var stages = AgentFilters.stagesFor(params);
            final var expected = ids(engine.filterAndSort(records, params));
            final var orderings = permutations(stages.size());

            assertEquals(6, stages.size());
            assertEquals(720, orderings.size());
            assertTrue(expected.contains("seed"));
            assertTrue(expected.size() < records.size());
            for (List<Integer> ordering : orderings) {
                List<AgentRecord> remaining = records;
                for (int index : ordering) {
                    final var stage = stages.get(index);
                    remaining = remaining.stream().filter(stage).toList();
                }
                assertEquals(expected, ids(remaining), "stage order " + ordering);
            }
        }
    }

    @Nested
    @DisplayName("execute()")
    class ExecuteTests {

        @Test
        @DisplayName("should page the sorted result")
        void shouldPageSortedResult() {
            final var params = QueryParameters.builder()
                    .sort(SortStrategy.NEWEST)
                    .page(2)
                    .limit(2)
                    .build();

            final var page = engine.execute(List.of(a, b, c), params);

            assertEquals(List.of("B"), ids(page.items()));
            assertEquals(3, page.total());
            assertEquals(2, page.totalPages());
        }
    }

    @Test
    @DisplayName("featured() should return featured records newest first up to the limit")
    void featuredShouldReturnNewestFirst() {
        final var f1 = b.toBuilder().featured(true).build();
        final var f2 = c.toBuilder().featured(true).build();
        final var f3 = a.toBuilder().featured(true).build();

        final var result = engine.featured(List.of(f1, a, f2, f3), 2);

        assertEquals(List.of("A", "C"), ids(result));
        assertTrue(engine.featured(List.of(a, b), 5).isEmpty());
    }
}
