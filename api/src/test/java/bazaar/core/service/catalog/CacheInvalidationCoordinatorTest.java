package bazaar.core.service.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.List;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import bazaar.adapter.out.cache.memory.InMemoryCacheStore;
import bazaar.core.cache.CacheAvailability;
import bazaar.core.cache.CacheKeyBuilder;
import bazaar.core.cache.ResilientCache;
import bazaar.core.cache.TtlPolicy;
import bazaar.core.config.CacheConfig.InvalidationMode;
import bazaar.core.model.catalog.AgentMutation;
import bazaar.core.model.catalog.AgentRecord;
import bazaar.core.model.catalog.QueryParameters;
import bazaar.core.port.out.CacheMetrics;
import bazaar.core.port.out.CacheStore;

@DisplayName("CacheInvalidationCoordinator")
@ExtendWith(MockitoExtension.class)
class CacheInvalidationCoordinatorTest {

    private static final Duration TIMEOUT = Duration.ofMillis(200);

    @Mock
    private CacheMetrics metrics;

    private final CacheKeyBuilder keys = new CacheKeyBuilder(6, 256);
    private InMemoryCacheStore store;
    private ResilientCache cache;

    @BeforeEach
    void setUp() {
        store = new InMemoryCacheStore();
        cache = new ResilientCache(store, TtlPolicy.defaults(), TIMEOUT, CacheMetrics.NOOP, new CacheAvailability(3));
    }

    private String listing(String category, int page) {
        return keys.listingKey(QueryParameters.builder().category(category).page(page).build());
    }

    private void seed(String... cacheKeys) {
        for (String key : cacheKeys) {
            cache.set(key, "x").await().indefinitely();
        }
    }

    private boolean cached(String key) {
        return store.get(key).await().indefinitely() != null;
    }

    @Nested
    @DisplayName("pattern mode")
    class PatternModeTests {

        private CacheInvalidationCoordinator coordinator;

        @BeforeEach
        void setUp() {
            coordinator = new CacheInvalidationCoordinator(cache, keys, InvalidationMode.PATTERN, metrics);
        }

        @Test
        @DisplayName("should remove every view a category move made stale")
        void shouldRemoveStaleViewsOnCategoryMove() {
            seed(
                    keys.detailKey("a1"),
                    listing("Tools", 1),
                    listing("Tools", 2),
                    listing("Games", 1),
                    listing("All", 1),
                    listing("Music", 1),
                    keys.countKey("Tools"),
                    keys.countKey("Music"),
                    keys.featuredKey(8),
                    keys.userAgentKey("u1", "a1"),
                    keys.userAgentKey("u1", "a9"));
            final var before = AgentRecord.builder("a1").name("A").category("Tools").build();
            final var after = before.toBuilder().category("Games").build();

            final var removed = coordinator.onAgentMutated(AgentMutation.updated(before, after))
                    .await()
                    .indefinitely();

            assertEquals(8L, removed);
            assertTrue(cached(listing("Music", 1)));
            assertTrue(cached(keys.countKey("Music")));
            assertTrue(cached(keys.userAgentKey("u1", "a9")));
            assertFalse(cached(listing("Tools", 2)));
            assertFalse(cached(keys.featuredKey(8)));
            verify(metrics).recordInvalidation("mutation", 8L);
        }

        @Test
        @DisplayName("should not write index sets")
        void shouldNotWriteIndexSets() {
            coordinator.track("Tools", listing("Tools", 1)).await().indefinitely();

            assertTrue(store.members(keys.indexKey("Tools")).await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should drop a category and the All views")
        void shouldInvalidateCategory() {
            seed(listing("Tools", 1), listing("All", 1), listing("Games", 1), keys.countKey("All"));

            final var removed = coordinator.invalidateCategory("Tools").await().indefinitely();

            assertEquals(3L, removed);
            assertTrue(cached(listing("Games", 1)));
        }

        @Test
        @DisplayName("should drop all listings when invalidating one record")
        void shouldInvalidateAgent() {
            seed(keys.detailKey("a1"), keys.detailKey("a2"), listing("Games", 1), keys.userAgentKey("u1", "a1"));

            final var removed = coordinator.invalidateAgent("a1").await().indefinitely();

            assertEquals(3L, removed);
            assertTrue(cached(keys.detailKey("a2")));
        }

        @Test
        @DisplayName("should flush every catalog key")
        void shouldInvalidateAll() {
            seed(keys.detailKey("a1"), listing("Games", 1), keys.userAgentKey("u1", "a1"), "external:other");

            final var removed = coordinator.invalidateAll().await().indefinitely();

            assertEquals(3L, removed);
            assertTrue(cached("external:other"));
        }
    }

    @Nested
    @DisplayName("indexed mode")
    class IndexedModeTests {

        private CacheInvalidationCoordinator coordinator;

        @BeforeEach
        void setUp() {
            coordinator = new CacheInvalidationCoordinator(cache, keys, InvalidationMode.INDEXED, metrics);
        }

        @Test
        @DisplayName("should delete the keys recorded in the category index")
        void shouldDeleteIndexedKeys() {
            seed(listing("Tools", 1), listing("Tools", 2), listing("Games", 1));
            coordinator.track("Tools", listing("Tools", 1)).await().indefinitely();
            coordinator.track("Tools", listing("Tools", 2)).await().indefinitely();

            coordinator.invalidateCategory("Tools").await().indefinitely();

            assertFalse(cached(listing("Tools", 1)));
            assertFalse(cached(listing("Tools", 2)));
            assertTrue(cached(listing("Games", 1)));
            assertTrue(store.members(keys.indexKey("Tools")).await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should scan by pattern when the category index is missing")
        void shouldScanWhenIndexMissing() {
            seed(listing("Tools", 1), listing("Games", 1));
            final var record = AgentRecord.builder("a1").name("A").category("Tools").build();

            coordinator.onAgentMutated(AgentMutation.of(AgentMutation.Type.CREATED, record))
                    .await()
                    .indefinitely();

            assertFalse(cached(listing("Tools", 1)));
            assertTrue(cached(listing("Games", 1)));
        }

        @Test
        @DisplayName("should scan by pattern when the index cannot be read")
        void shouldFallBackToPatternScan() {
            final var failing = mock(CacheStore.class);
            final var toolsPattern = keys.categoryPatterns("Tools").get(0);
            lenient().when(failing.delete(anyString())).thenReturn(Uni.createFrom().item(true));
            lenient().when(failing.keys(anyString())).thenReturn(Uni.createFrom().item(List.of()));
            lenient().when(failing.keys(toolsPattern)).thenReturn(Uni.createFrom().item(List.of("k1")));
            lenient().when(failing.deleteAll(any())).thenReturn(Uni.createFrom().item(1L));
            lenient().when(failing.members(anyString()))
                    .thenReturn(Uni.createFrom().failure(new RuntimeException("refused")));
            final var failingCache = new ResilientCache(
                    failing, TtlPolicy.defaults(), TIMEOUT, CacheMetrics.NOOP, new CacheAvailability(10));
            final var indexed =
                    new CacheInvalidationCoordinator(failingCache, keys, InvalidationMode.INDEXED, metrics);
            final var record = AgentRecord.builder("a1").name("A").category("Tools").build();

            indexed.onAgentMutated(AgentMutation.of(AgentMutation.Type.DELETED, record))
                    .await()
                    .indefinitely();

            final var order = inOrder(failing);
            order.verify(failing).delete(keys.detailKey("a1"));
            order.verify(failing).members(keys.indexKey("Tools"));
            order.verify(failing).keys(toolsPattern);
            order.verify(failing).deleteAll(List.of("k1"));
        }
    }
}
