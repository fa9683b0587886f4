package bazaar.core.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import bazaar.adapter.out.cache.memory.InMemoryCacheStore;
import bazaar.core.model.catalog.AgentRecord;
import bazaar.core.model.catalog.PagedResult;
import bazaar.core.port.out.CacheMetrics;
import bazaar.core.port.out.CacheStore;

@DisplayName("ResilientCache")
@ExtendWith(MockitoExtension.class)
class ResilientCacheTest {

    private static final Duration TIMEOUT = Duration.ofMillis(200);
    private static final String DETAIL_KEY = "agents:detail:a1";

    @Mock
    private CacheMetrics metrics;

    private CacheAvailability availability;

    @BeforeEach
    void setUp() {
        availability = new CacheAvailability(3);
    }

    @Nested
    @DisplayName("with a healthy store")
    class HealthyStoreTests {

        private InMemoryCacheStore store;
        private ResilientCache cache;

        @BeforeEach
        void setUp() {
            store = new InMemoryCacheStore();
            cache = new ResilientCache(store, TtlPolicy.defaults(), TIMEOUT, metrics, availability);
        }

        @Test
        @DisplayName("should return a written page and count a hit")
        void shouldReturnWrittenPage() {
            final var record = AgentRecord.builder("a1").name("Writer").category("Tools").build();
            final var page = PagedResult.slice(List.of(record), 1, 20);
            final var key = "agents:list:category:Tools:limit:20:page:1";

            assertTrue(cache.set(key, page).await().indefinitely());
            final var cached = cache.get(key, new TypeReference<PagedResult<AgentRecord>>() {})
                    .await()
                    .indefinitely();

            assertEquals("Writer", cached.orElseThrow().items().get(0).name());
            assertEquals(1, cached.get().total());
            verify(metrics).recordHit("agents:list");
        }

        @Test
        @DisplayName("should count a miss for an absent key")
        void shouldCountMiss() {
            final var cached = cache.get(DETAIL_KEY, AgentRecord.class).await().indefinitely();

            assertFalse(cached.isPresent());
            verify(metrics).recordMiss("agents:detail");
        }

        @Test
        @DisplayName("should discard entries that no longer deserialize")
        void shouldDiscardUndecodableEntries() {
            store.set(DETAIL_KEY, "{not json", Duration.ofMinutes(1)).await().indefinitely();

            final var cached = cache.get(DETAIL_KEY, AgentRecord.class).await().indefinitely();

            assertFalse(cached.isPresent());
            verify(metrics).recordFailure("deserialize");
        }

        @Test
        @DisplayName("should delete keys matching a pattern and leave others")
        void shouldDeleteByPattern() {
            cache.set("agents:list:category:Tools:limit:20:page:1", 1).await().indefinitely();
            cache.set("agents:list:category:Tools:limit:20:page:2", 2).await().indefinitely();
            cache.set("agents:list:category:Games:limit:20:page:1", 3).await().indefinitely();

            final var removed = cache.deleteByPattern("agents:list:category:Tools:*").await().indefinitely();

            assertEquals(2L, removed);
            assertTrue(cache.get("agents:list:category:Games:limit:20:page:1", Integer.class)
                    .await()
                    .indefinitely()
                    .isPresent());
        }

        @Test
        @DisplayName("should read several keys and omit missing ones")
        void shouldGetMany() {
            cache.set("user:u1:agent:a1:like", true).await().indefinitely();

            final Map<String, Boolean> values = cache.getMany(
                            List.of("user:u1:agent:a1:like", "user:u1:agent:a2:like"), Boolean.class)
                    .await()
                    .indefinitely();

            assertEquals(Map.of("user:u1:agent:a1:like", true), values);
        }

        @Test
        @DisplayName("should skip reads and writes while unavailable")
        void shouldBypassWhileUnavailable() {
            cache.set(DETAIL_KEY, "value").await().indefinitely();
            availability.markUnavailable("probe failed");

            assertFalse(cache.set(DETAIL_KEY, "other").await().indefinitely());
            assertFalse(cache.get(DETAIL_KEY, String.class).await().indefinitely().isPresent());

            availability.markAvailable();
            assertEquals("value", cache.get(DETAIL_KEY, String.class).await().indefinitely().orElseThrow());
        }
    }

    @Nested
    @DisplayName("with a failing store")
    class FailingStoreTests {

        private CacheStore store;
        private ResilientCache cache;

        @BeforeEach
        void setUp() {
            store = mock(CacheStore.class);
            cache = new ResilientCache(store, TtlPolicy.defaults(), TIMEOUT, metrics, availability);
        }

        @Test
        @DisplayName("should report a miss when the store fails")
        void shouldReportMissOnFailure() {
            when(store.get(anyString())).thenReturn(Uni.createFrom().failure(new RuntimeException("refused")));

            final var cached = cache.get(DETAIL_KEY, AgentRecord.class).await().indefinitely();

            assertFalse(cached.isPresent());
            verify(metrics).recordFailure("get");
        }

        @Test
        @DisplayName("should stop calling the store after repeated failures")
        void shouldBypassAfterRepeatedFailures() {
            when(store.get(anyString())).thenReturn(Uni.createFrom().failure(new RuntimeException("refused")));

            for (int i = 0; i < 5; i++) {
                cache.get(DETAIL_KEY, AgentRecord.class).await().indefinitely();
            }

            assertFalse(cache.isAvailable());
            verify(store, times(3)).get(DETAIL_KEY);
        }

        @Test
        @DisplayName("should report false when a write fails")
        void shouldReportFalseOnWriteFailure() {
            when(store.set(anyString(), anyString(), any()))
                    .thenReturn(Uni.createFrom().failure(new RuntimeException("refused")));

            assertFalse(cache.set(DETAIL_KEY, "value").await().indefinitely());
        }

        @Test
        @DisplayName("should remember a failed delete so the cache is flushed on recovery")
        void shouldMarkInvalidationLostOnDeleteFailure() {
            when(store.delete(anyString())).thenReturn(Uni.createFrom().failure(new RuntimeException("refused")));

            assertFalse(cache.delete(DETAIL_KEY).await().indefinitely());
            assertTrue(availability.isInvalidationLost());
        }

        @Test
        @DisplayName("should attempt deletes while unavailable")
        void shouldAttemptDeletesWhileUnavailable() {
            availability.markUnavailable("probe failed");
            when(store.delete(DETAIL_KEY)).thenReturn(Uni.createFrom().item(true));

            assertTrue(cache.delete(DETAIL_KEY).await().indefinitely());
            verify(store).delete(DETAIL_KEY);
            verify(store, never()).get(anyString());
        }

        @Test
        @DisplayName("should report an unreadable index as empty")
        void shouldReportUnreadableIndexAsEmpty() {
            when(store.members(anyString())).thenReturn(Uni.createFrom().failure(new RuntimeException("refused")));

            assertFalse(cache.indexMembers("idx:category:Tools").await().indefinitely().isPresent());
        }
    }
}
