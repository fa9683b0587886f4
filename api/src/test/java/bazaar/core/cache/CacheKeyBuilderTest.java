package bazaar.core.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import bazaar.core.model.catalog.QueryParameters;
import bazaar.core.model.catalog.SortStrategy;

@DisplayName("CacheKeyBuilder")
class CacheKeyBuilderTest {

    private CacheKeyBuilder keys;

    @BeforeEach
    void setUp() {
        keys = new CacheKeyBuilder(6, 256);
    }

    @Nested
    @DisplayName("listingKey()")
    class ListingKeyTests {

        @Test
        @DisplayName("should build a plain key for the default query")
        void shouldBuildPlainKeyForDefaults() {
            assertEquals("agents:list:category:All:limit:20:page:1", keys.listingKey(QueryParameters.defaults()));
        }

        @Test
        @DisplayName("should produce the same key regardless of tag order")
        void shouldBeDeterministicForTagOrder() {
            final var first = QueryParameters.builder().category("Tools").tags("b", "a").build();
            final var second = QueryParameters.builder().category("Tools").tags("a", "b").build();

            assertEquals(keys.listingKey(first), keys.listingKey(second));
            assertEquals("agents:list:category:Tools:limit:20:page:1:tags:a,b", keys.listingKey(first));
        }

        @Test
        @DisplayName("should distinguish different pages")
        void shouldDistinguishPages() {
            final var first = QueryParameters.builder().page(1).build();
            final var second = QueryParameters.builder().page(2).build();

            assertNotEquals(keys.listingKey(first), keys.listingKey(second));
        }

        @Test
        @DisplayName("should use the search namespace when a term is present")
        void shouldUseSearchNamespace() {
            final var params = QueryParameters.builder().searchTerm("Writer").build();

            final var key = keys.listingKey(params);

            assertTrue(key.startsWith("agents:search:category:All:"));
            assertTrue(key.contains(":search:writer"));
        }

        @Test
        @DisplayName("should hash the suffix but keep the category when there are many parameters")
        void shouldHashManyParameters() {
            final var params = QueryParameters.builder()
                    .category("Tools")
                    .sort(SortStrategy.TOP_RATED)
                    .priceMin(1.0)
                    .priceMax(10.0)
                    .ratingMin(3.0)
                    .tags("x")
                    .build();

            final var key = keys.listingKey(params);

            assertTrue(key.startsWith("agents:list:category:Tools:h:"));
            assertEquals("agents:list:category:Tools:h:".length() + CacheKeyBuilder.HASH_HEX_CHARS, key.length());
            assertEquals(key, keys.listingKey(params.toBuilder().build()));
        }

        @Test
        @DisplayName("should hash when the plain key would be too long")
        void shouldHashLongKeys() {
            final var shortLimit = new CacheKeyBuilder(6, 40);
            final var params = QueryParameters.builder().category("Tools").tags("averyveryverylongtag").build();

            assertTrue(shortLimit.listingKey(params).startsWith("agents:list:category:Tools:h:"));
        }

        @Test
        @DisplayName("should format numbers without trailing zeros")
        void shouldFormatNumbers() {
            final var params = QueryParameters.builder().priceMax(10.0).build();

            assertTrue(keys.listingKey(params).endsWith(":priceMax:10"));
        }
    }

    @Nested
    @DisplayName("escaping")
    class EscapingTests {

        @Test
        @DisplayName("should escape separators and wildcards")
        void shouldEscapeSpecialCharacters() {
            assertEquals("a%3Ab%2Ac%3F%5Bd%5D%25%5C", CacheKeyBuilder.escape("a:b*c?[d]%\\"));
        }

        @Test
        @DisplayName("should escape ids in detail keys")
        void shouldEscapeDetailKeys() {
            assertEquals("agents:detail:a%3Ab", keys.detailKey("a:b"));
        }

        @Test
        @DisplayName("should escape categories so globs cannot be widened")
        void shouldEscapeCategories() {
            final var params = QueryParameters.builder().category("Too*").build();

            assertTrue(keys.listingKey(params).startsWith("agents:list:category:Too%2A:"));
            assertEquals("agents:list:category:Too%2A:*", keys.categoryPatterns("Too*").get(0));
        }
    }

    @Nested
    @DisplayName("fixed keys and patterns")
    class FixedKeyTests {

        @Test
        @DisplayName("should build count, featured and user keys")
        void shouldBuildFixedKeys() {
            assertEquals("agents:count:category:Tools", keys.countKey("Tools"));
            assertEquals("agents:count:category:All", keys.countKey(null));
            assertEquals("agents:featured:limit:8", keys.featuredKey(8));
            assertEquals("user:u1:agent:a1:like", keys.userAgentKey("u1", "a1"));
            assertEquals("user:*:agent:a1:*", keys.userAgentPattern("a1"));
            assertEquals("idx:category:Tools", keys.indexKey("Tools"));
        }

        @Test
        @DisplayName("should cover every category-scoped namespace")
        void shouldCoverCategoryNamespaces() {
            assertEquals(
                    List.of(
                            "agents:list:category:Tools:*",
                            "agents:search:category:Tools:*",
                            "agents:category:category:Tools:*"),
                    keys.categoryPatterns("Tools"));
        }

        @Test
        @DisplayName("should flush agents, user and index keys")
        void shouldListFlushPatterns() {
            assertEquals(List.of("agents:*", "user:*", "idx:*"), keys.flushPatterns());
        }
    }
}
