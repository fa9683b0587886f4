package bazaar.core.service.catalog;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.type.TypeReference;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bazaar.core.cache.CacheKeyBuilder;
import bazaar.core.cache.CacheWrite;
import bazaar.core.cache.ResilientCache;
import bazaar.core.config.ResiliencyConfig;
import bazaar.core.model.catalog.AgentRecord;
import bazaar.core.model.catalog.PagedResult;
import bazaar.core.model.catalog.QueryParameters;
import bazaar.core.port.in.CatalogQueryUseCase;
import bazaar.core.port.out.CatalogStore;

/**
 * Cache-aside catalog reads.
 *
 * <p>Every read checks the cache first. On a miss the store is queried, with
 * only the category pushed down, the in-memory pipeline produces the result and
 * the result is written back under the TTL of its key's namespace. Store calls
 * are bounded by the catalog query timeout; a timeout or store failure surfaces
 * as {@link CatalogUnavailableException}. Cache trouble only costs latency.
 */
@ApplicationScoped
public class AgentCatalogService implements CatalogQueryUseCase {

    private static final Logger LOG = Logger.getLogger(AgentCatalogService.class);

    static final String CATEGORY_FIELD = "category";

    private static final TypeReference<PagedResult<AgentRecord>> PAGE_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<AgentRecord>> LIST_TYPE = new TypeReference<>() {};

    private final CatalogStore store;
    private final ResilientCache cache;
    private final CacheKeyBuilder keys;
    private final AgentQueryEngine engine;
    private final CacheInvalidationCoordinator coordinator;
    private final Duration queryTimeout;

    @Inject
    public AgentCatalogService(
            CatalogStore store,
            ResilientCache cache,
            CacheKeyBuilder keys,
            AgentQueryEngine engine,
            CacheInvalidationCoordinator coordinator,
            ResiliencyConfig resiliencyConfig) {
        this(store, cache, keys, engine, coordinator, resiliencyConfig.catalog().queryTimeout());
    }

    public AgentCatalogService(
            CatalogStore store,
            ResilientCache cache,
            CacheKeyBuilder keys,
            AgentQueryEngine engine,
            CacheInvalidationCoordinator coordinator,
            Duration queryTimeout) {
        this.store = store;
        this.cache = cache;
        this.keys = keys;
        this.engine = engine;
        this.coordinator = coordinator;
        this.queryTimeout = queryTimeout;
    }

    @Override
    public Uni<PagedResult<AgentRecord>> listAgents(QueryParameters params) {
        final String key = keys.listingKey(params);
        return cache.get(key, PAGE_TYPE).flatMap(cached -> {
            if (cached.isPresent()) {
                return Uni.createFrom().item(cached.get());
            }
            return loadCategory(params.category(), "listAgents")
                    .map(candidates -> engine.execute(candidates, params))
                    .call(page -> cache.set(key, page).flatMap(written -> written
                            ? coordinator.track(params.category(), key)
                            : Uni.createFrom().voidItem()));
        });
    }

    @Override
    public Uni<AgentRecord> getAgentDetail(String agentId, boolean skipCache) {
        final String key = keys.detailKey(agentId);
        final Uni<Optional<AgentRecord>> cached = skipCache
                ? Uni.createFrom().item(Optional.<AgentRecord>empty())
                : cache.get(key, AgentRecord.class);
        return cached.flatMap(hit -> {
            if (hit.isPresent()) {
                return Uni.createFrom().item(hit.get());
            }
            if (skipCache) {
                LOG.debugv("Skipping cache for agent {0}", agentId);
            }
            return guarded(store.getById(agentId), "getAgentDetail")
                    .map(found -> found.orElseThrow(() -> new AgentNotFoundException(agentId)))
                    .call(record -> cache.set(key, record));
        });
    }

    @Override
    public Uni<Integer> countAgents(String category) {
        final String effective = QueryParameters.normalizeCategory(category);
        final String key = keys.countKey(effective);
        return cache.get(key, Integer.class).flatMap(cached -> {
            if (cached.isPresent()) {
                return Uni.createFrom().item(cached.get());
            }
            return loadCategory(effective, "countAgents")
                    .map(List::size)
                    .call(count -> cache.set(key, count));
        });
    }

    @Override
    public Uni<List<AgentRecord>> listFeatured(int limit) {
        final String key = keys.featuredKey(limit);
        return cache.get(key, LIST_TYPE).flatMap(cached -> {
            if (cached.isPresent()) {
                return Uni.createFrom().item(cached.get());
            }
            return guarded(store.findAll(), "listFeatured")
                    .map(all -> engine.featured(all, limit))
                    .call(featured -> cache.set(key, featured));
        });
    }

    @Override
    public Uni<Map<String, Boolean>> isLikedBy(Collection<String> agentIds, String userId) {
        final List<String> ids = new ArrayList<>(new LinkedHashSet<>(agentIds));
        if (ids.isEmpty()) {
            return Uni.createFrom().item(Map.of());
        }
        final Map<String, String> keyById = new LinkedHashMap<>();
        ids.forEach(id -> keyById.put(id, keys.userAgentKey(userId, id)));

        return cache.getMany(keyById.values(), Boolean.class).flatMap(cached -> {
            final List<String> missing = ids.stream()
                    .filter(id -> !cached.containsKey(keyById.get(id)))
                    .toList();
            return loadLikes(missing, userId).call(loaded -> cache.setMany(loaded.entrySet().stream()
                            .map(e -> CacheWrite.of(keyById.get(e.getKey()), e.getValue()))
                            .toList()))
                    .map(loaded -> {
                        final Map<String, Boolean> result = new LinkedHashMap<>();
                        for (String id : ids) {
                            final Boolean hit = cached.get(keyById.get(id));
                            result.put(id, hit != null ? hit : loaded.getOrDefault(id, false));
                        }
                        return result;
                    });
        });
    }

    private Uni<Map<String, Boolean>> loadLikes(List<String> agentIds, String userId) {
        if (agentIds.isEmpty()) {
            return Uni.createFrom().item(Map.of());
        }
        final List<Uni<Optional<AgentRecord>>> lookups = agentIds.stream()
                .map(id -> guarded(store.getById(id), "isLikedBy"))
                .toList();
        return Uni.join().all(lookups).andFailFast().map(records -> {
            final Map<String, Boolean> likes = new LinkedHashMap<>();
            for (int i = 0; i < agentIds.size(); i++) {
                final Optional<AgentRecord> record = records.get(i);
                if (record.isPresent()) {
                    likes.put(agentIds.get(i), record.get().likes().contains(userId));
                }
            }
            return likes;
        });
    }

    private Uni<List<AgentRecord>> loadCategory(String category, String operation) {
        if (QueryParameters.ALL_CATEGORIES.equalsIgnoreCase(category)) {
            return guarded(store.findAll(), operation);
        }
        return guarded(store.queryByEquality(CATEGORY_FIELD, category), operation);
    }

    private <T> Uni<T> guarded(Uni<T> operation, String operationName) {
        return CatalogCalls.guarded(operation, operationName, queryTimeout);
    }
}
