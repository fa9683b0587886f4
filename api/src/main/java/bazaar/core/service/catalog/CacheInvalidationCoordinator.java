package bazaar.core.service.catalog;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bazaar.core.cache.CacheKeyBuilder;
import bazaar.core.cache.CacheNamespace;
import bazaar.core.cache.ResilientCache;
import bazaar.core.config.CacheConfig;
import bazaar.core.config.CacheConfig.InvalidationMode;
import bazaar.core.model.catalog.AgentMutation;
import bazaar.core.model.catalog.QueryParameters;
import bazaar.core.port.in.CacheInvalidationUseCase;
import bazaar.core.port.out.CacheMetrics;

/**
 * Removes cached views made stale by catalog writes.
 *
 * <p>For a mutation the steps run in order:
 * <ol>
 *   <li>the record's detail key</li>
 *   <li>listing, search and category keys of the old and new category and of
 *       {@code All}, plus their count keys and every featured list</li>
 *   <li>per-user keys derived from the record</li>
 * </ol>
 *
 * <p>In {@link InvalidationMode#INDEXED} mode category keys come from the
 * per-category index set written alongside each listing; when the index is
 * missing, empty or unreadable the glob scan is used instead.
 */
@ApplicationScoped
public class CacheInvalidationCoordinator implements CacheInvalidationUseCase {

    private static final Logger LOG = Logger.getLogger(CacheInvalidationCoordinator.class);

    private final ResilientCache cache;
    private final CacheKeyBuilder keys;
    private final InvalidationMode mode;
    private final CacheMetrics metrics;

    @Inject
    public CacheInvalidationCoordinator(
            ResilientCache cache, CacheKeyBuilder keys, CacheConfig config, CacheMetrics metrics) {
        this(cache, keys, config.invalidation().mode(), metrics);
    }

    public CacheInvalidationCoordinator(
            ResilientCache cache, CacheKeyBuilder keys, InvalidationMode mode, CacheMetrics metrics) {
        this.cache = cache;
        this.keys = keys;
        this.mode = mode;
        this.metrics = metrics != null ? metrics : CacheMetrics.NOOP;
    }

    public InvalidationMode mode() {
        return mode;
    }

    /**
     * Invalidate everything a mutation may have made stale.
     *
     * @param mutation the completed write
     * @return number of keys removed
     */
    public Uni<Long> onAgentMutated(AgentMutation mutation) {
        final Set<String> categories = new LinkedHashSet<>(mutation.affectedCategories());
        categories.add(QueryParameters.ALL_CATEGORIES);

        final List<Supplier<Uni<Long>>> steps = new ArrayList<>();
        steps.add(() -> deleteKey(keys.detailKey(mutation.agentId())));
        for (String category : categories) {
            steps.add(() -> categoryKeys(category));
            steps.add(() -> deleteKey(keys.countKey(category)));
        }
        steps.add(() -> cache.deleteByPattern(keys.featuredPattern()));
        steps.add(() -> cache.deleteByPattern(keys.userAgentPattern(mutation.agentId())));

        return inSequence(steps).invoke(removed -> {
            LOG.debugv("Invalidated {0} keys after {1} of {2}", removed, mutation.type(), mutation.agentId());
            metrics.recordInvalidation("mutation", removed);
        });
    }

    /**
     * Record a listing key in its category index. No-op in pattern mode.
     *
     * <p>A key that cannot be indexed would never be invalidated, so it is
     * deleted again.
     *
     * @param category listing category
     * @param key      cache key just written
     */
    public Uni<Void> track(String category, String key) {
        if (mode != InvalidationMode.INDEXED) {
            return Uni.createFrom().voidItem();
        }
        return cache.addToIndex(keys.indexKey(category), key).flatMap(indexed -> {
            if (indexed) {
                return Uni.createFrom().voidItem();
            }
            LOG.debugv("Could not index {0}, dropping it", key);
            return cache.delete(key).replaceWithVoid();
        });
    }

    /**
     * Drop one record's detail and derived keys plus every listing, since the
     * record's category is not known here.
     */
    @Override
    public Uni<Long> invalidateAgent(String agentId) {
        final List<Supplier<Uni<Long>>> steps = List.of(
                () -> deleteKey(keys.detailKey(agentId)),
                () -> cache.deleteByPattern(CacheNamespace.AGENTS_LIST.prefix() + ":*"),
                () -> cache.deleteByPattern(CacheNamespace.AGENTS_SEARCH.prefix() + ":*"),
                () -> cache.deleteByPattern(CacheNamespace.AGENTS_CATEGORY.prefix() + ":*"),
                () -> cache.deleteByPattern(CacheNamespace.AGENTS_COUNT.prefix() + ":*"),
                () -> cache.deleteByPattern(keys.featuredPattern()),
                () -> cache.deleteByPattern(keys.userAgentPattern(agentId)));
        return inSequence(steps).invoke(removed -> {
            LOG.infof("Invalidated %d keys for agent %s", removed, agentId);
            metrics.recordInvalidation("agent", removed);
        });
    }

    @Override
    public Uni<Long> invalidateCategory(String requested) {
        final String category = QueryParameters.normalizeCategory(requested);
        final List<Supplier<Uni<Long>>> steps = List.of(
                () -> categoryKeys(category),
                () -> deleteKey(keys.countKey(category)),
                () -> categoryKeys(QueryParameters.ALL_CATEGORIES),
                () -> deleteKey(keys.countKey(QueryParameters.ALL_CATEGORIES)),
                () -> cache.deleteByPattern(keys.featuredPattern()));
        return inSequence(steps).invoke(removed -> {
            LOG.infof("Invalidated %d keys for category %s", removed, category);
            metrics.recordInvalidation("category", removed);
        });
    }

    @Override
    public Uni<Long> invalidateAll() {
        final List<Supplier<Uni<Long>>> steps = new ArrayList<>();
        for (String pattern : keys.flushPatterns()) {
            steps.add(() -> cache.deleteByPattern(pattern));
        }
        return inSequence(steps).invoke(removed -> {
            LOG.infof("Invalidated all catalog cache entries (%d keys)", removed);
            metrics.recordInvalidation("all", removed);
        });
    }

    private Uni<Long> categoryKeys(String category) {
        if (mode == InvalidationMode.INDEXED) {
            final String indexKey = keys.indexKey(category);
            return cache.indexMembers(indexKey).flatMap(members -> {
                if (members.isEmpty() || members.get().isEmpty()) {
                    LOG.debugv("Index {0} unreadable or empty, scanning category {1}", indexKey, category);
                    return categoryPatterns(category);
                }
                final Set<String> targets = new LinkedHashSet<>(members.get());
                targets.add(indexKey);
                return cache.deleteAll(targets);
            });
        }
        return categoryPatterns(category);
    }

    private Uni<Long> categoryPatterns(String category) {
        final List<Supplier<Uni<Long>>> steps = new ArrayList<>();
        for (String pattern : keys.categoryPatterns(category)) {
            steps.add(() -> cache.deleteByPattern(pattern));
        }
        return inSequence(steps);
    }

    private Uni<Long> deleteKey(String key) {
        return cache.delete(key).map(deleted -> deleted ? 1L : 0L);
    }

    private static Uni<Long> inSequence(List<Supplier<Uni<Long>>> steps) {
        Uni<Long> total = Uni.createFrom().item(0L);
        for (Supplier<Uni<Long>> step : steps) {
            total = total.flatMap(sum -> step.get().map(removed -> sum + removed));
        }
        return total;
    }
}
