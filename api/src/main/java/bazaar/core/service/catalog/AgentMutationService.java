package bazaar.core.service.catalog;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bazaar.core.config.ResiliencyConfig;
import bazaar.core.model.catalog.AgentMutation;
import bazaar.core.model.catalog.AgentPatch;
import bazaar.core.model.catalog.AgentRecord;
import bazaar.core.model.catalog.Creator;
import bazaar.core.model.catalog.Review;
import bazaar.core.port.in.AgentMutationUseCase;
import bazaar.core.port.out.CatalogStore;

/**
 * Catalog writes. Each operation saves to the store, then waits for cache
 * invalidation before emitting, so the writer reads its own write.
 */
@ApplicationScoped
public class AgentMutationService implements AgentMutationUseCase {

    private static final Logger LOG = Logger.getLogger(AgentMutationService.class);

    static final int MIN_REVIEW_LENGTH = 3;
    private static final String DEFAULT_USER_NAME = "User";

    private final CatalogStore store;
    private final CacheInvalidationCoordinator coordinator;
    private final Duration queryTimeout;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    @Inject
    public AgentMutationService(
            CatalogStore store, CacheInvalidationCoordinator coordinator, ResiliencyConfig resiliencyConfig) {
        this(
                store,
                coordinator,
                resiliencyConfig.catalog().queryTimeout(),
                Clock.systemUTC(),
                () -> UUID.randomUUID().toString());
    }

    public AgentMutationService(
            CatalogStore store,
            CacheInvalidationCoordinator coordinator,
            Duration queryTimeout,
            Clock clock,
            Supplier<String> idGenerator) {
        this.store = store;
        this.coordinator = coordinator;
        this.queryTimeout = queryTimeout;
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    @Override
    public Uni<AgentRecord> create(AgentPatch patch, Creator actor) {
        if (patch.name().filter(n -> !n.isBlank()).isEmpty()) {
            return Uni.createFrom().failure(new IllegalArgumentException("name is required"));
        }
        final AgentRecord record = AgentRecordMerger.create(idGenerator.get(), patch, actor, clock.instant());
        return save(record, "create")
                .call(saved -> coordinator.onAgentMutated(AgentMutation.of(AgentMutation.Type.CREATED, saved)))
                .invoke(saved -> LOG.infof("Created agent %s in category %s", saved.id(), saved.category()));
    }

    @Override
    public Uni<AgentRecord> update(String agentId, AgentPatch patch) {
        return load(agentId, "update").flatMap(existing -> {
            final AgentRecord merged = AgentRecordMerger.merge(existing, patch, clock.instant());
            return save(merged, "update")
                    .call(saved -> coordinator.onAgentMutated(AgentMutation.updated(existing, saved)));
        });
    }

    @Override
    public Uni<Void> delete(String agentId) {
        return load(agentId, "delete").flatMap(existing -> CatalogCalls.guarded(
                        store.delete(agentId), "delete", queryTimeout)
                .call(deleted -> coordinator.onAgentMutated(AgentMutation.of(AgentMutation.Type.DELETED, existing)))
                .invoke(deleted -> LOG.infof("Deleted agent %s", agentId))
                .replaceWithVoid());
    }

    @Override
    public Uni<Boolean> toggleLike(String agentId, String userId) {
        if (userId == null || userId.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("userId is required"));
        }
        return load(agentId, "toggleLike").flatMap(existing -> {
            final Set<String> likes = new LinkedHashSet<>(existing.likes());
            final boolean liked = likes.add(userId) || !likes.remove(userId);
            final AgentRecord updated = existing.toBuilder().likes(likes).build();
            return save(updated, "toggleLike")
                    .call(saved -> coordinator.onAgentMutated(
                            AgentMutation.of(AgentMutation.Type.LIKE_TOGGLED, saved)))
                    .replaceWith(liked);
        });
    }

    @Override
    public Uni<AgentRecord> addReview(String agentId, String userId, String userName, int rating, String content) {
        if (userId == null || userId.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("userId is required"));
        }
        if (!Review.isValidRating(rating)) {
            return Uni.createFrom().failure(new IllegalArgumentException(
                    "Rating must be between " + Review.MIN_RATING + " and " + Review.MAX_RATING));
        }
        if (content == null || content.trim().length() < MIN_REVIEW_LENGTH) {
            return Uni.createFrom().failure(new IllegalArgumentException("Review content is too short"));
        }
        return load(agentId, "addReview").flatMap(existing -> {
            if (existing.reviews().stream().anyMatch(r -> userId.equals(r.userId()))) {
                return Uni.createFrom().failure(
                        new DuplicateReviewException("User " + userId + " has already reviewed agent " + agentId));
            }
            final Instant now = clock.instant();
            final Review review = new Review(
                    userId + "_" + now.toEpochMilli(),
                    userId,
                    userName == null || userName.isBlank() ? DEFAULT_USER_NAME : userName,
                    rating,
                    content.trim(),
                    now);
            final List<Review> reviews = new ArrayList<>(existing.reviews());
            reviews.add(review);
            return save(ReviewAggregator.withReviews(existing, reviews), "addReview")
                    .call(saved -> coordinator.onAgentMutated(
                            AgentMutation.of(AgentMutation.Type.REVIEW_ADDED, saved)));
        });
    }

    @Override
    public Uni<AgentRecord> removeReview(String agentId, String reviewId, String userId, boolean admin) {
        return load(agentId, "removeReview").flatMap(existing -> {
            final Review target = existing.reviews().stream()
                    .filter(r -> reviewId.equals(r.id()))
                    .findFirst()
                    .orElse(null);
            if (target == null) {
                return Uni.createFrom().failure(
                        new ReviewNotFoundException("Review " + reviewId + " not found on agent " + agentId));
            }
            if (!admin && (userId == null || !userId.equals(target.userId()))) {
                return Uni.createFrom().failure(
                        new ReviewNotPermittedException("Not allowed to delete review " + reviewId));
            }
            final List<Review> remaining = existing.reviews().stream()
                    .filter(r -> !reviewId.equals(r.id()))
                    .toList();
            return save(ReviewAggregator.withReviews(existing, remaining), "removeReview")
                    .call(saved -> coordinator.onAgentMutated(
                            AgentMutation.of(AgentMutation.Type.REVIEW_REMOVED, saved)));
        });
    }

    private Uni<AgentRecord> load(String agentId, String operation) {
        return CatalogCalls.guarded(store.getById(agentId), operation, queryTimeout)
                .map(found -> found.orElseThrow(() -> new AgentNotFoundException(agentId)));
    }

    private Uni<AgentRecord> save(AgentRecord record, String operation) {
        return CatalogCalls.guarded(store.save(record), operation, queryTimeout);
    }
}
