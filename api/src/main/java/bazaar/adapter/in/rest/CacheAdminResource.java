package bazaar.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import bazaar.adapter.in.dto.InvalidationResponse;
import bazaar.adapter.in.dto.TtlInspectionResponse;
import bazaar.adapter.in.problem.CatalogProblem;
import bazaar.core.cache.CacheNamespace;
import bazaar.core.cache.TtlBucket;
import bazaar.core.cache.TtlPolicy;
import bazaar.core.port.in.CacheInvalidationUseCase;

/**
 * Administrative cache operations: manual invalidation and TTL inspection.
 */
@Path("/admin/cache")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class CacheAdminResource {

    private final CacheInvalidationUseCase invalidation;
    private final TtlPolicy ttlPolicy;

    @Inject
    public CacheAdminResource(CacheInvalidationUseCase invalidation, TtlPolicy ttlPolicy) {
        this.invalidation = invalidation;
        this.ttlPolicy = ttlPolicy;
    }

    @POST
    @Path("/invalidate/agent/{id}")
    public Uni<InvalidationResponse> invalidateAgent(@PathParam("id") String agentId) {
        return invalidation.invalidateAgent(agentId).map(removed -> new InvalidationResponse("agent", agentId, removed));
    }

    @POST
    @Path("/invalidate/category/{category}")
    public Uni<InvalidationResponse> invalidateCategory(@PathParam("category") String category) {
        return invalidation.invalidateCategory(category)
                .map(removed -> new InvalidationResponse("category", category, removed));
    }

    @POST
    @Path("/invalidate/all")
    public Uni<InvalidationResponse> invalidateAll() {
        return invalidation.invalidateAll().map(removed -> new InvalidationResponse("all", null, removed));
    }

    /**
     * Show which namespace and TTL a key would be written with.
     *
     * @param key cache key
     */
    @GET
    @Path("/ttl")
    public TtlInspectionResponse inspectTtl(@QueryParam("key") String key) {
        if (key == null || key.isBlank()) {
            throw CatalogProblem.badRequest("key is required");
        }
        final TtlBucket bucket = ttlPolicy.bucketFor(key);
        return new TtlInspectionResponse(
                key,
                CacheNamespace.of(key).map(CacheNamespace::prefix).orElse(null),
                bucket.name(),
                ttlPolicy.ttlFor(bucket).toSeconds());
    }
}
