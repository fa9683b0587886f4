package bazaar.adapter.in.rest;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;

import io.smallrye.mutiny.Uni;

import bazaar.adapter.in.dto.CountResponse;
import bazaar.adapter.in.dto.LikeStatusResponse;
import bazaar.adapter.in.dto.ReviewRequest;
import bazaar.adapter.in.problem.CatalogProblem;
import bazaar.core.config.QueryConfig;
import bazaar.core.model.catalog.AgentPatch;
import bazaar.core.model.catalog.AgentRecord;
import bazaar.core.model.catalog.Creator;
import bazaar.core.model.catalog.PagedResult;
import bazaar.core.model.catalog.QueryParameters;
import bazaar.core.port.in.AgentMutationUseCase;
import bazaar.core.port.in.CatalogQueryUseCase;

/**
 * REST resource for catalog reads and writes.
 *
 * <p>Authentication happens upstream. The caller's identity arrives in the
 * {@code X-User-Id}, {@code X-User-Name} and {@code X-User-Role} headers; write
 * endpoints that act on behalf of a user require {@code X-User-Id}.
 */
@Path("/agents")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AgentResource {

    static final String USER_ID_HEADER = "X-User-Id";
    static final String USER_NAME_HEADER = "X-User-Name";
    static final String USER_ROLE_HEADER = "X-User-Role";
    static final String ADMIN_ROLE = "admin";

    private final CatalogQueryUseCase catalog;
    private final AgentMutationUseCase mutations;
    private final QueryConfig queryConfig;

    @Inject
    public AgentResource(CatalogQueryUseCase catalog, AgentMutationUseCase mutations, QueryConfig queryConfig) {
        this.catalog = catalog;
        this.mutations = mutations;
        this.queryConfig = queryConfig;
    }

    /**
     * Filtered, sorted, paginated listing.
     *
     * <p>Accepts {@code category}, {@code sort} (alias {@code filter}), {@code priceMin}, {@code priceMax},
     * {@code ratingMin} (alias {@code minRating}), {@code tags}, {@code features},
     * {@code search} (alias {@code searchQuery}), {@code page} and {@code limit}.
     * Malformed values are coerced rather than rejected.
     */
    @GET
    public Uni<PagedResult<AgentRecord>> listAgents(@Context UriInfo uriInfo) {
        final QueryParameters params = QueryParameters.fromRaw(
                uriInfo.getQueryParameters(), queryConfig.defaultLimit(), queryConfig.maxLimit());
        return catalog.listAgents(params);
    }

    @GET
    @Path("/count")
    public Uni<CountResponse> countAgents(
            @QueryParam("category") @DefaultValue(QueryParameters.ALL_CATEGORIES) String category) {
        return catalog.countAgents(category).map(count -> new CountResponse(category, count));
    }

    @GET
    @Path("/featured")
    public Uni<List<AgentRecord>> listFeatured(@QueryParam("limit") Integer limit) {
        final int effective = limit == null || limit < 1
                ? queryConfig.featuredLimit()
                : Math.min(limit, queryConfig.maxLimit());
        return catalog.listFeatured(effective);
    }

    /**
     * Like status of the caller for several agents.
     *
     * @param ids comma-separated agent ids
     */
    @GET
    @Path("/likes")
    public Uni<Map<String, Boolean>> likeStatus(
            @QueryParam("ids") String ids, @HeaderParam(USER_ID_HEADER) String userId) {
        requireUser(userId);
        final List<String> agentIds = ids == null
                ? List.of()
                : Arrays.stream(ids.split(","))
                        .map(String::trim)
                        .filter(id -> !id.isEmpty())
                        .toList();
        return catalog.isLikedBy(agentIds, userId);
    }

    @GET
    @Path("/{id}")
    public Uni<AgentRecord> getAgent(
            @PathParam("id") String agentId, @QueryParam("skipCache") @DefaultValue("false") boolean skipCache) {
        return catalog.getAgentDetail(agentId, skipCache);
    }

    @POST
    public Uni<Response> createAgent(
            AgentPatch patch,
            @HeaderParam(USER_ID_HEADER) String userId,
            @HeaderParam(USER_NAME_HEADER) String userName) {
        if (patch == null) {
            throw CatalogProblem.badRequest("Request body is required");
        }
        final Creator actor = userId == null || userId.isBlank() ? null : new Creator(userId, userName, null);
        return mutations.create(patch, actor)
                .map(created -> Response.status(Response.Status.CREATED).entity(created).build());
    }

    /**
     * Partial update. Only fields present in the body change.
     */
    @PATCH
    @Path("/{id}")
    public Uni<AgentRecord> updateAgent(@PathParam("id") String agentId, AgentPatch patch) {
        if (patch == null) {
            throw CatalogProblem.badRequest("Request body is required");
        }
        return mutations.update(agentId, patch);
    }

    @DELETE
    @Path("/{id}")
    public Uni<Response> deleteAgent(@PathParam("id") String agentId) {
        return mutations.delete(agentId).map(ignored -> Response.noContent().build());
    }

    @POST
    @Path("/{id}/like")
    public Uni<LikeStatusResponse> toggleLike(
            @PathParam("id") String agentId, @HeaderParam(USER_ID_HEADER) String userId) {
        requireUser(userId);
        return mutations.toggleLike(agentId, userId).map(liked -> new LikeStatusResponse(agentId, liked));
    }

    @POST
    @Path("/{id}/reviews")
    public Uni<Response> addReview(
            @PathParam("id") String agentId,
            ReviewRequest request,
            @HeaderParam(USER_ID_HEADER) String userId,
            @HeaderParam(USER_NAME_HEADER) String userName) {
        requireUser(userId);
        if (request == null || request.rating() == null) {
            throw CatalogProblem.badRequest("rating is required");
        }
        final String name = request.userName() != null ? request.userName() : userName;
        return mutations.addReview(agentId, userId, name, request.rating(), request.content())
                .map(updated -> Response.status(Response.Status.CREATED).entity(updated).build());
    }

    @DELETE
    @Path("/{id}/reviews/{reviewId}")
    public Uni<AgentRecord> removeReview(
            @PathParam("id") String agentId,
            @PathParam("reviewId") String reviewId,
            @HeaderParam(USER_ID_HEADER) String userId,
            @HeaderParam(USER_ROLE_HEADER) String role) {
        requireUser(userId);
        return mutations.removeReview(agentId, reviewId, userId, ADMIN_ROLE.equalsIgnoreCase(role));
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw CatalogProblem.unauthorized(USER_ID_HEADER + " header is required");
        }
    }
}
