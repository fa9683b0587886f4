package bazaar.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import bazaar.core.service.catalog.AgentNotFoundException;
import bazaar.core.service.catalog.CatalogUnavailableException;
import bazaar.core.service.catalog.DuplicateReviewException;
import bazaar.core.service.catalog.ReviewNotFoundException;
import bazaar.core.service.catalog.ReviewNotPermittedException;

/**
 * Maps catalog exceptions to RFC 7807 Problem Details.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapAgentNotFound(AgentNotFoundException e) {
        LOG.debugv("Agent not found: {0}", e.getAgentId());
        return toResponse(CatalogProblem.agentNotFound(e.getAgentId()));
    }

    @ServerExceptionMapper
    public Response mapCatalogUnavailable(CatalogUnavailableException e) {
        LOG.warnv("Catalog store unavailable during {0}: {1}", e.getOperation(), e.getMessage());
        return toResponse(CatalogProblem.catalogUnavailable(e.getOperation()));
    }

    @ServerExceptionMapper
    public Response mapDuplicateReview(DuplicateReviewException e) {
        return toResponse(CatalogProblem.conflict(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapReviewNotFound(ReviewNotFoundException e) {
        return toResponse(CatalogProblem.notFound(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapReviewNotPermitted(ReviewNotPermittedException e) {
        return toResponse(CatalogProblem.forbidden(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(CatalogProblem.badRequest(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
