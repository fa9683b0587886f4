package bazaar.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for catalog errors.
 */
public final class CatalogProblem {

    private CatalogProblem() {
        // Utility class - prevent instantiation
    }

    public static HttpProblem agentNotFound(String agentId) {
        return HttpProblem.builder()
                .withTitle("Agent Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail("Agent '%s' does not exist".formatted(agentId))
                .build();
    }

    public static HttpProblem notFound(String detail) {
        return HttpProblem.builder()
                .withTitle("Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem unauthorized(String detail) {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem forbidden(String detail) {
        return HttpProblem.builder()
                .withTitle("Forbidden")
                .withStatus(Status.FORBIDDEN)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem conflict(String detail) {
        return HttpProblem.builder()
                .withTitle("Conflict")
                .withStatus(Status.CONFLICT)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem catalogUnavailable(String operation) {
        return HttpProblem.builder()
                .withTitle("Catalog Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail("The catalog store could not complete '%s'".formatted(operation))
                .build();
    }
}
