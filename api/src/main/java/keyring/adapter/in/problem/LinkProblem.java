package keyring.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for keyring errors.
 *
 * <p>Provides static factory methods that create {@link HttpProblem} instances
 * from quarkus-resteasy-problem for consistent error responses across all
 * endpoints.
 */
public final class LinkProblem {

    private LinkProblem() {
        // Utility class - prevent instantiation
    }

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    /**
     * The same body for every rejected token, whatever the reason.
     */
    public static HttpProblem unauthorized() {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail("Invalid or expired token")
                .build();
    }

    public static HttpProblem conflict(String detail) {
        return HttpProblem.builder()
                .withTitle("Conflict")
                .withStatus(Status.CONFLICT)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem serviceUnavailable(String detail) {
        return HttpProblem.builder()
                .withTitle("Service Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem internalError(String detail) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }
}
