package warden.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for enforcement responses.
 */
public final class WardenProblem {

    private WardenProblem() {}

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

    public static HttpProblem validationError(String detail) {
        return HttpProblem.builder()
                .withTitle("Validation Error")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    /**
     * A 429 problem carrying the window state.
     *
     * @param detail the error detail message
     * @param retryAfterSeconds seconds until the client can retry
     * @param limit requests allowed per window
     * @param remaining requests left (0 when rejected)
     * @param resetAt epoch seconds when the oldest counted request leaves the window
     */
    public static HttpProblem tooManyRequests(
            String detail, long retryAfterSeconds, long limit, long remaining, long resetAt) {
        return HttpProblem.builder()
                .withTitle("Too Many Requests")
                .withStatus(Status.fromStatusCode(429))
                .withDetail(detail)
                .with("retryAfter", retryAfterSeconds)
                .with("limit", limit)
                .with("remaining", remaining)
                .with("resetAt", resetAt)
                .build();
    }

    public static HttpProblem featureDisabled(String feature) {
        return HttpProblem.builder()
                .withTitle("Feature Disabled")
                .withStatus(Status.NOT_FOUND)
                .withDetail("%s is disabled".formatted(feature))
                .build();
    }
}
