package warden.system.filter;

import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;
import org.jboss.resteasy.reactive.server.ServerResponseFilter;

import warden.adapter.in.problem.WardenProblem;
import warden.core.config.RateLimitingConfig;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.service.common.ClientIpExtractor;
import warden.core.service.ratelimit.RateLimitService;

/**
 * Enforces per-route rate limits on incoming requests.
 *
 * <p>Runs before authentication so excessive traffic is rejected cheaply. The
 * client is identified by IP address; the policy comes from the route table.
 * Rejected requests get a 429 problem with {@code Retry-After} and
 * {@code X-RateLimit-*} headers; allowed requests get the {@code X-RateLimit-*}
 * headers on their response.
 */
public class RateLimitFilter {

    static final String DECISION_PROPERTY = "warden.ratelimit.decision";

    private final RateLimitService rateLimitService;
    private final boolean includeHeaders;

    @Inject
    public RateLimitFilter(RateLimitService rateLimitService, RateLimitingConfig config) {
        this(rateLimitService, config.includeHeaders());
    }

    RateLimitFilter(RateLimitService rateLimitService, boolean includeHeaders) {
        this.rateLimitService = rateLimitService;
        this.includeHeaders = includeHeaders;
    }

    @ServerRequestFilter(priority = 950, preMatching = true)
    public Uni<Response> enforce(ContainerRequestContext requestContext, HttpServerRequest request) {
        if (!rateLimitService.isEnabled()) {
            return Uni.createFrom().nullItem();
        }

        final var remote = request != null && request.remoteAddress() != null
                ? request.remoteAddress().hostAddress()
                : null;
        final var address = ClientIpExtractor.extract(
                requestContext.getHeaderString("Forwarded"),
                requestContext.getHeaderString("X-Forwarded-For"),
                requestContext.getHeaderString("X-Real-IP"),
                remote);
        final var path = requestContext.getUriInfo().getPath();

        return rateLimitService
                .checkRequest(ClientIpExtractor.identity(address), path)
                .map(decision -> {
                    requestContext.setProperty(DECISION_PROPERTY, decision);
                    return decision.allowed() ? null : buildRateLimitResponse(decision);
                });
    }

    @ServerResponseFilter
    public void addHeaders(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        if (!includeHeaders) {
            return;
        }
        final var decision = (RateLimitDecision) requestContext.getProperty(DECISION_PROPERTY);
        if (decision == null || !decision.allowed() || decision.limit() == Long.MAX_VALUE) {
            return;
        }
        final var headers = responseContext.getHeaders();
        headers.putSingle("X-RateLimit-Limit", decision.limit());
        headers.putSingle("X-RateLimit-Remaining", decision.remaining());
        headers.putSingle("X-RateLimit-Reset", decision.resetAtEpochSeconds());
    }

    static Response buildRateLimitResponse(RateLimitDecision decision) {
        final var detail = "Rate limit exceeded. Retry after %d seconds.".formatted(decision.retryAfterSeconds());

        return Response.status(429)
                .type("application/problem+json")
                .header("Retry-After", decision.retryAfterSeconds())
                .header("X-RateLimit-Limit", decision.limit())
                .header("X-RateLimit-Remaining", 0)
                .header("X-RateLimit-Reset", decision.resetAtEpochSeconds())
                .entity(WardenProblem.tooManyRequests(
                        detail, decision.retryAfterSeconds(), decision.limit(), 0, decision.resetAtEpochSeconds()))
                .build();
    }
}
