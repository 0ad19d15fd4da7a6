package warden.core.service.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.runtime.configuration.ConfigurationException;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.RateLimitingConfig;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.RateLimitKey;
import warden.core.model.ratelimit.RateLimitPolicy;
import warden.core.model.ratelimit.RouteMatch;
import warden.core.model.ratelimit.RouteRateLimitTable;
import warden.core.port.out.Metrics;
import warden.core.port.out.RateLimiter;

/**
 * Sliding-window request rate limiting keyed by client identity and route.
 *
 * <p>Failure policy is fail-open: when the backing store fails, the request is
 * allowed and the failure is logged. Invalid input is rejected with
 * {@link IllegalArgumentException}; a malformed route table fails startup.
 */
@ApplicationScoped
public class RateLimitService {

    private static final Logger LOG = Logger.getLogger(RateLimitService.class);

    private final RateLimiter rateLimiter;
    private final RouteRateLimitTable routeTable;
    private final Metrics metrics;
    private final boolean enabled;

    @Inject
    public RateLimitService(RateLimiter rateLimiter, RateLimitingConfig config, Metrics metrics) {
        this(rateLimiter, buildRouteTable(config), metrics, config.enabled());
    }

    public RateLimitService(RateLimiter rateLimiter, RouteRateLimitTable routeTable, Metrics metrics, boolean enabled) {
        this.rateLimiter = rateLimiter;
        this.routeTable = routeTable;
        this.metrics = metrics;
        this.enabled = enabled;
    }

    void onStart(@Observes StartupEvent event) {
        LOG.infov(
                "Rate limiting enabled={0}, backend={1}, routes={2}, default={3}/{4}",
                enabled,
                rateLimiter.backend(),
                routeTable.size(),
                routeTable.defaultPolicy().requests(),
                routeTable.defaultPolicy().window());
    }

    /**
     * Record a request against a window and decide whether it is allowed.
     *
     * @param identity the client identity
     * @param routeKey the route the policy applies to
     * @param policy the policy
     * @return the decision; never a failure
     */
    public Uni<RateLimitDecision> check(String identity, String routeKey, RateLimitPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        final var key = new RateLimitKey(identity, routeKey);

        if (!enabled) {
            return Uni.createFrom().item(RateLimitDecision.unlimited());
        }

        return rateLimiter
                .checkAndConsume(key, policy)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorv(error, "Rate limit check failed for route {0}, allowing request", routeKey);
                    return RateLimitDecision.allow(policy, Instant.now());
                })
                .invoke(decision -> {
                    metrics.recordRateLimitCheck(routeKey, decision.allowed());
                    if (!decision.allowed()) {
                        LOG.debugv(
                                "Rate limit exceeded: route={0}, count={1}, limit={2}",
                                routeKey, decision.requestCount(), decision.limit());
                    }
                });
    }

    /**
     * Resolve the policy for a request path and check it.
     *
     * @param identity the client identity
     * @param path the request path
     * @return the decision; never a failure
     */
    public Uni<RateLimitDecision> checkRequest(String identity, String path) {
        final var match = resolve(path);
        return check(identity, match.routeKey(), match.policy());
    }

    public RouteMatch resolve(String path) {
        return routeTable.resolve(path);
    }

    /**
     * Read the window for an identity on a route without consuming capacity.
     */
    public Uni<RateLimitDecision> status(String identity, String path) {
        final var match = resolve(path);
        return rateLimiter.getStatus(new RateLimitKey(identity, match.routeKey()), match.policy());
    }

    /**
     * Discard the window for an identity on the route a path resolves to.
     */
    public Uni<Void> reset(String identity, String path) {
        final var match = resolve(path);
        LOG.infov("Resetting rate limit window: route={0}", match.routeKey());
        return rateLimiter.reset(new RateLimitKey(identity, match.routeKey()));
    }

    /**
     * Discard every rate-limit window owned by this service.
     *
     * @return the number of windows removed
     */
    public Uni<Long> clearAll() {
        return rateLimiter.clearAll().invoke(count -> LOG.warnv("Cleared {0} rate limit windows", count));
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String backend() {
        return rateLimiter.backend();
    }

    /**
     * Build and validate the route table.
     *
     * @throws ConfigurationException if any route or the default policy is malformed
     */
    static RouteRateLimitTable buildRouteTable(RateLimitingConfig config) {
        final var routes = new HashMap<String, RateLimitPolicy>();
        for (var entry : config.routes().entrySet()) {
            final var path = entry.getKey();
            if (path == null || !path.startsWith("/")) {
                throw new ConfigurationException("Rate limit route must be an absolute path: " + path);
            }
            final var route = entry.getValue();
            final var key = "warden.rate-limiting.routes.\"" + path + "\"";
            routes.put(path, toPolicy(key, route.requests(), route.window()));
        }

        final var defaults = config.defaultPolicy();
        final var defaultPolicy =
                toPolicy("warden.rate-limiting.default-policy", defaults.requests(), defaults.window());
        return new RouteRateLimitTable(routes, defaultPolicy);
    }

    private static RateLimitPolicy toPolicy(String property, int requests, Duration window) {
        try {
            return RateLimitPolicy.of(requests, window);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigurationException("Invalid rate limit policy " + property + ": " + e.getMessage());
        }
    }
}
