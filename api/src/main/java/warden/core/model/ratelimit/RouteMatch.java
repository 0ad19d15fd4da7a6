package warden.core.model.ratelimit;

/**
 * Outcome of resolving a request path against the route table.
 *
 * @param routeKey the matched route entry, or {@link RouteRateLimitTable#DEFAULT_ROUTE}
 * @param policy the policy to apply
 */
public record RouteMatch(String routeKey, RateLimitPolicy policy) {}
