package warden.core.model.ratelimit;

import java.util.Objects;

/**
 * Identifies one rate-limit window: a client identity on a route.
 *
 * @param identity the client identity (for example {@code ip:203.0.113.7})
 * @param routeKey the route the policy was resolved for
 */
public record RateLimitKey(String identity, String routeKey) {

    public RateLimitKey {
        Objects.requireNonNull(identity, "identity cannot be null");
        Objects.requireNonNull(routeKey, "routeKey cannot be null");
        if (identity.isBlank()) {
            throw new IllegalArgumentException("identity cannot be blank");
        }
        if (routeKey.isBlank()) {
            throw new IllegalArgumentException("routeKey cannot be blank");
        }
    }

    /**
     * Build the storage key under the given namespace.
     *
     * <p>Format: {@code {namespace}:ratelimit:{identity}:{routeKey}}
     *
     * @param namespace the key prefix owned by this service
     * @return the storage key
     */
    public String toCacheKey(String namespace) {
        return namespace + ":ratelimit:" + identity + ":" + routeKey;
    }

    /**
     * Pattern matching every rate-limit key under the given namespace.
     *
     * @param namespace the key prefix owned by this service
     * @return a glob pattern
     */
    public static String namespacePattern(String namespace) {
        return namespace + ":ratelimit:*";
    }
}
