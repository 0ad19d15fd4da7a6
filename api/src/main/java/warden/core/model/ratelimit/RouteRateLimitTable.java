package warden.core.model.ratelimit;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Static table of route-specific rate-limit policies.
 *
 * <p>Resolution order for a path:
 * <ol>
 *   <li>an entry whose key equals the path</li>
 *   <li>the longest entry key the path starts with</li>
 *   <li>the default policy</li>
 * </ol>
 */
public final class RouteRateLimitTable {

    public static final String DEFAULT_ROUTE = "default";

    private final Map<String, RateLimitPolicy> exact;
    private final List<Map.Entry<String, RateLimitPolicy>> byLongestPrefix;
    private final RateLimitPolicy defaultPolicy;

    public RouteRateLimitTable(Map<String, RateLimitPolicy> routes, RateLimitPolicy defaultPolicy) {
        Objects.requireNonNull(routes, "routes cannot be null");
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy cannot be null");
        this.exact = Map.copyOf(routes);
        this.byLongestPrefix = exact.entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, RateLimitPolicy> e) ->
                                e.getKey().length())
                        .reversed())
                .toList();
    }

    public RouteMatch resolve(String path) {
        if (path == null || path.isBlank()) {
            return new RouteMatch(DEFAULT_ROUTE, defaultPolicy);
        }

        final var exactPolicy = exact.get(path);
        if (exactPolicy != null) {
            return new RouteMatch(path, exactPolicy);
        }

        for (var entry : byLongestPrefix) {
            if (path.startsWith(entry.getKey())) {
                return new RouteMatch(entry.getKey(), entry.getValue());
            }
        }
        return new RouteMatch(DEFAULT_ROUTE, defaultPolicy);
    }

    public RateLimitPolicy defaultPolicy() {
        return defaultPolicy;
    }

    public int size() {
        return exact.size();
    }
}
