package warden.core.config;

import java.time.Duration;
import java.util.Map;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for request rate limiting.
 *
 * <p>Configuration prefix: {@code warden.rate-limiting}
 *
 * <p>Routes are configured as a map keyed by path. Paths contain slashes, so
 * the keys must be quoted:
 *
 * <pre>
 * warden.rate-limiting.routes."/api/auth/login".requests=5
 * warden.rate-limiting.routes."/api/auth/login".window=PT15M
 * </pre>
 */
@ConfigMapping(prefix = "warden.rate-limiting")
public interface RateLimitingConfig {

    /**
     * Enable or disable rate limiting globally.
     *
     * @return true if rate limiting is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Include X-RateLimit-* headers in responses.
     *
     * @return true to include headers (default: true)
     */
    @WithDefault("true")
    boolean includeHeaders();

    /**
     * Policy applied to paths no route entry matches.
     */
    PolicyConfig defaultPolicy();

    /**
     * Route-specific policies keyed by path. A path equal to a key uses that
     * entry; otherwise the longest key the path starts with is used.
     */
    Map<String, RouteConfig> routes();

    /**
     * Interval at which idle in-memory windows are discarded.
     *
     * @return the cleanup interval (default: 1 minute)
     */
    @WithDefault("PT1M")
    Duration cleanupInterval();

    /**
     * A request budget over a sliding window.
     */
    interface PolicyConfig {

        @WithDefault("300")
        int requests();

        @WithDefault("PT1M")
        Duration window();
    }

    /**
     * A policy bound to a path.
     */
    interface RouteConfig {

        int requests();

        Duration window();
    }
}
