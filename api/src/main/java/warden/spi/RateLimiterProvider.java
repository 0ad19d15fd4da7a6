package warden.spi;

import warden.core.port.out.RateLimiter;

/**
 * Service Provider Interface for rate limiter backends.
 *
 * <p>The loader collects the configured providers, drops those that are not
 * available and uses the one with the highest priority.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>In-memory (priority 0) - always available, limits are per process</li>
 *   <li>Redis (priority 10) - distributed, used when configured and resolvable</li>
 * </ul>
 *
 * @see warden.core.port.out.RateLimiter
 */
public interface RateLimiterProvider {

    /**
     * Return the priority of this provider. Higher values win.
     *
     * @return the provider priority
     */
    int priority();

    /**
     * Return the name of this provider for logging.
     *
     * @return the provider name (e.g., "memory", "redis")
     */
    String name();

    /**
     * Check if this provider can be used in the current environment.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create the rate limiter. Called once during startup; the result must be
     * thread-safe.
     *
     * @return the rate limiter instance
     */
    RateLimiter createRateLimiter();
}
