package warden.adapter.out.ratelimit.memory;

import java.time.Duration;

import warden.core.port.out.RateLimiter;
import warden.spi.RateLimiterProvider;

/**
 * Process-local rate limiter provider.
 *
 * <p>Always available. Has the lowest priority (0) so it is only used when
 * no distributed backend can be.
 */
public final class InMemoryRateLimiterProvider implements RateLimiterProvider {

    private static final int PRIORITY = 0;
    private static final String NAME = "memory";

    private final Duration cleanupInterval;

    public InMemoryRateLimiterProvider(Duration cleanupInterval) {
        this.cleanupInterval = cleanupInterval;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public RateLimiter createRateLimiter() {
        return new InMemoryRateLimiter(cleanupInterval);
    }
}
