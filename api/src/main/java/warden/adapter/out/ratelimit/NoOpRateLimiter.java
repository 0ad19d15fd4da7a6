package warden.adapter.out.ratelimit;

import io.smallrye.mutiny.Uni;

import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.RateLimitKey;
import warden.core.model.ratelimit.RateLimitPolicy;
import warden.core.port.out.RateLimiter;

/**
 * Rate limiter used when rate limiting is disabled. Allows every request.
 */
public final class NoOpRateLimiter implements RateLimiter {

    private static final NoOpRateLimiter INSTANCE = new NoOpRateLimiter();

    private NoOpRateLimiter() {}

    public static NoOpRateLimiter getInstance() {
        return INSTANCE;
    }

    @Override
    public Uni<RateLimitDecision> checkAndConsume(RateLimitKey key, RateLimitPolicy policy) {
        return Uni.createFrom().item(RateLimitDecision.unlimited());
    }

    @Override
    public Uni<RateLimitDecision> getStatus(RateLimitKey key, RateLimitPolicy policy) {
        return Uni.createFrom().item(RateLimitDecision.unlimited());
    }

    @Override
    public Uni<Void> reset(RateLimitKey key) {
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<Long> clearAll() {
        return Uni.createFrom().item(0L);
    }

    @Override
    public String backend() {
        return "none";
    }
}
