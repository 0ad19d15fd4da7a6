package warden.core.model.ratelimit;

import java.time.Instant;

/**
 * Result of a rate limit check.
 *
 * @param allowed whether the request is allowed
 * @param remaining requests remaining in the current window
 * @param limit the configured limit
 * @param resetAt when the oldest request in the window expires and capacity frees up
 * @param retryAfterSeconds seconds until the client can retry (only meaningful when not allowed)
 * @param requestCount requests counted in the window, including this one
 */
public record RateLimitDecision(
        boolean allowed, long remaining, long limit, Instant resetAt, long retryAfterSeconds, long requestCount) {

    /**
     * Create an "allowed" decision without consulting any store.
     *
     * <p>Used when the store cannot be reached; the full budget is reported.
     *
     * @param policy the policy that would have applied
     * @param now the current time
     * @return an allowed decision
     */
    public static RateLimitDecision allow(RateLimitPolicy policy, Instant now) {
        return new RateLimitDecision(
                true, policy.requests(), policy.requests(), now.plus(policy.window()), 0, 0);
    }

    /**
     * Create an "allowed" decision for disabled rate limiting.
     *
     * @return an allowed decision with no meaningful limit
     */
    public static RateLimitDecision unlimited() {
        return new RateLimitDecision(true, Long.MAX_VALUE, Long.MAX_VALUE, Instant.MAX, 0, 0);
    }

    /**
     * Build a decision from a window count.
     *
     * @param policy the applied policy
     * @param requestCount entries in the window including the current request
     * @param resetAt when the oldest entry leaves the window
     * @param now the current time
     * @return the decision
     */
    public static RateLimitDecision fromCount(
            RateLimitPolicy policy, long requestCount, Instant resetAt, Instant now) {
        final var allowed = requestCount <= policy.requests();
        final var remaining = Math.max(0, policy.requests() - requestCount);
        final var retryAfter = allowed ? 0 : Math.max(1, ceilSeconds(resetAt.toEpochMilli() - now.toEpochMilli()));
        return new RateLimitDecision(allowed, remaining, policy.requests(), resetAt, retryAfter, requestCount);
    }

    /**
     * Get the reset time as Unix epoch seconds for HTTP headers.
     *
     * @return reset time in epoch seconds
     */
    public long resetAtEpochSeconds() {
        return resetAt.getEpochSecond();
    }

    private static long ceilSeconds(long millis) {
        return (millis + 999) / 1000;
    }
}
