package warden.core.port.out;

import io.smallrye.mutiny.Uni;

import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.RateLimitKey;
import warden.core.model.ratelimit.RateLimitPolicy;

/**
 * Port for sliding-window rate limit storage.
 *
 * <p>Implementations keep a log of request timestamps per key and must make
 * prune, insert and count a single atomic step per key, so that concurrent
 * callers on the same key cannot interleave.
 *
 * <p>Implementations must be thread-safe. A check that cannot reach its store
 * completes with an allowing decision rather than a failure.
 */
public interface RateLimiter {

    /**
     * Record a request and decide whether it is within the policy.
     *
     * <p>The check is also the increment: denied requests are recorded too.
     *
     * @param key the window key
     * @param policy the policy to enforce
     * @return the decision
     */
    Uni<RateLimitDecision> checkAndConsume(RateLimitKey key, RateLimitPolicy policy);

    /**
     * Read the current window without recording a request.
     *
     * @param key the window key
     * @param policy the policy to evaluate against
     * @return the decision the next request would start from
     */
    Uni<RateLimitDecision> getStatus(RateLimitKey key, RateLimitPolicy policy);

    /**
     * Discard the window for a key.
     *
     * @param key the window key
     * @return completion signal
     */
    Uni<Void> reset(RateLimitKey key);

    /**
     * Discard every window owned by this service.
     *
     * <p>Only keys under this service's rate-limit namespace are touched.
     *
     * @return the number of windows removed
     */
    Uni<Long> clearAll();

    /**
     * Name of the backing store, for logs and admin responses.
     */
    String backend();
}
