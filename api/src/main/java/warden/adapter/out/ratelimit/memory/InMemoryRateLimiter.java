package warden.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.RateLimitKey;
import warden.core.model.ratelimit.RateLimitPolicy;
import warden.core.port.out.RateLimiter;

/**
 * In-memory sliding-window rate limiter.
 *
 * <p>
 * Keeps a timestamp log per key in a concurrent hash map and updates it with
 * {@link ConcurrentMap#compute}, so prune, insert and count are atomic per key.
 * Each log holds at most {@code requests} timestamps: a decision only depends on
 * whether that many requests are already inside the window.
 *
 * <p>
 * Limitations:
 * <ul>
 * <li>State is not shared across instances: with N instances a client may
 * make up to N times the configured requests</li>
 * <li>State is lost on restart</li>
 * </ul>
 *
 * <p>
 * Used when Redis is not configured or cannot be resolved at startup.
 */
public final class InMemoryRateLimiter implements RateLimiter {

    private static final Logger LOG = Logger.getLogger(InMemoryRateLimiter.class);
    private static final String NAMESPACE = "memory";

    private final ConcurrentMap<String, RequestLog> logs = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryRateLimiter(Duration cleanupInterval) {
        this(cleanupInterval, Clock.systemUTC());
    }

    /**
     * Creates a new in-memory rate limiter.
     *
     * @param cleanupInterval how often idle windows are discarded
     * @param clock the time source
     */
    public InMemoryRateLimiter(Duration cleanupInterval, Clock clock) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "rate-limit-cleanup");
            t.setDaemon(true);
            return t;
        });

        final var intervalMillis = Math.max(1000, cleanupInterval.toMillis());
        cleanupExecutor.scheduleAtFixedRate(
                this::cleanupIdle, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public Uni<RateLimitDecision> checkAndConsume(RateLimitKey key, RateLimitPolicy policy) {
        return Uni.createFrom().item(() -> consume(key.toCacheKey(NAMESPACE), policy));
    }

    @Override
    public Uni<RateLimitDecision> getStatus(RateLimitKey key, RateLimitPolicy policy) {
        return Uni.createFrom().item(() -> {
            final var now = clock.millis();
            final var log = logs.get(key.toCacheKey(NAMESPACE));
            final var inWindow = log == null ? new long[0] : log.prune(now - policy.windowMillis());
            final var oldest = inWindow.length == 0 ? now : inWindow[0];
            final var resetAt = oldest + policy.windowMillis();
            return RateLimitDecision.fromCount(
                    policy, inWindow.length, Instant.ofEpochMilli(resetAt), Instant.ofEpochMilli(now));
        });
    }

    @Override
    public Uni<Void> reset(RateLimitKey key) {
        return Uni.createFrom().item(() -> logs.remove(key.toCacheKey(NAMESPACE))).replaceWithVoid();
    }

    @Override
    public Uni<Long> clearAll() {
        return Uni.createFrom().item(() -> {
            final long removed = logs.size();
            logs.clear();
            return removed;
        });
    }

    @Override
    public String backend() {
        return "memory";
    }

    /**
     * Returns the number of windows currently held.
     *
     * @return the number of tracked keys
     */
    public int getWindowCount() {
        return logs.size();
    }

    /**
     * Stops the cleanup task.
     */
    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private RateLimitDecision consume(String cacheKey, RateLimitPolicy policy) {
        final var now = clock.millis();
        final var windowStart = now - policy.windowMillis();
        final var result = new RateLimitDecision[1];

        logs.compute(cacheKey, (k, current) -> {
            final var inWindow = current == null ? new long[0] : current.prune(windowStart);
            final var updated = append(inWindow, now, policy.requests());
            final var requestCount = inWindow.length + 1L;
            final var resetAt = updated[0] + policy.windowMillis();

            result[0] = RateLimitDecision.fromCount(
                    policy, requestCount, Instant.ofEpochMilli(resetAt), Instant.ofEpochMilli(now));
            return new RequestLog(updated, policy.windowMillis());
        });

        return result[0];
    }

    private static long[] append(long[] inWindow, long now, int cap) {
        final var appended = Arrays.copyOf(inWindow, inWindow.length + 1);
        appended[inWindow.length] = now;
        if (appended.length <= cap) {
            return appended;
        }
        return Arrays.copyOfRange(appended, appended.length - cap, appended.length);
    }

    private void cleanupIdle() {
        final var now = clock.millis();
        final var before = logs.size();
        logs.entrySet().removeIf(entry -> entry.getValue().isIdle(now));
        final var removed = before - logs.size();
        if (removed > 0) {
            LOG.debugf("Discarded %d idle rate limit windows", removed);
        }
    }

    /**
     * Timestamps of recorded requests, oldest first.
     */
    private record RequestLog(long[] timestamps, long windowMillis) {

        long[] prune(long windowStart) {
            return Arrays.stream(timestamps).filter(ts -> ts >= windowStart).toArray();
        }

        boolean isIdle(long now) {
            return timestamps.length == 0 || timestamps[timestamps.length - 1] < now - windowMillis;
        }
    }
}
