package warden.adapter.out.ratelimit.redis;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;

import warden.adapter.out.storage.redis.RedisKeyspace;
import warden.adapter.out.storage.redis.RedisTimeoutHelper;
import warden.core.model.ratelimit.RateLimitDecision;
import warden.core.model.ratelimit.RateLimitKey;
import warden.core.model.ratelimit.RateLimitPolicy;
import warden.core.port.out.RateLimiter;

/**
 * Redis-based sliding-window rate limiter for distributed deployments.
 *
 * <p>Each window is a sorted set of request timestamps. A Lua script prunes,
 * counts, inserts, trims and sets the expiry in one round trip, so concurrent
 * callers on the same key never interleave.
 *
 * <p>Every call carries the configured timeout. On timeout or any Redis
 * failure the request is allowed and the failure is logged and counted.
 *
 * <p>Key format: {@code {prefix}:ratelimit:{identity}:{routeKey}}
 */
public final class RedisRateLimiter implements RateLimiter {

    /**
     * Lua script for an atomic sliding-window check.
     *
     * <p>Arguments:
     * <ol>
     *   <li>KEYS[1] - the window key</li>
     *   <li>ARGV[1] - requests allowed per window</li>
     *   <li>ARGV[2] - window duration in milliseconds</li>
     *   <li>ARGV[3] - current timestamp in milliseconds</li>
     *   <li>ARGV[4] - unique member for this request</li>
     * </ol>
     *
     * <p>Returns array: [request_count, reset_at_ms]
     */
    private static final String SLIDING_WINDOW_SCRIPT =
            """
            local key = KEYS[1]
            local limit = tonumber(ARGV[1])
            local window_ms = tonumber(ARGV[2])
            local now_ms = tonumber(ARGV[3])
            local member = ARGV[4]

            -- Drop entries older than the window start
            redis.call('ZREMRANGEBYSCORE', key, '-inf', '(' .. (now_ms - window_ms))
            local before = redis.call('ZCARD', key)

            redis.call('ZADD', key, now_ms, member)
            -- Keep only the newest `limit` entries
            redis.call('ZREMRANGEBYRANK', key, 0, -(limit + 1))
            redis.call('PEXPIRE', key, window_ms)

            local reset_at = now_ms + window_ms
            local oldest = redis.call('ZRANGE', key, 0, 0, 'WITHSCORES')
            if oldest[2] then
                reset_at = tonumber(oldest[2]) + window_ms
            end

            return {before + 1, reset_at}
            """;

    /**
     * Lua script reading a window without recording a request.
     *
     * <p>Returns array: [request_count, reset_at_ms]
     */
    private static final String STATUS_SCRIPT =
            """
            local key = KEYS[1]
            local window_ms = tonumber(ARGV[1])
            local now_ms = tonumber(ARGV[2])
            local window_start = now_ms - window_ms

            local count = redis.call('ZCOUNT', key, window_start, '+inf')
            local reset_at = now_ms + window_ms
            local oldest = redis.call('ZRANGEBYSCORE', key, window_start, '+inf', 'WITHSCORES', 'LIMIT', 0, 1)
            if oldest[2] then
                reset_at = tonumber(oldest[2]) + window_ms
            end

            return {count, reset_at}
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisTimeoutHelper timeoutHelper;
    private final String keyPrefix;
    private final Clock clock;

    public RedisRateLimiter(
            ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper, String keyPrefix) {
        this(redisDataSource, timeoutHelper, keyPrefix, Clock.systemUTC());
    }

    public RedisRateLimiter(
            ReactiveRedisDataSource redisDataSource,
            RedisTimeoutHelper timeoutHelper,
            String keyPrefix,
            Clock clock) {
        this.redisDataSource = redisDataSource;
        this.keyCommands = redisDataSource.key(String.class);
        this.timeoutHelper = timeoutHelper;
        this.keyPrefix = keyPrefix;
        this.clock = clock;
    }

    @Override
    public Uni<RateLimitDecision> checkAndConsume(RateLimitKey key, RateLimitPolicy policy) {
        final var now = clock.instant();
        final var nowMs = now.toEpochMilli();
        final var member = nowMs + "-" + UUID.randomUUID();

        // EVAL script numkeys key [key...] arg [arg...]
        final var operation = redisDataSource
                .execute(
                        "EVAL",
                        SLIDING_WINDOW_SCRIPT,
                        "1", // numkeys
                        key.toCacheKey(keyPrefix), // KEYS[1]
                        String.valueOf(policy.requests()), // ARGV[1]
                        String.valueOf(policy.windowMillis()), // ARGV[2]
                        String.valueOf(nowMs), // ARGV[3]
                        member // ARGV[4]
                        )
                .map(response -> toDecision(response, policy, now));

        return timeoutHelper.withTimeoutFallback(
                operation, "checkAndConsume", () -> RateLimitDecision.allow(policy, now));
    }

    @Override
    public Uni<RateLimitDecision> getStatus(RateLimitKey key, RateLimitPolicy policy) {
        final var now = clock.instant();

        final var operation = redisDataSource
                .execute(
                        "EVAL",
                        STATUS_SCRIPT,
                        "1",
                        key.toCacheKey(keyPrefix),
                        String.valueOf(policy.windowMillis()),
                        String.valueOf(now.toEpochMilli()))
                .map(response -> toDecision(response, policy, now));

        return timeoutHelper.withTimeoutFallback(operation, "getStatus", () -> RateLimitDecision.allow(policy, now));
    }

    @Override
    public Uni<Void> reset(RateLimitKey key) {
        return timeoutHelper.withTimeoutSilent(
                keyCommands.del(key.toCacheKey(keyPrefix)).replaceWithVoid(), "reset");
    }

    @Override
    public Uni<Long> clearAll() {
        return timeoutHelper.withTimeout(
                RedisKeyspace.deleteMatching(keyCommands, RateLimitKey.namespacePattern(keyPrefix)), "clearAll");
    }

    @Override
    public String backend() {
        return "redis";
    }

    private RateLimitDecision toDecision(Response response, RateLimitPolicy policy, Instant now) {
        if (response == null || response.size() < 2) {
            throw new IllegalStateException("Unexpected response from Redis rate limit script");
        }

        final var requestCount = response.get(0).toLong();
        final var resetAt = Instant.ofEpochMilli(response.get(1).toLong());
        return RateLimitDecision.fromCount(policy, requestCount, resetAt, now);
    }
}
