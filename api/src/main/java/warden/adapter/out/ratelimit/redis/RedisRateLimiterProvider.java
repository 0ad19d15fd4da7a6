package warden.adapter.out.ratelimit.redis;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;

import warden.adapter.out.storage.redis.RedisTimeoutHelper;
import warden.core.port.out.RateLimiter;
import warden.spi.RateLimiterProvider;

/**
 * Redis-based rate limiter provider for distributed deployments.
 *
 * <p>This provider has higher priority than in-memory (10 vs 0) and is
 * selected automatically when Redis is enabled and a data source can be
 * resolved.
 */
public final class RedisRateLimiterProvider implements RateLimiterProvider {

    private static final int PRIORITY = 10;
    private static final String NAME = "redis";

    private final ReactiveRedisDataSource redisDataSource;
    private final RedisTimeoutHelper timeoutHelper;
    private final String keyPrefix;

    public RedisRateLimiterProvider(
            ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper, String keyPrefix) {
        this.redisDataSource = redisDataSource;
        this.timeoutHelper = timeoutHelper;
        this.keyPrefix = keyPrefix;
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
        return redisDataSource != null;
    }

    @Override
    public RateLimiter createRateLimiter() {
        if (redisDataSource == null) {
            throw new IllegalStateException("Redis data source is not available");
        }
        return new RedisRateLimiter(redisDataSource, timeoutHelper, keyPrefix);
    }
}
