package warden.adapter.out.ratelimit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import warden.adapter.out.ratelimit.memory.InMemoryRateLimiter;
import warden.adapter.out.ratelimit.memory.InMemoryRateLimiterProvider;
import warden.adapter.out.ratelimit.redis.RedisRateLimiterProvider;
import warden.adapter.out.storage.redis.RedisTimeoutHelper;
import warden.core.config.RateLimitingConfig;
import warden.core.config.RedisStorageConfig;
import warden.core.port.out.Metrics;
import warden.core.port.out.RateLimiter;
import warden.spi.RateLimiterProvider;

/**
 * CDI producer for the rate limiter.
 *
 * <p>Selects the highest-priority available provider:
 * <ul>
 *   <li>Redis (priority 10) - used when {@code warden.redis.enabled} is set and a
 *       data source resolves</li>
 *   <li>In-memory (priority 0) - fallback, always available; limits become per process</li>
 * </ul>
 *
 * <p>When rate limiting is disabled, returns a no-op implementation.
 */
@ApplicationScoped
public class RateLimiterProviderLoader {

    private static final Logger LOG = Logger.getLogger(RateLimiterProviderLoader.class);

    private final RateLimitingConfig config;
    private final RedisStorageConfig redisConfig;
    private final Metrics metrics;
    private final Instance<ReactiveRedisDataSource> redisDataSource;

    @Inject
    public RateLimiterProviderLoader(
            RateLimitingConfig config,
            RedisStorageConfig redisConfig,
            Metrics metrics,
            Instance<ReactiveRedisDataSource> redisDataSource) {
        this.config = config;
        this.redisConfig = redisConfig;
        this.metrics = metrics;
        this.redisDataSource = redisDataSource;
    }

    /**
     * Produces the rate limiter instance for CDI injection.
     *
     * @return the configured rate limiter
     */
    @Produces
    @ApplicationScoped
    public RateLimiter produceRateLimiter() {
        if (!config.enabled()) {
            LOG.info("Rate limiting is disabled, using NoOpRateLimiter");
            return NoOpRateLimiter.getInstance();
        }

        final var provider = candidateProviders().stream()
                .filter(RateLimiterProvider::isAvailable)
                .max(Comparator.comparingInt(RateLimiterProvider::priority))
                .orElseThrow(() -> new IllegalStateException("No rate limiter provider available"));

        LOG.infov("Using rate limiter provider: {0}", provider.name());
        if (provider.priority() == 0) {
            LOG.warn("Rate limits are enforced per process; run a single instance or enable Redis");
        }
        return provider.createRateLimiter();
    }

    /**
     * Disposes the rate limiter, shutting down any cleanup executors.
     */
    void disposeRateLimiter(@Disposes RateLimiter rateLimiter) {
        if (rateLimiter instanceof InMemoryRateLimiter inMemory) {
            inMemory.shutdown();
        }
    }

    List<RateLimiterProvider> candidateProviders() {
        final var providers = new ArrayList<RateLimiterProvider>();
        providers.add(new InMemoryRateLimiterProvider(config.cleanupInterval()));

        if (!redisConfig.enabled()) {
            LOG.debug("Redis rate limiting not enabled in configuration");
            return providers;
        }

        if (!redisDataSource.isResolvable()) {
            LOG.warn("Redis enabled but ReactiveRedisDataSource not available, falling back to in-memory");
            return providers;
        }

        try {
            final var timeoutHelper = new RedisTimeoutHelper(redisConfig.timeout(), metrics, "rate-limiter");
            providers.add(new RedisRateLimiterProvider(redisDataSource.get(), timeoutHelper, redisConfig.keyPrefix()));
        } catch (RuntimeException e) {
            LOG.warnv(e, "Failed to initialize Redis rate limiter, falling back to in-memory");
        }
        return providers;
    }
}
