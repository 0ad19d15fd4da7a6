package warden.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import warden.adapter.out.storage.memory.InMemoryFailedAttemptRepository;
import warden.adapter.out.storage.redis.RedisFailedAttemptRepository;
import warden.adapter.out.storage.redis.RedisTimeoutHelper;
import warden.core.config.RedisStorageConfig;
import warden.core.port.out.Metrics;
import warden.spi.FailedAttemptRepository;

/**
 * CDI producer for failed-attempt storage.
 *
 * <p>With Redis enabled and resolvable, produces a failover repository over
 * Redis with an in-memory fallback. Otherwise produces the in-memory
 * repository alone.
 */
@ApplicationScoped
public class FailedAttemptRepositoryLoader {

    private static final Logger LOG = Logger.getLogger(FailedAttemptRepositoryLoader.class);

    private final RedisStorageConfig redisConfig;
    private final Metrics metrics;
    private final ObjectMapper objectMapper;
    private final Instance<ReactiveRedisDataSource> redisDataSource;

    @Inject
    public FailedAttemptRepositoryLoader(
            RedisStorageConfig redisConfig,
            Metrics metrics,
            ObjectMapper objectMapper,
            Instance<ReactiveRedisDataSource> redisDataSource) {
        this.redisConfig = redisConfig;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.redisDataSource = redisDataSource;
    }

    @Produces
    @ApplicationScoped
    public FailedAttemptRepository produceFailedAttemptRepository() {
        final var local = new InMemoryFailedAttemptRepository();

        if (!redisConfig.enabled()) {
            LOG.info("Using in-memory failed attempt storage");
            return local;
        }

        if (!redisDataSource.isResolvable()) {
            LOG.warn("Redis enabled but ReactiveRedisDataSource not available, using in-memory failed attempt storage");
            return local;
        }

        try {
            final var timeoutHelper = new RedisTimeoutHelper(redisConfig.timeout(), metrics, "failed-attempts");
            final var redis = new RedisFailedAttemptRepository(
                    redisDataSource.get(), timeoutHelper, objectMapper, redisConfig.keyPrefix());
            LOG.info("Using Redis failed attempt storage with in-memory fallback");
            return new FailoverFailedAttemptRepository(redis, local);
        } catch (RuntimeException e) {
            LOG.warnv(e, "Failed to initialize Redis failed attempt storage, using in-memory");
            return local;
        }
    }

    void disposeFailedAttemptRepository(@Disposes FailedAttemptRepository repository) {
        if (repository instanceof InMemoryFailedAttemptRepository inMemory) {
            inMemory.shutdown();
        } else if (repository instanceof FailoverFailedAttemptRepository failover) {
            failover.shutdown();
        }
    }
}
