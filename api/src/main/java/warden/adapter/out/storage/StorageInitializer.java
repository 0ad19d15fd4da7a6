package warden.adapter.out.storage;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.runtime.configuration.ConfigurationException;
import org.jboss.logging.Logger;

import warden.core.config.RedisStorageConfig;
import warden.core.port.out.RateLimiter;
import warden.spi.FailedAttemptRepository;

/**
 * Validates storage configuration and selects the storage backends on startup.
 */
@ApplicationScoped
public class StorageInitializer {

    private static final Logger LOG = Logger.getLogger(StorageInitializer.class);
    private static final Duration MAX_TIMEOUT = Duration.ofSeconds(10);

    private final RedisStorageConfig redisConfig;
    private final RateLimiter rateLimiter;
    private final FailedAttemptRepository failedAttemptRepository;

    @Inject
    public StorageInitializer(
            RedisStorageConfig redisConfig, RateLimiter rateLimiter, FailedAttemptRepository failedAttemptRepository) {
        this.redisConfig = redisConfig;
        this.rateLimiter = rateLimiter;
        this.failedAttemptRepository = failedAttemptRepository;
    }

    void onStart(@Observes StartupEvent event) {
        validate(redisConfig);
        LOG.infov(
                "Storage initialized: rateLimiter={0}, redisEnabled={1}, keyPrefix={2}",
                rateLimiter.backend(),
                redisConfig.enabled(),
                redisConfig.keyPrefix());
        // Resolve the producer at startup so backend selection problems surface here
        failedAttemptRepository.countFailedAttempts("startup-check", Duration.ofSeconds(1))
                .subscribe()
                .with(
                        count -> LOG.debug("Failed attempt storage reachable"),
                        e -> LOG.warnv("Failed attempt storage check failed: {0}", e.getMessage()));
    }

    static void validate(RedisStorageConfig config) {
        final var timeout = config.timeout();
        if (timeout == null || timeout.isNegative() || timeout.isZero() || timeout.compareTo(MAX_TIMEOUT) >= 0) {
            throw new ConfigurationException("warden.redis.timeout must be positive and under 10 seconds: " + timeout);
        }
        if (config.keyPrefix() == null || config.keyPrefix().isBlank() || config.keyPrefix().contains("*")) {
            throw new ConfigurationException(
                    "warden.redis.key-prefix must be a non-empty literal: " + config.keyPrefix());
        }
    }
}
