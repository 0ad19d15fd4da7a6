package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the shared Redis store.
 *
 * <p>Configuration prefix: {@code warden.redis}
 *
 * <p>The store is shared with other applications, so every key written by
 * this service lives under {@link #keyPrefix()}.
 */
@ConfigMapping(prefix = "warden.redis")
public interface RedisStorageConfig {

    /**
     * Use Redis for rate-limit windows, failed-attempt ledgers and lockouts.
     *
     * <p>When disabled, or when no Redis data source can be resolved at startup,
     * process-local stores are used instead.
     *
     * @return true to use Redis (default: false)
     */
    @WithDefault("false")
    boolean enabled();

    /**
     * Timeout applied to every Redis call.
     *
     * <p>Must be shorter than ten seconds; a slow store is treated as an
     * unavailable one.
     *
     * @return the operation timeout (default: 2 seconds)
     */
    @WithDefault("PT2S")
    Duration timeout();

    /**
     * Namespace for all keys written by this service.
     *
     * @return the key prefix (default: warden)
     */
    @WithDefault("warden")
    String keyPrefix();
}
