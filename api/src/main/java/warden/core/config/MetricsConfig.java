package warden.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for Micrometer metrics.
 *
 * <p>Configuration prefix: {@code warden.metrics}
 */
@ConfigMapping(prefix = "warden.metrics")
public interface MetricsConfig {

    @WithDefault("true")
    boolean enabled();
}
