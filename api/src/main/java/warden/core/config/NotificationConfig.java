package warden.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for outbound security notifications.
 *
 * <p>Configuration prefix: {@code warden.notifications}
 */
@ConfigMapping(prefix = "warden.notifications")
public interface NotificationConfig {

    @WithDefault("true")
    boolean enabled();

    /**
     * Notifications waiting for delivery before new ones are dropped.
     *
     * @return queue capacity (default: 1000)
     */
    @WithDefault("1000")
    int queueCapacity();
}
