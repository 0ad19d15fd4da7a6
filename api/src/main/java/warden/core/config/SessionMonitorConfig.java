package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for session tracking thresholds.
 *
 * <p>Configuration prefix: {@code warden.sessions}
 */
@ConfigMapping(prefix = "warden.sessions")
public interface SessionMonitorConfig {

    /**
     * Sessions allowed inside {@link #concurrentWindow()} before an alert.
     *
     * @return maximum concurrent sessions (default: 3)
     */
    @WithDefault("3")
    int maxConcurrentSessions();

    /**
     * Activity window used to decide whether sessions are concurrent.
     *
     * @return the concurrency window (default: 60 seconds)
     */
    @WithDefault("PT60S")
    Duration concurrentWindow();

    /**
     * Distinct network origins tolerated inside {@link #originWindow()}.
     *
     * @return maximum origin changes per hour (default: 5)
     */
    @WithDefault("5")
    int maxOriginChangesPerHour();

    @WithDefault("PT1H")
    Duration originWindow();

    /**
     * Window in which a different device fingerprint is reported as a device change.
     * Sessions idle for longer than this are pruned.
     *
     * @return the device window (default: 24 hours)
     */
    @WithDefault("PT24H")
    Duration deviceWindow();

    /**
     * Hard cap on sessions kept per user; the least recently active is evicted.
     *
     * @return maximum tracked sessions per user (default: 50)
     */
    @WithDefault("50")
    int maxSessionsPerUser();
}
