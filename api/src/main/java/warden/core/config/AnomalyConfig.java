package warden.core.config;

import java.time.Duration;
import java.time.ZoneId;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for anomaly and breach-pattern detection.
 *
 * <p>Configuration prefix: {@code warden.anomaly}
 */
@ConfigMapping(prefix = "warden.anomaly")
public interface AnomalyConfig {

    /**
     * Time zone used to decide whether a login happened off hours.
     */
    @WithDefault("UTC")
    ZoneId zone();

    /**
     * First off-hours hour, inclusive.
     */
    @WithDefault("2")
    int unusualHoursStart();

    /**
     * Last off-hours hour, inclusive.
     */
    @WithDefault("5")
    int unusualHoursEnd();

    @WithDefault("3")
    int secondFactorFailureThreshold();

    /**
     * Failed logins from one network origin that count as a brute-force pattern.
     */
    @WithDefault("5")
    int failedLoginThreshold();

    @WithDefault("PT1H")
    Duration failedLoginWindow();

    /**
     * Distinct origins used by one user that count as an unusual pattern.
     */
    @WithDefault("3")
    int loginOriginThreshold();

    @WithDefault("PT5M")
    Duration loginOriginWindow();

    @WithDefault("PT24H")
    Duration secondFactorDisabledWindow();

    @WithDefault("PT24H")
    Duration passwordChangeWindow();

    /**
     * Sensitive-record views after a password change that indicate a compromise.
     */
    @WithDefault("20")
    int postPasswordChangeViews();

    @WithDefault("PT1H")
    Duration postPasswordChangeWindow();

    @WithDefault("5")
    int exportThreshold();

    @WithDefault("PT1H")
    Duration exportWindow();

    /**
     * Per-user event history.
     */
    HistoryConfig history();

    interface HistoryConfig {

        @WithDefault("100")
        int maxEventsPerUser();

        @WithDefault("P30D")
        Duration retention();

        /**
         * Sweep interval in scheduler syntax.
         */
        @WithDefault("1h")
        String sweepInterval();
    }
}
