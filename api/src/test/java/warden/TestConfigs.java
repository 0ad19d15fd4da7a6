package warden;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

import warden.core.config.AnomalyConfig;
import warden.core.config.LockoutConfig;
import warden.core.config.SessionMonitorConfig;

/**
 * Plain implementations of the config mappings, filled with the shipped defaults.
 */
public final class TestConfigs {

    private TestConfigs() {}

    public record Lockout(int maxFailedAttempts, Duration attemptWindow, Duration lockoutDuration, int captchaThreshold)
            implements LockoutConfig {}

    public record Sessions(
            int maxConcurrentSessions,
            Duration concurrentWindow,
            int maxOriginChangesPerHour,
            Duration originWindow,
            Duration deviceWindow,
            int maxSessionsPerUser)
            implements SessionMonitorConfig {}

    public record History(int maxEventsPerUser, Duration retention, String sweepInterval)
            implements AnomalyConfig.HistoryConfig {}

    public record Anomaly(
            ZoneId zone,
            int unusualHoursStart,
            int unusualHoursEnd,
            int secondFactorFailureThreshold,
            int failedLoginThreshold,
            Duration failedLoginWindow,
            int loginOriginThreshold,
            Duration loginOriginWindow,
            Duration secondFactorDisabledWindow,
            Duration passwordChangeWindow,
            int postPasswordChangeViews,
            Duration postPasswordChangeWindow,
            int exportThreshold,
            Duration exportWindow,
            AnomalyConfig.HistoryConfig history)
            implements AnomalyConfig {}

    public static Lockout lockout() {
        return new Lockout(5, Duration.ofMinutes(15), Duration.ofMinutes(30), 3);
    }

    public static Sessions sessions() {
        return new Sessions(3, Duration.ofSeconds(60), 5, Duration.ofHours(1), Duration.ofHours(24), 50);
    }

    public static History history() {
        return new History(100, Duration.ofDays(30), "1h");
    }

    public static Anomaly anomaly() {
        return anomaly(history());
    }

    public static Anomaly anomaly(AnomalyConfig.HistoryConfig history) {
        return new Anomaly(
                ZoneOffset.UTC,
                2,
                5,
                3,
                5,
                Duration.ofHours(1),
                3,
                Duration.ofMinutes(5),
                Duration.ofHours(24),
                Duration.ofHours(24),
                20,
                Duration.ofHours(1),
                5,
                Duration.ofHours(1),
                history);
    }
}
