package warden.core.service.security.detector;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

import warden.core.model.security.AutoResponse;
import warden.core.model.security.SecurityEvent;
import warden.core.model.security.SecurityEventType;
import warden.core.model.security.Severity;

/**
 * Flags logins during off hours in the configured zone.
 *
 * <p>Both bounds are inclusive hours of day, so 2 and 5 cover 02:00 to 05:59.
 */
public class UnusualTimeDetector {

    private final ZoneId zone;
    private final int startHour;
    private final int endHour;

    public UnusualTimeDetector(ZoneId zone, int startHour, int endHour) {
        if (startHour < 0 || startHour > 23 || endHour < 0 || endHour > 23) {
            throw new IllegalArgumentException("Off-hours bounds must be hours of day (0-23)");
        }
        this.zone = zone;
        this.startHour = startHour;
        this.endHour = endHour;
    }

    public Optional<SecurityEvent> detect(String userId, Instant loginAt, String networkOrigin) {
        final var hour = loginAt.atZone(zone).getHour();
        if (!isOffHours(hour)) {
            return Optional.empty();
        }
        return Optional.of(SecurityEvent.builder(SecurityEventType.UNUSUAL_TIME, Severity.LOW, AutoResponse.NONE)
                .userId(userId)
                .timestamp(loginAt)
                .with("hour", hour)
                .with("zone", zone.getId())
                .with("networkOrigin", networkOrigin)
                .build());
    }

    // A range such as 22..3 wraps past midnight
    boolean isOffHours(int hour) {
        if (startHour <= endHour) {
            return hour >= startHour && hour <= endHour;
        }
        return hour >= startHour || hour <= endHour;
    }
}
