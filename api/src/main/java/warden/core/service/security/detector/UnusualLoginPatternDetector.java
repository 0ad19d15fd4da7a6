package warden.core.service.security.detector;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.TreeSet;

import io.smallrye.mutiny.Uni;

import warden.core.model.audit.AuditAction;
import warden.core.model.audit.AuditQuery;
import warden.core.model.security.AutoResponse;
import warden.core.model.security.SecurityEvent;
import warden.core.model.security.SecurityEventType;
import warden.core.model.security.Severity;
import warden.core.port.out.AuditLogReader;

/**
 * Login-pattern rules backed by the audit log.
 *
 * <ul>
 *   <li>Failed-login burst: {@code failedLoginThreshold} or more failures from
 *       one network origin within {@code failedLoginWindow}.</li>
 *   <li>Origin spread: {@code originThreshold} or more distinct origins logging
 *       in as one user within {@code originWindow}.</li>
 * </ul>
 */
public class UnusualLoginPatternDetector {

    private final AuditLogReader auditLog;
    private final int failedLoginThreshold;
    private final Duration failedLoginWindow;
    private final int originThreshold;
    private final Duration originWindow;

    public UnusualLoginPatternDetector(
            AuditLogReader auditLog,
            int failedLoginThreshold,
            Duration failedLoginWindow,
            int originThreshold,
            Duration originWindow) {
        this.auditLog = auditLog;
        this.failedLoginThreshold = failedLoginThreshold;
        this.failedLoginWindow = failedLoginWindow;
        this.originThreshold = originThreshold;
        this.originWindow = originWindow;
    }

    /**
     * Check for a burst of failed logins from the origin of a failed attempt.
     *
     * @param subject the user id, or the login identity when the user is unknown
     * @param networkOrigin the origin of the failed attempt (no event when null)
     * @param now when the attempt failed
     */
    public Uni<Optional<SecurityEvent>> detectFailedLoginBurst(String subject, String networkOrigin, Instant now) {
        if (networkOrigin == null || networkOrigin.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        final var query = AuditQuery.byOrigin(AuditAction.LOGIN_FAILED, networkOrigin, now.minus(failedLoginWindow));
        final var detection = auditLog.count(query).map(count -> {
            if (count < failedLoginThreshold) {
                return Optional.<SecurityEvent>empty();
            }
            return Optional.of(SecurityEvent.builder(
                            SecurityEventType.UNUSUAL_LOGIN_PATTERN, Severity.HIGH, AutoResponse.NONE)
                    .userId(subject)
                    .timestamp(now)
                    .with("pattern", "failed-login-burst")
                    .with("networkOrigin", networkOrigin)
                    .with("failedAttempts", count)
                    .with("window", failedLoginWindow.toString())
                    .build());
        });
        return DetectorSupport.orNothing(detection, "failed-login-burst");
    }

    /**
     * Check how many distinct origins logged in as the user recently,
     * counting the current login.
     */
    public Uni<Optional<SecurityEvent>> detectOriginSpread(String userId, String networkOrigin, Instant now) {
        final var query = AuditQuery.byUser(AuditAction.LOGIN, userId, now.minus(originWindow));
        final var detection = auditLog.distinctOrigins(query).map(recorded -> {
            final var origins = new TreeSet<>(recorded);
            if (networkOrigin != null && !networkOrigin.isBlank()) {
                origins.add(networkOrigin);
            }
            if (origins.size() < originThreshold) {
                return Optional.<SecurityEvent>empty();
            }
            return Optional.of(SecurityEvent.builder(
                            SecurityEventType.UNUSUAL_LOGIN_PATTERN,
                            Severity.MEDIUM,
                            AutoResponse.REQUIRE_SECOND_FACTOR)
                    .userId(userId)
                    .timestamp(now)
                    .with("pattern", "origin-spread")
                    .with("origins", String.join(",", origins))
                    .with("originCount", origins.size())
                    .with("window", originWindow.toString())
                    .build());
        });
        return DetectorSupport.orNothing(detection, "origin-spread");
    }
}
