package warden.core.service.security.detector;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.audit.AuditAction;
import warden.core.model.audit.AuditQuery;
import warden.core.model.security.AutoResponse;
import warden.core.model.security.SecurityEvent;
import warden.core.model.security.SecurityEventType;
import warden.core.model.security.Severity;
import warden.core.port.out.AuditLogReader;

/**
 * Flags repeated bulk exports of sensitive records by one user.
 */
public class DataExfiltrationDetector {

    private final AuditLogReader auditLog;
    private final int threshold;
    private final Duration window;

    public DataExfiltrationDetector(AuditLogReader auditLog, int threshold, Duration window) {
        this.auditLog = auditLog;
        this.threshold = threshold;
        this.window = window;
    }

    public Uni<Optional<SecurityEvent>> detect(String userId, Instant now) {
        final var query = AuditQuery.byUser(AuditAction.SENSITIVE_RECORD_EXPORT, userId, now.minus(window));
        final var detection = auditLog.count(query).map(count -> {
            if (count < threshold) {
                return Optional.<SecurityEvent>empty();
            }
            return Optional.of(SecurityEvent.builder(
                            SecurityEventType.DATA_EXFILTRATION, Severity.CRITICAL, AutoResponse.FORCE_LOGOUT)
                    .userId(userId)
                    .timestamp(now)
                    .with("exportCount", count)
                    .with("threshold", threshold)
                    .with("window", window.toString())
                    .build());
        });
        return DetectorSupport.orNothing(detection, "data-exfiltration");
    }
}
