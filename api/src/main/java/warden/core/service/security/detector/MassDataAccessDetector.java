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
 * Flags a user viewing at least {@code threshold} sensitive records of one type
 * within a window. Window and threshold are chosen by the caller per resource
 * type.
 */
public class MassDataAccessDetector {

    private final AuditLogReader auditLog;

    public MassDataAccessDetector(AuditLogReader auditLog) {
        this.auditLog = auditLog;
    }

    public Uni<Optional<SecurityEvent>> detect(
            String userId, String resourceType, Duration window, int threshold, Instant now) {
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive");
        }
        final var query = AuditQuery.byUser(AuditAction.SENSITIVE_RECORD_VIEW, userId, now.minus(window))
                .withResourceType(resourceType);
        final var detection = auditLog.count(query).map(count -> {
            if (count < threshold) {
                return Optional.<SecurityEvent>empty();
            }
            return Optional.of(SecurityEvent.builder(
                            SecurityEventType.MASS_DATA_ACCESS, Severity.CRITICAL, AutoResponse.ALERT_USER)
                    .userId(userId)
                    .timestamp(now)
                    .with("resourceType", resourceType)
                    .with("accessCount", count)
                    .with("threshold", threshold)
                    .with("windowSeconds", window.toSeconds())
                    .build());
        });
        return DetectorSupport.orNothing(detection, "mass-data-access");
    }
}
