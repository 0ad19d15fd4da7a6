package warden.core.service.security.detector;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.audit.AuditAction;
import warden.core.model.audit.AuditEntry;
import warden.core.model.audit.AuditQuery;
import warden.core.model.security.AutoResponse;
import warden.core.model.security.SecurityEvent;
import warden.core.model.security.SecurityEventType;
import warden.core.model.security.Severity;
import warden.core.port.out.AuditLogReader;

/**
 * Account-compromise rules: sensitive access shortly after a security setting
 * was weakened or changed.
 *
 * <p>The second-factor rule is checked first; the password rule only runs when
 * it finds nothing.
 */
public class AccountCompromiseDetector {

    private final AuditLogReader auditLog;
    private final Duration secondFactorDisabledWindow;
    private final Duration passwordChangeWindow;
    private final int postPasswordChangeViews;
    private final Duration postPasswordChangeWindow;

    public AccountCompromiseDetector(
            AuditLogReader auditLog,
            Duration secondFactorDisabledWindow,
            Duration passwordChangeWindow,
            int postPasswordChangeViews,
            Duration postPasswordChangeWindow) {
        this.auditLog = auditLog;
        this.secondFactorDisabledWindow = secondFactorDisabledWindow;
        this.passwordChangeWindow = passwordChangeWindow;
        this.postPasswordChangeViews = postPasswordChangeViews;
        this.postPasswordChangeWindow = postPasswordChangeWindow;
    }

    public Uni<Optional<SecurityEvent>> detect(String userId, Instant now) {
        final var detection = secondFactorDisabled(userId, now).flatMap(found -> {
            if (found.isPresent()) {
                return Uni.createFrom().item(found);
            }
            return passwordChanged(userId, now);
        });
        return DetectorSupport.orNothing(detection, "account-compromise");
    }

    private Uni<Optional<SecurityEvent>> secondFactorDisabled(String userId, Instant now) {
        final var query =
                AuditQuery.byUser(AuditAction.SECOND_FACTOR_DISABLED, userId, now.minus(secondFactorDisabledWindow));
        return auditLog.findLatest(query).flatMap(disabled -> {
            if (disabled.isEmpty()) {
                return Uni.createFrom().item(Optional.<SecurityEvent>empty());
            }
            final var disabledAt = disabled.get().timestamp();
            return auditLog
                    .count(AuditQuery.byUser(AuditAction.SENSITIVE_RECORD_VIEW, userId, disabledAt))
                    .map(views -> {
                        if (views == 0) {
                            return Optional.<SecurityEvent>empty();
                        }
                        return Optional.of(SecurityEvent.builder(
                                        SecurityEventType.ACCOUNT_COMPROMISE,
                                        Severity.CRITICAL,
                                        AutoResponse.FORCE_LOGOUT)
                                .userId(userId)
                                .timestamp(now)
                                .with("indicator", "second-factor-disabled")
                                .with("secondFactorDisabledAt", disabledAt)
                                .with("sensitiveViews", views)
                                .build());
                    });
        });
    }

    private Uni<Optional<SecurityEvent>> passwordChanged(String userId, Instant now) {
        final var query = AuditQuery.byUser(AuditAction.PASSWORD_CHANGE, userId, now.minus(passwordChangeWindow));
        return auditLog.findLatest(query).flatMap(changed -> {
            if (changed.isEmpty()) {
                return Uni.createFrom().item(Optional.<SecurityEvent>empty());
            }
            final var changedAt = changed.map(AuditEntry::timestamp).get();
            final var views = AuditQuery.byUser(AuditAction.SENSITIVE_RECORD_VIEW, userId, changedAt)
                    .until(changedAt.plus(postPasswordChangeWindow).plusNanos(1));
            return auditLog.count(views).map(count -> {
                if (count < postPasswordChangeViews) {
                    return Optional.<SecurityEvent>empty();
                }
                return Optional.of(SecurityEvent.builder(
                                SecurityEventType.ACCOUNT_COMPROMISE, Severity.HIGH, AutoResponse.REQUIRE_SECOND_FACTOR)
                        .userId(userId)
                        .timestamp(now)
                        .with("indicator", "password-change")
                        .with("passwordChangedAt", changedAt)
                        .with("sensitiveViews", count)
                        .with("window", postPasswordChangeWindow.toString())
                        .build());
            });
        });
    }
}
