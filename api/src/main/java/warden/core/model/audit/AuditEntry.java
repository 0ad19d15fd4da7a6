package warden.core.model.audit;

import java.time.Instant;
import java.util.Objects;

/**
 * One action in the audit log.
 *
 * @param action the recorded action
 * @param userId the acting user (null for failed logins of unknown users)
 * @param networkOrigin the client IP address (may be null)
 * @param resourceType the accessed resource type (may be null)
 * @param timestamp when the action happened
 */
public record AuditEntry(
        AuditAction action, String userId, String networkOrigin, String resourceType, Instant timestamp) {

    public AuditEntry {
        Objects.requireNonNull(action, "action cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
    }
}
