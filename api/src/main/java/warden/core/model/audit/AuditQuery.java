package warden.core.model.audit;

import java.time.Instant;
import java.util.Objects;

/**
 * Filter over the audit log. Null fields match anything.
 *
 * @param action the action to match
 * @param userId the acting user
 * @param networkOrigin the client IP address
 * @param resourceType the accessed resource type
 * @param from inclusive lower bound
 * @param to exclusive upper bound (null for no bound)
 */
public record AuditQuery(
        AuditAction action, String userId, String networkOrigin, String resourceType, Instant from, Instant to) {

    public AuditQuery {
        Objects.requireNonNull(action, "action cannot be null");
        Objects.requireNonNull(from, "from cannot be null");
    }

    public static AuditQuery byUser(AuditAction action, String userId, Instant from) {
        return new AuditQuery(action, userId, null, null, from, null);
    }

    public static AuditQuery byOrigin(AuditAction action, String networkOrigin, Instant from) {
        return new AuditQuery(action, null, networkOrigin, null, from, null);
    }

    public AuditQuery withResourceType(String resourceType) {
        return new AuditQuery(action, userId, networkOrigin, resourceType, from, to);
    }

    public AuditQuery until(Instant to) {
        return new AuditQuery(action, userId, networkOrigin, resourceType, from, to);
    }

    public boolean matches(AuditEntry entry) {
        return entry.action() == action
                && (userId == null || userId.equals(entry.userId()))
                && (networkOrigin == null || networkOrigin.equals(entry.networkOrigin()))
                && (resourceType == null || resourceType.equals(entry.resourceType()))
                && !entry.timestamp().isBefore(from)
                && (to == null || entry.timestamp().isBefore(to));
    }
}
