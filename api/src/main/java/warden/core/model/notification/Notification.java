package warden.core.model.notification;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import warden.core.model.security.Severity;

/**
 * An outbound security notification.
 *
 * @param kind why the notification is sent
 * @param severity how urgent it is
 * @param recipient the identity to notify (email address or user id)
 * @param reason a short human-readable summary
 * @param metadata details for the channel to render
 * @param timestamp when the notification was created
 */
public record Notification(
        NotificationKind kind,
        Severity severity,
        String recipient,
        String reason,
        Map<String, Object> metadata,
        Instant timestamp) {

    public Notification {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(severity, "severity cannot be null");
        Objects.requireNonNull(recipient, "recipient cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
