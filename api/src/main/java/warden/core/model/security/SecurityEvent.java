package warden.core.model.security;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable record of suspicious activity for one user.
 *
 * @param type what was detected
 * @param severity fixed per detector rule
 * @param userId the affected user
 * @param timestamp when the activity was detected
 * @param metadata evidence collected by the detector
 * @param autoResponse the response to execute
 */
public record SecurityEvent(
        SecurityEventType type,
        Severity severity,
        String userId,
        Instant timestamp,
        Map<String, Object> metadata,
        AutoResponse autoResponse) {

    public SecurityEvent {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(severity, "severity cannot be null");
        Objects.requireNonNull(userId, "userId cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        Objects.requireNonNull(autoResponse, "autoResponse cannot be null");
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Builder builder(SecurityEventType type, Severity severity, AutoResponse autoResponse) {
        return new Builder(type, severity, autoResponse);
    }

    public static final class Builder {

        private final SecurityEventType type;
        private final Severity severity;
        private final AutoResponse autoResponse;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private String userId;
        private Instant timestamp;

        private Builder(SecurityEventType type, Severity severity, AutoResponse autoResponse) {
            this.type = type;
            this.severity = severity;
            this.autoResponse = autoResponse;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder with(String key, Object value) {
            if (value != null) {
                metadata.put(key, value);
            }
            return this;
        }

        public SecurityEvent build() {
            return new SecurityEvent(type, severity, userId, timestamp, metadata, autoResponse);
        }
    }
}
