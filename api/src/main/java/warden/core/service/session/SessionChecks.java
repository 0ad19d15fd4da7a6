package warden.core.service.session;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;

import warden.core.config.SessionMonitorConfig;
import warden.core.model.security.AutoResponse;
import warden.core.model.security.SecurityEvent;
import warden.core.model.security.SecurityEventType;
import warden.core.model.security.Severity;
import warden.core.model.session.SessionRecord;

/**
 * Session-pattern rules evaluated against one user's sessions, including the
 * session just tracked.
 *
 * <p>Windows are measured back from the new session's last activity.
 */
class SessionChecks {

    private final SessionMonitorConfig config;

    SessionChecks(SessionMonitorConfig config) {
        this.config = config;
    }

    /**
     * Fires when more than {@code maxConcurrentSessions} sessions were active
     * within the concurrency window and they span at least two origins.
     */
    Optional<SecurityEvent> concurrentSessions(SessionRecord current, Collection<SessionRecord> sessions) {
        final var cutoff = current.lastActivity().minus(config.concurrentWindow());
        final var active = sessions.stream().filter(s -> s.activeSince(cutoff)).toList();
        final var origins = distinctOrigins(active);
        if (active.size() <= config.maxConcurrentSessions() || origins.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(SecurityEvent.builder(
                        SecurityEventType.CONCURRENT_SESSION, Severity.HIGH, AutoResponse.ALERT_USER)
                .userId(current.userId())
                .timestamp(current.lastActivity())
                .with("activeSessions", active.size())
                .with("origins", String.join(",", origins))
                .with("limit", config.maxConcurrentSessions())
                .build());
    }

    /**
     * Fires when sessions active within the origin window span more than
     * {@code maxOriginChangesPerHour} distinct origins.
     */
    Optional<SecurityEvent> originChurn(SessionRecord current, Collection<SessionRecord> sessions) {
        final var cutoff = current.lastActivity().minus(config.originWindow());
        final var origins = distinctOrigins(
                sessions.stream().filter(s -> s.activeSince(cutoff)).toList());
        if (origins.size() <= config.maxOriginChangesPerHour()) {
            return Optional.empty();
        }
        return Optional.of(SecurityEvent.builder(
                        SecurityEventType.RAPID_ORIGIN_CHANGE, Severity.MEDIUM, AutoResponse.ALERT_USER)
                .userId(current.userId())
                .timestamp(current.lastActivity())
                .with("originCount", origins.size())
                .with("origins", String.join(",", origins))
                .with("limit", config.maxOriginChangesPerHour())
                .build());
    }

    /**
     * Fires when the new session's device differs from the device of another
     * session active within the device window.
     */
    Optional<SecurityEvent> deviceChange(SessionRecord current, Collection<SessionRecord> sessions) {
        if (!current.hasDevice()) {
            return Optional.empty();
        }
        final var cutoff = current.lastActivity().minus(config.deviceWindow());
        return sessions.stream()
                .filter(s -> !s.sessionId().equals(current.sessionId()))
                .filter(s -> s.activeSince(cutoff))
                .filter(SessionRecord::hasDevice)
                .filter(s -> !Objects.equals(s.deviceId(), current.deviceId()))
                .findFirst()
                .map(previous -> SecurityEvent.builder(
                                SecurityEventType.DEVICE_CHANGE, Severity.MEDIUM, AutoResponse.ALERT_USER)
                        .userId(current.userId())
                        .timestamp(current.lastActivity())
                        .with("previousDevice", previous.deviceId())
                        .with("newDevice", current.deviceId())
                        .with("networkOrigin", current.networkOrigin())
                        .build());
    }

    private static LinkedHashSet<String> distinctOrigins(Collection<SessionRecord> sessions) {
        final var origins = new LinkedHashSet<String>();
        for (var session : sessions) {
            if (session.networkOrigin() != null && !session.networkOrigin().isBlank()) {
                origins.add(session.networkOrigin());
            }
        }
        return origins;
    }
}
