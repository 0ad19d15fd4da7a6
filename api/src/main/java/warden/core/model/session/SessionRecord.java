package warden.core.model.session;

import java.time.Instant;
import java.util.Objects;

/**
 * Security-relevant metadata of an authenticated session.
 *
 * @param userId the owning user
 * @param sessionId the session identifier
 * @param networkOrigin the client IP address
 * @param deviceId the device fingerprint (may be null)
 * @param userAgent the client user agent (may be null)
 * @param lastActivity when the session was last used
 */
public record SessionRecord(
        String userId,
        String sessionId,
        String networkOrigin,
        String deviceId,
        String userAgent,
        Instant lastActivity) {

    public SessionRecord {
        Objects.requireNonNull(userId, "userId cannot be null");
        Objects.requireNonNull(sessionId, "sessionId cannot be null");
        Objects.requireNonNull(lastActivity, "lastActivity cannot be null");
        if (userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be blank");
        }
        if (sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be blank");
        }
    }

    public SessionRecord withLastActivity(Instant lastActivity) {
        return new SessionRecord(userId, sessionId, networkOrigin, deviceId, userAgent, lastActivity);
    }

    public boolean activeSince(Instant cutoff) {
        return !lastActivity.isBefore(cutoff);
    }

    public boolean hasDevice() {
        return deviceId != null && !deviceId.isBlank();
    }
}
