package warden.core.model.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Details of an authentication outcome reported by the login flow.
 *
 * @param identity the login identity (usually an email address)
 * @param userId the resolved user id (null when the identity is unknown)
 * @param sessionId the session created on success (null on failure)
 * @param networkOrigin the client IP address
 * @param deviceId the device fingerprint (may be null)
 * @param userAgent the client user agent (may be null)
 * @param timestamp when the outcome occurred
 */
public record LoginContext(
        String identity,
        String userId,
        String sessionId,
        String networkOrigin,
        String deviceId,
        String userAgent,
        Instant timestamp) {

    public LoginContext {
        Objects.requireNonNull(identity, "identity cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
    }
}
