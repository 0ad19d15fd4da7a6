package warden.core.model.lockout;

/**
 * Client details captured with a failed authentication attempt.
 *
 * @param networkOrigin the client IP address (may be null)
 * @param userAgent the client user agent (may be null)
 */
public record AttemptMetadata(String networkOrigin, String userAgent) {

    public static AttemptMetadata empty() {
        return new AttemptMetadata(null, null);
    }
}
