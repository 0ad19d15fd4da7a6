package warden.core.model.lockout;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry in a failed-attempt ledger.
 *
 * @param timestamp when the attempt failed
 * @param networkOrigin the client IP address (may be null)
 * @param userAgent the client user agent (may be null)
 */
public record FailedAttempt(Instant timestamp, String networkOrigin, String userAgent) {

    public FailedAttempt {
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
    }

    public static FailedAttempt at(Instant timestamp, AttemptMetadata metadata) {
        final var meta = metadata != null ? metadata : AttemptMetadata.empty();
        return new FailedAttempt(timestamp, meta.networkOrigin(), meta.userAgent());
    }
}
