package warden.core.model.lockout;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A temporary lock on an identity.
 *
 * <p>{@code unlockAt} is always {@code lockedAt + lockoutDuration}.
 *
 * @param lockedAt when the lock was applied
 * @param unlockAt when the lock expires
 * @param failedAttempts failures counted when the lock was applied
 */
public record LockoutRecord(Instant lockedAt, Instant unlockAt, int failedAttempts) {

    public LockoutRecord {
        Objects.requireNonNull(lockedAt, "lockedAt cannot be null");
        Objects.requireNonNull(unlockAt, "unlockAt cannot be null");
    }

    public static LockoutRecord lock(Instant lockedAt, Duration duration, int failedAttempts) {
        return new LockoutRecord(lockedAt, lockedAt.plus(duration), failedAttempts);
    }

    public boolean isActive(Instant now) {
        return unlockAt.isAfter(now);
    }

    public Duration remaining(Instant now) {
        return isActive(now) ? Duration.between(now, unlockAt) : Duration.ZERO;
    }

    /**
     * Remaining lock time in whole minutes, rounded up.
     */
    public long remainingMinutes(Instant now) {
        final var millis = remaining(now).toMillis();
        return (millis + 59_999) / 60_000;
    }
}
