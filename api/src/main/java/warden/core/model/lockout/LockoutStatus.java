package warden.core.model.lockout;

import java.time.Instant;

/**
 * Lockout state of an identity.
 *
 * @param locked whether authentication is currently blocked
 * @param lockedAt when the lock was applied (null when not locked)
 * @param unlockAt when the lock expires (null when not locked)
 * @param failedAttempts failures in the current window, or at lock time when locked
 * @param requiresCaptcha whether the next attempt must pass a CAPTCHA
 */
public record LockoutStatus(
        boolean locked, Instant lockedAt, Instant unlockAt, int failedAttempts, boolean requiresCaptcha) {

    public static LockoutStatus clean() {
        return new LockoutStatus(false, null, null, 0, false);
    }

    public static LockoutStatus unlocked(int failedAttempts, int captchaThreshold) {
        return new LockoutStatus(false, null, null, failedAttempts, failedAttempts >= captchaThreshold);
    }

    public static LockoutStatus locked(LockoutRecord lockout) {
        return new LockoutStatus(true, lockout.lockedAt(), lockout.unlockAt(), lockout.failedAttempts(), true);
    }
}
