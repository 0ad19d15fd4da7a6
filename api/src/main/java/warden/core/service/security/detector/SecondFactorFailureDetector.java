package warden.core.service.security.detector;

import java.time.Instant;
import java.util.Optional;

import warden.core.model.security.AutoResponse;
import warden.core.model.security.SecurityEvent;
import warden.core.model.security.SecurityEventType;
import warden.core.model.security.Severity;

/**
 * Flags repeated second-factor failures, which suggest the password is
 * already known to someone else.
 */
public class SecondFactorFailureDetector {

    private final int threshold;

    public SecondFactorFailureDetector(int threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive");
        }
        this.threshold = threshold;
    }

    public Optional<SecurityEvent> detect(String userId, int failureCount, Instant now) {
        if (failureCount < threshold) {
            return Optional.empty();
        }
        return Optional.of(SecurityEvent.builder(
                        SecurityEventType.EXCESSIVE_SECOND_FACTOR_FAILURES, Severity.HIGH, AutoResponse.FORCE_LOGOUT)
                .userId(userId)
                .timestamp(now)
                .with("failureCount", failureCount)
                .with("threshold", threshold)
                .build());
    }
}
