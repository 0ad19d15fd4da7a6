package warden.core.port.out;

import warden.core.model.security.SecurityEventType;
import warden.core.model.security.Severity;

/**
 * Port interface for recording enforcement metrics.
 *
 * <p>Implementations must be no-ops when metrics are disabled.
 */
public interface Metrics {

    boolean isEnabled();

    /**
     * Record a rate-limit check.
     *
     * @param routeKey the matched route
     * @param allowed whether the request was allowed
     */
    void recordRateLimitCheck(String routeKey, boolean allowed);

    void recordLockout();

    void recordUnlock(String trigger);

    void recordSecurityEvent(SecurityEventType type, Severity severity);

    void recordNotificationDropped(String kind);

    void recordRedisTimeout(String repository, String operation);

    void recordRedisFailure(String repository, String operation);
}
