package warden.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import warden.core.config.MetricsConfig;
import warden.core.model.security.SecurityEventType;
import warden.core.model.security.Severity;
import warden.core.port.out.Metrics;

/**
 * Records enforcement metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, so callers never need
 * to check configuration.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code warden.ratelimit.checks.total} - Rate limit checks by route and outcome</li>
 *   <li>{@code warden.ratelimit.rejections.total} - Rejected requests by route</li>
 *   <li>{@code warden.lockout.locks.total} - Accounts locked</li>
 *   <li>{@code warden.lockout.unlocks.total} - Accounts unlocked by trigger (manual, expired)</li>
 *   <li>{@code warden.security.events.total} - Security events by type and severity</li>
 *   <li>{@code warden.notifications.dropped.total} - Notifications dropped by kind</li>
 *   <li>{@code warden.redis.timeouts.total} - Redis timeouts by repository and operation</li>
 *   <li>{@code warden.redis.failures.total} - Other Redis failures by repository and operation</li>
 * </ul>
 */
@ApplicationScoped
public class WardenMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public WardenMetrics(MeterRegistry registry, MetricsConfig config) {
        this.registry = registry;
        this.enabled = registry != null && config != null && config.enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordRateLimitCheck(String routeKey, boolean allowed) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.ratelimit.checks.total")
                .description("Rate limit checks performed")
                .tag("route", nullSafe(routeKey))
                .tag("outcome", allowed ? "allowed" : "rejected")
                .register(registry)
                .increment();

        if (!allowed) {
            Counter.builder("warden.ratelimit.rejections.total")
                    .description("Requests rejected by rate limiting")
                    .tag("route", nullSafe(routeKey))
                    .register(registry)
                    .increment();
        }
    }

    @Override
    public void recordLockout() {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.lockout.locks.total")
                .description("Accounts locked after repeated failed logins")
                .register(registry)
                .increment();
    }

    @Override
    public void recordUnlock(String trigger) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.lockout.unlocks.total")
                .description("Accounts unlocked")
                .tag("trigger", nullSafe(trigger))
                .register(registry)
                .increment();
    }

    @Override
    public void recordSecurityEvent(SecurityEventType type, Severity severity) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.security.events.total")
                .description("Security events detected")
                .tag("type", type.name().toLowerCase())
                .tag("severity", severity.name().toLowerCase())
                .register(registry)
                .increment();
    }

    @Override
    public void recordNotificationDropped(String kind) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.notifications.dropped.total")
                .description("Notifications dropped because the delivery queue was full")
                .tag("kind", nullSafe(kind))
                .register(registry)
                .increment();
    }

    @Override
    public void recordRedisTimeout(String repository, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.redis.timeouts.total")
                .description("Redis operations that timed out")
                .tag("repository", nullSafe(repository))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    @Override
    public void recordRedisFailure(String repository, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.redis.failures.total")
                .description("Redis operations that failed")
                .tag("repository", nullSafe(repository))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
