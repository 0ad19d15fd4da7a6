package warden.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.security.SecurityEventType;
import warden.core.model.security.Severity;

@DisplayName("WardenMetrics")
class WardenMetricsTest {

    private SimpleMeterRegistry registry;
    private WardenMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new WardenMetrics(registry, () -> true);
    }

    @Test
    @DisplayName("should count checks by outcome and rejections by route")
    void shouldCountRateLimitChecks() {
        metrics.recordRateLimitCheck("/api/auth/login", true);
        metrics.recordRateLimitCheck("/api/auth/login", false);
        metrics.recordRateLimitCheck("/api/auth/login", false);

        assertEquals(1.0, registry.get("warden.ratelimit.checks.total")
                .tag("route", "/api/auth/login")
                .tag("outcome", "allowed")
                .counter()
                .count());
        assertEquals(2.0, registry.get("warden.ratelimit.rejections.total")
                .tag("route", "/api/auth/login")
                .counter()
                .count());
    }

    @Test
    @DisplayName("should tag security events with lowercase type and severity")
    void shouldTagSecurityEvents() {
        metrics.recordSecurityEvent(SecurityEventType.SUSPECTED_HIJACK, Severity.CRITICAL);

        assertEquals(1.0, registry.get("warden.security.events.total")
                .tag("type", "suspected_hijack")
                .tag("severity", "critical")
                .counter()
                .count());
    }

    @Test
    @DisplayName("should tag missing values as unknown")
    void shouldTagNullAsUnknown() {
        metrics.recordUnlock(null);
        metrics.recordRedisTimeout("lockout", null);

        assertNotNull(registry.find("warden.lockout.unlocks.total").tag("trigger", "unknown").counter());
        assertNotNull(registry.find("warden.redis.timeouts.total").tag("operation", "unknown").counter());
    }

    @Test
    @DisplayName("should record nothing when disabled")
    void shouldRecordNothingWhenDisabled() {
        var disabled = new WardenMetrics(registry, () -> false);

        disabled.recordLockout();
        disabled.recordNotificationDropped("FORCED_LOGOUT");
        disabled.recordRedisFailure("rate-limit", "checkAndConsume");

        assertFalse(disabled.isEnabled());
        assertTrue(registry.getMeters().isEmpty());
    }

    @Test
    @DisplayName("should be disabled without a registry")
    void shouldBeDisabledWithoutRegistry() {
        var noRegistry = new WardenMetrics(null, () -> true);

        noRegistry.recordLockout();

        assertFalse(noRegistry.isEnabled());
    }
}
