package warden.core.service.security.detector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.adapter.out.audit.InMemoryAuditLog;
import warden.core.model.audit.AuditAction;
import warden.core.model.audit.AuditEntry;
import warden.core.model.security.AutoResponse;
import warden.core.model.security.SecurityEventType;
import warden.core.model.security.Severity;

@DisplayName("MassDataAccessDetector")
class MassDataAccessDetectorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final Duration WAIT = Duration.ofSeconds(1);

    private final InMemoryAuditLog auditLog = new InMemoryAuditLog();
    private final MassDataAccessDetector detector = new MassDataAccessDetector(auditLog);

    private void views(String resourceType, int count, Instant at) {
        for (int i = 0; i < count; i++) {
            auditLog.append(new AuditEntry(AuditAction.SENSITIVE_RECORD_VIEW, "user-1", null, resourceType, at));
        }
    }

    @Test
    @DisplayName("should raise a critical alert at the threshold")
    void shouldAlertAtThreshold() {
        views("patient", 50, NOW.minusSeconds(300));

        var event = detector.detect("user-1", "patient", Duration.ofMinutes(10), 50, NOW)
                .await()
                .atMost(WAIT)
                .orElseThrow();

        assertEquals(SecurityEventType.MASS_DATA_ACCESS, event.type());
        assertEquals(Severity.CRITICAL, event.severity());
        assertEquals(AutoResponse.ALERT_USER, event.autoResponse());
        assertEquals("patient", event.metadata().get("resourceType"));
    }

    @Test
    @DisplayName("should only count views of the given resource type inside the window")
    void shouldScopeToTypeAndWindow() {
        views("patient", 30, NOW.minusSeconds(300));
        views("billing", 30, NOW.minusSeconds(300));
        views("patient", 30, NOW.minus(Duration.ofHours(1)));

        assertTrue(detector.detect("user-1", "patient", Duration.ofMinutes(10), 50, NOW)
                .await()
                .atMost(WAIT)
                .isEmpty());
    }

    @Test
    @DisplayName("should reject a non-positive window or threshold")
    void shouldRejectInvalidArguments() {
        assertThrows(
                IllegalArgumentException.class,
                () -> detector.detect("user-1", "patient", Duration.ZERO, 50, NOW));
        assertThrows(
                IllegalArgumentException.class,
                () -> detector.detect("user-1", "patient", Duration.ofMinutes(10), 0, NOW));
    }
}
