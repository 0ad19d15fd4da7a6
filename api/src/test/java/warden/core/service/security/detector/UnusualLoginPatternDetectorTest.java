package warden.core.service.security.detector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.audit.InMemoryAuditLog;
import warden.core.model.audit.AuditAction;
import warden.core.model.audit.AuditEntry;
import warden.core.model.security.AutoResponse;
import warden.core.model.security.SecurityEventType;
import warden.core.model.security.Severity;
import warden.core.port.out.AuditLogReader;

@DisplayName("UnusualLoginPatternDetector")
class UnusualLoginPatternDetectorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final Duration WAIT = Duration.ofSeconds(1);

    private final InMemoryAuditLog auditLog = new InMemoryAuditLog();
    private final UnusualLoginPatternDetector detector =
            new UnusualLoginPatternDetector(auditLog, 5, Duration.ofHours(1), 3, Duration.ofMinutes(5));

    private void failedLogins(String origin, int count, Instant at) {
        for (int i = 0; i < count; i++) {
            auditLog.append(new AuditEntry(AuditAction.LOGIN_FAILED, "user-" + i, origin, null, at));
        }
    }

    @Nested
    @DisplayName("detectFailedLoginBurst()")
    class FailedLoginBurstTests {

        @Test
        @DisplayName("should flag five failures from one origin within the hour")
        void shouldFlagBurst() {
            failedLogins("203.0.113.7", 5, NOW.minus(Duration.ofMinutes(30)));

            var event = detector.detectFailedLoginBurst("alice@example.com", "203.0.113.7", NOW)
                    .await()
                    .atMost(WAIT)
                    .orElseThrow();

            assertEquals(SecurityEventType.UNUSUAL_LOGIN_PATTERN, event.type());
            assertEquals(Severity.HIGH, event.severity());
            assertEquals(AutoResponse.NONE, event.autoResponse());
            assertEquals("failed-login-burst", event.metadata().get("pattern"));
        }

        @Test
        @DisplayName("should ignore failures outside the window and from other origins")
        void shouldIgnoreOldAndForeignFailures() {
            failedLogins("203.0.113.7", 4, NOW.minus(Duration.ofMinutes(30)));
            failedLogins("203.0.113.7", 3, NOW.minus(Duration.ofHours(2)));
            failedLogins("198.51.100.1", 3, NOW.minus(Duration.ofMinutes(1)));

            var event = detector.detectFailedLoginBurst("alice@example.com", "203.0.113.7", NOW)
                    .await()
                    .atMost(WAIT);

            assertTrue(event.isEmpty());
        }

        @Test
        @DisplayName("should skip attempts with no origin")
        void shouldSkipMissingOrigin() {
            assertTrue(detector.detectFailedLoginBurst("alice@example.com", null, NOW)
                    .await()
                    .atMost(WAIT)
                    .isEmpty());
        }

        @Test
        @DisplayName("should detect nothing when the audit log fails")
        void shouldDetectNothingOnFailure() {
            var broken = mock(AuditLogReader.class);
            when(broken.count(any())).thenReturn(Uni.createFrom().failure(new RuntimeException("db down")));
            var failing = new UnusualLoginPatternDetector(broken, 5, Duration.ofHours(1), 3, Duration.ofMinutes(5));

            assertTrue(failing.detectFailedLoginBurst("alice@example.com", "203.0.113.7", NOW)
                    .await()
                    .atMost(WAIT)
                    .isEmpty());
        }
    }

    @Nested
    @DisplayName("detectOriginSpread()")
    class OriginSpreadTests {

        @Test
        @DisplayName("should require a second factor when three origins log in within five minutes")
        void shouldFlagThreeOrigins() {
            auditLog.append(new AuditEntry(AuditAction.LOGIN, "user-1", "10.0.0.1", null, NOW.minusSeconds(120)));
            auditLog.append(new AuditEntry(AuditAction.LOGIN, "user-1", "10.0.0.2", null, NOW.minusSeconds(60)));

            var event = detector.detectOriginSpread("user-1", "10.0.0.3", NOW)
                    .await()
                    .atMost(WAIT)
                    .orElseThrow();

            assertEquals(Severity.MEDIUM, event.severity());
            assertEquals(AutoResponse.REQUIRE_SECOND_FACTOR, event.autoResponse());
            assertEquals(3, event.metadata().get("originCount"));
        }

        @Test
        @DisplayName("should not count the current origin twice")
        void shouldNotDoubleCountCurrentOrigin() {
            auditLog.append(new AuditEntry(AuditAction.LOGIN, "user-1", "10.0.0.1", null, NOW.minusSeconds(120)));
            auditLog.append(new AuditEntry(AuditAction.LOGIN, "user-1", "10.0.0.2", null, NOW));

            assertTrue(detector.detectOriginSpread("user-1", "10.0.0.2", NOW)
                    .await()
                    .atMost(WAIT)
                    .isEmpty());
        }

        @Test
        @DisplayName("should ignore logins older than the window")
        void shouldIgnoreOldLogins() {
            auditLog.append(new AuditEntry(AuditAction.LOGIN, "user-1", "10.0.0.1", null, NOW.minusSeconds(600)));
            auditLog.append(new AuditEntry(AuditAction.LOGIN, "user-1", "10.0.0.2", null, NOW.minusSeconds(60)));

            assertTrue(detector.detectOriginSpread("user-1", "10.0.0.3", NOW)
                    .await()
                    .atMost(WAIT)
                    .isEmpty());
        }
    }
}
