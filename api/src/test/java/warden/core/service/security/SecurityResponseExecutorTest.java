package warden.core.service.security;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import jakarta.enterprise.event.Event;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.MutableClock;
import warden.TestConfigs;
import warden.core.model.notification.NotificationKind;
import warden.core.model.security.AutoResponse;
import warden.core.model.security.SecurityEvent;
import warden.core.model.security.SecurityEventType;
import warden.core.model.security.Severity;
import warden.core.model.session.ForcedLogoutEvent;
import warden.core.model.session.SecondFactorRequiredEvent;
import warden.core.port.out.Metrics;
import warden.core.port.out.NotificationDispatcher;

@DisplayName("SecurityResponseExecutor")
@ExtendWith(MockitoExtension.class)
class SecurityResponseExecutorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private NotificationDispatcher notifications;

    @Mock
    private Metrics metrics;

    @Mock
    private Event<ForcedLogoutEvent> forcedLogout;

    @Mock
    private Event<SecondFactorRequiredEvent> secondFactorRequired;

    private SecurityEventLog eventLog;
    private SecurityResponseExecutor executor;

    @BeforeEach
    void setUp() {
        eventLog = new SecurityEventLog(TestConfigs.history(), new MutableClock(NOW));
        executor = new SecurityResponseExecutor(eventLog, notifications, metrics, forcedLogout, secondFactorRequired);
    }

    private static SecurityEvent event(SecurityEventType type, Severity severity, AutoResponse response) {
        return SecurityEvent.builder(type, severity, response)
                .userId("user-1")
                .timestamp(NOW)
                .with("networkOrigin", "203.0.113.7")
                .build();
    }

    @Test
    @DisplayName("should alert the user")
    void shouldAlertUser() {
        executor.execute(event(SecurityEventType.CONCURRENT_SESSION, Severity.HIGH, AutoResponse.ALERT_USER));

        verify(notifications).dispatch(argThat(n -> n.kind() == NotificationKind.SECURITY_ALERT
                && n.recipient().equals("user-1")
                && "CONCURRENT_SESSION".equals(n.metadata().get("eventType"))
                && "203.0.113.7".equals(n.metadata().get("networkOrigin"))));
        verifyNoInteractions(forcedLogout, secondFactorRequired);
    }

    @Test
    @DisplayName("should fire a forced logout and notify")
    void shouldForceLogout() {
        executor.execute(event(SecurityEventType.SUSPECTED_HIJACK, Severity.CRITICAL, AutoResponse.FORCE_LOGOUT));

        verify(forcedLogout).fire(new ForcedLogoutEvent("user-1", SecurityEventType.SUSPECTED_HIJACK, NOW));
        verify(notifications).dispatch(argThat(n -> n.kind() == NotificationKind.FORCED_LOGOUT));
    }

    @Test
    @DisplayName("should require a second factor and notify")
    void shouldRequireSecondFactor() {
        executor.execute(
                event(SecurityEventType.UNUSUAL_LOGIN_PATTERN, Severity.MEDIUM, AutoResponse.REQUIRE_SECOND_FACTOR));

        verify(secondFactorRequired)
                .fire(new SecondFactorRequiredEvent("user-1", SecurityEventType.UNUSUAL_LOGIN_PATTERN, NOW));
        verify(notifications).dispatch(argThat(n -> n.kind() == NotificationKind.SECOND_FACTOR_REQUIRED));
    }

    @Test
    @DisplayName("should only record events with no automatic response")
    void shouldOnlyRecord() {
        executor.execute(event(SecurityEventType.UNUSUAL_TIME, Severity.LOW, AutoResponse.NONE));

        verify(notifications, never()).dispatch(any());
        verify(metrics).recordSecurityEvent(SecurityEventType.UNUSUAL_TIME, Severity.LOW);
        assertEquals(1, eventLog.size());
    }

    @Test
    @DisplayName("should record every event it executes")
    void shouldRecordEveryEvent() {
        executor.executeAll(List.of(
                event(SecurityEventType.UNUSUAL_TIME, Severity.LOW, AutoResponse.NONE),
                event(SecurityEventType.DEVICE_CHANGE, Severity.MEDIUM, AutoResponse.ALERT_USER)));

        assertEquals(2, eventLog.userEvents("user-1", NOW.minus(Duration.ofMinutes(1)), 10).size());
    }
}
