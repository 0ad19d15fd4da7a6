package warden.core.service.security;

import java.util.LinkedHashMap;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.model.notification.Notification;
import warden.core.model.notification.NotificationKind;
import warden.core.model.security.SecurityEvent;
import warden.core.model.session.ForcedLogoutEvent;
import warden.core.model.session.SecondFactorRequiredEvent;
import warden.core.port.out.Metrics;
import warden.core.port.out.NotificationDispatcher;

/**
 * Executes the automatic response attached to each security event.
 *
 * <p>Every event is recorded in the {@link SecurityEventLog} and counted,
 * whatever its response. Forced logout is delivered synchronously to
 * observers, so sessions are gone by the time {@link #execute} returns.
 */
@ApplicationScoped
public class SecurityResponseExecutor {

    private static final Logger LOG = Logger.getLogger(SecurityResponseExecutor.class);

    private final SecurityEventLog eventLog;
    private final NotificationDispatcher notifications;
    private final Metrics metrics;
    private final Event<ForcedLogoutEvent> forcedLogout;
    private final Event<SecondFactorRequiredEvent> secondFactorRequired;

    @Inject
    public SecurityResponseExecutor(
            SecurityEventLog eventLog,
            NotificationDispatcher notifications,
            Metrics metrics,
            Event<ForcedLogoutEvent> forcedLogout,
            Event<SecondFactorRequiredEvent> secondFactorRequired) {
        this.eventLog = eventLog;
        this.notifications = notifications;
        this.metrics = metrics;
        this.forcedLogout = forcedLogout;
        this.secondFactorRequired = secondFactorRequired;
    }

    public void executeAll(List<SecurityEvent> events) {
        events.forEach(this::execute);
    }

    public void execute(SecurityEvent event) {
        eventLog.record(event);
        metrics.recordSecurityEvent(event.type(), event.severity());
        LOG.infov(
                "Security event: type={0}, severity={1}, user={2}, response={3}",
                event.type(), event.severity(), event.userId(), event.autoResponse());

        switch (event.autoResponse()) {
            case ALERT_USER -> sendNotification(
                    event, NotificationKind.SECURITY_ALERT, "Suspicious activity on your account");
            case FORCE_LOGOUT -> {
                forcedLogout.fire(new ForcedLogoutEvent(event.userId(), event.type(), event.timestamp()));
                sendNotification(
                        event,
                        NotificationKind.FORCED_LOGOUT,
                        "All sessions were signed out after suspicious activity");
            }
            case REQUIRE_SECOND_FACTOR -> {
                secondFactorRequired.fire(
                        new SecondFactorRequiredEvent(event.userId(), event.type(), event.timestamp()));
                sendNotification(
                        event,
                        NotificationKind.SECOND_FACTOR_REQUIRED,
                        "Additional verification is required on your next sign-in");
            }
            case NONE -> {
                // recorded only
            }
        }
    }

    private void sendNotification(SecurityEvent event, NotificationKind kind, String reason) {
        final var metadata = new LinkedHashMap<String, Object>(event.metadata());
        metadata.put("eventType", event.type().name());
        notifications.dispatch(
                new Notification(kind, event.severity(), event.userId(), reason, metadata, event.timestamp()));
    }
}
