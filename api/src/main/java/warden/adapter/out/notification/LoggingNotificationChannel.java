package warden.adapter.out.notification;

import org.jboss.logging.Logger;

import warden.core.model.notification.Notification;
import warden.spi.NotificationChannel;

/**
 * Notification channel that writes notifications to the {@code warden.security}
 * log category.
 *
 * <p>Built in with priority 0. Log level follows severity: LOW as INFO, MEDIUM
 * and HIGH as WARN, CRITICAL as ERROR.
 */
public class LoggingNotificationChannel implements NotificationChannel {

    private static final Logger LOG = Logger.getLogger("warden.security");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public void deliver(Notification notification) {
        var message = format(notification);

        switch (notification.severity()) {
            case LOW -> LOG.info(message);
            case MEDIUM, HIGH -> LOG.warn(message);
            case CRITICAL -> LOG.error(message);
        }
    }

    static String format(Notification notification) {
        return String.format(
                "%s: recipient=%s severity=%s reason=%s details=%s",
                notification.kind(),
                notification.recipient(),
                notification.severity(),
                notification.reason(),
                notification.metadata());
    }
}
