package warden.spi;

import warden.core.model.notification.Notification;

/**
 * Service Provider Interface for notification delivery channels.
 *
 * <p>Channels are discovered via {@link java.util.ServiceLoader} from
 * {@code META-INF/services/warden.spi.NotificationChannel} and invoked in
 * priority order on the dispatcher's worker thread.
 *
 * <p>Implementations must be thread-safe. Exceptions thrown from
 * {@link #deliver} are logged by the dispatcher and do not affect other
 * channels.
 */
public interface NotificationChannel {

    /**
     * Unique name of this channel for logging.
     *
     * @return the channel name
     */
    String name();

    /**
     * Higher priority channels are invoked first.
     *
     * @return the priority (default: 0)
     */
    default int priority() {
        return 0;
    }

    /**
     * Check whether this channel can deliver in the current environment.
     *
     * @return true if the channel should receive notifications
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Deliver one notification.
     *
     * @param notification the notification
     */
    void deliver(Notification notification);

    /**
     * Release resources held by the channel.
     */
    default void close() {}
}
