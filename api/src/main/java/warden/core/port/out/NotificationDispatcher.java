package warden.core.port.out;

import warden.core.model.notification.Notification;

/**
 * Port for fire-and-forget security notifications.
 *
 * <p>{@link #dispatch} enqueues and returns. Delivery failures are handled by
 * the implementation and never reach the caller.
 */
public interface NotificationDispatcher {

    /**
     * Enqueue a notification for asynchronous delivery.
     *
     * @param notification the notification
     * @return true if it was accepted, false if it was dropped
     */
    boolean dispatch(Notification notification);
}
