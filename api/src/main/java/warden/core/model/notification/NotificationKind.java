package warden.core.model.notification;

/**
 * Reasons this service notifies an account owner or operator.
 */
public enum NotificationKind {
    ACCOUNT_LOCKED,
    ACCOUNT_UNLOCKED,
    SECURITY_ALERT,
    FORCED_LOGOUT,
    SECOND_FACTOR_REQUIRED
}
