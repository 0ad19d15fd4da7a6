package warden.core.model.audit;

/**
 * Actions recorded by the audit log.
 */
public enum AuditAction {
    LOGIN,
    LOGIN_FAILED,
    LOGOUT,
    PASSWORD_CHANGE,
    SECOND_FACTOR_ENABLED,
    SECOND_FACTOR_DISABLED,
    SENSITIVE_RECORD_VIEW,
    SENSITIVE_RECORD_EXPORT,
    ACCOUNT_LOCKED,
    ACCOUNT_UNLOCKED
}
