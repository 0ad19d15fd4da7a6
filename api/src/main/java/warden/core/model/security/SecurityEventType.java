package warden.core.model.security;

/**
 * Kinds of suspicious activity recognized by the detectors.
 */
public enum SecurityEventType {
    CONCURRENT_SESSION,
    RAPID_ORIGIN_CHANGE,
    DEVICE_CHANGE,
    UNUSUAL_TIME,
    EXCESSIVE_SECOND_FACTOR_FAILURES,
    SUSPECTED_HIJACK,
    UNUSUAL_LOGIN_PATTERN,
    MASS_DATA_ACCESS,
    ACCOUNT_COMPROMISE,
    DATA_EXFILTRATION
}
