package warden.core.model.security;

/**
 * Automated response recommended for a security event.
 */
public enum AutoResponse {
    /** Notify the account owner. */
    ALERT_USER,
    /** Terminate every session of the user, then notify. */
    FORCE_LOGOUT,
    /** Challenge the user for a second factor. */
    REQUIRE_SECOND_FACTOR,
    /** Record only. */
    NONE
}
