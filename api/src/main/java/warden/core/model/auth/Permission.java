package warden.core.model.auth;

/**
 * Permissions checked by the administrative endpoints.
 *
 * <p>The {@code *_VALUE} constants exist for use in annotations.
 */
public enum Permission {
    ADMIN("admin"),
    LOCKOUTS_READ("lockouts.read"),
    LOCKOUTS_WRITE("lockouts.write"),
    SECURITY_EVENTS_READ("security-events.read"),
    RATE_LIMITS_WRITE("rate-limits.write");

    public static final String ADMIN_VALUE = "admin";
    public static final String LOCKOUTS_READ_VALUE = "lockouts.read";
    public static final String LOCKOUTS_WRITE_VALUE = "lockouts.write";
    public static final String SECURITY_EVENTS_READ_VALUE = "security-events.read";
    public static final String RATE_LIMITS_WRITE_VALUE = "rate-limits.write";

    private final String value;

    Permission(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
