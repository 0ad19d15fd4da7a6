package warden.core.model.lockout;

/**
 * A locked identity with its lock record, as listed to administrators.
 *
 * @param identity the normalized identity
 * @param lockout the active lock
 */
public record LockedAccount(String identity, LockoutRecord lockout) {}
