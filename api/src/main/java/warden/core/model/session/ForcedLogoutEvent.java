package warden.core.model.session;

import java.time.Instant;

import warden.core.model.security.SecurityEventType;

/**
 * Fired when a security response terminates every session of a user.
 *
 * <p>Observers holding session state for the user must drop it.
 *
 * @param userId the user whose sessions are terminated
 * @param cause the event type that triggered the logout
 * @param timestamp when the logout was requested
 */
public record ForcedLogoutEvent(String userId, SecurityEventType cause, Instant timestamp) {}
