package warden.core.model.session;

import java.time.Instant;

import warden.core.model.security.SecurityEventType;

/**
 * Fired when a user must complete a second factor before continuing.
 *
 * @param userId the user to challenge
 * @param cause the event type that triggered the challenge
 * @param timestamp when the challenge was requested
 */
public record SecondFactorRequiredEvent(String userId, SecurityEventType cause, Instant timestamp) {}
