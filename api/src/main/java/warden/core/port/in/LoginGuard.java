package warden.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.LoginContext;
import warden.core.model.lockout.AttemptDecision;
import warden.core.model.lockout.LockoutStatus;
import warden.core.model.security.SecurityEvent;

/**
 * Use case called by the authentication flow around credential verification.
 */
public interface LoginGuard {

    /**
     * Decide whether credentials may be verified for the identity.
     *
     * @param identity the login identity
     * @return the decision; when not allowed, credentials must not be checked
     */
    Uni<AttemptDecision> beforeCredentialCheck(String identity);

    /**
     * Report a successful login.
     *
     * <p>Clears the lockout state, starts tracking the session and runs the
     * login detectors.
     *
     * @param context the login details; {@code userId} and {@code sessionId} are required
     * @return the security events raised by the login
     */
    Uni<List<SecurityEvent>> onLoginSucceeded(LoginContext context);

    /**
     * Report a failed login.
     *
     * @param context the login details
     * @return the lockout state after recording the failure
     */
    Uni<LockoutStatus> onLoginFailed(LoginContext context);

    /**
     * Report a logout.
     *
     * @param sessionId the ended session
     * @param userId the session owner
     */
    void onLogout(String sessionId, String userId);

    /**
     * Report consecutive second-factor failures for a user.
     *
     * @param userId the user
     * @param failureCount failures so far
     * @return the security events raised
     */
    List<SecurityEvent> onSecondFactorFailures(String userId, int failureCount);
}
