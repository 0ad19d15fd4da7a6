package warden.core.service.auth;

import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.auth.LoginContext;
import warden.core.model.lockout.AttemptDecision;
import warden.core.model.lockout.AttemptMetadata;
import warden.core.model.lockout.LockoutStatus;
import warden.core.model.security.SecurityEvent;
import warden.core.model.session.SessionRecord;
import warden.core.port.in.LoginGuard;
import warden.core.service.lockout.AccountLockoutGuard;
import warden.core.service.security.AnomalyDetector;
import warden.core.service.session.SessionTracker;

/**
 * Wires lockout, session tracking and anomaly detection into the login flow.
 */
@ApplicationScoped
public class LoginGuardService implements LoginGuard {

    private static final Logger LOG = Logger.getLogger(LoginGuardService.class);

    private final AccountLockoutGuard lockoutGuard;
    private final SessionTracker sessionTracker;
    private final AnomalyDetector anomalyDetector;

    @Inject
    public LoginGuardService(
            AccountLockoutGuard lockoutGuard, SessionTracker sessionTracker, AnomalyDetector anomalyDetector) {
        this.lockoutGuard = lockoutGuard;
        this.sessionTracker = sessionTracker;
        this.anomalyDetector = anomalyDetector;
    }

    @Override
    public Uni<AttemptDecision> beforeCredentialCheck(String identity) {
        return lockoutGuard.canAttempt(identity);
    }

    @Override
    public Uni<List<SecurityEvent>> onLoginSucceeded(LoginContext context) {
        if (context.userId() == null || context.sessionId() == null) {
            throw new IllegalArgumentException("A successful login needs a userId and a sessionId");
        }
        final var session = new SessionRecord(
                context.userId(),
                context.sessionId(),
                context.networkOrigin(),
                context.deviceId(),
                context.userAgent(),
                context.timestamp());

        return lockoutGuard
                .recordSuccess(context.identity())
                .map(v -> sessionTracker.track(session))
                .flatMap(sessionEvents -> anomalyDetector.onLoginSucceeded(context).map(loginEvents -> {
                    final var events = new ArrayList<SecurityEvent>(sessionEvents);
                    events.addAll(loginEvents);
                    return List.copyOf(events);
                }));
    }

    @Override
    public Uni<LockoutStatus> onLoginFailed(LoginContext context) {
        final var metadata = new AttemptMetadata(context.networkOrigin(), context.userAgent());
        return lockoutGuard
                .recordFailure(context.identity(), metadata)
                .call(status -> anomalyDetector.onLoginFailed(context));
    }

    @Override
    public void onLogout(String sessionId, String userId) {
        if (!sessionTracker.remove(sessionId, userId)) {
            LOG.debugv("Logout for untracked session of user {0}", userId);
        }
    }

    @Override
    public List<SecurityEvent> onSecondFactorFailures(String userId, int failureCount) {
        return anomalyDetector.onSecondFactorFailures(userId, failureCount);
    }
}
