package warden.core.service.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.runtime.configuration.ConfigurationException;
import org.jboss.logging.Logger;

import warden.core.config.SessionMonitorConfig;
import warden.core.model.security.SecurityEvent;
import warden.core.model.session.ForcedLogoutEvent;
import warden.core.model.session.SessionRecord;
import warden.core.service.security.SecurityResponseExecutor;

/**
 * Tracks active sessions per user and flags suspicious session patterns.
 *
 * <p>All reads and writes for one user happen inside a single
 * {@link ConcurrentMap#compute} call, so the checks always see the state
 * transition they are judging. Detected events are handed to the
 * {@link SecurityResponseExecutor} after the compute has finished.
 *
 * <p>State is process-local. Sessions idle for longer than the device window
 * are pruned whenever the user's sessions are touched, and each user keeps at
 * most {@code maxSessionsPerUser} sessions.
 */
@ApplicationScoped
public class SessionTracker {

    private static final Logger LOG = Logger.getLogger(SessionTracker.class);

    private final ConcurrentMap<String, Map<String, SessionRecord>> sessionsByUser = new ConcurrentHashMap<>();
    private final SessionMonitorConfig config;
    private final SessionChecks checks;
    private final SecurityResponseExecutor executor;
    private final Clock clock;

    @Inject
    public SessionTracker(SessionMonitorConfig config, SecurityResponseExecutor executor) {
        this(config, executor, Clock.systemUTC());
    }

    public SessionTracker(SessionMonitorConfig config, SecurityResponseExecutor executor, Clock clock) {
        validate(config);
        this.config = config;
        this.checks = new SessionChecks(config);
        this.executor = executor;
        this.clock = clock;
    }

    void onStart(@Observes StartupEvent event) {
        LOG.infov(
                "Session tracking: maxConcurrentSessions={0}, maxOriginChangesPerHour={1}, maxSessionsPerUser={2}",
                config.maxConcurrentSessions(),
                config.maxOriginChangesPerHour(),
                config.maxSessionsPerUser());
    }

    void onForcedLogout(@Observes ForcedLogoutEvent event) {
        final var removed = removeAll(event.userId());
        LOG.infov("Forced logout for user {0} ({1}): removed {2} session(s)", event.userId(), event.cause(), removed);
    }

    /**
     * Start or refresh tracking of a session and run the session checks.
     *
     * <p>Removing a newly tracked session restores the user's previous
     * sessions, except when tracking it evicted the least recently active one
     * at {@code maxSessionsPerUser}, or when the id was already tracked and
     * this call replaced its record.
     *
     * @param session the session; its {@code lastActivity} is the reference time for the checks
     * @return the events raised, already handed to the response executor
     */
    public List<SecurityEvent> track(SessionRecord session) {
        final var events = new ArrayList<SecurityEvent>();

        sessionsByUser.compute(session.userId(), (userId, existing) -> {
            final var sessions = existing != null ? existing : new LinkedHashMap<String, SessionRecord>();
            pruneStale(sessions, session.lastActivity());
            sessions.put(session.sessionId(), session);
            evictOverflow(sessions);

            final var snapshot = List.copyOf(sessions.values());
            checks.concurrentSessions(session, snapshot).ifPresent(events::add);
            checks.originChurn(session, snapshot).ifPresent(events::add);
            checks.deviceChange(session, snapshot).ifPresent(events::add);
            return sessions;
        });

        if (!events.isEmpty()) {
            LOG.debugv(
                    "Session {0} for user {1} raised {2} event(s)",
                    session.sessionId(), session.userId(), events.size());
            executor.executeAll(events);
        }
        return List.copyOf(events);
    }

    /**
     * Record activity on a tracked session.
     *
     * @return true if the session is tracked
     */
    public boolean touch(String sessionId, String userId) {
        final var now = clock.instant();
        final var touched = new boolean[1];
        sessionsByUser.computeIfPresent(userId, (id, sessions) -> {
            pruneStale(sessions, now);
            final var session = sessions.get(sessionId);
            if (session != null) {
                sessions.put(sessionId, session.withLastActivity(now));
                touched[0] = true;
            }
            return sessions.isEmpty() ? null : sessions;
        });
        return touched[0];
    }

    /**
     * Stop tracking one session.
     *
     * @return true if the session was tracked
     */
    public boolean remove(String sessionId, String userId) {
        final var removed = new boolean[1];
        sessionsByUser.computeIfPresent(userId, (id, sessions) -> {
            removed[0] = sessions.remove(sessionId) != null;
            return sessions.isEmpty() ? null : sessions;
        });
        return removed[0];
    }

    /**
     * Stop tracking every session of a user.
     *
     * @return the number of sessions removed
     */
    public int removeAll(String userId) {
        final var sessions = sessionsByUser.remove(userId);
        return sessions != null ? sessions.size() : 0;
    }

    /**
     * Sessions of a user, most recently active first.
     */
    public List<SessionRecord> activeSessions(String userId) {
        final var now = clock.instant();
        final var snapshot = new ArrayList<SessionRecord>();
        sessionsByUser.computeIfPresent(userId, (id, sessions) -> {
            pruneStale(sessions, now);
            snapshot.addAll(sessions.values());
            return sessions.isEmpty() ? null : sessions;
        });
        snapshot.sort(Comparator.comparing(SessionRecord::lastActivity).reversed());
        return List.copyOf(snapshot);
    }

    public int trackedUsers() {
        return sessionsByUser.size();
    }

    private void pruneStale(Map<String, SessionRecord> sessions, Instant now) {
        final var horizon = now.minus(config.deviceWindow());
        sessions.values().removeIf(s -> s.lastActivity().isBefore(horizon));
    }

    private void evictOverflow(Map<String, SessionRecord> sessions) {
        while (sessions.size() > config.maxSessionsPerUser()) {
            final var oldest = sessions.values().stream()
                    .min(Comparator.comparing(SessionRecord::lastActivity))
                    .orElseThrow();
            sessions.remove(oldest.sessionId());
        }
    }

    static void validate(SessionMonitorConfig config) {
        if (config.maxConcurrentSessions() <= 0
                || config.maxOriginChangesPerHour() <= 0
                || config.maxSessionsPerUser() <= 0) {
            throw new ConfigurationException("warden.sessions limits must be positive");
        }
        if (!isPositive(config.concurrentWindow())
                || !isPositive(config.originWindow())
                || !isPositive(config.deviceWindow())) {
            throw new ConfigurationException("warden.sessions windows must be positive");
        }
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }
}
