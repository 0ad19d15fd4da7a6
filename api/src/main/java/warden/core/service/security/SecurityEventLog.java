package warden.core.service.security;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import org.jboss.logging.Logger;

import warden.core.config.AnomalyConfig;
import warden.core.model.security.SecurityEvent;
import warden.core.model.security.Severity;

/**
 * Bounded in-process history of detected security events.
 *
 * <p>Each user keeps at most {@code maxEventsPerUser} events; the oldest is
 * dropped first. Events older than the retention period are removed by a
 * scheduled sweep.
 */
@ApplicationScoped
public class SecurityEventLog {

    private static final Logger LOG = Logger.getLogger(SecurityEventLog.class);

    private final ConcurrentMap<String, Deque<SecurityEvent>> eventsByUser = new ConcurrentHashMap<>();
    private final int maxEventsPerUser;
    private final AnomalyConfig.HistoryConfig history;
    private final Clock clock;

    @Inject
    public SecurityEventLog(AnomalyConfig config) {
        this(config.history(), Clock.systemUTC());
    }

    public SecurityEventLog(AnomalyConfig.HistoryConfig history, Clock clock) {
        if (history.maxEventsPerUser() <= 0) {
            throw new IllegalArgumentException("maxEventsPerUser must be positive");
        }
        this.history = history;
        this.maxEventsPerUser = history.maxEventsPerUser();
        this.clock = clock;
    }

    public void record(SecurityEvent event) {
        eventsByUser.compute(event.userId(), (userId, events) -> {
            final var deque = events != null ? events : new ArrayDeque<SecurityEvent>();
            deque.addLast(event);
            while (deque.size() > maxEventsPerUser) {
                deque.removeFirst();
            }
            return deque;
        });
    }

    /**
     * Events for one user, newest first.
     *
     * @param userId the user
     * @param since inclusive lower bound (null for all)
     * @param limit maximum events returned
     */
    public List<SecurityEvent> userEvents(String userId, Instant since, int limit) {
        final var snapshot = new ArrayList<SecurityEvent>();
        eventsByUser.computeIfPresent(userId, (id, events) -> {
            snapshot.addAll(events);
            return events;
        });
        return snapshot.stream()
                .filter(event -> since == null || !event.timestamp().isBefore(since))
                .sorted(Comparator.comparing(SecurityEvent::timestamp).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    /**
     * Events across all users, newest first.
     *
     * @param since inclusive lower bound (null for all)
     * @param minSeverity lowest severity included (null for all)
     * @param limit maximum events returned
     */
    public List<SecurityEvent> allEvents(Instant since, Severity minSeverity, int limit) {
        final var snapshot = new ArrayList<SecurityEvent>();
        for (var userId : eventsByUser.keySet()) {
            eventsByUser.computeIfPresent(userId, (id, events) -> {
                snapshot.addAll(events);
                return events;
            });
        }
        return snapshot.stream()
                .filter(event -> since == null || !event.timestamp().isBefore(since))
                .filter(event -> minSeverity == null || event.severity().isAtLeast(minSeverity))
                .sorted(Comparator.comparing(SecurityEvent::timestamp).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    /**
     * Remove events recorded before a cutoff.
     *
     * @return the number of events removed
     */
    public int sweep(Instant olderThan) {
        var removed = 0;
        for (var userId : eventsByUser.keySet()) {
            final var counter = new int[1];
            eventsByUser.computeIfPresent(userId, (id, events) -> {
                final var before = events.size();
                events.removeIf(event -> event.timestamp().isBefore(olderThan));
                counter[0] = before - events.size();
                return events.isEmpty() ? null : events;
            });
            removed += counter[0];
        }
        return removed;
    }

    @Scheduled(
            every = "${warden.anomaly.history.sweep-interval:1h}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void sweepExpired() {
        final var removed = sweep(clock.instant().minus(history.retention()));
        if (removed > 0) {
            LOG.debugv("Swept {0} expired security event(s)", removed);
        }
    }

    public int size() {
        return eventsByUser.values().stream().mapToInt(Deque::size).sum();
    }
}
