package warden.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.lockout.FailedAttempt;
import warden.core.model.lockout.LockedAccount;
import warden.core.model.lockout.LockoutRecord;
import warden.spi.FailedAttemptRepository;

/**
 * In-memory implementation of FailedAttemptRepository.
 *
 * <p>
 * Used on its own when Redis is not configured, and as the local fallback
 * behind Redis otherwise. Ledgers and lockouts are lost on restart and not
 * shared across instances.
 *
 * <p>
 * Updates to one identity's ledger go through {@link ConcurrentMap#compute},
 * so concurrent failures for the same identity are counted exactly.
 */
public class InMemoryFailedAttemptRepository implements FailedAttemptRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryFailedAttemptRepository.class);

    private final ConcurrentMap<String, Ledger> ledgers = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LockoutRecord> lockouts = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryFailedAttemptRepository() {
        this(Clock.systemUTC());
    }

    public InMemoryFailedAttemptRepository(Clock clock) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "failed-attempt-cleanup");
            t.setDaemon(true);
            return t;
        });

        // Run cleanup every minute
        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, 1, 1, TimeUnit.MINUTES);
        LOG.debug("Initialized in-memory failed attempt repository");
    }

    @Override
    public Uni<Integer> recordFailedAttempt(String identity, FailedAttempt attempt, Duration window, int maxEntries) {
        return Uni.createFrom().item(() -> {
            final var windowStart = clock.instant().minus(window);

            final var ledger = ledgers.compute(identity, (k, existing) -> {
                final var attempts = existing == null ? new ArrayList<FailedAttempt>() : existing.inWindow(windowStart);
                attempts.add(attempt);
                final var from = Math.max(0, attempts.size() - maxEntries);
                return new Ledger(List.copyOf(attempts.subList(from, attempts.size())), window);
            });

            LOG.debugf("Recorded failed attempt: count=%d", ledger.attempts().size());
            return ledger.attempts().size();
        });
    }

    @Override
    public Uni<Integer> countFailedAttempts(String identity, Duration window) {
        return Uni.createFrom().item(() -> {
            final var ledger = ledgers.get(identity);
            if (ledger == null) {
                return 0;
            }
            return ledger.inWindow(clock.instant().minus(window)).size();
        });
    }

    @Override
    public Uni<Void> clearFailedAttempts(String identity) {
        return Uni.createFrom().item(() -> ledgers.remove(identity)).replaceWithVoid();
    }

    @Override
    public Uni<Boolean> saveLockout(String identity, LockoutRecord lockout) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var created = new boolean[1];
            lockouts.compute(identity, (k, existing) -> {
                if (existing != null && existing.isActive(now)) {
                    return existing;
                }
                created[0] = true;
                return lockout;
            });
            return created[0];
        });
    }

    @Override
    public Uni<Optional<LockoutRecord>> findLockout(String identity) {
        return Uni.createFrom().item(() -> {
            final var lockout = lockouts.get(identity);
            if (lockout != null && !lockout.isActive(clock.instant())) {
                lockouts.remove(identity, lockout);
                return Optional.empty();
            }
            return Optional.ofNullable(lockout);
        });
    }

    @Override
    public Uni<Void> clearLockout(String identity) {
        return Uni.createFrom().item(() -> lockouts.remove(identity)).replaceWithVoid();
    }

    @Override
    public Multi<LockedAccount> streamLockouts() {
        return Multi.createFrom().deferred(() -> {
            final var now = clock.instant();
            final var active = lockouts.entrySet().stream()
                    .filter(entry -> entry.getValue().isActive(now))
                    .map(entry -> new LockedAccount(entry.getKey(), entry.getValue()))
                    .toList();
            return Multi.createFrom().iterable(active);
        });
    }

    @Override
    public Uni<Long> clearAll() {
        return Uni.createFrom().item(() -> {
            final long removed = ledgers.size() + lockouts.size();
            ledgers.clear();
            lockouts.clear();
            return removed;
        });
    }

    /**
     * Shutdown the cleanup executor.
     */
    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    void cleanupExpired() {
        final var now = clock.instant();
        ledgers.entrySet().removeIf(entry -> entry.getValue().isIdle(now));
        lockouts.entrySet().removeIf(entry -> !entry.getValue().isActive(now));
    }

    private record Ledger(List<FailedAttempt> attempts, Duration window) {

        ArrayList<FailedAttempt> inWindow(Instant windowStart) {
            final var kept = new ArrayList<FailedAttempt>(attempts.size() + 1);
            for (var attempt : attempts) {
                if (!attempt.timestamp().isBefore(windowStart)) {
                    kept.add(attempt);
                }
            }
            return kept;
        }

        boolean isIdle(Instant now) {
            return attempts.isEmpty()
                    || attempts.get(attempts.size() - 1).timestamp().isBefore(now.minus(window));
        }
    }
}
