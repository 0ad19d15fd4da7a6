package warden.adapter.out.storage;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.adapter.out.storage.memory.InMemoryFailedAttemptRepository;
import warden.core.model.lockout.FailedAttempt;
import warden.core.model.lockout.LockedAccount;
import warden.core.model.lockout.LockoutRecord;
import warden.spi.FailedAttemptRepository;

/**
 * Fail-closed failed-attempt storage: a shared primary store backed by a
 * process-local fallback.
 *
 * <p>Writes go to the primary; when it fails they go to the fallback, so a
 * threshold crossed during an outage still locks the account. The fallback
 * only ever holds the failures the primary missed, so failure counts are the
 * sum of both ledgers: failures split across an outage still add up to a lock.
 * Lockout reads take the later unlock of the two stores, so a lockout recorded
 * locally during an outage keeps holding after the primary recovers. Clears
 * are applied to both stores.
 */
public class FailoverFailedAttemptRepository implements FailedAttemptRepository {

    private static final Logger LOG = Logger.getLogger(FailoverFailedAttemptRepository.class);

    private final FailedAttemptRepository primary;
    private final InMemoryFailedAttemptRepository fallback;

    public FailoverFailedAttemptRepository(FailedAttemptRepository primary, InMemoryFailedAttemptRepository fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public Uni<Integer> recordFailedAttempt(String identity, FailedAttempt attempt, Duration window, int maxEntries) {
        return primary.recordFailedAttempt(identity, attempt, window, maxEntries)
                .flatMap(count -> fallback.countFailedAttempts(identity, window).map(local -> count + local))
                .onFailure()
                .recoverWithUni(error -> {
                    logFallback("recordFailedAttempt", error);
                    return fallback.recordFailedAttempt(identity, attempt, window, maxEntries);
                });
    }

    @Override
    public Uni<Integer> countFailedAttempts(String identity, Duration window) {
        return primary.countFailedAttempts(identity, window)
                .onFailure()
                .recoverWithItem(error -> {
                    logFallback("countFailedAttempts", error);
                    return 0;
                })
                .flatMap(count -> fallback.countFailedAttempts(identity, window).map(local -> count + local));
    }

    @Override
    public Uni<Void> clearFailedAttempts(String identity) {
        return primary.clearFailedAttempts(identity)
                .onFailure()
                .invoke(error -> logFallback("clearFailedAttempts", error))
                .onFailure()
                .recoverWithNull()
                .flatMap(v -> fallback.clearFailedAttempts(identity));
    }

    @Override
    public Uni<Boolean> saveLockout(String identity, LockoutRecord lockout) {
        return primary.saveLockout(identity, lockout).onFailure().recoverWithUni(error -> {
            logFallback("saveLockout", error);
            return fallback.saveLockout(identity, lockout);
        });
    }

    @Override
    public Uni<Optional<LockoutRecord>> findLockout(String identity) {
        return primary.findLockout(identity)
                .onFailure()
                .recoverWithItem(error -> {
                    logFallback("findLockout", error);
                    return Optional.empty();
                })
                .flatMap(remote -> fallback.findLockout(identity).map(local -> stricter(remote, local)));
    }

    @Override
    public Uni<Void> clearLockout(String identity) {
        return primary.clearLockout(identity)
                .onFailure()
                .invoke(error -> logFallback("clearLockout", error))
                .onFailure()
                .recoverWithNull()
                .flatMap(v -> fallback.clearLockout(identity));
    }

    @Override
    public Multi<LockedAccount> streamLockouts() {
        final var remote = primary.streamLockouts()
                .onFailure()
                .invoke(error -> logFallback("streamLockouts", error))
                .onFailure()
                .recoverWithCompletion()
                .collect()
                .asList();
        final var local = fallback.streamLockouts().collect().asList();

        return Uni.combine()
                .all()
                .unis(remote, local)
                .asTuple()
                .onItem()
                .transformToMulti(tuple -> Multi.createFrom().iterable(merge(tuple.getItem1(), tuple.getItem2())));
    }

    @Override
    public Uni<Long> clearAll() {
        return primary.clearAll()
                .onFailure()
                .recoverWithItem(error -> {
                    logFallback("clearAll", error);
                    return 0L;
                })
                .flatMap(remote -> fallback.clearAll().map(local -> remote + local));
    }

    public void shutdown() {
        fallback.shutdown();
    }

    private static Optional<LockoutRecord> stricter(Optional<LockoutRecord> a, Optional<LockoutRecord> b) {
        if (a.isEmpty()) {
            return b;
        }
        if (b.isEmpty()) {
            return a;
        }
        return a.get().unlockAt().isAfter(b.get().unlockAt()) ? a : b;
    }

    private static List<LockedAccount> merge(List<LockedAccount> remote, List<LockedAccount> local) {
        final var byIdentity = new LinkedHashMap<String, LockedAccount>();
        for (var account : remote) {
            byIdentity.put(account.identity(), account);
        }
        for (var account : local) {
            byIdentity.merge(
                    account.identity(),
                    account,
                    (existing, candidate) -> candidate.lockout().unlockAt().isAfter(existing.lockout().unlockAt())
                            ? candidate
                            : existing);
        }
        return List.copyOf(byIdentity.values());
    }

    private void logFallback(String operation, Throwable error) {
        LOG.warnv("Lockout store unavailable during {0}, using local fallback: {1}", operation, error.getMessage());
    }
}
