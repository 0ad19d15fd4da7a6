package warden.spi;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import warden.core.model.lockout.FailedAttempt;
import warden.core.model.lockout.LockedAccount;
import warden.core.model.lockout.LockoutRecord;

/**
 * Storage for failed-attempt ledgers and lockout records.
 *
 * <p>Identities passed to this repository are already normalized. Ledgers are
 * bounded by the attempt window and by {@code maxEntries}; lockout records
 * expire on their own at {@link LockoutRecord#unlockAt()}.
 */
public interface FailedAttemptRepository {

    /**
     * Append a failed attempt and count the failures still inside the window.
     *
     * <p>Entries older than the window are pruned and only the newest
     * {@code maxEntries} are kept. Pruning, appending and counting are atomic
     * per identity.
     *
     * @param identity the normalized identity
     * @param attempt the failed attempt
     * @param window the rolling attempt window
     * @param maxEntries the ledger cap
     * @return failures inside the window, including this one
     */
    Uni<Integer> recordFailedAttempt(String identity, FailedAttempt attempt, Duration window, int maxEntries);

    /**
     * Count failures inside the window without recording one.
     */
    Uni<Integer> countFailedAttempts(String identity, Duration window);

    Uni<Void> clearFailedAttempts(String identity);

    /**
     * Store a lockout record that expires at its {@code unlockAt}, unless an
     * unexpired one is already stored.
     *
     * <p>The check and the write are atomic per identity, so of two concurrent
     * calls at most one creates the lock.
     *
     * @return true if this call stored the record, false if an active lock already existed
     */
    Uni<Boolean> saveLockout(String identity, LockoutRecord lockout);

    /**
     * Find the lockout record for an identity.
     *
     * <p>A record past its {@code unlockAt} may still be returned until the
     * store expires it; callers decide with {@link LockoutRecord#isActive}.
     */
    Uni<Optional<LockoutRecord>> findLockout(String identity);

    Uni<Void> clearLockout(String identity);

    /**
     * Stream all stored lockouts.
     *
     * @return a Multi emitting lockouts; implementations may emit expired records
     */
    Multi<LockedAccount> streamLockouts();

    /**
     * Remove every ledger and lockout owned by this service.
     *
     * @return the number of entries removed
     */
    Uni<Long> clearAll();
}
