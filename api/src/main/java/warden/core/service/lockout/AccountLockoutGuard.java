package warden.core.service.lockout;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.runtime.configuration.ConfigurationException;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.Cancellable;
import org.jboss.logging.Logger;

import warden.core.config.LockoutConfig;
import warden.core.model.lockout.AttemptDecision;
import warden.core.model.lockout.AttemptMetadata;
import warden.core.model.lockout.FailedAttempt;
import warden.core.model.lockout.LockedAccount;
import warden.core.model.lockout.LockoutRecord;
import warden.core.model.lockout.LockoutStatus;
import warden.core.model.notification.Notification;
import warden.core.model.notification.NotificationKind;
import warden.core.model.security.Severity;
import warden.core.port.out.Metrics;
import warden.core.port.out.NotificationDispatcher;
import warden.spi.FailedAttemptRepository;

/**
 * Brute-force protection for credential checks.
 *
 * <p>Failures are counted per identity in a rolling window. Once they reach the
 * CAPTCHA threshold the next attempt must pass a CAPTCHA; once they reach the
 * maximum the identity is locked for the configured duration. A successful
 * login clears both the ledger and any lock.
 *
 * <p>Failure policy is fail-closed: when no store can answer, attempts are
 * denied.
 *
 * <p>Expiry notices are scheduled on this instance when it applies the lock.
 * In a multi-instance deployment an instance that restarts loses its pending
 * notices; the lock itself still expires in the shared store.
 */
@ApplicationScoped
public class AccountLockoutGuard {

    private static final Logger LOG = Logger.getLogger(AccountLockoutGuard.class);

    static final String STORE_UNAVAILABLE_REASON = "Unable to verify account status. Try again later.";

    private final FailedAttemptRepository repository;
    private final LockoutConfig config;
    private final NotificationDispatcher notifications;
    private final Metrics metrics;
    private final Clock clock;
    private final Map<String, Cancellable> pendingUnlockNotices = new ConcurrentHashMap<>();

    @Inject
    public AccountLockoutGuard(
            FailedAttemptRepository repository,
            LockoutConfig config,
            NotificationDispatcher notifications,
            Metrics metrics) {
        this(repository, config, notifications, metrics, Clock.systemUTC());
    }

    public AccountLockoutGuard(
            FailedAttemptRepository repository,
            LockoutConfig config,
            NotificationDispatcher notifications,
            Metrics metrics,
            Clock clock) {
        validate(config);
        this.repository = repository;
        this.config = config;
        this.notifications = notifications;
        this.metrics = metrics;
        this.clock = clock;
    }

    void onStart(@Observes StartupEvent event) {
        LOG.infov(
                "Account lockout: maxFailedAttempts={0}, attemptWindow={1}, lockoutDuration={2}, captchaThreshold={3}",
                config.maxFailedAttempts(),
                config.attemptWindow(),
                config.lockoutDuration(),
                config.captchaThreshold());
    }

    @PreDestroy
    void shutdown() {
        pendingUnlockNotices.values().forEach(Cancellable::cancel);
        pendingUnlockNotices.clear();
    }

    /**
     * Decide whether credentials may be checked for an identity.
     *
     * @param identity the login identity (email address or username)
     * @return the decision; a store failure yields a denial, never a failed Uni
     */
    public Uni<AttemptDecision> canAttempt(String identity) {
        final var normalized = normalize(identity);
        return status(normalized)
                .map(status -> {
                    if (status.locked()) {
                        final var minutes = lockRecordOf(status).remainingMinutes(clock.instant());
                        return AttemptDecision.deny(
                                "Account is temporarily locked. Try again in " + minutes + " minutes.");
                    }
                    return AttemptDecision.allow(status.requiresCaptcha());
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorv(error, "Lockout state unavailable for {0}, denying attempt", normalized);
                    return AttemptDecision.deny(STORE_UNAVAILABLE_REASON);
                });
    }

    /**
     * Record a failed credential check and lock the identity when the
     * threshold is reached.
     *
     * <p>A failure while the identity is already locked is not recorded and
     * does not extend the lock. When concurrent failures cross the threshold
     * together, only the one that stores the lock notifies.
     *
     * @param identity the login identity
     * @param metadata client details (may be null)
     * @return the status after recording
     */
    public Uni<LockoutStatus> recordFailure(String identity, AttemptMetadata metadata) {
        final var normalized = normalize(identity);
        final var now = clock.instant();
        final var attempt = FailedAttempt.at(now, metadata);

        return repository.findLockout(normalized).flatMap(existing -> {
            final var active = existing.filter(lock -> lock.isActive(now));
            if (active.isPresent()) {
                LOG.debugv("Failed attempt for locked identity {0}, lock unchanged", normalized);
                return Uni.createFrom().item(LockoutStatus.locked(active.get()));
            }
            return repository
                    .recordFailedAttempt(
                            normalized, attempt, config.attemptWindow(), config.maxFailedAttempts())
                    .flatMap(count -> {
                        if (count >= config.maxFailedAttempts()) {
                            return lock(normalized, now, count);
                        }
                        LOG.debugv(
                                "Failed attempt for {0}: {1}/{2}", normalized, count, config.maxFailedAttempts());
                        return Uni.createFrom().item(LockoutStatus.unlocked(count, config.captchaThreshold()));
                    });
        });
    }

    /**
     * Clear the ledger and any lock after a successful login.
     *
     * <p>Also cancels a pending expiry notice; no notification is sent.
     */
    public Uni<Void> recordSuccess(String identity) {
        final var normalized = normalize(identity);
        cancelUnlockNotice(normalized);
        return clear(normalized);
    }

    /**
     * Current lockout state of an identity.
     *
     * <p>An expired lock reads as unlocked without an explicit unlock. Failures
     * are not recorded while locked, so the only ledger entries left are the
     * ones that caused the lock, and those age out of the attempt window. A
     * store that still returns the expired record has it cleared together with
     * its ledger.
     */
    public Uni<LockoutStatus> isLocked(String identity) {
        return status(normalize(identity));
    }

    /**
     * Lift a lock before it expires.
     *
     * @param identity the locked identity
     * @param actorId the administrator performing the unlock (may be null)
     * @return true if an active lock was lifted
     */
    public Uni<Boolean> unlock(String identity, String actorId) {
        final var normalized = normalize(identity);
        final var actor = actorId == null || actorId.isBlank() ? "system" : actorId;
        final var now = clock.instant();

        return repository.findLockout(normalized).flatMap(existing -> {
            final var wasLocked = existing.filter(lock -> lock.isActive(now)).isPresent();
            cancelUnlockNotice(normalized);
            return clear(normalized).map(v -> {
                if (wasLocked) {
                    LOG.infov("Account unlocked: identity={0}, actor={1}", normalized, actor);
                    metrics.recordUnlock("manual");
                    notifications.dispatch(unlockedNotification(normalized, Map.of("actor", actor)));
                }
                return wasLocked;
            });
        });
    }

    /**
     * List identities whose lock is still active, soonest unlock first.
     */
    public Uni<List<LockedAccount>> getLockedAccounts() {
        final var now = clock.instant();
        return repository
                .streamLockouts()
                .filter(account -> account.lockout().isActive(now))
                .collect()
                .asList()
                .map(accounts -> accounts.stream()
                        .sorted(Comparator.comparing(account -> account.lockout().unlockAt()))
                        .toList());
    }

    int pendingUnlockNotices() {
        return pendingUnlockNotices.size();
    }

    private Uni<LockoutStatus> status(String identity) {
        final var now = clock.instant();
        return repository.findLockout(identity).flatMap(lockout -> {
            if (lockout.isPresent()) {
                if (lockout.get().isActive(now)) {
                    return Uni.createFrom().item(LockoutStatus.locked(lockout.get()));
                }
                LOG.debugv("Lock expired for {0}", identity);
                return clear(identity).map(v -> LockoutStatus.clean());
            }
            return repository
                    .countFailedAttempts(identity, config.attemptWindow())
                    .map(count -> LockoutStatus.unlocked(count, config.captchaThreshold()));
        });
    }

    private Uni<LockoutStatus> lock(String identity, Instant now, int failedAttempts) {
        final var record = LockoutRecord.lock(now, config.lockoutDuration(), failedAttempts);
        return repository.saveLockout(identity, record).flatMap(created -> {
            if (!created) {
                LOG.debugv("Lock for {0} already stored by a concurrent failure", identity);
                return repository
                        .findLockout(identity)
                        .map(stored -> LockoutStatus.locked(stored.orElse(record)));
            }
            LOG.warnv(
                    "Account locked: identity={0}, failedAttempts={1}, unlockAt={2}",
                    identity, failedAttempts, record.unlockAt());
            metrics.recordLockout();
            notifications.dispatch(new Notification(
                    NotificationKind.ACCOUNT_LOCKED,
                    Severity.HIGH,
                    identity,
                    "Account temporarily locked after repeated failed login attempts",
                    Map.of("failedAttempts", failedAttempts, "unlockAt", record.unlockAt()),
                    now));
            scheduleUnlockNotice(identity, record);
            return Uni.createFrom().item(LockoutStatus.locked(record));
        });
    }

    private void scheduleUnlockNotice(String identity, LockoutRecord record) {
        final var delay = Duration.between(clock.instant(), record.unlockAt());
        final var notice = Uni.createFrom()
                .voidItem()
                .onItem()
                .delayIt()
                .by(delay.isNegative() ? Duration.ZERO : delay)
                .subscribe()
                .with(
                        v -> {
                            if (pendingUnlockNotices.remove(identity) != null) {
                                LOG.infov("Lock expired: identity={0}", identity);
                                metrics.recordUnlock("expired");
                                notifications.dispatch(
                                        unlockedNotification(identity, Map.of("unlockedAt", record.unlockAt())));
                            }
                        },
                        error -> LOG.warnv("Expiry notice failed for {0}: {1}", identity, error.getMessage()));
        final var previous = pendingUnlockNotices.put(identity, notice);
        if (previous != null) {
            previous.cancel();
        }
    }

    private void cancelUnlockNotice(String identity) {
        final var notice = pendingUnlockNotices.remove(identity);
        if (notice != null) {
            notice.cancel();
        }
    }

    private Uni<Void> clear(String identity) {
        return repository.clearLockout(identity).flatMap(v -> repository.clearFailedAttempts(identity));
    }

    private Notification unlockedNotification(String identity, Map<String, Object> metadata) {
        return new Notification(
                NotificationKind.ACCOUNT_UNLOCKED,
                Severity.LOW,
                identity,
                "Account unlocked",
                metadata,
                clock.instant());
    }

    private static LockoutRecord lockRecordOf(LockoutStatus status) {
        return new LockoutRecord(status.lockedAt(), status.unlockAt(), status.failedAttempts());
    }

    static String normalize(String identity) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity cannot be blank");
        }
        return identity.trim().toLowerCase(Locale.ROOT);
    }

    static void validate(LockoutConfig config) {
        if (config.maxFailedAttempts() <= 0) {
            throw new ConfigurationException("warden.lockout.max-failed-attempts must be positive");
        }
        if (config.captchaThreshold() <= 0 || config.captchaThreshold() > config.maxFailedAttempts()) {
            throw new ConfigurationException(
                    "warden.lockout.captcha-threshold must be between 1 and max-failed-attempts");
        }
        if (!isPositive(config.attemptWindow()) || !isPositive(config.lockoutDuration())) {
            throw new ConfigurationException("warden.lockout windows and durations must be positive");
        }
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }
}
