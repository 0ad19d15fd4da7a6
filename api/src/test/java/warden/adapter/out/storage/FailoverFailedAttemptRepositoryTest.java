package warden.adapter.out.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.MutableClock;
import warden.adapter.out.storage.memory.InMemoryFailedAttemptRepository;
import warden.core.model.lockout.AttemptMetadata;
import warden.core.model.lockout.FailedAttempt;
import warden.core.model.lockout.LockedAccount;
import warden.core.model.lockout.LockoutRecord;
import warden.spi.FailedAttemptRepository;

@DisplayName("FailoverFailedAttemptRepository")
@ExtendWith(MockitoExtension.class)
class FailoverFailedAttemptRepositoryTest {

    private static final Duration WINDOW = Duration.ofMinutes(15);
    private static final String IDENTITY = "alice@example.com";

    @Mock
    private FailedAttemptRepository primary;

    private MutableClock clock;
    private InMemoryFailedAttemptRepository fallback;
    private FailoverFailedAttemptRepository repository;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        fallback = new InMemoryFailedAttemptRepository(clock);
        repository = new FailoverFailedAttemptRepository(primary, fallback);
    }

    @AfterEach
    void tearDown() {
        repository.shutdown();
    }

    private static <T> Uni<T> down() {
        return Uni.createFrom().failure(new RuntimeException("Connection refused"));
    }

    @Test
    @DisplayName("should record in the fallback when the primary fails")
    void shouldRecordInFallback() {
        when(primary.recordFailedAttempt(anyString(), any(), any(), anyInt())).thenReturn(down());
        var attempt = FailedAttempt.at(clock.instant(), AttemptMetadata.empty());

        var count = repository.recordFailedAttempt(IDENTITY, attempt, WINDOW, 5).await().atMost(Duration.ofSeconds(1));

        assertEquals(1, count);
        assertEquals(1, fallback.countFailedAttempts(IDENTITY, WINDOW).await().atMost(Duration.ofSeconds(1)));
    }

    @Test
    @DisplayName("should add failures held by the fallback to the primary count")
    void shouldSumBothLedgers() {
        for (int i = 0; i < 3; i++) {
            fallback.recordFailedAttempt(IDENTITY, FailedAttempt.at(clock.instant(), null), WINDOW, 5)
                    .await()
                    .atMost(Duration.ofSeconds(1));
        }
        when(primary.countFailedAttempts(IDENTITY, WINDOW)).thenReturn(Uni.createFrom().item(1));

        var count = repository.countFailedAttempts(IDENTITY, WINDOW).await().atMost(Duration.ofSeconds(1));

        assertEquals(4, count);
    }

    @Test
    @DisplayName("should count failures recorded during an outage once the primary recovers")
    void shouldCountAcrossOutage() {
        when(primary.recordFailedAttempt(anyString(), any(), any(), anyInt()))
                .thenReturn(down(), down(), Uni.createFrom().item(1));
        var attempt = FailedAttempt.at(clock.instant(), null);

        repository.recordFailedAttempt(IDENTITY, attempt, WINDOW, 5).await().atMost(Duration.ofSeconds(1));
        repository.recordFailedAttempt(IDENTITY, attempt, WINDOW, 5).await().atMost(Duration.ofSeconds(1));
        var count = repository.recordFailedAttempt(IDENTITY, attempt, WINDOW, 5).await().atMost(Duration.ofSeconds(1));

        assertEquals(3, count);
    }

    @Test
    @DisplayName("should keep honoring a lockout saved during an outage after the primary recovers")
    void shouldHonorFallbackLockout() {
        var record = LockoutRecord.lock(clock.instant(), Duration.ofMinutes(30), 5);
        when(primary.saveLockout(IDENTITY, record)).thenReturn(down());
        repository.saveLockout(IDENTITY, record).await().atMost(Duration.ofSeconds(1));

        when(primary.findLockout(IDENTITY)).thenReturn(Uni.createFrom().item(Optional.empty()));
        var found = repository.findLockout(IDENTITY).await().atMost(Duration.ofSeconds(1));

        assertEquals(record, found.orElseThrow());
    }

    @Test
    @DisplayName("should report the later unlock when both stores hold a lockout")
    void shouldPreferLaterUnlock() {
        var local = LockoutRecord.lock(clock.instant(), Duration.ofMinutes(10), 5);
        var remote = LockoutRecord.lock(clock.instant(), Duration.ofMinutes(30), 5);
        fallback.saveLockout(IDENTITY, local).await().atMost(Duration.ofSeconds(1));
        when(primary.findLockout(IDENTITY)).thenReturn(Uni.createFrom().item(Optional.of(remote)));

        var found = repository.findLockout(IDENTITY).await().atMost(Duration.ofSeconds(1));

        assertEquals(remote, found.orElseThrow());
    }

    @Test
    @DisplayName("should clear the fallback even when the primary fails")
    void shouldClearBoth() {
        fallback.saveLockout(IDENTITY, LockoutRecord.lock(clock.instant(), Duration.ofMinutes(10), 5))
                .await()
                .atMost(Duration.ofSeconds(1));
        when(primary.clearLockout(IDENTITY)).thenReturn(down());

        repository.clearLockout(IDENTITY).await().atMost(Duration.ofSeconds(1));

        assertTrue(fallback.findLockout(IDENTITY).await().atMost(Duration.ofSeconds(1)).isEmpty());
    }

    @Test
    @DisplayName("should merge lockouts from both stores")
    void shouldMergeLockouts() {
        var remoteOnly = new LockedAccount("bob", LockoutRecord.lock(clock.instant(), Duration.ofMinutes(5), 5));
        fallback.saveLockout("carol", LockoutRecord.lock(clock.instant(), Duration.ofMinutes(5), 5))
                .await()
                .atMost(Duration.ofSeconds(1));
        when(primary.streamLockouts()).thenReturn(Multi.createFrom().items(remoteOnly));

        var accounts = repository.streamLockouts().collect().asList().await().atMost(Duration.ofSeconds(1));

        assertEquals(2, accounts.size());
    }

    @Test
    @DisplayName("should still list local lockouts when the primary cannot be scanned")
    void shouldListLocalLockoutsWhenPrimaryFails() {
        fallback.saveLockout("carol", LockoutRecord.lock(clock.instant(), Duration.ofMinutes(5), 5))
                .await()
                .atMost(Duration.ofSeconds(1));
        when(primary.streamLockouts())
                .thenReturn(Multi.createFrom().failure(new RuntimeException("Connection refused")));

        var accounts = repository.streamLockouts().collect().asList().await().atMost(Duration.ofSeconds(1));

        assertEquals(1, accounts.size());
        assertEquals("carol", accounts.get(0).identity());
    }
}
