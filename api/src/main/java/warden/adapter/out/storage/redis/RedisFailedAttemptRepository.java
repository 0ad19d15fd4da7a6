package warden.adapter.out.storage.redis;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.lockout.FailedAttempt;
import warden.core.model.lockout.LockedAccount;
import warden.core.model.lockout.LockoutRecord;
import warden.spi.FailedAttemptRepository;

/**
 * Redis implementation of FailedAttemptRepository.
 *
 * <p>Key structure:
 * <ul>
 *   <li>Failed attempts: {@code {prefix}:auth:failed:{identity}} (sorted set of JSON attempts
 *       scored by timestamp, expiring with the attempt window)</li>
 *   <li>Lockout: {@code {prefix}:auth:locked:{identity}} (hash with lockedAt, unlockAt,
 *       failedAttempts, expiring at unlockAt)</li>
 * </ul>
 *
 * <p>Every operation carries the configured timeout and fails on timeout or
 * error. The caller decides how to degrade.
 */
public class RedisFailedAttemptRepository implements FailedAttemptRepository {

    private static final Logger LOG = Logger.getLogger(RedisFailedAttemptRepository.class);

    private static final String FIELD_LOCKED_AT = "lockedAt";
    private static final String FIELD_UNLOCK_AT = "unlockAt";
    private static final String FIELD_FAILED_ATTEMPTS = "failedAttempts";

    /**
     * Prune, append, trim, expire and count in one round trip.
     *
     * <p>KEYS[1] ledger key; ARGV: now_ms, window_ms, max_entries, member.
     */
    private static final String RECORD_ATTEMPT_SCRIPT =
            """
            local key = KEYS[1]
            local now_ms = tonumber(ARGV[1])
            local window_ms = tonumber(ARGV[2])
            local max_entries = tonumber(ARGV[3])

            redis.call('ZREMRANGEBYSCORE', key, '-inf', '(' .. (now_ms - window_ms))
            redis.call('ZADD', key, now_ms, ARGV[4])
            redis.call('ZREMRANGEBYRANK', key, 0, -(max_entries + 1))
            redis.call('PEXPIRE', key, window_ms)
            return redis.call('ZCARD', key)
            """;

    /**
     * Store a lockout hash that expires at its unlock time, unless an
     * unexpired lock is already stored.
     *
     * <p>KEYS[1] lockout key; ARGV: locked_at_ms, unlock_at_ms, failed_attempts, now_ms.
     * Returns 1 when the lock was stored, 0 when one was already active.
     */
    private static final String SAVE_LOCKOUT_SCRIPT =
            """
            local key = KEYS[1]
            local existing = redis.call('HGET', key, 'unlockAt')
            if existing and tonumber(existing) > tonumber(ARGV[4]) then
                return 0
            end
            redis.call('DEL', key)
            redis.call('HSET', key, 'lockedAt', ARGV[1], 'unlockAt', ARGV[2], 'failedAttempts', ARGV[3])
            redis.call('PEXPIREAT', key, ARGV[2])
            return 1
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisTimeoutHelper timeoutHelper;
    private final ObjectMapper objectMapper;
    private final String failedPrefix;
    private final String lockedPrefix;
    private final Clock clock;

    public RedisFailedAttemptRepository(
            ReactiveRedisDataSource redisDataSource,
            RedisTimeoutHelper timeoutHelper,
            ObjectMapper objectMapper,
            String keyPrefix) {
        this(redisDataSource, timeoutHelper, objectMapper, keyPrefix, Clock.systemUTC());
    }

    public RedisFailedAttemptRepository(
            ReactiveRedisDataSource redisDataSource,
            RedisTimeoutHelper timeoutHelper,
            ObjectMapper objectMapper,
            String keyPrefix,
            Clock clock) {
        this.redisDataSource = redisDataSource;
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.timeoutHelper = timeoutHelper;
        this.objectMapper = objectMapper;
        this.failedPrefix = keyPrefix + ":auth:failed:";
        this.lockedPrefix = keyPrefix + ":auth:locked:";
        this.clock = clock;
    }

    @Override
    public Uni<Integer> recordFailedAttempt(String identity, FailedAttempt attempt, Duration window, int maxEntries) {
        final var nowMs = clock.millis();
        final var member = toMember(attempt);

        final var operation = redisDataSource
                .execute(
                        "EVAL",
                        RECORD_ATTEMPT_SCRIPT,
                        "1",
                        failedPrefix + identity,
                        String.valueOf(nowMs),
                        String.valueOf(window.toMillis()),
                        String.valueOf(maxEntries),
                        member)
                .map(response -> response.toInteger());

        return timeoutHelper.withTimeout(operation, "recordFailedAttempt");
    }

    @Override
    public Uni<Integer> countFailedAttempts(String identity, Duration window) {
        final var windowStart = clock.millis() - window.toMillis();
        final var operation = redisDataSource
                .execute("ZCOUNT", failedPrefix + identity, String.valueOf(windowStart), "+inf")
                .map(response -> response == null ? 0 : response.toInteger());

        return timeoutHelper.withTimeout(operation, "countFailedAttempts");
    }

    @Override
    public Uni<Void> clearFailedAttempts(String identity) {
        return timeoutHelper.withTimeout(
                keyCommands.del(failedPrefix + identity).replaceWithVoid(), "clearFailedAttempts");
    }

    @Override
    public Uni<Boolean> saveLockout(String identity, LockoutRecord lockout) {
        final var operation = redisDataSource
                .execute(
                        "EVAL",
                        SAVE_LOCKOUT_SCRIPT,
                        "1",
                        lockedPrefix + identity,
                        String.valueOf(lockout.lockedAt().toEpochMilli()),
                        String.valueOf(lockout.unlockAt().toEpochMilli()),
                        String.valueOf(lockout.failedAttempts()),
                        String.valueOf(clock.millis()))
                .map(response -> response != null && response.toInteger() == 1);

        return timeoutHelper.withTimeout(operation, "saveLockout");
    }

    @Override
    public Uni<Optional<LockoutRecord>> findLockout(String identity) {
        final var operation =
                hashCommands.hgetall(lockedPrefix + identity).map(fields -> Optional.ofNullable(toLockout(fields)));
        return timeoutHelper.withTimeout(operation, "findLockout");
    }

    @Override
    public Uni<Void> clearLockout(String identity) {
        return timeoutHelper.withTimeout(keyCommands.del(lockedPrefix + identity).replaceWithVoid(), "clearLockout");
    }

    @Override
    public Multi<LockedAccount> streamLockouts() {
        final var args = new KeyScanArgs().match(lockedPrefix + "*").count(1000);
        return keyCommands
                .scan(args)
                .toMulti()
                .onItem()
                .transformToUniAndMerge(this::loadLockedAccount)
                .select()
                .where(account -> account != null);
    }

    @Override
    public Uni<Long> clearAll() {
        final var operation = RedisKeyspace.deleteMatching(keyCommands, failedPrefix + "*")
                .flatMap(failed -> RedisKeyspace.deleteMatching(keyCommands, lockedPrefix + "*")
                        .map(locked -> failed + locked));
        return timeoutHelper.withTimeout(operation, "clearAll");
    }

    private Uni<LockedAccount> loadLockedAccount(String redisKey) {
        final var identity = redisKey.substring(lockedPrefix.length());
        return timeoutHelper.withTimeout(hashCommands.hgetall(redisKey), "loadLockout").map(fields -> {
            final var lockout = toLockout(fields);
            if (lockout == null || !lockout.isActive(clock.instant())) {
                return null;
            }
            return new LockedAccount(identity, lockout);
        });
    }

    private LockoutRecord toLockout(Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) {
            return null;
        }

        final var lockedAt = fields.get(FIELD_LOCKED_AT);
        final var unlockAt = fields.get(FIELD_UNLOCK_AT);
        if (lockedAt == null || unlockAt == null) {
            LOG.warn("Ignoring malformed lockout record");
            return null;
        }

        final var failedAttempts = fields.get(FIELD_FAILED_ATTEMPTS);
        return new LockoutRecord(
                Instant.ofEpochMilli(Long.parseLong(lockedAt)),
                Instant.ofEpochMilli(Long.parseLong(unlockAt)),
                failedAttempts != null ? Integer.parseInt(failedAttempts) : 0);
    }

    private String toMember(FailedAttempt attempt) {
        final var stored = new StoredAttempt(
                attempt.timestamp().toEpochMilli(),
                attempt.networkOrigin(),
                attempt.userAgent(),
                UUID.randomUUID().toString());
        try {
            return objectMapper.writeValueAsString(stored);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize failed attempt", e);
        }
    }

    /**
     * Ledger entry as stored in Redis. The nonce keeps simultaneous attempts distinct.
     */
    public record StoredAttempt(long timestamp, String ip, String userAgent, String nonce) {}
}
