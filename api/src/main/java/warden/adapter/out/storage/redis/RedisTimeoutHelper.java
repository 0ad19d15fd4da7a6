package warden.adapter.out.storage.redis;

import java.time.Duration;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.port.out.Metrics;

/**
 * Applies a timeout and a failure policy to Redis operations.
 *
 * <p>Every Redis call made by this service goes through one of these modes:
 * <ul>
 *   <li>{@link #withTimeout} - Fail-fast: a timeout becomes a {@link RedisTimeoutException},
 *       other failures propagate. Used where the caller has its own fallback store
 *       (failed-attempt ledgers and lockouts).</li>
 *   <li>{@link #withTimeoutFallback} - Fail-open: returns a supplied value on timeout or
 *       failure. Used for rate limiting, where failure allows the request.</li>
 *   <li>{@link #withTimeoutSilent} - Logs and ignores timeout or failure. Used for cleanup
 *       writes whose failure must not affect the caller.</li>
 * </ul>
 *
 * <p>Timeouts are counted as {@code warden.redis.timeouts.total}, other failures as
 * {@code warden.redis.failures.total}.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final Metrics metrics;
    private final String repositoryName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout for each Redis operation
     * @param metrics the metrics port (may be null)
     * @param repositoryName the repository name for logs and metric tags
     */
    public RedisTimeoutHelper(Duration timeout, Metrics metrics, String repositoryName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.repositoryName = repositoryName;
    }

    /**
     * Apply a timeout that fails the operation.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that fails with RedisTimeoutException on timeout; other failures propagate
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, repositoryName, timeout);
                    recordTimeout(operationName);
                    return new RedisTimeoutException(operationName, repositoryName);
                })
                .onFailure(error -> !(error instanceof RedisTimeoutException))
                .invoke(error -> {
                    LOG.warnv(
                            "Redis operation failure: {0} in {1}: {2}",
                            operationName,
                            repositoryName,
                            error.getMessage());
                    recordFailure(operationName);
                });
    }

    /**
     * Apply a timeout with a fallback value.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param fallback supplier for the value used on timeout or failure
     * @param <T> the result type
     * @return a Uni that returns the fallback value on timeout or failure
     */
    public <T> Uni<T> withTimeoutFallback(Uni<T> operation, String operationName, Supplier<T> fallback) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv(
                            "Redis operation timeout (fallback): {0} in {1} after {2}",
                            operationName, repositoryName, timeout);
                    recordTimeout(operationName);
                    return fallback.get();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            error,
                            "Redis operation failure (fallback): {0} in {1}",
                            operationName,
                            repositoryName);
                    recordFailure(operationName);
                    return fallback.get();
                });
    }

    /**
     * Apply a timeout and ignore any failure.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @return a Uni that completes with void on timeout or failure
     */
    public Uni<Void> withTimeoutSilent(Uni<Void> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv(
                            "Redis operation timeout (silent): {0} in {1} after {2}",
                            operationName, repositoryName, timeout);
                    recordTimeout(operationName);
                    return null;
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Redis operation failure (silent): {0} in {1}: {2}",
                            operationName, repositoryName, error.getMessage());
                    recordFailure(operationName);
                    return null;
                });
    }

    public Duration timeout() {
        return timeout;
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordRedisTimeout(repositoryName, operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordRedisFailure(repositoryName, operationName);
        }
    }

    /**
     * Exception indicating a Redis operation timeout.
     */
    public static class RedisTimeoutException extends RuntimeException {
        private final String operation;
        private final String repository;

        public RedisTimeoutException(String operation, String repository) {
            super("Redis operation timeout: " + operation + " in " + repository);
            this.operation = operation;
            this.repository = repository;
        }

        /** Returns the name of the operation that timed out. */
        public String getOperation() {
            return operation;
        }

        /** Returns the repository where the timeout occurred. */
        public String getRepository() {
            return repository;
        }
    }
}
