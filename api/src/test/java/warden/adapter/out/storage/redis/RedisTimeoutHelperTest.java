package warden.adapter.out.storage.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.adapter.out.storage.redis.RedisTimeoutHelper.RedisTimeoutException;
import warden.core.port.out.Metrics;

@DisplayName("RedisTimeoutHelper")
@ExtendWith(MockitoExtension.class)
class RedisTimeoutHelperTest {

    private static final Duration TIMEOUT = Duration.ofMillis(50);
    private static final String REPOSITORY_NAME = "failed-attempts";
    private static final String OPERATION_NAME = "findLockout";

    @Mock
    private Metrics metrics;

    private RedisTimeoutHelper helper;

    @BeforeEach
    void setUp() {
        helper = new RedisTimeoutHelper(TIMEOUT, metrics, REPOSITORY_NAME);
    }

    @Nested
    @DisplayName("withTimeout()")
    class WithTimeoutTests {

        @Test
        @DisplayName("should return result when operation completes within timeout")
        void shouldReturnResult() {
            final var result = helper.withTimeout(Uni.createFrom().item("ok"), OPERATION_NAME)
                    .await()
                    .indefinitely();

            assertEquals("ok", result);
            verifyNoInteractions(metrics);
        }

        @Test
        @DisplayName("should fail with RedisTimeoutException when operation times out")
        void shouldFailOnTimeout() {
            final var operation = Uni.createFrom().<String>nothing();

            final var exception = assertThrows(
                    RedisTimeoutException.class,
                    () -> helper.withTimeout(operation, OPERATION_NAME).await().indefinitely());

            assertEquals(OPERATION_NAME, exception.getOperation());
            assertEquals(REPOSITORY_NAME, exception.getRepository());
            assertTrue(exception.getMessage().contains(OPERATION_NAME));
            verify(metrics).recordRedisTimeout(REPOSITORY_NAME, OPERATION_NAME);
        }

        @Test
        @DisplayName("should propagate other failures and count them")
        void shouldPropagateFailure() {
            final var operation = Uni.createFrom().<String>failure(new IllegalStateException("Connection refused"));

            assertThrows(
                    IllegalStateException.class,
                    () -> helper.withTimeout(operation, OPERATION_NAME).await().indefinitely());

            verify(metrics).recordRedisFailure(REPOSITORY_NAME, OPERATION_NAME);
        }
    }

    @Nested
    @DisplayName("withTimeoutFallback()")
    class WithTimeoutFallbackTests {

        @Test
        @DisplayName("should return result when operation completes within timeout")
        void shouldReturnResult() {
            final var result = helper.withTimeoutFallback(Uni.createFrom().item(42L), OPERATION_NAME, () -> 0L)
                    .await()
                    .indefinitely();

            assertEquals(42L, result);
            verifyNoInteractions(metrics);
        }

        @Test
        @DisplayName("should return fallback value when operation times out")
        void shouldReturnFallbackOnTimeout() {
            final var result = helper.withTimeoutFallback(Uni.createFrom().<Long>nothing(), OPERATION_NAME, () -> 0L)
                    .await()
                    .indefinitely();

            assertEquals(0L, result);
            verify(metrics).recordRedisTimeout(REPOSITORY_NAME, OPERATION_NAME);
        }

        @Test
        @DisplayName("should return fallback value when operation fails")
        void shouldReturnFallbackOnFailure() {
            final var operation = Uni.createFrom().<Long>failure(new RuntimeException("Connection refused"));

            final var result = helper.withTimeoutFallback(operation, OPERATION_NAME, () -> -1L)
                    .await()
                    .indefinitely();

            assertEquals(-1L, result);
            verify(metrics).recordRedisFailure(REPOSITORY_NAME, OPERATION_NAME);
        }
    }

    @Nested
    @DisplayName("withTimeoutSilent()")
    class WithTimeoutSilentTests {

        @Test
        @DisplayName("should complete when operation times out")
        void shouldCompleteOnTimeout() {
            final var result = helper.withTimeoutSilent(Uni.createFrom().<Void>nothing(), OPERATION_NAME)
                    .await()
                    .indefinitely();

            assertNull(result);
            verify(metrics).recordRedisTimeout(REPOSITORY_NAME, OPERATION_NAME);
        }

        @Test
        @DisplayName("should complete when operation fails")
        void shouldCompleteOnFailure() {
            final var operation = Uni.createFrom().<Void>failure(new RuntimeException("Connection reset"));

            final var result = helper.withTimeoutSilent(operation, OPERATION_NAME).await().indefinitely();

            assertNull(result);
            verify(metrics).recordRedisFailure(REPOSITORY_NAME, OPERATION_NAME);
        }
    }

    @Test
    @DisplayName("should tolerate a missing metrics port")
    void shouldTolerateMissingMetrics() {
        final var withoutMetrics = new RedisTimeoutHelper(TIMEOUT, null, REPOSITORY_NAME);

        final var result = withoutMetrics
                .withTimeoutFallback(Uni.createFrom().<String>nothing(), OPERATION_NAME, () -> "fallback")
                .await()
                .indefinitely();

        assertEquals("fallback", result);
    }
}
