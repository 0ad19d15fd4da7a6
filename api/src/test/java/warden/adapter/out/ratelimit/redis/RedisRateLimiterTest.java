package warden.adapter.out.ratelimit.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.MutableClock;
import warden.adapter.out.storage.redis.RedisTimeoutHelper;
import warden.core.model.ratelimit.RateLimitKey;
import warden.core.model.ratelimit.RateLimitPolicy;
import warden.core.port.out.Metrics;

@DisplayName("RedisRateLimiter")
@ExtendWith(MockitoExtension.class)
class RedisRateLimiterTest {

    private static final RateLimitPolicy LOGIN = RateLimitPolicy.of(5, Duration.ofMinutes(15));
    private static final RateLimitKey KEY = new RateLimitKey("ip:203.0.113.7", "/api/auth/login");

    @Mock
    private ReactiveRedisDataSource redisDataSource;

    @Mock
    private Metrics metrics;

    private MutableClock clock;
    private RedisRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        var timeoutHelper = new RedisTimeoutHelper(Duration.ofMillis(50), metrics, "rate-limit");
        rateLimiter = new RedisRateLimiter(redisDataSource, timeoutHelper, "warden", clock);
    }

    private static Response scriptResult(long count, Instant resetAt) {
        var response = mock(Response.class);
        var countValue = mock(Response.class);
        var resetValue = mock(Response.class);
        when(response.size()).thenReturn(2);
        when(response.get(0)).thenReturn(countValue);
        when(response.get(1)).thenReturn(resetValue);
        when(countValue.toLong()).thenReturn(count);
        when(resetValue.toLong()).thenReturn(resetAt.toEpochMilli());
        return response;
    }

    @Nested
    @DisplayName("checkAndConsume()")
    class CheckAndConsumeTests {

        @Test
        @DisplayName("should allow while the script count is within the limit")
        void shouldAllowWithinLimit() {
            var resetAt = clock.instant().plus(Duration.ofMinutes(15));
            var response = scriptResult(3, resetAt);
            when(redisDataSource.execute(anyString(), any(String[].class)))
                    .thenReturn(Uni.createFrom().item(response));

            var decision = rateLimiter.checkAndConsume(KEY, LOGIN).await().atMost(Duration.ofSeconds(1));

            assertTrue(decision.allowed());
            assertEquals(2, decision.remaining());
            assertEquals(resetAt, decision.resetAt());
        }

        @Test
        @DisplayName("should reject once the script count exceeds the limit")
        void shouldRejectOverLimit() {
            var resetAt = clock.instant().plus(Duration.ofMinutes(10));
            var response = scriptResult(6, resetAt);
            when(redisDataSource.execute(anyString(), any(String[].class)))
                    .thenReturn(Uni.createFrom().item(response));

            var decision = rateLimiter.checkAndConsume(KEY, LOGIN).await().atMost(Duration.ofSeconds(1));

            assertFalse(decision.allowed());
            assertEquals(0, decision.remaining());
            assertEquals(600, decision.retryAfterSeconds());
        }

        @Test
        @DisplayName("should allow the request when Redis fails")
        void shouldFailOpenOnFailure() {
            when(redisDataSource.execute(anyString(), any(String[].class)))
                    .thenReturn(Uni.createFrom().failure(new RuntimeException("Connection refused")));

            var decision = rateLimiter.checkAndConsume(KEY, LOGIN).await().atMost(Duration.ofSeconds(1));

            assertTrue(decision.allowed());
            assertEquals(5, decision.remaining());
            verify(metrics).recordRedisFailure("rate-limit", "checkAndConsume");
        }

        @Test
        @DisplayName("should allow the request when Redis does not answer in time")
        void shouldFailOpenOnTimeout() {
            when(redisDataSource.execute(anyString(), any(String[].class)))
                    .thenReturn(Uni.createFrom().nothing());

            var decision = rateLimiter.checkAndConsume(KEY, LOGIN).await().atMost(Duration.ofSeconds(2));

            assertTrue(decision.allowed());
            verify(metrics).recordRedisTimeout("rate-limit", "checkAndConsume");
        }

        @Test
        @DisplayName("should allow the request when the script answer is malformed")
        void shouldFailOpenOnMalformedResponse() {
            var response = mock(Response.class);
            when(response.size()).thenReturn(1);
            when(redisDataSource.execute(anyString(), any(String[].class)))
                    .thenReturn(Uni.createFrom().item(response));

            var decision = rateLimiter.checkAndConsume(KEY, LOGIN).await().atMost(Duration.ofSeconds(1));

            assertTrue(decision.allowed());
            verify(metrics).recordRedisFailure("rate-limit", "checkAndConsume");
        }
    }

    @Test
    @DisplayName("should fail open on status reads")
    void shouldFailOpenOnStatus() {
        when(redisDataSource.execute(anyString(), any(String[].class)))
                .thenReturn(Uni.createFrom().failure(new RuntimeException("Connection refused")));

        var decision = rateLimiter.getStatus(KEY, LOGIN).await().atMost(Duration.ofSeconds(1));

        assertTrue(decision.allowed());
        assertEquals(5, decision.remaining());
    }

    @Test
    @DisplayName("should report redis backend")
    void shouldReportBackend() {
        assertEquals("redis", rateLimiter.backend());
    }
}
