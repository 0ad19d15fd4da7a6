package warden.adapter.in.rest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

import java.time.Duration;
import java.util.Map;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.MutableClock;
import warden.adapter.out.ratelimit.memory.InMemoryRateLimiter;
import warden.core.model.ratelimit.RateLimitPolicy;
import warden.core.model.ratelimit.RouteRateLimitTable;
import warden.core.port.out.Metrics;
import warden.core.service.ratelimit.RateLimitService;

@DisplayName("RateLimitResource")
class RateLimitResourceTest {

    private static final Duration WAIT = Duration.ofSeconds(1);
    private static final String CLIENT = "ip:203.0.113.7";
    private static final String LOGIN = "/api/auth/login";

    private InMemoryRateLimiter rateLimiter;
    private RouteRateLimitTable table;
    private RateLimitService service;
    private RateLimitResource resource;

    @BeforeEach
    void setUp() {
        rateLimiter = new InMemoryRateLimiter(Duration.ofHours(1), MutableClock.at("2024-03-01T10:00:00Z"));
        table = new RouteRateLimitTable(
                Map.of(LOGIN, RateLimitPolicy.of(1, Duration.ofMinutes(15))),
                RateLimitPolicy.of(300, Duration.ofMinutes(1)));
        service = new RateLimitService(rateLimiter, table, mock(Metrics.class), true);
        resource = new RateLimitResource(service);
    }

    @AfterEach
    void tearDown() {
        rateLimiter.shutdown();
    }

    @Nested
    @DisplayName("reset()")
    class ResetTests {

        @Test
        @DisplayName("should reopen the window of one client on the given route")
        void shouldResetWindow() {
            service.checkRequest(CLIENT, LOGIN).await().atMost(WAIT);
            assertEquals(0, service.status(CLIENT, LOGIN).await().atMost(WAIT).remaining());

            var response = resource.reset(CLIENT, LOGIN).await().atMost(WAIT);

            assertEquals(204, response.getStatus());
            assertEquals(1, service.status(CLIENT, LOGIN).await().atMost(WAIT).remaining());
        }

        @Test
        @DisplayName("should answer 404 when rate limiting is disabled")
        void shouldRejectWhenDisabled() {
            var disabled = new RateLimitResource(new RateLimitService(rateLimiter, table, mock(Metrics.class), false));

            var problem = assertThrows(HttpProblem.class, () -> disabled.reset(CLIENT, LOGIN));

            assertEquals(404, problem.getStatusCode());
            assertEquals("Rate limiting is disabled", problem.getDetail());
        }
    }

    @Nested
    @DisplayName("clearAll()")
    class ClearAllTests {

        @Test
        @DisplayName("should require force=true")
        void shouldRequireForce() {
            var problem = assertThrows(HttpProblem.class, () -> resource.clearAll(false));

            assertEquals(400, problem.getStatusCode());
        }

        @Test
        @DisplayName("should clear every window and report the count")
        void shouldClearAll() {
            service.checkRequest(CLIENT, LOGIN).await().atMost(WAIT);
            service.checkRequest("ip:203.0.113.8", LOGIN).await().atMost(WAIT);

            var response = resource.clearAll(true).await().atMost(WAIT);

            assertEquals(200, response.getStatus());
            var body = (Map<?, ?>) response.getEntity();
            assertEquals("cleared", body.get("status"));
            assertEquals(2L, body.get("count"));
            assertEquals("memory", body.get("backend"));
            assertEquals(1, service.status(CLIENT, LOGIN).await().atMost(WAIT).remaining());
        }
    }
}
