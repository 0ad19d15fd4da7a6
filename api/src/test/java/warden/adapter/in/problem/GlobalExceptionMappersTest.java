package warden.adapter.in.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("GlobalExceptionMappers")
class GlobalExceptionMappersTest {

    private final GlobalExceptionMappers mappers = new GlobalExceptionMappers();

    @Test
    @DisplayName("should map IllegalArgumentException to a 400 validation problem")
    void shouldMapIllegalArgument() {
        var response = mappers.mapIllegalArgumentException(new IllegalArgumentException("identity cannot be blank"));

        assertEquals(400, response.getStatus());
        var problem = assertInstanceOf(HttpProblem.class, response.getEntity());
        assertEquals("Validation Error", problem.getTitle());
        assertEquals("identity cannot be blank", problem.getDetail());
    }

    @Test
    @DisplayName("should map IllegalStateException to a 400 problem")
    void shouldMapIllegalState() {
        var response = mappers.mapIllegalStateException(new IllegalStateException("not ready"));

        assertEquals(400, response.getStatus());
        assertEquals("Bad Request", assertInstanceOf(HttpProblem.class, response.getEntity()).getTitle());
    }

    @Test
    @DisplayName("tooManyRequests() should expose the window state as extension members")
    void shouldExposeWindowState() {
        var problem = WardenProblem.tooManyRequests("slow down", 30, 5, 0, 1709287200L);

        assertEquals(429, problem.getStatusCode());
        assertEquals(30L, problem.getParameters().get("retryAfter"));
        assertEquals(5L, problem.getParameters().get("limit"));
    }
}
