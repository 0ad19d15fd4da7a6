package warden.adapter.in.rest;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import io.quarkus.security.PermissionsAllowed;

import warden.core.model.auth.Permission;
import warden.core.model.security.SecurityEvent;
import warden.core.model.security.Severity;
import warden.core.service.security.SecurityEventLog;

/**
 * REST resource for browsing detected security events, newest first.
 */
@Path("/admin/security-events")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class SecurityEventResource {

    static final int DEFAULT_LIMIT = 100;
    static final int MAX_LIMIT = 1000;

    private final SecurityEventLog eventLog;

    public SecurityEventResource(SecurityEventLog eventLog) {
        this.eventLog = eventLog;
    }

    /**
     * List events across all users.
     *
     * @param since ISO-8601 instant; only later events are returned
     * @param severity lowest severity to include
     * @param limit maximum number of events (default 100, at most 1000)
     */
    @GET
    @PermissionsAllowed({Permission.SECURITY_EVENTS_READ_VALUE, Permission.ADMIN_VALUE})
    public Map<String, Object> listEvents(
            @QueryParam("since") String since,
            @QueryParam("severity") String severity,
            @QueryParam("limit") Integer limit) {
        final var events = eventLog.allEvents(parseInstant(since), parseSeverity(severity), effectiveLimit(limit));
        return Map.of("events", format(events), "count", events.size());
    }

    @GET
    @Path("/users/{userId}")
    @PermissionsAllowed({Permission.SECURITY_EVENTS_READ_VALUE, Permission.ADMIN_VALUE})
    public Map<String, Object> listUserEvents(
            @PathParam("userId") String userId,
            @QueryParam("since") String since,
            @QueryParam("limit") Integer limit) {
        final var events = eventLog.userEvents(userId, parseInstant(since), effectiveLimit(limit));
        return Map.of("userId", userId, "events", format(events), "count", events.size());
    }

    static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("since must be an ISO-8601 instant: " + value, e);
        }
    }

    static Severity parseSeverity(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: " + value, e);
        }
    }

    static int effectiveLimit(Integer limit) {
        if (limit == null || limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }

    private static List<Map<String, Object>> format(List<SecurityEvent> events) {
        return events.stream()
                .map(event -> Map.<String, Object>of(
                        "type", event.type().name(),
                        "severity", event.severity().name(),
                        "userId", event.userId(),
                        "timestamp", event.timestamp().toString(),
                        "autoResponse", event.autoResponse().name(),
                        "metadata", event.metadata()))
                .toList();
    }
}
