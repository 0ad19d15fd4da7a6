package warden.adapter.in.rest;

import java.time.Instant;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkus.security.PermissionsAllowed;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.adapter.in.problem.WardenProblem;
import warden.core.model.auth.Permission;
import warden.core.service.ratelimit.RateLimitService;

/**
 * REST resource for resetting rate-limit windows.
 */
@Path("/admin/rate-limits")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class RateLimitResource {

    private static final Logger LOG = Logger.getLogger(RateLimitResource.class);

    private final RateLimitService rateLimitService;

    public RateLimitResource(RateLimitService rateLimitService) {
        this.rateLimitService = rateLimitService;
    }

    /**
     * Reset the window of one client on the route a path resolves to.
     *
     * @param identity the client identity, e.g. {@code ip:203.0.113.7}
     * @param route a request path; the default route when absent
     */
    @DELETE
    @Path("/{identity}")
    @PermissionsAllowed({Permission.RATE_LIMITS_WRITE_VALUE, Permission.ADMIN_VALUE})
    public Uni<Response> reset(@PathParam("identity") String identity, @QueryParam("route") String route) {
        if (!rateLimitService.isEnabled()) {
            throw WardenProblem.featureDisabled("Rate limiting");
        }
        final var path = route != null && !route.isBlank() ? route : "/";
        return rateLimitService.reset(identity, path).map(v -> Response.noContent().build());
    }

    /**
     * Remove every rate-limit window owned by this service.
     *
     * @param force must be true
     */
    @DELETE
    @PermissionsAllowed({Permission.ADMIN_VALUE})
    public Uni<Response> clearAll(@QueryParam("force") boolean force) {
        if (!rateLimitService.isEnabled()) {
            throw WardenProblem.featureDisabled("Rate limiting");
        }
        if (!force) {
            throw WardenProblem.badRequest("Must set force=true to clear all rate limit windows");
        }
        LOG.warn("Clearing all rate limit windows");

        return rateLimitService.clearAll().map(count -> Response.ok(Map.of(
                        "status", "cleared",
                        "count", count,
                        "backend", rateLimitService.backend(),
                        "clearedAt", Instant.now().toString()))
                .build());
    }
}
