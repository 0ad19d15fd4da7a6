package warden.adapter.in.rest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
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
import warden.core.model.lockout.LockedAccount;
import warden.core.service.lockout.AccountLockoutGuard;

/**
 * REST resource for account lockout administration.
 *
 * <p>Lists locked accounts, reports the lockout state of an identity and lifts
 * locks before they expire.
 */
@Path("/admin/lockouts")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class LockoutResource {

    private static final Logger LOG = Logger.getLogger(LockoutResource.class);

    private final AccountLockoutGuard lockoutGuard;

    public LockoutResource(AccountLockoutGuard lockoutGuard) {
        this.lockoutGuard = lockoutGuard;
    }

    /**
     * List accounts that are currently locked, soonest unlock first.
     *
     * @param limit maximum number of entries to return
     */
    @GET
    @PermissionsAllowed({Permission.LOCKOUTS_READ_VALUE, Permission.ADMIN_VALUE})
    public Uni<Response> listLockouts(@QueryParam("limit") Integer limit) {
        final var effectiveLimit = limit != null && limit > 0 ? limit : 100;

        return lockoutGuard.getLockedAccounts().map(accounts -> {
            final var page = accounts.stream()
                    .limit(effectiveLimit)
                    .map(LockoutResource::formatLockedAccount)
                    .toList();
            return Response.ok(Map.of(
                            "lockouts", page,
                            "count", page.size(),
                            "total", accounts.size(),
                            "limit", effectiveLimit))
                    .build();
        });
    }

    @GET
    @Path("/{identity}")
    @PermissionsAllowed({Permission.LOCKOUTS_READ_VALUE, Permission.ADMIN_VALUE})
    public Uni<Response> getLockoutStatus(@PathParam("identity") String identity) {
        return lockoutGuard.isLocked(identity).map(status -> {
            final var response = new LinkedHashMap<String, Object>();
            response.put("identity", identity.trim().toLowerCase(Locale.ROOT));
            response.put("locked", status.locked());
            response.put("failedAttempts", status.failedAttempts());
            response.put("requiresCaptcha", status.requiresCaptcha());
            if (status.locked()) {
                response.put("lockedAt", status.lockedAt().toString());
                response.put("unlockAt", status.unlockAt().toString());
            }
            response.put("checkedAt", Instant.now().toString());
            return Response.ok(response).build();
        });
    }

    /**
     * Lift the lock on an identity.
     *
     * @param identity the locked identity
     * @param actor the administrator performing the unlock (recorded in logs)
     * @return 204 when a lock was lifted, 404 when the identity was not locked
     */
    @DELETE
    @Path("/{identity}")
    @PermissionsAllowed({Permission.LOCKOUTS_WRITE_VALUE, Permission.ADMIN_VALUE})
    public Uni<Response> unlock(@PathParam("identity") String identity, @QueryParam("actor") String actor) {
        LOG.infov("Unlock requested: identity={0}, actor={1}", identity, actor);

        return lockoutGuard.unlock(identity, actor).map(unlocked -> {
            if (!unlocked) {
                throw WardenProblem.notFound("Account is not locked: " + identity);
            }
            return Response.noContent().build();
        });
    }

    private static Map<String, Object> formatLockedAccount(LockedAccount account) {
        return Map.of(
                "identity", account.identity(),
                "lockedAt", account.lockout().lockedAt().toString(),
                "unlockAt", account.lockout().unlockAt().toString(),
                "failedAttempts", account.lockout().failedAttempts());
    }
}
