package warden.core.port.out;

import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import warden.core.model.audit.AuditEntry;
import warden.core.model.audit.AuditQuery;

/**
 * Read-only port onto the append-only audit log of authentication and
 * sensitive-record actions.
 *
 * <p>This service never writes to the audit log.
 */
public interface AuditLogReader {

    /**
     * Count entries matching the query.
     */
    Uni<Long> count(AuditQuery query);

    /**
     * Find the most recent entry matching the query.
     */
    Uni<Optional<AuditEntry>> findLatest(AuditQuery query);

    /**
     * Collect the distinct network origins of entries matching the query.
     */
    Uni<Set<String>> distinctOrigins(AuditQuery query);
}
