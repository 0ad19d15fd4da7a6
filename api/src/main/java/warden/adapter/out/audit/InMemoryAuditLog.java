package warden.adapter.out.audit;

import java.util.Comparator;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;

import warden.core.model.audit.AuditEntry;
import warden.core.model.audit.AuditQuery;
import warden.core.port.out.AuditLogReader;

/**
 * Process-local audit log for development and tests.
 *
 * <p>Replaced by any other {@link AuditLogReader} bean. Entries are kept up to
 * a fixed capacity; the oldest are discarded first. Appends are serialized;
 * queries read the deque without locking.
 */
@DefaultBean
@ApplicationScoped
public class InMemoryAuditLog implements AuditLogReader {

    static final int DEFAULT_CAPACITY = 100_000;

    private final ConcurrentLinkedDeque<AuditEntry> entries = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();
    private final int capacity;

    public InMemoryAuditLog() {
        this(DEFAULT_CAPACITY);
    }

    public InMemoryAuditLog(int capacity) {
        this.capacity = capacity;
    }

    public synchronized void append(AuditEntry entry) {
        entries.addLast(entry);
        if (size.incrementAndGet() > capacity && entries.pollFirst() != null) {
            size.decrementAndGet();
        }
    }

    @Override
    public Uni<Long> count(AuditQuery query) {
        return Uni.createFrom().item(() -> entries.stream().filter(query::matches).count());
    }

    @Override
    public Uni<Optional<AuditEntry>> findLatest(AuditQuery query) {
        return Uni.createFrom()
                .item(() -> entries.stream().filter(query::matches).max(Comparator.comparing(AuditEntry::timestamp)));
    }

    @Override
    public Uni<Set<String>> distinctOrigins(AuditQuery query) {
        return Uni.createFrom()
                .item(() -> entries.stream()
                        .filter(query::matches)
                        .map(AuditEntry::networkOrigin)
                        .filter(origin -> origin != null && !origin.isBlank())
                        .collect(Collectors.toUnmodifiableSet()));
    }

    public int size() {
        return size.get();
    }
}
