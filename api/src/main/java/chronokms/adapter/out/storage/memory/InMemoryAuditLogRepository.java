package chronokms.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.audit.AuditEvent;
import chronokms.core.model.audit.AuditFilter;
import chronokms.core.port.out.AuditLogRepository;

/**
 * In-memory append-only audit log.
 *
 * <p>Sequence assignment and the append happen under one lock, so the stored
 * sequence always matches the order of insertion.
 */
public class InMemoryAuditLogRepository implements AuditLogRepository {

    private static final Comparator<AuditEvent> ORDER =
            Comparator.comparingLong(AuditEvent::timestamp).thenComparingLong(AuditEvent::sequence);

    private final List<AuditEvent> events = new ArrayList<>();
    private long nextSequence = 0;

    @Override
    public Uni<AuditEvent> append(AuditEvent event) {
        return Uni.createFrom().item(() -> {
            synchronized (events) {
                AuditEvent stored = event.withSequence(nextSequence++);
                events.add(stored);
                return stored;
            }
        });
    }

    @Override
    public Uni<List<AuditEvent>> find(AuditFilter filter) {
        return Uni.createFrom().item(() -> {
            List<AuditEvent> snapshot;
            synchronized (events) {
                snapshot = new ArrayList<>(events);
            }
            List<AuditEvent> matching = new ArrayList<>();
            for (AuditEvent event : snapshot) {
                if (filter == null || filter.matches(event)) {
                    matching.add(event);
                }
            }
            matching.sort(ORDER);
            return matching;
        });
    }

    @Override
    public Uni<Long> count() {
        return Uni.createFrom().item(() -> {
            synchronized (events) {
                return (long) events.size();
            }
        });
    }
}
