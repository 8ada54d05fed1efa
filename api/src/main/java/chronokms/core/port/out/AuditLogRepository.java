package chronokms.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.audit.AuditEvent;
import chronokms.core.model.audit.AuditFilter;

/**
 * Append-only storage for audit events.
 */
public interface AuditLogRepository {

    /**
     * Append an event, assigning the next insertion sequence.
     *
     * @param event the event to append
     * @return the stored event carrying its sequence
     */
    Uni<AuditEvent> append(AuditEvent event);

    /**
     * Retrieve matching events ordered by timestamp, then sequence.
     */
    Uni<List<AuditEvent>> find(AuditFilter filter);

    Uni<Long> count();
}
