package chronokms.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.audit.AuditEvent;
import chronokms.core.model.audit.AuditFilter;
import chronokms.core.model.audit.AuditStatistics;

/**
 * Append-only event trail with filtered retrieval and aggregates.
 */
public interface AuditTrail {

    /**
     * Appends one event.
     *
     * @return the stored event with its insertion sequence
     */
    Uni<AuditEvent> append(AuditEvent event);

    /**
     * Returns every event matching the filter, in (timestamp, sequence) order.
     * An empty filter returns everything.
     */
    Uni<List<AuditEvent>> retrieve(AuditFilter filter);

    /**
     * Groups the matching events by type and actor.
     *
     * <p>{@code successRate} is 0 when no event matches.
     */
    Uni<AuditStatistics> statistics(AuditFilter filter);
}
