package chronokms.core.model.audit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate statistics over a set of audit events.
 *
 * @param totalEntries   number of events
 * @param entriesByType  counts keyed by event type name
 * @param entriesByActor counts keyed by actor
 * @param successRate    successful / total, exactly 0 when there are no events
 * @param earliest       smallest timestamp, null when empty
 * @param latest         largest timestamp, null when empty
 */
public record AuditStatistics(
        long totalEntries,
        Map<String, Long> entriesByType,
        Map<String, Long> entriesByActor,
        double successRate,
        Long earliest,
        Long latest) {

    public AuditStatistics {
        entriesByType = entriesByType != null ? Collections.unmodifiableMap(new LinkedHashMap<>(entriesByType)) : Map.of();
        entriesByActor =
                entriesByActor != null ? Collections.unmodifiableMap(new LinkedHashMap<>(entriesByActor)) : Map.of();
    }
}
