package chronokms.core.model.audit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import chronokms.core.model.access.TimeRange;

/**
 * Immutable record of one lifecycle step.
 *
 * <p>Events are never mutated once appended. {@code sequence} is assigned by the
 * audit store on append and gives insertion order within one process; callers
 * build events with a sequence of {@code -1}.
 *
 * @param id        unique identifier
 * @param sequence  insertion order assigned by the store
 * @param timestamp epoch millis when the step happened
 * @param eventType lifecycle step
 * @param actor     who performed the step (requester or key-holder)
 * @param target    optional subject of the step
 * @param timeRange optional time range the step concerns
 * @param success   whether the step succeeded
 * @param details   optional structured details
 */
public record AuditEvent(
        String id,
        long sequence,
        long timestamp,
        AuditEventType eventType,
        String actor,
        String target,
        TimeRange timeRange,
        boolean success,
        Map<String, Object> details) {

    public static final long UNSEQUENCED = -1L;

    /** Detail key linking an outcome event to the request event it answers. */
    public static final String REQUEST_EVENT_ID = "requestEventId";

    public AuditEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(eventType, "eventType");
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("Audit event actor cannot be null or blank");
        }
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public AuditEvent withSequence(long sequence) {
        return new AuditEvent(id, sequence, timestamp, eventType, actor, target, timeRange, success, details);
    }

    /**
     * Returns true if this event concerns the given party as actor or target.
     */
    public boolean involves(String party) {
        return party.equals(actor) || party.equals(target);
    }

    public String requestEventId() {
        Object value = details.get(REQUEST_EVENT_ID);
        return value != null ? value.toString() : null;
    }
}
