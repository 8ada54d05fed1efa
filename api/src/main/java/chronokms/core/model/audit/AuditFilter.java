package chronokms.core.model.audit;

import chronokms.core.model.access.TimeRange;

/**
 * Criteria for retrieving audit events. Null fields do not constrain the result;
 * all non-null fields must match.
 *
 * @param timeRange event timestamp range (inclusive)
 * @param eventType event type
 * @param actor     event actor
 * @param success   success flag
 */
public record AuditFilter(TimeRange timeRange, AuditEventType eventType, String actor, Boolean success) {

    public static AuditFilter all() {
        return new AuditFilter(null, null, null, null);
    }

    public static AuditFilter byTimeRange(TimeRange timeRange) {
        return new AuditFilter(timeRange, null, null, null);
    }

    public static AuditFilter byEventType(AuditEventType eventType) {
        return new AuditFilter(null, eventType, null, null);
    }

    public static AuditFilter byActor(String actor) {
        return new AuditFilter(null, null, actor, null);
    }

    public boolean isEmpty() {
        return timeRange == null && eventType == null && actor == null && success == null;
    }

    public boolean matches(AuditEvent event) {
        if (timeRange != null && !timeRange.contains(event.timestamp())) {
            return false;
        }
        if (eventType != null && event.eventType() != eventType) {
            return false;
        }
        if (actor != null && !actor.equals(event.actor())) {
            return false;
        }
        return success == null || success == event.success();
    }
}
