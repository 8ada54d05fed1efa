package chronokms.core.model.access;

/**
 * A request event paired with its reconstructed status.
 *
 * @param id             id of the request event
 * @param timestamp      when the request was submitted
 * @param requesterId    requester that submitted it
 * @param timeRange      requested range
 * @param purpose        optional purpose
 * @param status         reconstructed status
 * @param outcomeEventId id of the matched outcome event, null when pending
 */
public record CorrelatedRequest(
        String id,
        long timestamp,
        String requesterId,
        TimeRange timeRange,
        String purpose,
        RequestStatus status,
        String outcomeEventId) {}
