package chronokms.core.model.access;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Denormalized history row summarizing a submitted request and its outcome.
 *
 * <p>Written best-effort after the decision; its absence never affects the
 * response returned to the caller.
 *
 * @param id           unique identifier
 * @param requesterId  requester that submitted the request
 * @param timeRange    requested range
 * @param purpose      optional purpose
 * @param metadata     optional metadata
 * @param granted      whether access was granted
 * @param denialReason reason for denial, if any
 * @param keyCount     number of keys handed out (null when denied)
 * @param createdAt    when the record was written
 */
public record AccessRequestRecord(
        String id,
        String requesterId,
        TimeRange timeRange,
        String purpose,
        Map<String, Object> metadata,
        boolean granted,
        String denialReason,
        Integer keyCount,
        Instant createdAt) {

    public AccessRequestRecord {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }
}
