package chronokms.core.model.access;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request for decryption keys covering a time range.
 *
 * @param requesterId requester asking for access
 * @param timeRange   time range the keys should cover
 * @param purpose     optional human-readable purpose
 * @param metadata    optional free-form metadata
 */
public record AccessRequest(String requesterId, TimeRange timeRange, String purpose, Map<String, Object> metadata) {

    public AccessRequest {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }
}
