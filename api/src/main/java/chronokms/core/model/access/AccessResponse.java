package chronokms.core.model.access;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of an access request as returned to the caller.
 *
 * @param granted       whether access was granted
 * @param keys          exported keys keyed by epoch-millis timestamp, ascending (empty when denied)
 * @param granularityMs time step between consecutive keys (0 when denied)
 * @param denialReason  reason for denial (null when granted)
 */
public record AccessResponse(boolean granted, Map<Long, String> keys, long granularityMs, String denialReason) {

    public AccessResponse {
        keys = keys != null ? Collections.unmodifiableMap(new LinkedHashMap<>(keys)) : Map.of();
    }

    public static AccessResponse granted(Map<Long, String> keys, long granularityMs) {
        return new AccessResponse(true, keys, granularityMs, null);
    }

    public static AccessResponse denied(String denialReason) {
        return new AccessResponse(false, Map.of(), 0, denialReason);
    }

    public int keyCount() {
        return keys.size();
    }

    @Override
    public String toString() {
        return "AccessResponse[granted=" + granted + ", keyCount=" + keys.size() + ", denialReason=" + denialReason
                + "]";
    }
}
