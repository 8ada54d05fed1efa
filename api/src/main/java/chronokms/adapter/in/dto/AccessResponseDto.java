package chronokms.adapter.in.dto;

import java.util.LinkedHashMap;
import java.util.Map;

import chronokms.core.model.access.AccessResponse;

/**
 * Access decision as returned to the caller.
 *
 * @param granted      whether access was granted
 * @param privateKeys  exported keys keyed by epoch-millis timestamp (empty when denied)
 * @param metadata     key count and granularity
 * @param denialReason reason for denial, null when granted
 */
public record AccessResponseDto(
        boolean granted, Map<String, String> privateKeys, Metadata metadata, String denialReason) {

    public record Metadata(int keyCount, long granularityMs) {}

    public static AccessResponseDto fromModel(AccessResponse response) {
        Map<String, String> keys = new LinkedHashMap<>();
        response.keys().forEach((timestamp, key) -> keys.put(Long.toString(timestamp), key));
        return new AccessResponseDto(
                response.granted(),
                keys,
                new Metadata(response.keyCount(), response.granularityMs()),
                response.denialReason());
    }

    @Override
    public String toString() {
        return "AccessResponseDto[granted=" + granted + ", keyCount=" + privateKeys.size() + "]";
    }
}
