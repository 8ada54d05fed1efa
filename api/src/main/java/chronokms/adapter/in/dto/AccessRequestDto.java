package chronokms.adapter.in.dto;

import java.util.Map;

import chronokms.core.model.access.AccessRequest;

/**
 * DTO for an access request.
 *
 * @param requesterId requester to act for; defaults to the calling requester
 * @param timeRange   range the keys should cover (required)
 * @param purpose     optional purpose
 * @param metadata    optional metadata
 */
public record AccessRequestDto(
        String requesterId, TimeRangeDto timeRange, String purpose, Map<String, Object> metadata) {

    public AccessRequest toModel(String effectiveRequesterId) {
        return new AccessRequest(
                effectiveRequesterId, timeRange != null ? timeRange.toModel() : null, purpose, metadata);
    }
}
