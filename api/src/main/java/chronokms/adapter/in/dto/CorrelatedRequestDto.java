package chronokms.adapter.in.dto;

import chronokms.core.model.access.CorrelatedRequest;

/**
 * A request reconstructed from the audit trail, with its status as
 * {@code granted}, {@code denied} or {@code pending}.
 */
public record CorrelatedRequestDto(
        String id, long timestamp, String requesterId, TimeRangeDto timeRange, String purpose, String status) {

    public static CorrelatedRequestDto fromModel(CorrelatedRequest request) {
        return new CorrelatedRequestDto(
                request.id(),
                request.timestamp(),
                request.requesterId(),
                TimeRangeDto.fromModel(request.timeRange()),
                request.purpose(),
                request.status().wireName());
    }
}
