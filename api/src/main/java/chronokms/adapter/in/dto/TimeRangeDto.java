package chronokms.adapter.in.dto;

import chronokms.core.model.access.TimeRange;

/**
 * Epoch-millisecond range as sent by clients. Both bounds are required.
 */
public record TimeRangeDto(Long startTime, Long endTime) {

    public TimeRange toModel() {
        if (startTime == null || endTime == null) {
            return null;
        }
        return new TimeRange(startTime, endTime);
    }

    public static TimeRangeDto fromModel(TimeRange range) {
        return range == null ? null : new TimeRangeDto(range.startTime(), range.endTime());
    }
}
