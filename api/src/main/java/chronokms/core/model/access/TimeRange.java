package chronokms.core.model.access;

/**
 * Inclusive range of epoch-millisecond timestamps.
 *
 * @param startTime first instant, epoch millis
 * @param endTime   last instant, epoch millis
 */
public record TimeRange(long startTime, long endTime) {

    public boolean isValid() {
        return startTime <= endTime;
    }

    public boolean contains(long timestamp) {
        return timestamp >= startTime && timestamp <= endTime;
    }

    /**
     * Length of the range, saturating at {@link Long#MAX_VALUE}.
     */
    public long durationMillis() {
        long duration = endTime - startTime;
        // overflow when the range spans more than the positive long range
        return ((endTime ^ startTime) & (endTime ^ duration)) < 0 ? Long.MAX_VALUE : duration;
    }
}
