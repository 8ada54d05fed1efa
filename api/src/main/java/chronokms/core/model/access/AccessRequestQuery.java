package chronokms.core.model.access;

/**
 * Filter and pagination for access request history listing.
 *
 * @param requesterId only records of this requester (null = any)
 * @param timeRange   only records whose requested range lies inside this range (null = any)
 * @param granted     only granted or only denied records (null = both)
 * @param limit       page size
 * @param offset      number of records to skip
 */
public record AccessRequestQuery(String requesterId, TimeRange timeRange, Boolean granted, int limit, int offset) {

    public static final int DEFAULT_LIMIT = 50;

    public AccessRequestQuery {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        if (offset < 0) {
            offset = 0;
        }
    }

    public boolean matches(AccessRequestRecord record) {
        if (requesterId != null && !requesterId.equals(record.requesterId())) {
            return false;
        }
        if (timeRange != null
                && (record.timeRange().startTime() < timeRange.startTime()
                        || record.timeRange().endTime() > timeRange.endTime())) {
            return false;
        }
        return granted == null || granted == record.granted();
    }
}
