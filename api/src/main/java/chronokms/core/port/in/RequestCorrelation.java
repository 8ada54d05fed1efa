package chronokms.core.port.in;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.access.CorrelatedRequest;
import chronokms.core.model.access.Page;
import chronokms.core.model.access.RequestStatus;
import chronokms.core.model.access.TimeRange;

/**
 * Reconstructs request status from the audit trail.
 */
public interface RequestCorrelation {

    /**
     * Lists request events with their reconstructed status, newest first.
     *
     * @param requesterId optional requester filter
     * @param window      time window of request events; null means the default window ending now
     * @param status      optional status filter
     * @param limit       page size
     * @param offset      page offset
     * @throws chronokms.core.model.common.ValidationException if the window is inverted or too large
     */
    Uni<Page<CorrelatedRequest>> listRequests(
            String requesterId, TimeRange window, RequestStatus status, int limit, int offset);
}
