package chronokms.core.port.in;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.access.AccessRequestQuery;
import chronokms.core.model.access.AccessRequestRecord;
import chronokms.core.model.access.AccessRequestStatistics;
import chronokms.core.model.access.Page;

/**
 * Read side of the denormalized access request history.
 */
public interface AccessHistory {

    Uni<Page<AccessRequestRecord>> list(AccessRequestQuery query);

    Uni<AccessRequestStatistics> statistics();
}
