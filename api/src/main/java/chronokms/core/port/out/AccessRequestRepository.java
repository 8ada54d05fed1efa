package chronokms.core.port.out;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.access.AccessRequestQuery;
import chronokms.core.model.access.AccessRequestRecord;
import chronokms.core.model.access.AccessRequestStatistics;
import chronokms.core.model.access.Page;

/**
 * Storage for denormalized access request history rows.
 */
public interface AccessRequestRepository {

    Uni<Void> save(AccessRequestRecord record);

    Uni<Optional<AccessRequestRecord>> findById(String id);

    /**
     * Retrieve matching records, newest first.
     */
    Uni<Page<AccessRequestRecord>> find(AccessRequestQuery query);

    /**
     * Compute totals; "last 24 hours" is measured back from {@code now}.
     */
    Uni<AccessRequestStatistics> statistics(Instant now);
}
