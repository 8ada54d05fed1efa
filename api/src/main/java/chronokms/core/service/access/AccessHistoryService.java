package chronokms.core.service.access;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.access.AccessRequestQuery;
import chronokms.core.model.access.AccessRequestRecord;
import chronokms.core.model.access.AccessRequestStatistics;
import chronokms.core.model.access.Page;
import chronokms.core.port.in.AccessHistory;
import chronokms.core.port.out.AccessRequestRepository;

@ApplicationScoped
public class AccessHistoryService implements AccessHistory {

    private final AccessRequestRepository repository;
    private final Clock clock;

    @Inject
    public AccessHistoryService(AccessRequestRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public Uni<Page<AccessRequestRecord>> list(AccessRequestQuery query) {
        return repository.find(query);
    }

    @Override
    public Uni<AccessRequestStatistics> statistics() {
        return repository.statistics(clock.instant());
    }
}
