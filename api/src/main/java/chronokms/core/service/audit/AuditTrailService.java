package chronokms.core.service.audit;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import chronokms.core.model.audit.AuditEvent;
import chronokms.core.model.audit.AuditFilter;
import chronokms.core.model.audit.AuditStatistics;
import chronokms.core.port.in.AuditTrail;
import chronokms.core.port.out.AuditLogRepository;

/**
 * Append-only audit trail backed by an {@link AuditLogRepository}.
 */
@ApplicationScoped
public class AuditTrailService implements AuditTrail {

    private static final Logger LOG = Logger.getLogger(AuditTrailService.class);

    private final AuditLogRepository repository;

    @Inject
    public AuditTrailService(AuditLogRepository repository) {
        this.repository = repository;
    }

    @Override
    public Uni<AuditEvent> append(AuditEvent event) {
        return repository.append(event).invoke(stored -> LOG.debugf(
                "Audit event %s #%d %s actor=%s target=%s success=%s",
                stored.id(),
                stored.sequence(),
                stored.eventType(),
                stored.actor(),
                stored.target(),
                stored.success()));
    }

    @Override
    public Uni<List<AuditEvent>> retrieve(AuditFilter filter) {
        return repository.find(filter != null ? filter : AuditFilter.all());
    }

    @Override
    public Uni<AuditStatistics> statistics(AuditFilter filter) {
        return retrieve(filter).map(AuditTrailService::aggregate);
    }

    static AuditStatistics aggregate(List<AuditEvent> events) {
        Map<String, Long> byType = new TreeMap<>();
        Map<String, Long> byActor = new TreeMap<>();
        long successful = 0;
        Long earliest = null;
        Long latest = null;

        for (AuditEvent event : events) {
            byType.merge(event.eventType().name(), 1L, Long::sum);
            byActor.merge(event.actor(), 1L, Long::sum);
            if (event.success()) {
                successful++;
            }
            earliest = earliest == null ? event.timestamp() : Math.min(earliest, event.timestamp());
            latest = latest == null ? event.timestamp() : Math.max(latest, event.timestamp());
        }

        long total = events.size();
        double successRate = total == 0 ? 0.0 : (double) successful / total;
        return new AuditStatistics(total, byType, byActor, successRate, earliest, latest);
    }
}
