package chronokms.core.service.stats;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.audit.AuditEvent;
import chronokms.core.model.audit.AuditEventType;
import chronokms.core.model.audit.AuditFilter;
import chronokms.core.model.policy.Policy;
import chronokms.core.model.stats.DashboardSummary;
import chronokms.core.port.in.AuditTrail;
import chronokms.core.port.in.SystemStatistics;
import chronokms.core.port.out.PolicyRepository;

/**
 * Dashboard counters derived from the audit trail.
 */
@ApplicationScoped
public class SystemStatisticsService implements SystemStatistics {

    static final Duration RECENT_WINDOW = Duration.ofHours(24);

    private final AuditTrail auditTrail;
    private final PolicyRepository policies;
    private final Clock clock;

    @Inject
    public SystemStatisticsService(AuditTrail auditTrail, PolicyRepository policies, Clock clock) {
        this.auditTrail = auditTrail;
        this.policies = policies;
        this.clock = clock;
    }

    @Override
    public Uni<DashboardSummary> summary() {
        return Uni.combine()
                .all()
                .unis(auditTrail.retrieve(AuditFilter.all()), policies.findAll())
                .asTuple()
                .map(tuple -> summarize(tuple.getItem1(), tuple.getItem2(), clock.millis()));
    }

    static DashboardSummary summarize(List<AuditEvent> events, List<Policy> policies, long now) {
        long recentSince = now - RECENT_WINDOW.toMillis();
        long requests = 0;
        long granted = 0;
        long denied = 0;
        long recent = 0;
        long successful = 0;
        long keysDerived = 0;

        for (AuditEvent event : events) {
            if (event.success()) {
                successful++;
            }
            if (event.eventType() == AuditEventType.ACCESS_REQUEST) {
                requests++;
                if (event.timestamp() >= recentSince) {
                    recent++;
                }
            } else if (event.eventType() == AuditEventType.ACCESS_GRANTED) {
                granted++;
            } else if (event.eventType() == AuditEventType.ACCESS_DENIED) {
                denied++;
            } else if (event.eventType() == AuditEventType.KEY_GENERATION) {
                Object count = event.details().get("keyCount");
                if (count instanceof Number number) {
                    keysDerived += number.longValue();
                }
            }
        }

        long enabledPolicies = policies.stream().filter(Policy::enabled).count();
        double successRate = events.isEmpty() ? 0.0 : (double) successful / events.size();
        long average = granted == 0 ? 0 : Math.round((double) keysDerived / granted);

        return new DashboardSummary(
                requests,
                granted,
                denied,
                recent,
                policies.size(),
                enabledPolicies,
                events.size(),
                successRate,
                keysDerived,
                average);
    }
}
