package chronokms.core.port.in;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.stats.DashboardSummary;

/**
 * Dashboard summary over the audit trail and policy store.
 */
public interface SystemStatistics {

    Uni<DashboardSummary> summary();
}
