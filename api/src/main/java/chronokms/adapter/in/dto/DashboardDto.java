package chronokms.adapter.in.dto;

import chronokms.core.model.stats.DashboardSummary;

/**
 * Dashboard summary grouped the way the console displays it.
 */
public record DashboardDto(
        AccessRequests accessRequests, Policies policies, AuditLog auditLog, KeyManagement keyManagement) {

    public record AccessRequests(long total, long granted, long denied, long last24Hours) {}

    public record Policies(long total, long enabled) {}

    public record AuditLog(long totalEntries, double successRate) {}

    public record KeyManagement(long totalKeysDerived, long averageKeysPerRequest) {}

    public static DashboardDto fromModel(DashboardSummary summary) {
        return new DashboardDto(
                new AccessRequests(
                        summary.requestsTotal(),
                        summary.requestsGranted(),
                        summary.requestsDenied(),
                        summary.requestsLast24Hours()),
                new Policies(summary.policiesTotal(), summary.policiesEnabled()),
                new AuditLog(summary.auditEntries(), summary.auditSuccessRate()),
                new KeyManagement(summary.keysDerived(), summary.averageKeysPerRequest()));
    }
}
