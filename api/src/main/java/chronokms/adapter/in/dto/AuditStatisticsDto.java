package chronokms.adapter.in.dto;

import java.util.Map;

import chronokms.core.model.audit.AuditStatistics;

/**
 * Audit aggregates with the timestamp span of the matching events.
 */
public record AuditStatisticsDto(
        long totalEntries,
        Map<String, Long> entriesByType,
        Map<String, Long> entriesByActor,
        double successRate,
        Span timeRange) {

    public record Span(Long earliest, Long latest) {}

    public static AuditStatisticsDto fromModel(AuditStatistics statistics) {
        return new AuditStatisticsDto(
                statistics.totalEntries(),
                statistics.entriesByType(),
                statistics.entriesByActor(),
                statistics.successRate(),
                new Span(statistics.earliest(), statistics.latest()));
    }
}
