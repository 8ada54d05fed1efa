package chronokms.core.model.stats;

/**
 * Counters shown on the console dashboard.
 *
 * @param requestsTotal          number of request events
 * @param requestsGranted        number of grant events
 * @param requestsDenied         number of denial events
 * @param requestsLast24Hours    request events in the last 24 hours
 * @param policiesTotal          stored policies
 * @param policiesEnabled        enabled policies
 * @param auditEntries           audit events
 * @param auditSuccessRate       audit success rate
 * @param keysDerived            sum of derived key counts
 * @param averageKeysPerRequest  keys derived per granted request, rounded
 */
public record DashboardSummary(
        long requestsTotal,
        long requestsGranted,
        long requestsDenied,
        long requestsLast24Hours,
        long policiesTotal,
        long policiesEnabled,
        long auditEntries,
        double auditSuccessRate,
        long keysDerived,
        long averageKeysPerRequest) {}
