package chronokms.core.model.access;

/**
 * Totals over the access request history.
 */
public record AccessRequestStatistics(long total, long granted, long denied, long last24Hours) {}
