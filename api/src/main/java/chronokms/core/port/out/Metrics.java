package chronokms.core.port.out;

/**
 * Port interface for recording service metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Record a rejected credential or session.
     *
     * @param mechanism "api_key" or "session"
     */
    void recordAuthFailure(String mechanism);

    /**
     * Record an access decision.
     */
    void recordAccessDecision(boolean granted);

    /**
     * Record the failure of a best-effort side effect.
     *
     * @param task name of the side effect
     */
    void recordSideEffectFailure(String task);
}
