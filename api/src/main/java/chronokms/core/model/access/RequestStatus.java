package chronokms.core.model.access;

/**
 * Reconstructed status of a submitted request.
 *
 * <p>{@link #PENDING} means no outcome event was observed in the examined window.
 * It is not the same as {@link #DENIED}.
 */
public enum RequestStatus {
    GRANTED,
    DENIED,
    PENDING;

    public String wireName() {
        return name().toLowerCase();
    }
}
