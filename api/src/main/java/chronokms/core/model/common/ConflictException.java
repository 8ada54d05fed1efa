package chronokms.core.model.common;

/**
 * Signals a request that conflicts with the current state (e.g. deleting a built-in policy).
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
