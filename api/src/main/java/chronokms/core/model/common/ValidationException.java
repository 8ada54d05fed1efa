package chronokms.core.model.common;

/**
 * Signals a malformed request. The message is safe to return to the caller.
 */
public class ValidationException extends IllegalArgumentException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
