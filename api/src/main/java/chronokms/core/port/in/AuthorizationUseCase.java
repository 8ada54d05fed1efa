package chronokms.core.port.in;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.access.AccessRequest;
import chronokms.core.model.access.AccessResponse;

/**
 * Turns a validated access request into an audited outcome.
 */
public interface AuthorizationUseCase {

    /**
     * Validates the request, delegates the decision to the key-holder, appends
     * the audit events and exports any granted keys.
     *
     * <p>The audit events are appended even if the caller goes away before the
     * result is delivered. The history row is written best-effort.
     *
     * @param request the access request
     * @return Uni with the decision
     * @throws chronokms.core.model.common.ValidationException for an empty requester id or an inverted range
     * @throws KeyHolderUnavailableException if the key-holder failed or timed out
     */
    Uni<AccessResponse> authorize(AccessRequest request);

    /**
     * Exception thrown when the key-holder could not produce a decision.
     */
    class KeyHolderUnavailableException extends RuntimeException {
        public KeyHolderUnavailableException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
