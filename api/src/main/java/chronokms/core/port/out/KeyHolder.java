package chronokms.core.port.out;

import java.util.Map;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.access.AccessRequest;
import chronokms.core.model.keyholder.KeyHolderDecision;
import chronokms.core.model.keyholder.KeyHolderStatus;

/**
 * The external component that evaluates policies and derives time-sliced keys.
 *
 * <p>This service treats it as opaque: it hands over a validated request and
 * receives a decision. Granularity and step count are the key-holder's business.
 */
public interface KeyHolder {

    /**
     * Identifier used as the actor of the key-holder's audit events.
     */
    String id();

    /**
     * Evaluate a request and, if granted, derive one key per time step.
     */
    Uni<KeyHolderDecision> authorize(AccessRequest request);

    /**
     * The master public key as a JWK.
     */
    Uni<Map<String, Object>> masterPublicKey();

    KeyHolderStatus status();
}
