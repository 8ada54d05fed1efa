package chronokms.core.model.keyholder;

import java.time.Instant;

/**
 * Operational status reported by the key-holder.
 *
 * @param keyHolderId     identifier used as the actor of key-holder audit events
 * @param masterKeyStatus status of the master key (e.g. "active")
 * @param keyAlgorithm    master key algorithm
 * @param keyCreatedAt    when the master key was created
 * @param granularityMs   time step of derived keys
 */
public record KeyHolderStatus(
        String keyHolderId, String masterKeyStatus, String keyAlgorithm, Instant keyCreatedAt, long granularityMs) {}
