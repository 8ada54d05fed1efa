package chronokms.core.model.keyholder;

import java.security.Key;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Decision returned by the key-holder for one access request.
 *
 * <p>Derived keys are live in-memory key handles; they must be exported before
 * they leave the process.
 *
 * @param granted       whether access was granted
 * @param derivedKeys   one key per time step, keyed by epoch-millis timestamp
 * @param granularityMs time step between keys
 * @param denialReason  reason for denial, if any
 */
public record KeyHolderDecision(
        boolean granted, SortedMap<Long, Key> derivedKeys, long granularityMs, String denialReason) {

    public KeyHolderDecision {
        derivedKeys = derivedKeys != null ? new TreeMap<>(derivedKeys) : new TreeMap<>();
    }

    public static KeyHolderDecision grant(Map<Long, Key> keys, long granularityMs) {
        return new KeyHolderDecision(true, new TreeMap<>(keys), granularityMs, null);
    }

    public static KeyHolderDecision deny(String reason) {
        return new KeyHolderDecision(false, new TreeMap<>(), 0, reason);
    }
}
