package chronokms.core.model.audit;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle steps recorded in the audit trail.
 */
public enum AuditEventType {
    ACCESS_REQUEST,
    ACCESS_GRANTED,
    ACCESS_DENIED,
    KEY_GENERATION,
    KEY_DISTRIBUTION;

    public boolean isOutcome() {
        return this == ACCESS_GRANTED || this == ACCESS_DENIED;
    }

    /**
     * Parses a wire name, returning empty for unknown values.
     */
    public static Optional<AuditEventType> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(t -> t.name().equalsIgnoreCase(name.trim())).findFirst();
    }
}
