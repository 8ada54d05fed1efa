package chronokms.core.model.requester;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An identity permitted to submit access requests.
 *
 * <p>A requester owns zero or more API-key credentials. Disabling a requester
 * invalidates all of its credentials at validation time; nothing is cascaded eagerly.
 *
 * @param id          unique identifier
 * @param name        display name
 * @param description optional free-form description
 * @param enabled     whether credentials of this requester may authenticate
 * @param metadata    free-form metadata
 * @param createdAt   creation instant
 * @param updatedAt   last modification instant
 */
public record Requester(
        String id,
        String name,
        String description,
        boolean enabled,
        Map<String, Object> metadata,
        Instant createdAt,
        Instant updatedAt) {

    public Requester {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Requester ID cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Requester name cannot be null or blank");
        }
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public Requester withEnabled(boolean enabled, Instant now) {
        return new Requester(id, name, description, enabled, metadata, createdAt, now);
    }

    public Requester withDetails(String name, String description, Map<String, Object> metadata, Instant now) {
        return new Requester(
                id,
                name != null ? name : this.name,
                description != null ? description : this.description,
                enabled,
                metadata != null ? metadata : this.metadata,
                createdAt,
                now);
    }
}
