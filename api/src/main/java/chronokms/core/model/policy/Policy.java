package chronokms.core.model.policy;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named, prioritized access rule consumed by the key-holder.
 *
 * <p>This service stores and serves policies; it never evaluates them.
 *
 * @param id          unique identifier
 * @param name        display name
 * @param type        policy type (whitelist, time-based, duration-limit, custom, built-in)
 * @param priority    evaluation priority, higher first
 * @param enabled     whether the key-holder should apply it
 * @param config      type-specific configuration
 * @param description optional description
 * @param createdAt   creation instant
 */
public record Policy(
        String id,
        String name,
        String type,
        int priority,
        boolean enabled,
        Map<String, Object> config,
        String description,
        Instant createdAt) {

    public static final String ALLOW_ALL_ID = "allow-all";
    public static final String DEFAULT_TYPE = "custom";

    public Policy {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Policy ID cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Policy name cannot be null or blank");
        }
        if (type == null || type.isBlank()) {
            type = DEFAULT_TYPE;
        }
        config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
    }

    public boolean isBuiltIn() {
        return ALLOW_ALL_ID.equals(id);
    }

    public Policy withEnabled(boolean enabled) {
        return new Policy(id, name, type, priority, enabled, config, description, createdAt);
    }
}
