package chronokms.adapter.in.dto;

import java.util.Map;

/**
 * DTO for policy creation.
 *
 * @param name        display name (required)
 * @param type        policy type (default custom)
 * @param priority    evaluation priority (default 0)
 * @param config      type-specific configuration
 * @param description optional description
 */
public record PolicyRequest(
        String name, String type, Integer priority, Map<String, Object> config, String description) {}
