package chronokms.adapter.in.dto;

import java.util.Map;

/**
 * DTO for creating or updating a requester. Null fields are left unchanged on update.
 *
 * @param id          requester id (create only; generated when blank)
 * @param name        display name
 * @param description optional description
 * @param enabled     enabled flag (update only)
 * @param metadata    free-form metadata
 */
public record RequesterRequest(
        String id, String name, String description, Boolean enabled, Map<String, Object> metadata) {}
