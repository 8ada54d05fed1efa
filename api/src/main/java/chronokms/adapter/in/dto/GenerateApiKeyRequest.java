package chronokms.adapter.in.dto;

import java.time.Instant;

/**
 * DTO for API key generation.
 *
 * @param requesterId owning requester (required)
 * @param name        display name
 * @param expiresAt   optional expiry (null = never, unless a maximum lifetime is configured)
 */
public record GenerateApiKeyRequest(String requesterId, String name, Instant expiresAt) {}
