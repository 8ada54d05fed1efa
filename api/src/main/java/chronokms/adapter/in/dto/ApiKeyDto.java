package chronokms.adapter.in.dto;

import java.time.Instant;

import chronokms.core.model.auth.ApiKeyCredential;

/**
 * API key metadata. Neither the secret nor its hash is ever part of this DTO.
 */
public record ApiKeyDto(
        String keyId,
        String name,
        String requesterId,
        boolean enabled,
        Instant expiresAt,
        Instant lastUsedAt,
        Instant createdAt,
        String createdBy) {

    public static ApiKeyDto fromModel(ApiKeyCredential credential) {
        return new ApiKeyDto(
                credential.keyId(),
                credential.name(),
                credential.requesterId(),
                credential.enabled(),
                credential.expiresAt(),
                credential.lastUsedAt(),
                credential.createdAt(),
                credential.createdBy());
    }
}
