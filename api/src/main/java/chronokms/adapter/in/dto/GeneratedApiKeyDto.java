package chronokms.adapter.in.dto;

import chronokms.core.model.auth.ApiKeyCreateResult;

/**
 * Response to key generation. {@code apiKey} is the only time the plaintext
 * {@code <keyId>.<secret>} credential is returned.
 */
public record GeneratedApiKeyDto(String apiKey, ApiKeyDto key) {

    public static GeneratedApiKeyDto fromModel(ApiKeyCreateResult result) {
        return new GeneratedApiKeyDto(result.plaintextCredential(), ApiKeyDto.fromModel(result.metadata()));
    }

    @Override
    public String toString() {
        return "GeneratedApiKeyDto[keyId=" + key.keyId() + "]";
    }
}
