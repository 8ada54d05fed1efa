package chronokms.core.model.auth;

import java.time.Instant;

/**
 * A stored API-key credential belonging to a requester.
 *
 * <p>The secret is never stored; only its bcrypt hash is persisted. The
 * plaintext is handed to the caller exactly once, when the key pair is generated.
 *
 * @param keyId       public identifier, prefixed with {@code ck_}
 * @param secretHash  bcrypt hash of the secret
 * @param name        display name
 * @param requesterId owning requester
 * @param enabled     whether the credential may be used
 * @param expiresAt   expiry instant (null = never)
 * @param lastUsedAt  last successful authentication (null = never used)
 * @param createdAt   creation instant
 * @param createdBy   admin username (or "bootstrap") that generated the key
 */
public record ApiKeyCredential(
        String keyId,
        String secretHash,
        String name,
        String requesterId,
        boolean enabled,
        Instant expiresAt,
        Instant lastUsedAt,
        Instant createdAt,
        String createdBy) {

    public static final String REDACTED = "[REDACTED]";

    public ApiKeyCredential {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("Key ID cannot be null or blank");
        }
        if (secretHash == null || secretHash.isBlank()) {
            throw new IllegalArgumentException("Secret hash cannot be null or blank");
        }
        if (requesterId == null || requesterId.isBlank()) {
            throw new IllegalArgumentException("Requester ID cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            name = keyId;
        }
        if (createdBy == null) {
            createdBy = "unknown";
        }
    }

    /**
     * Checks whether the credential has expired at the given instant.
     */
    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }

    /**
     * Creates a copy with the hash redacted for display purposes.
     */
    public ApiKeyCredential redacted() {
        return new ApiKeyCredential(
                keyId, REDACTED, name, requesterId, enabled, expiresAt, lastUsedAt, createdAt, createdBy);
    }

    public ApiKeyCredential withEnabled(boolean enabled) {
        return new ApiKeyCredential(
                keyId, secretHash, name, requesterId, enabled, expiresAt, lastUsedAt, createdAt, createdBy);
    }

    public ApiKeyCredential withName(String name) {
        return new ApiKeyCredential(
                keyId, secretHash, name, requesterId, enabled, expiresAt, lastUsedAt, createdAt, createdBy);
    }

    public ApiKeyCredential withLastUsedAt(Instant lastUsedAt) {
        return new ApiKeyCredential(
                keyId, secretHash, name, requesterId, enabled, expiresAt, lastUsedAt, createdAt, createdBy);
    }
}
