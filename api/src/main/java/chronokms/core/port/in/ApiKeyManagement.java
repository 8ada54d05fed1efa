package chronokms.core.port.in;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.auth.ApiKeyCreateResult;
import chronokms.core.model.auth.ApiKeyCredential;
import chronokms.core.model.auth.ApiKeyPair;
import chronokms.core.model.auth.RequesterIdentity;

/**
 * Port for issuing and checking requester API keys.
 *
 * <p>The plaintext secret is returned once by {@link #generate}; afterwards only
 * its hash exists.
 */
public interface ApiKeyManagement {

    /**
     * Mints a new key pair without persisting anything.
     *
     * @return a pair of {@code ck_} key id and {@code sk_} secret
     */
    ApiKeyPair generateKeyPair();

    /**
     * Hashes a secret with the configured work factor.
     *
     * @param secret plaintext secret
     * @return Uni with the salted hash
     */
    Uni<String> hashSecret(String secret);

    /**
     * Generates and stores a credential for a requester.
     *
     * @param requesterId owning requester (must exist)
     * @param name        display name (defaults to the key id)
     * @param expiresAt   optional expiry
     * @param createdBy   admin username creating the key
     * @return Uni with the one-time plaintext credential and redacted metadata
     * @throws chronokms.core.model.common.ValidationException if the expiry is in the past or exceeds the max TTL
     */
    Uni<ApiKeyCreateResult> generate(String requesterId, String name, Instant expiresAt, String createdBy);

    /**
     * Validates a {@code <keyId>.<secret>} credential.
     *
     * <p>Checks run in order and stop at the first failure: format, key lookup,
     * credential enabled, credential expiry, requester enabled, secret hash. On
     * success a best-effort last-used update is scheduled.
     *
     * @param credential the composite credential
     * @return Uni with the identity, or empty on any failure
     */
    Uni<Optional<RequesterIdentity>> validate(String credential);

    /**
     * Lists credentials with hashes redacted.
     *
     * @param requesterId optional filter
     */
    Uni<List<ApiKeyCredential>> list(String requesterId);

    Uni<Optional<ApiKeyCredential>> get(String keyId);

    /**
     * Updates name and/or enabled flag. Null arguments are left unchanged.
     *
     * @return Uni with the updated credential, or empty if unknown
     */
    Uni<Optional<ApiKeyCredential>> update(String keyId, String name, Boolean enabled);

    /**
     * Deletes a credential.
     *
     * @return Uni with true if it existed
     */
    Uni<Boolean> revoke(String keyId);
}
