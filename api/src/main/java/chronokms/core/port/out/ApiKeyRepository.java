package chronokms.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.auth.ApiKeyCredential;

/**
 * Credential half of the credential store.
 *
 * <p>Implementations must support safe concurrent reads and a non-corrupting
 * write path.
 */
public interface ApiKeyRepository {

    /**
     * Save or replace a credential.
     *
     * @param credential the credential to persist
     * @return Uni completing when the save is durable
     */
    Uni<Void> save(ApiKeyCredential credential);

    /**
     * Find a credential by its public key id.
     */
    Uni<Optional<ApiKeyCredential>> findById(String keyId);

    /**
     * Retrieve all credentials.
     */
    Uni<List<ApiKeyCredential>> findAll();

    /**
     * Retrieve all credentials of one requester.
     */
    Uni<List<ApiKeyCredential>> findByRequesterId(String requesterId);

    /**
     * Record a successful use of a credential.
     *
     * @return Uni with true if the credential existed
     */
    Uni<Boolean> updateLastUsed(String keyId, Instant lastUsedAt);

    /**
     * Delete a credential.
     *
     * @return Uni with true if deleted, false if not found
     */
    Uni<Boolean> delete(String keyId);

    /**
     * Delete every credential owned by a requester.
     *
     * @return Uni with the number of deleted credentials
     */
    Uni<Integer> deleteByRequesterId(String requesterId);
}
