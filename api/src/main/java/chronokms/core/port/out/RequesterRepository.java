package chronokms.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.requester.Requester;

/**
 * Requester half of the credential store.
 */
public interface RequesterRepository {

    Uni<Void> save(Requester requester);

    Uni<Optional<Requester>> findById(String id);

    Uni<List<Requester>> findAll();

    /**
     * Delete a requester.
     *
     * @return Uni with true if deleted, false if not found
     */
    Uni<Boolean> delete(String id);
}
