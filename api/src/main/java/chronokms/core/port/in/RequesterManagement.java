package chronokms.core.port.in;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.requester.Requester;

/**
 * CRUD over requesters.
 */
public interface RequesterManagement {

    Uni<List<Requester>> list();

    Uni<Optional<Requester>> get(String id);

    /**
     * Creates an enabled requester. A blank id is replaced by a generated one.
     *
     * @throws chronokms.core.model.common.ConflictException if the id is taken
     */
    Uni<Requester> create(String id, String name, String description, Map<String, Object> metadata);

    /**
     * Updates the given fields; nulls are left unchanged.
     */
    Uni<Optional<Requester>> update(
            String id, String name, String description, Boolean enabled, Map<String, Object> metadata);

    /**
     * Deletes a requester together with its credentials.
     */
    Uni<Boolean> delete(String id);
}
