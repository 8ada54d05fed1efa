package chronokms.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.policy.Policy;

/**
 * Storage for policies served to the key-holder.
 */
public interface PolicyRepository {

    Uni<Void> save(Policy policy);

    Uni<Optional<Policy>> findById(String id);

    /**
     * Retrieve all policies, highest priority first.
     */
    Uni<List<Policy>> findAll();

    Uni<Boolean> delete(String id);

    Uni<Long> count();
}
