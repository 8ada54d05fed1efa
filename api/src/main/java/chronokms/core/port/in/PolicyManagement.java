package chronokms.core.port.in;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.policy.Policy;

/**
 * Storage-facing management of key-holder policies.
 */
public interface PolicyManagement {

    /**
     * Lists policies, highest priority first.
     */
    Uni<List<Policy>> list();

    Uni<Optional<Policy>> get(String id);

    Uni<Policy> create(String name, String type, Integer priority, Map<String, Object> config, String description);

    /**
     * Deletes a policy.
     *
     * @throws chronokms.core.model.common.ConflictException for the built-in policy
     */
    Uni<Boolean> delete(String id);

    Uni<Optional<Policy>> setEnabled(String id, boolean enabled);

    /**
     * Seeds the built-in allow-all policy when no policy exists.
     */
    Uni<Void> seedDefaults();
}
