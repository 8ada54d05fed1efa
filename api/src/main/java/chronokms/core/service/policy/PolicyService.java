package chronokms.core.service.policy;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import chronokms.core.model.common.ConflictException;
import chronokms.core.model.common.ValidationException;
import chronokms.core.model.policy.Policy;
import chronokms.core.port.in.PolicyManagement;
import chronokms.core.port.out.PolicyRepository;

/**
 * Stores the policies the key-holder evaluates. Policies are never evaluated here.
 */
@ApplicationScoped
public class PolicyService implements PolicyManagement {

    private static final Logger LOG = Logger.getLogger(PolicyService.class);

    static final String ID_PREFIX = "policy-";
    static final String BUILT_IN_TYPE = "built-in";
    static final int ALLOW_ALL_PRIORITY = -1000;

    private final PolicyRepository repository;
    private final Clock clock;

    @Inject
    public PolicyService(PolicyRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public Uni<List<Policy>> list() {
        return repository.findAll();
    }

    @Override
    public Uni<Optional<Policy>> get(String id) {
        return repository.findById(id);
    }

    @Override
    public Uni<Policy> create(
            String name, String type, Integer priority, Map<String, Object> config, String description) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name", "name is required");
        }
        Policy policy = new Policy(
                ID_PREFIX + UUID.randomUUID(),
                name,
                type,
                priority != null ? priority : 0,
                true,
                config,
                description,
                clock.instant());
        return repository.save(policy).invoke(() -> LOG.infof(
                "Created policy %s (%s, priority %d)", policy.id(), policy.type(), policy.priority()))
                .replaceWith(policy);
    }

    @Override
    public Uni<Boolean> delete(String id) {
        if (Policy.ALLOW_ALL_ID.equals(id)) {
            return Uni.createFrom().failure(new ConflictException("The built-in policy cannot be deleted"));
        }
        return repository.delete(id);
    }

    @Override
    public Uni<Optional<Policy>> setEnabled(String id, boolean enabled) {
        return repository.findById(id).flatMap(existing -> {
            if (existing.isEmpty()) {
                return Uni.createFrom().item(Optional.<Policy>empty());
            }
            Policy updated = existing.get().withEnabled(enabled);
            return repository.save(updated).replaceWith(Optional.of(updated));
        });
    }

    @Override
    public Uni<Void> seedDefaults() {
        return repository.count().flatMap(count -> {
            if (count > 0) {
                return Uni.createFrom().voidItem();
            }
            Policy allowAll = new Policy(
                    Policy.ALLOW_ALL_ID,
                    "Allow all",
                    BUILT_IN_TYPE,
                    ALLOW_ALL_PRIORITY,
                    true,
                    Map.of(),
                    "Default policy granting every request",
                    clock.instant());
            return repository.save(allowAll).invoke(() -> LOG.info("Seeded built-in allow-all policy"));
        });
    }
}
