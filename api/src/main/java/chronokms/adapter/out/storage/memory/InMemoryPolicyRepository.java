package chronokms.adapter.out.storage.memory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.policy.Policy;
import chronokms.core.port.out.PolicyRepository;

/**
 * In-memory policy store.
 */
public class InMemoryPolicyRepository implements PolicyRepository {

    private static final Comparator<Policy> HIGHEST_PRIORITY_FIRST =
            Comparator.comparingInt(Policy::priority).reversed().thenComparing(Policy::id);

    private final ConcurrentHashMap<String, Policy> storage = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> save(Policy policy) {
        return Uni.createFrom().item(() -> {
            storage.put(policy.id(), policy);
            return null;
        });
    }

    @Override
    public Uni<Optional<Policy>> findById(String id) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storage.get(id)));
    }

    @Override
    public Uni<List<Policy>> findAll() {
        return Uni.createFrom()
                .item(() -> storage.values().stream().sorted(HIGHEST_PRIORITY_FIRST).toList());
    }

    @Override
    public Uni<Boolean> delete(String id) {
        return Uni.createFrom().item(() -> storage.remove(id) != null);
    }

    @Override
    public Uni<Long> count() {
        return Uni.createFrom().item(() -> (long) storage.size());
    }
}
