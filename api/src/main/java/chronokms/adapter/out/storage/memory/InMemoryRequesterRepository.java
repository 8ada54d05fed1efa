package chronokms.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.requester.Requester;
import chronokms.core.port.out.RequesterRepository;

/**
 * In-memory implementation of RequesterRepository.
 */
public class InMemoryRequesterRepository implements RequesterRepository {

    private final ConcurrentHashMap<String, Requester> storage = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> save(Requester requester) {
        return Uni.createFrom().item(() -> {
            storage.put(requester.id(), requester);
            return null;
        });
    }

    @Override
    public Uni<Optional<Requester>> findById(String id) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storage.get(id)));
    }

    @Override
    public Uni<List<Requester>> findAll() {
        return Uni.createFrom().item(() -> {
            List<Requester> result = new ArrayList<>(storage.values());
            result.sort(Comparator.comparing(Requester::id));
            return result;
        });
    }

    @Override
    public Uni<Boolean> delete(String id) {
        return Uni.createFrom().item(() -> storage.remove(id) != null);
    }
}
