package chronokms.adapter.out.storage.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.auth.ApiKeyCredential;
import chronokms.core.port.out.ApiKeyRepository;

/**
 * In-memory implementation of ApiKeyRepository.
 *
 * <p>Reads are lock-free. Single-key updates go through {@link ConcurrentHashMap#computeIfPresent}
 * so a last-used update never resurrects a deleted key.
 */
public class InMemoryApiKeyRepository implements ApiKeyRepository {

    private final ConcurrentHashMap<String, ApiKeyCredential> storage = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> save(ApiKeyCredential credential) {
        return Uni.createFrom().item(() -> {
            storage.put(credential.keyId(), credential);
            return null;
        });
    }

    @Override
    public Uni<Optional<ApiKeyCredential>> findById(String keyId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storage.get(keyId)));
    }

    @Override
    public Uni<List<ApiKeyCredential>> findAll() {
        return Uni.createFrom().item(() -> sorted(new ArrayList<>(storage.values())));
    }

    @Override
    public Uni<List<ApiKeyCredential>> findByRequesterId(String requesterId) {
        return Uni.createFrom().item(() -> sorted(storage.values().stream()
                .filter(credential -> credential.requesterId().equals(requesterId))
                .toList()));
    }

    @Override
    public Uni<Boolean> updateLastUsed(String keyId, Instant lastUsedAt) {
        return Uni.createFrom()
                .item(() -> storage.computeIfPresent(keyId, (id, existing) -> existing.withLastUsedAt(lastUsedAt))
                        != null);
    }

    @Override
    public Uni<Boolean> delete(String keyId) {
        return Uni.createFrom().item(() -> storage.remove(keyId) != null);
    }

    @Override
    public Uni<Integer> deleteByRequesterId(String requesterId) {
        return Uni.createFrom().item(() -> {
            int removed = 0;
            for (var entry : storage.entrySet()) {
                if (entry.getValue().requesterId().equals(requesterId)
                        && storage.remove(entry.getKey(), entry.getValue())) {
                    removed++;
                }
            }
            return removed;
        });
    }

    private static List<ApiKeyCredential> sorted(List<ApiKeyCredential> credentials) {
        List<ApiKeyCredential> result = new ArrayList<>(credentials);
        result.sort(Comparator.comparing(
                ApiKeyCredential::createdAt, Comparator.nullsLast(Comparator.naturalOrder())));
        return result;
    }
}
