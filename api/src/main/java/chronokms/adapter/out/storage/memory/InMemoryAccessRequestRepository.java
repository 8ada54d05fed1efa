package chronokms.adapter.out.storage.memory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.access.AccessRequestQuery;
import chronokms.core.model.access.AccessRequestRecord;
import chronokms.core.model.access.AccessRequestStatistics;
import chronokms.core.model.access.Page;
import chronokms.core.port.out.AccessRequestRepository;

/**
 * In-memory access request history.
 */
public class InMemoryAccessRequestRepository implements AccessRequestRepository {

    private static final Comparator<AccessRequestRecord> NEWEST_FIRST = Comparator.comparing(
                    AccessRequestRecord::createdAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparing(AccessRequestRecord::id)
            .reversed();

    private final ConcurrentHashMap<String, AccessRequestRecord> storage = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> save(AccessRequestRecord record) {
        return Uni.createFrom().item(() -> {
            storage.put(record.id(), record);
            return null;
        });
    }

    @Override
    public Uni<Optional<AccessRequestRecord>> findById(String id) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storage.get(id)));
    }

    @Override
    public Uni<Page<AccessRequestRecord>> find(AccessRequestQuery query) {
        return Uni.createFrom().item(() -> {
            List<AccessRequestRecord> matching = storage.values().stream()
                    .filter(query::matches)
                    .sorted(NEWEST_FIRST)
                    .toList();
            return Page.of(matching, query.limit(), query.offset());
        });
    }

    @Override
    public Uni<AccessRequestStatistics> statistics(Instant now) {
        return Uni.createFrom().item(() -> {
            Instant since = now.minus(Duration.ofHours(24));
            long total = 0;
            long granted = 0;
            long recent = 0;
            for (AccessRequestRecord record : storage.values()) {
                total++;
                if (record.granted()) {
                    granted++;
                }
                if (record.createdAt() != null && !record.createdAt().isBefore(since)) {
                    recent++;
                }
            }
            return new AccessRequestStatistics(total, granted, total - granted, recent);
        });
    }
}
