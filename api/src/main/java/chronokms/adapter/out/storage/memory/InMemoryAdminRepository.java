package chronokms.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.admin.AdminAccount;
import chronokms.core.port.out.AdminRepository;

/**
 * In-memory implementation of AdminRepository.
 *
 * <p>Writes are serialized so that the first-account check and the insert are atomic
 * and the username index stays consistent with the primary map.
 */
public class InMemoryAdminRepository implements AdminRepository {

    private final ConcurrentHashMap<String, AdminAccount> storageById = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> idByUsername = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    @Override
    public Uni<Boolean> saveFirst(AdminAccount account) {
        return Uni.createFrom().item(() -> {
            synchronized (writeLock) {
                if (!storageById.isEmpty()) {
                    return false;
                }
                storageById.put(account.id(), account);
                idByUsername.put(account.username(), account.id());
                return true;
            }
        });
    }

    @Override
    public Uni<Void> update(AdminAccount account) {
        return Uni.createFrom().item(() -> {
            synchronized (writeLock) {
                AdminAccount previous = storageById.put(account.id(), account);
                if (previous != null && !previous.username().equals(account.username())) {
                    idByUsername.remove(previous.username());
                }
                idByUsername.put(account.username(), account.id());
            }
            return null;
        });
    }

    @Override
    public Uni<Optional<AdminAccount>> findById(String id) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storageById.get(id)));
    }

    @Override
    public Uni<Optional<AdminAccount>> findByUsername(String username) {
        return Uni.createFrom().item(() -> Optional.ofNullable(idByUsername.get(username))
                .map(storageById::get));
    }

    @Override
    public Uni<Long> count() {
        return Uni.createFrom().item(() -> (long) storageById.size());
    }
}
