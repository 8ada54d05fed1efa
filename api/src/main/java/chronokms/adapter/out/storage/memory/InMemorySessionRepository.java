package chronokms.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import chronokms.core.model.session.AdminSession;
import chronokms.core.port.out.SessionRepository;

/**
 * In-memory implementation of SessionRepository.
 *
 * <p>Sessions are lost on restart and not shared across instances. Expired
 * sessions are evicted by the scheduled sweep, not by this class.
 */
public class InMemorySessionRepository implements SessionRepository {

    private static final Logger LOG = Logger.getLogger(InMemorySessionRepository.class);

    private final ConcurrentMap<String, AdminSession> sessions = new ConcurrentHashMap<>();

    @Override
    public Uni<Boolean> saveIfAbsent(AdminSession session) {
        return Uni.createFrom().item(() -> {
            AdminSession existing = sessions.putIfAbsent(session.id(), session);
            if (existing == null) {
                return true;
            }
            LOG.debugf("Session ID collision detected: %s", session.logId());
            return false;
        });
    }

    @Override
    public Uni<AdminSession> update(AdminSession session) {
        return Uni.createFrom().item(() -> {
            // a session deleted concurrently stays deleted
            sessions.replace(session.id(), session);
            return session;
        });
    }

    @Override
    public Uni<Optional<AdminSession>> findById(String sessionId) {
        // Expiration checking is handled by the service layer.
        return Uni.createFrom().item(() -> Optional.ofNullable(sessions.get(sessionId)));
    }

    @Override
    public Uni<Void> delete(String sessionId) {
        return Uni.createFrom().item(() -> {
            if (sessions.remove(sessionId) != null) {
                LOG.debugf("Session deleted: %s", AdminSession.logId(sessionId));
            }
            return null;
        });
    }

    @Override
    public Uni<Integer> deleteByAdminId(String adminId) {
        return Uni.createFrom().item(() -> removeIf(session -> session.adminId().equals(adminId)));
    }

    @Override
    public Uni<Integer> removeExpired(Instant now) {
        return Uni.createFrom().item(() -> removeIf(session -> session.expiresAt() != null
                && session.expiresAt().isBefore(now)));
    }

    @Override
    public Uni<Integer> count() {
        return Uni.createFrom().item(() -> sessions.size());
    }

    private int removeIf(Predicate<AdminSession> predicate) {
        int removed = 0;
        // weakly consistent iteration tolerates concurrent inserts and deletes
        for (var entry : sessions.entrySet()) {
            if (predicate.test(entry.getValue()) && sessions.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }
}
