package chronokms.core.port.out;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.session.AdminSession;

/**
 * Outbound port for admin session storage.
 *
 * <p>Expiry decisions belong to the service layer; the repository only stores
 * and evicts. Iteration for {@link #removeExpired(Instant)} must tolerate
 * concurrent inserts and deletes.
 */
public interface SessionRepository {

    /**
     * Store a new session only if the ID does not already exist.
     *
     * @param session Session to store
     * @return true if saved successfully, false if ID already exists
     */
    Uni<Boolean> saveIfAbsent(AdminSession session);

    /**
     * Replace a stored session (e.g. to slide its expiry).
     */
    Uni<AdminSession> update(AdminSession session);

    Uni<Optional<AdminSession>> findById(String sessionId);

    /**
     * Delete a session. Deleting an unknown id is a no-op.
     */
    Uni<Void> delete(String sessionId);

    /**
     * Delete all sessions bound to an admin account.
     *
     * @return number of deleted sessions
     */
    Uni<Integer> deleteByAdminId(String adminId);

    /**
     * Evict every session whose expiry is strictly before {@code now}.
     *
     * @return number of evicted sessions
     */
    Uni<Integer> removeExpired(Instant now);

    Uni<Integer> count();
}
