package chronokms.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import chronokms.core.model.session.AdminSession;

/**
 * Inbound port for admin session lifecycle.
 *
 * <p>A session is either active, expired (evicted on the next validation or
 * sweep) or destroyed (evicted on logout).
 */
public interface SessionManagement {

    /**
     * Creates a session for an authenticated admin.
     *
     * <p>Generated ids are retried on collision up to the configured maximum.
     *
     * @param adminId  bound admin account
     * @param username admin username
     * @return the created session
     * @throws SessionCreationException if no unique id could be generated
     */
    Uni<AdminSession> createSession(String adminId, String username);

    /**
     * Validates a session id.
     *
     * <p>Unknown ids yield empty. Expired sessions are evicted and yield empty.
     * With sliding expiration enabled the expiry of a valid session is pushed to
     * now + TTL.
     *
     * @param sessionId Session identifier
     * @return The valid session, or empty
     */
    Uni<Optional<AdminSession>> validateSession(String sessionId);

    /**
     * Destroys a session. Unknown ids are ignored.
     */
    Uni<Void> deleteSession(String sessionId);

    /**
     * Destroys every session of an admin.
     *
     * @return number of destroyed sessions
     */
    Uni<Integer> deleteAdminSessions(String adminId);

    /**
     * Evicts every session that has expired.
     *
     * @return number of evicted sessions
     */
    Uni<Integer> sweepExpired();

    /**
     * Exception thrown when session creation fails.
     */
    class SessionCreationException extends RuntimeException {
        public SessionCreationException(String message) {
            super(message);
        }
    }
}
