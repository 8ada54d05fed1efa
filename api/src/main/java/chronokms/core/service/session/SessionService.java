package chronokms.core.service.session;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import chronokms.core.config.SessionConfig;
import chronokms.core.model.session.AdminSession;
import chronokms.core.port.in.SessionManagement;
import chronokms.core.port.out.SessionRepository;

/**
 * Implementation of admin session management.
 *
 * <p>Handles session creation with collision retry, validation with optional
 * sliding expiration, logout and the periodic sweep. Expiry is evaluated
 * against the injected {@link Clock}: a session is expired once now is strictly
 * after its expiry instant.
 */
@ApplicationScoped
public class SessionService implements SessionManagement {

    private static final Logger LOG = Logger.getLogger(SessionService.class);

    private final SessionRepository repository;
    private final SessionIdGenerator idGenerator;
    private final SessionConfig config;
    private final Clock clock;

    @Inject
    public SessionService(
            SessionRepository repository, SessionIdGenerator idGenerator, SessionConfig config, Clock clock) {
        this.repository = repository;
        this.idGenerator = idGenerator;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Uni<AdminSession> createSession(String adminId, String username) {
        Instant now = clock.instant();
        return createSessionWithRetry(adminId, username, now, now.plus(config.ttl()), 0);
    }

    private Uni<AdminSession> createSessionWithRetry(
            String adminId, String username, Instant createdAt, Instant expiresAt, int attempt) {

        int maxRetries = config.idGeneration().maxRetries();

        if (attempt >= maxRetries) {
            return Uni.createFrom()
                    .failure(new SessionCreationException(
                            "Failed to generate unique session ID after " + maxRetries + " attempts"));
        }

        AdminSession session = new AdminSession(idGenerator.generate(), adminId, username, createdAt, expiresAt);

        return repository.saveIfAbsent(session).flatMap(saved -> {
            if (saved) {
                LOG.infof("Session created: %s for admin %s", session.logId(), username);
                return Uni.createFrom().item(session);
            }

            LOG.warnf("Session ID collision detected (attempt %d/%d), retrying", attempt + 1, maxRetries);
            return createSessionWithRetry(adminId, username, createdAt, expiresAt, attempt + 1);
        });
    }

    @Override
    public Uni<Optional<AdminSession>> validateSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return repository.findById(sessionId).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(Optional.<AdminSession>empty());
            }
            AdminSession session = found.get();
            Instant now = clock.instant();

            if (session.isExpired(now)) {
                LOG.debugf("Session %s expired at %s, evicting", session.logId(), session.expiresAt());
                return repository.delete(sessionId).replaceWith(Optional.<AdminSession>empty());
            }

            if (!config.slidingExpiration()) {
                return Uni.createFrom().item(Optional.of(session));
            }
            return repository.update(session.withExpiresAt(now.plus(config.ttl()))).map(Optional::of);
        });
    }

    @Override
    public Uni<Void> deleteSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Uni.createFrom().voidItem();
        }
        LOG.infof("Deleting session: %s", AdminSession.logId(sessionId));
        return repository.delete(sessionId);
    }

    @Override
    public Uni<Integer> deleteAdminSessions(String adminId) {
        return repository.deleteByAdminId(adminId).invoke(count -> {
            if (count > 0) {
                LOG.infof("Deleted %d session(s) of admin %s", count, adminId);
            }
        });
    }

    @Override
    public Uni<Integer> sweepExpired() {
        return repository.removeExpired(clock.instant()).invoke(count -> {
            if (count > 0) {
                LOG.infof("Session sweep evicted %d expired session(s)", count);
            }
        });
    }
}
