package chronokms.adapter.in.scheduling;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import chronokms.core.port.in.SessionManagement;

/**
 * Periodically evicts expired admin sessions.
 */
@ApplicationScoped
public class SessionSweepScheduler {

    private static final Logger LOG = Logger.getLogger(SessionSweepScheduler.class);

    private final SessionManagement sessionManagement;

    @Inject
    public SessionSweepScheduler(SessionManagement sessionManagement) {
        this.sessionManagement = sessionManagement;
    }

    @Scheduled(
            every = "${kms.session.sweep-interval:15m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> sweep() {
        return sessionManagement
                .sweepExpired()
                .replaceWithVoid()
                .onFailure()
                .invoke(e -> LOG.error("Session sweep failed", e))
                .onFailure()
                .recoverWithNull();
    }
}
