package chronokms.core.service.common;

import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import chronokms.core.port.out.Metrics;

/**
 * Runs best-effort side effects detached from the caller's pipeline.
 *
 * <p>A failed side effect is logged and counted under
 * {@code kms.side_effects.failures{task}}; it never reaches the caller.
 */
@ApplicationScoped
public class SideEffectRunner {

    private static final Logger LOG = Logger.getLogger(SideEffectRunner.class);

    private final Metrics metrics;

    @Inject
    public SideEffectRunner(Metrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Subscribes to the action and returns immediately.
     *
     * @param task   metric tag naming the side effect
     * @param action supplier of the work; exceptions thrown by it count as failures
     */
    public void run(String task, Supplier<Uni<?>> action) {
        Uni.createFrom()
                .deferred(action)
                .subscribe()
                .with(
                        ignored -> LOG.debugf("Side effect completed: %s", task),
                        error -> {
                            LOG.warnf("Side effect failed: %s (%s)", task, error.getMessage());
                            metrics.recordSideEffectFailure(task);
                        });
    }
}
