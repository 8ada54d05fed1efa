package chronokms.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import chronokms.core.port.out.Metrics;

/**
 * Micrometer-backed metrics.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code kms.auth.failures} - rejected credentials and sessions, by mechanism</li>
 *   <li>{@code kms.access.decisions} - access decisions, by outcome</li>
 *   <li>{@code kms.side_effects.failures} - failed best-effort writes, by task</li>
 * </ul>
 */
@ApplicationScoped
public class KmsMetrics implements Metrics {

    private final MeterRegistry registry;

    @Inject
    public KmsMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordAuthFailure(String mechanism) {
        Counter.builder("kms.auth.failures")
                .description("Rejected authentication attempts")
                .tag("mechanism", mechanism)
                .register(registry)
                .increment();
    }

    @Override
    public void recordAccessDecision(boolean granted) {
        Counter.builder("kms.access.decisions")
                .description("Access decisions returned by the key holder")
                .tag("outcome", granted ? "granted" : "denied")
                .register(registry)
                .increment();
    }

    @Override
    public void recordSideEffectFailure(String task) {
        Counter.builder("kms.side_effects.failures")
                .description("Best-effort side effects that failed")
                .tag("task", task)
                .register(registry)
                .increment();
    }
}
