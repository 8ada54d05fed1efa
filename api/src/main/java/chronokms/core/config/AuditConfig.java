package chronokms.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for audit correlation.
 *
 * <p>Configuration prefix: {@code kms.audit}
 */
@ConfigMapping(prefix = "kms.audit")
public interface AuditConfig {

    /**
     * Window examined when a caller lists requests without a time range.
     *
     * @return window ending now (default: 1 day)
     */
    @WithDefault("P1D")
    Duration defaultCorrelationWindow();

    /**
     * Largest window the correlator accepts.
     *
     * @return maximum window (default: 31 days)
     */
    @WithDefault("P31D")
    Duration maxCorrelationWindow();
}
