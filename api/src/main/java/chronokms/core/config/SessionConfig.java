package chronokms.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for admin sessions.
 *
 * <p>Configuration prefix: {@code kms.session}
 */
@ConfigMapping(prefix = "kms.session")
public interface SessionConfig {

    /**
     * Session TTL (time-to-live).
     *
     * @return Session duration (default: 24 hours)
     */
    @WithDefault("PT24H")
    Duration ttl();

    /**
     * Enable sliding expiration.
     *
     * <p>When enabled, every successful validation moves the expiry to now + TTL,
     * so the TTL acts as an idle timeout. When disabled the TTL is measured from
     * creation.
     *
     * @return true if sliding expiration is enabled (default: true)
     */
    @WithDefault("true")
    boolean slidingExpiration();

    /**
     * Period of the background sweep, in scheduler syntax.
     *
     * @return sweep period (default: 15m)
     */
    @WithDefault("15m")
    String sweepInterval();

    /**
     * ID generation configuration.
     */
    IdGenerationConfig idGeneration();

    /**
     * Session ID generation configuration.
     */
    interface IdGenerationConfig {

        /**
         * Maximum attempts when a generated session ID already exists.
         *
         * @return Max retry attempts (default: 3)
         */
        @WithDefault("3")
        int maxRetries();
    }
}
