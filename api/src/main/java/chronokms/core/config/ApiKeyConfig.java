package chronokms.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for requester API keys.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code kms.auth.api-keys.hash-rounds} - bcrypt work factor for secrets</li>
 *   <li>{@code kms.auth.api-keys.max-ttl} - Maximum lifetime of a key (optional)</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>
 * kms.auth.api-keys.hash-rounds=12
 * kms.auth.api-keys.max-ttl=P365D
 * </pre>
 */
@ConfigMapping(prefix = "kms.auth.api-keys")
public interface ApiKeyConfig {

    /**
     * bcrypt work factor used when hashing new secrets.
     *
     * @return log2 rounds (default: 10)
     */
    @WithDefault("10")
    int hashRounds();

    /**
     * Maximum lifetime of an API key.
     *
     * <p>If set, every key must carry an expiry no further away than this.
     *
     * @return the maximum TTL, or empty if not configured
     */
    Optional<Duration> maxTtl();
}
