package chronokms.spi;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration access for storage providers.
 *
 * <p>Lets providers read their settings without coupling to a specific
 * configuration framework.
 */
public interface StorageAdapterConfig {

    /**
     * Get a required configuration value.
     *
     * @throws IllegalStateException if not configured
     */
    String getRequired(String key);

    Optional<String> get(String key);

    String getOrDefault(String key, String defaultValue);

    /**
     * Get all configuration properties starting with the given prefix.
     */
    Map<String, String> getWithPrefix(String prefix);

    Optional<Integer> getInt(String key);

    Optional<Boolean> getBoolean(String key);

    /**
     * Get a duration value (ISO-8601, e.g. PT15M).
     */
    Optional<Duration> getDuration(String key);
}
