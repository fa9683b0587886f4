package bazaar.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration access for catalog and cache providers.
 *
 * <p>Providers read their settings through this interface instead of a specific
 * configuration framework.
 */
public interface StorageAdapterConfig {

    /**
     * Get a required configuration value.
     *
     * @param key the configuration key
     * @return the value
     * @throws IllegalStateException if not configured
     */
    String getRequired(String key);

    Optional<String> get(String key);

    String getOrDefault(String key, String defaultValue);

    Optional<Integer> getInt(String key);

    /**
     * Get a duration value in ISO-8601 format, e.g. {@code PT15M}.
     *
     * @param key the configuration key
     * @return the duration if present and valid
     */
    Optional<Duration> getDuration(String key);
}
