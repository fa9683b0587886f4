package bazaar.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for timeouts on outbound calls.
 *
 * <p>Configuration prefix: {@code bazaar.resiliency}
 */
@ConfigMapping(prefix = "bazaar.resiliency")
public interface ResiliencyConfig {

    /**
     * Cache tier timeout configuration.
     */
    CacheTimeouts cache();

    /**
     * Catalog store timeout configuration.
     */
    CatalogTimeouts catalog();

    interface CacheTimeouts {

        /**
         * Maximum time for a single cache operation before it is treated as a miss.
         *
         * @return operation timeout (default: 250 milliseconds)
         */
        @WithDefault("PT0.25S")
        Duration operationTimeout();
    }

    interface CatalogTimeouts {

        /**
         * Maximum time for a catalog store read.
         *
         * <p>If exceeded, the request fails with 503 Service Unavailable.
         *
         * @return query timeout (default: 5 seconds)
         */
        @WithDefault("PT5S")
        Duration queryTimeout();
    }
}
