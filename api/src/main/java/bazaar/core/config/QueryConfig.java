package bazaar.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for listing queries.
 *
 * <p>Configuration prefix: {@code bazaar.query}
 */
@ConfigMapping(prefix = "bazaar.query")
public interface QueryConfig {

    /**
     * @return page size when the request gives none (default: 20)
     */
    @WithDefault("20")
    int defaultLimit();

    /**
     * @return largest accepted page size (default: 100)
     */
    @WithDefault("100")
    int maxLimit();

    /**
     * Items created within this window rank first under the HotNow ordering.
     *
     * @return recency window (default: 7 days)
     */
    @WithDefault("P7D")
    Duration hotWindow();

    /**
     * @return featured list size when the request gives none (default: 10)
     */
    @WithDefault("10")
    int featuredLimit();
}
