package bazaar.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the catalog cache tier.
 *
 * <p>Configuration prefix: {@code bazaar.cache}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code BAZAAR_CACHE_TTL_DETAIL} - TTL of single-record entries</li>
 *   <li>{@code BAZAAR_CACHE_INVALIDATION_MODE} - PATTERN or INDEXED</li>
 *   <li>{@code BAZAAR_CACHE_LIVENESS_MAX_BACKOFF} - Longest wait between failed probes</li>
 * </ul>
 */
@ConfigMapping(prefix = "bazaar.cache")
public interface CacheConfig {

    /**
     * TTL buckets. Must be strictly increasing from admin to external.
     */
    TtlConfig ttl();

    KeysConfig keys();

    InvalidationConfig invalidation();

    LivenessConfig liveness();

    interface TtlConfig {

        /**
         * Per-user and admin dashboard entries.
         *
         * @return TTL (default: 5 minutes)
         */
        @WithDefault("PT5M")
        Duration admin();

        /**
         * Search results and featured lists.
         *
         * @return TTL (default: 1 hour)
         */
        @WithDefault("PT1H")
        Duration search();

        /**
         * Listing, category and count pages.
         *
         * @return TTL (default: 24 hours)
         */
        @WithDefault("PT24H")
        Duration listing();

        /**
         * Single-record detail entries.
         *
         * @return TTL (default: 7 days)
         */
        @WithDefault("P7D")
        Duration detail();

        /**
         * Data fetched from rate-limited external providers.
         *
         * @return TTL (default: 14 days)
         */
        @WithDefault("P14D")
        Duration external();
    }

    interface KeysConfig {

        /**
         * Above this many non-empty parameters the key suffix is hashed.
         *
         * @return parameter count threshold (default: 6)
         */
        @WithDefault("6")
        int maxPlainParams();

        /**
         * Above this length the key suffix is hashed.
         *
         * @return character threshold (default: 200)
         */
        @WithDefault("200")
        int maxPlainLength();
    }

    interface InvalidationConfig {

        /**
         * How category-scoped invalidation finds keys.
         *
         * @return mode (default: PATTERN)
         */
        @WithDefault("PATTERN")
        InvalidationMode mode();
    }

    interface LivenessConfig {

        /**
         * How often the supervisor probes the cache store. Read by the scheduler.
         *
         * @return probe interval (default: 5 seconds)
         */
        @WithDefault("PT5S")
        Duration interval();

        /**
         * Consecutive operation failures that switch the cache to bypass mode
         * before the next probe runs.
         *
         * @return failure threshold (default: 3)
         */
        @WithDefault("3")
        int failureThreshold();

        /**
         * First backoff after a failed probe.
         *
         * @return base backoff (default: 1 second)
         */
        @WithDefault("PT1S")
        Duration baseBackoff();

        /**
         * Upper bound on backoff between probes.
         *
         * @return max backoff (default: 60 seconds)
         */
        @WithDefault("PT60S")
        Duration maxBackoff();

        /**
         * Random spread applied to each backoff, as a fraction.
         *
         * @return jitter factor between 0 and 0.5 (default: 0.2)
         */
        @WithDefault("0.2")
        double jitter();
    }

    enum InvalidationMode {
        /** Scan with glob patterns. */
        PATTERN,
        /** Delete the keys recorded in per-category index sets. */
        INDEXED
    }
}
