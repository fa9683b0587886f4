package bazaar.core.port.out;

/**
 * Port for recording cache tier metrics.
 */
public interface CacheMetrics {

    void recordHit(String namespace);

    void recordMiss(String namespace);

    void recordFailure(String operation);

    void recordTimeout(String operation);

    void recordInvalidation(String scope, long keys);

    /**
     * Metrics sink that discards everything.
     */
    CacheMetrics NOOP = new CacheMetrics() {
        @Override
        public void recordHit(String namespace) {}

        @Override
        public void recordMiss(String namespace) {}

        @Override
        public void recordFailure(String operation) {}

        @Override
        public void recordTimeout(String operation) {}

        @Override
        public void recordInvalidation(String scope, long keys) {}
    };
}
