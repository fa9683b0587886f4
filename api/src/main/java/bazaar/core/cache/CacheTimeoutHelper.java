package bazaar.core.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bazaar.core.port.out.CacheMetrics;

/**
 * Applies a timeout and failure handling to cache store operations.
 *
 * <ul>
 *   <li>{@link #withTimeout} - Fail-fast: fails with {@link CacheTimeoutException} on timeout,
 *       propagates other failures. Used by the liveness probe.</li>
 *   <li>{@link #withTimeoutGraceful} - Fail-soft: empty Optional on timeout or any failure.
 *       Used for reads, where a failure is a miss.</li>
 *   <li>{@link #withTimeoutFallback} - Returns a fallback on timeout or any failure.
 *       Used for writes and deletes.</li>
 * </ul>
 *
 * <p>Timeouts and other failures are counted separately through {@link CacheMetrics}.
 */
public class CacheTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(CacheTimeoutHelper.class);

    private final Duration timeout;
    private final CacheMetrics metrics;
    private final String storeName;

    /**
     * @param timeout   limit for each operation
     * @param metrics   metrics sink (may be null)
     * @param storeName store name used in log messages
     */
    public CacheTimeoutHelper(Duration timeout, CacheMetrics metrics, String storeName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.storeName = storeName;
    }

    public Duration timeout() {
        return timeout;
    }

    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation.ifNoItem().after(timeout).failWith(() -> {
            LOG.warnv("Cache operation timeout: {0} on {1} after {2}", operationName, storeName, timeout);
            recordTimeout(operationName);
            return new CacheTimeoutException(operationName, storeName);
        });
    }

    public <T> Uni<Optional<T>> withTimeoutGraceful(Uni<T> operation, String operationName) {
        return operation
                .map(Optional::ofNullable)
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv("Cache operation timeout (graceful): {0} on {1} after {2}",
                            operationName, storeName, timeout);
                    recordTimeout(operationName);
                    return Optional.empty();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Cache operation failure (graceful): {0} on {1}: {2}",
                            operationName, storeName, error.getMessage());
                    recordFailure(operationName);
                    return Optional.empty();
                });
    }

    public <T> Uni<T> withTimeoutFallback(Uni<T> operation, String operationName, Supplier<T> fallback) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv("Cache operation timeout (fallback): {0} on {1} after {2}",
                            operationName, storeName, timeout);
                    recordTimeout(operationName);
                    return fallback.get();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Cache operation failure (fallback): {0} on {1}: {2}",
                            operationName, storeName, error.getMessage());
                    recordFailure(operationName);
                    return fallback.get();
                });
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordTimeout(operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordFailure(operationName);
        }
    }

    /**
     * Raised by {@link #withTimeout} when an operation exceeds the timeout.
     */
    public static class CacheTimeoutException extends RuntimeException {
        private final String operation;

        public CacheTimeoutException(String operation, String store) {
            super("Cache operation timeout: " + operation + " on " + store);
            this.operation = operation;
        }

        public String getOperation() {
            return operation;
        }
    }
}
