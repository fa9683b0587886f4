package bazaar.core.service.catalog;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

/**
 * Bounds catalog store calls and translates their failures.
 */
final class CatalogCalls {

    private static final Logger LOG = Logger.getLogger(CatalogCalls.class);

    private CatalogCalls() {}

    /**
     * Apply the query timeout and wrap any store failure.
     *
     * @param operation     the store call
     * @param operationName name for logs and the exception
     * @param timeout       limit for the call
     * @param <T>           result type
     * @return the call, failing with {@link CatalogUnavailableException} on timeout or error
     */
    static <T> Uni<T> guarded(Uni<T> operation, String operationName, Duration timeout) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> new CatalogUnavailableException(
                        operationName, new TimeoutException("no response after " + timeout)))
                .onFailure(error -> !(error instanceof CatalogUnavailableException))
                .transform(error -> {
                    LOG.warnv("Catalog store failure during {0}: {1}", operationName, error.getMessage());
                    return new CatalogUnavailableException(operationName, error);
                });
    }
}
