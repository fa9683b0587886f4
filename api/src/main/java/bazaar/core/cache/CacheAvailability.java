package bazaar.core.cache;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import bazaar.core.config.CacheConfig;

/**
 * Shared view of whether the cache store should be used.
 *
 * <p>While unavailable, reads and writes skip the store entirely. Only a
 * successful liveness probe makes it available again. Deletes that fail in the
 * meantime set the invalidation-lost flag so stale entries can be flushed on
 * recovery.
 */
@ApplicationScoped
public class CacheAvailability {

    private static final Logger LOG = Logger.getLogger(CacheAvailability.class);

    private final int failureThreshold;
    private final AtomicBoolean available = new AtomicBoolean(true);
    private final AtomicBoolean invalidationLost = new AtomicBoolean(false);
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    @Inject
    public CacheAvailability(CacheConfig config) {
        this(config.liveness().failureThreshold());
    }

    public CacheAvailability(int failureThreshold) {
        this.failureThreshold = Math.max(1, failureThreshold);
    }

    public static CacheAvailability alwaysAvailable() {
        return new CacheAvailability(Integer.MAX_VALUE);
    }

    public boolean isAvailable() {
        return available.get();
    }

    public void reportSuccess() {
        consecutiveFailures.set(0);
    }

    /**
     * Count a failed operation; enough in a row switch to bypass mode.
     *
     * @param error the failure
     */
    public void reportFailure(Throwable error) {
        if (consecutiveFailures.incrementAndGet() >= failureThreshold) {
            markUnavailable(error.getMessage());
        }
    }

    public void markUnavailable(String reason) {
        if (available.compareAndSet(true, false)) {
            LOG.warnv("Cache store unavailable, bypassing cache: {0}", reason);
        }
    }

    /**
     * Leave bypass mode.
     *
     * @return true if the cache was unavailable before this call
     */
    public boolean markAvailable() {
        consecutiveFailures.set(0);
        final boolean recovered = available.compareAndSet(false, true);
        if (recovered) {
            LOG.info("Cache store available again");
        }
        return recovered;
    }

    public void markInvalidationLost() {
        if (invalidationLost.compareAndSet(false, true)) {
            LOG.warn("Cache invalidation could not be applied; entries will be flushed on recovery");
        }
    }

    /**
     * Read and clear the invalidation-lost flag.
     *
     * @return true if an invalidation failed since the last call
     */
    public boolean consumeInvalidationLost() {
        return invalidationLost.getAndSet(false);
    }

    public boolean isInvalidationLost() {
        return invalidationLost.get();
    }
}
