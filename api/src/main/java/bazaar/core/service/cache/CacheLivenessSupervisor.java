package bazaar.core.service.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bazaar.core.cache.BackoffPolicy;
import bazaar.core.cache.CacheAvailability;
import bazaar.core.cache.CacheKeyBuilder;
import bazaar.core.cache.CacheTimeoutHelper;
import bazaar.core.config.CacheConfig;
import bazaar.core.config.ResiliencyConfig;
import bazaar.core.port.out.CacheMetrics;
import bazaar.core.port.out.CacheStore;

/**
 * Background probe of the cache store.
 *
 * <p>A successful ping makes the cache available again. If invalidations were
 * lost while the store was unreachable, every catalog key is flushed before
 * that. A failed ping puts the cache in bypass mode and delays the next probe by
 * an exponentially growing, jittered backoff.
 */
@ApplicationScoped
public class CacheLivenessSupervisor {

    private static final Logger LOG = Logger.getLogger(CacheLivenessSupervisor.class);

    private final CacheStore store;
    private final CacheAvailability availability;
    private final CacheKeyBuilder keys;
    private final BackoffPolicy backoff;
    private final CacheTimeoutHelper timeouts;
    private final Clock clock;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile Instant nextProbeAt = Instant.EPOCH;

    @Inject
    public CacheLivenessSupervisor(
            CacheStore store,
            CacheAvailability availability,
            CacheKeyBuilder keys,
            CacheConfig cacheConfig,
            ResiliencyConfig resiliencyConfig,
            CacheMetrics metrics) {
        this(
                store,
                availability,
                keys,
                new BackoffPolicy(
                        cacheConfig.liveness().baseBackoff(),
                        cacheConfig.liveness().maxBackoff(),
                        cacheConfig.liveness().jitter()),
                new CacheTimeoutHelper(
                        resiliencyConfig.cache().operationTimeout(),
                        metrics,
                        store.getClass().getSimpleName()),
                Clock.systemUTC());
    }

    public CacheLivenessSupervisor(
            CacheStore store,
            CacheAvailability availability,
            CacheKeyBuilder keys,
            BackoffPolicy backoff,
            CacheTimeoutHelper timeouts,
            Clock clock) {
        this.store = store;
        this.availability = availability;
        this.keys = keys;
        this.backoff = backoff;
        this.timeouts = timeouts;
        this.clock = clock;
    }

    @Scheduled(
            every = "${bazaar.cache.liveness.interval:5s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> probe() {
        if (clock.instant().isBefore(nextProbeAt)) {
            return Uni.createFrom().voidItem();
        }
        return timeouts.withTimeout(store.ping(), "ping")
                .flatMap(ignored -> onProbeSuccess())
                .onFailure()
                .recoverWithItem(error -> {
                    onProbeFailure(error);
                    return null;
                });
    }

    public int consecutiveFailures() {
        return consecutiveFailures.get();
    }

    public Instant nextProbeAt() {
        return nextProbeAt;
    }

    private Uni<Void> onProbeSuccess() {
        consecutiveFailures.set(0);
        nextProbeAt = Instant.EPOCH;
        if (!availability.consumeInvalidationLost()) {
            availability.markAvailable();
            return Uni.createFrom().voidItem();
        }
        LOG.warn("Invalidations were lost while the cache was unreachable, flushing catalog keys");
        return flush()
                .invoke(removed -> {
                    LOG.infof("Flushed %d catalog keys after recovery", removed);
                    availability.markAvailable();
                })
                .onFailure()
                .invoke(error -> availability.markInvalidationLost())
                .replaceWithVoid();
    }

    private void onProbeFailure(Throwable error) {
        final int failures = consecutiveFailures.incrementAndGet();
        final Duration delay = backoff.delayFor(failures);
        nextProbeAt = clock.instant().plus(delay);
        availability.markUnavailable(error.getMessage());
        LOG.warnv("Cache probe failed ({0} in a row), next probe in {1} ms: {2}",
                failures, delay.toMillis(), error.getMessage());
    }

    private Uni<Long> flush() {
        final List<String> patterns = keys.flushPatterns();
        Uni<Long> total = Uni.createFrom().item(0L);
        for (String pattern : patterns) {
            total = total.flatMap(sum -> store.keys(pattern)
                    .flatMap(found -> found.isEmpty() ? Uni.createFrom().item(0L) : store.deleteAll(found))
                    .map(removed -> sum + removed));
        }
        return timeouts.withTimeout(total, "flush");
    }
}
