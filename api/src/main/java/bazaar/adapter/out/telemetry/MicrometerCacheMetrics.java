package bazaar.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import bazaar.core.port.out.CacheMetrics;

/**
 * Micrometer-backed cache metrics.
 *
 * <p>All methods are no-ops when {@code bazaar.metrics.enabled=false}.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code bazaar.cache.hits} - Cache hits by namespace</li>
 *   <li>{@code bazaar.cache.misses} - Cache misses by namespace</li>
 *   <li>{@code bazaar.cache.failures} - Failed cache operations by operation</li>
 *   <li>{@code bazaar.cache.timeouts} - Timed-out cache operations by operation</li>
 *   <li>{@code bazaar.cache.invalidations} - Keys removed by invalidation scope</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerCacheMetrics implements CacheMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerCacheMetrics(
            MeterRegistry registry, @ConfigProperty(name = "bazaar.metrics.enabled", defaultValue = "true") boolean enabled) {
        this.registry = registry;
        this.enabled = enabled;
    }

    @Override
    public void recordHit(String namespace) {
        increment("bazaar.cache.hits", "Cache hits", "namespace", namespace, 1);
    }

    @Override
    public void recordMiss(String namespace) {
        increment("bazaar.cache.misses", "Cache misses", "namespace", namespace, 1);
    }

    @Override
    public void recordFailure(String operation) {
        increment("bazaar.cache.failures", "Failed cache operations", "operation", operation, 1);
    }

    @Override
    public void recordTimeout(String operation) {
        increment("bazaar.cache.timeouts", "Timed-out cache operations", "operation", operation, 1);
    }

    @Override
    public void recordInvalidation(String scope, long keys) {
        increment("bazaar.cache.invalidations", "Cache keys removed by invalidation", "scope", scope, keys);
    }

    private void increment(String name, String description, String tagKey, String tagValue, double amount) {
        if (!enabled) {
            return;
        }
        Counter.builder(name)
                .description(description)
                .tag(tagKey, tagValue != null ? tagValue : "unknown")
                .register(registry)
                .increment(amount);
    }
}
