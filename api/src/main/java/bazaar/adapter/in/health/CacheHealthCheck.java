package bazaar.adapter.in.health;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.health.api.AsyncHealthCheck;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import bazaar.core.cache.CacheAvailability;
import bazaar.core.model.common.StorageHealth;
import bazaar.core.port.out.StorageHealthIndicator;

/**
 * Readiness check for the catalog and cache backends.
 *
 * <p>The catalog store must be reachable for the service to be ready. The cache
 * only adds data: an unavailable cache runs in bypass mode, which costs latency
 * but not correctness, so it never marks the service DOWN.
 */
@Readiness
@ApplicationScoped
public class CacheHealthCheck implements AsyncHealthCheck {

    static final String CATALOG_PREFIX = "catalog-";

    private final List<StorageHealthIndicator> indicators;
    private final CacheAvailability availability;

    @Inject
    public CacheHealthCheck(List<StorageHealthIndicator> indicators, CacheAvailability availability) {
        this.indicators = indicators;
        this.availability = availability;
    }

    @Override
    public Uni<HealthCheckResponse> call() {
        return Multi.createFrom()
                .iterable(indicators)
                .onItem()
                .transformToUniAndConcatenate(StorageHealthIndicator::check)
                .collect()
                .asList()
                .map(this::toResponse);
    }

    HealthCheckResponse toResponse(List<StorageHealth> results) {
        final HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name("storage");
        boolean up = true;
        for (StorageHealth health : results) {
            builder.withData(health.name() + ".healthy", health.healthy());
            if (health.healthy()) {
                builder.withData(health.name() + ".latencyMs", health.latencyMs());
            } else if (health.message() != null) {
                builder.withData(health.name() + ".message", health.message());
            }
            if (!health.healthy() && health.name().startsWith(CATALOG_PREFIX)) {
                up = false;
            }
        }
        builder.withData("cache.available", availability.isAvailable());
        builder.withData("cache.invalidationLost", availability.isInvalidationLost());
        return builder.status(up).build();
    }
}
