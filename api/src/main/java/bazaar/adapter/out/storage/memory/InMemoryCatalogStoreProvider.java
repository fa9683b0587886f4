package bazaar.adapter.out.storage.memory;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import bazaar.core.model.common.StorageHealth;
import bazaar.core.port.out.CatalogStore;
import bazaar.core.port.out.StorageHealthIndicator;
import bazaar.spi.CatalogStoreProvider;
import bazaar.spi.StorageAdapterConfig;

/**
 * Default in-memory catalog provider.
 *
 * <p>Data is NOT persisted across restarts. Used for development and tests, or
 * when no persistent provider is available.
 */
public class InMemoryCatalogStoreProvider implements CatalogStoreProvider {

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory catalog (non-persistent)";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public CatalogStore createStore(StorageAdapterConfig config) {
        return new InMemoryCatalogStore();
    }

    @Override
    public Optional<StorageHealthIndicator> createHealthIndicator(StorageAdapterConfig config) {
        return Optional.of(() -> Uni.createFrom().item(StorageHealth.healthy("catalog-memory", 0)));
    }
}
