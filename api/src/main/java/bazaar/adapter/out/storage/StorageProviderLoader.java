package bazaar.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.runtime.ShutdownEvent;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import bazaar.core.port.out.CacheStore;
import bazaar.core.port.out.CatalogStore;
import bazaar.core.port.out.StorageHealthIndicator;
import bazaar.spi.CacheStoreProvider;
import bazaar.spi.CatalogStoreProvider;
import bazaar.spi.StorageAdapterConfig;
import bazaar.spi.StorageProviderException;

/**
 * Discovers catalog and cache providers via ServiceLoader.
 *
 * <p>Provider selection, done independently for each kind:
 * <ol>
 *   <li>If {@code bazaar.storage.catalog.provider} / {@code bazaar.storage.cache.provider}
 *       is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class StorageProviderLoader {

    private static final Logger LOG = Logger.getLogger(StorageProviderLoader.class);

    private final Optional<String> configuredCatalogProvider;
    private final Optional<String> configuredCacheProvider;
    private final StorageAdapterConfig config;

    private CatalogStoreProvider catalogProvider;
    private CacheStoreProvider cacheProvider;
    private CacheStore cacheStore;

    @Inject
    public StorageProviderLoader(
            @ConfigProperty(name = "bazaar.storage.catalog.provider") Optional<String> configuredCatalogProvider,
            @ConfigProperty(name = "bazaar.storage.cache.provider") Optional<String> configuredCacheProvider,
            StorageAdapterConfig config) {
        this.configuredCatalogProvider = configuredCatalogProvider;
        this.configuredCacheProvider = configuredCacheProvider;
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public CatalogStore catalogStore() {
        final CatalogStoreProvider provider = getCatalogProvider();
        LOG.infof("Creating catalog store from provider: %s (%s)", provider.name(), provider.description());
        return provider.createStore(config);
    }

    @Produces
    @ApplicationScoped
    public CacheStore cacheStore() {
        final CacheStoreProvider provider = getCacheProvider();
        LOG.infof("Creating cache store from provider: %s (%s)", provider.name(), provider.description());
        cacheStore = provider.createStore(config);
        return cacheStore;
    }

    @Produces
    @ApplicationScoped
    public List<StorageHealthIndicator> healthIndicators() {
        final List<StorageHealthIndicator> indicators = new ArrayList<>();
        getCatalogProvider().createHealthIndicator(config).ifPresent(indicators::add);
        getCacheProvider().createHealthIndicator(config).ifPresent(indicators::add);
        return indicators;
    }

    void onShutdown(@Observes ShutdownEvent event) {
        if (cacheStore != null) {
            LOG.info("Closing cache store");
            cacheStore.close();
        }
    }

    CatalogStoreProvider getCatalogProvider() {
        if (catalogProvider == null) {
            catalogProvider = select(
                    load(CatalogStoreProvider.class),
                    configuredCatalogProvider.orElse(null),
                    "catalog",
                    CatalogStoreProvider::name,
                    CatalogStoreProvider::isAvailable,
                    CatalogStoreProvider::priority);
        }
        return catalogProvider;
    }

    CacheStoreProvider getCacheProvider() {
        if (cacheProvider == null) {
            cacheProvider = select(
                    load(CacheStoreProvider.class),
                    configuredCacheProvider.orElse(null),
                    "cache",
                    CacheStoreProvider::name,
                    CacheStoreProvider::isAvailable,
                    CacheStoreProvider::priority);
        }
        return cacheProvider;
    }

    private static <T> List<T> load(Class<T> type) {
        final List<T> providers = new ArrayList<>();
        ServiceLoader.load(type).forEach(providers::add);
        return providers;
    }

    static <T> T select(
            List<T> providers,
            String configured,
            String type,
            Function<T, String> name,
            Predicate<T> available,
            ToIntFunction<T> priority) {
        if (providers.isEmpty()) {
            throw new StorageProviderException(
                    "No " + type + " providers found. Ensure a provider JAR is on the classpath.");
        }
        LOG.infof(
                "Found %d %s provider(s): %s",
                providers.size(),
                type,
                providers.stream().map(name).toList());

        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> name.apply(p).equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new StorageProviderException("Configured " + type + " provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(name).toList()));
        }

        return providers.stream()
                .filter(available)
                .max(Comparator.comparingInt(priority))
                .orElseThrow(() -> new StorageProviderException("No available " + type + " providers"));
    }
}
