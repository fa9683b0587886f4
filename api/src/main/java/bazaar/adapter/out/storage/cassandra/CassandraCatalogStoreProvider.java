package bazaar.adapter.out.storage.cassandra;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.CqlSessionBuilder;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import io.vertx.core.Context;
import io.vertx.core.Vertx;
import org.jboss.logging.Logger;

import bazaar.core.model.common.StorageHealth;
import bazaar.core.port.out.CatalogStore;
import bazaar.core.port.out.StorageHealthIndicator;
import bazaar.core.util.JsonMappers;
import bazaar.spi.CatalogStoreProvider;
import bazaar.spi.StorageAdapterConfig;
import bazaar.spi.StorageProviderException;

/**
 * Cassandra catalog provider.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>bazaar.storage.cassandra.contact-points - Comma-separated host:port pairs (default: localhost:9042)</li>
 *   <li>bazaar.storage.cassandra.datacenter - Local datacenter name (default: datacenter1)</li>
 *   <li>bazaar.storage.cassandra.keyspace - Keyspace name (default: bazaar)</li>
 *   <li>bazaar.storage.cassandra.username - Username for authentication (optional)</li>
 *   <li>bazaar.storage.cassandra.password - Password for authentication (optional)</li>
 *   <li>bazaar.storage.cassandra.create-schema - Create the agents table on startup (default: false)</li>
 * </ul>
 */
public class CassandraCatalogStoreProvider implements CatalogStoreProvider {

    private static final Logger LOG = Logger.getLogger(CassandraCatalogStoreProvider.class);

    static final List<String> SCHEMA = List.of(
            "CREATE TABLE IF NOT EXISTS agents (id text PRIMARY KEY, category text, record_json text)",
            "CREATE INDEX IF NOT EXISTS agents_category_idx ON agents (category)");

    private CqlSession session;

    @Override
    public String name() {
        return "cassandra";
    }

    @Override
    public String description() {
        return "Apache Cassandra catalog storage";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        try {
            Class.forName("com.datastax.oss.driver.api.core.CqlSession");
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    @Override
    public CatalogStore createStore(StorageAdapterConfig config) {
        this.session = buildSession(config);
        if (Boolean.parseBoolean(config.getOrDefault("bazaar.storage.cassandra.create-schema", "false"))) {
            createSchema();
        }
        return new CassandraCatalogStore(JsonMappers.create(), session);
    }

    @Override
    public Optional<StorageHealthIndicator> createHealthIndicator(StorageAdapterConfig config) {
        return Optional.of(() -> {
            if (session == null || session.isClosed()) {
                return Uni.createFrom().item(StorageHealth.unhealthy("catalog-cassandra", "Session not initialized or closed"));
            }
            final long start = System.currentTimeMillis();
            return Uni.createFrom()
                    .completionStage(() -> session.executeAsync("SELECT release_version FROM system.local"))
                    .emitOn(getContextExecutor())
                    .map(rs -> StorageHealth.healthy("catalog-cassandra", System.currentTimeMillis() - start))
                    .onFailure()
                    .recoverWithItem(e -> StorageHealth.unhealthy("catalog-cassandra", e.getMessage()));
        });
    }

    private void createSchema() {
        LOG.info("Ensuring Cassandra catalog schema exists");
        for (String statement : SCHEMA) {
            try {
                session.execute(statement);
            } catch (RuntimeException e) {
                throw new StorageProviderException("Failed to create catalog schema", e);
            }
        }
    }

    private CqlSession buildSession(StorageAdapterConfig config) {
        final String contactPoints = config.getOrDefault("bazaar.storage.cassandra.contact-points", "localhost:9042");
        final String datacenter = config.getOrDefault("bazaar.storage.cassandra.datacenter", "datacenter1");
        final String keyspace = config.getOrDefault("bazaar.storage.cassandra.keyspace", "bazaar");

        final CqlSessionBuilder builder =
                CqlSession.builder().withLocalDatacenter(datacenter).withKeyspace(keyspace);

        for (String contactPoint : contactPoints.split(",")) {
            final String[] parts = contactPoint.trim().split(":");
            final int port = parts.length > 1 ? Integer.parseInt(parts[1]) : 9042;
            builder.addContactPoint(new InetSocketAddress(parts[0], port));
        }

        config.get("bazaar.storage.cassandra.username").ifPresent(username -> {
            final String password = config.get("bazaar.storage.cassandra.password")
                    .orElseThrow(() ->
                            new StorageProviderException("Cassandra password required when username is specified"));
            builder.withAuthCredentials(username, password);
        });

        try {
            return builder.build();
        } catch (RuntimeException e) {
            throw new StorageProviderException("Failed to connect to Cassandra", e);
        }
    }

    private Executor getContextExecutor() {
        final Context context = Vertx.currentContext();
        if (context != null) {
            return command -> context.runOnContext(v -> command.run());
        }
        return Infrastructure.getDefaultWorkerPool();
    }
}
