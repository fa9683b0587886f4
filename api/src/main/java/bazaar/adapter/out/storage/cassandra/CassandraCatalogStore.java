package bazaar.adapter.out.storage.cassandra;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.AsyncResultSet;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.Row;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import io.vertx.core.Context;
import io.vertx.core.Vertx;
import org.jboss.logging.Logger;

import bazaar.core.model.catalog.AgentRecord;
import bazaar.core.port.out.CatalogStore;

/**
 * Cassandra implementation of CatalogStore.
 *
 * <p>Each record is stored as a JSON document in a text column, keyed by id. The
 * category is denormalized into its own indexed column, which makes it the only
 * field that can be filtered server-side.
 */
public class CassandraCatalogStore implements CatalogStore {

    private static final Logger LOG = Logger.getLogger(CassandraCatalogStore.class);

    static final String CATEGORY_FIELD = "category";

    private final ObjectMapper objectMapper;
    private final CqlSession session;
    private final PreparedStatement upsertStmt;
    private final PreparedStatement selectByIdStmt;
    private final PreparedStatement selectByCategoryStmt;
    private final PreparedStatement selectAllStmt;
    private final PreparedStatement deleteStmt;

    public CassandraCatalogStore(ObjectMapper objectMapper, CqlSession session) {
        this.objectMapper = objectMapper;
        this.session = session;
        this.upsertStmt = session.prepare("INSERT INTO agents (id, category, record_json) VALUES (?, ?, ?)");
        this.selectByIdStmt = session.prepare("SELECT record_json FROM agents WHERE id = ?");
        this.selectByCategoryStmt = session.prepare("SELECT record_json FROM agents WHERE category = ?");
        this.selectAllStmt = session.prepare("SELECT record_json FROM agents");
        this.deleteStmt = session.prepare("DELETE FROM agents WHERE id = ? IF EXISTS");
    }

    @Override
    public Uni<List<AgentRecord>> queryByEquality(String field, String value) {
        if (!CATEGORY_FIELD.equals(field)) {
            return Uni.createFrom().failure(new UnsupportedOperationException("Cannot query on field: " + field));
        }
        return collectAll(() -> session.executeAsync(selectByCategoryStmt.bind(value)));
    }

    @Override
    public Uni<List<AgentRecord>> findAll() {
        return collectAll(() -> session.executeAsync(selectAllStmt.bind()));
    }

    @Override
    public Uni<Optional<AgentRecord>> getById(String id) {
        return Uni.createFrom()
                .completionStage(() -> session.executeAsync(selectByIdStmt.bind(id)))
                .emitOn(getContextExecutor())
                .map(rs -> {
                    final Row row = rs.one();
                    return row == null ? Optional.empty() : Optional.of(fromRow(row));
                });
    }

    @Override
    public Uni<AgentRecord> save(AgentRecord record) {
        return Uni.createFrom()
                .completionStage(() -> session.executeAsync(
                        upsertStmt.bind(record.id(), record.category(), toJson(record))))
                .emitOn(getContextExecutor())
                .replaceWith(record);
    }

    @Override
    public Uni<Boolean> delete(String id) {
        return Uni.createFrom()
                .completionStage(() -> session.executeAsync(deleteStmt.bind(id)))
                .emitOn(getContextExecutor())
                .map(AsyncResultSet::wasApplied);
    }

    private Uni<List<AgentRecord>> collectAll(Supplier<CompletionStage<AsyncResultSet>> query) {
        return Uni.createFrom()
                .completionStage(() -> query.get().thenCompose(first -> drain(first, new ArrayList<>())))
                .emitOn(getContextExecutor());
    }

    private CompletionStage<List<AgentRecord>> drain(AsyncResultSet page, List<AgentRecord> into) {
        for (Row row : page.currentPage()) {
            into.add(fromRow(row));
        }
        if (page.hasMorePages()) {
            return page.fetchNextPage().thenCompose(next -> drain(next, into));
        }
        return CompletableFuture.completedFuture(into);
    }

    private AgentRecord fromRow(Row row) {
        final String json = row.getString("record_json");
        try {
            return objectMapper.readValue(json, AgentRecord.class);
        } catch (JsonProcessingException e) {
            LOG.warnv("Undecodable catalog row: {0}", e.getOriginalMessage());
            throw new IllegalStateException("Failed to deserialize catalog record", e);
        }
    }

    private String toJson(AgentRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize catalog record " + record.id(), e);
        }
    }

    /**
     * Executor on the current Vert.x context, or the default worker pool outside
     * one. The driver completes futures on its own I/O threads.
     */
    private Executor getContextExecutor() {
        final Context context = Vertx.currentContext();
        if (context != null) {
            return command -> context.runOnContext(v -> command.run());
        }
        return Infrastructure.getDefaultWorkerPool();
    }
}
