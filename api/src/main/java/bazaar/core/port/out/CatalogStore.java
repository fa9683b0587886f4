package bazaar.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import bazaar.core.model.catalog.AgentRecord;

/**
 * Port for the document store holding catalog records.
 *
 * <p>The store supports a single server-side equality predicate; every other
 * filter runs in memory.
 */
public interface CatalogStore {

    /**
     * Fetch records whose field equals a value.
     *
     * @param field top-level field name, e.g. {@code category}
     * @param value exact value
     * @return matching records in store order
     * @throws UnsupportedOperationException (via the Uni) for a field the store cannot filter on
     */
    Uni<List<AgentRecord>> queryByEquality(String field, String value);

    Uni<List<AgentRecord>> findAll();

    Uni<Optional<AgentRecord>> getById(String id);

    /**
     * Insert or replace a record.
     *
     * @param record the record
     * @return the stored record
     */
    Uni<AgentRecord> save(AgentRecord record);

    /**
     * @return true if a record was removed
     */
    Uni<Boolean> delete(String id);
}
