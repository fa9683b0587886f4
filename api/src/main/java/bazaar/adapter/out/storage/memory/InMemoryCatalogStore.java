package bazaar.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import io.smallrye.mutiny.Uni;

import bazaar.core.model.catalog.AgentRecord;
import bazaar.core.port.out.CatalogStore;

/**
 * In-memory implementation of CatalogStore.
 *
 * <p>Data is NOT persisted across restarts. Records are returned in insertion
 * order, which keeps results reproducible for sorts that tie.
 */
public class InMemoryCatalogStore implements CatalogStore {

    private static final Map<String, Function<AgentRecord, Object>> QUERYABLE_FIELDS = Map.of(
            "category", AgentRecord::category,
            "status", AgentRecord::status,
            "isFeatured", AgentRecord::featured,
            "isVerified", AgentRecord::verified,
            "creator.id", r -> r.creator() != null ? r.creator().id() : null);

    private final Map<String, AgentRecord> storage = new LinkedHashMap<>();

    public InMemoryCatalogStore() {}

    public InMemoryCatalogStore(List<AgentRecord> seed) {
        seed.forEach(r -> storage.put(r.id(), r));
    }

    @Override
    public Uni<List<AgentRecord>> queryByEquality(String field, String value) {
        final Function<AgentRecord, Object> accessor = QUERYABLE_FIELDS.get(field);
        if (accessor == null) {
            return Uni.createFrom().failure(new UnsupportedOperationException("Cannot query on field: " + field));
        }
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return storage.values().stream()
                        .filter(r -> Objects.equals(stringValue(accessor.apply(r)), value))
                        .toList();
            }
        });
    }

    @Override
    public Uni<List<AgentRecord>> findAll() {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return new ArrayList<>(storage.values());
            }
        });
    }

    @Override
    public Uni<Optional<AgentRecord>> getById(String id) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return Optional.ofNullable(storage.get(id));
            }
        });
    }

    @Override
    public Uni<AgentRecord> save(AgentRecord record) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                storage.put(record.id(), record);
            }
            return record;
        });
    }

    @Override
    public Uni<Boolean> delete(String id) {
        return Uni.createFrom().item(() -> {
            synchronized (storage) {
                return storage.remove(id) != null;
            }
        });
    }

    private static String stringValue(Object value) {
        return value == null ? null : value.toString();
    }
}
