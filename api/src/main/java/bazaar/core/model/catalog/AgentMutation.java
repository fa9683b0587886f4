package bazaar.core.model.catalog;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Describes a completed write to an {@link AgentRecord}, used to decide which
 * cached views are stale.
 *
 * @param agentId          the record that changed
 * @param type             kind of change
 * @param category         category after the change, null if unknown
 * @param previousCategory category before the change when it moved, otherwise null
 */
public record AgentMutation(String agentId, Type type, String category, String previousCategory) {

    public enum Type {
        CREATED,
        UPDATED,
        DELETED,
        LIKE_TOGGLED,
        REVIEW_ADDED,
        REVIEW_REMOVED
    }

    public AgentMutation {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(type, "type");
        if (previousCategory != null && previousCategory.equals(category)) {
            previousCategory = null;
        }
    }

    public static AgentMutation of(Type type, AgentRecord record) {
        return new AgentMutation(record.id(), type, record.category(), null);
    }

    public static AgentMutation updated(AgentRecord before, AgentRecord after) {
        return new AgentMutation(after.id(), Type.UPDATED, after.category(), before.category());
    }

    /**
     * Every category whose listings may include this record, old and new.
     *
     * @return non-blank categories, in change order
     */
    public Set<String> affectedCategories() {
        final var categories = new LinkedHashSet<String>();
        if (category != null && !category.isBlank()) {
            categories.add(category);
        }
        if (previousCategory != null && !previousCategory.isBlank()) {
            categories.add(previousCategory);
        }
        return categories;
    }
}
