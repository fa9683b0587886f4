package bazaar.core.port.in;

import io.smallrye.mutiny.Uni;

import bazaar.core.model.catalog.AgentPatch;
import bazaar.core.model.catalog.AgentRecord;
import bazaar.core.model.catalog.Creator;

/**
 * Primary port for catalog writes.
 *
 * <p>Every operation writes the store and then invalidates the affected cache
 * entries before completing.
 */
public interface AgentMutationUseCase {

    /**
     * @param patch initial values
     * @param actor creator to record when the patch names none, may be null
     * @return the stored record with a generated id
     */
    Uni<AgentRecord> create(AgentPatch patch, Creator actor);

    Uni<AgentRecord> update(String agentId, AgentPatch patch);

    Uni<Void> delete(String agentId);

    /**
     * Add or remove a user's like.
     *
     * @return true if the user now likes the record
     */
    Uni<Boolean> toggleLike(String agentId, String userId);

    /**
     * Add a review. A user may review a record once.
     *
     * @return the updated record
     */
    Uni<AgentRecord> addReview(String agentId, String userId, String userName, int rating, String content);

    /**
     * Remove a review. Only its author or an admin may remove it.
     *
     * @return the updated record
     */
    Uni<AgentRecord> removeReview(String agentId, String reviewId, String userId, boolean admin);
}
