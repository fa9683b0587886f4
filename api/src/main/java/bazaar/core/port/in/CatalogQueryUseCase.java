package bazaar.core.port.in;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Uni;

import bazaar.core.model.catalog.AgentRecord;
import bazaar.core.model.catalog.PagedResult;
import bazaar.core.model.catalog.QueryParameters;

/**
 * Primary port for cached catalog reads.
 */
public interface CatalogQueryUseCase {

    /**
     * Filtered, sorted and paginated listing.
     *
     * @param params normalized query
     * @return the requested page
     */
    Uni<PagedResult<AgentRecord>> listAgents(QueryParameters params);

    /**
     * Single record.
     *
     * @param agentId   record id
     * @param skipCache read the store and refresh the cached copy
     * @return the record; fails with {@code AgentNotFoundException} when absent
     */
    Uni<AgentRecord> getAgentDetail(String agentId, boolean skipCache);

    /**
     * Number of records in a category, or in the whole catalog for {@code All}.
     */
    Uni<Integer> countAgents(String category);

    Uni<List<AgentRecord>> listFeatured(int limit);

    /**
     * Whether a user likes each of several records.
     *
     * @param agentIds record ids
     * @param userId   the user
     * @return like status by record id; unknown records map to false
     */
    Uni<Map<String, Boolean>> isLikedBy(Collection<String> agentIds, String userId);
}
