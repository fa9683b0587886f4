package bazaar.core.port.in;

import io.smallrye.mutiny.Uni;

/**
 * Primary port for explicit cache invalidation.
 *
 * <p>Each operation completes with the number of keys removed. Failures are
 * absorbed; a return of 0 does not distinguish "nothing cached" from "cache down".
 */
public interface CacheInvalidationUseCase {

    Uni<Long> invalidateAgent(String agentId);

    Uni<Long> invalidateCategory(String category);

    Uni<Long> invalidateAll();
}
