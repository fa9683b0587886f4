package bazaar.core.service.catalog;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import bazaar.core.config.QueryConfig;
import bazaar.core.model.catalog.AgentRecord;
import bazaar.core.model.catalog.PagedResult;
import bazaar.core.model.catalog.QueryParameters;

/**
 * In-memory filter, sort and paginate pipeline over records fetched from the store.
 *
 * <p>The engine is pure apart from the clock used to decide what is recent.
 */
@ApplicationScoped
public class AgentQueryEngine {

    private final Duration hotWindow;
    private final Clock clock;

    @Inject
    public AgentQueryEngine(QueryConfig config) {
        this(config.hotWindow(), Clock.systemUTC());
    }

    public AgentQueryEngine(Duration hotWindow, Clock clock) {
        this.hotWindow = hotWindow;
        this.clock = clock;
    }

    /**
     * Run the full pipeline.
     *
     * @param candidates records after category pushdown, in store order
     * @param params     normalized query
     * @return the requested page
     */
    public PagedResult<AgentRecord> execute(List<AgentRecord> candidates, QueryParameters params) {
        return PagedResult.slice(filterAndSort(candidates, params), params.page(), params.limit());
    }

    /**
     * Apply every active filter stage, then the requested ordering.
     *
     * @return a new list; the input is not modified
     */
    public List<AgentRecord> filterAndSort(List<AgentRecord> candidates, QueryParameters params) {
        final Predicate<AgentRecord> filter =
                AgentFilters.stagesFor(params).stream().reduce(r -> true, Predicate::and);
        final List<AgentRecord> result = new ArrayList<>();
        for (AgentRecord record : candidates) {
            if (filter.test(record)) {
                result.add(record);
            }
        }
        AgentSorts.forStrategy(params.sort(), clock.instant(), hotWindow).ifPresent(result::sort);
        return result;
    }

    /**
     * Featured records, newest first.
     *
     * @param candidates all records
     * @param limit      maximum number returned
     * @return at most {@code limit} featured records
     */
    public List<AgentRecord> featured(List<AgentRecord> candidates, int limit) {
        return candidates.stream()
                .filter(AgentRecord::featured)
                .sorted(AgentSorts.newest())
                .limit(Math.max(0, limit))
                .toList();
    }
}
