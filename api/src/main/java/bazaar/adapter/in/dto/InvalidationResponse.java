package bazaar.adapter.in.dto;

/**
 * Result of an administrative cache invalidation.
 *
 * @param scope       agent, category or all
 * @param target      agent id or category, null for {@code all}
 * @param keysRemoved number of cache keys deleted
 */
public record InvalidationResponse(String scope, String target, long keysRemoved) {}
