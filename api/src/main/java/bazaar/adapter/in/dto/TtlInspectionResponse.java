package bazaar.adapter.in.dto;

/**
 * TTL that would be applied to a cache key.
 *
 * @param key        the inspected key
 * @param namespace  matched namespace prefix, null when none matches
 * @param bucket     TTL bucket name
 * @param ttlSeconds TTL in seconds
 */
public record TtlInspectionResponse(String key, String namespace, String bucket, long ttlSeconds) {}
