package bazaar.adapter.in.dto;

/**
 * Request body for adding a review.
 *
 * @param rating   stars, 1 to 5
 * @param content  review text, at least 3 characters after trimming
 * @param userName display name; the caller's header value is used when absent
 */
public record ReviewRequest(Integer rating, String content, String userName) {}
