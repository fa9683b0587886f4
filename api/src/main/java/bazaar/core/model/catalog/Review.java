package bazaar.core.model.catalog;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * A user review embedded in an {@link AgentRecord}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Review(
        @JsonProperty("id") String id,
        @JsonProperty("userId") String userId,
        @JsonProperty("userName") String userName,
        @JsonProperty("rating") int rating,
        @JsonProperty("content") String content,
        @JsonProperty("createdAt") @JsonDeserialize(using = LenientInstantDeserializer.class) Instant createdAt) {

    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;

    /**
     * Check whether a rating value is acceptable for a new review.
     *
     * @param rating the candidate rating
     * @return true if within {@value #MIN_RATING}..{@value #MAX_RATING}
     */
    public static boolean isValidRating(int rating) {
        return rating >= MIN_RATING && rating <= MAX_RATING;
    }
}
