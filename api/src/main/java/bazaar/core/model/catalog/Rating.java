package bazaar.core.model.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregated review rating.
 *
 * @param average mean of the embedded review ratings, 0 when there are none
 * @param count   number of reviews contributing to the average
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Rating(@JsonProperty("average") double average, @JsonProperty("count") int count) {

    private static final Rating NONE = new Rating(0.0, 0);

    public Rating {
        if (count < 0) {
            count = 0;
        }
    }

    public static Rating none() {
        return NONE;
    }
}
