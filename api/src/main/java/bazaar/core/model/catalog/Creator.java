package bazaar.core.model.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Publisher of a catalog item.
 *
 * @param id       creator user id (may be null for system-seeded records)
 * @param name     display name, searched by the free-text filter
 * @param imageUrl avatar URL (optional)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Creator(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("imageUrl") String imageUrl) {

    public static Creator system() {
        return new Creator(null, "System", null);
    }
}
