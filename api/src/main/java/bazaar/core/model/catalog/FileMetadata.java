package bazaar.core.model.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata of a file already uploaded to blob storage.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileMetadata(
        @JsonProperty("url") String url,
        @JsonProperty("fileName") String fileName,
        @JsonProperty("originalName") String originalName,
        @JsonProperty("contentType") String contentType,
        @JsonProperty("size") long size) {

    /**
     * Metadata for a file known only by its URL.
     *
     * @param url        the file URL
     * @param contentType content type, empty when unknown
     * @return metadata with blank name fields and zero size
     */
    public static FileMetadata ofUrl(String url, String contentType) {
        return new FileMetadata(url, "", "", contentType, 0);
    }
}
