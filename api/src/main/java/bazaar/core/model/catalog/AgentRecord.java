package bazaar.core.model.catalog;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * A catalog item offered on the marketplace.
 *
 * <p>Records are read from a document store that has held several generations of
 * the schema, so most components are optional:
 * <ul>
 *   <li>{@code priceDetails} may be absent on records that only carry the legacy
 *       free-form {@code price} ("Free", "$0", "19.99", ...)</li>
 *   <li>{@code createdAt}/{@code updatedAt} are null when the stored value could
 *       not be resolved to an instant</li>
 * </ul>
 *
 * <p>Collections are never null. {@code reviews} are kept newest first and
 * {@code rating} reflects them; see {@code ReviewAggregator}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentRecord(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("category") String category,
        @JsonProperty("creator") Creator creator,
        @JsonProperty("priceDetails") PriceDetails priceDetails,
        @JsonProperty("price") String price,
        @JsonProperty("rating") Rating rating,
        @JsonProperty("tags") Set<String> tags,
        @JsonProperty("features") Set<String> features,
        @JsonProperty("popularity") int popularity,
        @JsonProperty("downloadCount") int downloadCount,
        @JsonProperty("createdAt") @JsonDeserialize(using = LenientInstantDeserializer.class) Instant createdAt,
        @JsonProperty("updatedAt") @JsonDeserialize(using = LenientInstantDeserializer.class) Instant updatedAt,
        @JsonProperty("likes") Set<String> likes,
        @JsonProperty("reviews") List<Review> reviews,
        @JsonProperty("image") FileMetadata image,
        @JsonProperty("icon") FileMetadata icon,
        @JsonProperty("jsonFile") FileMetadata jsonFile,
        @JsonProperty("isFeatured") boolean featured,
        @JsonProperty("isVerified") boolean verified,
        @JsonProperty("status") String status,
        @JsonProperty("version") String version) {

    public AgentRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Agent ID cannot be null or blank");
        }
        if (rating == null) {
            rating = Rating.none();
        }
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        features = features == null ? Set.of() : Set.copyOf(features);
        likes = likes == null ? Set.of() : Set.copyOf(likes);
        reviews = reviews == null ? List.of() : List.copyOf(reviews);
    }

    /**
     * Name shown to users: the title when set, otherwise the name.
     *
     * @return display name, never null
     */
    public String displayName() {
        if (title != null && !title.isBlank()) {
            return title;
        }
        return name != null ? name : "";
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Start a builder pre-populated with this record's values.
     *
     * @return builder for a modified copy
     */
    public Builder toBuilder() {
        return new Builder(id)
                .name(name)
                .title(title)
                .description(description)
                .category(category)
                .creator(creator)
                .priceDetails(priceDetails)
                .price(price)
                .rating(rating)
                .tags(tags)
                .features(features)
                .popularity(popularity)
                .downloadCount(downloadCount)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .likes(likes)
                .reviews(reviews)
                .image(image)
                .icon(icon)
                .jsonFile(jsonFile)
                .featured(featured)
                .verified(verified)
                .status(status)
                .version(version);
    }

    public static class Builder {
        private final String id;
        private String name;
        private String title;
        private String description;
        private String category;
        private Creator creator;
        private PriceDetails priceDetails;
        private String price;
        private Rating rating = Rating.none();
        private Set<String> tags = Set.of();
        private Set<String> features = Set.of();
        private int popularity;
        private int downloadCount;
        private Instant createdAt;
        private Instant updatedAt;
        private Set<String> likes = Set.of();
        private List<Review> reviews = List.of();
        private FileMetadata image;
        private FileMetadata icon;
        private FileMetadata jsonFile;
        private boolean featured;
        private boolean verified;
        private String status;
        private String version;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder creator(Creator creator) {
            this.creator = creator;
            return this;
        }

        public Builder priceDetails(PriceDetails priceDetails) {
            this.priceDetails = priceDetails;
            return this;
        }

        public Builder price(String price) {
            this.price = price;
            return this;
        }

        public Builder rating(Rating rating) {
            this.rating = rating;
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder tags(String... tags) {
            this.tags = new LinkedHashSet<>(List.of(tags));
            return this;
        }

        public Builder features(Set<String> features) {
            this.features = features;
            return this;
        }

        public Builder features(String... features) {
            this.features = new LinkedHashSet<>(List.of(features));
            return this;
        }

        public Builder popularity(int popularity) {
            this.popularity = popularity;
            return this;
        }

        public Builder downloadCount(int downloadCount) {
            this.downloadCount = downloadCount;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder likes(Set<String> likes) {
            this.likes = likes;
            return this;
        }

        public Builder reviews(List<Review> reviews) {
            this.reviews = reviews;
            return this;
        }

        public Builder image(FileMetadata image) {
            this.image = image;
            return this;
        }

        public Builder icon(FileMetadata icon) {
            this.icon = icon;
            return this;
        }

        public Builder jsonFile(FileMetadata jsonFile) {
            this.jsonFile = jsonFile;
            return this;
        }

        public Builder featured(boolean featured) {
            this.featured = featured;
            return this;
        }

        public Builder verified(boolean verified) {
            this.verified = verified;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public AgentRecord build() {
            return new AgentRecord(
                    id,
                    name,
                    title,
                    description,
                    category,
                    creator,
                    priceDetails,
                    price,
                    rating,
                    tags,
                    features,
                    popularity,
                    downloadCount,
                    createdAt,
                    updatedAt,
                    likes,
                    reviews,
                    image,
                    icon,
                    jsonFile,
                    featured,
                    verified,
                    status,
                    version);
        }
    }
}
