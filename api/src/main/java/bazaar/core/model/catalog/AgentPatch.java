package bazaar.core.model.catalog;

import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Partial update to an {@link AgentRecord}.
 *
 * <p>An empty component means "not provided": the existing value is kept.
 * For the URL shortcuts ({@code imageUrl}, {@code iconUrl}, {@code downloadUrl})
 * a present blank string clears the corresponding file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentPatch(
        @JsonProperty("name") Optional<String> name,
        @JsonProperty("title") Optional<String> title,
        @JsonProperty("description") Optional<String> description,
        @JsonProperty("category") Optional<String> category,
        @JsonProperty("creator") Optional<Creator> creator,
        @JsonProperty("priceDetails") Optional<PriceDetails> priceDetails,
        @JsonProperty("basePrice") Optional<Double> basePrice,
        @JsonProperty("discountedPrice") Optional<Double> discountedPrice,
        @JsonProperty("currency") Optional<String> currency,
        @JsonProperty("isSubscription") Optional<Boolean> subscription,
        @JsonProperty("tags") Optional<Set<String>> tags,
        @JsonProperty("features") Optional<Set<String>> features,
        @JsonProperty("popularity") Optional<Integer> popularity,
        @JsonProperty("downloadCount") Optional<Integer> downloadCount,
        @JsonProperty("image") Optional<FileMetadata> image,
        @JsonProperty("imageUrl") Optional<String> imageUrl,
        @JsonProperty("icon") Optional<FileMetadata> icon,
        @JsonProperty("iconUrl") Optional<String> iconUrl,
        @JsonProperty("jsonFile") Optional<FileMetadata> jsonFile,
        @JsonProperty("downloadUrl") Optional<String> downloadUrl,
        @JsonProperty("isFeatured") Optional<Boolean> featured,
        @JsonProperty("isVerified") Optional<Boolean> verified,
        @JsonProperty("status") Optional<String> status,
        @JsonProperty("version") Optional<String> version) {

    private static final AgentPatch EMPTY = builder().build();

    public AgentPatch {
        name = orEmpty(name);
        title = orEmpty(title);
        description = orEmpty(description);
        category = orEmpty(category);
        creator = orEmpty(creator);
        priceDetails = orEmpty(priceDetails);
        basePrice = orEmpty(basePrice);
        discountedPrice = orEmpty(discountedPrice);
        currency = orEmpty(currency);
        subscription = orEmpty(subscription);
        tags = orEmpty(tags);
        features = orEmpty(features);
        popularity = orEmpty(popularity);
        downloadCount = orEmpty(downloadCount);
        image = orEmpty(image);
        imageUrl = orEmpty(imageUrl);
        icon = orEmpty(icon);
        iconUrl = orEmpty(iconUrl);
        jsonFile = orEmpty(jsonFile);
        downloadUrl = orEmpty(downloadUrl);
        featured = orEmpty(featured);
        verified = orEmpty(verified);
        status = orEmpty(status);
        version = orEmpty(version);
    }

    public static AgentPatch empty() {
        return EMPTY;
    }

    private static <T> Optional<T> orEmpty(Optional<T> value) {
        return value == null ? Optional.empty() : value;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String title;
        private String description;
        private String category;
        private Creator creator;
        private PriceDetails priceDetails;
        private Double basePrice;
        private Double discountedPrice;
        private String currency;
        private Boolean subscription;
        private Set<String> tags;
        private Set<String> features;
        private Integer popularity;
        private Integer downloadCount;
        private FileMetadata image;
        private String imageUrl;
        private FileMetadata icon;
        private String iconUrl;
        private FileMetadata jsonFile;
        private String downloadUrl;
        private Boolean featured;
        private Boolean verified;
        private String status;
        private String version;

        private Builder() {}

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

        public Builder basePrice(Double basePrice) {
            this.basePrice = basePrice;
            return this;
        }

        public Builder discountedPrice(Double discountedPrice) {
            this.discountedPrice = discountedPrice;
            return this;
        }

        public Builder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public Builder subscription(Boolean subscription) {
            this.subscription = subscription;
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder features(Set<String> features) {
            this.features = features;
            return this;
        }

        public Builder popularity(Integer popularity) {
            this.popularity = popularity;
            return this;
        }

        public Builder downloadCount(Integer downloadCount) {
            this.downloadCount = downloadCount;
            return this;
        }

        public Builder image(FileMetadata image) {
            this.image = image;
            return this;
        }

        public Builder imageUrl(String imageUrl) {
            this.imageUrl = imageUrl;
            return this;
        }

        public Builder icon(FileMetadata icon) {
            this.icon = icon;
            return this;
        }

        public Builder iconUrl(String iconUrl) {
            this.iconUrl = iconUrl;
            return this;
        }

        public Builder jsonFile(FileMetadata jsonFile) {
            this.jsonFile = jsonFile;
            return this;
        }

        public Builder downloadUrl(String downloadUrl) {
            this.downloadUrl = downloadUrl;
            return this;
        }

        public Builder featured(Boolean featured) {
            this.featured = featured;
            return this;
        }

        public Builder verified(Boolean verified) {
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

        public AgentPatch build() {
            return new AgentPatch(
                    Optional.ofNullable(name),
                    Optional.ofNullable(title),
                    Optional.ofNullable(description),
                    Optional.ofNullable(category),
                    Optional.ofNullable(creator),
                    Optional.ofNullable(priceDetails),
                    Optional.ofNullable(basePrice),
                    Optional.ofNullable(discountedPrice),
                    Optional.ofNullable(currency),
                    Optional.ofNullable(subscription),
                    Optional.ofNullable(tags),
                    Optional.ofNullable(features),
                    Optional.ofNullable(popularity),
                    Optional.ofNullable(downloadCount),
                    Optional.ofNullable(image),
                    Optional.ofNullable(imageUrl),
                    Optional.ofNullable(icon),
                    Optional.ofNullable(iconUrl),
                    Optional.ofNullable(jsonFile),
                    Optional.ofNullable(downloadUrl),
                    Optional.ofNullable(featured),
                    Optional.ofNullable(verified),
                    Optional.ofNullable(status),
                    Optional.ofNullable(version));
        }
    }
}
