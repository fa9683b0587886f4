package bazaar.core.service.catalog;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import bazaar.core.model.catalog.AgentPatch;
import bazaar.core.model.catalog.AgentRecord;
import bazaar.core.model.catalog.Creator;
import bazaar.core.model.catalog.FileMetadata;
import bazaar.core.model.catalog.PriceDetails;

/**
 * Applies an {@link AgentPatch} to a record.
 *
 * <p>For every field a present patch value wins, otherwise the existing value is
 * kept, otherwise a default applies. Blank strings in the patch count as absent,
 * except for the file URL shortcuts where a blank clears the file. Price details
 * are always rebuilt through {@link PriceDetails#of} so the derived fields stay
 * consistent, and the legacy {@code price} mirrors the discounted price.
 * {@code createdAt} is never replaced; {@code updatedAt} is the merge time.
 * Likes, reviews and rating are not patchable.
 */
public final class AgentRecordMerger {

    static final String DEFAULT_STATUS = "active";
    static final String DEFAULT_VERSION = "1.0.0";
    static final String JSON_CONTENT_TYPE = "application/json";

    private AgentRecordMerger() {}

    public static AgentRecord create(String id, AgentPatch patch, Creator actor, Instant now) {
        return shape(id, null, patch, actor, now);
    }

    public static AgentRecord merge(AgentRecord existing, AgentPatch patch, Instant now) {
        return shape(existing.id(), existing, patch, null, now);
    }

    private static AgentRecord shape(String id, AgentRecord existing, AgentPatch patch, Creator actor, Instant now) {
        final Optional<AgentRecord> ex = Optional.ofNullable(existing);

        final String name = text(patch.name()).or(() -> ex.map(AgentRecord::name)).orElse("");
        final String title = text(patch.title())
                .or(() -> ex.map(AgentRecord::title).filter(t -> !t.isBlank()))
                .orElse(name);
        final PriceDetails price = price(patch, ex.orElse(null));

        return AgentRecord.builder(id)
                .name(name)
                .title(title)
                .description(text(patch.description()).or(() -> ex.map(AgentRecord::description)).orElse(""))
                .category(text(patch.category()).or(() -> ex.map(AgentRecord::category)).orElse(""))
                .creator(creator(patch.creator(), ex.map(AgentRecord::creator).orElse(null), actor))
                .priceDetails(price)
                .price(BigDecimal.valueOf(price.discountedPrice()).stripTrailingZeros().toPlainString())
                .rating(ex.map(AgentRecord::rating).orElse(null))
                .tags(patch.tags().or(() -> ex.map(AgentRecord::tags)).orElse(Set.of()))
                .features(patch.features().or(() -> ex.map(AgentRecord::features)).orElse(Set.of()))
                .popularity(Math.max(0, patch.popularity().orElse(ex.map(AgentRecord::popularity).orElse(0))))
                .downloadCount(
                        Math.max(0, patch.downloadCount().orElse(ex.map(AgentRecord::downloadCount).orElse(0))))
                .createdAt(ex.map(AgentRecord::createdAt).orElse(now))
                .updatedAt(now)
                .likes(ex.map(AgentRecord::likes).orElse(Set.of()))
                .reviews(ex.map(AgentRecord::reviews).orElse(null))
                .image(file(patch.image(), patch.imageUrl(), ex.map(AgentRecord::image), ""))
                .icon(file(patch.icon(), patch.iconUrl(), ex.map(AgentRecord::icon), ""))
                .jsonFile(file(patch.jsonFile(), patch.downloadUrl(), ex.map(AgentRecord::jsonFile), JSON_CONTENT_TYPE))
                .featured(patch.featured().orElse(ex.map(AgentRecord::featured).orElse(false)))
                .verified(patch.verified().orElse(ex.map(AgentRecord::verified).orElse(false)))
                .status(text(patch.status()).or(() -> ex.map(AgentRecord::status)).orElse(DEFAULT_STATUS))
                .version(text(patch.version()).or(() -> ex.map(AgentRecord::version)).orElse(DEFAULT_VERSION))
                .build();
    }

    private static PriceDetails price(AgentPatch patch, AgentRecord existing) {
        final Optional<PriceDetails> given = patch.priceDetails();
        final Optional<PriceDetails> current = Optional.ofNullable(existing).map(AgentRecord::priceDetails);

        final double base = given.map(PriceDetails::basePrice)
                .or(patch::basePrice)
                .or(() -> current.map(PriceDetails::basePrice))
                .or(() -> legacyPrice(existing))
                .filter(v -> !v.isNaN())
                .orElse(0.0);
        // A new base price without a new discount resets the discount.
        final Double discounted = given.map(PriceDetails::discountedPrice)
                .or(patch::discountedPrice)
                .or(() -> patch.basePrice().isPresent()
                        ? Optional.empty()
                        : current.map(PriceDetails::discountedPrice))
                .orElse(null);
        final String currency = given.map(PriceDetails::currency)
                .or(patch::currency)
                .or(() -> current.map(PriceDetails::currency))
                .orElse(null);
        final boolean subscription = given.map(PriceDetails::isSubscription)
                .or(patch::subscription)
                .or(() -> current.map(PriceDetails::isSubscription))
                .orElse(false);
        return PriceDetails.of(base, discounted, currency, subscription);
    }

    private static Optional<Double> legacyPrice(AgentRecord existing) {
        if (existing == null) {
            return Optional.empty();
        }
        final double parsed = PriceResolver.parseLegacy(existing.price());
        return Double.isInfinite(parsed) ? Optional.empty() : Optional.of(parsed);
    }

    private static Creator creator(Optional<Creator> patch, Creator existing, Creator actor) {
        if (patch.isEmpty()) {
            if (existing != null) {
                return existing;
            }
            return actor != null ? actor : Creator.system();
        }
        final Creator given = patch.get();
        final Optional<Creator> ex = Optional.ofNullable(existing);
        final Optional<Creator> act = Optional.ofNullable(actor);
        return new Creator(
                Optional.ofNullable(given.id())
                        .or(() -> ex.map(Creator::id))
                        .or(() -> act.map(Creator::id))
                        .orElse(null),
                nonBlank(given.name())
                        .or(() -> ex.map(Creator::name))
                        .or(() -> act.map(Creator::name))
                        .orElse("Anonymous"),
                given.imageUrl() != null ? given.imageUrl() : ex.map(Creator::imageUrl).orElse(null));
    }

    private static FileMetadata file(
            Optional<FileMetadata> file, Optional<String> url, Optional<FileMetadata> existing, String contentType) {
        if (file.isPresent() && file.get().url() != null && !file.get().url().isBlank()) {
            return file.get();
        }
        if (url.isPresent()) {
            return url.get().isBlank() ? null : FileMetadata.ofUrl(url.get().trim(), contentType);
        }
        return existing.orElse(null);
    }

    private static Optional<String> text(Optional<String> value) {
        return value.flatMap(AgentRecordMerger::nonBlank);
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
