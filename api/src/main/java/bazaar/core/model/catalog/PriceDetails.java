package bazaar.core.model.catalog;

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured price of a catalog item.
 *
 * <p>All components are boxed because records written before structured pricing
 * existed may carry a partial object. Use {@link #of} to build a complete,
 * internally consistent value.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PriceDetails(
        @JsonProperty("basePrice") Double basePrice,
        @JsonProperty("discountedPrice") Double discountedPrice,
        @JsonProperty("currency") String currency,
        @JsonProperty("isFree") Boolean isFree,
        @JsonProperty("isSubscription") Boolean isSubscription,
        @JsonProperty("discountPercentage") Integer discountPercentage) {

    public static final String DEFAULT_CURRENCY = "USD";

    /**
     * Build a complete price, deriving the dependent fields.
     *
     * <p>Negative prices are raised to zero and the discounted price is clamped to
     * {@code [0, basePrice]}. {@code isFree} is {@code basePrice == 0}; the discount
     * percentage is rounded to the nearest integer.
     *
     * @param basePrice       list price
     * @param discountedPrice effective price, null to use the list price
     * @param currency        ISO currency code, null for {@value #DEFAULT_CURRENCY}
     * @param subscription    whether the item is sold as a subscription
     * @return a consistent price
     */
    public static PriceDetails of(double basePrice, Double discountedPrice, String currency, boolean subscription) {
        final double base = Math.max(0.0, basePrice);
        double discounted = discountedPrice == null || discountedPrice.isNaN() ? base : discountedPrice;
        discounted = Math.min(Math.max(0.0, discounted), base);
        final int percentage = base > 0 && discounted < base
                ? BigDecimal.valueOf((base - discounted) / base * 100)
                        .setScale(0, RoundingMode.HALF_UP)
                        .intValue()
                : 0;
        return new PriceDetails(
                base,
                discounted,
                currency == null || currency.isBlank() ? DEFAULT_CURRENCY : currency,
                base == 0.0,
                subscription,
                percentage);
    }

    public static PriceDetails free() {
        return of(0.0, 0.0, DEFAULT_CURRENCY, false);
    }
}
