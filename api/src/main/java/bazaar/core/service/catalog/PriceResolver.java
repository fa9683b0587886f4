package bazaar.core.service.catalog;

import java.util.Locale;
import java.util.regex.Pattern;

import bazaar.core.model.catalog.AgentRecord;
import bazaar.core.model.catalog.PriceDetails;

/**
 * Derives comparable price facts from records of any schema generation.
 *
 * <p>Structured {@link PriceDetails} take precedence over the legacy free-form
 * {@code price}. A missing legacy price counts as 0; a legacy price with no
 * number in it counts as {@link Double#POSITIVE_INFINITY} so any bound excludes it.
 */
final class PriceResolver {

    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9.\\-]");

    private PriceResolver() {}

    static double effectivePrice(AgentRecord record) {
        final PriceDetails details = record.priceDetails();
        if (details != null) {
            if (details.discountedPrice() != null) {
                return details.discountedPrice();
            }
            if (details.basePrice() != null) {
                return details.basePrice();
            }
        }
        return parseLegacy(record.price());
    }

    static boolean isFree(AgentRecord record) {
        final PriceDetails details = record.priceDetails();
        if (details != null) {
            if (details.isFree() != null) {
                return details.isFree();
            }
            if (details.basePrice() != null) {
                return details.basePrice() == 0.0;
            }
        }
        return parseLegacy(record.price()) == 0.0;
    }

    static boolean isSubscription(AgentRecord record) {
        final PriceDetails details = record.priceDetails();
        return details != null && Boolean.TRUE.equals(details.isSubscription());
    }

    /**
     * Parse a legacy price such as {@code "Free"}, {@code "$0"} or {@code "19.99"}.
     *
     * @param price stored value, may be null
     * @return the amount, 0 when absent, +Infinity when unparsable
     */
    static double parseLegacy(String price) {
        if (price == null || price.isBlank()) {
            return 0.0;
        }
        final String trimmed = price.trim();
        if (trimmed.toLowerCase(Locale.ROOT).equals("free")) {
            return 0.0;
        }
        final String digits = NON_NUMERIC.matcher(trimmed).replaceAll("");
        if (digits.isEmpty()) {
            return Double.POSITIVE_INFINITY;
        }
        try {
            final double value = Double.parseDouble(digits);
            return Double.isNaN(value) ? Double.POSITIVE_INFINITY : value;
        } catch (NumberFormatException e) {
            return Double.POSITIVE_INFINITY;
        }
    }
}
