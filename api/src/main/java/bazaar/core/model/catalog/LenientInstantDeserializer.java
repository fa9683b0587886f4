package bazaar.core.model.catalog;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

/**
 * Reads catalog timestamps written by several generations of clients.
 *
 * <p>Accepted forms:
 * <ul>
 *   <li>ISO-8601 instants and offset date-times ({@code 2024-05-01T10:00:00Z})</li>
 *   <li>ISO local date-times and dates, interpreted as UTC</li>
 *   <li>epoch milliseconds, as a number or a numeric string</li>
 *   <li>document-store timestamp objects ({@code {"_seconds": .., "_nanoseconds": ..}} or
 *       {@code {"seconds": .., "nanos": ..}})</li>
 * </ul>
 *
 * <p>Anything else deserializes to {@code null}, which the query engine treats as
 * an unresolvable date.
 */
public class LenientInstantDeserializer extends StdDeserializer<Instant> {

    private static final List<Function<String, Instant>> TEXT_PARSERS = List.of(
            v -> OffsetDateTime.parse(v).toInstant(),
            v -> LocalDateTime.parse(v).toInstant(ZoneOffset.UTC),
            v -> LocalDate.parse(v).atStartOfDay().toInstant(ZoneOffset.UTC));

    public LenientInstantDeserializer() {
        super(Instant.class);
    }

    @Override
    public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        final JsonToken token = p.currentToken();
        if (token == JsonToken.VALUE_NUMBER_INT) {
            return Instant.ofEpochMilli(p.getLongValue());
        }
        if (token == JsonToken.VALUE_NUMBER_FLOAT) {
            return Instant.ofEpochMilli((long) p.getDoubleValue());
        }
        if (token == JsonToken.VALUE_STRING) {
            return parse(p.getText());
        }
        if (token == JsonToken.START_OBJECT) {
            final JsonNode node = p.readValueAsTree();
            return fromTimestampObject(node);
        }
        p.skipChildren();
        return null;
    }

    /**
     * Parse a timestamp string in any of the accepted textual forms.
     *
     * @param text the raw value
     * @return the instant, or null if the text cannot be resolved
     */
    public static Instant parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        final var value = text.trim();
        if (value.chars().allMatch(Character::isDigit)) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(value));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        for (var parser : TEXT_PARSERS) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                continue;
            }
        }
        return null;
    }

    private static Instant fromTimestampObject(JsonNode node) {
        final var seconds = node.has("_seconds") ? node.get("_seconds") : node.get("seconds");
        if (seconds == null || !seconds.canConvertToLong()) {
            return null;
        }
        final var nanos = node.has("_nanoseconds") ? node.get("_nanoseconds") : node.get("nanos");
        final long nanoAdjustment = nanos != null && nanos.canConvertToLong() ? nanos.asLong() : 0L;
        return Instant.ofEpochSecond(seconds.asLong(), nanoAdjustment);
    }
}
