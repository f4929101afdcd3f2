package org.netpreserve.pagecrawl.util;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Reads durations written as milliseconds ({@code 500}), with a unit ({@code 500ms}, {@code 30s}, {@code 2m},
 * {@code 1h}) or in ISO-8601 form ({@code PT30S}).
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return Duration.ofMillis(jsonParser.getLongValue());
        String text = jsonParser.getText().strip();
        try {
            return parse(text);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new InvalidFormatException(jsonParser, "Invalid duration: " + text, text, Duration.class);
        }
    }

    public static Duration parse(String text) {
        String upper = text.strip().toUpperCase(Locale.ROOT);
        if (upper.startsWith("P")) return Duration.parse(upper);
        if (upper.endsWith("MS")) return Duration.ofMillis(Long.parseLong(upper.substring(0, upper.length() - 2).strip()));
        if (!upper.isEmpty() && Character.isDigit(upper.charAt(upper.length() - 1))) return Duration.ofMillis(Long.parseLong(upper));
        return Duration.parse("PT" + upper);
    }
}
