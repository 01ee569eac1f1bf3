package org.gpsagents.frontier.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Reads durations written as milliseconds ({@code 30000}), shorthand ({@code 5m}, {@code 1h30m}) or ISO-8601
 * ({@code PT5M}).
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        if (parser.currentToken().isNumeric()) return Duration.ofMillis(parser.getLongValue());
        String text = parser.getText().trim().toUpperCase(Locale.ROOT);
        try {
            return Duration.parse(text.startsWith("P") ? text : "PT" + text);
        } catch (DateTimeParseException e) {
            return (Duration) context.handleWeirdStringValue(Duration.class, parser.getText(),
                    "expected milliseconds or a duration like 5m or PT5M");
        }
    }
}
