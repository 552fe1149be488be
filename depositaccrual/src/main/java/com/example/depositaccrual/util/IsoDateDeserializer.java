package com.example.depositaccrual.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Reads a calendar date from any ISO-8601 date or date-time string.
 * Time-of-day and offset are dropped; the date is taken as written, without zone conversion,
 * so "2024-03-31T22:00:00.000Z" becomes 2024-03-31.
 */
public class IsoDateDeserializer extends StdDeserializer<LocalDate> {

    public IsoDateDeserializer() {
        super(LocalDate.class);
    }

    @Override
    public LocalDate deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        String text = parser.getValueAsString();
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return parse(text);
        } catch (DateTimeParseException e) {
            return (LocalDate) context.handleWeirdStringValue(LocalDate.class, text,
                    "not an ISO-8601 date: %s", e.getMessage());
        }
    }

    /**
     * Parse an ISO-8601 date or date-time string, truncated to its date part
     *
     * @param text The date text, e.g. 2024-01-01, 2024-01-01+01:00 or 2024-01-01T10:15:30Z
     * @return The calendar date
     * @throws DateTimeParseException if the text is not ISO-8601
     */
    public static LocalDate parse(String text) {
        String trimmed = text.trim();
        if (trimmed.indexOf('T') >= 0) {
            return DateTimeFormatter.ISO_DATE_TIME.parse(trimmed, LocalDate::from);
        }
        return DateTimeFormatter.ISO_DATE.parse(trimmed, LocalDate::from);
    }
}
