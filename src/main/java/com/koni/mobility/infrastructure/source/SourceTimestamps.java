package com.koni.mobility.infrastructure.source;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Timestamp formats seen in source payloads.
 */
public final class SourceTimestamps {

    private static final DateTimeFormatter SPACE_SEPARATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private SourceTimestamps() {
    }

    /**
     * Parses ISO-8601 instants and offset date-times. An ISO interval {@code start/end}
     * resolves to its start.
     *
     * @throws DateTimeParseException if the text is none of these
     */
    public static Instant parseIso(String text) {
        String value = text.trim();
        int slash = value.indexOf('/');
        if (slash > 0) {
            value = value.substring(0, slash);
        }
        return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    }

    /**
     * Parses {@code yyyy-MM-dd HH:mm:ss} as UTC.
     *
     * @throws DateTimeParseException if the text has another format
     */
    public static Instant parseUtcLocal(String text) {
        return LocalDateTime.parse(text.trim(), SPACE_SEPARATED).toInstant(ZoneOffset.UTC);
    }

    /**
     * Formats an instant the way OData filters expect it.
     */
    public static String format(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }
}
