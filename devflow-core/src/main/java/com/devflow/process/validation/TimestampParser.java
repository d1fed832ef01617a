package com.devflow.process.validation;

import com.devflow.process.error.EventValidationException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;

/**
 * Parses event timestamps. Accepts ISO-8601 instants and offset date-times, plus local date-times in ISO form or
 * {@code yyyy-MM-dd HH:mm:ss[.fraction]}; local forms are read as UTC.
 */
public final class TimestampParser {

    public static final String FIELD = "timestamp";

    private static final DateTimeFormatter SPACE_SEPARATED = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .toFormatter();

    private static final List<DateTimeFormatter> LOCAL_FORMATS =
            List.of(DateTimeFormatter.ISO_LOCAL_DATE_TIME, SPACE_SEPARATED);

    private TimestampParser() {}

    public static Instant parse(String value) {
        return parse(value, EventValidationException.UNKNOWN_INDEX);
    }

    /**
     * @param eventIndex position of the event being parsed, reported on failure
     * @throws EventValidationException if the value is blank or in none of the supported formats
     */
    public static Instant parse(String value, int eventIndex) {
        if (value == null || value.isBlank()) {
            throw EventValidationException.missingField(eventIndex, FIELD);
        }
        String trimmed = value.trim();
        try {
            return OffsetDateTime.parse(trimmed).toInstant();
        } catch (DateTimeParseException ignored) {
            // not an offset date-time, try the remaining forms
        }
        try {
            return Instant.parse(trimmed);
        } catch (DateTimeParseException ignored) {
            // fall through to local formats
        }
        for (DateTimeFormatter format : LOCAL_FORMATS) {
            try {
                return LocalDateTime.parse(trimmed, format).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        throw new EventValidationException(
                eventIndex,
                FIELD,
                String.format("Event #%d has an unparsable timestamp '%s'", eventIndex, trimmed));
    }
}
