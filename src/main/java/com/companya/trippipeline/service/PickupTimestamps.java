package com.companya.trippipeline.service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;

/**
 * Parses pickup timestamps as they appear in trip files: ISO local date-times
 * with either a {@code T} or a space between date and time, with or without
 * seconds and fractions, optionally followed by an offset (dropped), or a bare
 * date meaning midnight.
 */
public final class PickupTimestamps {

    private static final DateTimeFormatter FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .appendValue(ChronoField.HOUR_OF_DAY, 2)
            .appendLiteral(':')
            .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
            .optionalStart()
            .appendLiteral(':')
            .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .optionalEnd()
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private PickupTimestamps() {
    }

    /**
     * @throws DateTimeParseException if the text matches none of the accepted forms
     */
    public static LocalDateTime parse(String text) {
        TemporalAccessor parsed = FORMAT.parseBest(text.trim(), LocalDateTime::from, LocalDate::from);
        if (parsed instanceof LocalDate date) {
            return date.atStartOfDay();
        }
        return (LocalDateTime) parsed;
    }
}
