/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.core.utils;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Parsing and calendar helpers for the fixed-format trip timestamps found in shards,
 * e.g. {@code "2023-01-03 23:14:52.325"}.
 *
 * <p>Timestamps carry no zone. They are parsed as {@link LocalDateTime} and all arithmetic happens on
 * the local time line, so results never depend on the zone of the host running the query.</p>
 *
 * <p>Example usage:
 * <pre>{@code
 * TripTimestamps.hourOf("2023-01-03 23:14:52.325");          // OptionalInt[23]
 * TripTimestamps.weekdayName("2023-01-03 23:14:52.325");     // "Tuesday"
 * TripTimestamps.minutesBetween("2023-01-03 23:00:00.000",
 *                               "2023-01-03 23:15:30.000");  // 15.5
 * }</pre>
 */
public final class TripTimestamps {

    /**
     * {@code yyyy-MM-dd HH:mm[:ss[.fraction]]}, accepting {@code T} in place of the space.
     */
    public static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder().append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
        .appendLiteral(' ')
        .optionalEnd()
        .optionalStart()
        .appendLiteral('T')
        .optionalEnd()
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
        .toFormatter(Locale.ROOT);

    private TripTimestamps() {}

    /**
     * Parse a trip timestamp.
     *
     * @param timestamp the timestamp text
     * @return the parsed date-time
     * @throws DateTimeParseException if the text is not a trip timestamp
     * @throws NullPointerException if {@code timestamp} is null
     */
    public static LocalDateTime parse(String timestamp) {
        return LocalDateTime.parse(timestamp.trim(), TIMESTAMP_FORMAT);
    }

    /**
     * Read the hour straight from the time component of the text, without calendar parsing.
     * The time component is whatever follows the first space (or {@code T}); its leading digits
     * up to the first {@code ':'} are the hour.
     *
     * @param timestamp the timestamp text, may be null
     * @return the hour, or empty when the text has no readable hour
     */
    public static OptionalInt hourOf(String timestamp) {
        if (timestamp == null) {
            return OptionalInt.empty();
        }
        String text = timestamp.trim();
        int separator = text.indexOf(' ');
        if (separator < 0) {
            separator = text.indexOf('T');
        }
        if (separator < 0) {
            return OptionalInt.empty();
        }
        int start = separator + 1;
        int end = start;
        while (end < text.length() && Character.isDigit(text.charAt(end))) {
            end++;
        }
        if (end == start || end - start > 2) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.parseInt(text.substring(start, end)));
    }

    /**
     * English name of the weekday of the timestamp's calendar date, {@code "Sunday"} ... {@code "Saturday"}.
     *
     * @param timestamp the timestamp text
     * @return the weekday name
     * @throws DateTimeParseException if the text is not a trip timestamp
     */
    public static String weekdayName(String timestamp) {
        return weekdayName(parse(timestamp).getDayOfWeek());
    }

    public static String weekdayName(DayOfWeek dayOfWeek) {
        return dayOfWeek.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    /**
     * Fractional minutes from {@code start} to {@code end}; negative when {@code end} is earlier.
     *
     * @throws DateTimeParseException if either text is not a trip timestamp
     */
    public static double minutesBetween(String start, String end) {
        Duration duration = Duration.between(parse(start), parse(end));
        // seconds and nanos separately: toNanos() overflows past roughly 292 years
        return duration.getSeconds() / 60.0 + duration.getNano() / 60_000_000_000.0;
    }
}
