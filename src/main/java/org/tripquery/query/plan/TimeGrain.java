/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.plan;

import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.util.Locale;
import java.util.Optional;

/**
 * Period length daily summaries are bucketed by.
 */
public enum TimeGrain {
    DAY("day"),
    WEEK("week"),
    MONTH("month"),
    QUARTER("quarter"),
    YEAR("year");

    private final String value;

    TimeGrain(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Key of the period containing {@code date}.
     *
     * <ul>
     *   <li>day: {@code 2023-04-01}</li>
     *   <li>week: ISO-8601 week of the week-based year, {@code 2023-W13}; {@code 2023-01-01} is {@code 2022-W52}</li>
     *   <li>month: {@code 2023-04}</li>
     *   <li>quarter: {@code 2023-Q2}</li>
     *   <li>year: {@code 2023}</li>
     * </ul>
     *
     * @param date the summary date
     * @return the bucket key
     */
    public String bucketKey(LocalDate date) {
        return switch (this) {
            case DAY -> date.toString();
            case WEEK -> String.format(
                Locale.ROOT,
                "%04d-W%02d",
                date.get(IsoFields.WEEK_BASED_YEAR),
                date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR)
            );
            case MONTH -> String.format(Locale.ROOT, "%04d-%02d", date.getYear(), date.getMonthValue());
            case QUARTER -> String.format(Locale.ROOT, "%04d-Q%d", date.getYear(), date.get(IsoFields.QUARTER_OF_YEAR));
            case YEAR -> String.format(Locale.ROOT, "%04d", date.getYear());
        };
    }

    /**
     * Look up a grain by its plan name.
     *
     * @param name grain name, may be null
     * @return the grain, or empty when the name is not supported
     */
    public static Optional<TimeGrain> fromString(String name) {
        for (TimeGrain grain : values()) {
            if (grain.value.equals(name)) {
                return Optional.of(grain);
            }
        }
        return Optional.empty();
    }
}
