/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.filter;

import org.tripquery.core.model.Row;
import org.tripquery.core.model.TripRecord;
import org.tripquery.core.utils.TripTimestamps;

import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Keeps records that started on the named weekday ({@code "Monday"}, ...). The weekday is computed from
 * {@code started_at}; matching is exact and case-sensitive.
 */
public final class DayOfWeekFilter implements RecordFilter {

    /** The name identifier for this operation. */
    public static final String NAME = "day_of_week";

    private final String field;
    private final Object value;

    public DayOfWeekFilter(String field, Object value) {
        this.field = field;
        this.value = value;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getField() {
        return field;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public boolean test(Row row) {
        if (!(row.get(TripRecord.STARTED_AT) instanceof String start)) {
            return false;
        }
        try {
            return TripTimestamps.weekdayName(start).equals(value);
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DayOfWeekFilter other && Objects.equals(field, other.field) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NAME, field, value);
    }
}
