/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.calculate;

import org.tripquery.core.model.Row;
import org.tripquery.core.model.TripRecord;
import org.tripquery.core.utils.TripTimestamps;
import org.tripquery.query.diagnostics.Diagnostic;
import org.tripquery.query.diagnostics.DiagnosticSink;

import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Weekday name ({@code "Sunday"} ... {@code "Saturday"}) of the {@code started_at} calendar date.
 * The field is left unset when the timestamp cannot be parsed.
 */
public final class DayOfWeekCalculation implements FieldCalculation {

    /** The name identifier for this operation. */
    public static final String NAME = "day_of_week";

    private final String targetField;

    public DayOfWeekCalculation(String targetField) {
        this.targetField = Objects.requireNonNull(targetField, "targetField");
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getTargetField() {
        return targetField;
    }

    @Override
    public Row apply(Row row, DiagnosticSink sink) {
        Object start = row.get(TripRecord.STARTED_AT);
        if (start instanceof String text) {
            try {
                return row.with(targetField, TripTimestamps.weekdayName(text));
            } catch (DateTimeParseException e) {
                sink.report(Diagnostic.of(Diagnostic.Code.UNPARSEABLE_TIMESTAMP, STAGE, "%s: %s", NAME, e.getMessage()));
                return row;
            }
        }
        sink.report(Diagnostic.of(Diagnostic.Code.UNPARSEABLE_TIMESTAMP, STAGE, "%s: no timestamp in [%s]", NAME, start));
        return row;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DayOfWeekCalculation other && targetField.equals(other.targetField);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NAME, targetField);
    }
}
