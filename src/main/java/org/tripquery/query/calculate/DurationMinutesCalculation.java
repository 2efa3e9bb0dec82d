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
import org.tripquery.core.utils.FieldValues;
import org.tripquery.core.utils.TripTimestamps;
import org.tripquery.query.diagnostics.Diagnostic;
import org.tripquery.query.diagnostics.DiagnosticSink;

import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Trip duration in whole minutes, {@code ended_at - started_at} rounded half away from zero.
 * A record whose timestamps cannot be parsed gets {@code NaN}.
 */
public final class DurationMinutesCalculation implements FieldCalculation {

    /** The name identifier for this operation. */
    public static final String NAME = "duration_minutes";

    private final String targetField;

    public DurationMinutesCalculation(String targetField) {
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
        Object end = row.get(TripRecord.ENDED_AT);
        if (start instanceof String startText && end instanceof String endText) {
            try {
                double minutes = TripTimestamps.minutesBetween(startText, endText);
                return row.with(targetField, FieldValues.normalize(FieldValues.roundHalfAwayFromZero(minutes)));
            } catch (DateTimeParseException e) {
                sink.report(Diagnostic.of(Diagnostic.Code.UNPARSEABLE_TIMESTAMP, STAGE, "%s: %s", NAME, e.getMessage()));
                return row.with(targetField, Double.NaN);
            }
        }
        sink.report(
            Diagnostic.of(
                Diagnostic.Code.UNPARSEABLE_TIMESTAMP,
                STAGE,
                "%s: expected %s and %s strings, got [%s] and [%s]",
                NAME,
                TripRecord.STARTED_AT,
                TripRecord.ENDED_AT,
                start,
                end
            )
        );
        return row.with(targetField, Double.NaN);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DurationMinutesCalculation other && targetField.equals(other.targetField);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NAME, targetField);
    }
}
