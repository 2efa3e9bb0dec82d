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

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Start hour (0-23) read directly from the {@code started_at} text. {@code NaN} when no hour can be read.
 */
public final class HourOfDayCalculation implements FieldCalculation {

    /** The name identifier for this operation. */
    public static final String NAME = "hour_of_day";

    private final String targetField;

    public HourOfDayCalculation(String targetField) {
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
        OptionalInt hour = start instanceof String text ? TripTimestamps.hourOf(text) : OptionalInt.empty();
        if (hour.isEmpty()) {
            sink.report(Diagnostic.of(Diagnostic.Code.UNPARSEABLE_TIMESTAMP, STAGE, "%s: no hour in [%s]", NAME, start));
            return row.with(targetField, Double.NaN);
        }
        return row.with(targetField, hour.getAsInt());
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof HourOfDayCalculation other && targetField.equals(other.targetField);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NAME, targetField);
    }
}
