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
import org.tripquery.query.diagnostics.DiagnosticSink;

import java.util.Objects;

/**
 * Whether the trip ended at the station it started from ({@code start_station_id == end_station_id}).
 */
public final class IsRoundTripCalculation implements FieldCalculation {

    /** The name identifier for this operation. */
    public static final String NAME = "is_round_trip";

    private final String targetField;

    public IsRoundTripCalculation(String targetField) {
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
        boolean roundTrip = FieldValues.strictEquals(row.get(TripRecord.START_STATION_ID), row.get(TripRecord.END_STATION_ID));
        return row.with(targetField, roundTrip);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof IsRoundTripCalculation other && targetField.equals(other.targetField);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NAME, targetField);
    }
}
