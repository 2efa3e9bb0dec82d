/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.calculate;

import org.tripquery.core.model.Row;
import org.tripquery.query.diagnostics.DiagnosticSink;

/**
 * A derived field computed onto every record before filtering.
 *
 * <p>Each supported operation is its own implementation carrying only what it needs; an unrecognised
 * operation name is kept as {@link UnknownCalculation} so the plan still executes.</p>
 */
public sealed interface FieldCalculation permits DurationMinutesCalculation, HourOfDayCalculation, IsRoundTripCalculation,
    DayOfWeekCalculation, UnknownCalculation {

    /** Stage name used when reporting diagnostics. */
    String STAGE = "calculate";

    /**
     * Operation name as written in plans, e.g. {@code duration_minutes}.
     */
    String getName();

    /**
     * Name of the field the result is written to.
     */
    String getTargetField();

    /**
     * Compute the field onto a copy of {@code row}. The input row is never modified.
     *
     * @param row the record
     * @param sink receives a diagnostic when the value cannot be computed
     * @return a copy of the row with the target field set, or the row itself when nothing was computed
     */
    Row apply(Row row, DiagnosticSink sink);
}
