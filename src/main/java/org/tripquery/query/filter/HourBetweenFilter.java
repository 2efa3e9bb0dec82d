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
import org.tripquery.core.utils.NumericValue;
import org.tripquery.core.utils.TripTimestamps;
import org.tripquery.query.diagnostics.Diagnostic;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Keeps records whose start hour lies in the half-open interval {@code [from, to)}.
 *
 * <p>The hour is always read from {@code started_at}, never from a field computed by an
 * {@code hour_of_day} calculation, so the filter works whether or not the plan computes one.
 * Bounds that are not a list of two numbers reject every record.</p>
 */
public final class HourBetweenFilter implements RecordFilter {

    /** The name identifier for this operation. */
    public static final String NAME = "hour_between";

    private final String field;
    private final Object value;
    private final double from;
    private final double to;
    private final boolean wellFormed;

    public HourBetweenFilter(String field, Object value) {
        this.field = field;
        this.value = value;
        NumericValue lower = NumericValue.NOT_A_NUMBER;
        NumericValue upper = NumericValue.NOT_A_NUMBER;
        if (value instanceof List<?> bounds && bounds.size() >= 2) {
            lower = NumericValue.parse(bounds.get(0));
            upper = NumericValue.parse(bounds.get(1));
        }
        this.wellFormed = lower.isNumber() && upper.isNumber();
        this.from = lower.orElse(Double.NaN);
        this.to = upper.orElse(Double.NaN);
    }

    public HourBetweenFilter(String field, int from, int to) {
        this(field, List.of(from, to));
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getField() {
        return field;
    }

    public double getFrom() {
        return from;
    }

    public double getTo() {
        return to;
    }

    @Override
    public boolean test(Row row) {
        if (!wellFormed) {
            return false;
        }
        Object start = row.get(TripRecord.STARTED_AT);
        OptionalInt hour = start instanceof String text ? TripTimestamps.hourOf(text) : OptionalInt.empty();
        if (hour.isEmpty()) {
            return false;
        }
        int h = hour.getAsInt();
        return h >= from && h < to;
    }

    @Override
    public Optional<Diagnostic> planDiagnostic() {
        if (wellFormed) {
            return Optional.empty();
        }
        return Optional.of(
            Diagnostic.of(Diagnostic.Code.MALFORMED_ARGUMENT, STAGE, "%s expects [from, to] hour bounds, got [%s]", NAME, value)
        );
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof HourBetweenFilter other && Objects.equals(field, other.field) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NAME, field, value);
    }
}
