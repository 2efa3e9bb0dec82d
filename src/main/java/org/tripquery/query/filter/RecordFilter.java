/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.filter;

import org.tripquery.core.model.Row;
import org.tripquery.query.diagnostics.Diagnostic;

import java.util.Optional;

/**
 * A predicate over records. All filters of a plan are combined with logical AND.
 *
 * <p>Each supported operation is its own implementation carrying only the arguments it needs; an
 * unrecognised operation name is kept as {@link UnknownOperationFilter}.</p>
 */
public sealed interface RecordFilter permits EqualsFilter, HourBetweenFilter, GreaterThanFilter, LessThanFilter, ContainsFilter,
    DayOfWeekFilter, UnknownOperationFilter {

    /** Stage name used when reporting diagnostics. */
    String STAGE = "filter";

    /**
     * Operation name as written in plans, e.g. {@code hour_between}.
     */
    String getName();

    /**
     * Field the filter reads, may be null for filters that read the start timestamp.
     */
    String getField();

    /**
     * Whether the record survives this filter.
     */
    boolean test(Row row);

    /**
     * A problem with the filter's own arguments, reported once per execution rather than once per record.
     *
     * @return the diagnostic, or empty when the filter is well formed
     */
    default Optional<Diagnostic> planDiagnostic() {
        return Optional.empty();
    }
}
