/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.filter;

import org.tripquery.query.plan.PlanArgs;

import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Builds {@link RecordFilter}s from plan entries of the form {@code {"field": ..., "operation": ..., "value": ...}}.
 */
public final class RecordFilterFactory {

    /** Argument holding the field name. */
    public static final String FIELD_ARG = "field";
    /** Argument holding the operation name. */
    public static final String OPERATION_ARG = "operation";
    /** Argument holding the comparison value. */
    public static final String VALUE_ARG = "value";

    private static final Map<String, BiFunction<String, Object, RecordFilter>> OPERATIONS = Map.of(
        EqualsFilter.NAME,
        EqualsFilter::new,
        HourBetweenFilter.NAME,
        HourBetweenFilter::new,
        GreaterThanFilter.NAME,
        GreaterThanFilter::new,
        LessThanFilter.NAME,
        LessThanFilter::new,
        ContainsFilter.NAME,
        ContainsFilter::new,
        DayOfWeekFilter.NAME,
        DayOfWeekFilter::new
    );

    private RecordFilterFactory() {
        // Utility class - prevent instantiation
    }

    /**
     * Create a filter for an operation name. Names outside the supported set yield an
     * {@link UnknownOperationFilter}.
     *
     * @param operation the operation name
     * @param field the field the filter reads
     * @param value the comparison value
     * @return the filter
     */
    public static RecordFilter create(String operation, String field, Object value) {
        BiFunction<String, Object, RecordFilter> constructor = operation == null ? null : OPERATIONS.get(operation);
        if (constructor == null) {
            return new UnknownOperationFilter(operation, field);
        }
        return constructor.apply(field, value);
    }

    /**
     * Create a filter from a plan entry.
     *
     * @param args the plan entry
     * @param reader reads the entry's arguments and records their diagnostics
     * @return the filter
     */
    public static RecordFilter fromArgs(Map<String, Object> args, PlanArgs reader) {
        if (args == null) {
            throw new IllegalArgumentException("Filter entry cannot be null");
        }
        return create(reader.stringArg(args, OPERATION_ARG), reader.stringArg(args, FIELD_ARG), args.get(VALUE_ARG));
    }

    /**
     * Operation names with a dedicated implementation.
     */
    public static Set<String> supportedOperations() {
        return OPERATIONS.keySet();
    }
}
