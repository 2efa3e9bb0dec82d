/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.plan;

import org.tripquery.query.diagnostics.Diagnostic;

import java.util.List;
import java.util.Map;

/**
 * Plan run by the rollup aggregator: restrict to a date range, bucket by a time grain, project fields.
 *
 * @param dateRange dates to keep, or {@code null} for all
 * @param aggregateBy grain name as written in the plan, or {@code null} for {@code day}
 * @param fields fields to keep besides {@code period}; empty keeps every field
 * @param diagnostics problems found while reading the plan, reported by the aggregator on each run
 */
public record RollupPlan(DateRange dateRange, String aggregateBy, List<String> fields, List<Diagnostic> diagnostics) {

    public static final String DATE_RANGE_ARG = "dateRange";
    public static final String AGGREGATE_BY_ARG = "aggregateBy";
    public static final String FIELDS_ARG = "fields";
    /** Free-text hint some planners emit; accepted and ignored. */
    public static final String TRANSFORM_ARG = "transform";

    private static final RollupPlan EMPTY = new RollupPlan(null, (String) null, null);

    public RollupPlan {
        fields = fields == null ? List.of() : List.copyOf(fields);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public RollupPlan(DateRange dateRange, String aggregateBy, List<String> fields) {
        this(dateRange, aggregateBy, fields, List.of());
    }

    public RollupPlan(DateRange dateRange, TimeGrain grain, List<String> fields) {
        this(dateRange, grain.getValue(), fields);
    }

    public static RollupPlan empty() {
        return EMPTY;
    }

    /**
     * Grain to bucket by. Absent and unrecognised names both mean {@link TimeGrain#DAY}.
     */
    public TimeGrain grain() {
        return TimeGrain.fromString(aggregateBy).orElse(TimeGrain.DAY);
    }

    /**
     * Whether {@code aggregateBy} names a grain that had to be replaced by the default.
     */
    public boolean hasUnknownGrain() {
        return aggregateBy != null && TimeGrain.fromString(aggregateBy).isEmpty();
    }

    /**
     * Build a plan from its JSON object form.
     *
     * @param args the plan object
     * @return the plan, carrying a diagnostic for each malformed argument
     * @throws IllegalArgumentException if {@code args} is null
     */
    public static RollupPlan fromArgs(Map<String, Object> args) {
        if (args == null) {
            throw new IllegalArgumentException("Rollup plan cannot be null");
        }
        PlanArgs reader = new PlanArgs();
        Map<String, Object> range = reader.mapArg(args, DATE_RANGE_ARG);
        return new RollupPlan(
            range == null ? null : DateRange.fromArgs(range, reader),
            reader.stringArg(args, AGGREGATE_BY_ARG),
            reader.stringListArg(args, FIELDS_ARG),
            reader.getDiagnostics()
        );
    }
}
