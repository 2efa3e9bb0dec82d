/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.plan;

import org.tripquery.query.calculate.FieldCalculation;
import org.tripquery.query.calculate.FieldCalculationFactory;
import org.tripquery.query.diagnostics.Diagnostic;
import org.tripquery.query.filter.RecordFilter;
import org.tripquery.query.filter.RecordFilterFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Declarative plan run by the record pipeline: calculate, filter, group and aggregate, order, limit.
 * Every stage is optional; an absent stage passes rows through unchanged.
 *
 * @param calculate derived fields, computed in list order
 * @param filters predicates combined with logical AND
 * @param groupBy field to group on, or {@code null}
 * @param aggregate reduction applied to each group, or {@code null}; ignored without {@code groupBy}
 * @param orderBy sort applied after grouping, or {@code null}
 * @param limit maximum number of rows returned, or {@code null}
 * @param diagnostics problems found while reading the plan, reported by the pipeline on each run
 */
public record RecordQueryPlan(
    List<FieldCalculation> calculate,
    List<RecordFilter> filters,
    String groupBy,
    AggregateSpec aggregate,
    SortSpec orderBy,
    Integer limit,
    List<Diagnostic> diagnostics
) {

    public static final String CALCULATE_ARG = "calculate";
    public static final String FILTERS_ARG = "filters";
    public static final String GROUP_BY_ARG = "groupBy";
    public static final String AGGREGATE_ARG = "aggregate";
    public static final String ORDER_BY_ARG = "orderBy";
    public static final String LIMIT_ARG = "limit";

    private static final RecordQueryPlan EMPTY = new RecordQueryPlan(null, null, null, null, null, null);

    public RecordQueryPlan {
        calculate = calculate == null ? List.of() : List.copyOf(calculate);
        filters = filters == null ? List.of() : List.copyOf(filters);
        groupBy = groupBy == null || groupBy.isEmpty() ? null : groupBy;
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public RecordQueryPlan(
        List<FieldCalculation> calculate,
        List<RecordFilter> filters,
        String groupBy,
        AggregateSpec aggregate,
        SortSpec orderBy,
        Integer limit
    ) {
        this(calculate, filters, groupBy, aggregate, orderBy, limit, List.of());
    }

    /**
     * Plan with every stage absent; returns its input unchanged.
     */
    public static RecordQueryPlan empty() {
        return EMPTY;
    }

    public boolean hasGrouping() {
        return groupBy != null;
    }

    /**
     * Build a plan from its JSON object form.
     *
     * @param args the plan object
     * @return the plan, carrying a diagnostic for each malformed argument
     * @throws IllegalArgumentException if {@code args} is null
     */
    public static RecordQueryPlan fromArgs(Map<String, Object> args) {
        if (args == null) {
            throw new IllegalArgumentException("Query plan cannot be null");
        }
        PlanArgs reader = new PlanArgs();
        List<FieldCalculation> calculations = new ArrayList<>();
        for (Map<String, Object> entry : reader.mapListArg(args, CALCULATE_ARG)) {
            FieldCalculationFactory.fromArgs(entry, reader).ifPresent(calculations::add);
        }
        List<RecordFilter> filters = new ArrayList<>();
        for (Map<String, Object> entry : reader.mapListArg(args, FILTERS_ARG)) {
            filters.add(RecordFilterFactory.fromArgs(entry, reader));
        }
        String groupBy = reader.stringArg(args, GROUP_BY_ARG);
        Map<String, Object> aggregate = reader.mapArg(args, AGGREGATE_ARG);
        Map<String, Object> orderBy = reader.mapArg(args, ORDER_BY_ARG);
        return new RecordQueryPlan(
            calculations,
            filters,
            groupBy,
            aggregate == null ? null : AggregateSpec.fromArgs(aggregate, reader),
            orderBy == null ? null : SortSpec.fromArgs(orderBy, reader),
            reader.intArg(args, LIMIT_ARG),
            reader.getDiagnostics()
        );
    }
}
