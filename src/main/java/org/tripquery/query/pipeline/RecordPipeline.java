/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tripquery.core.model.Row;
import org.tripquery.core.utils.NumericValue;
import org.tripquery.query.calculate.FieldCalculation;
import org.tripquery.query.calculate.UnknownCalculation;
import org.tripquery.query.diagnostics.Diagnostic;
import org.tripquery.query.diagnostics.DiagnosticSink;
import org.tripquery.query.diagnostics.LoggingDiagnosticSink;
import org.tripquery.query.filter.RecordFilter;
import org.tripquery.query.filter.UnknownFilterPolicy;
import org.tripquery.query.filter.UnknownOperationFilter;
import org.tripquery.query.plan.RecordQueryPlan;
import org.tripquery.query.plan.SortDirection;
import org.tripquery.query.plan.SortSpec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Runs a {@link RecordQueryPlan} over trip records.
 *
 * <p>Stages run in a fixed order, each skipped when the plan leaves it out:</p>
 * <ol>
 *   <li>calculate: derived fields are computed onto copies of the records, in plan order</li>
 *   <li>filter: a record survives when every filter accepts it</li>
 *   <li>group and aggregate: see {@link GroupReducer}</li>
 *   <li>order: stable sort on the numeric reading of a field, non-numbers counting as 0</li>
 *   <li>limit: keep the first N rows</li>
 * </ol>
 *
 * <p>Input rows are never modified. Malformed plan content never fails the run; each degradation is
 * reported to the {@link DiagnosticSink} and the documented fallback is used. The pipeline holds no
 * per-run state and may be shared between threads.</p>
 */
public class RecordPipeline {

    private static final Logger logger = LogManager.getLogger(RecordPipeline.class);

    /** The name identifier for this pipeline. */
    public static final String NAME = "record pipeline";
    /** Stage name used when reporting limit diagnostics. */
    public static final String LIMIT_STAGE = "limit";

    private final RecordQueryPlan plan;
    private final UnknownFilterPolicy unknownFilterPolicy;

    public RecordPipeline(RecordQueryPlan plan) {
        this(plan, UnknownFilterPolicy.PASS);
    }

    public RecordPipeline(RecordQueryPlan plan, UnknownFilterPolicy unknownFilterPolicy) {
        if (plan == null) {
            throw new NullPointerException(NAME + " received null plan");
        }
        this.plan = plan;
        this.unknownFilterPolicy = Objects.requireNonNull(unknownFilterPolicy, "unknownFilterPolicy");
    }

    /**
     * Run the plan, reporting diagnostics as log warnings.
     *
     * @see #process(List, DiagnosticSink)
     */
    public List<Row> process(List<Row> input) {
        return process(input, LoggingDiagnosticSink.INSTANCE);
    }

    /**
     * Run the plan over {@code input}.
     *
     * @param input trip records in order
     * @param sink receives data-quality diagnostics
     * @return result rows in order
     * @throws NullPointerException if {@code input} or {@code sink} is null
     */
    public List<Row> process(List<Row> input, DiagnosticSink sink) {
        if (input == null) {
            throw new NullPointerException(NAME + " received null input");
        }
        if (sink == null) {
            throw new NullPointerException(NAME + " received null diagnostic sink");
        }
        logger.debug("Starting with {} records", input.size());
        plan.diagnostics().forEach(sink::report);

        List<Row> rows = calculate(input, sink);
        rows = filter(rows, sink);

        if (plan.hasGrouping()) {
            rows = new GroupReducer(plan.groupBy(), plan.aggregate()).reduce(rows, sink);
            logger.debug("Grouped by [{}] into {} groups", plan.groupBy(), rows.size());
        }

        if (plan.orderBy() != null) {
            rows = order(rows, plan.orderBy());
        }

        if (plan.limit() != null) {
            rows = limit(rows, plan.limit(), sink);
        }

        logger.debug("Final result: {} rows", rows.size());
        return rows;
    }

    private List<Row> calculate(List<Row> input, DiagnosticSink sink) {
        List<FieldCalculation> calculations = plan.calculate();
        if (calculations.isEmpty()) {
            return new ArrayList<>(input);
        }
        for (FieldCalculation calculation : calculations) {
            if (calculation instanceof UnknownCalculation) {
                sink.report(
                    Diagnostic.of(
                        Diagnostic.Code.UNKNOWN_OPERATION,
                        FieldCalculation.STAGE,
                        "Unknown calculate operation: %s (field %s)",
                        calculation.getName(),
                        calculation.getTargetField()
                    )
                );
            }
        }
        logger.debug("Calculating {} derived fields", calculations.size());
        List<Row> result = new ArrayList<>(input.size());
        for (Row record : input) {
            if (record == null) {
                throw new NullPointerException(NAME + " received null record");
            }
            Row row = record;
            for (FieldCalculation calculation : calculations) {
                row = calculation.apply(row, sink);
            }
            result.add(row);
        }
        return result;
    }

    private List<Row> filter(List<Row> rows, DiagnosticSink sink) {
        List<RecordFilter> filters = plan.filters();
        if (filters.isEmpty()) {
            return rows;
        }
        List<Predicate<Row>> predicates = new ArrayList<>(filters.size());
        for (RecordFilter filter : filters) {
            filter.planDiagnostic().ifPresent(sink::report);
            if (filter instanceof UnknownOperationFilter && unknownFilterPolicy == UnknownFilterPolicy.REJECT) {
                predicates.add(row -> false);
            } else {
                predicates.add(filter::test);
            }
        }
        List<Row> result = new ArrayList<>();
        for (Row row : rows) {
            if (acceptsAll(predicates, row)) {
                result.add(row);
            }
        }
        logger.debug("After {} filters: {} records", filters.size(), result.size());
        return result;
    }

    private static boolean acceptsAll(List<Predicate<Row>> predicates, Row row) {
        for (Predicate<Row> predicate : predicates) {
            if (!predicate.test(row)) {
                return false;
            }
        }
        return true;
    }

    private static List<Row> order(List<Row> rows, SortSpec orderBy) {
        String field = orderBy.field();
        // +0.0 folds -0.0 into 0.0 so the two compare equal
        Comparator<Row> comparator = Comparator.comparingDouble(row -> NumericValue.parse(row.get(field)).orElse(0) + 0.0);
        List<Row> sorted = new ArrayList<>(rows);
        sorted.sort(orderBy.direction() == SortDirection.ASC ? comparator : comparator.reversed());
        logger.debug("Sorted by [{}] {}", field, orderBy.direction().getValue());
        return sorted;
    }

    private static List<Row> limit(List<Row> rows, int limit, DiagnosticSink sink) {
        if (limit <= 0) {
            sink.report(Diagnostic.of(Diagnostic.Code.IGNORED_LIMIT, LIMIT_STAGE, "Ignoring non-positive limit %d", limit));
            return rows;
        }
        if (rows.size() <= limit) {
            return rows;
        }
        logger.debug("Limiting to first {} rows", limit);
        return new ArrayList<>(rows.subList(0, limit));
    }

    public RecordQueryPlan getPlan() {
        return plan;
    }

    public UnknownFilterPolicy getUnknownFilterPolicy() {
        return unknownFilterPolicy;
    }
}
