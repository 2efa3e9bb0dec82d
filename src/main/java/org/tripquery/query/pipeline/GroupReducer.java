/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.pipeline;

import org.tripquery.core.model.Row;
import org.tripquery.core.utils.FieldValues;
import org.tripquery.core.utils.NumericValue;
import org.tripquery.query.diagnostics.Diagnostic;
import org.tripquery.query.diagnostics.DiagnosticSink;
import org.tripquery.query.plan.AggregateOperation;
import org.tripquery.query.plan.AggregateSpec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Group and aggregate stage of the record pipeline.
 *
 * <p>Rows are partitioned by the text form of the group field; a row without the field joins the
 * {@code "undefined"} group. Groups are emitted in order of first occurrence, one row per group:</p>
 * <ul>
 *   <li>no aggregate: {@code {<groupBy>: key, count: n}}</li>
 *   <li>aggregate: {@code {<groupBy>: key, <operation>: value}}</li>
 *   <li>unknown aggregate operation: {@code {<groupBy>: key}}</li>
 * </ul>
 *
 * <p>{@code sum} and {@code avg} count a non-numeric value as 0; {@code min} and {@code max} count it as
 * {@code +Infinity} and {@code -Infinity}, so a group without any numeric value yields that sentinel.</p>
 */
public final class GroupReducer {

    /** Stage name used when reporting diagnostics. */
    public static final String STAGE = "aggregate";
    /** Output field of the member count. */
    public static final String COUNT_FIELD = "count";

    private final String groupBy;
    private final AggregateSpec aggregate;

    /**
     * @param groupBy field to group on
     * @param aggregate reduction per group, or {@code null} to emit member counts
     */
    public GroupReducer(String groupBy, AggregateSpec aggregate) {
        this.groupBy = Objects.requireNonNull(groupBy, "groupBy");
        this.aggregate = aggregate;
    }

    /**
     * Reduce rows to one row per group.
     *
     * @param rows the rows to group, in order
     * @param sink receives a diagnostic for an unknown aggregate operation
     * @return one row per group, in order of first occurrence
     */
    public List<Row> reduce(List<Row> rows, DiagnosticSink sink) {
        Map<String, List<Row>> groups = new LinkedHashMap<>();
        for (Row row : rows) {
            String key = FieldValues.stringify(row.get(groupBy), row.has(groupBy));
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }

        Optional<AggregateOperation> operation = aggregate == null ? Optional.empty() : aggregate.operation();
        if (aggregate != null && operation.isEmpty()) {
            sink.report(
                Diagnostic.of(Diagnostic.Code.UNKNOWN_OPERATION, STAGE, "Unknown aggregate operation: %s", aggregate.operationName())
            );
        }

        List<Row> result = new ArrayList<>(groups.size());
        for (Map.Entry<String, List<Row>> group : groups.entrySet()) {
            Row.Builder builder = Row.builder().put(groupBy, group.getKey());
            List<Row> members = group.getValue();
            if (aggregate == null) {
                builder.put(COUNT_FIELD, (long) members.size());
            } else if (operation.isPresent()) {
                builder.put(operation.get().getValue(), apply(operation.get(), members));
            }
            result.add(builder.build());
        }
        return result;
    }

    private Number apply(AggregateOperation operation, List<Row> members) {
        String field = aggregate.field();
        return switch (operation) {
            case COUNT -> (long) members.size();
            case SUM -> FieldValues.normalize(sum(members, field));
            case AVG -> FieldValues.normalize(FieldValues.roundHalfAwayFromZero(sum(members, field) / members.size()));
            case MIN -> {
                double min = Double.POSITIVE_INFINITY;
                for (Row member : members) {
                    min = Math.min(min, NumericValue.parse(member.get(field)).orElse(Double.POSITIVE_INFINITY));
                }
                yield FieldValues.normalize(min);
            }
            case MAX -> {
                double max = Double.NEGATIVE_INFINITY;
                for (Row member : members) {
                    max = Math.max(max, NumericValue.parse(member.get(field)).orElse(Double.NEGATIVE_INFINITY));
                }
                yield FieldValues.normalize(max);
            }
        };
    }

    private static double sum(List<Row> members, String field) {
        double sum = 0;
        for (Row member : members) {
            sum += NumericValue.parse(member.get(field)).orElse(0);
        }
        return sum;
    }

    public String getGroupBy() {
        return groupBy;
    }

    public AggregateSpec getAggregate() {
        return aggregate;
    }
}
