/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.plan;

import java.util.Map;
import java.util.Optional;

/**
 * Aggregate entry of a record query plan, {@code {"operation": ..., "field": ...}}.
 *
 * @param operationName operation as written in the plan, kept verbatim so an unsupported name can be reported
 * @param field field the reduction reads; unused by {@code count}
 */
public record AggregateSpec(String operationName, String field) {

    public static final String OPERATION_ARG = "operation";
    public static final String FIELD_ARG = "field";

    public AggregateSpec(AggregateOperation operation, String field) {
        this(operation.getValue(), field);
    }

    /**
     * The supported operation this entry names, or empty when the name is unknown.
     */
    public Optional<AggregateOperation> operation() {
        return AggregateOperation.fromString(operationName);
    }

    public static AggregateSpec fromArgs(Map<String, Object> args, PlanArgs reader) {
        if (args == null) {
            throw new IllegalArgumentException("Aggregate entry cannot be null");
        }
        return new AggregateSpec(reader.stringArg(args, OPERATION_ARG), reader.stringArg(args, FIELD_ARG));
    }
}
