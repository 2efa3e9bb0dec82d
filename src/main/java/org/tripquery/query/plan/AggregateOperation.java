/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.plan;

import java.util.Optional;

/**
 * Reductions a group can be collapsed with. The output field of an aggregated group row is named after
 * the operation, e.g. {@code {"start_station_name": "A", "avg": 12}}.
 */
public enum AggregateOperation {
    COUNT("count"),
    SUM("sum"),
    AVG("avg"),
    MIN("min"),
    MAX("max");

    private final String value;

    AggregateOperation(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Look up an operation by its plan name.
     *
     * @param name operation name, may be null
     * @return the operation, or empty when the name is not supported
     */
    public static Optional<AggregateOperation> fromString(String name) {
        for (AggregateOperation operation : values()) {
            if (operation.value.equals(name)) {
                return Optional.of(operation);
            }
        }
        return Optional.empty();
    }
}
