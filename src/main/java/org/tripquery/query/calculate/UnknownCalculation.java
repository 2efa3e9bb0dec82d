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

import java.util.Objects;

/**
 * Placeholder for an operation name outside the supported set. Computes nothing; the record passes
 * through unchanged. The pipeline reports it once per execution.
 */
public final class UnknownCalculation implements FieldCalculation {

    private final String operation;
    private final String targetField;

    public UnknownCalculation(String operation, String targetField) {
        this.operation = operation;
        this.targetField = targetField;
    }

    @Override
    public String getName() {
        return operation;
    }

    @Override
    public String getTargetField() {
        return targetField;
    }

    @Override
    public Row apply(Row row, DiagnosticSink sink) {
        return row;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof UnknownCalculation other
            && Objects.equals(operation, other.operation)
            && Objects.equals(targetField, other.targetField);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operation, targetField);
    }
}
