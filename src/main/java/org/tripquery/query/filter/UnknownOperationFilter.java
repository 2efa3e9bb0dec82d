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

import java.util.Objects;
import java.util.Optional;

/**
 * Filter with an operation name outside the supported set.
 *
 * <p>Fails open: every record passes, and the pipeline reports the unknown operation once per
 * execution. Executions configured with the {@code reject} policy replace it with a predicate that
 * rejects every record.</p>
 */
public final class UnknownOperationFilter implements RecordFilter {

    private final String operation;
    private final String field;

    public UnknownOperationFilter(String operation, String field) {
        this.operation = operation;
        this.field = field;
    }

    @Override
    public String getName() {
        return operation;
    }

    @Override
    public String getField() {
        return field;
    }

    @Override
    public boolean test(Row row) {
        return true;
    }

    @Override
    public Optional<Diagnostic> planDiagnostic() {
        return Optional.of(
            Diagnostic.of(Diagnostic.Code.UNKNOWN_OPERATION, STAGE, "Unknown filter operation: %s (field %s)", operation, field)
        );
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof UnknownOperationFilter other
            && Objects.equals(operation, other.operation)
            && Objects.equals(field, other.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operation, field);
    }
}
