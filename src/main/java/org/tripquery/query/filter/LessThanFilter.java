/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.filter;

import org.tripquery.core.model.Row;
import org.tripquery.core.utils.FieldValues;

import java.util.Objects;

/**
 * Keeps records whose field orders strictly before the value. Same ordering rules as {@link GreaterThanFilter}.
 */
public final class LessThanFilter implements RecordFilter {

    /** The name identifier for this operation. */
    public static final String NAME = "less_than";

    private final String field;
    private final Object value;

    public LessThanFilter(String field, Object value) {
        this.field = field;
        this.value = value;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getField() {
        return field;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public boolean test(Row row) {
        Integer order = FieldValues.compare(row.get(field), value);
        return order != null && order < 0;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof LessThanFilter other && Objects.equals(field, other.field) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NAME, field, value);
    }
}
