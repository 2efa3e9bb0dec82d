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
 * Keeps records whose field orders strictly after the value. Numbers compare numerically, strings
 * lexicographically; a missing field or a number/string mix never matches.
 */
public final class GreaterThanFilter implements RecordFilter {

    /** The name identifier for this operation. */
    public static final String NAME = "greater_than";

    private final String field;
    private final Object value;

    public GreaterThanFilter(String field, Object value) {
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
        return order != null && order > 0;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof GreaterThanFilter other && Objects.equals(field, other.field) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NAME, field, value);
    }
}
