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
 * Keeps records whose field strictly equals the value. A record without the field never matches.
 *
 * @see FieldValues#strictEquals(Object, Object)
 */
public final class EqualsFilter implements RecordFilter {

    /** The name identifier for this operation. */
    public static final String NAME = "equals";

    private final String field;
    private final Object value;

    public EqualsFilter(String field, Object value) {
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
        return row.has(field) && FieldValues.strictEquals(row.get(field), value);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof EqualsFilter other && Objects.equals(field, other.field) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NAME, field, value);
    }
}
