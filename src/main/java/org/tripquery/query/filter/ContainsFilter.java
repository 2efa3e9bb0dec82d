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

import java.util.Locale;
import java.util.Objects;

/**
 * Case-insensitive substring match on the text form of the field.
 */
public final class ContainsFilter implements RecordFilter {

    /** The name identifier for this operation. */
    public static final String NAME = "contains";

    private final String field;
    private final String needle;

    public ContainsFilter(String field, Object value) {
        this.field = field;
        this.needle = FieldValues.stringify(value).toLowerCase(Locale.ROOT);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getField() {
        return field;
    }

    /**
     * The lower-cased text searched for.
     */
    public String getNeedle() {
        return needle;
    }

    @Override
    public boolean test(Row row) {
        String haystack = FieldValues.stringify(row.get(field), row.has(field));
        return haystack.toLowerCase(Locale.ROOT).contains(needle);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ContainsFilter other && Objects.equals(field, other.field) && needle.equals(other.needle);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NAME, field, needle);
    }
}
