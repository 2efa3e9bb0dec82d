/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable, ordered set of named field values.
 *
 * <p>Rows are the unit flowing through both query paths: input trip records are read as rows, derived
 * fields are added by copying a row, and result rows are handed to the caller for serialization. Field
 * order is insertion order and is preserved on copy, so serialized output keeps the order fields were
 * produced in.</p>
 *
 * <p>A field can be present with a {@code null} value; {@link #has(String)} distinguishes that from an
 * absent field.</p>
 */
public final class Row {

    private static final Row EMPTY = new Row(Collections.emptyMap());

    private final Map<String, Object> fields;

    private Row(Map<String, Object> fields) {
        this.fields = fields;
    }

    /**
     * Create a row holding a copy of the given fields.
     *
     * @param fields field values in the order they should appear
     * @return a new row
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Row of(Map<String, ?> fields) {
        if (fields == null) {
            throw new NullPointerException("Row fields cannot be null");
        }
        if (fields.isEmpty()) {
            return EMPTY;
        }
        return new Row(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    /**
     * Create a row from alternating field names and values.
     *
     * @param namesAndValues name, value, name, value ...
     * @return a new row
     */
    public static Row of(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs, got " + namesAndValues.length + " arguments");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            map.put((String) namesAndValues[i], namesAndValues[i + 1]);
        }
        return of(map);
    }

    public static Row empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Value of a field, or {@code null} when the field is absent or null.
     */
    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    /**
     * Copy-on-write update: returns a new row with the field set, leaving this row untouched.
     * An existing field keeps its position; a new field is appended.
     *
     * @param field field name
     * @param value field value
     * @return the updated copy
     */
    public Row with(String field, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(field, value);
        return new Row(Collections.unmodifiableMap(copy));
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public int size() {
        return fields.size();
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return fields;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return fields.equals(((Row) obj).fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "Row" + fields;
    }

    /**
     * Accumulates fields in order before freezing them into a {@link Row}.
     */
    public static final class Builder {
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String field, Object value) {
            fields.put(field, value);
            return this;
        }

        public Builder putAll(Row row) {
            fields.putAll(row.fields);
            return this;
        }

        public Row build() {
            return Row.of(fields);
        }
    }
}
