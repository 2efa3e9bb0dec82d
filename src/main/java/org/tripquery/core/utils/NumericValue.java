/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.core.utils;

import java.util.regex.Pattern;

/**
 * Result of reading a loosely-typed field value as a number.
 *
 * <p>Parsing never fails: a value that has no numeric reading yields {@link #NOT_A_NUMBER}, which is
 * distinct from zero. Callers decide what a non-number stands for through {@link #orElse(double)}:
 * sums and sort keys substitute {@code 0}, minimum and maximum substitute an infinite sentinel.</p>
 *
 * <p>Readings: numbers as themselves (a {@code NaN} number is not a number), booleans as 1 and 0,
 * strings holding a decimal literal as that literal. {@code null}, blank strings, and every other
 * type are not numbers.</p>
 */
public final class NumericValue {

    /** Marker for a value with no numeric reading. */
    public static final NumericValue NOT_A_NUMBER = new NumericValue(Double.NaN, false);

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?|[+-]?Infinity");

    private final double value;
    private final boolean number;

    private NumericValue(double value, boolean number) {
        this.value = value;
        this.number = number;
    }

    public static NumericValue of(double value) {
        return Double.isNaN(value) ? NOT_A_NUMBER : new NumericValue(value, true);
    }

    /**
     * Read a field value as a number.
     *
     * @param raw the field value, may be null
     * @return the numeric reading, or {@link #NOT_A_NUMBER}
     */
    public static NumericValue parse(Object raw) {
        if (raw instanceof Number n) {
            return of(n.doubleValue());
        }
        if (raw instanceof Boolean b) {
            return of(b ? 1.0 : 0.0);
        }
        if (raw instanceof String s) {
            String text = s.trim();
            if (text.isEmpty() || !DECIMAL.matcher(text).matches()) {
                return NOT_A_NUMBER;
            }
            return of(Double.parseDouble(text));
        }
        return NOT_A_NUMBER;
    }

    public boolean isNumber() {
        return number;
    }

    /**
     * The numeric value, or {@code fallback} when this is {@link #NOT_A_NUMBER}.
     */
    public double orElse(double fallback) {
        return number ? value : fallback;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        NumericValue other = (NumericValue) obj;
        return number == other.number && (!number || Double.compare(value, other.value) == 0);
    }

    @Override
    public int hashCode() {
        return number ? Double.hashCode(value) : 0;
    }

    @Override
    public String toString() {
        return number ? Double.toString(value) : "NaN";
    }
}
