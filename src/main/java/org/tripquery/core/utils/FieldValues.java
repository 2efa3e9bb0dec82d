/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.core.utils;

import java.util.Iterator;
import java.util.Objects;

/**
 * Value semantics shared by the record pipeline stages: how a loosely-typed field value is turned into
 * text, compared for equality or order, and how computed numbers are rounded and emitted.
 */
public final class FieldValues {

    /** Text standing in for a field that is absent from a row. */
    public static final String MISSING_PLACEHOLDER = "undefined";

    private static final double MAX_EXACT_LONG = 9.007199254740992E15;

    private FieldValues() {
        // Utility class - prevent instantiation
    }

    /**
     * Text form of a field value. Integral doubles print without a fraction ({@code 5.0 -> "5"}),
     * lists print their elements joined by commas, {@code null} prints as {@code "null"}.
     *
     * @param value the value, may be null
     * @return the text form
     */
    public static String stringify(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d)) {
                return "NaN";
            }
            if (Double.isInfinite(d)) {
                return d > 0 ? "Infinity" : "-Infinity";
            }
            if (d == Math.rint(d) && Math.abs(d) < MAX_EXACT_LONG) {
                return Long.toString((long) d);
            }
            return Double.toString(d);
        }
        if (value instanceof Iterable<?> iterable) {
            StringBuilder sb = new StringBuilder();
            Iterator<?> it = iterable.iterator();
            while (it.hasNext()) {
                Object element = it.next();
                sb.append(element == null ? "" : stringify(element));
                if (it.hasNext()) {
                    sb.append(',');
                }
            }
            return sb.toString();
        }
        return value.toString();
    }

    /**
     * Text form of a field that may be absent.
     *
     * @param value the field value
     * @param present whether the field exists on the row
     * @return {@link #MISSING_PLACEHOLDER} for an absent field, otherwise {@link #stringify(Object)}
     */
    public static String stringify(Object value, boolean present) {
        return present ? stringify(value) : MISSING_PLACEHOLDER;
    }

    /**
     * Type-sensitive equality. Two numbers are equal when numerically equal, whatever their boxed
     * type; any other pair must be equal values of the same type. A string never equals a number.
     */
    public static boolean strictEquals(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return l.doubleValue() == r.doubleValue();
        }
        return Objects.equals(left, right);
    }

    /**
     * Ordering of two raw field values: numeric when both are numbers, lexicographic when both are
     * strings. Any other combination, including a missing value, is unordered.
     *
     * @return negative, zero or positive as for {@link Comparable}, or {@code null} when unordered
     */
    public static Integer compare(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            double a = l.doubleValue();
            double b = r.doubleValue();
            if (Double.isNaN(a) || Double.isNaN(b)) {
                return null;
            }
            return Double.compare(a + 0.0, b + 0.0);
        }
        if (left instanceof String l && right instanceof String r) {
            return l.compareTo(r);
        }
        return null;
    }

    /**
     * Round to the nearest integer, halves away from zero ({@code 15.5 -> 16}, {@code -15.5 -> -16}).
     * NaN and infinities are returned unchanged.
     */
    public static double roundHalfAwayFromZero(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return Math.signum(value) * Math.floor(Math.abs(value) + 0.5);
    }

    /**
     * Boxed form of a computed number for output rows: a {@link Long} when the value is integral and
     * exactly representable, otherwise the {@link Double} itself (including NaN and infinite sentinels).
     */
    public static Number normalize(double value) {
        if (!Double.isNaN(value) && !Double.isInfinite(value) && value == Math.rint(value) && Math.abs(value) < MAX_EXACT_LONG) {
            return (long) value;
        }
        return value;
    }
}
