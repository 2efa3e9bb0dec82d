/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.plan;

import org.tripquery.query.diagnostics.Diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Typed, lenient access to the loosely-typed argument maps planners produce.
 *
 * <p>An absent or {@code null} argument reads as absent. A malformed argument never fails the read:
 * a scalar given where text is expected is read in its text form, anything else unusable reads as
 * absent, and either way a {@link Diagnostic.Code#MALFORMED_ARGUMENT} diagnostic is recorded. The plan
 * built from the arguments carries the recorded diagnostics to the stage that runs it.</p>
 *
 * <p>A reader collects diagnostics for one plan and is not thread-safe.</p>
 */
public final class PlanArgs {

    /** Stage name used when reporting argument diagnostics. */
    public static final String STAGE = "plan";

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Diagnostics recorded so far, in read order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Record a malformed-argument diagnostic.
     */
    public void malformed(String format, Object... args) {
        diagnostics.add(Diagnostic.of(Diagnostic.Code.MALFORMED_ARGUMENT, STAGE, format, args));
    }

    /**
     * Read a string argument. Numbers and booleans are read as their text.
     *
     * @return the string, or {@code null} when absent or unusable
     */
    public String stringArg(Map<String, Object> args, String name) {
        Object value = args.get(name);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        if (value instanceof Number || value instanceof Boolean) {
            malformed("Invalid type for '%s' argument. Expected String, but got %s; using \"%s\"", name, typeName(value), value);
            return value.toString();
        }
        malformed("Invalid type for '%s' argument. Expected String, but got %s; ignored", name, typeName(value));
        return null;
    }

    /**
     * Read an object argument.
     *
     * @return the object's entries, or {@code null} when absent or not an object
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> mapArg(Map<String, Object> args, String name) {
        Object value = args.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        malformed("Invalid type for '%s' argument. Expected object, but got %s; ignored", name, typeName(value));
        return null;
    }

    /**
     * Read a list-of-objects argument. Entries that are not objects are skipped.
     *
     * @return the object entries in order, empty when absent or not a list
     */
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> mapListArg(Map<String, Object> args, String name) {
        Object value = args.get(name);
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List<?> list)) {
            malformed("Invalid type for '%s' argument. Expected list, but got %s; ignored", name, typeName(value));
            return Collections.emptyList();
        }
        List<Map<String, Object>> entries = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            Object entry = list.get(i);
            if (entry instanceof Map<?, ?> map) {
                entries.add((Map<String, Object>) map);
            } else {
                malformed("Invalid entry %s[%d]. Expected object, but got %s; skipped", name, i, typeName(entry));
            }
        }
        return entries;
    }

    /**
     * Read a list-of-strings argument. Non-string entries are kept in their text form, null entries dropped.
     *
     * @return the entries in order, empty when absent or not a list
     */
    public List<String> stringListArg(Map<String, Object> args, String name) {
        Object value = args.get(name);
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List<?> list)) {
            malformed("Invalid type for '%s' argument. Expected list, but got %s; ignored", name, typeName(value));
            return Collections.emptyList();
        }
        List<String> entries = new ArrayList<>(list.size());
        for (Object entry : list) {
            if (entry != null) {
                entries.add(entry.toString());
            }
        }
        return entries;
    }

    /**
     * Read an integer argument given as a number or a numeric string. Fractions are truncated and
     * values beyond the int range are clamped to it.
     *
     * @return the integer, or {@code null} when absent or not numeric
     */
    public Integer intArg(Map<String, Object> args, String name) {
        Object value = args.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            if (Double.isNaN(number.doubleValue())) {
                malformed("Invalid value for '%s' argument: NaN; ignored", name);
                return null;
            }
            return clamp(number);
        }
        if (value instanceof String text) {
            try {
                return clamp(Double.parseDouble(text.trim()));
            } catch (NumberFormatException e) {
                malformed("Invalid value for '%s' argument. Expected integer, but got \"%s\"; ignored", name, text);
                return null;
            }
        }
        malformed("Invalid type for '%s' argument. Expected Number or String, but got %s; ignored", name, typeName(value));
        return null;
    }

    private static int clamp(Number number) {
        if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, number.longValue()));
        }
        // the double-to-int cast saturates, which longValue() on a BigInteger would not
        return (int) number.doubleValue();
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
