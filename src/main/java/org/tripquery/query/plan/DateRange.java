/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.plan;

import java.util.Map;

/**
 * Inclusive range of ISO dates, compared lexically. Either bound may be {@code null}, leaving that side open.
 * Bounds are not validated: a malformed bound compares lexically like any other string.
 */
public record DateRange(String start, String end) {

    public static final String START_ARG = "start";
    public static final String END_ARG = "end";

    public boolean contains(String date) {
        return (start == null || date.compareTo(start) >= 0) && (end == null || date.compareTo(end) <= 0);
    }

    public static DateRange fromArgs(Map<String, Object> args, PlanArgs reader) {
        if (args == null) {
            throw new IllegalArgumentException("Date range cannot be null");
        }
        return new DateRange(reader.stringArg(args, START_ARG), reader.stringArg(args, END_ARG));
    }
}
