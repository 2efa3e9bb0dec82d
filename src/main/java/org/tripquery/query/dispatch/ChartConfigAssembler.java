/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.dispatch;

import org.tripquery.core.model.Row;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Places result rows into a planner-supplied chart descriptor. The descriptor is otherwise opaque.
 */
public final class ChartConfigAssembler {

    /** Field of the chart descriptor that holds the rows. */
    public static final String DATA_FIELD = "data";

    private ChartConfigAssembler() {
        // Utility class - prevent instantiation
    }

    /**
     * Copy of {@code chartConfig} with {@code data} set to {@code rows}, replacing any data the planner
     * put there. The given descriptor is not modified.
     */
    public static Map<String, Object> withData(Map<String, Object> chartConfig, List<Row> rows) {
        Map<String, Object> assembled = chartConfig == null ? new LinkedHashMap<>() : new LinkedHashMap<>(chartConfig);
        assembled.put(DATA_FIELD, rows);
        return assembled;
    }
}
