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
 * Order entry of a record query plan, {@code {"field": ..., "direction": "asc" | "desc"}}.
 */
public record SortSpec(String field, SortDirection direction) {

    public static final String FIELD_ARG = "field";
    public static final String DIRECTION_ARG = "direction";

    public SortSpec {
        direction = direction == null ? SortDirection.DESC : direction;
    }

    public static SortSpec fromArgs(Map<String, Object> args, PlanArgs reader) {
        if (args == null) {
            throw new IllegalArgumentException("OrderBy entry cannot be null");
        }
        return new SortSpec(reader.stringArg(args, FIELD_ARG), SortDirection.fromString(reader.stringArg(args, DIRECTION_ARG)));
    }
}
