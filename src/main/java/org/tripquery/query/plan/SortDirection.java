/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.plan;

/**
 * Direction of the order stage.
 */
public enum SortDirection {
    ASC("asc"),
    DESC("desc");

    private final String value;

    SortDirection(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Only {@code "asc"} sorts ascending; any other value, including none, sorts descending.
     */
    public static SortDirection fromString(String name) {
        return "asc".equals(name) ? ASC : DESC;
    }
}
