/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.filter;

import java.util.Locale;

/**
 * What an unrecognised filter operation does to records.
 */
public enum UnknownFilterPolicy {
    /** Keep every record. Compatible with plans written for earlier operation sets. */
    PASS("pass"),
    /** Drop every record. */
    REJECT("reject");

    private final String value;

    UnknownFilterPolicy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static UnknownFilterPolicy fromString(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Unknown filter policy cannot be null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (UnknownFilterPolicy policy : values()) {
            if (policy.value.equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Invalid unknown filter policy: " + name + ". Supported values: pass, reject");
    }
}
