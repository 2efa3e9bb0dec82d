/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Trips per vehicle category for one day.
 */
public record BikeTypeCounts(@JsonProperty("classic") long classic, @JsonProperty("electric") long electric) {

    public static final BikeTypeCounts ZERO = new BikeTypeCounts(0, 0);
}
