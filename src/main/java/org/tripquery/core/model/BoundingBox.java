/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Geographic envelope of the coordinates observed in a period.
 */
public record BoundingBox(
    @JsonProperty("north") double north,
    @JsonProperty("south") double south,
    @JsonProperty("east") double east,
    @JsonProperty("west") double west
) {

    /**
     * Smallest box containing both this box and {@code other}.
     *
     * @param other the box to include
     * @return the enclosing box
     */
    public BoundingBox union(BoundingBox other) {
        return new BoundingBox(
            Math.max(north, other.north),
            Math.min(south, other.south),
            Math.max(east, other.east),
            Math.min(west, other.west)
        );
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("north", north);
        map.put("south", south);
        map.put("east", east);
        map.put("west", west);
        return map;
    }
}
