/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pre-aggregated summary of one day of trips, as stored in the rollup index under its ISO date.
 *
 * <p>{@code hourlyDistribution} is expected to hold 24 counts summing to {@code tripCount}; this is not
 * re-verified. The top lists hold at most ten entries each, in descending count order. Absent lists are
 * normalized to empty lists and absent bike-type counts to zero; an absent bounding box stays {@code null}.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DailySummary(
    @JsonProperty("trip_count") long tripCount,
    @JsonProperty("member_trips") long memberTrips,
    @JsonProperty("casual_trips") long casualTrips,
    @JsonProperty("bike_types") BikeTypeCounts bikeTypes,
    @JsonProperty("peak_hour") int peakHour,
    @JsonProperty("hourly_distribution") List<Long> hourlyDistribution,
    @JsonProperty("top_start_stations") List<StationCount> topStartStations,
    @JsonProperty("top_end_stations") List<StationCount> topEndStations,
    @JsonProperty("top_routes") List<RouteCount> topRoutes,
    @JsonProperty("bounding_box") BoundingBox boundingBox
) {

    /** Number of hourly buckets in a day. */
    public static final int HOURS_PER_DAY = 24;

    public DailySummary {
        bikeTypes = bikeTypes == null ? BikeTypeCounts.ZERO : bikeTypes;
        hourlyDistribution = frozen(hourlyDistribution);
        topStartStations = frozen(topStartStations);
        topEndStations = frozen(topEndStations);
        topRoutes = frozen(topRoutes);
    }

    // List.copyOf rejects null elements, which loosely-typed input may contain
    private static <T> List<T> frozen(List<T> list) {
        return list == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(list));
    }
}
