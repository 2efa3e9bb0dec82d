/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Merge of every {@link DailySummary} that falls into one period of a time grain.
 *
 * @param period bucket key, e.g. {@code 2023-04-01}, {@code 2023-W13}, {@code 2023-04}, {@code 2023-Q2}, {@code 2023}
 * @param boundingBox envelope of the member boxes, {@code null} when no member carried one
 */
public record PeriodBucket(
    String period,
    long tripCount,
    long memberTrips,
    long casualTrips,
    long classicBikes,
    long electricBikes,
    List<Long> hourlyDistribution,
    int peakHour,
    List<StationCount> topStartStations,
    List<StationCount> topEndStations,
    List<RouteCount> topRoutes,
    BoundingBox boundingBox
) {

    public static final String PERIOD = "period";
    public static final String TRIP_COUNT = "trip_count";
    public static final String MEMBER_TRIPS = "member_trips";
    public static final String CASUAL_TRIPS = "casual_trips";
    public static final String CLASSIC_BIKES = "classic_bikes";
    public static final String ELECTRIC_BIKES = "electric_bikes";
    public static final String HOURLY_DISTRIBUTION = "hourly_distribution";
    public static final String PEAK_HOUR = "peak_hour";
    public static final String TOP_START_STATIONS = "top_start_stations";
    public static final String TOP_END_STATIONS = "top_end_stations";
    public static final String TOP_ROUTES = "top_routes";
    public static final String BOUNDING_BOX = "bounding_box";

    public PeriodBucket {
        hourlyDistribution = List.copyOf(hourlyDistribution);
        topStartStations = List.copyOf(topStartStations);
        topEndStations = List.copyOf(topEndStations);
        topRoutes = List.copyOf(topRoutes);
    }

    /**
     * Full row form of the bucket. Nested values are plain lists and maps so the row serializes
     * without knowledge of the model types. {@code bounding_box} is omitted when the bucket has none.
     *
     * @return the bucket as a row, {@code period} first
     */
    public Row toRow() {
        Row.Builder builder = Row.builder()
            .put(PERIOD, period)
            .put(TRIP_COUNT, tripCount)
            .put(MEMBER_TRIPS, memberTrips)
            .put(CASUAL_TRIPS, casualTrips)
            .put(CLASSIC_BIKES, classicBikes)
            .put(ELECTRIC_BIKES, electricBikes)
            .put(HOURLY_DISTRIBUTION, hourlyDistribution)
            .put(PEAK_HOUR, peakHour)
            .put(TOP_START_STATIONS, stationMaps(topStartStations))
            .put(TOP_END_STATIONS, stationMaps(topEndStations))
            .put(TOP_ROUTES, routeMaps(topRoutes));
        if (boundingBox != null) {
            builder.put(BOUNDING_BOX, boundingBox.toMap());
        }
        return builder.build();
    }

    private static List<Map<String, Object>> stationMaps(List<StationCount> stations) {
        List<Map<String, Object>> maps = new ArrayList<>(stations.size());
        for (StationCount station : stations) {
            maps.add(station.toMap());
        }
        return maps;
    }

    private static List<Map<String, Object>> routeMaps(List<RouteCount> routes) {
        List<Map<String, Object>> maps = new ArrayList<>(routes.size());
        for (RouteCount route : routes) {
            maps.add(route.toMap());
        }
        return maps;
    }
}
