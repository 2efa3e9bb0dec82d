/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.rollup;

import org.tripquery.core.model.BoundingBox;
import org.tripquery.core.model.DailySummary;
import org.tripquery.core.model.PeriodBucket;
import org.tripquery.core.model.RouteCount;
import org.tripquery.core.model.StationCount;
import org.tripquery.query.diagnostics.Diagnostic;
import org.tripquery.query.diagnostics.DiagnosticSink;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Merges the daily summaries of one period into a {@link PeriodBucket}.
 *
 * <ul>
 *   <li>trip, rider and bike-type counts are summed</li>
 *   <li>hourly distributions are summed hour by hour; the peak hour is the first hour holding the maximum</li>
 *   <li>station and route lists are summed per station or route, then ranked and cut to {@code topK}</li>
 *   <li>bounding boxes are joined into the smallest enclosing box</li>
 * </ul>
 *
 * <p>Each day only lists its own top stations and routes, so a merged total undercounts any station or
 * route that fell outside a day's list.</p>
 */
public final class BucketMerger {

    /** Stage name used when reporting diagnostics. */
    public static final String STAGE = "rollup.merge";

    private final int topK;

    public BucketMerger(int topK) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive, got: " + topK);
        }
        this.topK = topK;
    }

    /**
     * Merge the members of one bucket.
     *
     * @param period the bucket key
     * @param members the bucket's daily summaries, in date order; must not be empty
     * @param sink receives a diagnostic for each member missing its bounding box or a full hourly distribution
     * @return the merged bucket
     */
    public PeriodBucket merge(String period, List<DailySummary> members, DiagnosticSink sink) {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("Bucket " + period + " has no members");
        }
        long tripCount = 0;
        long memberTrips = 0;
        long casualTrips = 0;
        long classicBikes = 0;
        long electricBikes = 0;
        long[] hourly = new long[DailySummary.HOURS_PER_DAY];
        TopKAccumulator<String> startStations = new TopKAccumulator<>();
        TopKAccumulator<String> endStations = new TopKAccumulator<>();
        TopKAccumulator<RouteKey> routes = new TopKAccumulator<>();
        BoundingBox boundingBox = null;

        for (DailySummary day : members) {
            tripCount += day.tripCount();
            memberTrips += day.memberTrips();
            casualTrips += day.casualTrips();
            classicBikes += day.bikeTypes().classic();
            electricBikes += day.bikeTypes().electric();
            addHourly(hourly, day.hourlyDistribution(), period, sink);
            for (StationCount station : day.topStartStations()) {
                if (station != null) {
                    startStations.add(station.name(), station.count());
                }
            }
            for (StationCount station : day.topEndStations()) {
                if (station != null) {
                    endStations.add(station.name(), station.count());
                }
            }
            for (RouteCount route : day.topRoutes()) {
                if (route != null) {
                    routes.add(new RouteKey(route.from(), route.to()), route.count());
                }
            }
            if (day.boundingBox() == null) {
                sink.report(Diagnostic.of(Diagnostic.Code.MISSING_VALUE, STAGE, "%s: member without bounding_box skipped", period));
            } else {
                boundingBox = boundingBox == null ? day.boundingBox() : boundingBox.union(day.boundingBox());
            }
        }

        List<Long> hourlyDistribution = new ArrayList<>(hourly.length);
        for (long count : hourly) {
            hourlyDistribution.add(count);
        }
        return new PeriodBucket(
            period,
            tripCount,
            memberTrips,
            casualTrips,
            classicBikes,
            electricBikes,
            hourlyDistribution,
            peakHour(hourly),
            stations(startStations),
            stations(endStations),
            routes(routes),
            boundingBox
        );
    }

    private static void addHourly(long[] hourly, List<Long> distribution, String period, DiagnosticSink sink) {
        if (distribution.size() != hourly.length) {
            sink.report(
                Diagnostic.of(
                    Diagnostic.Code.MISSING_VALUE,
                    STAGE,
                    "%s: expected %d hourly counts, got %d",
                    period,
                    hourly.length,
                    distribution.size()
                )
            );
        }
        int hours = Math.min(hourly.length, distribution.size());
        for (int hour = 0; hour < hours; hour++) {
            Long count = distribution.get(hour);
            if (count != null) {
                hourly[hour] += count;
            }
        }
    }

    /**
     * Index of the first maximum.
     */
    static int peakHour(long[] hourly) {
        int peak = 0;
        for (int hour = 1; hour < hourly.length; hour++) {
            if (hourly[hour] > hourly[peak]) {
                peak = hour;
            }
        }
        return peak;
    }

    private List<StationCount> stations(TopKAccumulator<String> accumulator) {
        List<StationCount> result = new ArrayList<>();
        for (Map.Entry<String, Long> entry : accumulator.top(topK)) {
            result.add(new StationCount(entry.getKey(), entry.getValue()));
        }
        return result;
    }

    private List<RouteCount> routes(TopKAccumulator<RouteKey> accumulator) {
        List<RouteCount> result = new ArrayList<>();
        for (Map.Entry<RouteKey, Long> entry : accumulator.top(topK)) {
            result.add(new RouteCount(entry.getKey().from(), entry.getKey().to(), entry.getValue()));
        }
        return result;
    }

    public int getTopK() {
        return topK;
    }

    private record RouteKey(String from, String to) {}
}
