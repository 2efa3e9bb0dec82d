/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.plan;

import org.tripquery.TripQueryTestCase;
import org.tripquery.query.diagnostics.Diagnostic;
import org.tripquery.query.json.QueryJson;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class RollupPlanTests extends TripQueryTestCase {

    public void testFromArgs() {
        RollupPlan plan = QueryJson.parseRollupPlan("""
            {
              "dateRange": {"start": "2023-06-01", "end": "2023-08-31"},
              "aggregateBy": "month",
              "fields": ["trip_count", "peak_hour"],
              "transform": "compare summer months"
            }
            """);

        assertEquals(new DateRange("2023-06-01", "2023-08-31"), plan.dateRange());
        assertEquals(TimeGrain.MONTH, plan.grain());
        assertEquals(List.of("trip_count", "peak_hour"), plan.fields());
        assertFalse(plan.hasUnknownGrain());
    }

    public void testDefaults() {
        RollupPlan plan = RollupPlan.fromArgs(Map.of());

        assertEquals(RollupPlan.empty(), plan);
        assertNull(plan.dateRange());
        assertEquals(TimeGrain.DAY, plan.grain());
        assertTrue(plan.fields().isEmpty());
    }

    public void testUnknownGrainFallsBackToDay() {
        RollupPlan plan = RollupPlan.fromArgs(Map.of("aggregateBy", "fortnight"));

        assertEquals(TimeGrain.DAY, plan.grain());
        assertTrue(plan.hasUnknownGrain());
    }

    public void testMalformedArgumentsReadAsAbsent() {
        RollupPlan plan = RollupPlan.fromArgs(Map.of("dateRange", "2023-04", "aggregateBy", 7, "fields", "trip_count"));

        assertNull(plan.dateRange());
        assertEquals("7", plan.aggregateBy());
        assertTrue(plan.hasUnknownGrain());
        assertTrue(plan.fields().isEmpty());
        assertEquals(3, plan.diagnostics().size());
        for (Diagnostic diagnostic : plan.diagnostics()) {
            assertEquals(Diagnostic.Code.MALFORMED_ARGUMENT, diagnostic.code());
        }
    }

    public void testNumericDateBoundsReadAsText() {
        RollupPlan plan = RollupPlan.fromArgs(Map.of("dateRange", Map.of("start", 2023, "end", "2023-12-31")));

        assertEquals(new DateRange("2023", "2023-12-31"), plan.dateRange());
        assertTrue(plan.dateRange().contains("2023-06-01"));
        assertEquals(1, plan.diagnostics().size());
    }

    public void testDateRangeIsInclusive() {
        DateRange range = new DateRange("2023-06-01", "2023-06-30");

        assertTrue(range.contains("2023-06-01"));
        assertTrue(range.contains("2023-06-30"));
        assertFalse(range.contains("2023-05-31"));
        assertFalse(range.contains("2023-07-01"));
        assertTrue(new DateRange(null, "2023-01-01").contains("2022-12-31"));
        assertTrue(new DateRange("2023-01-01", null).contains("2024-01-01"));
    }

    public void testBucketKeys() {
        LocalDate date = LocalDate.of(2023, 4, 1);

        assertEquals("2023-04-01", TimeGrain.DAY.bucketKey(date));
        assertEquals("2023-W13", TimeGrain.WEEK.bucketKey(date));
        assertEquals("2023-04", TimeGrain.MONTH.bucketKey(date));
        assertEquals("2023-Q2", TimeGrain.QUARTER.bucketKey(date));
        assertEquals("2023", TimeGrain.YEAR.bucketKey(date));
    }

    public void testQuarterBoundaries() {
        assertEquals("2023-Q1", TimeGrain.QUARTER.bucketKey(LocalDate.of(2023, 3, 31)));
        assertEquals("2023-Q3", TimeGrain.QUARTER.bucketKey(LocalDate.of(2023, 7, 1)));
        assertEquals("2023-Q4", TimeGrain.QUARTER.bucketKey(LocalDate.of(2023, 12, 31)));
    }

    public void testIsoWeekYearBoundaries() {
        // Sunday 2023-12-31 closes week 52 of 2023
        assertEquals("2023-W52", TimeGrain.WEEK.bucketKey(LocalDate.of(2023, 12, 31)));
        // Sunday 2023-01-01 belongs to the last week of 2022
        assertEquals("2022-W52", TimeGrain.WEEK.bucketKey(LocalDate.of(2023, 1, 1)));
        assertEquals("2023-W01", TimeGrain.WEEK.bucketKey(LocalDate.of(2023, 1, 2)));
        // Monday 2024-12-30 opens week 1 of 2025
        assertEquals("2025-W01", TimeGrain.WEEK.bucketKey(LocalDate.of(2024, 12, 30)));
        assertEquals("2020-W53", TimeGrain.WEEK.bucketKey(LocalDate.of(2021, 1, 3)));
    }

    public void testGrainFromString() {
        for (TimeGrain grain : TimeGrain.values()) {
            assertEquals(grain, TimeGrain.fromString(grain.getValue()).orElseThrow());
        }
        assertTrue(TimeGrain.fromString("Week").isEmpty());
        assertTrue(TimeGrain.fromString(null).isEmpty());
    }
}
