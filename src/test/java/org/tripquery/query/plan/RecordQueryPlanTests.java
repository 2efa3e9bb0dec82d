/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.plan;

import org.tripquery.TripQueryTestCase;
import org.tripquery.query.calculate.HourOfDayCalculation;
import org.tripquery.query.diagnostics.Diagnostic;
import org.tripquery.query.filter.HourBetweenFilter;
import org.tripquery.query.json.QueryJson;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class RecordQueryPlanTests extends TripQueryTestCase {

    private static final String AFTERNOON_STATIONS = """
        {
          "calculate": [{"name": "hour", "operation": "hour_of_day"}],
          "filters": [{"field": "hour", "operation": "hour_between", "value": [12, 18]}],
          "groupBy": "start_station_name",
          "aggregate": {"operation": "count", "field": "*"},
          "orderBy": {"field": "count", "direction": "desc"},
          "limit": 10
        }
        """;

    public void testFromArgsReadsEveryStage() {
        RecordQueryPlan plan = QueryJson.parseQueryPlan(AFTERNOON_STATIONS);

        assertEquals(List.of(new HourOfDayCalculation("hour")), plan.calculate());
        assertEquals(List.of(new HourBetweenFilter("hour", 12, 18)), plan.filters());
        assertEquals("start_station_name", plan.groupBy());
        assertEquals(AggregateOperation.COUNT, plan.aggregate().operation().orElseThrow());
        assertEquals("*", plan.aggregate().field());
        assertEquals(new SortSpec("count", SortDirection.DESC), plan.orderBy());
        assertEquals(Integer.valueOf(10), plan.limit());
        assertTrue(plan.hasGrouping());
    }

    public void testEmptyPlan() {
        RecordQueryPlan plan = RecordQueryPlan.fromArgs(Map.of());

        assertEquals(RecordQueryPlan.empty(), plan);
        assertTrue(plan.calculate().isEmpty());
        assertTrue(plan.filters().isEmpty());
        assertFalse(plan.hasGrouping());
        assertNull(plan.aggregate());
        assertNull(plan.orderBy());
        assertNull(plan.limit());
    }

    public void testBlankGroupByMeansNoGrouping() {
        assertFalse(RecordQueryPlan.fromArgs(Map.of("groupBy", "")).hasGrouping());
    }

    public void testLimitAsNumericString() {
        assertEquals(Integer.valueOf(5), RecordQueryPlan.fromArgs(Map.of("limit", "5")).limit());
    }

    public void testWrongStageShapesReadAsAbsent() {
        assertMalformed(RecordQueryPlan.fromArgs(Map.of("filters", "hour > 12")), RecordQueryPlan.empty());
        assertMalformed(RecordQueryPlan.fromArgs(Map.of("calculate", List.of("hour"))), RecordQueryPlan.empty());
        assertMalformed(RecordQueryPlan.fromArgs(Map.of("groupBy", List.of("a"))), RecordQueryPlan.empty());
        assertMalformed(RecordQueryPlan.fromArgs(Map.of("aggregate", "count")), RecordQueryPlan.empty());
        assertMalformed(RecordQueryPlan.fromArgs(Map.of("orderBy", 3)), RecordQueryPlan.empty());
        assertThrows(IllegalArgumentException.class, () -> RecordQueryPlan.fromArgs(null));
    }

    public void testScalarsReadAsText() {
        RecordQueryPlan plan = RecordQueryPlan.fromArgs(
            Map.of("groupBy", 5, "aggregate", Map.of("operation", 1, "field", "duration"), "orderBy", Map.of("field", "count", "direction", 1))
        );

        assertEquals("5", plan.groupBy());
        assertEquals("1", plan.aggregate().operationName());
        assertTrue(plan.aggregate().operation().isEmpty());
        assertEquals(SortDirection.DESC, plan.orderBy().direction());
        assertEquals(3, plan.diagnostics().size());
        for (Diagnostic diagnostic : plan.diagnostics()) {
            assertEquals(Diagnostic.Code.MALFORMED_ARGUMENT, diagnostic.code());
            assertEquals(PlanArgs.STAGE, diagnostic.stage());
        }
    }

    public void testUnreadableLimitIsAbsent() {
        for (Object limit : List.of("ten", true, List.of(5), Double.NaN)) {
            RecordQueryPlan plan = RecordQueryPlan.fromArgs(Map.of("limit", limit));

            assertNull(plan.limit());
            assertEquals(1, plan.diagnostics().size());
        }
    }

    public void testLimitBeyondIntRangeIsClamped() {
        assertEquals(Integer.valueOf(Integer.MAX_VALUE), RecordQueryPlan.fromArgs(Map.of("limit", 4_294_967_297L)).limit());
        assertEquals(Integer.valueOf(Integer.MAX_VALUE), RecordQueryPlan.fromArgs(Map.of("limit", new BigInteger("99999999999999999999"))).limit());
        assertEquals(Integer.valueOf(Integer.MIN_VALUE), RecordQueryPlan.fromArgs(Map.of("limit", -4_294_967_297L)).limit());
        assertEquals(Integer.valueOf(2), RecordQueryPlan.fromArgs(Map.of("limit", 2.9)).limit());
        assertEquals(Integer.valueOf(Integer.MAX_VALUE), RecordQueryPlan.fromArgs(Map.of("limit", "1e12")).limit());
        assertTrue(RecordQueryPlan.fromArgs(Map.of("limit", 4_294_967_297L)).diagnostics().isEmpty());
    }

    public void testCalculateWithoutNameIsDropped() {
        RecordQueryPlan plan = RecordQueryPlan.fromArgs(
            Map.of("calculate", List.of(Map.of("operation", "hour_of_day"), Map.of("name", "hour", "operation", "hour_of_day")))
        );

        assertEquals(List.of(new HourOfDayCalculation("hour")), plan.calculate());
        assertEquals(1, plan.diagnostics().size());
    }

    private static void assertMalformed(RecordQueryPlan plan, RecordQueryPlan expected) {
        assertEquals(expected.calculate(), plan.calculate());
        assertEquals(expected.filters(), plan.filters());
        assertEquals(expected.groupBy(), plan.groupBy());
        assertEquals(expected.aggregate(), plan.aggregate());
        assertEquals(expected.orderBy(), plan.orderBy());
        assertEquals(expected.limit(), plan.limit());
        assertEquals(1, plan.diagnostics().size());
        assertEquals(Diagnostic.Code.MALFORMED_ARGUMENT, plan.diagnostics().get(0).code());
    }

    public void testUnknownAggregateIsKeptByName() {
        AggregateSpec aggregate = AggregateSpec.fromArgs(Map.of("operation", "median", "field", "duration"), new PlanArgs());

        assertEquals("median", aggregate.operationName());
        assertTrue(aggregate.operation().isEmpty());
    }

    public void testSortDirection() {
        assertEquals(SortDirection.ASC, SortDirection.fromString("asc"));
        assertEquals(SortDirection.DESC, SortDirection.fromString("desc"));
        assertEquals(SortDirection.DESC, SortDirection.fromString("ASC"));
        assertEquals(SortDirection.DESC, SortDirection.fromString(null));
        assertEquals(SortDirection.DESC, SortSpec.fromArgs(Map.of("field", "count"), new PlanArgs()).direction());
    }
}
