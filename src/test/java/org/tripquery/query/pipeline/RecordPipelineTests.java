/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.pipeline;

import org.tripquery.TripQueryTestCase;
import org.tripquery.core.model.Row;
import org.tripquery.core.model.TripRecord;
import org.tripquery.query.calculate.DurationMinutesCalculation;
import org.tripquery.query.calculate.FieldCalculation;
import org.tripquery.query.calculate.FieldCalculationFactory;
import org.tripquery.query.calculate.HourOfDayCalculation;
import org.tripquery.query.diagnostics.CollectingDiagnosticSink;
import org.tripquery.query.diagnostics.Diagnostic;
import org.tripquery.query.filter.ContainsFilter;
import org.tripquery.query.filter.EqualsFilter;
import org.tripquery.query.filter.HourBetweenFilter;
import org.tripquery.query.filter.RecordFilter;
import org.tripquery.query.filter.RecordFilterFactory;
import org.tripquery.query.filter.UnknownFilterPolicy;
import org.tripquery.query.json.QueryJson;
import org.tripquery.query.plan.AggregateOperation;
import org.tripquery.query.plan.AggregateSpec;
import org.tripquery.query.plan.RecordQueryPlan;
import org.tripquery.query.plan.SortDirection;
import org.tripquery.query.plan.SortSpec;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class RecordPipelineTests extends TripQueryTestCase {

    private final CollectingDiagnosticSink sink = new CollectingDiagnosticSink();

    private static RecordQueryPlan plan(
        List<FieldCalculation> calculate,
        List<RecordFilter> filters,
        String groupBy,
        AggregateSpec aggregate,
        SortSpec orderBy,
        Integer limit
    ) {
        return new RecordQueryPlan(calculate, filters, groupBy, aggregate, orderBy, limit);
    }

    private static List<Row> stationTrips(String... stations) {
        List<Row> trips = new ArrayList<>();
        for (int i = 0; i < stations.length; i++) {
            trips.add(trip("r" + i, "2023-04-01 10:00:00.000", "2023-04-01 10:10:00.000", stations[i], "B"));
        }
        return trips;
    }

    public void testEmptyPlanReturnsInputUnchanged() {
        List<Row> trips = randomTrips(randomIntBetween(0, 50));

        List<Row> result = new RecordPipeline(RecordQueryPlan.empty()).process(trips, sink);

        assertEquals(trips, result);
        assertNotSame(trips, result);
        assertTrue(sink.isEmpty());
    }

    public void testDeterminism() {
        List<Row> trips = randomTrips(randomIntBetween(1, 200));
        RecordQueryPlan plan = plan(
            List.of(new DurationMinutesCalculation("duration"), new HourOfDayCalculation("hour")),
            randomBoolean() ? List.of() : List.of(new HourBetweenFilter("hour", randomIntBetween(0, 12), randomIntBetween(12, 24))),
            randomFrom(new String[] { "hour", TripRecord.START_STATION_NAME, TripRecord.END_STATION_NAME }),
            new AggregateSpec(randomFrom(AggregateOperation.values()), "duration"),
            new SortSpec(randomFrom(new String[] { "duration", "count", "sum", "avg" }), randomFrom(SortDirection.values())),
            randomBoolean() ? null : randomIntBetween(1, 10)
        );
        RecordPipeline pipeline = new RecordPipeline(plan);

        assertEquals(pipeline.process(trips, sink), pipeline.process(new ArrayList<>(trips), sink));
    }

    public void testCalculateDoesNotModifyInput() {
        List<Row> trips = List.of(trip("r1", "2023-01-03 23:00:00.000", "2023-01-03 23:15:30.000", "A", "B"));

        List<Row> result = new RecordPipeline(plan(List.of(new DurationMinutesCalculation("duration")), null, null, null, null, null))
            .process(trips, sink);

        assertEquals(16L, result.get(0).get("duration"));
        assertFalse(trips.get(0).has("duration"));
    }

    public void testLaterCalculationsAndFiltersSeeDerivedFields() {
        List<Row> trips = List.of(
            trip("short", "2023-04-01 10:00:00.000", "2023-04-01 10:05:00.000", "A", "B"),
            trip("long", "2023-04-01 10:00:00.000", "2023-04-01 11:30:00.000", "A", "B")
        );
        RecordQueryPlan plan = QueryJson.parseQueryPlan("""
            {
              "calculate": [{"name": "duration_minutes", "operation": "duration_minutes"}],
              "filters": [{"field": "duration_minutes", "operation": "greater_than", "value": 60}]
            }
            """);

        List<Row> result = new RecordPipeline(plan).process(trips, sink);

        assertEquals(1, result.size());
        assertEquals("long", result.get(0).get(TripRecord.RIDE_ID));
        assertEquals(90L, result.get(0).get("duration_minutes"));
    }

    public void testHourBetweenKeepsOnlyHalfOpenRange() {
        List<Row> trips = List.of(
            tripAt("h11", "2023-04-01 11:30:00.000"),
            tripAt("h12", "2023-04-01 12:30:00.000"),
            tripAt("h17", "2023-04-01 17:30:00.000"),
            tripAt("h18", "2023-04-01 18:30:00.000")
        );

        List<Row> result = new RecordPipeline(plan(null, List.of(new HourBetweenFilter("hour", 12, 18)), null, null, null, null))
            .process(trips, sink);

        assertEquals(List.of(trips.get(1), trips.get(2)), result);
    }

    public void testFiltersCombineWithAnd() {
        List<Row> trips = randomTrips(randomIntBetween(20, 100));
        RecordFilter byStation = new EqualsFilter(TripRecord.START_STATION_NAME, STATIONS[0]);
        RecordFilter byHour = new HourBetweenFilter("hour", 6, 18);
        RecordFilter byName = new ContainsFilter(TripRecord.END_STATION_NAME, "st");

        List<Row> result = new RecordPipeline(plan(null, List.of(byStation, byHour, byName), null, null, null, null)).process(trips, sink);

        List<Row> expected = new ArrayList<>();
        for (Row trip : trips) {
            if (byStation.test(trip) && byHour.test(trip) && byName.test(trip)) {
                expected.add(trip);
            }
        }
        assertEquals(expected, result);
    }

    public void testGroupAndCount() {
        RecordQueryPlan plan = plan(null, null, TripRecord.START_STATION_NAME, new AggregateSpec(AggregateOperation.COUNT, "*"), null, null);

        List<Row> result = new RecordPipeline(plan).process(stationTrips("A", "A", "B", "A", "B"), sink);

        assertEquals(List.of(Row.of(TripRecord.START_STATION_NAME, "A", "count", 3L), Row.of(TripRecord.START_STATION_NAME, "B", "count", 2L)), result);
    }

    public void testAfternoonBusiestStations() {
        List<Row> trips = new ArrayList<>();
        String[] stations = { "A", "B", "B", "C", "C", "C", "A" };
        String[] times = { "09:00", "12:10", "13:00", "14:00", "15:00", "16:00", "19:00" };
        for (int i = 0; i < stations.length; i++) {
            trips.add(trip("r" + i, "2023-04-01 " + times[i] + ":00.000", "2023-04-01 " + times[i] + ":30.000", stations[i], "Z"));
        }
        RecordQueryPlan plan = QueryJson.parseQueryPlan("""
            {
              "calculate": [{"name": "hour", "operation": "hour_of_day"}],
              "filters": [{"field": "hour", "operation": "hour_between", "value": [12, 18]}],
              "groupBy": "start_station_name",
              "aggregate": {"operation": "count", "field": "*"},
              "orderBy": {"field": "count", "direction": "desc"},
              "limit": 2
            }
            """);

        List<Row> result = new RecordPipeline(plan).process(trips, sink);

        assertEquals(List.of(Row.of("start_station_name", "C", "count", 3L), Row.of("start_station_name", "B", "count", 2L)), result);
        assertTrue(sink.isEmpty());
    }

    public void testOrderIsStableForEqualKeys() {
        List<Row> rows = List.of(Row.of("id", 1, "v", 5), Row.of("id", 2, "v", "x"), Row.of("id", 3, "v", 5), Row.of("id", 4), Row.of("id", 5, "v", 9));

        List<Row> ascending = new RecordPipeline(plan(null, null, null, null, new SortSpec("v", SortDirection.ASC), null)).process(rows, sink);
        List<Row> descending = new RecordPipeline(plan(null, null, null, null, new SortSpec("v", SortDirection.DESC), null)).process(
            rows,
            sink
        );

        assertEquals(List.of(2, 4, 1, 3, 5), ids(ascending));
        assertEquals(List.of(5, 1, 3, 2, 4), ids(descending));
    }

    public void testOrderTreatsNegativeZeroAsZero() {
        List<Row> rows = List.of(Row.of("id", 1, "v", 0.0), Row.of("id", 2, "v", -0.0), Row.of("id", 3, "v", 0));

        List<Row> sorted = new RecordPipeline(plan(null, null, null, null, new SortSpec("v", SortDirection.ASC), null)).process(rows, sink);

        assertEquals(List.of(1, 2, 3), ids(sorted));
    }

    public void testLimit() {
        List<Row> trips = randomTrips(20);
        int limit = randomIntBetween(1, 30);

        List<Row> result = new RecordPipeline(plan(null, null, null, null, null, limit)).process(trips, sink);

        assertEquals(trips.subList(0, Math.min(limit, trips.size())), result);
    }

    public void testNonPositiveLimitIsIgnored() {
        List<Row> trips = randomTrips(5);

        List<Row> result = new RecordPipeline(plan(null, null, null, null, null, randomIntBetween(-5, 0))).process(trips, sink);

        assertEquals(trips, result);
        assertTrue(sink.hasCode(Diagnostic.Code.IGNORED_LIMIT));
    }

    public void testUnknownFilterReportedOncePerRun() {
        List<Row> trips = randomTrips(randomIntBetween(2, 30));
        RecordFilter unknown = RecordFilterFactory.create("within_radius", "start_lat", 1);

        List<Row> result = new RecordPipeline(plan(null, List.of(unknown), null, null, null, null)).process(trips, sink);

        assertEquals(trips, result);
        assertEquals(1, sink.getDiagnostics().size());
        assertEquals(Diagnostic.Code.UNKNOWN_OPERATION, sink.getDiagnostics().get(0).code());
    }

    public void testUnknownFilterUnderRejectPolicy() {
        RecordFilter unknown = RecordFilterFactory.create("within_radius", "start_lat", 1);

        List<Row> result = new RecordPipeline(plan(null, List.of(unknown), null, null, null, null), UnknownFilterPolicy.REJECT).process(
            randomTrips(10),
            sink
        );

        assertTrue(result.isEmpty());
        assertTrue(sink.hasCode(Diagnostic.Code.UNKNOWN_OPERATION));
    }

    public void testUnknownCalculationReportedOnce() {
        List<Row> trips = randomTrips(10);

        List<Row> result = new RecordPipeline(plan(List.of(FieldCalculationFactory.create("speed", "speed")), null, null, null, null, null))
            .process(trips, sink);

        assertEquals(trips, result);
        assertEquals(1, sink.getDiagnostics().size());
    }

    public void testMalformedPlanValuesDegrade() {
        List<Row> trips = stationTrips("A", "A", "B");

        assertEquals(List.of(Row.of("5", "undefined", "count", 3L)), runMalformed("{\"groupBy\": 5}", trips));
        assertEquals(trips, runMalformed("{\"limit\": \"ten\"}", trips));
        assertEquals(trips, runMalformed("{\"limit\": true}", trips));
        assertEquals(List.of(), runMalformed("{\"filters\": [{\"field\": 3, \"operation\": \"equals\", \"value\": \"A\"}]}", trips));
        assertEquals(trips, runMalformed("{\"calculate\": [{\"operation\": \"hour_of_day\"}]}", trips));
        assertEquals(trips, runMalformed("{\"orderBy\": {\"field\": \"count\", \"direction\": 1}}", trips));
        assertEquals(
            List.of(Row.of("start_station_name", "A"), Row.of("start_station_name", "B")),
            runMalformed("{\"groupBy\": \"start_station_name\", \"aggregate\": {\"operation\": 1, \"field\": \"x\"}}", trips)
        );
    }

    public void testPlanDiagnosticsReportedOnEveryRun() {
        RecordPipeline pipeline = new RecordPipeline(QueryJson.parseQueryPlan("{\"limit\": \"ten\"}"));
        List<Row> trips = randomTrips(5);

        pipeline.process(trips, sink);
        pipeline.process(trips, sink);

        assertEquals(2, sink.getDiagnostics().size());
    }

    public void testDurationAcrossCenturies() {
        RecordQueryPlan plan = plan(List.of(new DurationMinutesCalculation("minutes")), null, null, null, null, null);
        Row trip = trip("r1", "1000-01-01 00:00:00.000", "2023-01-01 00:00:00.000", STATIONS[0], STATIONS[1]);

        List<Row> result = new RecordPipeline(plan).process(List.of(trip), sink);

        long days = ChronoUnit.DAYS.between(LocalDate.of(1000, 1, 1), LocalDate.of(2023, 1, 1));
        assertEquals(days * 24 * 60, result.get(0).get("minutes"));
        assertTrue(sink.isEmpty());
    }

    private List<Row> runMalformed(String planJson, List<Row> trips) {
        CollectingDiagnosticSink diagnostics = new CollectingDiagnosticSink();
        List<Row> result = new RecordPipeline(QueryJson.parseQueryPlan(planJson)).process(trips, diagnostics);
        assertTrue(planJson, diagnostics.hasCode(Diagnostic.Code.MALFORMED_ARGUMENT));
        return result;
    }

    public void testNullArguments() {
        RecordPipeline pipeline = new RecordPipeline(RecordQueryPlan.empty());

        NullPointerException e = assertThrows(NullPointerException.class, () -> pipeline.process(null, sink));
        assertEquals("record pipeline received null input", e.getMessage());
        assertThrows(NullPointerException.class, () -> pipeline.process(List.of(), null));
        assertThrows(NullPointerException.class, () -> new RecordPipeline(null));
    }

    private static List<Object> ids(List<Row> rows) {
        List<Object> ids = new ArrayList<>();
        for (Row row : rows) {
            ids.add(row.get("id"));
        }
        return ids;
    }
}
