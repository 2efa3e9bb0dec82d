/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery;

import org.opensearch.common.settings.Setting;
import org.opensearch.common.settings.Settings;
import org.tripquery.config.EngineConfig;
import org.tripquery.core.model.Row;
import org.tripquery.query.diagnostics.CollectingDiagnosticSink;
import org.tripquery.query.diagnostics.Diagnostic;
import org.tripquery.query.plan.RecordQueryPlan;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TripQueryEngineTests extends TripQueryTestCase {

    private static final String RECORDS = """
        [
          {"ride_id": "r1", "rideable_type": "classic_bike", "started_at": "2023-04-01 08:05:00",
           "ended_at": "2023-04-01 08:20:00", "start_station_name": "A", "end_station_name": "B", "member_casual": "member"},
          {"ride_id": "r2", "rideable_type": "electric_bike", "started_at": "2023-04-01 17:10:00",
           "ended_at": "2023-04-01 17:40:00", "start_station_name": "B", "end_station_name": "B", "member_casual": "casual"},
          {"ride_id": "r3", "rideable_type": "classic_bike", "started_at": "2023-04-01 17:50:00",
           "ended_at": "2023-04-01 18:00:00", "start_station_name": "A", "end_station_name": "C", "member_casual": "member"},
          {"ride_id": "r4", "rideable_type": "classic_bike", "started_at": "not a time",
           "ended_at": "2023-04-01 19:00:00", "start_station_name": "C", "end_station_name": "A", "member_casual": "casual"}
        ]
        """;

    public void testRecordQueryEndToEnd() {
        CollectingDiagnosticSink sink = new CollectingDiagnosticSink();
        String plan = """
            {
              "calculate": [{"name": "minutes", "operation": "duration_minutes"}],
              "filters": [{"field": "minutes", "operation": "greater_than", "value": 12}],
              "groupBy": "start_station_name",
              "aggregate": {"operation": "avg", "field": "minutes"},
              "orderBy": {"field": "avg", "direction": "asc"},
              "limit": 5
            }
            """;

        String result = new TripQueryEngine().runQuery(RECORDS, plan, sink);

        assertEquals("[{\"start_station_name\":\"A\",\"avg\":15},{\"start_station_name\":\"B\",\"avg\":30}]", result);
        assertTrue(sink.hasCode(Diagnostic.Code.UNPARSEABLE_TIMESTAMP));
    }

    public void testRecordQueryCountsByGroup() {
        List<Row> records = List.of(
            tripAt("r1", "2023-04-01 08:00:00"),
            tripAt("r2", "2023-04-01 09:00:00"),
            trip("r3", "2023-04-01 10:00:00", "2023-04-01 10:30:00", STATIONS[2], STATIONS[0])
        );
        RecordQueryPlan plan = RecordQueryPlan.fromArgs(Map.of("groupBy", "start_station_name"));

        List<Row> rows = new TripQueryEngine().runQuery(records, plan);

        assertEquals(
            List.of(Row.of("start_station_name", STATIONS[0], "count", 2L), Row.of("start_station_name", STATIONS[2], "count", 1L)),
            rows
        );
    }

    public void testRollupEndToEnd() {
        String index = """
            {
              "2023-04-01": {"trip_count": 5, "peak_hour": 8, "top_start_stations": [{"name": "A", "count": 3}]},
              "2023-04-08": {"trip_count": 7, "peak_hour": 17, "top_start_stations": [{"name": "B", "count": 2}, {"name": "A", "count": 1}]},
              "2023-05-02": {"trip_count": 1, "peak_hour": 9, "top_start_stations": []}
            }
            """;
        String plan = """
            {"dateRange": {"start": "2023-04-01", "end": "2023-04-30"}, "aggregateBy": "month",
             "fields": ["trip_count", "top_start_stations"], "transform": "ignored"}
            """;
        Settings settings = Settings.builder().put(EngineConfig.ROLLUP_TOP_K.getKey(), 1).build();

        String result = new TripQueryEngine(settings).runRollup(index, plan, new CollectingDiagnosticSink());

        assertEquals("[{\"period\":\"2023-04\",\"trip_count\":12,\"top_start_stations\":[{\"name\":\"A\",\"count\":4}]}]", result);
    }

    public void testSettingsAreRegistered() {
        List<Setting<?>> settings = TripQueryEngine.getSettings();

        assertEquals(4, settings.size());
        assertTrue(settings.contains(EngineConfig.FETCH_TIMEOUT));
        assertEquals(7, new TripQueryEngine(new EngineConfig(7, null, null, 1)).getConfig().getTopK());
        assertThrows(NullPointerException.class, () -> new TripQueryEngine((EngineConfig) null));
    }
}
