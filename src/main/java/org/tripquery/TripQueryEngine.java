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
import org.tripquery.core.model.DailySummary;
import org.tripquery.core.model.Row;
import org.tripquery.query.diagnostics.DiagnosticSink;
import org.tripquery.query.diagnostics.LoggingDiagnosticSink;
import org.tripquery.query.json.QueryJson;
import org.tripquery.query.pipeline.RecordPipeline;
import org.tripquery.query.plan.RecordQueryPlan;
import org.tripquery.query.plan.RollupPlan;
import org.tripquery.query.rollup.RollupAggregator;

import java.util.List;
import java.util.Map;

/**
 * Entry point of the trip query engine.
 *
 * <p>Runs record query plans over shard records and rollup plans over the rollup index, either on
 * already-parsed inputs or directly on their JSON text. The engine is stateless apart from its
 * configuration and may be shared between threads.</p>
 */
public class TripQueryEngine {

    private final EngineConfig config;

    public TripQueryEngine() {
        this(EngineConfig.defaultConfig());
    }

    public TripQueryEngine(Settings settings) {
        this(new EngineConfig(settings));
    }

    public TripQueryEngine(EngineConfig config) {
        if (config == null) {
            throw new NullPointerException("trip query engine received null config");
        }
        this.config = config;
    }

    /**
     * Settings read by the engine.
     */
    public static List<Setting<?>> getSettings() {
        return List.of(
            EngineConfig.ROLLUP_TOP_K,
            EngineConfig.UNKNOWN_FILTER_POLICY,
            EngineConfig.FETCH_TIMEOUT,
            EngineConfig.MAX_CONCURRENT_FETCHES
        );
    }

    public List<Row> runQuery(List<Row> records, RecordQueryPlan plan) {
        return runQuery(records, plan, LoggingDiagnosticSink.INSTANCE);
    }

    /**
     * Run a record query plan over shard records.
     *
     * @param records trip records in order
     * @param plan the query plan
     * @param sink receives data-quality diagnostics
     * @return result rows in order
     */
    public List<Row> runQuery(List<Row> records, RecordQueryPlan plan, DiagnosticSink sink) {
        return new RecordPipeline(plan, config.getUnknownFilterPolicy()).process(records, sink);
    }

    /**
     * Run a record query plan given as JSON over a shard given as a JSON array.
     *
     * @return the result rows as a JSON array
     */
    public String runQuery(String recordsJson, String planJson, DiagnosticSink sink) {
        List<Row> records = QueryJson.parseRecords(recordsJson);
        RecordQueryPlan plan = QueryJson.parseQueryPlan(planJson);
        return QueryJson.writeRows(runQuery(records, plan, sink));
    }

    public List<Row> runRollup(Map<String, DailySummary> summaries, RollupPlan plan) {
        return runRollup(summaries, plan, LoggingDiagnosticSink.INSTANCE);
    }

    /**
     * Run a rollup plan over daily summaries.
     *
     * @param summaries daily summaries keyed by ISO date
     * @param plan the rollup plan
     * @param sink receives data-quality diagnostics
     * @return one row per period, in chronological order
     */
    public List<Row> runRollup(Map<String, DailySummary> summaries, RollupPlan plan, DiagnosticSink sink) {
        return new RollupAggregator(plan, config.getTopK()).process(summaries, sink);
    }

    /**
     * Run a rollup plan given as JSON over a rollup index given as a JSON object.
     *
     * @return the result rows as a JSON array
     */
    public String runRollup(String indexJson, String planJson, DiagnosticSink sink) {
        Map<String, DailySummary> summaries = QueryJson.parseSummaries(indexJson);
        RollupPlan plan = QueryJson.parseRollupPlan(planJson);
        return QueryJson.writeRows(runRollup(summaries, plan, sink));
    }

    public EngineConfig getConfig() {
        return config;
    }
}
