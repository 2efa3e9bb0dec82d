/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.dispatch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tripquery.config.EngineConfig;
import org.tripquery.core.model.DailySummary;
import org.tripquery.core.model.Row;
import org.tripquery.query.diagnostics.DiagnosticSink;
import org.tripquery.query.pipeline.RecordPipeline;
import org.tripquery.query.rollup.RollupAggregator;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Routes a planner response to the path that answers it and returns the finished chart descriptor.
 *
 * <ul>
 *   <li>shard path: fetch the listed shards, run the record pipeline, merge the rows into the chart</li>
 *   <li>index path: load the rollup index, run the rollup aggregator, merge the rows into the chart</li>
 *   <li>otherwise the planner's chart descriptor is returned as is</li>
 * </ul>
 */
public class QueryDispatcher {

    private static final Logger logger = LogManager.getLogger(QueryDispatcher.class);

    private final ShardFetcher shardFetcher;
    private final RollupIndexSource indexSource;
    private final EngineConfig config;

    /**
     * @param shardSource fetch layer for shards
     * @param indexSource fetch layer for the rollup index, or {@code null} when no index is available
     * @param config engine configuration
     */
    public QueryDispatcher(ShardSource shardSource, RollupIndexSource indexSource, EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.shardFetcher = new ShardFetcher(shardSource, config);
        this.indexSource = indexSource;
    }

    /**
     * Answer a planner response.
     *
     * @param response the parsed planner output
     * @param sink receives data-quality diagnostics of the executed plan
     * @return the chart descriptor with result rows under {@code data}
     * @throws ShardFetchException if a shard cannot be fetched
     * @throws IllegalStateException if a rollup plan arrives and no index source is configured
     * @throws UncheckedIOException if the rollup index cannot be read
     */
    public Map<String, Object> dispatch(PlannerResponse response, DiagnosticSink sink) {
        if (response == null) {
            throw new NullPointerException("query dispatcher received null response");
        }
        if (response.needsShards()) {
            logger.info("Shards requested: {}", response.shardsToFetch());
            List<Row> records = shardFetcher.fetchAll(response.shardsToFetch());
            List<Row> rows = new RecordPipeline(response.queryPlan(), config.getUnknownFilterPolicy()).process(records, sink);
            logger.info("Processed {} records into {} rows", records.size(), rows.size());
            return ChartConfigAssembler.withData(response.chartConfig(), rows);
        }
        if (response.rollupPlan() != null) {
            if (indexSource == null) {
                throw new IllegalStateException("Rollup plan received but no rollup index source is configured");
            }
            Map<String, DailySummary> index = loadIndex();
            List<Row> rows = new RollupAggregator(response.rollupPlan(), config.getTopK()).process(index, sink);
            logger.info("Aggregated {} days into {} rows", index.size(), rows.size());
            return ChartConfigAssembler.withData(response.chartConfig(), rows);
        }
        return new LinkedHashMap<>(response.chartConfig());
    }

    private Map<String, DailySummary> loadIndex() {
        try {
            return indexSource.load();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load rollup index", e);
        }
    }
}
