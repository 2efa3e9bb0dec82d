/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.config;

import org.opensearch.common.settings.Setting;
import org.opensearch.common.settings.Settings;
import org.opensearch.common.unit.TimeValue;
import org.tripquery.query.filter.UnknownFilterPolicy;

/**
 * Tunables of the query engine, read from node settings.
 *
 * <p>The record pipeline and the rollup aggregator read {@link #getUnknownFilterPolicy()} and
 * {@link #getTopK()}; the dispatch layer reads the fetch limits.</p>
 */
public class EngineConfig {

    /**
     * Length cap of merged top station and route lists.
     *
     * <p>Default: 10, the length of the per-day lists in the rollup index.</p>
     */
    public static final Setting<Integer> ROLLUP_TOP_K = Setting.intSetting(
        "trip_query.rollup.top_k",
        10, // default
        1, // min
        1000, // max
        Setting.Property.NodeScope
    );

    /**
     * What a filter with an unrecognised operation does: {@code pass} keeps every record,
     * {@code reject} drops every record.
     *
     * <p>Default: pass</p>
     */
    public static final Setting<UnknownFilterPolicy> UNKNOWN_FILTER_POLICY = new Setting<>(
        "trip_query.pipeline.unknown_filter_policy",
        UnknownFilterPolicy.PASS.getValue(),
        UnknownFilterPolicy::fromString,
        Setting.Property.NodeScope
    );

    /**
     * Upper bound on the wait for a request's shard fetches to complete.
     *
     * <p>Default: 30s</p>
     */
    public static final Setting<TimeValue> FETCH_TIMEOUT = Setting.timeSetting(
        "trip_query.dispatch.fetch_timeout",
        TimeValue.timeValueSeconds(30),
        TimeValue.timeValueMillis(1),
        Setting.Property.NodeScope
    );

    /**
     * Number of shard fetches a request runs at the same time.
     *
     * <p>Default: 4</p>
     */
    public static final Setting<Integer> MAX_CONCURRENT_FETCHES = Setting.intSetting(
        "trip_query.dispatch.max_concurrent_fetches",
        4, // default
        1, // min
        64, // max
        Setting.Property.NodeScope
    );

    private final int topK;
    private final UnknownFilterPolicy unknownFilterPolicy;
    private final TimeValue fetchTimeout;
    private final int maxConcurrentFetches;

    /**
     * Create configuration from settings.
     *
     * @param settings the node settings
     */
    public EngineConfig(Settings settings) {
        this.topK = ROLLUP_TOP_K.get(settings);
        this.unknownFilterPolicy = UNKNOWN_FILTER_POLICY.get(settings);
        this.fetchTimeout = FETCH_TIMEOUT.get(settings);
        this.maxConcurrentFetches = MAX_CONCURRENT_FETCHES.get(settings);
    }

    /**
     * Create configuration with explicit values (for testing).
     */
    public EngineConfig(int topK, UnknownFilterPolicy unknownFilterPolicy, TimeValue fetchTimeout, int maxConcurrentFetches) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive, got: " + topK);
        }
        if (maxConcurrentFetches <= 0) {
            throw new IllegalArgumentException("maxConcurrentFetches must be positive, got: " + maxConcurrentFetches);
        }
        this.topK = topK;
        this.unknownFilterPolicy = unknownFilterPolicy == null ? UnknownFilterPolicy.PASS : unknownFilterPolicy;
        this.fetchTimeout = fetchTimeout == null ? FETCH_TIMEOUT.getDefault(Settings.EMPTY) : fetchTimeout;
        this.maxConcurrentFetches = maxConcurrentFetches;
    }

    public int getTopK() {
        return topK;
    }

    public UnknownFilterPolicy getUnknownFilterPolicy() {
        return unknownFilterPolicy;
    }

    public TimeValue getFetchTimeout() {
        return fetchTimeout;
    }

    public int getMaxConcurrentFetches() {
        return maxConcurrentFetches;
    }

    /**
     * Default configuration for when settings are not available.
     *
     * @return default configuration
     */
    public static EngineConfig defaultConfig() {
        return new EngineConfig(Settings.EMPTY);
    }
}
