/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.dispatch;

import org.tripquery.query.diagnostics.LoggingDiagnosticSink;
import org.tripquery.query.json.QueryJson;
import org.tripquery.query.plan.PlanArgs;
import org.tripquery.query.plan.RecordQueryPlan;
import org.tripquery.query.plan.RollupPlan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parsed output of the upstream planner.
 *
 * <p>Two shapes are accepted. A shard response sets {@code needsShards}, lists {@code shardsToFetch} and
 * carries a {@code queryPlan}. An index response leaves {@code needsShards} false and either carries a
 * {@code rollupPlan} to run over the rollup index, or a finished {@code chartConfig} only.</p>
 *
 * @param needsShards whether the answer needs raw trip records
 * @param shardsToFetch shard locations, in request order
 * @param queryPlan plan for the shard records, {@code null} on index responses
 * @param rollupPlan plan for the rollup index, or {@code null}
 * @param chartConfig chart descriptor the result rows are merged into
 */
public record PlannerResponse(
    boolean needsShards,
    List<String> shardsToFetch,
    RecordQueryPlan queryPlan,
    RollupPlan rollupPlan,
    Map<String, Object> chartConfig
) {

    public static final String NEEDS_SHARDS_ARG = "needsShards";
    public static final String SHARDS_TO_FETCH_ARG = "shardsToFetch";
    public static final String QUERY_PLAN_ARG = "queryPlan";
    public static final String ROLLUP_PLAN_ARG = "rollupPlan";
    public static final String CHART_CONFIG_ARG = "chartConfig";

    private static final Pattern JSON_FENCE = Pattern.compile("```json\\n?");
    private static final Pattern FENCE = Pattern.compile("```\\n?");

    public PlannerResponse {
        shardsToFetch = shardsToFetch == null ? List.of() : List.copyOf(shardsToFetch);
        chartConfig = chartConfig == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(chartConfig));
        if (needsShards && queryPlan == null) {
            throw new IllegalArgumentException("A planner response that needs shards must carry a " + QUERY_PLAN_ARG);
        }
    }

    /**
     * Parse planner output, ignoring Markdown code fences around the JSON.
     *
     * @param text the planner's raw text
     * @return the parsed response
     * @throws IllegalArgumentException if the text is not a JSON object of the expected shape
     */
    public static PlannerResponse parse(String text) {
        if (text == null) {
            throw new NullPointerException("PlannerResponse received null text");
        }
        String cleaned = FENCE.matcher(JSON_FENCE.matcher(text).replaceAll("")).replaceAll("").trim();
        return fromArgs(QueryJson.parseObject(cleaned, "planner response"));
    }

    public static PlannerResponse fromArgs(Map<String, Object> args) {
        if (args == null) {
            throw new IllegalArgumentException("Planner response cannot be null");
        }
        PlanArgs reader = new PlanArgs();
        Object needsShards = args.get(NEEDS_SHARDS_ARG);
        Map<String, Object> queryPlan = reader.mapArg(args, QUERY_PLAN_ARG);
        Map<String, Object> rollupPlan = reader.mapArg(args, ROLLUP_PLAN_ARG);
        PlannerResponse response = new PlannerResponse(
            Boolean.TRUE.equals(needsShards),
            reader.stringListArg(args, SHARDS_TO_FETCH_ARG),
            queryPlan == null ? null : RecordQueryPlan.fromArgs(queryPlan),
            rollupPlan == null ? null : RollupPlan.fromArgs(rollupPlan),
            reader.mapArg(args, CHART_CONFIG_ARG)
        );
        // the plans carry their own diagnostics; the envelope's are only logged
        reader.getDiagnostics().forEach(LoggingDiagnosticSink.INSTANCE::report);
        return response;
    }
}
