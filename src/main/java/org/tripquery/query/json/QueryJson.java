/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.tripquery.core.model.DailySummary;
import org.tripquery.core.model.Row;
import org.tripquery.query.plan.RecordQueryPlan;
import org.tripquery.query.plan.RollupPlan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON codec for the engine's inputs and outputs: query plans, shard record arrays, rollup index
 * objects and result rows.
 *
 * <p>Reading checks the top-level shape only. Text that is not JSON, or JSON of the wrong top-level
 * shape, raises {@link IllegalArgumentException} carrying the parser error as cause where there is one.
 * Everything below the top level is interpreted leniently by the consuming stage.</p>
 */
public final class QueryJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, DailySummary>> INDEX_TYPE = new TypeReference<>() {
    };

    private QueryJson() {
        // Utility class - prevent instantiation
    }

    /**
     * Shared mapper. Do not reconfigure.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static RecordQueryPlan parseQueryPlan(String json) {
        return RecordQueryPlan.fromArgs(parseObject(json, "query plan"));
    }

    public static RollupPlan parseRollupPlan(String json) {
        return RollupPlan.fromArgs(parseObject(json, "rollup plan"));
    }

    /**
     * Read a JSON object into an ordered map.
     *
     * @param json the JSON text
     * @param what what the object is, for error messages
     * @return the object's entries in document order
     */
    public static Map<String, Object> parseObject(String json, String what) {
        JsonNode node = readTree(json, what);
        if (!node.isObject()) {
            throw new IllegalArgumentException("Expected " + what + " to be a JSON object, got " + node.getNodeType());
        }
        return toMap(node);
    }

    /**
     * Convert an object node to an ordered map.
     */
    public static Map<String, Object> toMap(JsonNode node) {
        return MAPPER.convertValue(node, OBJECT_TYPE);
    }

    /**
     * Read a shard: a JSON array of trip record objects.
     *
     * @param json the JSON text
     * @return the records as rows, in array order
     */
    public static List<Row> parseRecords(String json) {
        return toRows(readTree(json, "records"), "records");
    }

    /**
     * Convert an array node of objects to rows.
     *
     * @param node the array node
     * @param what what the array holds, for error messages
     * @return the rows in array order
     */
    public static List<Row> toRows(JsonNode node, String what) {
        if (!node.isArray()) {
            throw new IllegalArgumentException("Expected " + what + " to be a JSON array, got " + node.getNodeType());
        }
        List<Row> rows = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            JsonNode element = node.get(i);
            if (!element.isObject()) {
                throw new IllegalArgumentException("Expected " + what + "[" + i + "] to be a JSON object, got " + element.getNodeType());
            }
            rows.add(Row.of(toMap(element)));
        }
        return rows;
    }

    /**
     * Read a rollup index: a JSON object mapping ISO dates to daily summaries.
     *
     * @param json the JSON text
     * @return the summaries keyed by date, in document order
     */
    public static Map<String, DailySummary> parseSummaries(String json) {
        JsonNode node = readTree(json, "rollup index");
        if (!node.isObject()) {
            throw new IllegalArgumentException("Expected rollup index to be a JSON object, got " + node.getNodeType());
        }
        return MAPPER.convertValue(node, INDEX_TYPE);
    }

    /**
     * Write result rows as a JSON array.
     */
    public static String writeRows(List<Row> rows) {
        return write(rows);
    }

    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot write value as JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parse JSON text into a tree.
     *
     * @param json the JSON text
     * @param what what the text holds, for error messages
     * @return the root node
     */
    public static JsonNode readTree(String json, String what) {
        if (json == null) {
            throw new NullPointerException("QueryJson received null " + what);
        }
        try {
            JsonNode node = MAPPER.readTree(json);
            if (node == null || node.isMissingNode()) {
                throw new IllegalArgumentException("Expected " + what + " JSON, got empty input");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid " + what + " JSON: " + e.getOriginalMessage(), e);
        }
    }
}
