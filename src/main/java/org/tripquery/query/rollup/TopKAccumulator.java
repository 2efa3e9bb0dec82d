/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.rollup;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Running per-key totals, ranked on demand.
 *
 * <p>Ties in the ranking keep the order in which keys were first added.</p>
 *
 * @param <K> key type, compared with {@code equals}
 */
final class TopKAccumulator<K> {

    private final Map<K, Long> totals = new LinkedHashMap<>();

    void add(K key, long count) {
        totals.merge(key, count, Long::sum);
    }

    /**
     * The {@code k} keys with the highest totals, highest first.
     *
     * @param k maximum number of entries
     * @return key/total pairs
     */
    List<Map.Entry<K, Long>> top(int k) {
        List<Map.Entry<K, Long>> ranked = new ArrayList<>(totals.entrySet());
        ranked.sort(Map.Entry.<K, Long>comparingByValue().reversed());
        return ranked.size() <= k ? ranked : new ArrayList<>(ranked.subList(0, k));
    }

    int size() {
        return totals.size();
    }
}
