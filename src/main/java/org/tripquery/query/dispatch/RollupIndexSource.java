/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.dispatch;

import org.tripquery.core.model.DailySummary;

import java.io.IOException;
import java.util.Map;

/**
 * Fetch layer for the rollup index.
 */
@FunctionalInterface
public interface RollupIndexSource {

    /**
     * @return daily summaries keyed by ISO date
     * @throws IOException if the index cannot be read
     */
    Map<String, DailySummary> load() throws IOException;
}
