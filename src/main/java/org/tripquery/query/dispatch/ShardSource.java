/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.dispatch;

import org.tripquery.core.model.Row;

import java.io.IOException;
import java.util.List;

/**
 * Fetch layer for shards: one day of raw trip records each.
 */
@FunctionalInterface
public interface ShardSource {

    /**
     * Fetch every record of one shard.
     *
     * @param location shard location as named by the planner, e.g. a URL
     * @return the shard's records, in file order
     * @throws IOException if the shard cannot be read
     */
    List<Row> fetch(String location) throws IOException;
}
