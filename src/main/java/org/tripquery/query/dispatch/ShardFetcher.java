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
import org.opensearch.common.unit.TimeValue;
import org.opensearch.common.util.concurrent.OpenSearchExecutors;
import org.tripquery.config.EngineConfig;
import org.tripquery.core.model.Row;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Fetches the shards of one request concurrently and concatenates their records.
 *
 * <p>At most {@link EngineConfig#getMaxConcurrentFetches()} fetches run at once, and the whole fan-out
 * is bounded by {@link EngineConfig#getFetchTimeout()}. Records come back in request order: all records
 * of the first shard, then the second, and so on. One failed or timed-out shard fails the request.</p>
 */
public class ShardFetcher {

    private static final Logger logger = LogManager.getLogger(ShardFetcher.class);

    private static final String THREAD_NAME_PREFIX = "trip-query-shard-fetch";

    private final ShardSource source;
    private final int maxConcurrentFetches;
    private final TimeValue timeout;

    public ShardFetcher(ShardSource source, EngineConfig config) {
        this.source = Objects.requireNonNull(source, "source");
        this.maxConcurrentFetches = config.getMaxConcurrentFetches();
        this.timeout = config.getFetchTimeout();
    }

    /**
     * Fetch and concatenate shards.
     *
     * @param locations shard locations in request order
     * @return every record of every shard, in request order
     * @throws ShardFetchException if a shard fails, the timeout expires or the calling thread is interrupted
     */
    public List<Row> fetchAll(List<String> locations) {
        if (locations == null) {
            throw new NullPointerException("shard fetcher received null locations");
        }
        if (locations.isEmpty()) {
            return new ArrayList<>();
        }

        List<Callable<List<Row>>> tasks = new ArrayList<>(locations.size());
        for (String location : locations) {
            tasks.add(() -> source.fetch(location));
        }

        int threads = Math.min(maxConcurrentFetches, locations.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads, OpenSearchExecutors.daemonThreadFactory(THREAD_NAME_PREFIX));
        try {
            List<Future<List<Row>>> futures = executor.invokeAll(tasks, timeout.millis(), TimeUnit.MILLISECONDS);
            List<Row> records = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                records.addAll(result(locations.get(i), futures.get(i)));
            }
            logger.info("Fetched {} trips from {} shard(s)", records.size(), locations.size());
            return records;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ShardFetchException(null, "Interrupted while fetching shards", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private List<Row> result(String location, Future<List<Row>> future) throws InterruptedException {
        try {
            List<Row> rows = future.get();
            if (rows == null) {
                throw new ShardFetchException(location, "Shard source returned no records for " + location, null);
            }
            return rows;
        } catch (CancellationException e) {
            throw new ShardFetchException(location, "Timed out after " + timeout + " fetching shard: " + location, e);
        } catch (ExecutionException e) {
            throw new ShardFetchException(location, "Failed to fetch shard: " + location, e.getCause());
        }
    }
}
