/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.rollup;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tripquery.core.model.DailySummary;
import org.tripquery.core.model.PeriodBucket;
import org.tripquery.core.model.Row;
import org.tripquery.query.diagnostics.Diagnostic;
import org.tripquery.query.diagnostics.DiagnosticSink;
import org.tripquery.query.diagnostics.LoggingDiagnosticSink;
import org.tripquery.query.plan.DateRange;
import org.tripquery.query.plan.RollupPlan;
import org.tripquery.query.plan.TimeGrain;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a {@link RollupPlan} over a date-keyed rollup index.
 *
 * <p>Dates are sorted lexically (chronologically, for ISO dates) and restricted to the plan's inclusive
 * date range. Each remaining day joins the bucket of its period under the plan's grain; buckets are
 * emitted in order of their first day, merged by {@link BucketMerger}. When the plan lists fields, each
 * row is reduced to {@code period} plus those of the listed fields it actually has.</p>
 */
public class RollupAggregator {

    private static final Logger logger = LogManager.getLogger(RollupAggregator.class);

    /** The name identifier for this aggregator. */
    public static final String NAME = "rollup aggregator";
    /** Stage name used when reporting bucketing diagnostics. */
    public static final String BUCKET_STAGE = "rollup.bucket";
    /** Default length of merged top lists. */
    public static final int DEFAULT_TOP_K = 10;

    private final RollupPlan plan;
    private final BucketMerger merger;

    public RollupAggregator(RollupPlan plan) {
        this(plan, DEFAULT_TOP_K);
    }

    public RollupAggregator(RollupPlan plan, int topK) {
        if (plan == null) {
            throw new NullPointerException(NAME + " received null plan");
        }
        this.plan = plan;
        this.merger = new BucketMerger(topK);
    }

    /**
     * Run the plan, reporting diagnostics as log warnings.
     *
     * @see #process(Map, DiagnosticSink)
     */
    public List<Row> process(Map<String, DailySummary> summaries) {
        return process(summaries, LoggingDiagnosticSink.INSTANCE);
    }

    /**
     * Run the plan over {@code summaries}.
     *
     * @param summaries daily summaries keyed by ISO date
     * @param sink receives data-quality diagnostics
     * @return one row per period, in chronological order of first member
     * @throws NullPointerException if {@code summaries} or {@code sink} is null, or a key is null
     */
    public List<Row> process(Map<String, DailySummary> summaries, DiagnosticSink sink) {
        if (summaries == null) {
            throw new NullPointerException(NAME + " received null input");
        }
        if (sink == null) {
            throw new NullPointerException(NAME + " received null diagnostic sink");
        }

        plan.diagnostics().forEach(sink::report);
        List<String> dates = selectDates(summaries);
        logger.debug("Processing {} of {} days", dates.size(), summaries.size());

        TimeGrain grain = plan.grain();
        if (plan.hasUnknownGrain()) {
            sink.report(
                Diagnostic.of(
                    Diagnostic.Code.UNKNOWN_OPERATION,
                    BUCKET_STAGE,
                    "Unknown aggregateBy grain: %s, using %s",
                    plan.aggregateBy(),
                    grain.getValue()
                )
            );
        }

        Map<String, List<DailySummary>> buckets = new LinkedHashMap<>();
        for (String date : dates) {
            DailySummary summary = summaries.get(date);
            if (summary == null) {
                sink.report(Diagnostic.of(Diagnostic.Code.MISSING_VALUE, BUCKET_STAGE, "%s: no summary, day skipped", date));
                continue;
            }
            buckets.computeIfAbsent(bucketKey(date, grain, sink), k -> new ArrayList<>()).add(summary);
        }
        logger.debug("Created {} {} buckets", buckets.size(), grain.getValue());

        List<Row> result = new ArrayList<>(buckets.size());
        for (Map.Entry<String, List<DailySummary>> bucket : buckets.entrySet()) {
            PeriodBucket merged = merger.merge(bucket.getKey(), bucket.getValue(), sink);
            result.add(project(merged.toRow()));
        }
        logger.debug("Final result: {} rows", result.size());
        return result;
    }

    private List<String> selectDates(Map<String, DailySummary> summaries) {
        List<String> dates = new ArrayList<>(summaries.size());
        DateRange range = plan.dateRange();
        for (String date : summaries.keySet()) {
            if (date == null) {
                throw new NullPointerException(NAME + " received null date");
            }
            if (range == null || range.contains(date)) {
                dates.add(date);
            }
        }
        dates.sort(null);
        return dates;
    }

    private static String bucketKey(String date, TimeGrain grain, DiagnosticSink sink) {
        LocalDate parsed;
        try {
            parsed = LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            sink.report(
                Diagnostic.of(Diagnostic.Code.UNPARSEABLE_DATE, BUCKET_STAGE, "%s is not an ISO date, bucketed under its own key", date)
            );
            return date;
        }
        return grain == TimeGrain.DAY ? date : grain.bucketKey(parsed);
    }

    private Row project(Row full) {
        List<String> fields = plan.fields();
        if (fields.isEmpty()) {
            return full;
        }
        Row.Builder builder = Row.builder().put(PeriodBucket.PERIOD, full.get(PeriodBucket.PERIOD));
        for (String field : fields) {
            if (full.has(field)) {
                builder.put(field, full.get(field));
            }
        }
        return builder.build();
    }

    public RollupPlan getPlan() {
        return plan;
    }

    public int getTopK() {
        return merger.getTopK();
    }
}
