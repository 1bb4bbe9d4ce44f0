package io.nosqlbench.sensordata.aggregate;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.sensordata.SensorDataException;
import io.nosqlbench.sensordata.model.AggregatedTable;
import io.nosqlbench.sensordata.model.AggregationInterval;
import io.nosqlbench.sensordata.model.AlignedTable;
import io.nosqlbench.sensordata.model.ValueColumn;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/// Resamples an aligned table into fixed-width time buckets.
///
/// Buckets are aligned to midnight UTC of the first row's day and run contiguously from the
/// first row's bucket to the last row's bucket, including buckets no row falls into. For each
/// bucket and channel the mean and sample standard deviation of the present values are computed;
/// without any value both are missing, with a single value only the mean is present.
///
/// Aggregation only reads the aligned table, so several intervals can be computed side by side.
public class IntervalAggregator {
    private static final Logger logger = LogManager.getLogger(IntervalAggregator.class);

    /// Aggregate one interval width.
    public AggregatedTable aggregate(AlignedTable table, AggregationInterval interval) {
        int rows = table.rowCount();
        if (rows == 0) {
            List<AggregatedTable.ChannelAggregate> empty = new ArrayList<>();
            for (ValueColumn channel : table.valueColumns()) {
                empty.add(channelAggregate(channel.name(), new RunningMoments[0]));
            }
            return new AggregatedTable(interval, new Instant[0], empty);
        }

        BucketAssigner assigner = BucketAssigner.alignedToDayOf(table.timestamp(0), interval.duration());
        long firstBucket = assigner.bucketIndex(table.timestamp(0));
        long lastBucket = assigner.bucketIndex(table.timestamp(rows - 1));
        long span = lastBucket - firstBucket + 1;
        if (span > Integer.MAX_VALUE - 8) {
            throw new SensorDataException("Interval " + interval + " would produce " + span + " buckets");
        }
        int bucketCount = (int) span;

        int[] bucketOfRow = new int[rows];
        for (int row = 0; row < rows; row++) {
            bucketOfRow[row] = (int) (assigner.bucketIndex(table.timestamp(row)) - firstBucket);
        }

        Instant[] starts = new Instant[bucketCount];
        for (int bucket = 0; bucket < bucketCount; bucket++) {
            starts[bucket] = assigner.bucketStart(firstBucket + bucket);
        }

        List<AggregatedTable.ChannelAggregate> aggregates = new ArrayList<>(table.valueColumns().size());
        for (ValueColumn channel : table.valueColumns()) {
            RunningMoments[] moments = new RunningMoments[bucketCount];
            for (int bucket = 0; bucket < bucketCount; bucket++) {
                moments[bucket] = new RunningMoments();
            }
            for (int row = 0; row < rows; row++) {
                if (channel.isPresent(row)) {
                    moments[bucketOfRow[row]].add(channel.valueAt(row));
                }
            }
            aggregates.add(channelAggregate(channel.name(), moments));
        }

        logger.debug("Aggregated {} rows into {} buckets of {}", rows, bucketCount, interval);
        return new AggregatedTable(interval, starts, aggregates);
    }

    /// Aggregate several interval widths, each independently from the same table.
    ///
    /// @param parallelism
    ///     maximum number of intervals computed concurrently; 1 or less runs them in sequence
    /// @return one table per interval, in request order
    public Map<AggregationInterval, AggregatedTable> aggregateAll(
        AlignedTable table,
        List<AggregationInterval> intervals,
        int parallelism
    ) {
        Map<AggregationInterval, AggregatedTable> results = new LinkedHashMap<>();
        if (parallelism <= 1 || intervals.size() <= 1) {
            for (AggregationInterval interval : intervals) {
                results.put(interval, aggregate(table, interval));
            }
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, intervals.size()));
        try {
            List<Future<AggregatedTable>> futures = new ArrayList<>(intervals.size());
            for (AggregationInterval interval : intervals) {
                futures.add(executor.submit(() -> aggregate(table, interval)));
            }
            for (int i = 0; i < intervals.size(); i++) {
                results.put(intervals.get(i), futures.get(i).get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SensorDataException("Interrupted while aggregating", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new SensorDataException("Aggregation failed: " + cause.getMessage(), cause);
        } finally {
            executor.shutdownNow();
        }
    }

    private static AggregatedTable.ChannelAggregate channelAggregate(String channel, RunningMoments[] moments) {
        ValueColumn.Builder mean = ValueColumn.builder(AggregatedTable.meanColumn(channel), moments.length);
        ValueColumn.Builder std = ValueColumn.builder(AggregatedTable.stdColumn(channel), moments.length);
        int[] counts = new int[moments.length];
        for (int bucket = 0; bucket < moments.length; bucket++) {
            mean.set(bucket, moments[bucket].mean());
            std.set(bucket, moments[bucket].sampleStdDev());
            counts[bucket] = (int) moments[bucket].count();
        }
        return new AggregatedTable.ChannelAggregate(channel, mean.build(), std.build(), counts);
    }
}
