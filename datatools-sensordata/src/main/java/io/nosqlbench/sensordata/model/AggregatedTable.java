package io.nosqlbench.sensordata.model;

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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/// Per-bucket mean and sample standard deviation of every channel, for one interval width.
///
/// Rows are contiguous buckets in ascending order; each row's time cell is the bucket start and
/// the bucket covers `[start, start + interval)`. A bucket without samples for a channel has
/// a missing mean and standard deviation for that channel, and a bucket with a single sample
/// has a mean but a missing standard deviation.
public final class AggregatedTable implements ColumnarTable {

    /// Header of the bucket start column
    public static final String TIME_COLUMN = "datetime";

    /// Suffix of a channel's mean column
    public static final String MEAN_SUFFIX = "_mean";

    /// Suffix of a channel's standard deviation column
    public static final String STD_SUFFIX = "_std";

    private final AggregationInterval interval;
    private final Instant[] bucketStarts;
    private final Map<String, ChannelAggregate> channels;
    private final List<ValueColumn> valueColumns;

    /// The aggregate columns of one channel.
    ///
    /// @param channel
    ///     the source channel name
    /// @param mean
    ///     per-bucket mean, named `<channel>_mean`
    /// @param stdDev
    ///     per-bucket sample standard deviation, named `<channel>_std`
    /// @param counts
    ///     number of samples per bucket
    public record ChannelAggregate(String channel, ValueColumn mean, ValueColumn stdDev, int[] counts) {
        public ChannelAggregate {
            if (mean.size() != stdDev.size() || mean.size() != counts.length) {
                throw new IllegalArgumentException("Aggregate columns of '" + channel + "' differ in length");
            }
        }
    }

    public AggregatedTable(AggregationInterval interval, Instant[] bucketStarts, List<ChannelAggregate> channels) {
        this.interval = Objects.requireNonNull(interval, "interval cannot be null");
        Objects.requireNonNull(bucketStarts, "bucket starts cannot be null");
        for (int i = 1; i < bucketStarts.length; i++) {
            if (!bucketStarts[i].equals(bucketStarts[i - 1].plus(interval.duration()))) {
                throw new IllegalArgumentException("Bucket " + i + " starts at " + bucketStarts[i]
                                                   + ", expected " + bucketStarts[i - 1].plus(interval.duration()));
            }
        }
        Map<String, ChannelAggregate> index = new LinkedHashMap<>();
        List<ValueColumn> columns = new ArrayList<>(channels.size() * 2);
        for (ChannelAggregate aggregate : channels) {
            if (aggregate.counts().length != bucketStarts.length) {
                throw new IllegalArgumentException("Channel '" + aggregate.channel() + "' has "
                                                   + aggregate.counts().length + " buckets, expected "
                                                   + bucketStarts.length);
            }
            if (index.put(aggregate.channel(), aggregate) != null) {
                throw new IllegalArgumentException("Duplicate channel '" + aggregate.channel() + "'");
            }
            columns.add(aggregate.mean());
            columns.add(aggregate.stdDev());
        }
        this.bucketStarts = bucketStarts.clone();
        this.channels = Collections.unmodifiableMap(index);
        this.valueColumns = List.copyOf(columns);
    }

    public static String meanColumn(String channel) {
        return channel + MEAN_SUFFIX;
    }

    public static String stdColumn(String channel) {
        return channel + STD_SUFFIX;
    }

    public AggregationInterval interval() {
        return interval;
    }

    @Override
    public String timeColumnName() {
        return TIME_COLUMN;
    }

    @Override
    public int rowCount() {
        return bucketStarts.length;
    }

    @Override
    public List<ValueColumn> valueColumns() {
        return valueColumns;
    }

    public int bucketCount() {
        return bucketStarts.length;
    }

    public Instant bucketStart(int bucket) {
        return bucketStarts[bucket];
    }

    public Instant bucketEnd(int bucket) {
        return bucketStarts[bucket].plus(interval.duration());
    }

    public List<String> channelNames() {
        return new ArrayList<>(channels.keySet());
    }

    public ChannelAggregate channel(String name) {
        ChannelAggregate aggregate = channels.get(name);
        if (aggregate == null) {
            throw new IllegalArgumentException("Unknown channel '" + name + "', available: " + channels.keySet());
        }
        return aggregate;
    }

    public OptionalDouble mean(String channel, int bucket) {
        return channel(channel).mean().get(bucket);
    }

    public OptionalDouble stdDev(String channel, int bucket) {
        return channel(channel).stdDev().get(bucket);
    }

    public int count(String channel, int bucket) {
        return channel(channel).counts()[bucket];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AggregatedTable)) {
            return false;
        }
        AggregatedTable other = (AggregatedTable) o;
        return interval.equals(other.interval)
               && Arrays.equals(bucketStarts, other.bucketStarts)
               && valueColumns.equals(other.valueColumns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(interval, Arrays.hashCode(bucketStarts), valueColumns);
    }

    @Override
    public String toString() {
        return "AggregatedTable{interval=" + interval + ", buckets=" + bucketStarts.length
               + ", channels=" + channels.keySet() + "}";
    }
}
