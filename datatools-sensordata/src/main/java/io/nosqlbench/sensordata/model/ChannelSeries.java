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

import java.nio.file.Path;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.IntStream;

/// One channel's recording: raw tick timestamps and their values.
///
/// The series is sorted by tick when it is constructed, and tick values must be distinct within
/// the series. Values may be missing at a recorded tick. Instances are immutable.
public final class ChannelSeries {

    private final String name;
    private final long[] ticks;
    private final ValueColumn values;
    private final Path source;

    /// @param name
    ///     the channel name, used as the column header downstream
    /// @param ticks
    ///     raw tick timestamps, in any order
    /// @param values
    ///     values aligned with `ticks`; the column is renamed to the channel name
    /// @param source
    ///     the file the series was loaded from, or null for in-memory series
    public ChannelSeries(String name, long[] ticks, ValueColumn values, Path source) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Channel name cannot be null or blank");
        }
        if (ticks.length != values.size()) {
            throw new IllegalArgumentException("Channel '" + name + "' has " + ticks.length
                                               + " timestamps but " + values.size() + " values");
        }
        this.name = name;
        this.source = source;

        if (isStrictlyAscending(ticks)) {
            this.ticks = ticks.clone();
            this.values = values.name().equals(name) ? values : values.renamed(name);
        } else {
            int[] order = IntStream.range(0, ticks.length).boxed()
                .sorted(Comparator.comparingLong(i -> ticks[i]))
                .mapToInt(Integer::intValue)
                .toArray();
            long[] sortedTicks = new long[ticks.length];
            double[] sortedValues = new double[ticks.length];
            BitSet sortedPresent = new BitSet(ticks.length);
            for (int i = 0; i < order.length; i++) {
                sortedTicks[i] = ticks[order[i]];
                if (values.isPresent(order[i])) {
                    sortedValues[i] = values.valueAt(order[i]);
                    sortedPresent.set(i);
                }
            }
            for (int i = 1; i < sortedTicks.length; i++) {
                if (sortedTicks[i] == sortedTicks[i - 1]) {
                    throw new IllegalArgumentException(
                        "Channel '" + name + "' has more than one value at tick " + sortedTicks[i]);
                }
            }
            this.ticks = sortedTicks;
            this.values = new ValueColumn(name, sortedValues, sortedPresent);
        }
    }

    public ChannelSeries(String name, long[] ticks, ValueColumn values) {
        this(name, ticks, values, null);
    }

    /// Create an in-memory series in which every value is present.
    public static ChannelSeries of(String name, long[] ticks, double[] values) {
        return new ChannelSeries(name, ticks, ValueColumn.ofPresent(name, values));
    }

    private static boolean isStrictlyAscending(long[] ticks) {
        for (int i = 1; i < ticks.length; i++) {
            if (ticks[i] <= ticks[i - 1]) {
                return false;
            }
        }
        return true;
    }

    public String name() {
        return name;
    }

    public int size() {
        return ticks.length;
    }

    public long tick(int index) {
        return ticks[index];
    }

    public long[] ticks() {
        return ticks.clone();
    }

    public ValueColumn values() {
        return values;
    }

    public Optional<Path> source() {
        return Optional.ofNullable(source);
    }

    @Override
    public String toString() {
        return "ChannelSeries{" + name + ", size=" + ticks.length
               + (source != null ? ", source=" + source : "") + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChannelSeries)) {
            return false;
        }
        ChannelSeries other = (ChannelSeries) o;
        return name.equals(other.name) && Arrays.equals(ticks, other.ticks) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * name.hashCode() + Arrays.hashCode(ticks)) + values.hashCode();
    }
}
