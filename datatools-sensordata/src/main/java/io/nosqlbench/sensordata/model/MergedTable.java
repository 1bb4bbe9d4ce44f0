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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// The outer-joined timeline of all channels, keyed by raw tick timestamp.
///
/// Rows are strictly ascending by tick, one row per distinct tick seen in any channel. Each
/// channel contributes one value column, missing wherever that channel has no sample.
public final class MergedTable implements ColumnarTable {

    /// Header of the raw tick column
    public static final String TIME_COLUMN = "timestamp";

    private final long[] ticks;
    private final List<ValueColumn> channels;
    private final Map<String, ValueColumn> byName;

    public MergedTable(long[] ticks, List<ValueColumn> channels) {
        Objects.requireNonNull(ticks, "ticks cannot be null");
        Objects.requireNonNull(channels, "channels cannot be null");
        for (int i = 1; i < ticks.length; i++) {
            if (ticks[i] <= ticks[i - 1]) {
                throw new IllegalArgumentException(
                    "Merged ticks must be strictly ascending, found " + ticks[i] + " after " + ticks[i - 1]);
            }
        }
        Map<String, ValueColumn> index = new LinkedHashMap<>();
        for (ValueColumn channel : channels) {
            if (channel.size() != ticks.length) {
                throw new IllegalArgumentException("Channel '" + channel.name() + "' has " + channel.size()
                                                   + " cells but the table has " + ticks.length + " rows");
            }
            if (index.put(channel.name(), channel) != null) {
                throw new IllegalArgumentException("Duplicate channel column '" + channel.name() + "'");
            }
        }
        this.ticks = ticks.clone();
        this.channels = List.copyOf(channels);
        this.byName = Collections.unmodifiableMap(index);
    }

    @Override
    public String timeColumnName() {
        return TIME_COLUMN;
    }

    @Override
    public int rowCount() {
        return ticks.length;
    }

    @Override
    public List<ValueColumn> valueColumns() {
        return channels;
    }

    public int channelCount() {
        return channels.size();
    }

    public List<String> channelNames() {
        return new ArrayList<>(byName.keySet());
    }

    public boolean hasChannel(String name) {
        return byName.containsKey(name);
    }

    /// @throws IllegalArgumentException
    ///     if no channel of that name exists
    public ValueColumn channel(String name) {
        ValueColumn column = byName.get(name);
        if (column == null) {
            throw new IllegalArgumentException("Unknown channel '" + name + "', available: " + byName.keySet());
        }
        return column;
    }

    public long tick(int row) {
        return ticks[row];
    }

    public long[] ticks() {
        return ticks.clone();
    }

    /// Copy rows `[fromInclusive, toExclusive)` into a new table. Row numbering restarts at 0.
    public MergedTable slice(int fromInclusive, int toExclusive) {
        List<ValueColumn> sliced = new ArrayList<>(channels.size());
        for (ValueColumn channel : channels) {
            sliced.add(channel.slice(fromInclusive, toExclusive));
        }
        return new MergedTable(Arrays.copyOfRange(ticks, fromInclusive, toExclusive), sliced);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MergedTable)) {
            return false;
        }
        MergedTable other = (MergedTable) o;
        return Arrays.equals(ticks, other.ticks) && channels.equals(other.channels);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(ticks) + channels.hashCode();
    }

    @Override
    public String toString() {
        return "MergedTable{rows=" + ticks.length + ", channels=" + byName.keySet() + "}";
    }
}
