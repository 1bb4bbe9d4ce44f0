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
import java.util.List;
import java.util.Objects;

/// The merged timeline after tick timestamps have been replaced by calendar time.
///
/// This is the raw aligned output and the input of every aggregation. Timestamps are
/// non-decreasing; distinct ticks within the same second share a timestamp.
public final class AlignedTable implements ColumnarTable {

    /// Header of the calendar time column
    public static final String TIME_COLUMN = "datetime";

    private final Instant[] timestamps;
    private final List<ValueColumn> channels;

    public AlignedTable(Instant[] timestamps, List<ValueColumn> channels) {
        Objects.requireNonNull(timestamps, "timestamps cannot be null");
        for (int i = 0; i < timestamps.length; i++) {
            Objects.requireNonNull(timestamps[i], "timestamp at row " + i + " cannot be null");
            if (i > 0 && timestamps[i].isBefore(timestamps[i - 1])) {
                throw new IllegalArgumentException(
                    "Timestamps must be non-decreasing, found " + timestamps[i] + " after " + timestamps[i - 1]);
            }
        }
        for (ValueColumn channel : channels) {
            if (channel.size() != timestamps.length) {
                throw new IllegalArgumentException("Channel '" + channel.name() + "' has " + channel.size()
                                                   + " cells but the table has " + timestamps.length + " rows");
            }
        }
        this.timestamps = timestamps.clone();
        this.channels = List.copyOf(channels);
    }

    @Override
    public String timeColumnName() {
        return TIME_COLUMN;
    }

    @Override
    public int rowCount() {
        return timestamps.length;
    }

    @Override
    public List<ValueColumn> valueColumns() {
        return channels;
    }

    public List<String> channelNames() {
        List<String> names = new ArrayList<>(channels.size());
        channels.forEach(c -> names.add(c.name()));
        return names;
    }

    public Instant timestamp(int row) {
        return timestamps[row];
    }

    public Instant[] timestamps() {
        return timestamps.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AlignedTable)) {
            return false;
        }
        AlignedTable other = (AlignedTable) o;
        return Arrays.equals(timestamps, other.timestamps) && channels.equals(other.channels);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(timestamps) + channels.hashCode();
    }

    @Override
    public String toString() {
        return "AlignedTable{rows=" + timestamps.length + ", channels=" + channelNames() + "}";
    }
}
