package io.nosqlbench.sensordata.merge;

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

import io.nosqlbench.sensordata.model.ChannelSeries;
import io.nosqlbench.sensordata.model.MergedTable;
import io.nosqlbench.sensordata.model.ValueColumn;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Outer-joins channel series on their tick timestamps.
///
/// The result has one row per distinct tick across all inputs, in ascending order, and one
/// column per channel in input order. A channel without a sample at some row holds a missing
/// cell there. No row is dropped at this stage.
///
/// The join is done in one pass: the union of all ticks is sorted once and each channel's samples
/// are placed into it by binary search. This gives the same table as folding pairwise outer
/// joins left to right.
public class TimelineMerger {
    private static final Logger logger = LogManager.getLogger(TimelineMerger.class);

    /// @param series
    ///     at least one channel series, with distinct names
    /// @return the merged table
    /// @throws ChannelNameCollisionException
    ///     if two series share a name
    public MergedTable merge(List<ChannelSeries> series) {
        if (series == null || series.isEmpty()) {
            throw new IllegalArgumentException("At least one channel series is required to build a timeline");
        }
        checkNames(series);

        long[] timeline = unionOfTicks(series);
        List<ValueColumn> columns = new ArrayList<>(series.size());
        for (ChannelSeries channel : series) {
            ValueColumn source = channel.values();
            ValueColumn.Builder column = ValueColumn.builder(channel.name(), timeline.length);
            for (int i = 0; i < channel.size(); i++) {
                if (source.isPresent(i)) {
                    int row = Arrays.binarySearch(timeline, channel.tick(i));
                    column.set(row, source.valueAt(i));
                }
            }
            columns.add(column.build());
        }

        logger.debug("Merged {} channels into {} rows", series.size(), timeline.length);
        return new MergedTable(timeline, columns);
    }

    private static void checkNames(List<ChannelSeries> series) {
        Map<String, List<String>> sourcesByName = new LinkedHashMap<>();
        for (ChannelSeries channel : series) {
            String source = channel.source().map(Object::toString).orElse("<memory>");
            sourcesByName.computeIfAbsent(channel.name(), n -> new ArrayList<>()).add(source);
        }
        for (Map.Entry<String, List<String>> entry : sourcesByName.entrySet()) {
            if (entry.getValue().size() > 1) {
                throw new ChannelNameCollisionException(entry.getKey(), entry.getValue());
            }
        }
    }

    private static long[] unionOfTicks(List<ChannelSeries> series) {
        int total = 0;
        for (ChannelSeries channel : series) {
            total = Math.addExact(total, channel.size());
        }
        long[] all = new long[total];
        int offset = 0;
        for (ChannelSeries channel : series) {
            for (int i = 0; i < channel.size(); i++) {
                all[offset++] = channel.tick(i);
            }
        }
        Arrays.sort(all);

        int distinct = 0;
        for (int i = 0; i < all.length; i++) {
            if (distinct == 0 || all[i] != all[distinct - 1]) {
                all[distinct++] = all[i];
            }
        }
        return Arrays.copyOf(all, distinct);
    }
}
