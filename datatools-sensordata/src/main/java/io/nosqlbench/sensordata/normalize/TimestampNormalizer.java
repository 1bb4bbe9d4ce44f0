package io.nosqlbench.sensordata.normalize;

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

import io.nosqlbench.sensordata.epoch.TickEpochConverter;
import io.nosqlbench.sensordata.model.AlignedTable;
import io.nosqlbench.sensordata.model.MergedTable;

import java.time.Instant;

/// Replaces the raw tick column of a merged table with calendar time.
///
/// Runs after trimming. The conversion preserves order, so the aligned table keeps the row
/// order of the merged table; ticks that fall into the same second end up with equal timestamps.
public class TimestampNormalizer {

    /// @throws io.nosqlbench.sensordata.epoch.InvalidTickException
    ///     if any tick is outside the convertible range
    public AlignedTable normalize(MergedTable table) {
        Instant[] timestamps = new Instant[table.rowCount()];
        for (int row = 0; row < timestamps.length; row++) {
            timestamps[row] = TickEpochConverter.toInstant(table.tick(row));
        }
        return new AlignedTable(timestamps, table.valueColumns());
    }
}
