package io.nosqlbench.sensordata.trim;

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

import io.nosqlbench.sensordata.model.MergedTable;

/// Outcome of trimming a merged table to the valid range of a target channel.
///
/// @param table
///     the trimmed table, or the input table when no trim was possible
/// @param targetColumn
///     the channel whose valid range was used
/// @param targetEmpty
///     true when the target had no values at all and the table was left as it was
/// @param leadingRowsRemoved
///     rows dropped before the target's first value
/// @param trailingRowsRemoved
///     rows dropped after the target's last value
public record TrimResult(
    MergedTable table,
    String targetColumn,
    boolean targetEmpty,
    int leadingRowsRemoved,
    int trailingRowsRemoved
) {

    public static TrimResult untrimmed(MergedTable table, String targetColumn) {
        return new TrimResult(table, targetColumn, true, 0, 0);
    }

    public int rowsRemoved() {
        return leadingRowsRemoved + trailingRowsRemoved;
    }
}
