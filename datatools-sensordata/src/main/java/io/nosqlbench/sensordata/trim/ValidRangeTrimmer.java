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
import io.nosqlbench.sensordata.model.ValueColumn;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Cuts a merged table down to the span where a target channel has data.
///
/// Rows before the target's first present value and after its last present value are removed.
/// Interior rows are always kept, even where the target itself is missing. Trimming a trimmed
/// table with the same target returns an equal table.
public class ValidRangeTrimmer {
    private static final Logger logger = LogManager.getLogger(ValidRangeTrimmer.class);

    /// Trim after checking that the table has one column per expected channel plus the time column.
    ///
    /// @param table
    ///     the merged table
    /// @param targetColumn
    ///     the channel defining the valid range
    /// @param expectedChannelCount
    ///     the number of channels that went into the merge
    /// @throws SchemaMismatchException
    ///     if the column count is not `expectedChannelCount + 1`
    /// @throws IllegalArgumentException
    ///     if the target channel does not exist
    public TrimResult trim(MergedTable table, String targetColumn, int expectedChannelCount) {
        int expectedColumns = expectedChannelCount + 1;
        if (table.columnCount() != expectedColumns) {
            throw new SchemaMismatchException(expectedColumns, table.columnCount());
        }
        return trim(table, targetColumn);
    }

    /// Trim without a column count check.
    public TrimResult trim(MergedTable table, String targetColumn) {
        ValueColumn target = table.channel(targetColumn);

        int first = target.firstPresentIndex();
        if (first < 0) {
            logger.warn("Target channel '{}' has no values; keeping all {} rows untrimmed",
                targetColumn, table.rowCount());
            return TrimResult.untrimmed(table, targetColumn);
        }
        int last = target.lastPresentIndex();

        int leading = first;
        int trailing = table.rowCount() - 1 - last;
        MergedTable trimmed = (leading == 0 && trailing == 0) ? table : table.slice(first, last + 1);
        logger.info("Trimmed to valid range of '{}': {} rows kept, {} leading and {} trailing removed",
            targetColumn, trimmed.rowCount(), leading, trailing);
        return new TrimResult(trimmed, targetColumn, false, leading, trailing);
    }
}
