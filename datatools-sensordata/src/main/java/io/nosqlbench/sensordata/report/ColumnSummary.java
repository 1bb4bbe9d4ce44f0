package io.nosqlbench.sensordata.report;

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

import java.util.OptionalDouble;

/// Diagnostics for one column.
///
/// @param column
///     the column name
/// @param rowCount
///     number of cells in the column
/// @param missingCount
///     number of missing cells
/// @param mean
///     mean of the present cells, absent when moments were not requested or no cell is present
/// @param stdDev
///     sample standard deviation of the present cells, absent below two present cells
public record ColumnSummary(String column, int rowCount, int missingCount, OptionalDouble mean, OptionalDouble stdDev) {

    /// @return missing cells as a percentage of all cells, 0 for an empty column
    public double missingPercent() {
        return rowCount == 0 ? 0.0 : 100.0 * missingCount / rowCount;
    }
}
