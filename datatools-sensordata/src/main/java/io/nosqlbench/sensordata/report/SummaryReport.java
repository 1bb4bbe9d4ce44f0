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

import java.util.List;
import java.util.Optional;

/// Column diagnostics of one table.
///
/// @param title
///     what the report describes, e.g. `aligned` or `aggregate 3min`
/// @param rowCount
///     rows in the summarized table
/// @param includesMoments
///     whether mean and standard deviation were computed
/// @param columns
///     one entry per column, time column first; empty when summarizing failed
public record SummaryReport(String title, int rowCount, boolean includesMoments, List<ColumnSummary> columns) {

    public SummaryReport {
        columns = List.copyOf(columns);
    }

    public static SummaryReport empty(String title) {
        return new SummaryReport(title, 0, false, List.of());
    }

    public boolean isEmpty() {
        return columns.isEmpty();
    }

    public Optional<ColumnSummary> column(String name) {
        return columns.stream().filter(c -> c.column().equals(name)).findFirst();
    }
}
