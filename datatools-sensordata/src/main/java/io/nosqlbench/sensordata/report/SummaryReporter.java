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

import io.nosqlbench.sensordata.aggregate.RunningMoments;
import io.nosqlbench.sensordata.model.ColumnarTable;
import io.nosqlbench.sensordata.model.ValueColumn;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/// Computes missing-value percentages, and optionally mean and standard deviation, per column.
///
/// Reporting is diagnostic only. It never changes the table, and a failure while summarizing is
/// logged and turned into an empty report so that it cannot abort a run.
public class SummaryReporter {
    private static final Logger logger = LogManager.getLogger(SummaryReporter.class);

    /// @param title
    ///     label for the report
    /// @param table
    ///     any table
    /// @param includeMoments
    ///     whether to compute mean and standard deviation of the value columns; usually off for
    ///     tables which are already aggregates
    public SummaryReport summarize(String title, ColumnarTable table, boolean includeMoments) {
        try {
            List<ColumnSummary> columns = new ArrayList<>();
            columns.add(new ColumnSummary(table.timeColumnName(), table.rowCount(), 0,
                OptionalDouble.empty(), OptionalDouble.empty()));
            for (ValueColumn column : table.valueColumns()) {
                columns.add(summarize(column, includeMoments));
            }
            return new SummaryReport(title, table.rowCount(), includeMoments, columns);
        } catch (RuntimeException e) {
            logger.warn("Could not summarize {}: {}", title, e.getMessage(), e);
            return SummaryReport.empty(title);
        }
    }

    private static ColumnSummary summarize(ValueColumn column, boolean includeMoments) {
        if (!includeMoments) {
            return new ColumnSummary(column.name(), column.size(), column.missingCount(),
                OptionalDouble.empty(), OptionalDouble.empty());
        }
        RunningMoments moments = new RunningMoments();
        for (int row = 0; row < column.size(); row++) {
            if (column.isPresent(row)) {
                moments.add(column.valueAt(row));
            }
        }
        return new ColumnSummary(column.name(), column.size(), column.missingCount(),
            moments.mean(), moments.sampleStdDev());
    }
}
