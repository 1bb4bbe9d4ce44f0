package io.nosqlbench.sensordata.pipeline;

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

import io.nosqlbench.sensordata.model.AggregatedTable;
import io.nosqlbench.sensordata.model.AggregationInterval;
import io.nosqlbench.sensordata.model.AlignedTable;
import io.nosqlbench.sensordata.model.MergedTable;
import io.nosqlbench.sensordata.report.SummaryReport;
import io.nosqlbench.sensordata.trim.TrimResult;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// The tables and summaries of one alignment run, together with the files it wrote.
///
/// @param merged
///     the outer-joined table before trimming
/// @param trim
///     the trimming outcome
/// @param aligned
///     the trimmed table on calendar time
/// @param aggregates
///     one table per interval, in configured order
/// @param summaries
///     column summaries, aligned table first
/// @param writtenFiles
///     outputs moved into place, empty when the tables were only computed
public record PipelineResult(
    MergedTable merged,
    TrimResult trim,
    AlignedTable aligned,
    Map<AggregationInterval, AggregatedTable> aggregates,
    List<SummaryReport> summaries,
    List<Path> writtenFiles
) {

    public PipelineResult {
        aggregates = Collections.unmodifiableMap(new LinkedHashMap<>(aggregates));
        summaries = List.copyOf(summaries);
        writtenFiles = List.copyOf(writtenFiles);
    }

    PipelineResult withWrittenFiles(List<Path> files) {
        return new PipelineResult(merged, trim, aligned, aggregates, summaries, files);
    }

    /// @return whether the run finished but something about its output deserves attention
    public boolean hasWarnings() {
        return trim.targetEmpty();
    }
}
