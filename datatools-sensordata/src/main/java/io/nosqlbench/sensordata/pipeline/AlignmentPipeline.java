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

import io.nosqlbench.sensordata.aggregate.IntervalAggregator;
import io.nosqlbench.sensordata.io.StagedOutputs;
import io.nosqlbench.sensordata.io.TableCsvWriter;
import io.nosqlbench.sensordata.merge.TimelineMerger;
import io.nosqlbench.sensordata.model.AggregatedTable;
import io.nosqlbench.sensordata.model.AggregationInterval;
import io.nosqlbench.sensordata.model.AlignedTable;
import io.nosqlbench.sensordata.model.ChannelSeries;
import io.nosqlbench.sensordata.model.MergedTable;
import io.nosqlbench.sensordata.normalize.TimestampNormalizer;
import io.nosqlbench.sensordata.report.SummaryRenderer;
import io.nosqlbench.sensordata.report.SummaryReport;
import io.nosqlbench.sensordata.report.SummaryReporter;
import io.nosqlbench.sensordata.trim.TrimResult;
import io.nosqlbench.sensordata.trim.ValidRangeTrimmer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Runs the whole alignment job: load, merge, trim, normalize, aggregate, summarize and write.
///
/// All tables are computed before any file is written, and outputs are staged and moved into
/// place together, so a failing run leaves the output directory as it found it.
public class AlignmentPipeline {
    private static final Logger logger = LogManager.getLogger(AlignmentPipeline.class);

    private final TimelineMerger merger = new TimelineMerger();
    private final ValidRangeTrimmer trimmer = new ValidRangeTrimmer();
    private final TimestampNormalizer normalizer = new TimestampNormalizer();
    private final IntervalAggregator aggregator = new IntervalAggregator();
    private final SummaryReporter reporter = new SummaryReporter();
    private final SummaryRenderer renderer = new SummaryRenderer();
    private final TableCsvWriter csvWriter = new TableCsvWriter();
    private final PrintStream console;

    public AlignmentPipeline() {
        this(System.out);
    }

    /// @param console
    ///     where summaries are printed when requested
    public AlignmentPipeline(PrintStream console) {
        this.console = console;
    }

    /// Load the configured inputs, compute every table and write the outputs.
    ///
    /// @return the computed tables and the files written
    public PipelineResult run(PipelineConfig config) throws IOException {
        List<ChannelSeries> series = config.channelLoader().loadAll(config.inputs());
        PipelineResult result = process(series, config);

        if (config.showStats()) {
            for (SummaryReport summary : result.summaries()) {
                renderer.renderText(summary, console);
            }
        }

        List<Path> written;
        try (StagedOutputs outputs = new StagedOutputs(config.force())) {
            outputs.stage(config.rawOutputPath(), tmp -> csvWriter.write(result.aligned(), tmp));
            for (Map.Entry<AggregationInterval, AggregatedTable> entry : result.aggregates().entrySet()) {
                outputs.stage(config.aggregatedOutputPath(entry.getKey()),
                    tmp -> csvWriter.write(entry.getValue(), tmp));
            }
            if (config.statsFile() != null) {
                outputs.stage(config.statsFile(), tmp -> renderer.writeJson(result.summaries(), tmp));
            }
            written = outputs.commit();
        }
        logger.info("Wrote {} file(s) to {}", written.size(), config.outputDirectory());
        return result.withWrittenFiles(written);
    }

    /// Compute every table from already loaded channels without touching the file system.
    public PipelineResult process(List<ChannelSeries> series, PipelineConfig config) {
        MergedTable merged = merger.merge(series);
        TrimResult trim = trimmer.trim(merged, config.targetColumn(), series.size());
        AlignedTable aligned = normalizer.normalize(trim.table());
        logger.info("Aligned {} channels over {} rows", aligned.channelNames().size(), aligned.rowCount());

        Map<AggregationInterval, AggregatedTable> aggregates = config.aggregate()
            ? aggregator.aggregateAll(aligned, config.intervals(), config.aggregationParallelism())
            : Map.of();

        List<SummaryReport> summaries = new ArrayList<>();
        if (config.showStats() || config.statsFile() != null) {
            summaries.add(reporter.summarize("aligned", aligned, true));
            for (Map.Entry<AggregationInterval, AggregatedTable> entry : aggregates.entrySet()) {
                summaries.add(reporter.summarize("aggregate " + entry.getKey().label(), entry.getValue(), false));
            }
        }
        return new PipelineResult(merged, trim, aligned, aggregates, summaries, List.of());
    }
}
