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

import io.nosqlbench.sensordata.io.ChannelLoader;
import io.nosqlbench.sensordata.io.DuplicatePolicy;
import io.nosqlbench.sensordata.model.AggregationInterval;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Everything one alignment run needs to know, fixed before the run starts.
///
/// @param inputs
///     channel files and directories holding channel files
/// @param filePattern
///     glob selecting channel files inside input directories
/// @param outputDirectory
///     directory receiving all outputs
/// @param rawOutputName
///     file name of the raw aligned table
/// @param targetColumn
///     channel whose valid range bounds the timeline
/// @param aggregate
///     whether to produce aggregated tables
/// @param intervals
///     aggregation widths, each producing one `aggr_<label>.csv`
/// @param showStats
///     whether to print column summaries
/// @param statsFile
///     JSON file receiving column summaries, or null for none
/// @param dmsColumns
///     channels holding degree-minute coordinates
/// @param duplicatePolicy
///     handling of repeated ticks within one channel file
/// @param aggregationParallelism
///     number of intervals aggregated concurrently
/// @param force
///     whether existing outputs may be replaced
public record PipelineConfig(
    List<Path> inputs,
    String filePattern,
    Path outputDirectory,
    String rawOutputName,
    String targetColumn,
    boolean aggregate,
    List<AggregationInterval> intervals,
    boolean showStats,
    Path statsFile,
    Set<String> dmsColumns,
    DuplicatePolicy duplicatePolicy,
    int aggregationParallelism,
    boolean force
) {

    public static final Path DEFAULT_OUTPUT_DIRECTORY = Path.of("data");
    public static final String DEFAULT_RAW_OUTPUT = "final.csv";
    public static final List<String> DEFAULT_INTERVALS = List.of("3min", "10min");

    public PipelineConfig {
        if (inputs == null || inputs.isEmpty()) {
            throw new IllegalArgumentException("At least one input path is required");
        }
        inputs = List.copyOf(inputs);
        Objects.requireNonNull(filePattern, "filePattern cannot be null");
        Objects.requireNonNull(outputDirectory, "outputDirectory cannot be null");
        if (rawOutputName == null || rawOutputName.isBlank()) {
            throw new IllegalArgumentException("Raw output name cannot be blank");
        }
        if (targetColumn == null || targetColumn.isBlank()) {
            throw new IllegalArgumentException("A target column is required");
        }
        intervals = List.copyOf(intervals);
        Set<String> labels = new HashSet<>();
        for (AggregationInterval interval : intervals) {
            if (!labels.add(interval.fileLabel())) {
                throw new IllegalArgumentException("Interval '" + interval.label() + "' is given more than once");
            }
        }
        if (aggregate && intervals.isEmpty()) {
            throw new IllegalArgumentException("Aggregation is enabled but no intervals are given");
        }
        dmsColumns = Set.copyOf(dmsColumns);
        Objects.requireNonNull(duplicatePolicy, "duplicatePolicy cannot be null");
        if (aggregationParallelism < 1) {
            throw new IllegalArgumentException("Aggregation parallelism must be at least 1, got " + aggregationParallelism);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return the path of the raw aligned table
    public Path rawOutputPath() {
        return outputDirectory.resolve(rawOutputName);
    }

    /// @return the path of the aggregated table for one interval
    public Path aggregatedOutputPath(AggregationInterval interval) {
        return outputDirectory.resolve(aggregatedOutputName(interval));
    }

    public static String aggregatedOutputName(AggregationInterval interval) {
        return "aggr_" + interval.fileLabel() + ".csv";
    }

    public Optional<Path> statsPath() {
        return Optional.ofNullable(statsFile);
    }

    /// Creates a loader configured for this run.
    public ChannelLoader channelLoader() {
        return new ChannelLoader(duplicatePolicy, dmsColumns, filePattern);
    }

    /// Builder for [PipelineConfig]. Unset fields take the defaults of the original batch job:
    /// output to `data/final.csv`, aggregates at 3 and 10 minutes.
    public static final class Builder {
        private final List<Path> inputs = new ArrayList<>();
        private String filePattern = ChannelLoader.DEFAULT_PATTERN;
        private Path outputDirectory = DEFAULT_OUTPUT_DIRECTORY;
        private String rawOutputName = DEFAULT_RAW_OUTPUT;
        private String targetColumn;
        private boolean aggregate = true;
        private List<AggregationInterval> intervals;
        private boolean showStats;
        private Path statsFile;
        private final Set<String> dmsColumns = new LinkedHashSet<>();
        private DuplicatePolicy duplicatePolicy = DuplicatePolicy.FAIL;
        private int aggregationParallelism = 1;
        private boolean force;

        private Builder() {
        }

        public Builder input(Path input) {
            this.inputs.add(input);
            return this;
        }

        /// Replaces any inputs given so far.
        public Builder inputs(List<Path> inputs) {
            this.inputs.clear();
            this.inputs.addAll(inputs);
            return this;
        }

        public Builder filePattern(String filePattern) {
            this.filePattern = filePattern;
            return this;
        }

        public Builder outputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder rawOutputName(String rawOutputName) {
            this.rawOutputName = rawOutputName;
            return this;
        }

        public Builder targetColumn(String targetColumn) {
            this.targetColumn = targetColumn;
            return this;
        }

        public Builder aggregate(boolean aggregate) {
            this.aggregate = aggregate;
            return this;
        }

        public Builder intervals(List<AggregationInterval> intervals) {
            this.intervals = new ArrayList<>(intervals);
            return this;
        }

        /// Parse and set intervals such as `3min` or `PT10M`.
        public Builder intervalSpecs(List<String> specs) {
            List<AggregationInterval> parsed = new ArrayList<>(specs.size());
            for (String spec : specs) {
                parsed.add(AggregationInterval.parse(spec));
            }
            return intervals(parsed);
        }

        public Builder showStats(boolean showStats) {
            this.showStats = showStats;
            return this;
        }

        public Builder statsFile(Path statsFile) {
            this.statsFile = statsFile;
            return this;
        }

        /// Replaces any coordinate channels given so far.
        public Builder dmsColumns(Set<String> dmsColumns) {
            this.dmsColumns.clear();
            this.dmsColumns.addAll(dmsColumns);
            return this;
        }

        public Builder duplicatePolicy(DuplicatePolicy duplicatePolicy) {
            this.duplicatePolicy = duplicatePolicy;
            return this;
        }

        public Builder aggregationParallelism(int aggregationParallelism) {
            this.aggregationParallelism = aggregationParallelism;
            return this;
        }

        public Builder force(boolean force) {
            this.force = force;
            return this;
        }

        public PipelineConfig build() {
            List<AggregationInterval> chosen = intervals;
            if (chosen == null) {
                chosen = new ArrayList<>();
                for (String spec : DEFAULT_INTERVALS) {
                    chosen.add(AggregationInterval.parse(spec));
                }
            }
            return new PipelineConfig(
                inputs, filePattern, outputDirectory, rawOutputName, targetColumn, aggregate,
                aggregate ? chosen : List.of(), showStats, statsFile, dmsColumns, duplicatePolicy,
                aggregationParallelism, force);
        }
    }
}
