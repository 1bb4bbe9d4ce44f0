package io.nosqlbench.sensordata.command.align;

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

import io.nosqlbench.sensordata.SensorDataException;
import io.nosqlbench.sensordata.command.common.AggregationIntervalConverter;
import io.nosqlbench.sensordata.command.common.InputPathsOption;
import io.nosqlbench.sensordata.command.common.OutputDirectoryOption;
import io.nosqlbench.sensordata.command.common.VerbosityOption;
import io.nosqlbench.sensordata.io.DuplicatePolicy;
import io.nosqlbench.sensordata.model.AggregationInterval;
import io.nosqlbench.sensordata.pipeline.AlignmentPipeline;
import io.nosqlbench.sensordata.pipeline.PipelineConfig;
import io.nosqlbench.sensordata.pipeline.PipelineConfigLoader;
import io.nosqlbench.sensordata.pipeline.PipelineResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.Callable;

/**
 # Channel alignment

 Loads one CSV file per sensor channel, outer-joins them on their tick timestamps, trims the
 timeline to the rows where the target channel has data, converts ticks to calendar time and
 writes the raw aligned table plus one aggregated table per interval.

 # Basic Usage
 ```
 align -i raw/ --target oxygen
 align -i raw/ --target oxygen -o data --interval 3min --interval 10min --stats
 align --config align.yaml --force
 ```

 Options given on the command line override the values of a `--config` file.
 */
@CommandLine.Command(name = "align",
    header = "Align sensor channels onto one timeline and aggregate them",
    description = "Merge channel files on their tick timestamps, trim to the target channel's valid range,\n" +
        "convert ticks to calendar time and write final.csv and aggr_<interval>.csv tables.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success, including a target channel without data (logged as a warning)", "2: error"})
public class CMD_align implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_align.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Mixin
    private InputPathsOption inputOption = new InputPathsOption();

    @CommandLine.Mixin
    private OutputDirectoryOption outputOption = new OutputDirectoryOption();

    @CommandLine.Mixin
    private VerbosityOption verbosity = new VerbosityOption();

    @CommandLine.Option(names = {"-c", "--config"},
        description = "YAML file with pipeline settings")
    private Path configFile;

    @CommandLine.Option(names = {"-t", "--target"},
        description = "Channel whose first and last value bound the output timeline")
    private String target;

    @CommandLine.Option(names = {"--interval"},
        description = "Aggregation interval, e.g. 30s, 3min, 10T, 2h or PT10M. May be repeated (default: 3min, 10min)",
        converter = AggregationIntervalConverter.class)
    private List<AggregationInterval> intervals = new ArrayList<>();

    @CommandLine.Option(names = {"--no-aggregate"},
        description = "Only write the raw aligned table")
    private Boolean noAggregate;

    @CommandLine.Option(names = {"--stats"},
        description = "Print missing value percentages and column statistics")
    private Boolean stats;

    @CommandLine.Option(names = {"--stats-file"},
        description = "Write column statistics as JSON to this file")
    private Path statsFile;

    @CommandLine.Option(names = {"--dms-column"},
        description = "Channel holding degree-minute coordinates such as 4807.038N. May be repeated or comma separated",
        split = ",")
    private List<String> dmsColumns = new ArrayList<>();

    @CommandLine.Option(names = {"--duplicates"},
        description = "Handling of repeated ticks within a channel: ${COMPLETION-CANDIDATES} (default: FAIL)")
    private DuplicatePolicy duplicates;

    @CommandLine.Option(names = {"--raw-output"},
        description = "File name of the raw aligned table (default: final.csv)")
    private String rawOutput;

    @CommandLine.Option(names = {"--parallel"},
        description = "Number of intervals to aggregate concurrently (default: 1)")
    private Integer parallelism;

    /**
     * Run the align command on its own
     * @param args Command line arguments
     */
    public static void main(String[] args) {
        CMD_align cmd = new CMD_align();
        int exitCode = new CommandLine(cmd)
            .setCaseInsensitiveEnumValuesAllowed(true)
            .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            verbosity.validate();
            verbosity.applyLogLevel();
            inputOption.validate();
            outputOption.validate();

            PipelineConfig config = buildConfig();
            PrintStream out = System.out;
            PipelineResult result = new AlignmentPipeline(out).run(config);

            if (verbosity.showNormalOutput()) {
                out.printf("Aligned %d channels over %,d rows%n",
                    result.aligned().channelNames().size(), result.aligned().rowCount());
                for (Path written : result.writtenFiles()) {
                    out.println("  wrote " + written);
                }
            }
            if (result.hasWarnings()) {
                logger.warn("Target channel '{}' has no data; the timeline was not trimmed", config.targetColumn());
            }
            return EXIT_SUCCESS;
        } catch (SensorDataException | IllegalArgumentException | IllegalStateException | UncheckedIOException e) {
            logger.error("Alignment failed: {}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("I/O error during alignment", e);
            System.err.println("Error: " + e);
            return EXIT_ERROR;
        }
    }

    PipelineConfig buildConfig() throws IOException {
        PipelineConfig.Builder builder = configFile != null
            ? PipelineConfigLoader.load(configFile)
            : PipelineConfig.builder();

        if (inputOption.hasInputs()) {
            builder.inputs(inputOption.getInputs());
        }
        if (inputOption.getPattern() != null) {
            builder.filePattern(inputOption.getPattern());
        }
        if (outputOption.getOutputDirectory() != null) {
            builder.outputDirectory(outputOption.getOutputDirectory());
        }
        if (outputOption.isForce()) {
            builder.force(true);
        }
        if (target != null) {
            builder.targetColumn(target);
        }
        if (!intervals.isEmpty()) {
            builder.intervals(intervals);
        }
        if (noAggregate != null) {
            builder.aggregate(!noAggregate);
        }
        if (stats != null) {
            builder.showStats(stats);
        }
        if (statsFile != null) {
            builder.statsFile(statsFile);
        }
        if (!dmsColumns.isEmpty()) {
            builder.dmsColumns(new LinkedHashSet<>(dmsColumns));
        }
        if (duplicates != null) {
            builder.duplicatePolicy(duplicates);
        }
        if (rawOutput != null) {
            builder.rawOutputName(rawOutput);
        }
        if (parallelism != null) {
            builder.aggregationParallelism(parallelism);
        }
        return builder.build();
    }
}
