package io.nosqlbench.sensordata.command.stats;

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
import io.nosqlbench.sensordata.command.common.InputPathsOption;
import io.nosqlbench.sensordata.command.common.VerbosityOption;
import io.nosqlbench.sensordata.io.ChannelLoader;
import io.nosqlbench.sensordata.io.DuplicatePolicy;
import io.nosqlbench.sensordata.merge.TimelineMerger;
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
import picocli.CommandLine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Prints missing value percentages and column statistics of merged channel files without writing
 * any table. With {@code --target} the timeline is trimmed first, exactly as {@code align} does.
 */
@CommandLine.Command(name = "stats",
    header = "Summarize channel files",
    description = "Merge channel files and print the missing value percentage, mean and standard deviation\n" +
        "of every channel.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success, including a target channel without data (logged as a warning)", "2: error"})
public class CMD_stats implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_stats.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Mixin
    private InputPathsOption inputOption = new InputPathsOption();

    @CommandLine.Mixin
    private VerbosityOption verbosity = new VerbosityOption();

    @CommandLine.Option(names = {"-t", "--target"},
        description = "Trim to the valid range of this channel before summarizing")
    private String target;

    @CommandLine.Option(names = {"--dms-column"},
        description = "Channel holding degree-minute coordinates. May be repeated or comma separated",
        split = ",")
    private List<String> dmsColumns = new ArrayList<>();

    @CommandLine.Option(names = {"--duplicates"},
        description = "Handling of repeated ticks within a channel: ${COMPLETION-CANDIDATES}",
        defaultValue = "FAIL")
    private DuplicatePolicy duplicates = DuplicatePolicy.FAIL;

    @CommandLine.Option(names = {"--json"},
        description = "Print the summary as JSON")
    private boolean json = false;

    @Override
    public Integer call() {
        try {
            verbosity.validate();
            verbosity.applyLogLevel();
            if (!inputOption.hasInputs()) {
                throw new IllegalArgumentException("At least one --input is required");
            }
            inputOption.validate();

            String pattern = inputOption.getPattern() != null ? inputOption.getPattern() : ChannelLoader.DEFAULT_PATTERN;
            ChannelLoader loader = new ChannelLoader(duplicates, new LinkedHashSet<>(dmsColumns), pattern);
            List<ChannelSeries> series = loader.loadAll(inputOption.getInputs());
            MergedTable merged = new TimelineMerger().merge(series);

            String title = "merged";
            if (target != null) {
                TrimResult trim = new ValidRangeTrimmer().trim(merged, target, series.size());
                merged = trim.table();
                title = "trimmed to " + target;
            }
            AlignedTable aligned = new TimestampNormalizer().normalize(merged);
            SummaryReport report = new SummaryReporter().summarize(title, aligned, true);

            SummaryRenderer renderer = new SummaryRenderer();
            if (json) {
                System.out.println(renderer.toJson(List.of(report)));
            } else {
                renderer.renderText(report, System.out);
            }
            return EXIT_SUCCESS;
        } catch (SensorDataException | IllegalArgumentException | IllegalStateException | UncheckedIOException e) {
            logger.error("Summary failed: {}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("I/O error while summarizing", e);
            System.err.println("Error: " + e);
            return EXIT_ERROR;
        }
    }
}
