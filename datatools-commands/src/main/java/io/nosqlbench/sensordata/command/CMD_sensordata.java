package io.nosqlbench.sensordata.command;

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

import io.nosqlbench.sensordata.command.align.CMD_align;
import io.nosqlbench.sensordata.command.stats.CMD_stats;
import io.nosqlbench.sensordata.command.ticks.CMD_ticks;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 # Sensor data tools

 Prepares multi-channel sensor recordings for analysis.

 ## Subcommands
 - `align`: merge channel files, trim to a target channel, write raw and aggregated tables
 - `stats`: print missing value percentages and statistics of channel files
 - `ticks`: convert raw tick values to calendar time and back

 # Basic Usage
 ```
 sensordata align -i raw/ --target oxygen
 sensordata stats -i raw/
 sensordata ticks 637134336000000000
 ```
 */
@CommandLine.Command(name = "sensordata",
    header = "Sensor channel alignment tools",
    description = "Align, aggregate and summarize single-channel sensor recordings.",
    mixinStandardHelpOptions = true,
    version = "sensordata 0.1.0",
    subcommands = {
        CMD_align.class,
        CMD_stats.class,
        CMD_ticks.class,
        CommandLine.HelpCommand.class
    })
public class CMD_sensordata implements Callable<Integer> {

    /**
     * Run the sensordata command
     * @param args Command line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Create the command line with the parser settings shared by all subcommands
     * @return the configured command line
     */
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_sensordata())
            .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        // Print help information if no subcommand is specified
        CommandLine.usage(this, System.out);
        return 0;
    }
}
