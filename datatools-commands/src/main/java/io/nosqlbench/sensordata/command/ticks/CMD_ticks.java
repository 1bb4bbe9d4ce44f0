package io.nosqlbench.sensordata.command.ticks;

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

import io.nosqlbench.sensordata.epoch.InvalidTickException;
import io.nosqlbench.sensordata.epoch.TickEpochConverter;
import io.nosqlbench.sensordata.io.TableCsvWriter;
import picocli.CommandLine;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Converts between raw tick values, as found in channel files, and calendar time.
 *
 * <pre>
 * ticks 637134336000000000
 * ticks --reverse 2020-01-01T00:00:00Z
 * </pre>
 */
@CommandLine.Command(name = "ticks",
    header = "Convert 100ns ticks to calendar time and back",
    description = "Print the UTC time of each tick value (100 ns units since 0001-01-01T00:00:00Z).",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "2: a value could not be converted"})
public class CMD_ticks implements Callable<Integer> {

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Parameters(paramLabel = "VALUE", arity = "1..*",
        description = "Tick values, or ISO-8601 instants with --reverse")
    private List<String> values = new ArrayList<>();

    @CommandLine.Option(names = {"-r", "--reverse"},
        description = "Convert ISO-8601 instants such as 2020-01-01T00:00:00Z to ticks")
    private boolean reverse = false;

    @Override
    public Integer call() {
        int exitCode = EXIT_SUCCESS;
        for (String value : values) {
            try {
                if (reverse) {
                    Instant instant = Instant.parse(value.trim());
                    System.out.println(value.trim() + "\t" + TickEpochConverter.toTicks(instant));
                } else {
                    long ticks = Long.parseLong(value.trim());
                    Instant instant = TickEpochConverter.toInstant(ticks);
                    System.out.println(ticks + "\t" + TableCsvWriter.formatTimestamp(instant) + "\t" + instant);
                }
            } catch (NumberFormatException | DateTimeParseException | InvalidTickException e) {
                System.err.println("Error: cannot convert '" + value + "': " + e.getMessage());
                exitCode = EXIT_ERROR;
            }
        }
        return exitCode;
    }
}
