package io.nosqlbench.sensordata.command.common;

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

import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared input option naming channel files and directories of channel files.
 * Directories are scanned with the {@code --pattern} glob.
 */
public class InputPathsOption {

    @CommandLine.Option(
        names = {"-i", "--input"},
        description = "Channel CSV file, or directory of channel files. May be repeated.",
        arity = "1..*"
    )
    private List<Path> inputs = new ArrayList<>();

    @CommandLine.Option(
        names = {"--pattern"},
        description = "Glob selecting channel files inside input directories (default: *.csv)"
    )
    private String pattern;

    public List<Path> getInputs() {
        return inputs;
    }

    public boolean hasInputs() {
        return !inputs.isEmpty();
    }

    /**
     * Gets the file pattern, or null if none was given.
     */
    public String getPattern() {
        return pattern;
    }

    /**
     * Validates that every named input exists.
     *
     * @throws IllegalStateException if an input does not exist
     */
    public void validate() {
        for (Path input : inputs) {
            if (!Files.exists(input)) {
                throw new IllegalStateException("Input does not exist: " + input);
            }
        }
    }
}
