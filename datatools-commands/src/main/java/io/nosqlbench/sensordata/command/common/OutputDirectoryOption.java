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

/**
 * Shared output directory option with force overwrite flag.
 */
public class OutputDirectoryOption {

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Directory receiving the output tables (default: data)"
    )
    private Path outputDirectory;

    @CommandLine.Option(
        names = {"-f", "--force"},
        description = "Force overwrite if output files already exist"
    )
    private boolean force = false;

    /**
     * Gets the output directory, or null if none was given.
     */
    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public boolean isForce() {
        return force;
    }

    /**
     * Validates that the output path is not an existing regular file.
     *
     * @throws IllegalStateException if the output path names a file
     */
    public void validate() {
        if (outputDirectory != null && Files.isRegularFile(outputDirectory)) {
            throw new IllegalStateException("Output path is a file, not a directory: " + outputDirectory);
        }
    }
}
