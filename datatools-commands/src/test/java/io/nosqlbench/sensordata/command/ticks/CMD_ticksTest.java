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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.assertj.core.api.Assertions.assertThat;

public class CMD_ticksTest {

    private final ByteArrayOutputStream outContent = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errContent = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void captureStreams() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outContent));
        System.setErr(new PrintStream(errContent));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    public void testConvertsTicksToCalendarTime() {
        int exitCode = new CommandLine(new CMD_ticks()).execute("637134336000000000", "637134336019999999");

        assertThat(exitCode).isEqualTo(0);
        assertThat(outContent.toString())
            .contains("637134336000000000\t2020-01-01 00:00:00\t2020-01-01T00:00:00Z")
            .contains("637134336019999999\t2020-01-01 00:00:01\t2020-01-01T00:00:01Z");
    }

    @Test
    public void testConvertsInstantsToTicks() {
        int exitCode = new CommandLine(new CMD_ticks()).execute("--reverse", "1970-01-01T00:00:00Z");

        assertThat(exitCode).isEqualTo(0);
        assertThat(outContent.toString()).contains("1970-01-01T00:00:00Z\t621355968000000000");
    }

    @Test
    public void testReportsUnconvertibleValues() {
        int exitCode = new CommandLine(new CMD_ticks()).execute("--", "-5", "abc", "637134336000000000");

        assertThat(exitCode).isEqualTo(2);
        assertThat(errContent.toString()).contains("'-5'").contains("'abc'");
        assertThat(outContent.toString()).contains("2020-01-01 00:00:00");
    }
}
