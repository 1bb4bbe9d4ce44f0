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

import com.google.gson.JsonArray;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class CMD_statsTest {

    private static final long BASE_TICKS = 637_134_336_000_000_000L;

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outContent = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(tempDir.resolve("A.csv"),
            BASE_TICKS + ",1.0\n" + (BASE_TICKS + 10_000_000L) + ",3.0\n");
        Files.writeString(tempDir.resolve("B.csv"),
            (BASE_TICKS + 20_000_000L) + ",5.0\n");
        originalOut = System.out;
        System.setOut(new PrintStream(outContent));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
    }

    @Test
    public void testPrintsSummaryTable() {
        int exitCode = new CommandLine(new CMD_stats()).execute("-i", tempDir.toString());

        assertThat(exitCode).isEqualTo(0);
        String output = outContent.toString();
        assertThat(output).contains("merged (3 rows)");
        assertThat(output).contains("33.33%").contains("66.67%");
    }

    @Test
    public void testTrimsToTargetAndPrintsJson() {
        int exitCode = new CommandLine(new CMD_stats()).execute("-i", tempDir.toString(), "-t", "A", "--json");

        assertThat(exitCode).isEqualTo(0);
        JsonArray reports = JsonParser.parseString(outContent.toString()).getAsJsonArray();
        assertThat(reports.get(0).getAsJsonObject().get("rows").getAsInt()).isEqualTo(2);
        assertThat(reports.get(0).getAsJsonObject().get("title").getAsString()).isEqualTo("trimmed to A");
    }

    @Test
    public void testTargetWithoutDataStillSucceeds() throws IOException {
        Files.writeString(tempDir.resolve("T.csv"), BASE_TICKS + ",nan\n");

        int exitCode = new CommandLine(new CMD_stats()).execute("-i", tempDir.toString(), "-t", "T", "--json");

        assertThat(exitCode).isEqualTo(0);
        JsonArray reports = JsonParser.parseString(outContent.toString()).getAsJsonArray();
        assertThat(reports.get(0).getAsJsonObject().get("rows").getAsInt()).isEqualTo(3);
    }

    @Test
    public void testRequiresInput() {
        assertThat(new CommandLine(new CMD_stats()).execute()).isEqualTo(2);
    }
}
