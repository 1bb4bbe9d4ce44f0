package io.nosqlbench.sensordata.report;

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
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.nosqlbench.sensordata.model.AlignedTable;
import io.nosqlbench.sensordata.model.ColumnarTable;
import io.nosqlbench.sensordata.model.ValueColumn;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("SummaryReporter")
class SummaryReporterTest {

    @TempDir
    Path tempDir;

    private final SummaryReporter reporter = new SummaryReporter();

    private static AlignedTable table() {
        Instant t = Instant.parse("2020-01-01T00:00:00Z");
        return new AlignedTable(new Instant[]{t, t.plusSeconds(1), t.plusSeconds(2), t.plusSeconds(3)}, List.of(
            ValueColumn.of("A", 1.0, 2.0, 3.0, null),
            ValueColumn.of("B", null, null, null, 5.0)));
    }

    @Test
    @DisplayName("reports missing percentages and moments per column")
    void summarizesColumns() {
        SummaryReport report = reporter.summarize("aligned", table(), true);

        assertThat(report.rowCount()).isEqualTo(4);
        assertThat(report.columns()).extracting(ColumnSummary::column).containsExactly("datetime", "A", "B");
        assertThat(report.column("datetime").orElseThrow().missingPercent()).isZero();

        ColumnSummary a = report.column("A").orElseThrow();
        assertThat(a.missingPercent()).isEqualTo(25.0);
        assertThat(a.mean()).hasValue(2.0);
        assertThat(a.stdDev().getAsDouble()).isCloseTo(1.0, within(1e-12));

        ColumnSummary b = report.column("B").orElseThrow();
        assertThat(b.missingPercent()).isEqualTo(75.0);
        assertThat(b.mean()).hasValue(5.0);
        assertThat(b.stdDev()).isEmpty();
    }

    @Test
    void skipsMomentsWhenNotRequested() {
        SummaryReport report = reporter.summarize("aggregate", table(), false);

        assertThat(report.includesMoments()).isFalse();
        assertThat(report.column("A").orElseThrow().mean()).isEmpty();
        assertThat(report.column("A").orElseThrow().missingCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("degrades to an empty report instead of failing")
    void failureGivesEmptyReport() {
        ColumnarTable broken = new ColumnarTable() {
            @Override
            public String timeColumnName() {
                return "datetime";
            }

            @Override
            public int rowCount() {
                return 1;
            }

            @Override
            public List<ValueColumn> valueColumns() {
                throw new IllegalStateException("columns unavailable");
            }
        };

        SummaryReport report = reporter.summarize("broken", broken, true);

        assertThat(report.isEmpty()).isTrue();
        assertThat(report.title()).isEqualTo("broken");
    }

    @Test
    void rendersTextTable() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        new SummaryRenderer().renderText(reporter.summarize("aligned", table(), true),
            new PrintStream(buffer, true, StandardCharsets.UTF_8));

        String text = buffer.toString(StandardCharsets.UTF_8);
        assertThat(text).contains("aligned (4 rows)");
        assertThat(text).contains("25.00%");
        assertThat(text).contains("75.00%");
        assertThat(text).contains("Mean");
    }

    @Test
    void writesJsonWithNullForAbsentMoments() throws IOException {
        Path output = tempDir.resolve("stats.json");
        new SummaryRenderer().writeJson(List.of(reporter.summarize("aligned", table(), true)), output);

        JsonArray reports = JsonParser.parseString(Files.readString(output)).getAsJsonArray();
        assertThat(reports).hasSize(1);
        JsonObject report = reports.get(0).getAsJsonObject();
        assertThat(report.get("title").getAsString()).isEqualTo("aligned");
        JsonObject b = report.getAsJsonArray("columns").get(2).getAsJsonObject();
        assertThat(b.get("column").getAsString()).isEqualTo("B");
        assertThat(b.get("missingPercent").getAsDouble()).isEqualTo(75.0);
        assertThat(b.get("mean").getAsDouble()).isEqualTo(5.0);
        assertThat(b.get("std").isJsonNull()).isTrue();
    }
}
