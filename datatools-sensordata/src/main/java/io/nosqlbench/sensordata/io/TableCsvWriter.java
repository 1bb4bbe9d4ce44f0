package io.nosqlbench.sensordata.io;

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

import io.nosqlbench.sensordata.model.AggregatedTable;
import io.nosqlbench.sensordata.model.AlignedTable;
import io.nosqlbench.sensordata.model.ColumnarTable;
import io.nosqlbench.sensordata.model.ValueColumn;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.function.IntFunction;

/// Writes aligned and aggregated tables as CSV with a header row.
///
/// The time column comes first and is formatted as `yyyy-MM-dd HH:mm:ss` in UTC. Missing cells
/// are written as empty fields.
public class TableCsvWriter {

    /// Format of the time column
    public static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    public void write(AlignedTable table, Path output) throws IOException {
        write(table, row -> formatTimestamp(table.timestamp(row)), output);
    }

    public void write(AggregatedTable table, Path output) throws IOException {
        write(table, row -> formatTimestamp(table.bucketStart(row)), output);
    }

    public void write(AlignedTable table, Writer writer) throws IOException {
        write(table, row -> formatTimestamp(table.timestamp(row)), writer);
    }

    public void write(AggregatedTable table, Writer writer) throws IOException {
        write(table, row -> formatTimestamp(table.bucketStart(row)), writer);
    }

    private void write(ColumnarTable table, IntFunction<String> timeCell, Path output) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            write(table, timeCell, writer);
        }
    }

    private void write(ColumnarTable table, IntFunction<String> timeCell, Writer writer) throws IOException {
        List<String> header = table.columnNames();
        for (int i = 0; i < header.size(); i++) {
            if (i > 0) {
                writer.write(',');
            }
            writer.write(escape(header.get(i)));
        }
        writer.write('\n');

        List<ValueColumn> columns = table.valueColumns();
        StringBuilder line = new StringBuilder();
        for (int row = 0; row < table.rowCount(); row++) {
            line.setLength(0);
            line.append(timeCell.apply(row));
            for (ValueColumn column : columns) {
                line.append(',');
                if (column.isPresent(row)) {
                    line.append(formatValue(column.valueAt(row)));
                }
            }
            line.append('\n');
            writer.write(line.toString());
        }
        writer.flush();
    }

    public static String formatTimestamp(Instant instant) {
        return TIMESTAMP_FORMAT.format(instant);
    }

    public static String formatValue(double value) {
        return Double.toString(value);
    }

    static String escape(String field) {
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0 && field.indexOf('\n') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
