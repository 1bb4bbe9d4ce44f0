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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/// Renders summary reports as console tables or JSON.
public class SummaryRenderer {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    public void renderText(SummaryReport report, PrintStream out) {
        out.printf(Locale.ROOT, "%s (%,d rows)%n", report.title(), report.rowCount());
        if (report.isEmpty()) {
            out.println("  no summary available");
            return;
        }
        int width = Math.max(6, report.columns().stream().mapToInt(c -> c.column().length()).max().orElse(6));
        String rule = "─".repeat(width + 2);
        if (report.includesMoments()) {
            out.println("┌" + rule + "┬──────────┬──────────────┬──────────────┐");
            out.printf(Locale.ROOT, "│ %-" + width + "s │ Missing%% │     Mean     │     Std      │%n", "Column");
            out.println("├" + rule + "┼──────────┼──────────────┼──────────────┤");
            for (ColumnSummary column : report.columns()) {
                out.printf(Locale.ROOT, "│ %-" + width + "s │ %7.2f%% │ %12s │ %12s │%n",
                    column.column(), column.missingPercent(), cell(column.mean()), cell(column.stdDev()));
            }
            out.println("└" + rule + "┴──────────┴──────────────┴──────────────┘");
        } else {
            out.println("┌" + rule + "┬──────────┐");
            out.printf(Locale.ROOT, "│ %-" + width + "s │ Missing%% │%n", "Column");
            out.println("├" + rule + "┼──────────┤");
            for (ColumnSummary column : report.columns()) {
                out.printf(Locale.ROOT, "│ %-" + width + "s │ %7.2f%% │%n", column.column(), column.missingPercent());
            }
            out.println("└" + rule + "┴──────────┘");
        }
    }

    private static String cell(OptionalDouble value) {
        return value.isPresent() ? String.format(Locale.ROOT, "%.6g", value.getAsDouble()) : "-";
    }

    public JsonElement toJsonTree(List<SummaryReport> reports) {
        JsonArray array = new JsonArray();
        for (SummaryReport report : reports) {
            JsonObject object = new JsonObject();
            object.addProperty("title", report.title());
            object.addProperty("rows", report.rowCount());
            object.addProperty("includesMoments", report.includesMoments());
            JsonArray columns = new JsonArray();
            for (ColumnSummary column : report.columns()) {
                JsonObject entry = new JsonObject();
                entry.addProperty("column", column.column());
                entry.addProperty("missing", column.missingCount());
                entry.addProperty("missingPercent", column.missingPercent());
                entry.add("mean", number(column.mean()));
                entry.add("std", number(column.stdDev()));
                columns.add(entry);
            }
            object.add("columns", columns);
            array.add(object);
        }
        return array;
    }

    public String toJson(List<SummaryReport> reports) {
        return GSON.toJson(toJsonTree(reports));
    }

    public void writeJson(List<SummaryReport> reports, Path output) throws IOException {
        Files.writeString(output, toJson(reports), StandardCharsets.UTF_8);
    }

    private static JsonElement number(OptionalDouble value) {
        if (value.isEmpty() || !Double.isFinite(value.getAsDouble())) {
            return JsonNull.INSTANCE;
        }
        return new JsonPrimitive(value.getAsDouble());
    }
}
