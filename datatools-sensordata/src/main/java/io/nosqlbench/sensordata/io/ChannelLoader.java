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

import io.nosqlbench.sensordata.SensorDataException;
import io.nosqlbench.sensordata.model.ChannelSeries;
import io.nosqlbench.sensordata.model.ValueColumn;
import io.nosqlbench.sensordata.transform.DmsCoordinateParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/// Reads channel recordings: one CSV file per channel, two columns `ticks,value`, no header.
///
/// The channel name is the file name without its extension. Blank lines are skipped. A value of
/// `nan`, `null`, `na`, `none` (any case) or an empty field is a missing value. Channels listed
/// as coordinate channels have their values parsed by [DmsCoordinateParser]. Rows without a
/// timestamp cannot be placed on the timeline; they are skipped and counted in a warning.
public class ChannelLoader {
    private static final Logger logger = LogManager.getLogger(ChannelLoader.class);

    /// Glob used to pick channel files out of an input directory
    public static final String DEFAULT_PATTERN = "*.csv";

    // the UTF-8 decoder keeps a leading byte order mark as a character
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private static final Set<String> MISSING_TOKENS = Set.of("", "nan", "null", "na", "n/a", "none");

    private final DuplicatePolicy duplicatePolicy;
    private final Set<String> coordinateChannels;
    private final String filePattern;

    public ChannelLoader() {
        this(DuplicatePolicy.FAIL, Set.of(), DEFAULT_PATTERN);
    }

    /// @param duplicatePolicy
    ///     handling of repeated ticks within one file
    /// @param coordinateChannels
    ///     channels whose values are degree-minute coordinates
    /// @param filePattern
    ///     glob selecting channel files inside input directories
    public ChannelLoader(DuplicatePolicy duplicatePolicy, Set<String> coordinateChannels, String filePattern) {
        this.duplicatePolicy = Objects.requireNonNull(duplicatePolicy, "duplicate policy cannot be null");
        this.coordinateChannels = Set.copyOf(coordinateChannels);
        this.filePattern = Objects.requireNonNull(filePattern, "file pattern cannot be null");
    }

    /// @return the file name without its last extension
    public static String channelNameOf(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /// Expand the given inputs into channel files. Directories contribute the files matching the
    /// file pattern, in file name order; plain files are taken as they are.
    ///
    /// @throws NoSuchFileException
    ///     if an input does not exist
    public List<Path> resolveInputs(List<Path> inputs) throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                List<Path> matched = new ArrayList<>();
                try (DirectoryStream<Path> stream = Files.newDirectoryStream(input, filePattern)) {
                    for (Path entry : stream) {
                        if (Files.isRegularFile(entry)) {
                            matched.add(entry);
                        }
                    }
                }
                matched.sort(Comparator.comparing(p -> p.getFileName().toString()));
                if (matched.isEmpty()) {
                    logger.warn("No files matching '{}' in {}", filePattern, input);
                }
                files.addAll(matched);
            } else if (Files.isRegularFile(input)) {
                files.add(input);
            } else {
                throw new NoSuchFileException(input.toString(), null, "input does not exist");
            }
        }
        return files;
    }

    /// Load every channel file named by the inputs.
    ///
    /// @throws SensorDataException
    ///     if the inputs contain no channel files
    public List<ChannelSeries> loadAll(List<Path> inputs) throws IOException {
        List<Path> files = resolveInputs(inputs);
        if (files.isEmpty()) {
            throw new SensorDataException("No channel files found in " + inputs + " matching '" + filePattern + "'");
        }
        List<ChannelSeries> series = new ArrayList<>(files.size());
        for (Path file : files) {
            series.add(load(file));
        }
        logger.info("Loaded {} channels from {} input(s)", series.size(), inputs.size());
        return series;
    }

    /// Load a single channel file.
    public ChannelSeries load(Path file) throws IOException {
        String channel = channelNameOf(file);
        boolean coordinates = coordinateChannels.contains(channel);
        List<Row> rows = new ArrayList<>();
        int skippedWithoutTimestamp = 0;

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (lineNumber == 1 && line.startsWith(BYTE_ORDER_MARK)) {
                    line = line.substring(BYTE_ORDER_MARK.length());
                }
                if (line.isBlank()) {
                    continue;
                }
                String[] fields = line.split(",", -1);
                if (fields.length != 2) {
                    throw new ChannelFormatException(file, lineNumber,
                        "expected 2 fields (timestamp,value) but found " + fields.length);
                }
                String tickField = unquote(fields[0]);
                if (tickField.isEmpty()) {
                    skippedWithoutTimestamp++;
                    continue;
                }
                long tick = parseTick(file, lineNumber, tickField);
                OptionalDouble value = parseValue(file, lineNumber, unquote(fields[1]), coordinates);
                rows.add(new Row(tick, value, lineNumber));
            }
        }

        if (skippedWithoutTimestamp > 0) {
            logger.warn("Skipped {} row(s) without a timestamp in {}", skippedWithoutTimestamp, file);
        }

        rows = resolveDuplicates(file, rows);

        long[] ticks = new long[rows.size()];
        ValueColumn.Builder values = ValueColumn.builder(channel, rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Row row = rows.get(i);
            ticks[i] = row.tick;
            values.set(i, row.value);
        }
        logger.debug("Read {} rows for channel '{}' from {}", ticks.length, channel, file);
        return new ChannelSeries(channel, ticks, values.build(), file);
    }

    private List<Row> resolveDuplicates(Path file, List<Row> rows) {
        rows.sort(Comparator.comparingLong(r -> r.tick));
        List<Row> distinct = new ArrayList<>(rows.size());
        int dropped = 0;
        for (Row row : rows) {
            Row previous = distinct.isEmpty() ? null : distinct.get(distinct.size() - 1);
            if (previous == null || previous.tick != row.tick) {
                distinct.add(row);
                continue;
            }
            switch (duplicatePolicy) {
                case FAIL:
                    throw new ChannelFormatException(file, row.line,
                        "timestamp " + row.tick + " already appeared on line " + previous.line);
                case KEEP_FIRST:
                    break;
                case KEEP_LAST:
                    distinct.set(distinct.size() - 1, row);
                    break;
                default:
                    throw new IllegalStateException("Unhandled duplicate policy " + duplicatePolicy);
            }
            dropped++;
        }
        if (dropped > 0) {
            logger.warn("Dropped {} duplicate timestamp row(s) in {} ({})", dropped, file, duplicatePolicy);
        }
        return distinct;
    }

    private static long parseTick(Path file, int line, String field) {
        try {
            return Long.parseLong(field);
        } catch (NumberFormatException e) {
            try {
                return new BigDecimal(field).longValueExact();
            } catch (NumberFormatException | ArithmeticException inner) {
                throw new ChannelFormatException(file, line, "timestamp '" + field + "' is not an integer", inner);
            }
        }
    }

    private static OptionalDouble parseValue(Path file, int line, String field, boolean coordinates) {
        if (MISSING_TOKENS.contains(field.toLowerCase(Locale.ROOT))) {
            return OptionalDouble.empty();
        }
        try {
            if (coordinates) {
                return DmsCoordinateParser.parse(field);
            }
            return OptionalDouble.of(Double.parseDouble(field));
        } catch (IllegalArgumentException e) {
            throw new ChannelFormatException(file, line, "value '" + field + "' is not numeric", e);
        }
    }

    private static String unquote(String field) {
        String trimmed = field.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    private static final class Row {
        private final long tick;
        private final OptionalDouble value;
        private final int line;

        private Row(long tick, OptionalDouble value, int line) {
            this.tick = tick;
            this.value = value;
            this.line = line;
        }
    }
}
