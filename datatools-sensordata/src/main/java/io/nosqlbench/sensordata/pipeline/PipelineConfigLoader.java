package io.nosqlbench.sensordata.pipeline;

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

import io.nosqlbench.sensordata.io.DuplicatePolicy;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.BufferedReader;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Reads a pipeline configuration from a YAML file.
///
/// ```yaml
/// inputs: [raw]
/// target: oxygen
/// output: data
/// intervals: [3min, 10min]
/// dms-columns: [latitude, longitude]
/// duplicates: keep_last
/// ```
///
/// Relative paths are resolved against the directory holding the YAML file. The result is a
/// [PipelineConfig.Builder], so command line options can still override individual values.
public final class PipelineConfigLoader {

    private static final Set<String> KEYS = Set.of(
        "inputs", "pattern", "output", "raw-output", "target", "aggregate", "intervals", "stats",
        "stats-file", "dms-columns", "duplicates", "parallelism", "force");

    private PipelineConfigLoader() {
    }

    /// @throws IllegalArgumentException
    ///     if the file is not a YAML mapping, has unknown keys or holds values of the wrong type
    public static PipelineConfig.Builder load(Path yamlFile) throws IOException {
        Path base = yamlFile.toAbsolutePath().getParent();
        LoadSettings loadSettings = LoadSettings.builder().setLabel(yamlFile.toString()).build();
        Load yaml = new Load(loadSettings);
        Object document;
        try (BufferedReader reader = Files.newBufferedReader(yamlFile, StandardCharsets.UTF_8)) {
            document = yaml.loadFromReader(reader);
        } catch (YamlEngineException e) {
            throw new IllegalArgumentException("Invalid YAML in " + yamlFile + ": " + e.getMessage(), e);
        }
        if (document == null) {
            return PipelineConfig.builder();
        }
        if (!(document instanceof Map)) {
            throw new IllegalArgumentException("Expected a mapping at the top of " + yamlFile);
        }
        @SuppressWarnings("unchecked")
        Map<Object, Object> map = (Map<Object, Object>) document;
        return fromMap(map, base);
    }

    static PipelineConfig.Builder fromMap(Map<Object, Object> map, Path base) {
        for (Object key : map.keySet()) {
            if (!KEYS.contains(String.valueOf(key))) {
                throw new IllegalArgumentException("Unknown configuration key '" + key + "', expected one of " + KEYS);
            }
        }
        PipelineConfig.Builder builder = PipelineConfig.builder();
        if (map.containsKey("inputs")) {
            List<Path> inputs = new ArrayList<>();
            for (String input : strings(map.get("inputs"), "inputs")) {
                inputs.add(base.resolve(input));
            }
            builder.inputs(inputs);
        }
        if (map.containsKey("pattern")) {
            builder.filePattern(string(map.get("pattern"), "pattern"));
        }
        if (map.containsKey("output")) {
            builder.outputDirectory(base.resolve(string(map.get("output"), "output")));
        }
        if (map.containsKey("raw-output")) {
            builder.rawOutputName(string(map.get("raw-output"), "raw-output"));
        }
        if (map.containsKey("target")) {
            builder.targetColumn(string(map.get("target"), "target"));
        }
        if (map.containsKey("aggregate")) {
            builder.aggregate(bool(map.get("aggregate"), "aggregate"));
        }
        if (map.containsKey("intervals")) {
            builder.intervalSpecs(strings(map.get("intervals"), "intervals"));
        }
        if (map.containsKey("stats")) {
            builder.showStats(bool(map.get("stats"), "stats"));
        }
        if (map.containsKey("stats-file")) {
            builder.statsFile(base.resolve(string(map.get("stats-file"), "stats-file")));
        }
        if (map.containsKey("dms-columns")) {
            builder.dmsColumns(new LinkedHashSet<>(strings(map.get("dms-columns"), "dms-columns")));
        }
        if (map.containsKey("duplicates")) {
            String policy = string(map.get("duplicates"), "duplicates");
            try {
                builder.duplicatePolicy(DuplicatePolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT).replace('-', '_')));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown duplicate policy '" + policy + "'", e);
            }
        }
        if (map.containsKey("parallelism")) {
            builder.aggregationParallelism(integer(map.get("parallelism"), "parallelism"));
        }
        if (map.containsKey("force")) {
            builder.force(bool(map.get("force"), "force"));
        }
        return builder;
    }

    private static int integer(Object value, String key) {
        if (!(value instanceof Integer || value instanceof Long || value instanceof BigInteger)) {
            throw new IllegalArgumentException("'" + key + "' must be an integer, got " + value);
        }
        BigInteger number = value instanceof BigInteger ? (BigInteger) value : BigInteger.valueOf(((Number) value).longValue());
        if (number.bitLength() > 31) {
            throw new IllegalArgumentException("'" + key + "' is out of range: " + value);
        }
        return number.intValue();
    }

    private static String string(Object value, String key) {
        if (value == null || value instanceof Map || value instanceof List) {
            throw new IllegalArgumentException("'" + key + "' must be a single value, got " + value);
        }
        return String.valueOf(value);
    }

    private static boolean bool(Object value, String key) {
        if (!(value instanceof Boolean)) {
            throw new IllegalArgumentException("'" + key + "' must be true or false, got " + value);
        }
        return (Boolean) value;
    }

    private static List<String> strings(Object value, String key) {
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                result.add(string(item, key));
            }
        } else {
            result.add(string(value, key));
        }
        return result;
    }
}
