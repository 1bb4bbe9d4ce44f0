package io.nosqlbench.sensordata.support;

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

import io.nosqlbench.sensordata.epoch.TickEpochConverter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/// Helpers for building channel files and tick values in tests.
public final class SensorFixtures {

    /// 2020-01-01T00:00:00Z, a midnight, so fixture buckets line up with whole seconds from here
    public static final Instant BASE = Instant.parse("2020-01-01T00:00:00Z");

    /// Ticks of [#BASE]
    public static final long BASE_TICKS = 637_134_336_000_000_000L;

    private SensorFixtures() {
    }

    /// @return the tick value `seconds` after [#BASE]
    public static long ticksAt(long seconds) {
        return BASE_TICKS + seconds * TickEpochConverter.TICKS_PER_SECOND;
    }

    public static long[] ticksAt(long... seconds) {
        long[] ticks = new long[seconds.length];
        for (int i = 0; i < seconds.length; i++) {
            ticks[i] = ticksAt(seconds[i]);
        }
        return ticks;
    }

    /// Write a channel file holding the given lines, one per row.
    public static Path writeChannel(Path dir, String channel, String... lines) throws IOException {
        Files.createDirectories(dir);
        Path file = dir.resolve(channel + ".csv");
        Files.writeString(file, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
        return file;
    }

    /// Write a channel file with one `ticks,value` row per second offset.
    public static Path writeChannel(Path dir, String channel, long[] seconds, double[] values) throws IOException {
        String[] lines = new String[seconds.length];
        for (int i = 0; i < seconds.length; i++) {
            lines[i] = ticksAt(seconds[i]) + "," + values[i];
        }
        return writeChannel(dir, channel, lines);
    }
}
