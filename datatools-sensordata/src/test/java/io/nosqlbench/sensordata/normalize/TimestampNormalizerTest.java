package io.nosqlbench.sensordata.normalize;

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

import io.nosqlbench.sensordata.epoch.InvalidTickException;
import io.nosqlbench.sensordata.model.AlignedTable;
import io.nosqlbench.sensordata.model.MergedTable;
import io.nosqlbench.sensordata.model.ValueColumn;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static io.nosqlbench.sensordata.support.SensorFixtures.ticksAt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimestampNormalizerTest {

    private final TimestampNormalizer normalizer = new TimestampNormalizer();

    @Test
    void replacesTicksWithCalendarTime() {
        MergedTable merged = new MergedTable(
            new long[]{ticksAt(0), ticksAt(0) + 5_000_000L, ticksAt(61)},
            List.of(ValueColumn.of("A", 1.0, null, 3.0)));

        AlignedTable aligned = normalizer.normalize(merged);

        assertThat(aligned.columnNames()).containsExactly("datetime", "A");
        assertThat(aligned.timestamps()).containsExactly(
            Instant.parse("2020-01-01T00:00:00Z"),
            Instant.parse("2020-01-01T00:00:00Z"),
            Instant.parse("2020-01-01T00:01:01Z"));
        assertThat(aligned.valueColumns()).containsExactlyElementsOf(merged.valueColumns());
    }

    @Test
    void propagatesInvalidTicks() {
        MergedTable merged = new MergedTable(new long[]{-5}, List.of(ValueColumn.ofPresent("A", 1.0)));
        assertThatThrownBy(() -> normalizer.normalize(merged)).isInstanceOf(InvalidTickException.class);
    }
}
