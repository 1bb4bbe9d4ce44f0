package io.nosqlbench.sensordata.features;

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

import io.nosqlbench.sensordata.model.AlignedTable;
import io.nosqlbench.sensordata.model.ValueColumn;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FeatureMatrixTest {

    private static AlignedTable table() {
        Instant t = Instant.parse("2020-01-01T00:00:00Z");
        return new AlignedTable(new Instant[]{t, t.plusSeconds(1), t.plusSeconds(2)}, List.of(
            ValueColumn.of("A", 1.0, null, 3.0),
            ValueColumn.of("B", 4.0, 5.0, 6.0)));
    }

    @Test
    void dropIncompleteRowsRemovesRowsWithGaps() {
        FeatureMatrix matrix = FeatureMatrix.of(table(), MissingValuePolicy.DROP_INCOMPLETE_ROWS);

        assertThat(matrix.columns()).containsExactly("A", "B");
        assertThat(matrix.rows()).isEqualTo(2);
        assertThat(matrix.sourceRow(0)).isZero();
        assertThat(matrix.sourceRow(1)).isEqualTo(2);
        assertThat(matrix.values()).isDeepEqualTo(new double[][]{{1.0, 4.0}, {3.0, 6.0}});
        assertThat(matrix.hasMaskedCells()).isFalse();
    }

    @Test
    void maskKeepsAllRowsAndFlagsGaps() {
        FeatureMatrix matrix = FeatureMatrix.of(table(), MissingValuePolicy.MASK);

        assertThat(matrix.rows()).isEqualTo(3);
        assertThat(matrix.width()).isEqualTo(2);
        assertThat(matrix.value(1, 0)).isZero();
        assertThat(matrix.isMasked(1, 0)).isTrue();
        assertThat(matrix.isMasked(1, 1)).isFalse();
        assertThat(matrix.mask()).isDeepEqualTo(new boolean[][]{{false, false}, {true, false}, {false, false}});
    }

    @Test
    void rowMaskFlagsRowsWithAnyGap() {
        FeatureMatrix matrix = FeatureMatrix.of(table(), MissingValuePolicy.MASK);

        assertThat(matrix.rowMask()).containsExactly(false, true, false);
        assertThat(FeatureMatrix.of(table(), MissingValuePolicy.DROP_INCOMPLETE_ROWS).rowMask())
            .containsExactly(false, false);
    }

    @Test
    void returnedArraysAreCopies() {
        FeatureMatrix matrix = FeatureMatrix.of(table(), MissingValuePolicy.MASK);
        matrix.values()[0][0] = 42.0;
        assertThat(matrix.value(0, 0)).isEqualTo(1.0);
    }
}
