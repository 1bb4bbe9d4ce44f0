package io.nosqlbench.sensordata.trim;

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

import io.nosqlbench.sensordata.model.MergedTable;
import io.nosqlbench.sensordata.model.ValueColumn;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ValidRangeTrimmer")
class ValidRangeTrimmerTest {

    private final ValidRangeTrimmer trimmer = new ValidRangeTrimmer();

    private static MergedTable table() {
        return new MergedTable(new long[]{1, 2, 3, 4, 5, 6}, List.of(
            ValueColumn.of("target", null, 1.0, null, 3.0, null, null),
            ValueColumn.of("other", 9.0, 9.0, 9.0, 9.0, 9.0, 9.0)));
    }

    @Test
    @DisplayName("keeps rows from the first to the last present target value")
    void trimsToTargetRange() {
        TrimResult result = trimmer.trim(table(), "target", 2);

        assertThat(result.targetEmpty()).isFalse();
        assertThat(result.table().ticks()).containsExactly(2, 3, 4);
        assertThat(result.leadingRowsRemoved()).isEqualTo(1);
        assertThat(result.trailingRowsRemoved()).isEqualTo(2);
        assertThat(result.rowsRemoved()).isEqualTo(3);
        assertThat(result.table().channel("target").isPresent(1))
            .as("interior gaps are kept")
            .isFalse();
    }

    @Test
    @DisplayName("is idempotent")
    void idempotent() {
        MergedTable once = trimmer.trim(table(), "target").table();
        TrimResult twice = trimmer.trim(once, "target");

        assertThat(twice.table()).isEqualTo(once);
        assertThat(twice.rowsRemoved()).isZero();
    }

    @Test
    @DisplayName("returns the table unchanged when the target has no values")
    void emptyTargetIsAWarningNotAnError() {
        MergedTable table = new MergedTable(new long[]{1, 2}, List.of(
            ValueColumn.missing("target", 2),
            ValueColumn.ofPresent("other", 1.0, 2.0)));

        TrimResult result = trimmer.trim(table, "target", 2);

        assertThat(result.targetEmpty()).isTrue();
        assertThat(result.table()).isSameAs(table);
        assertThat(result.rowsRemoved()).isZero();
    }

    @Test
    void rejectsColumnCountMismatch() {
        assertThatThrownBy(() -> trimmer.trim(table(), "target", 3))
            .isInstanceOf(SchemaMismatchException.class)
            .hasMessageContaining("Expected 4 columns")
            .satisfies(e -> assertThat(((SchemaMismatchException) e).getActualColumns()).isEqualTo(3));
    }

    @Test
    void rejectsUnknownTarget() {
        assertThatThrownBy(() -> trimmer.trim(table(), "nope", 2))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown channel 'nope'");
    }
}
