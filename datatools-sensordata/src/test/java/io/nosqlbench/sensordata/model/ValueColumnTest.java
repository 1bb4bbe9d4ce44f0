package io.nosqlbench.sensordata.model;

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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ValueColumn")
class ValueColumnTest {

    @Nested
    @DisplayName("missing cells")
    class MissingCells {

        @Test
        @DisplayName("are distinct from recorded NaN")
        void missingIsNotNaN() {
            ValueColumn column = ValueColumn.of("c", Double.NaN, null, 1.0);

            assertThat(column.isPresent(0)).isTrue();
            assertThat(column.get(0).getAsDouble()).isNaN();
            assertThat(column.isPresent(1)).isFalse();
            assertThat(column.get(1)).isEqualTo(OptionalDouble.empty());
            assertThat(column.presentCount()).isEqualTo(2);
            assertThat(column.missingCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("cannot be read as a value")
        void valueAtRejectsMissing() {
            ValueColumn column = ValueColumn.of("c", (Double) null);
            assertThatThrownBy(() -> column.valueAt(0))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("missing");
        }

        @Test
        void firstAndLastPresent() {
            ValueColumn column = ValueColumn.of("c", null, 2.0, null, 4.0, null);
            assertThat(column.firstPresentIndex()).isEqualTo(1);
            assertThat(column.lastPresentIndex()).isEqualTo(3);

            ValueColumn empty = ValueColumn.missing("e", 3);
            assertThat(empty.firstPresentIndex()).isEqualTo(-1);
            assertThat(empty.lastPresentIndex()).isEqualTo(-1);
            assertThat(ValueColumn.missing("z", 0).lastPresentIndex()).isEqualTo(-1);
        }
    }

    @Test
    void sliceKeepsPresence() {
        ValueColumn column = ValueColumn.of("c", 1.0, null, 3.0, 4.0);
        ValueColumn slice = column.slice(1, 3);

        assertThat(slice.size()).isEqualTo(2);
        assertThat(slice.isPresent(0)).isFalse();
        assertThat(slice.valueAt(1)).isEqualTo(3.0);
        assertThat(slice).isEqualTo(ValueColumn.of("c", null, 3.0));
    }

    @Test
    void sliceRejectsBadBounds() {
        ValueColumn column = ValueColumn.ofPresent("c", 1, 2, 3);
        assertThatThrownBy(() -> column.slice(2, 4)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> column.slice(2, 1)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void equalityIgnoresValuesBehindMissingCells() {
        ValueColumn a = ValueColumn.builder("c", 2).set(0, 1.0).build();
        BitSet present = new BitSet(2);
        present.set(0);
        ValueColumn b = new ValueColumn("c", new double[]{1.0, 99.0}, present);
        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
    }

    @Test
    void builderCannotBeReusedAfterBuild() {
        ValueColumn.Builder builder = ValueColumn.builder("c", 1);
        builder.build();
        assertThatThrownBy(() -> builder.set(0, 1.0)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsBlankName() {
        assertThatThrownBy(() -> ValueColumn.ofPresent(" ", 1.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("blank");
    }
}
