package io.nosqlbench.sensordata.epoch;

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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TickEpochConverter")
class TickEpochConverterTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "621355968000000000, 1970-01-01T00:00:00Z",
        "637134336000000000, 2020-01-01T00:00:00Z",
        "0,                  0001-01-01T00:00:00Z",
        "3155378975999999999, 9999-12-31T23:59:59Z",
        "630822816000000000, 2000-01-01T00:00:00Z"
    })
    @DisplayName("converts known tick values")
    void convertsKnownPairs(long ticks, String expected) {
        assertThat(TickEpochConverter.toInstant(ticks)).isEqualTo(Instant.parse(expected));
    }

    @Test
    @DisplayName("truncates sub-second ticks instead of rounding")
    void truncatesSubSecondTicks() {
        long second = 637_134_336_000_000_000L;
        assertThat(TickEpochConverter.toInstant(second + 1)).isEqualTo(Instant.parse("2020-01-01T00:00:00Z"));
        assertThat(TickEpochConverter.toInstant(second + 9_999_999)).isEqualTo(Instant.parse("2020-01-01T00:00:00Z"));
        assertThat(TickEpochConverter.toInstant(second + 10_000_000)).isEqualTo(Instant.parse("2020-01-01T00:00:01Z"));
    }

    @Test
    @DisplayName("truncates toward the earlier second before 1970")
    void truncatesBeforeUnixEpoch() {
        long ticks = TickEpochConverter.UNIX_EPOCH_TICKS - 1;
        assertThat(TickEpochConverter.toInstant(ticks)).isEqualTo(Instant.parse("1969-12-31T23:59:59Z"));
    }

    @Test
    void absentTickGivesAbsentInstant() {
        assertThat(TickEpochConverter.toInstant(OptionalLong.empty())).isEqualTo(Optional.empty());
        assertThat(TickEpochConverter.toInstant(OptionalLong.of(621_355_968_000_000_000L)))
            .contains(Instant.EPOCH);
    }

    @ParameterizedTest
    @CsvSource({"-1", "3155378976000000000", "-9223372036854775808"})
    @DisplayName("rejects ticks outside year 1 to 9999")
    void rejectsOutOfRangeTicks(long ticks) {
        assertThatThrownBy(() -> TickEpochConverter.toInstant(ticks))
            .isInstanceOf(InvalidTickException.class)
            .hasMessageContaining(Long.toString(ticks))
            .satisfies(e -> assertThat(((InvalidTickException) e).getTicks()).isEqualTo(ticks));
    }

    @Test
    void toTicksInvertsWholeSeconds() {
        Instant instant = Instant.parse("2021-06-15T12:34:56Z");
        assertThat(TickEpochConverter.toInstant(TickEpochConverter.toTicks(instant))).isEqualTo(instant);
        assertThat(TickEpochConverter.toTicks(Instant.parse("2020-01-01T00:00:00Z"))).isEqualTo(637_134_336_000_000_000L);
    }

    @Test
    void toTicksRejectsInstantsBeforeYearOne() {
        assertThatThrownBy(() -> TickEpochConverter.toTicks(Instant.parse("0000-12-31T23:59:59Z")))
            .isInstanceOf(InvalidTickException.class);
    }
}
