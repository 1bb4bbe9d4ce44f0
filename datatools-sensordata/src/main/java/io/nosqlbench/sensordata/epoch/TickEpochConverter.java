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

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

/// Converts tick-based timestamps to calendar instants.
///
/// A tick is 100 nanoseconds, counted from `0001-01-01T00:00:00Z` (the epoch used by .NET
/// `DateTime` values). Conversion keeps whole seconds only: the tick remainder below one second
/// is discarded by floor division, never rounded. Downstream consumers rely on this, so two
/// ticks within the same second always map to the same instant.
///
/// ```
/// TickEpochConverter.toInstant(621_355_968_000_000_000L)   // 1970-01-01T00:00:00Z
/// TickEpochConverter.toInstant(621_355_968_019_999_999L)   // 1970-01-01T00:00:01Z
/// ```
public final class TickEpochConverter {

    /// Ticks per second (one tick is 100ns)
    public static final long TICKS_PER_SECOND = 10_000_000L;

    /// Ticks between 0001-01-01 and 1970-01-01
    public static final long UNIX_EPOCH_TICKS = 621_355_968_000_000_000L;

    /// The last tick of 9999-12-31
    public static final long MAX_TICKS = 3_155_378_975_999_999_999L;

    private TickEpochConverter() {
    }

    /// Convert a tick count to the instant of its whole second.
    ///
    /// @param ticks
    ///     ticks since 0001-01-01T00:00:00Z
    /// @return the calendar instant, truncated to the second
    /// @throws InvalidTickException
    ///     if the tick count is negative or beyond the year 9999
    public static Instant toInstant(long ticks) {
        if (ticks < 0 || ticks > MAX_TICKS) {
            throw new InvalidTickException(ticks);
        }
        long epochSeconds = Math.floorDiv(ticks - UNIX_EPOCH_TICKS, TICKS_PER_SECOND);
        return Instant.ofEpochSecond(epochSeconds);
    }

    /// Convert an optional tick count. An absent input yields an absent result, not an error.
    ///
    /// @param ticks
    ///     the tick count, possibly absent
    /// @return the instant, or empty when no tick value was given
    public static Optional<Instant> toInstant(OptionalLong ticks) {
        if (ticks.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toInstant(ticks.getAsLong()));
    }

    /// Convert an instant back to ticks. Sub-tick precision of the instant is dropped.
    ///
    /// @param instant
    ///     the instant to convert
    /// @return ticks since 0001-01-01T00:00:00Z
    /// @throws InvalidTickException
    ///     if the instant cannot be expressed as a valid tick count
    public static long toTicks(Instant instant) {
        long ticks;
        try {
            ticks = Math.addExact(
                Math.multiplyExact(instant.getEpochSecond(), TICKS_PER_SECOND),
                UNIX_EPOCH_TICKS + instant.getNano() / 100
            );
        } catch (ArithmeticException e) {
            throw new InvalidTickException(instant.getEpochSecond() < 0 ? Long.MIN_VALUE : Long.MAX_VALUE);
        }
        if (ticks < 0 || ticks > MAX_TICKS) {
            throw new InvalidTickException(ticks);
        }
        return ticks;
    }
}
