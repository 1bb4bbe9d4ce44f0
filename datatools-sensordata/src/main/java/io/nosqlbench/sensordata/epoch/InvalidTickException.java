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

import io.nosqlbench.sensordata.SensorDataException;

/// Thrown when a tick count lies outside the range a calendar date can be derived from.
public class InvalidTickException extends SensorDataException {

    private final long ticks;

    public InvalidTickException(long ticks) {
        super(String.format("Tick value %d is outside the supported range [0, %d]",
            ticks, TickEpochConverter.MAX_TICKS));
        this.ticks = ticks;
    }

    public long getTicks() {
        return ticks;
    }
}
