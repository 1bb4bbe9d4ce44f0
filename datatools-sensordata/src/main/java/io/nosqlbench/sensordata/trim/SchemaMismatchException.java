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

import io.nosqlbench.sensordata.SensorDataException;

/// Thrown when a merged table does not have one column per input channel plus its time column.
/// This points at a broken merge or a channel name collision upstream.
public class SchemaMismatchException extends SensorDataException {

    private final int expectedColumns;
    private final int actualColumns;

    public SchemaMismatchException(int expectedColumns, int actualColumns) {
        super(String.format("Expected %d columns (channels plus timestamp) but the table has %d",
            expectedColumns, actualColumns));
        this.expectedColumns = expectedColumns;
        this.actualColumns = actualColumns;
    }

    public int getExpectedColumns() {
        return expectedColumns;
    }

    public int getActualColumns() {
        return actualColumns;
    }
}
