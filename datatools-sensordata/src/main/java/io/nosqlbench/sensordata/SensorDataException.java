package io.nosqlbench.sensordata;

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

/// Base type for failures that abort a sensordata run.
///
/// Conditions which are valid but degenerate, such as a target channel without any data or an
/// aggregation bucket without samples, are never reported through this type. They travel through
/// the tables as missing values instead.
public class SensorDataException extends RuntimeException {

    public SensorDataException(String message) {
        super(message);
    }

    public SensorDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
