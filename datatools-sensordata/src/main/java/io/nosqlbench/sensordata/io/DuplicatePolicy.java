package io.nosqlbench.sensordata.io;

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

/// What to do when a channel file holds more than one row for the same tick.
public enum DuplicatePolicy {
    /// Reject the file
    FAIL,
    /// Keep the row that appears first in the file
    KEEP_FIRST,
    /// Keep the row that appears last in the file
    KEEP_LAST
}
