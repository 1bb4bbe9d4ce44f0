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

import java.util.ArrayList;
import java.util.List;

/// A table with one time column followed by numeric value columns.
///
/// The merged, aligned and aggregated tables all share this shape, which lets summaries and
/// feature extraction treat them alike.
public interface ColumnarTable {

    /// @return the header name of the time column
    String timeColumnName();

    int rowCount();

    /// @return the value columns in output order
    List<ValueColumn> valueColumns();

    /// @return the time column name followed by all value column names
    default List<String> columnNames() {
        List<String> names = new ArrayList<>();
        names.add(timeColumnName());
        valueColumns().forEach(c -> names.add(c.name()));
        return names;
    }

    /// @return the number of columns including the time column
    default int columnCount() {
        return valueColumns().size() + 1;
    }
}
