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

import io.nosqlbench.sensordata.model.ColumnarTable;
import io.nosqlbench.sensordata.model.ValueColumn;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Dense, fixed-width view of a table's value columns, ready to hand to a sequence model.
///
/// Each matrix row corresponds to one row of the source table, identified by [#sourceRow(int)].
/// The cell mask is `true` where the source cell was missing. A sequence model's key-padding
/// mask has one flag per step instead; [#rowMask()] gives that form, `true` for every row with
/// at least one missing cell.
public final class FeatureMatrix {

    private final List<String> columns;
    private final double[][] values;
    private final boolean[][] mask;
    private final int[] sourceRows;

    private FeatureMatrix(List<String> columns, double[][] values, boolean[][] mask, int[] sourceRows) {
        this.columns = List.copyOf(columns);
        this.values = values;
        this.mask = mask;
        this.sourceRows = sourceRows;
    }

    /// Build a feature matrix from all value columns of a table.
    ///
    /// @param table
    ///     the source table, usually an aligned or aggregated table
    /// @param policy
    ///     how to treat missing cells
    /// @return the matrix
    public static FeatureMatrix of(ColumnarTable table, MissingValuePolicy policy) {
        Objects.requireNonNull(table, "table cannot be null");
        Objects.requireNonNull(policy, "policy cannot be null");
        List<ValueColumn> valueColumns = table.valueColumns();
        int width = valueColumns.size();
        List<String> names = new ArrayList<>(width);
        valueColumns.forEach(c -> names.add(c.name()));

        List<Integer> kept = new ArrayList<>();
        for (int row = 0; row < table.rowCount(); row++) {
            if (policy == MissingValuePolicy.MASK || isComplete(valueColumns, row)) {
                kept.add(row);
            }
        }

        double[][] values = new double[kept.size()][width];
        boolean[][] mask = new boolean[kept.size()][width];
        int[] sourceRows = new int[kept.size()];
        for (int i = 0; i < kept.size(); i++) {
            int row = kept.get(i);
            sourceRows[i] = row;
            for (int col = 0; col < width; col++) {
                ValueColumn column = valueColumns.get(col);
                if (column.isPresent(row)) {
                    values[i][col] = column.valueAt(row);
                } else {
                    mask[i][col] = true;
                }
            }
        }
        return new FeatureMatrix(names, values, mask, sourceRows);
    }

    private static boolean isComplete(List<ValueColumn> columns, int row) {
        for (ValueColumn column : columns) {
            if (!column.isPresent(row)) {
                return false;
            }
        }
        return true;
    }

    public List<String> columns() {
        return columns;
    }

    public int rows() {
        return values.length;
    }

    public int width() {
        return columns.size();
    }

    public double value(int row, int column) {
        return values[row][column];
    }

    public boolean isMasked(int row, int column) {
        return mask[row][column];
    }

    /// @return the index of the source table row this matrix row came from
    public int sourceRow(int row) {
        return sourceRows[row];
    }

    /// @return a copy of the values, row major
    public double[][] values() {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i].clone();
        }
        return copy;
    }

    /// @return a copy of the mask, row major
    public boolean[][] mask() {
        boolean[][] copy = new boolean[mask.length][];
        for (int i = 0; i < mask.length; i++) {
            copy[i] = mask[i].clone();
        }
        return copy;
    }

    /// @return one flag per row, `true` where any cell of the row is masked
    public boolean[] rowMask() {
        boolean[] rowMask = new boolean[mask.length];
        for (int i = 0; i < mask.length; i++) {
            for (boolean cell : mask[i]) {
                if (cell) {
                    rowMask[i] = true;
                    break;
                }
            }
        }
        return rowMask;
    }

    /// @return whether any cell is masked
    public boolean hasMaskedCells() {
        for (boolean[] row : mask) {
            for (boolean cell : row) {
                if (cell) {
                    return true;
                }
            }
        }
        return false;
    }
}
