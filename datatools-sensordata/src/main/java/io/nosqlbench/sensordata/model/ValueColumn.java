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

import java.util.Arrays;
import java.util.BitSet;
import java.util.Objects;
import java.util.OptionalDouble;

/// An immutable named column of numeric cells, each of which is either present or missing.
///
/// Presence is tracked separately from the value array, so a missing cell is never confused
/// with a recorded `NaN`. Every table type in this package stores its channels as value
/// columns.
public final class ValueColumn {

    private final String name;
    private final double[] values;
    private final BitSet present;

    private ValueColumn(String name, double[] values, BitSet present, boolean copy) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be null or blank");
        }
        Objects.requireNonNull(values, "values cannot be null");
        Objects.requireNonNull(present, "presence mask cannot be null");
        if (present.length() > values.length) {
            throw new IllegalArgumentException(
                "Presence mask for column '" + name + "' marks rows beyond its " + values.length + " values");
        }
        this.name = name;
        this.values = copy ? values.clone() : values;
        this.present = copy ? (BitSet) present.clone() : present;
    }

    /// Create a column from values and a presence mask. Both are copied.
    public ValueColumn(String name, double[] values, BitSet present) {
        this(name, values, present, true);
    }

    /// Create a column where a `null` element denotes a missing cell.
    public static ValueColumn of(String name, Double... cells) {
        Builder builder = builder(name, cells.length);
        for (int row = 0; row < cells.length; row++) {
            if (cells[row] != null) {
                builder.set(row, cells[row]);
            }
        }
        return builder.build();
    }

    /// Create a column in which every cell is present.
    public static ValueColumn ofPresent(String name, double... values) {
        BitSet present = new BitSet(values.length);
        present.set(0, values.length);
        return new ValueColumn(name, values, present);
    }

    /// Create a column of the given size in which every cell is missing.
    public static ValueColumn missing(String name, int size) {
        return new ValueColumn(name, new double[size], new BitSet(size), false);
    }

    public static Builder builder(String name, int size) {
        return new Builder(name, size);
    }

    public String name() {
        return name;
    }

    public int size() {
        return values.length;
    }

    public boolean isPresent(int row) {
        checkRow(row);
        return present.get(row);
    }

    /// @return the cell value, or empty when the cell is missing
    public OptionalDouble get(int row) {
        checkRow(row);
        return present.get(row) ? OptionalDouble.of(values[row]) : OptionalDouble.empty();
    }

    /// Return the value of a present cell.
    ///
    /// @throws IllegalStateException
    ///     if the cell is missing
    public double valueAt(int row) {
        if (!isPresent(row)) {
            throw new IllegalStateException("Cell " + row + " of column '" + name + "' is missing");
        }
        return values[row];
    }

    public int presentCount() {
        return present.cardinality();
    }

    public int missingCount() {
        return values.length - present.cardinality();
    }

    /// @return the index of the first present cell, or -1 when there is none
    public int firstPresentIndex() {
        return present.nextSetBit(0);
    }

    /// @return the index of the last present cell, or -1 when there is none
    public int lastPresentIndex() {
        return present.previousSetBit(values.length - 1);
    }

    /// Copy rows `[fromInclusive, toExclusive)` into a new column.
    public ValueColumn slice(int fromInclusive, int toExclusive) {
        if (fromInclusive < 0 || toExclusive > values.length || fromInclusive > toExclusive) {
            throw new IndexOutOfBoundsException(
                "Invalid slice [" + fromInclusive + ", " + toExclusive + ") of column size " + values.length);
        }
        return new ValueColumn(
            name,
            Arrays.copyOfRange(values, fromInclusive, toExclusive),
            present.get(fromInclusive, toExclusive),
            false
        );
    }

    public ValueColumn renamed(String newName) {
        return new ValueColumn(newName, values, present, false);
    }

    private void checkRow(int row) {
        if (row < 0 || row >= values.length) {
            throw new IndexOutOfBoundsException("Row " + row + " out of range for column '" + name
                                                + "' of size " + values.length);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValueColumn)) {
            return false;
        }
        ValueColumn other = (ValueColumn) o;
        if (!name.equals(other.name) || values.length != other.values.length || !present.equals(other.present)) {
            return false;
        }
        for (int row = present.nextSetBit(0); row >= 0; row = present.nextSetBit(row + 1)) {
            if (Double.compare(values[row], other.values[row]) != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(name, values.length, present);
        for (int row = present.nextSetBit(0); row >= 0; row = present.nextSetBit(row + 1)) {
            result = 31 * result + Double.hashCode(values[row]);
        }
        return result;
    }

    @Override
    public String toString() {
        return "ValueColumn{" + name + ", size=" + values.length + ", present=" + presentCount() + "}";
    }

    /// Fills a column cell by cell. Cells that are never set stay missing.
    public static final class Builder {
        private final String name;
        private final double[] values;
        private final BitSet present;
        private boolean built;

        private Builder(String name, int size) {
            if (size < 0) {
                throw new IllegalArgumentException("Column size must be non-negative, got " + size);
            }
            this.name = name;
            this.values = new double[size];
            this.present = new BitSet(size);
        }

        public Builder set(int row, double value) {
            if (built) {
                throw new IllegalStateException("Column '" + name + "' has already been built");
            }
            values[row] = value;
            present.set(row);
            return this;
        }

        public Builder set(int row, OptionalDouble value) {
            if (value.isPresent()) {
                set(row, value.getAsDouble());
            }
            return this;
        }

        public ValueColumn build() {
            built = true;
            return new ValueColumn(name, values, present, false);
        }
    }
}
