/*
 * RowMajorRealMatrix.java
 *
 * This source file is part of the ARC Conv open source project
 *
 * Copyright 2025 the ARC Conv project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.arcconv.linear;

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import org.arcconv.tensor.ShapeMismatchException;
import org.arcconv.tensor.Tensor;
import org.arcconv.util.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Arrays;

/**
 * A dense {@link RealMatrix} holding its entries as an array of rows.
 */
public class RowMajorRealMatrix implements RealMatrix {
    @Nonnull
    private final double[][] data;
    @Nonnull
    private final Supplier<Integer> hashCodeSupplier;

    public RowMajorRealMatrix(@Nonnull final double[][] data) {
        Preconditions.checkArgument(data.length > 0, "matrix must have at least one row");
        this.data = data;
        this.hashCodeSupplier = Suppliers.memoize(this::valueBasedHashCode);
    }

    /**
     * Creates a matrix from a rank-2 tensor. The tensor's data is copied.
     *
     * @param tensor a tensor of shape {@code (rows, columns)}
     * @return a new matrix
     */
    @Nonnull
    public static RowMajorRealMatrix fromTensor(@Nonnull final Tensor tensor) {
        if (tensor.rank() != 2) {
            throw new ShapeMismatchException("matrix requires a rank-2 tensor",
                    LogMessageKeys.ACTUAL_SHAPE, Tensor.shapeToString(tensor.getShape()));
        }
        final int rows = tensor.dim(0);
        final int columns = tensor.dim(1);
        final double[] flat = tensor.getData();
        final double[][] data = new double[rows][];
        for (int i = 0; i < rows; i++) {
            data[i] = Arrays.copyOfRange(flat, i * columns, (i + 1) * columns);
        }
        return new RowMajorRealMatrix(data);
    }

    @Nonnull
    @Override
    public double[][] getRowMajorData() {
        return data;
    }

    @Override
    public int getRowDimension() {
        return data.length;
    }

    @Override
    public int getColumnDimension() {
        return data[0].length;
    }

    @Override
    public double getEntry(final int row, final int column) {
        return data[row][column];
    }

    @Nonnull
    @Override
    public RealMatrix multiply(@Nonnull final RealMatrix otherMatrix) {
        Preconditions.checkArgument(getColumnDimension() == otherMatrix.getRowDimension());
        final int n = getRowDimension();
        final int m = otherMatrix.getColumnDimension();
        final int common = getColumnDimension();
        final double[][] other = otherMatrix.getRowMajorData();
        final double[][] result = new double[n][m];
        // i-k-j order walks both operands row by row
        for (int i = 0; i < n; i++) {
            final double[] resultRow = result[i];
            for (int k = 0; k < common; k++) {
                final double entry = data[i][k];
                final double[] otherRow = other[k];
                for (int j = 0; j < m; j++) {
                    resultRow[j] += entry * otherRow[j];
                }
            }
        }
        return new RowMajorRealMatrix(result);
    }

    @Nonnull
    @Override
    public RealMatrix subMatrix(final int startRow, final int lengthRow, final int startColumn, final int lengthColumn) {
        final double[][] subData = new double[lengthRow][lengthColumn];

        for (int i = startRow; i < startRow + lengthRow; i ++) {
            System.arraycopy(data[i], startColumn, subData[i - startRow], 0, lengthColumn);
        }

        return new RowMajorRealMatrix(subData);
    }

    @Override
    public final boolean equals(final Object o) {
        if (o instanceof RowMajorRealMatrix) {
            final RowMajorRealMatrix that = (RowMajorRealMatrix)o;
            return Arrays.deepEquals(data, that.data);
        }
        return valueEquals(o);
    }

    @Override
    public int hashCode() {
        return hashCodeSupplier.get();
    }

    @Override
    public String toString() {
        return "RowMajorRealMatrix[" + getRowDimension() + "x" + getColumnDimension() + "]";
    }
}
