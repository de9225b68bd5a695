/*
 * RealMatrix.java
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

import com.google.common.base.Verify;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A dense matrix of real numbers.
 */
public interface RealMatrix {
    int getRowDimension();

    int getColumnDimension();

    double getEntry(int row, int column);

    @Nonnull
    RealMatrix multiply(@Nonnull RealMatrix otherMatrix);

    @Nonnull
    RealMatrix subMatrix(int startRow, int lengthRow, int startColumn, int lengthColumn);

    @Nonnull
    double[][] getRowMajorData();

    /**
     * Computes {@code A x} for this matrix {@code A}.
     * @param vector the vector {@code x}
     * @return a new array holding {@code A x}
     */
    @Nonnull
    default double[] operate(@Nonnull final double[] vector) {
        Verify.verify(getColumnDimension() == vector.length);
        final double[] result = new double[getRowDimension()];
        for (int i = 0; i < getRowDimension(); i ++) {
            double sum = 0.0d;
            for (int j = 0; j < getColumnDimension(); j ++) {
                sum += getEntry(i, j) * vector[j];
            }
            result[i] = sum;
        }
        return result;
    }

    default boolean valueEquals(@Nullable final Object o) {
        if (!(o instanceof RealMatrix)) {
            return false;
        }

        final RealMatrix that = (RealMatrix)o;
        if (getRowDimension() != that.getRowDimension() ||
                getColumnDimension() != that.getColumnDimension()) {
            return false;
        }

        for (int i = 0; i < getRowDimension(); i ++) {
            for (int j = 0; j < getColumnDimension(); j ++) {
                if (getEntry(i, j) != that.getEntry(i, j)) {
                    return false;
                }
            }
        }
        return true;
    }

    default int valueBasedHashCode() {
        int hashCode = 0;
        for (int i = 0; i < getRowDimension(); i ++) {
            for (int j = 0; j < getColumnDimension(); j ++) {
                hashCode += 31 * Double.hashCode(getEntry(i, j));
            }
        }
        return hashCode;
    }
}
