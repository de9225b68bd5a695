/*
 * RotationOperatorBuilder.java
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

package org.arcconv.arc;

import org.arcconv.annotation.API;
import org.arcconv.linear.RealMatrix;
import org.arcconv.linear.RowMajorRealMatrix;
import org.arcconv.tensor.ShapeMismatchException;
import org.arcconv.tensor.Tensor;
import org.arcconv.util.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * Builds the 9x9 operators that rotate a 3x3 kernel about its center tap.
 * <p>
 * Taps are numbered row-major {@code 0..8}. Row {@code r} of an operator says how much of every source tap ends up in
 * output tap {@code r}, so the rotated kernel is {@code R w} for a flattened kernel {@code w}. The entries are
 * bilinear interpolation weights of the eight outer taps moving along the border of the kernel, expressed in terms
 * of {@code x = cos θ}, {@code y = sin θ}, {@code a = x - y}, {@code b = x y} and {@code c = x + y}. Rows always sum
 * to one, the center tap is fixed, and {@code θ = 0} gives the identity. For {@code |θ| < 45°} all entries are
 * non-negative.
 * <p>
 * Two templates exist, one for each direction of rotation. They are both evaluated for every angle and blended with a
 * {@code θ ≥ 0} mask, so {@code -0.0} uses the positive template and {@code NaN} angles propagate into the operator.
 */
@API(API.Status.EXPERIMENTAL)
public final class RotationOperatorBuilder {
    public static final int TAPS = 9;

    /**
     * The symbolic entries that occur in the templates.
     */
    enum Term {
        ZERO,
        ONE,
        A,
        ONE_MINUS_A,
        B,
        MINUS_B,
        C,
        ONE_MINUS_C,
        X_MINUS_B,
        Y_MINUS_B,
        ONE_MINUS_C_PLUS_B,
        X_PLUS_B,
        ONE_MINUS_A_MINUS_B,
        B_MINUS_Y;

        double evaluate(final double x, final double y) {
            final double a = x - y;
            final double b = x * y;
            final double c = x + y;
            switch (this) {
                case ZERO:
                    return 0.0d;
                case ONE:
                    return 1.0d;
                case A:
                    return a;
                case ONE_MINUS_A:
                    return 1.0d - a;
                case B:
                    return b;
                case MINUS_B:
                    return -b;
                case C:
                    return c;
                case ONE_MINUS_C:
                    return 1.0d - c;
                case X_MINUS_B:
                    return x - b;
                case Y_MINUS_B:
                    return y - b;
                case ONE_MINUS_C_PLUS_B:
                    return 1.0d - c + b;
                case X_PLUS_B:
                    return x + b;
                case ONE_MINUS_A_MINUS_B:
                    return 1.0d - a - b;
                case B_MINUS_Y:
                    return b - y;
                default:
                    throw new IllegalStateException("unknown term " + this);
            }
        }
    }

    private static final Term O = Term.ZERO;

    @Nonnull
    static final Term[][] POSITIVE = {
            {Term.A, Term.ONE_MINUS_A, O, O, O, O, O, O, O},
            {O, Term.X_MINUS_B, Term.B, O, Term.ONE_MINUS_C_PLUS_B, Term.Y_MINUS_B, O, O, O},
            {O, O, Term.A, O, O, Term.ONE_MINUS_A, O, O, O},
            {Term.B, Term.Y_MINUS_B, O, Term.X_MINUS_B, Term.ONE_MINUS_C_PLUS_B, O, O, O, O},
            {O, O, O, O, Term.ONE, O, O, O, O},
            {O, O, O, O, Term.ONE_MINUS_C_PLUS_B, Term.X_MINUS_B, O, Term.Y_MINUS_B, Term.B},
            {O, O, O, Term.ONE_MINUS_A, O, O, Term.A, O, O},
            {O, O, O, Term.Y_MINUS_B, Term.ONE_MINUS_C_PLUS_B, O, Term.B, Term.X_MINUS_B, O},
            {O, O, O, O, O, O, O, Term.ONE_MINUS_A, Term.A}
    };

    @Nonnull
    static final Term[][] NEGATIVE = {
            {Term.C, O, O, Term.ONE_MINUS_C, O, O, O, O, O},
            {Term.MINUS_B, Term.X_PLUS_B, O, Term.B_MINUS_Y, Term.ONE_MINUS_A_MINUS_B, O, O, O, O},
            {O, Term.ONE_MINUS_C, Term.C, O, O, O, O, O, O},
            {O, O, O, Term.X_PLUS_B, Term.ONE_MINUS_A_MINUS_B, O, Term.MINUS_B, Term.B_MINUS_Y, O},
            {O, O, O, O, Term.ONE, O, O, O, O},
            {O, Term.B_MINUS_Y, Term.MINUS_B, O, Term.ONE_MINUS_A_MINUS_B, Term.X_PLUS_B, O, O, O},
            {O, O, O, O, O, O, Term.C, Term.ONE_MINUS_C, O},
            {O, O, O, O, Term.ONE_MINUS_A_MINUS_B, Term.B_MINUS_Y, O, Term.X_PLUS_B, Term.MINUS_B},
            {O, O, O, O, O, Term.ONE_MINUS_C, O, O, Term.C}
    };

    private RotationOperatorBuilder() {
        // nothing
    }

    /**
     * Builds one operator per angle.
     *
     * @param angles rotation angles in radians, of shape {@code (B, kernelNumber)}
     * @return operators of shape {@code (B, kernelNumber, 9, 9)}
     */
    @Nonnull
    public static Tensor build(@Nonnull final Tensor angles) {
        if (angles.rank() != 2) {
            throw new ShapeMismatchException("angles must be (B, kernelNumber)",
                    LogMessageKeys.ACTUAL_SHAPE, Tensor.shapeToString(angles.getShape()));
        }
        final double[] thetas = angles.getData();
        final double[] result = new double[thetas.length * TAPS * TAPS];
        for (int k = 0; k < thetas.length; k++) {
            writeOperator(thetas[k], result, k * TAPS * TAPS);
        }
        return Tensor.wrap(result, angles.dim(0), angles.dim(1), TAPS, TAPS);
    }

    /**
     * Builds the operator for a single angle.
     *
     * @param theta the rotation angle in radians
     * @return a 9x9 matrix
     */
    @Nonnull
    public static RealMatrix build(final double theta) {
        final double[] flat = new double[TAPS * TAPS];
        writeOperator(theta, flat, 0);
        final double[][] data = new double[TAPS][TAPS];
        for (int r = 0; r < TAPS; r++) {
            System.arraycopy(flat, r * TAPS, data[r], 0, TAPS);
        }
        return new RowMajorRealMatrix(data);
    }

    private static void writeOperator(final double theta, @Nonnull final double[] target, final int offset) {
        final double x = Math.cos(theta);
        final double y = Math.sin(theta);
        // -0.0 >= 0 holds, NaN >= 0 does not
        final double mask = theta >= 0.0d ? 1.0d : 0.0d;
        for (int r = 0; r < TAPS; r++) {
            for (int c = 0; c < TAPS; c++) {
                final double positive = POSITIVE[r][c].evaluate(x, y);
                final double negative = NEGATIVE[r][c].evaluate(x, y);
                target[offset + r * TAPS + c] = mask * positive + (1.0d - mask) * negative;
            }
        }
    }
}
