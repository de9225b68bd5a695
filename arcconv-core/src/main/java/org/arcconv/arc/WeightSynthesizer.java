/*
 * WeightSynthesizer.java
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

/**
 * Turns a kernel bank and per-sample routing signals into the weights of one grouped convolution.
 * <p>
 * For sample {@code b} and variant {@code i}, every 3x3 kernel of {@code bank[i]} is rotated by the operator for
 * {@code angles[b, i]} and scaled by {@code gating[b, i]}. The operators of all samples are stacked into one
 * {@code (B 9, n 9)} matrix and the bank is flattened to {@code (n 9, Cout Cin)}; the product is then taken per
 * variant, one {@code (B 9, 9) x (9, Cout Cin)} multiplication each, so that variants never mix.
 */
@API(API.Status.EXPERIMENTAL)
public final class WeightSynthesizer {
    @Nonnull
    private static final Logger logger = LoggerFactory.getLogger(WeightSynthesizer.class);

    private static final int TAPS = RotationOperatorBuilder.TAPS;

    private WeightSynthesizer() {
        // nothing
    }

    @Nonnull
    public static Tensor synthesize(@Nonnull final Tensor kernelBank, @Nonnull final RoutingSignal signal) {
        return synthesize(kernelBank, signal.getGating(), signal.getAngles());
    }

    /**
     * Synthesizes the per-sample, per-variant weights.
     *
     * @param kernelBank the kernel bank of shape {@code (n, Cout, Cin / groups, 3, 3)}
     * @param gating gating magnitudes of shape {@code (B, n)}
     * @param angles rotation angles in radians of shape {@code (B, n)}
     * @return weights of shape {@code (B n Cout, Cin / groups, 3, 3)}, where the kernels of sample {@code b} and
     *         variant {@code i} start at row {@code (b n + i) Cout}
     * @throws ShapeMismatchException if the shapes of the arguments do not agree
     */
    @Nonnull
    public static Tensor synthesize(@Nonnull final Tensor kernelBank, @Nonnull final Tensor gating,
                                    @Nonnull final Tensor angles) {
        if (kernelBank.rank() != 5 || kernelBank.dim(3) != 3 || kernelBank.dim(4) != 3) {
            throw new ShapeMismatchException("kernel bank must be (n, Cout, Cin, 3, 3)",
                    LogMessageKeys.ACTUAL_SHAPE, Tensor.shapeToString(kernelBank.getShape()));
        }
        if (gating.rank() != 2 || !angles.hasShape(gating.getShape())) {
            throw ShapeMismatchException.ofShapes("gating and angles must both be (B, n)",
                    gating.getShape(), angles.getShape());
        }
        final int kernelNumber = kernelBank.dim(0);
        if (gating.dim(1) != kernelNumber) {
            throw new ShapeMismatchException("routing signal does not match kernel bank",
                    LogMessageKeys.KERNEL_NUMBER, kernelNumber,
                    LogMessageKeys.ACTUAL_SHAPE, Tensor.shapeToString(gating.getShape()));
        }

        final int batchSize = gating.dim(0);
        final int outChannels = kernelBank.dim(1);
        final int inChannels = kernelBank.dim(2);
        final int kernelSize = outChannels * inChannels;

        final RealMatrix operators = gatedOperatorMatrix(RotationOperatorBuilder.build(angles), gating);
        final RealMatrix weights = flattenKernelBank(kernelBank);

        // (B 9, n, Cout Cin)
        final double[] stacked = new double[batchSize * TAPS * kernelNumber * kernelSize];
        for (int i = 0; i < kernelNumber; i++) {
            final RealMatrix product =
                    operators.subMatrix(0, batchSize * TAPS, i * TAPS, TAPS)
                            .multiply(weights.subMatrix(i * TAPS, TAPS, 0, kernelSize));
            final double[][] rows = product.getRowMajorData();
            for (int row = 0; row < batchSize * TAPS; row++) {
                System.arraycopy(rows[row], 0, stacked, (row * kernelNumber + i) * kernelSize, kernelSize);
            }
        }

        if (logger.isTraceEnabled()) {
            logger.trace("synthesized weights; batchSize={}, kernelNumber={}, outChannels={}, inChannels={}",
                    batchSize, kernelNumber, outChannels, inChannels);
        }

        return Tensor.wrap(stacked, batchSize, 3, 3, kernelNumber, outChannels, inChannels)
                .permute(0, 3, 4, 5, 1, 2)
                .reshape(batchSize * kernelNumber * outChannels, inChannels, 3, 3);
    }

    /**
     * Scales every operator by its gating value and lays the result out as a {@code (B 9, n 9)} matrix whose entry
     * {@code (b 9 + r, i 9 + c)} is {@code gating[b, i] R[b, i][r][c]}.
     */
    @Nonnull
    static RealMatrix gatedOperatorMatrix(@Nonnull final Tensor operators, @Nonnull final Tensor gating) {
        final int batchSize = operators.dim(0);
        final int kernelNumber = operators.dim(1);
        final double[] r = operators.getData();
        final double[] g = gating.getData();
        final double[][] data = new double[batchSize * TAPS][kernelNumber * TAPS];
        for (int b = 0; b < batchSize; b++) {
            for (int i = 0; i < kernelNumber; i++) {
                final double scale = g[b * kernelNumber + i];
                final int base = (b * kernelNumber + i) * TAPS * TAPS;
                for (int row = 0; row < TAPS; row++) {
                    for (int column = 0; column < TAPS; column++) {
                        data[b * TAPS + row][i * TAPS + column] = scale * r[base + row * TAPS + column];
                    }
                }
            }
        }
        return new RowMajorRealMatrix(data);
    }

    /**
     * Moves the tap axes of the bank next to the variant axis, giving a {@code (n 9, Cout Cin)} matrix.
     */
    @Nonnull
    static RealMatrix flattenKernelBank(@Nonnull final Tensor kernelBank) {
        final int kernelNumber = kernelBank.dim(0);
        final int kernelSize = kernelBank.dim(1) * kernelBank.dim(2);
        return RowMajorRealMatrix.fromTensor(
                kernelBank.reshape(kernelNumber, kernelSize, TAPS)
                        .permute(0, 2, 1)
                        .reshape(kernelNumber * TAPS, kernelSize));
    }
}
