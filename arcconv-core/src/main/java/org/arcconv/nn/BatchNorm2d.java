/*
 * BatchNorm2d.java
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

package org.arcconv.nn;

import com.google.common.base.Preconditions;
import org.arcconv.annotation.API;
import org.arcconv.tensor.ShapeMismatchException;
import org.arcconv.tensor.Tensor;
import org.arcconv.util.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * Batch normalization over the channels of a {@code (B, C, H, W)} feature map.
 * <p>
 * In evaluation mode the running statistics are used; in training mode the statistics of the current batch are.
 * Running statistics are parameters like any other: they are updated by whoever trains the network through
 * {@link #loadParameters(java.util.Map)}, never by {@link #forward(Tensor)}.
 */
@API(API.Status.EXPERIMENTAL)
public class BatchNorm2d extends AbstractLayer {
    public static final double DEFAULT_EPSILON = 1e-5;

    private final int channels;
    private final double epsilon;
    @Nonnull
    private final Tensor weight;
    @Nonnull
    private final Tensor bias;
    @Nonnull
    private final Tensor runningMean;
    @Nonnull
    private final Tensor runningVar;

    public BatchNorm2d(final int channels) {
        this(channels, DEFAULT_EPSILON);
    }

    public BatchNorm2d(final int channels, final double epsilon) {
        Preconditions.checkArgument(channels >= 1, "channels must be positive");
        Preconditions.checkArgument(epsilon > 0, "epsilon must be positive");
        this.channels = channels;
        this.epsilon = epsilon;
        this.weight = registerParameter("weight", Tensor.filled(1.0d, channels));
        this.bias = registerParameter("bias", Tensor.zeros(channels));
        this.runningMean = registerParameter("runningMean", Tensor.zeros(channels));
        this.runningVar = registerParameter("runningVar", Tensor.filled(1.0d, channels));
    }

    @Nonnull
    @Override
    public Tensor forward(@Nonnull final Tensor input) {
        if (input.rank() != 4 || input.dim(1) != channels) {
            throw new ShapeMismatchException("batch norm input must be (B, C, H, W)",
                    LogMessageKeys.EXPECTED_CHANNELS, channels,
                    LogMessageKeys.ACTUAL_SHAPE, Tensor.shapeToString(input.getShape()));
        }
        final int batchSize = input.dim(0);
        final int plane = input.dim(2) * input.dim(3);
        final double[] in = input.getData();
        final double[] out = new double[in.length];

        final double[] mean;
        final double[] variance;
        if (isTraining()) {
            mean = new double[channels];
            variance = new double[channels];
            final int count = batchSize * plane;
            for (int c = 0; c < channels; c++) {
                double sum = 0.0d;
                for (int b = 0; b < batchSize; b++) {
                    final int base = (b * channels + c) * plane;
                    for (int p = 0; p < plane; p++) {
                        sum += in[base + p];
                    }
                }
                mean[c] = sum / count;
                double squares = 0.0d;
                for (int b = 0; b < batchSize; b++) {
                    final int base = (b * channels + c) * plane;
                    for (int p = 0; p < plane; p++) {
                        final double d = in[base + p] - mean[c];
                        squares += d * d;
                    }
                }
                // biased variance, as used for normalization
                variance[c] = squares / count;
            }
        } else {
            mean = runningMean.getData();
            variance = runningVar.getData();
        }

        final double[] gamma = weight.getData();
        final double[] beta = bias.getData();
        for (int b = 0; b < batchSize; b++) {
            for (int c = 0; c < channels; c++) {
                final double scale = gamma[c] / Math.sqrt(variance[c] + epsilon);
                final double shift = beta[c] - mean[c] * scale;
                final int base = (b * channels + c) * plane;
                for (int p = 0; p < plane; p++) {
                    out[base + p] = in[base + p] * scale + shift;
                }
            }
        }
        return Tensor.wrap(out, input.getShape());
    }

    @Override
    public String toString() {
        return "BatchNorm2d(" + channels + ")";
    }
}
