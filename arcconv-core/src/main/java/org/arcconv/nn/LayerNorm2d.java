/*
 * LayerNorm2d.java
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
 * Layer normalization over the channel axis of a {@code (B, C, H, W)} feature map, computed independently at every
 * sample and spatial position, followed by a per-channel affine transform.
 */
@API(API.Status.EXPERIMENTAL)
public class LayerNorm2d extends AbstractLayer {
    public static final double DEFAULT_EPSILON = 1e-5;

    private final int channels;
    private final double epsilon;
    @Nonnull
    private final Tensor weight;
    @Nonnull
    private final Tensor bias;

    public LayerNorm2d(final int channels) {
        this(channels, DEFAULT_EPSILON);
    }

    public LayerNorm2d(final int channels, final double epsilon) {
        Preconditions.checkArgument(channels >= 1, "channels must be positive");
        Preconditions.checkArgument(epsilon > 0, "epsilon must be positive");
        this.channels = channels;
        this.epsilon = epsilon;
        this.weight = registerParameter("weight", Tensor.filled(1.0d, channels));
        this.bias = registerParameter("bias", Tensor.zeros(channels));
    }

    @Nonnull
    @Override
    public Tensor forward(@Nonnull final Tensor input) {
        if (input.rank() != 4 || input.dim(1) != channels) {
            throw new ShapeMismatchException("layer norm input must be (B, C, H, W)",
                    LogMessageKeys.EXPECTED_CHANNELS, channels,
                    LogMessageKeys.ACTUAL_SHAPE, Tensor.shapeToString(input.getShape()));
        }
        final int batchSize = input.dim(0);
        final int plane = input.dim(2) * input.dim(3);
        final double[] in = input.getData();
        final double[] out = new double[in.length];
        final double[] gamma = weight.getData();
        final double[] beta = bias.getData();
        for (int b = 0; b < batchSize; b++) {
            final int base = b * channels * plane;
            for (int p = 0; p < plane; p++) {
                double mean = 0.0d;
                for (int c = 0; c < channels; c++) {
                    mean += in[base + c * plane + p];
                }
                mean /= channels;
                double variance = 0.0d;
                for (int c = 0; c < channels; c++) {
                    final double d = in[base + c * plane + p] - mean;
                    variance += d * d;
                }
                variance /= channels;
                final double invStd = 1.0d / Math.sqrt(variance + epsilon);
                for (int c = 0; c < channels; c++) {
                    final int i = base + c * plane + p;
                    out[i] = (in[i] - mean) * invStd * gamma[c] + beta[c];
                }
            }
        }
        return Tensor.wrap(out, input.getShape());
    }

    @Override
    public String toString() {
        return "LayerNorm2d(" + channels + ")";
    }
}
