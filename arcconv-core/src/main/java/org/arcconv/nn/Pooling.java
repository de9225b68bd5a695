/*
 * Pooling.java
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

import org.arcconv.annotation.API;
import org.arcconv.tensor.ShapeMismatchException;
import org.arcconv.tensor.Tensor;
import org.arcconv.util.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * Spatial pooling.
 */
@API(API.Status.EXPERIMENTAL)
public final class Pooling {
    private Pooling() {
        // nothing
    }

    /**
     * Averages every channel over its spatial extent.
     *
     * @param input a feature map of shape {@code (B, C, H, W)}
     * @return a tensor of shape {@code (B, C, 1, 1)}
     */
    @Nonnull
    public static Tensor globalAveragePool(@Nonnull final Tensor input) {
        if (input.rank() != 4) {
            throw new ShapeMismatchException("pooling input must be (B, C, H, W)",
                    LogMessageKeys.ACTUAL_SHAPE, Tensor.shapeToString(input.getShape()));
        }
        final int batchSize = input.dim(0);
        final int channels = input.dim(1);
        final int plane = input.dim(2) * input.dim(3);
        final double[] in = input.getData();
        final double[] out = new double[batchSize * channels];
        for (int bc = 0; bc < batchSize * channels; bc++) {
            double sum = 0.0d;
            final int base = bc * plane;
            for (int i = 0; i < plane; i++) {
                sum += in[base + i];
            }
            out[bc] = sum / plane;
        }
        return Tensor.wrap(out, batchSize, channels, 1, 1);
    }
}
