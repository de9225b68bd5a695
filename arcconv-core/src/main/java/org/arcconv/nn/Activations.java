/*
 * Activations.java
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
import org.arcconv.tensor.Tensor;

import javax.annotation.Nonnull;

/**
 * Element-wise activation functions and softmax.
 */
@API(API.Status.EXPERIMENTAL)
public final class Activations {
    private Activations() {
        // nothing
    }

    @Nonnull
    public static Tensor relu(@Nonnull final Tensor input) {
        // NaN must survive, Math.max(NaN, 0) is NaN
        return input.map(x -> Math.max(x, 0.0d));
    }

    @Nonnull
    public static Tensor sigmoid(@Nonnull final Tensor input) {
        return input.map(Activations::sigmoid);
    }

    public static double sigmoid(final double x) {
        if (x >= 0) {
            return 1.0d / (1.0d + Math.exp(-x));
        }
        final double e = Math.exp(x);
        return e / (1.0d + e);
    }

    /**
     * Softsign, {@code x / (1 + |x|)}, which maps the reals onto {@code (-1, 1)}.
     * @param input the input
     * @return a new tensor
     */
    @Nonnull
    public static Tensor softsign(@Nonnull final Tensor input) {
        return input.map(x -> x / (1.0d + Math.abs(x)));
    }

    /**
     * Numerically stable softmax along one axis: {@code exp(x - max(x)) / sum(exp(x - max(x)))}.
     *
     * @param input the input
     * @param axis the axis to normalize over; negative values count from the end
     * @return a new tensor whose slices along {@code axis} sum to one
     */
    @Nonnull
    public static Tensor softmax(@Nonnull final Tensor input, final int axis) {
        final int[] shape = input.getShape();
        final int a = axis < 0 ? axis + shape.length : axis;
        int outer = 1;
        for (int i = 0; i < a; i++) {
            outer *= shape[i];
        }
        int inner = 1;
        for (int i = a + 1; i < shape.length; i++) {
            inner *= shape[i];
        }
        final int size = shape[a];
        final double[] in = input.getData();
        final double[] out = new double[in.length];
        for (int o = 0; o < outer; o++) {
            for (int i = 0; i < inner; i++) {
                final int base = o * size * inner + i;
                double max = Double.NEGATIVE_INFINITY;
                for (int s = 0; s < size; s++) {
                    max = Math.max(max, in[base + s * inner]);
                }
                double sum = 0.0d;
                for (int s = 0; s < size; s++) {
                    final double e = Math.exp(in[base + s * inner] - max);
                    out[base + s * inner] = e;
                    sum += e;
                }
                final double invSum = 1.0d / sum;
                for (int s = 0; s < size; s++) {
                    out[base + s * inner] *= invSum;
                }
            }
        }
        return Tensor.wrap(out, shape);
    }
}
