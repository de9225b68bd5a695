/*
 * Initializers.java
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
import org.arcconv.tensor.Tensor;

import javax.annotation.Nonnull;
import java.util.Random;

/**
 * Random initialization schemes for layer parameters.
 */
@API(API.Status.EXPERIMENTAL)
public final class Initializers {
    private Initializers() {
        // nothing
    }

    /**
     * He initialization from a normal distribution with {@code std = sqrt(2 / fanOut)}, the gain used for layers
     * followed by a ReLU. For a tensor of shape {@code (d0, d1, d2, ...)} the fan-out is {@code d0 * d2 * ...}.
     *
     * @param random source of randomness
     * @param shape the shape of the parameter, at least rank 2
     * @return a new tensor
     */
    @Nonnull
    public static Tensor kaimingNormalFanOut(@Nonnull final Random random, @Nonnull final int... shape) {
        Preconditions.checkArgument(shape.length >= 2, "fan-out needs at least two dimensions");
        int receptiveField = 1;
        for (int i = 2; i < shape.length; i++) {
            receptiveField *= shape[i];
        }
        final int fanOut = shape[0] * receptiveField;
        final double std = Math.sqrt(2.0d / fanOut);
        return normal(random, std, shape);
    }

    @Nonnull
    public static Tensor normal(@Nonnull final Random random, final double std, @Nonnull final int... shape) {
        final Tensor result = Tensor.zeros(shape);
        final double[] data = result.getData();
        for (int i = 0; i < data.length; i++) {
            data[i] = random.nextGaussian() * std;
        }
        return result;
    }

    /**
     * Normal distribution with mean zero, redrawing every sample that falls outside of two standard deviations.
     *
     * @param random source of randomness
     * @param std the standard deviation before truncation
     * @param shape the shape of the parameter
     * @return a new tensor
     */
    @Nonnull
    public static Tensor truncatedNormal(@Nonnull final Random random, final double std, @Nonnull final int... shape) {
        final Tensor result = Tensor.zeros(shape);
        final double[] data = result.getData();
        for (int i = 0; i < data.length; i++) {
            double sample;
            do {
                sample = random.nextGaussian();
            } while (Math.abs(sample) > 2.0d);
            data[i] = sample * std;
        }
        return result;
    }

    /**
     * Uniform distribution on {@code [-bound, bound)}.
     *
     * @param random source of randomness
     * @param bound the bound
     * @param shape the shape of the parameter
     * @return a new tensor
     */
    @Nonnull
    public static Tensor uniform(@Nonnull final Random random, final double bound, @Nonnull final int... shape) {
        final Tensor result = Tensor.zeros(shape);
        final double[] data = result.getData();
        for (int i = 0; i < data.length; i++) {
            data[i] = (2.0d * random.nextDouble() - 1.0d) * bound;
        }
        return result;
    }
}
