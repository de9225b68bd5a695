/*
 * Dropout.java
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
 * Inverted dropout. In training mode every element is zeroed with probability {@code rate} and the survivors are
 * scaled by {@code 1 / (1 - rate)}; in evaluation mode the input passes through unchanged.
 * <p>
 * The random source is shared across calls, so a seeded instance yields a reproducible sequence of masks as long
 * as it is driven from a single thread.
 */
@API(API.Status.EXPERIMENTAL)
public class Dropout extends AbstractLayer {
    private final double rate;
    @Nonnull
    private final Random random;

    public Dropout(final double rate, @Nonnull final Random random) {
        Preconditions.checkArgument(rate >= 0.0d && rate < 1.0d, "rate must be in [0, 1)");
        this.rate = rate;
        this.random = random;
    }

    @Nonnull
    @Override
    public Tensor forward(@Nonnull final Tensor input) {
        if (!isTraining() || rate == 0.0d) {
            return input.copy();
        }
        final double scale = 1.0d / (1.0d - rate);
        final double[] in = input.getData();
        final double[] out = new double[in.length];
        synchronized (random) {
            for (int i = 0; i < in.length; i++) {
                out[i] = random.nextDouble() < rate ? 0.0d : in[i] * scale;
            }
        }
        return Tensor.wrap(out, input.getShape());
    }

    public double getRate() {
        return rate;
    }

    @Override
    public String toString() {
        return "Dropout(p=" + rate + ")";
    }
}
