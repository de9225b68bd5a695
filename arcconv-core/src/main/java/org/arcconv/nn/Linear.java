/*
 * Linear.java
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
import javax.annotation.Nullable;
import java.util.Random;

/**
 * A fully connected layer mapping {@code (B, in)} to {@code (B, out)} as {@code y = x W^T + b}.
 */
@API(API.Status.EXPERIMENTAL)
public class Linear extends AbstractLayer {
    private final int inFeatures;
    private final int outFeatures;
    @Nonnull
    private final Tensor weight;
    @Nullable
    private final Tensor bias;

    /**
     * Creates a new layer. The weight is drawn uniformly from {@code ±1/sqrt(inFeatures)}, as is the bias if there
     * is one.
     *
     * @param inFeatures input features
     * @param outFeatures output features
     * @param withBias whether to add a learnable bias
     * @param random source of randomness for the initial parameters
     */
    public Linear(final int inFeatures, final int outFeatures, final boolean withBias, @Nonnull final Random random) {
        Preconditions.checkArgument(inFeatures >= 1, "inFeatures must be positive");
        Preconditions.checkArgument(outFeatures >= 1, "outFeatures must be positive");
        this.inFeatures = inFeatures;
        this.outFeatures = outFeatures;
        final double bound = 1.0d / Math.sqrt(inFeatures);
        this.weight = registerParameter("weight", Initializers.uniform(random, bound, outFeatures, inFeatures));
        this.bias = withBias ? registerParameter("bias", Initializers.uniform(random, bound, outFeatures)) : null;
    }

    @Nonnull
    @Override
    public Tensor forward(@Nonnull final Tensor input) {
        if (input.rank() != 2 || input.dim(1) != inFeatures) {
            throw ShapeMismatchException.ofShapes("linear input must be (B, in)",
                    new int[] {-1, inFeatures}, input.getShape())
                    .addLogInfo(LogMessageKeys.EXPECTED_CHANNELS, inFeatures);
        }
        final int batchSize = input.dim(0);
        final double[] x = input.getData();
        final double[] w = weight.getData();
        final double[] out = new double[batchSize * outFeatures];
        for (int b = 0; b < batchSize; b++) {
            for (int o = 0; o < outFeatures; o++) {
                double sum = bias == null ? 0.0d : bias.getData()[o];
                for (int i = 0; i < inFeatures; i++) {
                    sum += x[b * inFeatures + i] * w[o * inFeatures + i];
                }
                out[b * outFeatures + o] = sum;
            }
        }
        return Tensor.wrap(out, batchSize, outFeatures);
    }

    @Nonnull
    public Tensor getWeight() {
        return weight;
    }

    @Nullable
    public Tensor getBias() {
        return bias;
    }

    @Override
    public String toString() {
        return "Linear(" + inFeatures + ", " + outFeatures + (bias == null ? ", bias=False" : "") + ")";
    }
}
