/*
 * FixedRoutingFunction.java
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

import com.google.common.collect.ImmutableMap;
import org.arcconv.tensor.Tensor;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Map;

/**
 * A routing function that ignores its input and returns the same gating and angles for every sample.
 */
class FixedRoutingFunction implements RoutingFunction {
    @Nonnull
    private final double[] gating;
    @Nonnull
    private final double[] angles;

    FixedRoutingFunction(@Nonnull final double[] gating, @Nonnull final double[] angles) {
        this.gating = gating.clone();
        this.angles = angles.clone();
    }

    static FixedRoutingFunction identity(final int kernelNumber) {
        final double[] gating = new double[kernelNumber];
        Arrays.fill(gating, 1.0d);
        return new FixedRoutingFunction(gating, new double[kernelNumber]);
    }

    @Nonnull
    @Override
    public RoutingSignal route(@Nonnull final Tensor input) {
        final int batchSize = input.dim(0);
        final int kernelNumber = getKernelNumber();
        final Tensor g = Tensor.zeros(batchSize, kernelNumber);
        final Tensor a = Tensor.zeros(batchSize, kernelNumber);
        for (int b = 0; b < batchSize; b++) {
            System.arraycopy(gating, 0, g.getData(), b * kernelNumber, kernelNumber);
            System.arraycopy(angles, 0, a.getData(), b * kernelNumber, kernelNumber);
        }
        return new RoutingSignal(g, a);
    }

    @Override
    public int getKernelNumber() {
        return gating.length;
    }

    @Override
    public void setTraining(final boolean training) {
        // no state
    }

    @Nonnull
    @Override
    public Map<String, Tensor> namedParameters() {
        return ImmutableMap.of();
    }
}
