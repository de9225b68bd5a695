/*
 * RoutingSignal.java
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
import org.arcconv.tensor.ShapeMismatchException;
import org.arcconv.tensor.Tensor;

import javax.annotation.Nonnull;

/**
 * The per-sample output of a {@link RoutingFunction}: one gating magnitude and one rotation angle (in radians) per
 * kernel variant. Both tensors have shape {@code (B, kernelNumber)}.
 */
@API(API.Status.EXPERIMENTAL)
public final class RoutingSignal {
    @Nonnull
    private final Tensor gating;
    @Nonnull
    private final Tensor angles;

    public RoutingSignal(@Nonnull final Tensor gating, @Nonnull final Tensor angles) {
        if (gating.rank() != 2 || !angles.hasShape(gating.getShape())) {
            throw ShapeMismatchException.ofShapes("gating and angles must both be (B, kernelNumber)",
                    gating.getShape(), angles.getShape());
        }
        this.gating = gating;
        this.angles = angles;
    }

    @Nonnull
    public Tensor getGating() {
        return gating;
    }

    @Nonnull
    public Tensor getAngles() {
        return angles;
    }

    public int getBatchSize() {
        return gating.dim(0);
    }

    public int getKernelNumber() {
        return gating.dim(1);
    }

    @Override
    public String toString() {
        return "RoutingSignal[" + Tensor.shapeToString(gating.getShape()) + "]";
    }
}
