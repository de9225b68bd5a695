/*
 * RoutingFunction.java
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
import java.util.Map;

/**
 * Maps an input feature map to per-sample routing signals, that is, a gating magnitude in {@code (0, 1)} and a
 * rotation angle for each kernel variant of an {@link AdaptiveRotatedConv2d}.
 * <p>
 * Implementations must be pure functions of the input and their parameters in evaluation mode, and must be safe to
 * call from several threads at once.
 */
@API(API.Status.EXPERIMENTAL)
public interface RoutingFunction {
    /**
     * Computes the routing signals for a batch.
     *
     * @param input feature map of shape {@code (B, Cin, H, W)}
     * @return gating and angles, each of shape {@code (B, getKernelNumber())}
     * @throws ShapeMismatchException if the input does not have the expected number of channels
     */
    @Nonnull
    RoutingSignal route(@Nonnull Tensor input);

    int getKernelNumber();

    void setTraining(boolean training);

    /**
     * Returns the learnable parameters of this routing function keyed by name. Routing functions without parameters
     * return an empty map.
     *
     * @return an ordered map of parameter names to live tensors
     */
    @Nonnull
    Map<String, Tensor> namedParameters();
}
