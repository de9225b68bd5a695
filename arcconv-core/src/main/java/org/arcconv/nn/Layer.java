/*
 * Layer.java
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
import java.util.Map;

/**
 * A layer of a network: a function of an input tensor and the layer's parameters.
 * <p>
 * Layers are interchangeable wherever the shapes line up. In particular, a standard 3x3 {@link Conv2d} and an
 * {@link org.arcconv.arc.AdaptiveRotatedConv2d} can be swapped for each other inside a residual block.
 * <p>
 * A layer is either in training mode or in evaluation mode. Layers start out in evaluation mode. Only stochastic
 * layers such as {@link Dropout} and statistics-dependent ones such as {@link BatchNorm2d} behave differently.
 */
@API(API.Status.EXPERIMENTAL)
public interface Layer {
    /**
     * Runs this layer on the given input. The input is never modified.
     *
     * @param input the input tensor
     * @return a newly allocated output tensor
     * @throws ShapeMismatchException if the input shape is not compatible with this layer
     */
    @Nonnull
    Tensor forward(@Nonnull Tensor input);

    void setTraining(boolean training);

    boolean isTraining();

    default void train() {
        setTraining(true);
    }

    default void eval() {
        setTraining(false);
    }

    /**
     * Returns the parameters of this layer and of all of its sub-layers, keyed by dotted path (e.g.
     * {@code routing.fcAlpha.bias}), in registration order.
     * <p>
     * The returned tensors are the live parameters, so they can be read without copying. They must not be written
     * to: updates go through {@link #loadParameters(Map)} (or a layer's own setter, such as
     * {@link org.arcconv.arc.AdaptiveRotatedConv2d#setKernelBank(Tensor)}), which order the write against forward
     * passes running on other threads.
     *
     * @return an ordered, unmodifiable map of parameter names to tensors
     */
    @Nonnull
    Map<String, Tensor> namedParameters();

    /**
     * Copies the given values into this layer's parameters. Parameters not mentioned keep their values. All names
     * and shapes are checked before anything is copied, so a failed load leaves every parameter as it was.
     *
     * @param values parameter values keyed like {@link #namedParameters()}
     * @throws IllegalArgumentException if a name is not a parameter of this layer
     * @throws ShapeMismatchException if a value has a different shape than the parameter it replaces
     */
    default void loadParameters(@Nonnull Map<String, Tensor> values) {
        final Map<String, Tensor> parameters = checkParameters(values);
        for (Map.Entry<String, Tensor> entry : values.entrySet()) {
            final Tensor value = entry.getValue();
            System.arraycopy(value.getData(), 0, parameters.get(entry.getKey()).getData(), 0, value.numElements());
        }
    }

    /**
     * Checks that every entry of {@code values} names a parameter of this layer and has that parameter's shape.
     *
     * @param values parameter values keyed like {@link #namedParameters()}
     * @return the parameters of this layer, as returned by {@link #namedParameters()}
     * @throws IllegalArgumentException if a name is not a parameter of this layer
     * @throws ShapeMismatchException if a value has a different shape than the parameter it replaces
     */
    @Nonnull
    default Map<String, Tensor> checkParameters(@Nonnull Map<String, Tensor> values) {
        final Map<String, Tensor> parameters = namedParameters();
        for (Map.Entry<String, Tensor> entry : values.entrySet()) {
            final Tensor target = parameters.get(entry.getKey());
            if (target == null) {
                throw new IllegalArgumentException("unknown parameter " + entry.getKey());
            }
            final Tensor value = entry.getValue();
            if (!target.hasShape(value.getShape())) {
                throw ShapeMismatchException.ofShapes("parameter shape mismatch", target.getShape(), value.getShape())
                        .addLogInfo(LogMessageKeys.PARAMETER_NAME, entry.getKey());
            }
        }
        return parameters;
    }
}
