/*
 * AbstractLayer.java
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
import com.google.common.collect.ImmutableMap;
import org.arcconv.annotation.API;
import org.arcconv.tensor.Tensor;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for layers that own parameters and sub-layers.
 */
@API(API.Status.EXPERIMENTAL)
public abstract class AbstractLayer implements Layer {
    @Nonnull
    private final Map<String, Tensor> parameters = new LinkedHashMap<>();
    @Nonnull
    private final Map<String, Layer> layers = new LinkedHashMap<>();
    private volatile boolean training;

    @Nonnull
    protected Tensor registerParameter(@Nonnull final String name, @Nonnull final Tensor parameter) {
        Preconditions.checkArgument(name.indexOf('.') < 0, "name must not contain a dot: %s", name);
        Preconditions.checkArgument(!parameters.containsKey(name) && !layers.containsKey(name),
                "duplicate name %s", name);
        parameters.put(name, parameter);
        return parameter;
    }

    @Nonnull
    protected <L extends Layer> L registerLayer(@Nonnull final String name, @Nonnull final L layer) {
        Preconditions.checkArgument(name.indexOf('.') < 0, "name must not contain a dot: %s", name);
        Preconditions.checkArgument(!parameters.containsKey(name) && !layers.containsKey(name),
                "duplicate name %s", name);
        layers.put(name, layer);
        layer.setTraining(training);
        return layer;
    }

    @Override
    public void setTraining(final boolean training) {
        this.training = training;
        for (final Layer layer : layers.values()) {
            layer.setTraining(training);
        }
    }

    @Override
    public boolean isTraining() {
        return training;
    }

    /**
     * Copies values into this layer's own parameters and hands the rest to the sub-layers they belong to, with the
     * sub-layer's name stripped from the key. Sub-layers that guard their parameters, like
     * {@link org.arcconv.arc.AdaptiveRotatedConv2d}, therefore apply their own locking at any depth. Everything is
     * checked before any sub-layer is loaded.
     *
     * @param values parameter values keyed like {@link #namedParameters()}
     */
    @Override
    public void loadParameters(@Nonnull final Map<String, Tensor> values) {
        checkParameters(values);
        final Map<String, Map<String, Tensor>> valuesByLayer = new LinkedHashMap<>();
        for (Map.Entry<String, Tensor> entry : values.entrySet()) {
            final Tensor parameter = parameters.get(entry.getKey());
            if (parameter != null) {
                final Tensor value = entry.getValue();
                System.arraycopy(value.getData(), 0, parameter.getData(), 0, value.numElements());
                continue;
            }
            final int dot = entry.getKey().indexOf('.');
            // checkParameters guarantees a registered layer name before the first dot
            valuesByLayer.computeIfAbsent(entry.getKey().substring(0, dot), name -> new LinkedHashMap<>())
                    .put(entry.getKey().substring(dot + 1), entry.getValue());
        }
        for (Map.Entry<String, Map<String, Tensor>> entry : valuesByLayer.entrySet()) {
            layers.get(entry.getKey()).loadParameters(entry.getValue());
        }
    }

    @Nonnull
    @Override
    public Map<String, Tensor> namedParameters() {
        final ImmutableMap.Builder<String, Tensor> builder = ImmutableMap.builder();
        builder.putAll(parameters);
        for (Map.Entry<String, Layer> entry : layers.entrySet()) {
            for (Map.Entry<String, Tensor> parameter : entry.getValue().namedParameters().entrySet()) {
                builder.put(entry.getKey() + "." + parameter.getKey(), parameter.getValue());
            }
        }
        return builder.build();
    }
}
