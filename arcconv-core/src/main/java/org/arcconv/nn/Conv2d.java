/*
 * Conv2d.java
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
 * A standard two-dimensional convolution with a fixed, learnable square kernel.
 */
@API(API.Status.EXPERIMENTAL)
public class Conv2d extends AbstractLayer {
    private final int inChannels;
    private final int outChannels;
    private final int kernelSize;
    private final int stride;
    private final int padding;
    private final int dilation;
    private final int groups;
    @Nonnull
    private final Tensor weight;
    @Nullable
    private final Tensor bias;

    public Conv2d(final int inChannels, final int outChannels, final int kernelSize, final int stride,
                  final int padding, final int dilation, final int groups, final boolean withBias,
                  @Nonnull final Random random) {
        Preconditions.checkArgument(inChannels >= 1, "inChannels must be positive");
        Preconditions.checkArgument(outChannels >= 1, "outChannels must be positive");
        Preconditions.checkArgument(kernelSize >= 1, "kernelSize must be positive");
        Preconditions.checkArgument(stride >= 1, "stride must be positive");
        Preconditions.checkArgument(padding >= 0, "padding must not be negative");
        Preconditions.checkArgument(dilation >= 1, "dilation must be positive");
        Preconditions.checkArgument(groups >= 1, "groups must be positive");
        if (inChannels % groups != 0 || outChannels % groups != 0) {
            throw new ShapeMismatchException("channels must be divisible by groups",
                    LogMessageKeys.IN_CHANNELS, inChannels,
                    LogMessageKeys.OUT_CHANNELS, outChannels,
                    LogMessageKeys.GROUPS, groups);
        }
        this.inChannels = inChannels;
        this.outChannels = outChannels;
        this.kernelSize = kernelSize;
        this.stride = stride;
        this.padding = padding;
        this.dilation = dilation;
        this.groups = groups;
        this.weight = registerParameter("weight",
                Initializers.kaimingNormalFanOut(random, outChannels, inChannels / groups, kernelSize, kernelSize));
        if (withBias) {
            final int fanIn = inChannels / groups * kernelSize * kernelSize;
            this.bias = registerParameter("bias", Initializers.uniform(random, 1.0d / Math.sqrt(fanIn), outChannels));
        } else {
            this.bias = null;
        }
    }

    /**
     * A 3x3 convolution with padding 1 and no bias, the spatial convolution of a bottleneck block.
     *
     * @param inChannels input channels
     * @param outChannels output channels
     * @param stride the stride
     * @param random source of randomness for the initial weights
     * @return a new layer
     */
    @Nonnull
    public static Conv2d conv3x3(final int inChannels, final int outChannels, final int stride,
                                 @Nonnull final Random random) {
        return new Conv2d(inChannels, outChannels, 3, stride, 1, 1, 1, false, random);
    }

    @Nonnull
    public static Conv2d conv1x1(final int inChannels, final int outChannels, final int stride,
                                 @Nonnull final Random random) {
        return new Conv2d(inChannels, outChannels, 1, stride, 0, 1, 1, false, random);
    }

    @Nonnull
    @Override
    public Tensor forward(@Nonnull final Tensor input) {
        return Convolutions.conv2d(input, weight, bias, stride, padding, dilation, groups);
    }

    public int getInChannels() {
        return inChannels;
    }

    public int getOutChannels() {
        return outChannels;
    }

    public int getKernelSize() {
        return kernelSize;
    }

    public int getStride() {
        return stride;
    }

    @Nonnull
    public Tensor getWeight() {
        return weight;
    }

    @Override
    public String toString() {
        return "Conv2d(" + inChannels + ", " + outChannels + ", kernel_size=" + kernelSize + ", stride=" + stride +
                (padding != 0 ? ", padding=" + padding : "") +
                (dilation != 1 ? ", dilation=" + dilation : "") +
                (groups != 1 ? ", groups=" + groups : "") +
                (bias == null ? ", bias=False" : "") + ")";
    }
}
