/*
 * ChannelAttention.java
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

import com.google.common.annotations.VisibleForTesting;
import org.arcconv.annotation.API;
import org.arcconv.nn.AbstractLayer;
import org.arcconv.nn.Activations;
import org.arcconv.nn.BatchNorm2d;
import org.arcconv.nn.Conv2d;
import org.arcconv.nn.Pooling;
import org.arcconv.tensor.ShapeMismatchException;
import org.arcconv.tensor.Tensor;
import org.arcconv.util.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Random;

/**
 * Attention over the kernel variants of an {@link AdaptiveRotatedConv2d}.
 * <p>
 * The input is the sum of the per-variant outputs, {@code (B, Cout, H, W)}. It is pooled, squeezed to {@code d}
 * channels by a 1x1 convolution followed by batch norm and ReLU, and expanded to {@code n Cout} channels by another
 * 1x1 convolution. A softmax over the variant axis yields weights of shape {@code (B, n, Cout)} that sum to one for
 * every sample and output channel.
 */
@API(API.Status.INTERNAL)
public class ChannelAttention extends AbstractLayer {
    @VisibleForTesting
    static final int MIN_HIDDEN_CHANNELS = 32;
    @VisibleForTesting
    static final int REDUCTION = 16;

    private final int channels;
    private final int kernelNumber;
    private final int hiddenChannels;
    @Nonnull
    private final Conv2d fc1;
    @Nonnull
    private final BatchNorm2d bn;
    @Nonnull
    private final Conv2d fc2;

    public ChannelAttention(final int channels, final int kernelNumber, @Nonnull final Random random) {
        this.channels = channels;
        this.kernelNumber = kernelNumber;
        this.hiddenChannels = hiddenChannels(channels);
        this.fc1 = registerLayer("fc1", Conv2d.conv1x1(channels, hiddenChannels, 1, random));
        this.bn = registerLayer("bn", new BatchNorm2d(hiddenChannels));
        this.fc2 = registerLayer("fc2", Conv2d.conv1x1(hiddenChannels, channels * kernelNumber, 1, random));
    }

    static int hiddenChannels(final int channels) {
        return Math.max(channels / REDUCTION, MIN_HIDDEN_CHANNELS);
    }

    /**
     * Computes the variant weights.
     *
     * @param input the summed variant outputs, {@code (B, Cout, H, W)}
     * @return weights of shape {@code (B, n, Cout)}
     */
    @Nonnull
    @Override
    public Tensor forward(@Nonnull final Tensor input) {
        if (input.rank() != 4 || input.dim(1) != channels) {
            throw new ShapeMismatchException("attention input must be (B, Cout, H, W)",
                    LogMessageKeys.EXPECTED_CHANNELS, channels,
                    LogMessageKeys.ACTUAL_SHAPE, Tensor.shapeToString(input.getShape()));
        }
        Tensor x = Pooling.globalAveragePool(input);
        x = Activations.relu(bn.forward(fc1.forward(x)));
        x = fc2.forward(x);
        return Activations.softmax(x.reshape(input.dim(0), kernelNumber, channels), 1);
    }

    public int getHiddenChannels() {
        return hiddenChannels;
    }

    @Override
    public String toString() {
        return "ChannelAttention(" + channels + ", kernel_number=" + kernelNumber + ", hidden=" + hiddenChannels + ")";
    }
}
