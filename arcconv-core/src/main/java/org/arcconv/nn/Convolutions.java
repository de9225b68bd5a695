/*
 * Convolutions.java
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

/**
 * Two-dimensional convolution over {@code (B, C, H, W)} feature maps.
 * <p>
 * Channels are split into {@code groups} consecutive groups; output channel group {@code g} only sees input
 * channel group {@code g}. With {@code groups == C} this is a depthwise convolution. Grouping is also what lets a
 * single call apply different weights to different samples: fold the samples into the channel axis of a batch of
 * one, and give each sample its own group.
 */
@API(API.Status.EXPERIMENTAL)
public final class Convolutions {
    private Convolutions() {
        // nothing
    }

    /**
     * Returns the size of an output axis, {@code floor((size + 2 padding - dilation (kernelSize - 1) - 1) / stride) + 1}.
     *
     * @param size input size along the axis
     * @param kernelSize kernel size along the axis
     * @param stride the stride
     * @param padding zero padding added to both sides
     * @param dilation spacing between kernel taps
     * @return the output size
     */
    public static int outputSize(final int size, final int kernelSize, final int stride, final int padding,
                                 final int dilation) {
        return Math.floorDiv(size + 2 * padding - dilation * (kernelSize - 1) - 1, stride) + 1;
    }

    /**
     * Convolves {@code input} with {@code weight}.
     *
     * @param input feature map of shape {@code (B, Cin, H, W)}
     * @param weight weights of shape {@code (Cout, Cin / groups, kH, kW)}
     * @param bias optional bias of shape {@code (Cout)}
     * @param stride stride along both spatial axes
     * @param padding zero padding along both spatial axes
     * @param dilation dilation along both spatial axes
     * @param groups number of channel groups
     * @return the output of shape {@code (B, Cout, H', W')}
     * @throws ShapeMismatchException if channel counts, groups and weight shape are inconsistent
     */
    @Nonnull
    public static Tensor conv2d(@Nonnull final Tensor input,
                                @Nonnull final Tensor weight,
                                @Nullable final Tensor bias,
                                final int stride,
                                final int padding,
                                final int dilation,
                                final int groups) {
        Preconditions.checkArgument(stride >= 1, "stride must be positive");
        Preconditions.checkArgument(padding >= 0, "padding must not be negative");
        Preconditions.checkArgument(dilation >= 1, "dilation must be positive");
        Preconditions.checkArgument(groups >= 1, "groups must be positive");
        if (input.rank() != 4) {
            throw new ShapeMismatchException("convolution input must be (B, C, H, W)",
                    LogMessageKeys.ACTUAL_SHAPE, Tensor.shapeToString(input.getShape()));
        }
        if (weight.rank() != 4) {
            throw new ShapeMismatchException("convolution weight must be (Cout, Cin / groups, kH, kW)",
                    LogMessageKeys.ACTUAL_SHAPE, Tensor.shapeToString(weight.getShape()));
        }

        final int batchSize = input.dim(0);
        final int inChannels = input.dim(1);
        final int height = input.dim(2);
        final int width = input.dim(3);
        final int outChannels = weight.dim(0);
        final int inChannelsPerGroup = weight.dim(1);
        final int kernelHeight = weight.dim(2);
        final int kernelWidth = weight.dim(3);

        if (inChannelsPerGroup * groups != inChannels) {
            throw new ShapeMismatchException("input channels do not match weight and groups",
                    LogMessageKeys.EXPECTED_CHANNELS, inChannelsPerGroup * groups,
                    LogMessageKeys.ACTUAL_CHANNELS, inChannels,
                    LogMessageKeys.GROUPS, groups);
        }
        if (outChannels % groups != 0) {
            throw new ShapeMismatchException("output channels must be divisible by groups",
                    LogMessageKeys.OUT_CHANNELS, outChannels,
                    LogMessageKeys.GROUPS, groups);
        }
        if (bias != null && !bias.hasShape(outChannels)) {
            throw ShapeMismatchException.ofShapes("bias must have one entry per output channel",
                    new int[] {outChannels}, bias.getShape());
        }

        final int outHeight = outputSize(height, kernelHeight, stride, padding, dilation);
        final int outWidth = outputSize(width, kernelWidth, stride, padding, dilation);
        if (outHeight < 1 || outWidth < 1) {
            throw new ShapeMismatchException("input is smaller than the dilated kernel",
                    LogMessageKeys.ACTUAL_SHAPE, Tensor.shapeToString(input.getShape()));
        }

        final int outChannelsPerGroup = outChannels / groups;
        final double[] in = input.getData();
        final double[] w = weight.getData();
        final double[] out = new double[batchSize * outChannels * outHeight * outWidth];
        final int inPlane = height * width;
        final int outPlane = outHeight * outWidth;
        final int kernelArea = kernelHeight * kernelWidth;

        for (int b = 0; b < batchSize; b++) {
            for (int oc = 0; oc < outChannels; oc++) {
                final int group = oc / outChannelsPerGroup;
                final int outBase = (b * outChannels + oc) * outPlane;
                if (bias != null) {
                    final double biasValue = bias.getData()[oc];
                    for (int i = 0; i < outPlane; i++) {
                        out[outBase + i] = biasValue;
                    }
                }
                for (int icg = 0; icg < inChannelsPerGroup; icg++) {
                    final int inBase = (b * inChannels + group * inChannelsPerGroup + icg) * inPlane;
                    final int weightBase = (oc * inChannelsPerGroup + icg) * kernelArea;
                    for (int kh = 0; kh < kernelHeight; kh++) {
                        for (int kw = 0; kw < kernelWidth; kw++) {
                            final double tap = w[weightBase + kh * kernelWidth + kw];
                            for (int oh = 0; oh < outHeight; oh++) {
                                final int ih = oh * stride - padding + kh * dilation;
                                if (ih < 0 || ih >= height) {
                                    continue;
                                }
                                final int inRow = inBase + ih * width;
                                final int outRow = outBase + oh * outWidth;
                                for (int ow = 0; ow < outWidth; ow++) {
                                    final int iw = ow * stride - padding + kw * dilation;
                                    if (iw >= 0 && iw < width) {
                                        out[outRow + ow] += tap * in[inRow + iw];
                                    }
                                }
                            }
                        }
                    }
                }
            }
        }
        return Tensor.wrap(out, batchSize, outChannels, outHeight, outWidth);
    }
}
