/*
 * Bottleneck.java
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

package org.arcconv.backbone;

import com.google.common.base.Preconditions;
import org.arcconv.annotation.API;
import org.arcconv.arc.AdaptiveRotatedConv2d;
import org.arcconv.arc.ArcConfig;
import org.arcconv.nn.AbstractLayer;
import org.arcconv.nn.Activations;
import org.arcconv.nn.BatchNorm2d;
import org.arcconv.nn.Conv2d;
import org.arcconv.nn.Layer;
import org.arcconv.tensor.Tensor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Random;

/**
 * Residual bottleneck block: a 1x1 reduction, a 3x3 convolution carrying the stride, and a 1x1 expansion by
 * {@link #EXPANSION}, each followed by batch normalization, with a shortcut added before the final ReLU.
 * <p>
 * The 3x3 convolution is either a plain {@link Conv2d} or an {@link AdaptiveRotatedConv2d}, depending on the
 * {@link ConvKind} the block was built with. Both use padding equal to the dilation so the spatial size only
 * depends on the stride.
 */
@API(API.Status.EXPERIMENTAL)
public class Bottleneck extends AbstractLayer {
    public static final int EXPANSION = 4;

    @Nonnull
    private static final Logger logger = LoggerFactory.getLogger(Bottleneck.class);

    private final int inPlanes;
    private final int planes;
    private final int stride;
    @Nonnull
    private final ConvKind convKind;
    @Nonnull
    private final Conv2d conv1;
    @Nonnull
    private final BatchNorm2d bn1;
    @Nonnull
    private final Layer conv2;
    @Nonnull
    private final BatchNorm2d bn2;
    @Nonnull
    private final Conv2d conv3;
    @Nonnull
    private final BatchNorm2d bn3;
    @Nullable
    private final Layer downsample;

    /**
     * Creates a new block.
     *
     * @param inPlanes channels of the block input
     * @param planes channels of the inner convolutions; the block outputs {@code planes * EXPANSION} channels
     * @param stride stride of the 3x3 convolution
     * @param dilation dilation (and padding) of the 3x3 convolution
     * @param downsample optional layer mapping the input onto the output shape for the shortcut
     * @param convKind which convolution to use for the 3x3 step
     * @param arcConfig routing settings ({@code kernelNumber}, dropout rate, maximum angle) for an adaptive 3x3
     *        convolution; its geometry is replaced by this block's stride and dilation
     * @param random source of randomness for initialization
     */
    public Bottleneck(final int inPlanes, final int planes, final int stride, final int dilation,
                      @Nullable final Layer downsample, @Nonnull final ConvKind convKind,
                      @Nonnull final ArcConfig arcConfig, @Nonnull final Random random) {
        Preconditions.checkArgument(inPlanes >= 1, "inPlanes must be positive");
        Preconditions.checkArgument(planes >= 1, "planes must be positive");
        Preconditions.checkArgument(stride >= 1, "stride must be positive");
        Preconditions.checkArgument(dilation >= 1, "dilation must be positive");
        this.inPlanes = inPlanes;
        this.planes = planes;
        this.stride = stride;
        this.convKind = convKind;

        this.conv1 = registerLayer("conv1", Conv2d.conv1x1(inPlanes, planes, 1, random));
        this.bn1 = registerLayer("bn1", new BatchNorm2d(planes));
        if (convKind == ConvKind.ADAPTIVE) {
            final ArcConfig config = arcConfig.toBuilder()
                    .setStride(stride)
                    .setPadding(dilation)
                    .setDilation(dilation)
                    .setGroups(1)
                    .build();
            this.conv2 = registerLayer("conv2", AdaptiveRotatedConv2d.create(planes, planes, config, random));
        } else {
            this.conv2 = registerLayer("conv2",
                    new Conv2d(planes, planes, 3, stride, dilation, dilation, 1, false, random));
        }
        this.bn2 = registerLayer("bn2", new BatchNorm2d(planes));
        this.conv3 = registerLayer("conv3", Conv2d.conv1x1(planes, planes * EXPANSION, 1, random));
        this.bn3 = registerLayer("bn3", new BatchNorm2d(planes * EXPANSION));
        this.downsample = downsample == null ? null : registerLayer("downsample", downsample);

        if (logger.isDebugEnabled()) {
            logger.debug("created bottleneck inPlanes={}, planes={}, stride={}, dilation={}, conv2={}, downsample={}",
                    inPlanes, planes, stride, dilation, conv2, downsample != null);
        }
    }

    /**
     * Runs the block.
     *
     * @param input feature map of shape {@code (B, inPlanes, H, W)}
     * @return feature map of shape {@code (B, planes * EXPANSION, H', W')}
     * @throws org.arcconv.tensor.ShapeMismatchException if the input does not fit the block, or if the shortcut
     *         and the residual branch disagree because a needed downsample is missing
     */
    @Nonnull
    @Override
    public Tensor forward(@Nonnull final Tensor input) {
        Tensor out = Activations.relu(bn1.forward(conv1.forward(input)));
        out = Activations.relu(bn2.forward(conv2.forward(out)));
        out = bn3.forward(conv3.forward(out));

        final Tensor identity = downsample == null ? input : downsample.forward(input);
        return Activations.relu(out.add(identity));
    }

    public int getInPlanes() {
        return inPlanes;
    }

    public int getPlanes() {
        return planes;
    }

    public int getOutPlanes() {
        return planes * EXPANSION;
    }

    public int getStride() {
        return stride;
    }

    @Nonnull
    public ConvKind getConvKind() {
        return convKind;
    }

    @Nonnull
    public Layer getConv2() {
        return conv2;
    }

    @Nullable
    public Layer getDownsample() {
        return downsample;
    }

    @Override
    public String toString() {
        return "Bottleneck(" + inPlanes + ", " + planes + ", stride=" + stride + ", conv2=" + conv2 + ")";
    }
}
