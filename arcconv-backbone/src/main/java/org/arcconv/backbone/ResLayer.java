/*
 * ResLayer.java
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
import com.google.common.collect.ImmutableList;
import org.arcconv.annotation.API;
import org.arcconv.arc.ArcConfig;
import org.arcconv.nn.AbstractLayer;
import org.arcconv.nn.BatchNorm2d;
import org.arcconv.nn.Conv2d;
import org.arcconv.tensor.Tensor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Random;

/**
 * A stage of a residual network: a sequence of {@link Bottleneck} blocks, named {@code 0}, {@code 1}, ... in
 * {@link #namedParameters()}.
 * <p>
 * The first block carries the stride. If it changes the shape of its input (stride other than 1, or a channel
 * count other than {@code planes * Bottleneck.EXPANSION}), its shortcut goes through a strided 1x1 convolution
 * followed by batch normalization. All later blocks keep the shape. The {@link BlockConvPlan} decides for each
 * block index whether the 3x3 convolution is adaptive.
 */
@API(API.Status.EXPERIMENTAL)
public class ResLayer extends AbstractLayer {
    @Nonnull
    private static final Logger logger = LoggerFactory.getLogger(ResLayer.class);

    @Nonnull
    private final BlockConvPlan plan;
    @Nonnull
    private final ImmutableList<Bottleneck> blocks;

    /**
     * Creates a new stage.
     *
     * @param inPlanes channels of the stage input
     * @param planes inner channels of each block; the stage outputs {@code planes * Bottleneck.EXPANSION}
     * @param numBlocks number of blocks
     * @param stride stride of the first block
     * @param dilation dilation of every 3x3 convolution
     * @param plan which blocks use an adaptive 3x3 convolution
     * @param arcConfig routing settings shared by all adaptive blocks
     * @param random source of randomness for initialization
     * @throws IllegalArgumentException if the plan names a block the stage does not have
     */
    public ResLayer(final int inPlanes, final int planes, final int numBlocks, final int stride, final int dilation,
                    @Nonnull final BlockConvPlan plan, @Nonnull final ArcConfig arcConfig,
                    @Nonnull final Random random) {
        Preconditions.checkArgument(numBlocks >= 1, "numBlocks must be positive");
        Preconditions.checkArgument(plan.getAdaptiveBlocks().isEmpty() || plan.getAdaptiveBlocks().last() < numBlocks,
                "plan names block %s, but the stage only has %s blocks",
                plan.getAdaptiveBlocks().isEmpty() ? -1 : plan.getAdaptiveBlocks().last(), numBlocks);
        this.plan = plan;

        final int outPlanes = planes * Bottleneck.EXPANSION;
        final Downsample downsample = stride != 1 || inPlanes != outPlanes
                                      ? new Downsample(inPlanes, outPlanes, stride, random)
                                      : null;

        final ImmutableList.Builder<Bottleneck> builder = ImmutableList.builder();
        builder.add(registerLayer("0",
                new Bottleneck(inPlanes, planes, stride, dilation, downsample, plan.kindOf(0), arcConfig, random)));
        for (int i = 1; i < numBlocks; i++) {
            builder.add(registerLayer(Integer.toString(i),
                    new Bottleneck(outPlanes, planes, 1, dilation, null, plan.kindOf(i), arcConfig, random)));
        }
        this.blocks = builder.build();

        if (logger.isDebugEnabled()) {
            logger.debug("created residual layer inPlanes={}, planes={}, numBlocks={}, stride={}, adaptive={}",
                    inPlanes, planes, numBlocks, stride, plan.getAdaptiveBlocks());
        }
    }

    @Nonnull
    @Override
    public Tensor forward(@Nonnull final Tensor input) {
        Tensor out = input;
        for (final Bottleneck block : blocks) {
            out = block.forward(out);
        }
        if (logger.isTraceEnabled()) {
            logger.trace("residual layer output shape={}", Tensor.shapeToString(out.getShape()));
        }
        return out;
    }

    @Nonnull
    public ImmutableList<Bottleneck> getBlocks() {
        return blocks;
    }

    @Nonnull
    public BlockConvPlan getPlan() {
        return plan;
    }

    public int getOutPlanes() {
        return blocks.get(0).getOutPlanes();
    }

    /**
     * Shortcut projection of the first block.
     */
    static class Downsample extends AbstractLayer {
        @Nonnull
        private final Conv2d conv;
        @Nonnull
        private final BatchNorm2d bn;

        Downsample(final int inPlanes, final int outPlanes, final int stride, @Nonnull final Random random) {
            this.conv = registerLayer("conv", Conv2d.conv1x1(inPlanes, outPlanes, stride, random));
            this.bn = registerLayer("bn", new BatchNorm2d(outPlanes));
        }

        @Nonnull
        @Override
        public Tensor forward(@Nonnull final Tensor input) {
            return bn.forward(conv.forward(input));
        }

        @Override
        public String toString() {
            return "Downsample(" + conv + ")";
        }
    }
}
