/*
 * AdaptiveRotatedConv2d.java
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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import org.arcconv.annotation.API;
import org.arcconv.nn.Convolutions;
import org.arcconv.nn.Initializers;
import org.arcconv.nn.Layer;
import org.arcconv.tensor.ShapeMismatchException;
import org.arcconv.tensor.Tensor;
import org.arcconv.util.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A 3x3 convolution whose kernels are rotated and gated per sample.
 * <p>
 * The layer owns a bank of {@code n} kernel variants. For every forward pass a {@link RoutingFunction} predicts, per
 * sample and variant, a gating magnitude and a rotation angle. The {@link WeightSynthesizer} turns these into
 * {@code B n} rotated kernel sets, which are applied in one grouped convolution by folding the batch into the channel
 * axis: the input is tiled {@code n} times along its channels, reshaped to a batch of one, and convolved with
 * {@code groups B n} groups. The {@code n} per-variant outputs are finally recombined by {@link ChannelAttention}.
 * <p>
 * Forward passes may run concurrently with each other. Parameter updates through {@link #setKernelBank(Tensor)} or
 * {@link #loadParameters(Map)} wait for running forward passes and are visible to all later ones.
 */
@API(API.Status.EXPERIMENTAL)
public class AdaptiveRotatedConv2d implements Layer {
    @Nonnull
    private static final Logger logger = LoggerFactory.getLogger(AdaptiveRotatedConv2d.class);

    private final int inChannels;
    private final int outChannels;
    @Nonnull
    private final ArcConfig config;
    @Nonnull
    private final Tensor kernelBank;
    @Nonnull
    private final RoutingFunction routingFunction;
    @Nonnull
    private final ChannelAttention attention;
    @Nonnull
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile boolean training;

    public AdaptiveRotatedConv2d(final int inChannels, final int outChannels, @Nonnull final ArcConfig config,
                                 @Nonnull final RoutingFunction routingFunction, @Nonnull final Random random) {
        Preconditions.checkArgument(inChannels >= 1, "inChannels must be positive");
        Preconditions.checkArgument(outChannels >= 1, "outChannels must be positive");
        final int groups = config.getGroups();
        if (inChannels % groups != 0 || outChannels % groups != 0) {
            throw new ShapeMismatchException("channels must be divisible by groups",
                    LogMessageKeys.IN_CHANNELS, inChannels,
                    LogMessageKeys.OUT_CHANNELS, outChannels,
                    LogMessageKeys.GROUPS, groups);
        }
        if (routingFunction.getKernelNumber() != config.getKernelNumber()) {
            throw new ShapeMismatchException("routing function has a different kernel number",
                    LogMessageKeys.KERNEL_NUMBER, config.getKernelNumber(),
                    "routing_kernel_number", routingFunction.getKernelNumber());
        }
        this.inChannels = inChannels;
        this.outChannels = outChannels;
        this.config = config;
        this.routingFunction = routingFunction;
        this.kernelBank = Initializers.kaimingNormalFanOut(random, config.getKernelNumber(), outChannels,
                inChannels / groups, config.getKernelSize(), config.getKernelSize());
        this.attention = new ChannelAttention(outChannels, config.getKernelNumber(), random);
        routingFunction.setTraining(false);
        attention.setTraining(false);

        if (logger.isDebugEnabled()) {
            logger.debug("created adaptive rotated convolution; inChannels={}, outChannels={}, config={}",
                    inChannels, outChannels, config);
        }
    }

    /**
     * Creates a layer with a {@link LearnedRoutingFunction} configured from the same {@link ArcConfig}.
     *
     * @param inChannels input channels
     * @param outChannels output channels
     * @param config the configuration
     * @param random source of randomness for all initial parameters
     * @return a new layer
     */
    @Nonnull
    public static AdaptiveRotatedConv2d create(final int inChannels, final int outChannels,
                                               @Nonnull final ArcConfig config, @Nonnull final Random random) {
        return new AdaptiveRotatedConv2d(inChannels, outChannels, config,
                new LearnedRoutingFunction(inChannels, config, random), random);
    }

    @Nonnull
    @Override
    public Tensor forward(@Nonnull final Tensor input) {
        final Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return forwardUnderLock(input);
        } finally {
            readLock.unlock();
        }
    }

    @Nonnull
    private Tensor forwardUnderLock(@Nonnull final Tensor input) {
        if (input.rank() != 4 || input.dim(1) != inChannels) {
            throw new ShapeMismatchException("input must be (B, Cin, H, W)",
                    LogMessageKeys.EXPECTED_CHANNELS, inChannels,
                    LogMessageKeys.ACTUAL_SHAPE, Tensor.shapeToString(input.getShape()));
        }
        final int batchSize = input.dim(0);
        final int height = input.dim(2);
        final int width = input.dim(3);
        final int kernelNumber = config.getKernelNumber();

        final RoutingSignal signal = routingFunction.route(input);
        if (signal.getBatchSize() != batchSize || signal.getKernelNumber() != kernelNumber) {
            throw ShapeMismatchException.ofShapes("routing signal does not match batch and kernel number",
                    new int[] {batchSize, kernelNumber}, signal.getGating().getShape());
        }
        final Tensor weights = WeightSynthesizer.synthesize(kernelBank, signal);

        final Tensor folded = input.repeat(1, kernelNumber)
                .reshape(1, batchSize * kernelNumber * inChannels, height, width);
        final Tensor convolved = Convolutions.conv2d(folded, weights, null, config.getStride(),
                config.getPadding(), config.getDilation(), config.getGroups() * batchSize * kernelNumber);
        final int outHeight = convolved.dim(2);
        final int outWidth = convolved.dim(3);
        final Tensor perVariant = convolved.reshape(batchSize, kernelNumber, outChannels, outHeight, outWidth);

        final Tensor variantWeights = attention.forward(perVariant.sum(1));

        final int plane = outHeight * outWidth;
        final double[] y = perVariant.getData();
        final double[] w = variantWeights.getData();
        final double[] out = new double[batchSize * outChannels * plane];
        for (int b = 0; b < batchSize; b++) {
            for (int i = 0; i < kernelNumber; i++) {
                for (int o = 0; o < outChannels; o++) {
                    final double weight = w[(b * kernelNumber + i) * outChannels + o];
                    final int source = ((b * kernelNumber + i) * outChannels + o) * plane;
                    final int target = (b * outChannels + o) * plane;
                    for (int p = 0; p < plane; p++) {
                        out[target + p] += weight * y[source + p];
                    }
                }
            }
        }

        if (logger.isTraceEnabled()) {
            logger.trace("forward; input={}, output={}", Tensor.shapeToString(input.getShape()),
                    Tensor.shapeToString(new int[] {batchSize, outChannels, outHeight, outWidth}));
        }
        return Tensor.wrap(out, batchSize, outChannels, outHeight, outWidth);
    }

    /**
     * Replaces the values of the kernel bank. Waits until running forward passes are done.
     *
     * @param values the new values, of shape {@code (n, Cout, Cin / groups, 3, 3)}
     * @throws ShapeMismatchException if the shape differs from the kernel bank's
     */
    public void setKernelBank(@Nonnull final Tensor values) {
        if (!kernelBank.hasShape(values.getShape())) {
            throw ShapeMismatchException.ofShapes("kernel bank shape is fixed", kernelBank.getShape(),
                    values.getShape());
        }
        final Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            System.arraycopy(values.getData(), 0, kernelBank.getData(), 0, kernelBank.numElements());
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Returns a copy of the kernel bank.
     * @return a tensor of shape {@code (n, Cout, Cin / groups, 3, 3)}
     */
    @Nonnull
    public Tensor getKernelBank() {
        final Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return kernelBank.copy();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public void loadParameters(@Nonnull final Map<String, Tensor> values) {
        final Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            Layer.super.loadParameters(values);
        } finally {
            writeLock.unlock();
        }
    }

    @Nonnull
    @Override
    public Map<String, Tensor> namedParameters() {
        final ImmutableMap.Builder<String, Tensor> builder = ImmutableMap.builder();
        builder.put("weight", kernelBank);
        routingFunction.namedParameters().forEach((name, parameter) -> builder.put("routing." + name, parameter));
        attention.namedParameters().forEach((name, parameter) -> builder.put("attention." + name, parameter));
        return builder.build();
    }

    @Override
    public void setTraining(final boolean training) {
        this.training = training;
        routingFunction.setTraining(training);
        attention.setTraining(training);
    }

    @Override
    public boolean isTraining() {
        return training;
    }

    public int getInChannels() {
        return inChannels;
    }

    public int getOutChannels() {
        return outChannels;
    }

    @Nonnull
    public ArcConfig getConfig() {
        return config;
    }

    @Nonnull
    public RoutingFunction getRoutingFunction() {
        return routingFunction;
    }

    @VisibleForTesting
    @Nonnull
    ChannelAttention getAttention() {
        return attention;
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder("AdaptiveRotatedConv2d(")
                .append(inChannels).append(", ").append(outChannels)
                .append(", kernel_number=").append(config.getKernelNumber())
                .append(", kernel_size=").append(config.getKernelSize())
                .append(", stride=").append(config.getStride());
        if (config.getPadding() != 0) {
            builder.append(", padding=").append(config.getPadding());
        }
        if (config.getDilation() != 1) {
            builder.append(", dilation=").append(config.getDilation());
        }
        if (config.getGroups() != 1) {
            builder.append(", groups=").append(config.getGroups());
        }
        return builder.append(")").toString();
    }
}
