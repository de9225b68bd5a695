/*
 * LearnedRoutingFunction.java
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

import com.google.common.base.Preconditions;
import org.arcconv.annotation.API;
import org.arcconv.nn.AbstractLayer;
import org.arcconv.nn.Activations;
import org.arcconv.nn.Conv2d;
import org.arcconv.nn.Dropout;
import org.arcconv.nn.Initializers;
import org.arcconv.nn.LayerNorm2d;
import org.arcconv.nn.Linear;
import org.arcconv.nn.Pooling;
import org.arcconv.tensor.ShapeMismatchException;
import org.arcconv.tensor.Tensor;
import org.arcconv.util.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Random;

/**
 * The learned routing function of an adaptive rotated convolution.
 * <p>
 * The input is mixed spatially by a depthwise 3x3 convolution, normalized over its channels, rectified and pooled
 * to one descriptor per sample. Two independent heads read that descriptor:
 * <ul>
 *     <li>the gating head (dropout, linear projection with bias, sigmoid) yields magnitudes in {@code (0, 1)};</li>
 *     <li>the angle head (dropout, linear projection without bias, softsign) yields values in {@code (-1, 1)} that
 *     are scaled to {@code (-maxAngle, maxAngle)} radians.</li>
 * </ul>
 * As a {@link org.arcconv.nn.Layer}, {@link #forward(Tensor)} returns gating and angles concatenated along the second
 * axis, i.e. a tensor of shape {@code (B, 2 kernelNumber)}.
 */
@API(API.Status.EXPERIMENTAL)
public class LearnedRoutingFunction extends AbstractLayer implements RoutingFunction {
    @Nonnull
    private static final Logger logger = LoggerFactory.getLogger(LearnedRoutingFunction.class);

    static final double INIT_STD = 0.02d;

    private final int inChannels;
    private final int kernelNumber;
    private final double maxAngle;

    @Nonnull
    private final Conv2d dwc;
    @Nonnull
    private final LayerNorm2d norm;
    @Nonnull
    private final Dropout dropoutAlpha;
    @Nonnull
    private final Linear fcAlpha;
    @Nonnull
    private final Dropout dropoutTheta;
    @Nonnull
    private final Linear fcTheta;

    public LearnedRoutingFunction(final int inChannels, @Nonnull final ArcConfig config,
                                  @Nonnull final Random random) {
        this(inChannels, config.getKernelNumber(), config.getDropoutRate(), config.getMaxAngleDegrees(), random);
    }

    public LearnedRoutingFunction(final int inChannels, final int kernelNumber, final double dropoutRate,
                                  final double maxAngleDegrees, @Nonnull final Random random) {
        Preconditions.checkArgument(inChannels >= 1, "inChannels must be positive");
        Preconditions.checkArgument(kernelNumber >= 1, "kernelNumber must be positive");
        Preconditions.checkArgument(maxAngleDegrees > 0.0d && maxAngleDegrees <= ArcConfig.MAX_ANGLE_LIMIT_DEGREES,
                "maxAngleDegrees must be (0, 45]");
        this.inChannels = inChannels;
        this.kernelNumber = kernelNumber;
        this.maxAngle = Math.toRadians(maxAngleDegrees);

        this.dwc = registerLayer("dwc", new Conv2d(inChannels, inChannels, 3, 1, 1, 1, inChannels, false, random));
        this.norm = registerLayer("norm", new LayerNorm2d(inChannels));
        this.dropoutAlpha = registerLayer("dropoutAlpha", new Dropout(dropoutRate, new Random(random.nextLong())));
        this.fcAlpha = registerLayer("fcAlpha", new Linear(inChannels, kernelNumber, true, random));
        this.dropoutTheta = registerLayer("dropoutTheta", new Dropout(dropoutRate, new Random(random.nextLong())));
        this.fcTheta = registerLayer("fcTheta", new Linear(inChannels, kernelNumber, false, random));

        fill(dwc.getWeight(), Initializers.truncatedNormal(random, INIT_STD, dwc.getWeight().getShape()));
        fill(fcAlpha.getWeight(), Initializers.truncatedNormal(random, INIT_STD, fcAlpha.getWeight().getShape()));
        fill(fcTheta.getWeight(), Initializers.truncatedNormal(random, INIT_STD, fcTheta.getWeight().getShape()));

        if (logger.isDebugEnabled()) {
            logger.debug("created routing function; inChannels={}, kernelNumber={}, dropoutRate={}, maxAngle={}",
                    inChannels, kernelNumber, dropoutRate, maxAngle);
        }
    }

    @Nonnull
    @Override
    public RoutingSignal route(@Nonnull final Tensor input) {
        if (input.rank() != 4 || input.dim(1) != inChannels) {
            throw new ShapeMismatchException("routing input must be (B, Cin, H, W)",
                    LogMessageKeys.EXPECTED_CHANNELS, inChannels,
                    LogMessageKeys.ACTUAL_SHAPE, Tensor.shapeToString(input.getShape()));
        }
        final int batchSize = input.dim(0);
        Tensor features = dwc.forward(input);
        features = norm.forward(features);
        features = Activations.relu(features);
        final Tensor pooled = Pooling.globalAveragePool(features).reshape(batchSize, inChannels);

        final Tensor gating = Activations.sigmoid(fcAlpha.forward(dropoutAlpha.forward(pooled)));
        final Tensor angles = Activations.softsign(fcTheta.forward(dropoutTheta.forward(pooled)))
                .map(v -> v * maxAngle);
        return new RoutingSignal(gating, angles);
    }

    @Nonnull
    @Override
    public Tensor forward(@Nonnull final Tensor input) {
        final RoutingSignal signal = route(input);
        final int batchSize = signal.getBatchSize();
        final double[] result = new double[batchSize * 2 * kernelNumber];
        for (int b = 0; b < batchSize; b++) {
            System.arraycopy(signal.getGating().getData(), b * kernelNumber, result,
                    2 * b * kernelNumber, kernelNumber);
            System.arraycopy(signal.getAngles().getData(), b * kernelNumber, result,
                    (2 * b + 1) * kernelNumber, kernelNumber);
        }
        return Tensor.wrap(result, batchSize, 2 * kernelNumber);
    }

    @Override
    public int getKernelNumber() {
        return kernelNumber;
    }

    public int getInChannels() {
        return inChannels;
    }

    /**
     * The bound on the magnitude of the predicted angles, in radians.
     * @return the maximum angle
     */
    public double getMaxAngle() {
        return maxAngle;
    }

    private static void fill(@Nonnull final Tensor target, @Nonnull final Tensor source) {
        System.arraycopy(source.getData(), 0, target.getData(), 0, target.numElements());
    }

    @Override
    public String toString() {
        return "LearnedRoutingFunction(" + inChannels + ", kernel_number=" + kernelNumber + ")";
    }
}
