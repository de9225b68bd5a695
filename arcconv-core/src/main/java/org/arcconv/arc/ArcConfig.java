/*
 * ArcConfig.java
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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.arcconv.annotation.API;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Configuration settings for an {@link AdaptiveRotatedConv2d}. Channel counts are not part of the configuration;
 * they are given when a layer is created.
 */
@API(API.Status.EXPERIMENTAL)
public final class ArcConfig {
    public static final int DEFAULT_KERNEL_SIZE = 3;
    public static final int DEFAULT_STRIDE = 1;
    public static final int DEFAULT_PADDING = 1;
    public static final int DEFAULT_DILATION = 1;
    public static final int DEFAULT_GROUPS = 1;
    public static final int DEFAULT_KERNEL_NUMBER = 1;
    // routing
    public static final double DEFAULT_DROPOUT_RATE = 0.2d;
    public static final double DEFAULT_MAX_ANGLE_DEGREES = 40.0d;
    /**
     * Largest supported maximum angle. Beyond it the rotation operators get negative entries.
     */
    public static final double MAX_ANGLE_LIMIT_DEGREES = 45.0d;

    private final int kernelSize;
    private final int stride;
    private final int padding;
    private final int dilation;
    private final int groups;
    private final int kernelNumber;
    private final double dropoutRate;
    private final double maxAngleDegrees;

    private ArcConfig(final int kernelSize, final int stride, final int padding, final int dilation, final int groups,
                      final int kernelNumber, final double dropoutRate, final double maxAngleDegrees) {
        Preconditions.checkArgument(kernelSize == 3, "kernelSize must be 3, rotation is only defined for 3x3 kernels");
        Preconditions.checkArgument(stride >= 1, "stride must be [1, MAX_INT]");
        Preconditions.checkArgument(padding >= 0, "padding must be [0, MAX_INT]");
        Preconditions.checkArgument(dilation >= 1, "dilation must be [1, MAX_INT]");
        Preconditions.checkArgument(groups >= 1, "groups must be [1, MAX_INT]");
        Preconditions.checkArgument(kernelNumber >= 1, "kernelNumber must be [1, MAX_INT]");
        Preconditions.checkArgument(dropoutRate >= 0.0d && dropoutRate < 1.0d, "dropoutRate must be [0, 1)");
        Preconditions.checkArgument(maxAngleDegrees > 0.0d && maxAngleDegrees <= MAX_ANGLE_LIMIT_DEGREES,
                "maxAngleDegrees must be (0, 45]");

        this.kernelSize = kernelSize;
        this.stride = stride;
        this.padding = padding;
        this.dilation = dilation;
        this.groups = groups;
        this.kernelNumber = kernelNumber;
        this.dropoutRate = dropoutRate;
        this.maxAngleDegrees = maxAngleDegrees;
    }

    @Nonnull
    public static ArcConfig defaultConfig() {
        return newBuilder().build();
    }

    @Nonnull
    public static ArcConfigBuilder newBuilder() {
        return new ArcConfigBuilder();
    }

    /**
     * The spatial size of the kernels. Only {@code 3} is supported.
     */
    public int getKernelSize() {
        return kernelSize;
    }

    public int getStride() {
        return stride;
    }

    public int getPadding() {
        return padding;
    }

    public int getDilation() {
        return dilation;
    }

    /**
     * Number of channel groups. Both the input and the output channels of a layer must be divisible by it.
     */
    public int getGroups() {
        return groups;
    }

    /**
     * Number of kernel variants in the kernel bank. Every variant gets its own gating magnitude and rotation angle
     * per sample, and the outputs of all variants are recombined by channel attention.
     */
    public int getKernelNumber() {
        return kernelNumber;
    }

    /**
     * Dropout rate applied to the pooled routing features before both routing heads, in training mode only.
     */
    public double getDropoutRate() {
        return dropoutRate;
    }

    /**
     * Bound on the magnitude of the rotation angles, in degrees. Predicted angles lie strictly inside
     * {@code (-maxAngleDegrees, maxAngleDegrees)}. Up to {@code 45} degrees all rotation operator entries stay
     * non-negative.
     */
    public double getMaxAngleDegrees() {
        return maxAngleDegrees;
    }

    public double getMaxAngleRadians() {
        return Math.toRadians(maxAngleDegrees);
    }

    @Nonnull
    public ArcConfigBuilder toBuilder() {
        return new ArcConfigBuilder(getKernelSize(), getStride(), getPadding(), getDilation(), getGroups(),
                getKernelNumber(), getDropoutRate(), getMaxAngleDegrees());
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ArcConfig)) {
            return false;
        }
        final ArcConfig config = (ArcConfig)o;
        return kernelSize == config.kernelSize && stride == config.stride && padding == config.padding &&
                dilation == config.dilation && groups == config.groups && kernelNumber == config.kernelNumber &&
                Double.compare(dropoutRate, config.dropoutRate) == 0 &&
                Double.compare(maxAngleDegrees, config.maxAngleDegrees) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kernelSize, stride, padding, dilation, groups, kernelNumber, dropoutRate,
                maxAngleDegrees);
    }

    @Override
    @Nonnull
    public String toString() {
        return "ArcConfig[" + "kernelSize=" + getKernelSize() + ", stride=" + getStride() +
                ", padding=" + getPadding() + ", dilation=" + getDilation() + ", groups=" + getGroups() +
                ", kernelNumber=" + getKernelNumber() + ", dropoutRate=" + getDropoutRate() +
                ", maxAngleDegrees=" + getMaxAngleDegrees() + "]";
    }

    /**
     * Builder for {@link ArcConfig}.
     *
     * @see ArcConfig#newBuilder
     */
    @CanIgnoreReturnValue
    public static class ArcConfigBuilder {
        private int kernelSize = DEFAULT_KERNEL_SIZE;
        private int stride = DEFAULT_STRIDE;
        private int padding = DEFAULT_PADDING;
        private int dilation = DEFAULT_DILATION;
        private int groups = DEFAULT_GROUPS;
        private int kernelNumber = DEFAULT_KERNEL_NUMBER;
        private double dropoutRate = DEFAULT_DROPOUT_RATE;
        private double maxAngleDegrees = DEFAULT_MAX_ANGLE_DEGREES;

        public ArcConfigBuilder() {
        }

        public ArcConfigBuilder(final int kernelSize, final int stride, final int padding, final int dilation,
                                final int groups, final int kernelNumber, final double dropoutRate,
                                final double maxAngleDegrees) {
            this.kernelSize = kernelSize;
            this.stride = stride;
            this.padding = padding;
            this.dilation = dilation;
            this.groups = groups;
            this.kernelNumber = kernelNumber;
            this.dropoutRate = dropoutRate;
            this.maxAngleDegrees = maxAngleDegrees;
        }

        public int getKernelSize() {
            return kernelSize;
        }

        @Nonnull
        public ArcConfigBuilder setKernelSize(final int kernelSize) {
            this.kernelSize = kernelSize;
            return this;
        }

        public int getStride() {
            return stride;
        }

        @Nonnull
        public ArcConfigBuilder setStride(final int stride) {
            this.stride = stride;
            return this;
        }

        public int getPadding() {
            return padding;
        }

        @Nonnull
        public ArcConfigBuilder setPadding(final int padding) {
            this.padding = padding;
            return this;
        }

        public int getDilation() {
            return dilation;
        }

        @Nonnull
        public ArcConfigBuilder setDilation(final int dilation) {
            this.dilation = dilation;
            return this;
        }

        public int getGroups() {
            return groups;
        }

        @Nonnull
        public ArcConfigBuilder setGroups(final int groups) {
            this.groups = groups;
            return this;
        }

        public int getKernelNumber() {
            return kernelNumber;
        }

        @Nonnull
        public ArcConfigBuilder setKernelNumber(final int kernelNumber) {
            this.kernelNumber = kernelNumber;
            return this;
        }

        public double getDropoutRate() {
            return dropoutRate;
        }

        @Nonnull
        public ArcConfigBuilder setDropoutRate(final double dropoutRate) {
            this.dropoutRate = dropoutRate;
            return this;
        }

        public double getMaxAngleDegrees() {
            return maxAngleDegrees;
        }

        @Nonnull
        public ArcConfigBuilder setMaxAngleDegrees(final double maxAngleDegrees) {
            this.maxAngleDegrees = maxAngleDegrees;
            return this;
        }

        @Nonnull
        public ArcConfig build() {
            return new ArcConfig(getKernelSize(), getStride(), getPadding(), getDilation(), getGroups(),
                    getKernelNumber(), getDropoutRate(), getMaxAngleDegrees());
        }
    }
}
