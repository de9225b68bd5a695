/*
 * ConvolutionsTest.java
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

import org.arcconv.tensor.ShapeMismatchException;
import org.arcconv.tensor.Tensor;
import org.arcconv.test.RandomizedTestUtils;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import javax.annotation.Nonnull;
import java.util.Random;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.within;

class ConvolutionsTest {
    @Nonnull
    private static Stream<Long> randomSeeds() {
        return RandomizedTestUtils.randomSeeds(0xdeadc0deL, 0xfdb5ca1eL, 0xf005ba1L);
    }

    @Test
    void testZeroPadding() {
        final Tensor input = Tensor.filled(1.0d, 1, 1, 3, 3);
        final Tensor weight = Tensor.filled(1.0d, 1, 1, 3, 3);
        final Tensor output = Convolutions.conv2d(input, weight, null, 1, 1, 1, 1);
        Assertions.assertThat(output.getShape()).containsExactly(1, 1, 3, 3);
        Assertions.assertThat(output.getData()).containsExactly(4, 6, 4, 6, 9, 6, 4, 6, 4);
    }

    @Test
    void testStride() {
        final Tensor input = Tensor.filled(1.0d, 1, 1, 3, 3);
        final Tensor weight = Tensor.filled(1.0d, 1, 1, 3, 3);
        final Tensor output = Convolutions.conv2d(input, weight, null, 2, 1, 1, 1);
        Assertions.assertThat(output.getShape()).containsExactly(1, 1, 2, 2);
        Assertions.assertThat(output.getData()).containsExactly(4, 4, 4, 4);
    }

    @Test
    void testDilation() {
        final Tensor input = Tensor.zeros(1, 1, 5, 5);
        for (int i = 0; i < 25; i++) {
            input.getData()[i] = i;
        }
        final Tensor weight = Tensor.filled(1.0d, 1, 1, 3, 3);
        final Tensor output = Convolutions.conv2d(input, weight, null, 1, 0, 2, 1);
        Assertions.assertThat(output.getShape()).containsExactly(1, 1, 1, 1);
        // taps at rows and columns 0, 2 and 4
        Assertions.assertThat(output.getData()[0]).isEqualTo(108.0d);
    }

    @Test
    void testGroupsAndBias() {
        final Tensor input = Tensor.of(new double[] {5, 7}, 1, 2, 1, 1);
        final Tensor weight = Tensor.of(new double[] {2, 3}, 2, 1, 1, 1);
        final Tensor bias = Tensor.of(new double[] {0.5, -1}, 2);
        final Tensor output = Convolutions.conv2d(input, weight, bias, 1, 0, 1, 2);
        Assertions.assertThat(output.getData()).containsExactly(10.5, 20);
    }

    @ParameterizedTest
    @MethodSource("randomSeeds")
    void testGroupedConvolutionEqualsSeparateConvolutions(final long seed) {
        final Random random = new Random(seed);
        final int batchSize = 2;
        final Tensor input = Initializers.normal(random, 1.0d, batchSize, 4, 6, 6);
        final Tensor weight = Initializers.normal(random, 1.0d, 6, 2, 3, 3);
        final Tensor grouped = Convolutions.conv2d(input, weight, null, 1, 1, 1, 2);

        for (int g = 0; g < 2; g++) {
            final Tensor inputSlice = Tensor.zeros(batchSize, 2, 6, 6);
            for (int b = 0; b < batchSize; b++) {
                System.arraycopy(input.getData(), (b * 4 + g * 2) * 36, inputSlice.getData(), b * 2 * 36, 2 * 36);
            }
            final Tensor weightSlice = Tensor.zeros(3, 2, 3, 3);
            System.arraycopy(weight.getData(), g * 3 * 18, weightSlice.getData(), 0, 3 * 18);
            final Tensor separate = Convolutions.conv2d(inputSlice, weightSlice, null, 1, 1, 1, 1);
            for (int b = 0; b < batchSize; b++) {
                for (int oc = 0; oc < 3; oc++) {
                    for (int h = 0; h < 6; h++) {
                        for (int w = 0; w < 6; w++) {
                            Assertions.assertThat(grouped.get(b, g * 3 + oc, h, w))
                                    .isCloseTo(separate.get(b, oc, h, w), within(1e-12));
                        }
                    }
                }
            }
        }
    }

    @Test
    void testOutputSize() {
        Assertions.assertThat(Convolutions.outputSize(5, 3, 1, 1, 1)).isEqualTo(5);
        Assertions.assertThat(Convolutions.outputSize(5, 3, 2, 1, 1)).isEqualTo(3);
        Assertions.assertThat(Convolutions.outputSize(7, 3, 1, 2, 2)).isEqualTo(7);
        Assertions.assertThat(Convolutions.outputSize(6, 3, 2, 0, 1)).isEqualTo(2);
    }

    @Test
    void testShapeMismatches() {
        Assertions.assertThatThrownBy(() -> Convolutions.conv2d(Tensor.zeros(1, 3, 4, 4),
                        Tensor.zeros(2, 2, 3, 3), null, 1, 1, 1, 1))
                .isInstanceOf(ShapeMismatchException.class);
        Assertions.assertThatThrownBy(() -> Convolutions.conv2d(Tensor.zeros(1, 4, 4, 4),
                        Tensor.zeros(3, 2, 3, 3), null, 1, 1, 1, 2))
                .isInstanceOf(ShapeMismatchException.class);
        Assertions.assertThatThrownBy(() -> Convolutions.conv2d(Tensor.zeros(4, 4, 4),
                        Tensor.zeros(3, 4, 3, 3), null, 1, 1, 1, 1))
                .isInstanceOf(ShapeMismatchException.class);
        Assertions.assertThatThrownBy(() -> Convolutions.conv2d(Tensor.zeros(1, 4, 4, 4),
                        Tensor.zeros(3, 4, 3, 3), Tensor.zeros(2), 1, 1, 1, 1))
                .isInstanceOf(ShapeMismatchException.class);
        Assertions.assertThatThrownBy(() -> Convolutions.conv2d(Tensor.zeros(1, 4, 4, 4),
                        Tensor.zeros(3, 4, 3, 3), null, 0, 1, 1, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
