/*
 * LearnedRoutingFunctionTest.java
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

import org.arcconv.nn.Initializers;
import org.arcconv.tensor.ShapeMismatchException;
import org.arcconv.tensor.Tensor;
import org.arcconv.test.RandomizedTestUtils;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import javax.annotation.Nonnull;
import java.util.Random;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.within;

class LearnedRoutingFunctionTest {
    @Nonnull
    private static Stream<Arguments> randomSeedsWithKernelNumbers() {
        return RandomizedTestUtils.randomSeedsWith(new int[] {1, 4}, 0xdeadc0deL, 0xfdb5ca1eL);
    }

    @ParameterizedTest
    @MethodSource("randomSeedsWithKernelNumbers")
    void testRoutingRanges(final long seed, final int kernelNumber) {
        final Random random = new Random(seed);
        final ArcConfig config = ArcConfig.newBuilder().setKernelNumber(kernelNumber).build();
        final LearnedRoutingFunction routing = new LearnedRoutingFunction(8, config, random);
        final Tensor input = Initializers.normal(random, 5.0d, 3, 8, 6, 6);

        final RoutingSignal signal = routing.route(input);
        Assertions.assertThat(signal.getGating().getShape()).containsExactly(3, kernelNumber);
        Assertions.assertThat(signal.getAngles().getShape()).containsExactly(3, kernelNumber);
        for (final double g : signal.getGating().getData()) {
            Assertions.assertThat(g).isStrictlyBetween(0.0d, 1.0d);
        }
        final double maxAngle = config.getMaxAngleRadians();
        for (final double a : signal.getAngles().getData()) {
            Assertions.assertThat(a).isStrictlyBetween(-maxAngle, maxAngle);
        }
        Assertions.assertThat(routing.getMaxAngle()).isEqualTo(maxAngle);
    }

    @ParameterizedTest
    @MethodSource("randomSeedsWithKernelNumbers")
    void testDeterministicInEvalMode(final long seed, final int kernelNumber) {
        final Random random = new Random(seed);
        final LearnedRoutingFunction routing = new LearnedRoutingFunction(4, kernelNumber, 0.5d, 40.0d, random);
        final Tensor input = Initializers.normal(random, 1.0d, 2, 4, 5, 5);

        final RoutingSignal first = routing.route(input);
        final RoutingSignal second = routing.route(input);
        Assertions.assertThat(first.getGating()).isEqualTo(second.getGating());
        Assertions.assertThat(first.getAngles()).isEqualTo(second.getAngles());

        final Tensor stacked = routing.forward(input);
        Assertions.assertThat(stacked.getShape()).containsExactly(2, 2 * kernelNumber);
        Assertions.assertThat(stacked.get(1, 0)).isEqualTo(first.getGating().get(1, 0));
        Assertions.assertThat(stacked.get(1, kernelNumber)).isEqualTo(first.getAngles().get(1, 0));
    }

    @Test
    void testSameSeedSameParameters() {
        final LearnedRoutingFunction a = new LearnedRoutingFunction(4, 2, 0.2d, 40.0d, new Random(7));
        final LearnedRoutingFunction b = new LearnedRoutingFunction(4, 2, 0.2d, 40.0d, new Random(7));
        Assertions.assertThat(a.namedParameters()).isEqualTo(b.namedParameters());
    }

    @Test
    void testDropoutOnlyInTrainingMode() {
        final Random random = new Random(0xdeadc0deL);
        final LearnedRoutingFunction routing = new LearnedRoutingFunction(16, 2, 0.2d, 40.0d, random);
        final Tensor input = Initializers.normal(random, 1.0d, 2, 16, 4, 4);

        final RoutingSignal evaluated = routing.route(input);
        routing.train();
        final RoutingSignal trained = routing.route(input);
        Assertions.assertThat(trained.getGating()).isNotEqualTo(evaluated.getGating());
        routing.eval();
        Assertions.assertThat(routing.route(input).getGating()).isEqualTo(evaluated.getGating());
    }

    @Test
    void testParameters() {
        final LearnedRoutingFunction routing = new LearnedRoutingFunction(8, 3, 0.2d, 40.0d, new Random(0));
        Assertions.assertThat(routing.namedParameters().keySet()).containsExactly(
                "dwc.weight", "norm.weight", "norm.bias", "fcAlpha.weight", "fcAlpha.bias", "fcTheta.weight");
        Assertions.assertThat(routing.namedParameters().get("dwc.weight").getShape()).containsExactly(8, 1, 3, 3);
        Assertions.assertThat(routing.namedParameters().get("fcTheta.weight").getShape()).containsExactly(3, 8);
        for (final String name : new String[] {"dwc.weight", "fcAlpha.weight", "fcTheta.weight"}) {
            for (final double v : routing.namedParameters().get(name).getData()) {
                Assertions.assertThat(Math.abs(v)).isLessThanOrEqualTo(2 * LearnedRoutingFunction.INIT_STD);
            }
        }
    }

    @Test
    void testWrongChannels() {
        final LearnedRoutingFunction routing = new LearnedRoutingFunction(8, 3, 0.2d, 40.0d, new Random(0));
        Assertions.assertThatThrownBy(() -> routing.route(Tensor.zeros(1, 4, 5, 5)))
                .isInstanceOf(ShapeMismatchException.class);
        Assertions.assertThatThrownBy(() -> routing.route(Tensor.zeros(8, 5, 5)))
                .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void testMaxAngleRange() {
        final LearnedRoutingFunction widest = new LearnedRoutingFunction(4, 2, 0.2d, 45.0d, new Random(0));
        Assertions.assertThat(widest.getMaxAngle()).isCloseTo(Math.PI / 4, within(1e-15));
        Assertions.assertThatThrownBy(() -> new LearnedRoutingFunction(4, 2, 0.2d, 46.0d, new Random(0)))
                .isInstanceOf(IllegalArgumentException.class);
        Assertions.assertThatThrownBy(() -> new LearnedRoutingFunction(4, 2, 0.2d, 0.0d, new Random(0)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
