/*
 * ChannelAttentionTest.java
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
import org.arcconv.tensor.Tensor;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.within;

class ChannelAttentionTest {
    @Test
    void testHiddenChannels() {
        Assertions.assertThat(ChannelAttention.hiddenChannels(4)).isEqualTo(ChannelAttention.MIN_HIDDEN_CHANNELS);
        Assertions.assertThat(ChannelAttention.hiddenChannels(512)).isEqualTo(32);
        Assertions.assertThat(ChannelAttention.hiddenChannels(1024)).isEqualTo(64);
    }

    @Test
    void testWeightsSumToOneOverVariants() {
        final Random random = new Random(0xdeadc0deL);
        final ChannelAttention attention = new ChannelAttention(8, 3, random);
        final Tensor weights = attention.forward(Initializers.normal(random, 1.0d, 2, 8, 4, 4));
        Assertions.assertThat(weights.getShape()).containsExactly(2, 3, 8);
        final Tensor sums = weights.sum(1);
        for (final double sum : sums.getData()) {
            Assertions.assertThat(sum).isCloseTo(1.0d, within(1e-12));
        }
    }

    @Test
    void testSingleSampleTrainingGivesUniformWeights() {
        final Random random = new Random(0xfdb5ca1eL);
        final ChannelAttention attention = new ChannelAttention(4, 4, random);
        attention.train();
        // batch statistics of a single pooled sample have zero variance, so the squeezed features vanish
        final Tensor weights = attention.forward(Initializers.normal(random, 1.0d, 1, 4, 3, 3));
        for (final double w : weights.getData()) {
            Assertions.assertThat(w).isCloseTo(0.25d, within(1e-12));
        }
    }

    @Test
    void testParameters() {
        final ChannelAttention attention = new ChannelAttention(8, 2, new Random(0));
        Assertions.assertThat(attention.namedParameters().keySet()).containsExactly("fc1.weight", "bn.weight",
                "bn.bias", "bn.runningMean", "bn.runningVar", "fc2.weight");
        Assertions.assertThat(attention.namedParameters().get("fc2.weight").getShape())
                .containsExactly(16, 32, 1, 1);
    }
}
