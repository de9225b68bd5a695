/*
 * LayersTest.java
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

import com.google.common.collect.ImmutableMap;
import org.arcconv.tensor.ShapeMismatchException;
import org.arcconv.tensor.Tensor;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.within;

class LayersTest {
    @Test
    void testLinear() {
        final Linear linear = new Linear(2, 2, true, new Random(0));
        linear.loadParameters(ImmutableMap.of(
                "weight", Tensor.of(new double[] {1, 2, 3, 4}, 2, 2),
                "bias", Tensor.of(new double[] {1, -1}, 2)));
        final Tensor output = linear.forward(Tensor.of(new double[] {1, 1, 0, 2}, 2, 2));
        Assertions.assertThat(output.getShape()).containsExactly(2, 2);
        Assertions.assertThat(output.getData()).containsExactly(4, 6, 5, 7);

        Assertions.assertThatThrownBy(() -> linear.forward(Tensor.zeros(2, 3)))
                .isInstanceOf(ShapeMismatchException.class);
        Assertions.assertThat(new Linear(2, 3, false, new Random(0)).namedParameters()).containsOnlyKeys("weight");
    }

    @Test
    void testLayerNormNormalizesOverChannels() {
        final LayerNorm2d norm = new LayerNorm2d(2);
        final Tensor output = norm.forward(Tensor.of(new double[] {1, 5, 3, 9}, 1, 2, 1, 2));
        // position 0 sees channels (1, 3), position 1 sees (5, 9)
        Assertions.assertThat(output.get(0, 0, 0, 0)).isCloseTo(-1.0d, within(1e-4));
        Assertions.assertThat(output.get(0, 1, 0, 0)).isCloseTo(1.0d, within(1e-4));
        Assertions.assertThat(output.get(0, 0, 0, 1)).isCloseTo(-1.0d, within(1e-4));
        Assertions.assertThat(output.get(0, 1, 0, 1)).isCloseTo(1.0d, within(1e-4));
        Assertions.assertThat(norm.namedParameters()).containsOnlyKeys("weight", "bias");
    }

    @Test
    void testBatchNormModes() {
        final BatchNorm2d bn = new BatchNorm2d(1);
        final Tensor input = Tensor.of(new double[] {1, 3}, 2, 1, 1, 1);

        final Tensor evaluated = bn.forward(input);
        Assertions.assertThat(evaluated.getData()[0]).isCloseTo(1.0d, within(1e-4));
        Assertions.assertThat(evaluated.getData()[1]).isCloseTo(3.0d, within(1e-4));

        bn.train();
        final Tensor trained = bn.forward(input);
        Assertions.assertThat(trained.getData()[0]).isCloseTo(-1.0d, within(1e-4));
        Assertions.assertThat(trained.getData()[1]).isCloseTo(1.0d, within(1e-4));

        // running statistics are untouched by forward
        Assertions.assertThat(bn.namedParameters().get("runningMean").getData()).containsExactly(0.0d);
        Assertions.assertThat(bn.namedParameters().get("runningVar").getData()).containsExactly(1.0d);
    }

    @Test
    void testDropout() {
        final Tensor input = Tensor.filled(1.0d, 4, 64);
        final Dropout dropout = new Dropout(0.5d, new Random(42));
        Assertions.assertThat(dropout.forward(input)).isEqualTo(input);

        dropout.train();
        final Tensor dropped = dropout.forward(input);
        Assertions.assertThat(dropped.getData()).containsOnly(0.0d, 2.0d).contains(0.0d, 2.0d);

        final Dropout same = new Dropout(0.5d, new Random(42));
        same.train();
        Assertions.assertThat(same.forward(input)).isEqualTo(dropped);
        Assertions.assertThatThrownBy(() -> new Dropout(1.0d, new Random(0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testActivations() {
        final Tensor input = Tensor.of(new double[] {-2, 0, 1}, 3);
        Assertions.assertThat(Activations.relu(input).getData()).containsExactly(0, 0, 1);
        Assertions.assertThat(Activations.sigmoid(input).getData()[1]).isEqualTo(0.5d);
        Assertions.assertThat(Activations.softsign(input).getData()).containsExactly(-2.0d / 3.0d, 0, 0.5d);
        Assertions.assertThat(Activations.sigmoid(-1000.0d)).isEqualTo(0.0d);
        Assertions.assertThat(Activations.sigmoid(1000.0d)).isEqualTo(1.0d);
    }

    @Test
    void testSoftmaxOverMiddleAxis() {
        final Tensor input = Tensor.of(new double[] {0, 1000, Math.log(3), 1000}, 1, 2, 2);
        final Tensor output = Activations.softmax(input, 1);
        Assertions.assertThat(output.get(0, 0, 0)).isCloseTo(0.25d, within(1e-12));
        Assertions.assertThat(output.get(0, 1, 0)).isCloseTo(0.75d, within(1e-12));
        Assertions.assertThat(output.get(0, 0, 1)).isCloseTo(0.5d, within(1e-12));
        Assertions.assertThat(output.get(0, 1, 1)).isCloseTo(0.5d, within(1e-12));
    }

    @Test
    void testGlobalAveragePool() {
        final Tensor output = Pooling.globalAveragePool(Tensor.of(new double[] {1, 2, 3, 4, 10, 10, 10, 10},
                1, 2, 2, 2));
        Assertions.assertThat(output.getShape()).containsExactly(1, 2, 1, 1);
        Assertions.assertThat(output.getData()).containsExactly(2.5, 10);
    }

    @Test
    void testLoadParametersRejectsUnknownNamesAndShapes() {
        final LayerNorm2d norm = new LayerNorm2d(3);
        Assertions.assertThatThrownBy(() -> norm.loadParameters(ImmutableMap.of("gamma", Tensor.zeros(3))))
                .isInstanceOf(IllegalArgumentException.class);
        Assertions.assertThatThrownBy(() -> norm.loadParameters(ImmutableMap.of("weight", Tensor.zeros(4))))
                .isInstanceOf(ShapeMismatchException.class)
                .satisfies(e -> Assertions.assertThat(((ShapeMismatchException)e).getLogInfo())
                        .containsEntry("parameter_name", "weight"));
    }

    @Test
    void testFailedLoadLeavesParametersUntouched() {
        final LayerNorm2d norm = new LayerNorm2d(3);
        final Map<String, Tensor> values = new LinkedHashMap<>();
        values.put("weight", Tensor.filled(7.0d, 3));
        values.put("bias", Tensor.zeros(4));
        Assertions.assertThatThrownBy(() -> norm.loadParameters(values))
                .isInstanceOf(ShapeMismatchException.class);
        Assertions.assertThat(norm.namedParameters().get("weight")).isEqualTo(Tensor.filled(1.0d, 3));

        values.put("bias", Tensor.zeros(3));
        values.put("beta", Tensor.zeros(3));
        Assertions.assertThatThrownBy(() -> norm.loadParameters(values))
                .isInstanceOf(IllegalArgumentException.class);
        Assertions.assertThat(norm.namedParameters().get("weight")).isEqualTo(Tensor.filled(1.0d, 3));
    }

    @Test
    void testNestedLoadGoesThroughSubLayers() {
        final List<Map<String, Tensor>> received = new ArrayList<>();
        final class RecordingNorm extends LayerNorm2d {
            RecordingNorm() {
                super(2);
            }

            @Override
            public void loadParameters(final Map<String, Tensor> values) {
                received.add(values);
                super.loadParameters(values);
            }
        }
        final class Block extends AbstractLayer {
            private final Tensor scale = registerParameter("scale", Tensor.zeros(1));
            private final RecordingNorm norm = registerLayer("norm", new RecordingNorm());

            @Override
            public Tensor forward(final Tensor input) {
                return norm.forward(input);
            }
        }

        final Block block = new Block();
        block.loadParameters(ImmutableMap.of(
                "scale", Tensor.filled(3.0d, 1),
                "norm.bias", Tensor.filled(0.5d, 2)));
        Assertions.assertThat(block.scale.getData()).containsExactly(3.0d);
        Assertions.assertThat(received).hasSize(1);
        Assertions.assertThat(received.get(0)).containsOnlyKeys("bias");
        Assertions.assertThat(block.norm.namedParameters().get("bias").getData()).containsExactly(0.5d, 0.5d);

        // a bad entry anywhere stops the load before any sub-layer sees it
        Assertions.assertThatThrownBy(() -> block.loadParameters(ImmutableMap.of(
                        "norm.weight", Tensor.zeros(2),
                        "scale", Tensor.zeros(2))))
                .isInstanceOf(ShapeMismatchException.class);
        Assertions.assertThat(received).hasSize(1);
        Assertions.assertThat(block.norm.namedParameters().get("weight").getData()).containsExactly(1.0d, 1.0d);
    }

    @Test
    void testDottedNamesAreRejected() {
        final class Block extends AbstractLayer {
            Block() {
                registerParameter("a.b", Tensor.zeros(1));
            }

            @Override
            public Tensor forward(final Tensor input) {
                return input;
            }
        }
        Assertions.assertThatThrownBy(Block::new).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testConv2dParametersAndToString() {
        final Conv2d conv = new Conv2d(4, 8, 3, 2, 1, 1, 2, true, new Random(0));
        Assertions.assertThat(conv.namedParameters()).containsOnlyKeys("weight", "bias");
        Assertions.assertThat(conv.getWeight().getShape()).containsExactly(8, 2, 3, 3);
        Assertions.assertThat(conv.forward(Tensor.zeros(2, 4, 6, 6)).getShape()).containsExactly(2, 8, 3, 3);
        Assertions.assertThat(conv.toString())
                .isEqualTo("Conv2d(4, 8, kernel_size=3, stride=2, padding=1, groups=2)");
        Assertions.assertThatThrownBy(() -> new Conv2d(3, 8, 3, 1, 1, 1, 2, false, new Random(0)))
                .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void testNestedParameterNamesAndTrainingPropagation() {
        final class Block extends AbstractLayer {
            private final Conv2d conv = registerLayer("conv", Conv2d.conv1x1(2, 2, 1, new Random(0)));
            private final BatchNorm2d bn = registerLayer("bn", new BatchNorm2d(2));

            @Override
            public Tensor forward(final Tensor input) {
                return bn.forward(conv.forward(input));
            }
        }

        final Block block = new Block();
        Assertions.assertThat(block.namedParameters().keySet())
                .containsExactly("conv.weight", "bn.weight", "bn.bias", "bn.runningMean", "bn.runningVar");
        Assertions.assertThat(block.isTraining()).isFalse();
        block.train();
        Assertions.assertThat(block.bn.isTraining()).isTrue();
        block.eval();
        Assertions.assertThat(block.conv.isTraining()).isFalse();
    }
}
