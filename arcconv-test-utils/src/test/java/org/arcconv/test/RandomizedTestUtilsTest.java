/*
 * RandomizedTestUtilsTest.java
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

package org.arcconv.test;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.provider.Arguments;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class RandomizedTestUtilsTest {
    @Test
    void staticSeedsAreAlwaysIncluded() {
        final List<Long> seeds = RandomizedTestUtils.randomSeeds(1L, 2L, 3L).collect(Collectors.toList());
        assertThat(seeds).startsWith(1L, 2L, 3L);
    }

    @Test
    void fixedSeedWhenNoneGiven() {
        assertThat(RandomizedTestUtils.randomSeeds().findFirst()).isPresent();
    }

    @Test
    void seedsCrossedWithValues() {
        final List<Arguments> arguments = RandomizedTestUtils.randomSeedsWith(new int[] {1, 4}, 7L, 8L)
                .collect(Collectors.toList());
        assertThat(arguments.subList(0, 4))
                .extracting(a -> List.of(a.get()))
                .containsExactly(List.of(7L, 1), List.of(7L, 4), List.of(8L, 1), List.of(8L, 4));
    }
}
