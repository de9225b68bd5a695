/*
 * RandomizedTestUtils.java
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

import org.junit.jupiter.params.provider.Arguments;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.LongStream;
import java.util.stream.Stream;

/**
 * Helpers for seeding randomized tensor tests.
 * <p>
 * Seeds are preferred over {@link Random} instances as test arguments because a seed shows up in the display name
 * of a {@link org.junit.jupiter.params.ParameterizedTest}, so a failing case can be replayed exactly.
 * </p>
 * <p>
 * Two system properties widen the run: {@code tests.includeRandom=true} appends freshly drawn seeds to the fixed
 * ones and {@code tests.iterations} says how many.
 * </p>
 */
public final class RandomizedTestUtils {
    private static final long FIXED_SEED = 0xa5c0dec0deL;

    private RandomizedTestUtils() {
    }

    /**
     * Return a stream of seeds for random number generators. The given static seeds are always part of the stream;
     * if none are given, {@value FIXED_SEED} is used.
     *
     * @param staticSeeds seeds that are always included
     * @return a stream of seeds
     */
    @Nonnull
    public static Stream<Long> randomSeeds(long... staticSeeds) {
        LongStream longStream = staticSeeds.length == 0 ? LongStream.of(FIXED_SEED) : LongStream.of(staticSeeds);
        if (includeRandomTests()) {
            final Random random = ThreadLocalRandom.current();
            longStream = LongStream.concat(longStream,
                    LongStream.generate(random::nextLong).limit(getIterations()));
        }
        return longStream.boxed();
    }

    /**
     * Cross the seeds returned by {@link #randomSeeds(long...)} with a fixed list of integer arguments, e.g. batch
     * sizes or kernel numbers.
     *
     * @param values the second argument of each pair
     * @param staticSeeds seeds that are always included
     * @return a stream of {@code (seed, value)} arguments
     */
    @Nonnull
    public static Stream<Arguments> randomSeedsWith(@Nonnull final int[] values, long... staticSeeds) {
        return randomSeeds(staticSeeds)
                .flatMap(seed -> Arrays.stream(values).mapToObj(value -> Arguments.of(seed, value)));
    }

    private static int getIterations() {
        return Integer.parseInt(System.getProperty("tests.iterations", "0"));
    }

    private static boolean includeRandomTests() {
        return Boolean.parseBoolean(System.getProperty("tests.includeRandom", "false"));
    }
}
