/*
 * BlockConvPlan.java
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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.primitives.Ints;
import org.arcconv.annotation.API;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Chooses, per block index of a {@link ResLayer}, which kind of convolution a {@link Bottleneck} uses for its
 * 3x3 convolution. Blocks that are not mentioned use {@link ConvKind#STANDARD}.
 */
@API(API.Status.EXPERIMENTAL)
public final class BlockConvPlan {
    private static final BlockConvPlan STANDARD_ONLY = new BlockConvPlan(ImmutableMap.of());

    @Nonnull
    private final ImmutableMap<Integer, ConvKind> kinds;

    private BlockConvPlan(@Nonnull final ImmutableMap<Integer, ConvKind> kinds) {
        this.kinds = kinds;
    }

    @Nonnull
    public static BlockConvPlan standardOnly() {
        return STANDARD_ONLY;
    }

    /**
     * Creates a plan from an explicit map of block indexes to kinds.
     *
     * @param kinds the kind of each listed block
     * @return a new plan
     * @throws IllegalArgumentException if an index is negative
     */
    @Nonnull
    public static BlockConvPlan of(@Nonnull final Map<Integer, ConvKind> kinds) {
        for (final Integer index : kinds.keySet()) {
            Preconditions.checkArgument(index >= 0, "block index must not be negative: %s", index);
        }
        return new BlockConvPlan(ImmutableMap.copyOf(kinds));
    }

    /**
     * Creates a plan in which exactly the given blocks are {@link ConvKind#ADAPTIVE}.
     *
     * @param adaptiveBlocks indexes of the blocks to replace
     * @return a new plan
     */
    @Nonnull
    public static BlockConvPlan fromIndices(@Nonnull final int... adaptiveBlocks) {
        final ImmutableMap.Builder<Integer, ConvKind> builder = ImmutableMap.builder();
        for (final int index : ImmutableSortedSet.copyOf(Ints.asList(adaptiveBlocks))) {
            builder.put(index, ConvKind.ADAPTIVE);
        }
        return of(builder.build());
    }

    @Nonnull
    public static BlockConvPlan fromIndices(@Nonnull final Collection<Integer> adaptiveBlocks) {
        final ImmutableMap.Builder<Integer, ConvKind> builder = ImmutableMap.builder();
        for (final Integer index : ImmutableSortedSet.copyOf(adaptiveBlocks)) {
            builder.put(index, ConvKind.ADAPTIVE);
        }
        return of(builder.build());
    }

    @Nonnull
    public ConvKind kindOf(final int blockIndex) {
        Preconditions.checkArgument(blockIndex >= 0, "block index must not be negative");
        return kinds.getOrDefault(blockIndex, ConvKind.STANDARD);
    }

    /**
     * Returns the indexes of all blocks that use {@link ConvKind#ADAPTIVE}, in ascending order.
     *
     * @return the adaptive block indexes
     */
    @Nonnull
    public ImmutableSortedSet<Integer> getAdaptiveBlocks() {
        final ImmutableSortedSet.Builder<Integer> builder = ImmutableSortedSet.naturalOrder();
        for (final Map.Entry<Integer, ConvKind> entry : kinds.entrySet()) {
            if (entry.getValue() == ConvKind.ADAPTIVE) {
                builder.add(entry.getKey());
            }
        }
        return builder.build();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return getAdaptiveBlocks().equals(((BlockConvPlan)o).getAdaptiveBlocks());
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(getAdaptiveBlocks());
    }

    @Override
    public String toString() {
        return "BlockConvPlan[adaptive=" + getAdaptiveBlocks() + "]";
    }
}
