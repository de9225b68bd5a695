/*
 * ShapeMismatchException.java
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

package org.arcconv.tensor;

import org.arcconv.annotation.API;
import org.arcconv.util.LogMessageKeys;
import org.arcconv.util.LoggableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown when the shapes of tensors, channel counts, group counts or kernel numbers handed to a layer are
 * inconsistent with each other. Shape mismatches are detected either when a layer is constructed or on the first
 * forward call that sees the offending input; they are never retried.
 */
@SuppressWarnings("serial")
@API(API.Status.EXPERIMENTAL)
public class ShapeMismatchException extends LoggableException {
    public ShapeMismatchException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }

    /**
     * Create an exception for a tensor whose shape differs from the one expected.
     *
     * @param msg error message
     * @param expected the expected shape
     * @param actual the actual shape
     * @return a new exception carrying both shapes as log info
     */
    @Nonnull
    public static ShapeMismatchException ofShapes(@Nonnull String msg, @Nonnull int[] expected, @Nonnull int[] actual) {
        return new ShapeMismatchException(msg,
                LogMessageKeys.EXPECTED_SHAPE, Tensor.shapeToString(expected),
                LogMessageKeys.ACTUAL_SHAPE, Tensor.shapeToString(actual));
    }

    @Nonnull
    @Override
    public ShapeMismatchException addLogInfo(@Nonnull String description, @Nullable Object object) {
        super.addLogInfo(description, object);
        return this;
    }

    @Nonnull
    @Override
    public ShapeMismatchException addLogInfo(@Nonnull Object... keyValue) {
        super.addLogInfo(keyValue);
        return this;
    }
}
