/*
 * LogMessageKeys.java
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

package org.arcconv.util;

import org.arcconv.annotation.API;

import java.util.Locale;

/**
 * Keys used in the log info of {@link LoggableException}s thrown by this library. Keeping them in one place makes it
 * easy to check for collisions and keep naming consistent.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // shapes
    EXPECTED_SHAPE,
    ACTUAL_SHAPE,
    EXPECTED_CHANNELS,
    ACTUAL_CHANNELS,

    // layer configuration
    IN_CHANNELS,
    OUT_CHANNELS,
    GROUPS,
    KERNEL_NUMBER,

    // parameters
    PARAMETER_NAME,
    ;

    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return logKey;
    }
}
