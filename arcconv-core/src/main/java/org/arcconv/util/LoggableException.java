/*
 * LoggableException.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception type with support for adding keys and values to its log info. The keys and values can then be logged
 * in a structured way, which makes failures such as mismatched tensor shapes easy to search for later.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class LoggableException extends RuntimeException {
    @Nullable
    private Map<String, Object> logInfo;

    /**
     * Create an exception with the given message and a sequence of key-value pairs.
     *
     * @param msg error message
     * @param keyValues flattened key-value pairs
     * @throws IllegalArgumentException if {@code keyValues} contains an odd number of elements
     * @see #addLogInfo(Object...)
     */
    public LoggableException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg);
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }

    public LoggableException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    /**
     * Get the log information associated with this exception, in insertion order.
     *
     * @return an unmodifiable view of the log information
     */
    @Nonnull
    public Map<String, Object> getLogInfo() {
        if (logInfo == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(logInfo);
    }

    /**
     * Add a key/value pair to the log information.
     *
     * @param description key of the pair
     * @param object value of the pair
     * @return this exception
     */
    @Nonnull
    public LoggableException addLogInfo(@Nonnull String description, @Nullable Object object) {
        if (logInfo == null) {
            logInfo = new LinkedHashMap<>();
        }
        logInfo.put(description, object);
        return this;
    }

    /**
     * Add a list of key/value pairs to the log information. Every even element is a key and the element after it
     * its value, so {@code ["k0", "v0", "k1", "v1"]} adds two pairs. This is the same format that
     * {@link #exportLogInfo()} produces.
     *
     * @param keyValue flattened key-value pairs
     * @return this exception
     * @throws IllegalArgumentException if {@code keyValue} has odd length
     */
    @Nonnull
    public LoggableException addLogInfo(@Nonnull Object... keyValue) {
        if ((keyValue.length % 2) != 0) {
            throw new IllegalArgumentException("Unbalanced key/value logging info");
        }
        for (int i = 0; i < keyValue.length; i += 2) {
            addLogInfo(String.valueOf(keyValue[i]), keyValue[i + 1]);
        }
        return this;
    }

    /**
     * Export the log information as a flattened array of alternating keys and values.
     *
     * @return the flattened log information
     */
    @Nonnull
    public Object[] exportLogInfo() {
        final Map<String, Object> info = getLogInfo();
        final Object[] flattened = new Object[info.size() * 2];
        int i = 0;
        for (Map.Entry<String, Object> entry : info.entrySet()) {
            flattened[i++] = entry.getKey();
            flattened[i++] = entry.getValue();
        }
        return flattened;
    }

    @Override
    public String getMessage() {
        final String message = super.getMessage();
        if (logInfo == null || logInfo.isEmpty()) {
            return message;
        }
        return message + " " + logInfo;
    }
}
