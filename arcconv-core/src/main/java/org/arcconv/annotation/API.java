/*
 * API.java
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

package org.arcconv.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks the stability of a public type or member for code that builds on this library.
 *
 * <p>
 * Members inherit the status of their enclosing type unless annotated themselves. A status may be raised at any time
 * but only lowered with the next minor (or, for {@link Status#STABLE}, major) release.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * Return the {@link Status} of the annotated element.
     * @return the stability status
     */
    Status value();

    /**
     * Stability levels, ordered from least to most stable.
     */
    enum Status {
        /**
         * Public only so that other packages of this project can reach it. May change at any time.
         */
        INTERNAL,

        /**
         * Scheduled for removal; do not use in new code.
         */
        DEPRECATED,

        /**
         * Under development. Layers and their parameter names may still change.
         */
        EXPERIMENTAL,

        /**
         * Will not change before the next minor release.
         */
        UNSTABLE,

        /**
         * Will not change incompatibly before the next major release.
         */
        STABLE
    }
}
