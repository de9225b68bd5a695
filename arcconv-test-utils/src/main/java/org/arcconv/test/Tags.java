/*
 * Tags.java
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

/**
 * Annotation {@link org.junit.jupiter.api.Tag}s for ARC Conv tests.
 */
@SuppressWarnings("PMD.FieldNamingConventions")
public final class Tags {
    /**
     * Tests that run full residual blocks or many forward passes and take noticeably longer than a unit test.
     */
    public static final String Slow = "Slow";
    /**
     * Tests that run forward passes from several threads at once.
     */
    public static final String Concurrency = "Concurrency";

    private Tags() {
    }
}
