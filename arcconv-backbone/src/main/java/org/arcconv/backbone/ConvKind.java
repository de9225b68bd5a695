/*
 * ConvKind.java
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

import org.arcconv.annotation.API;

/**
 * Kind of 3x3 convolution used in the middle of a {@link Bottleneck}.
 */
@API(API.Status.EXPERIMENTAL)
public enum ConvKind {
    /**
     * A plain {@link org.arcconv.nn.Conv2d}.
     */
    STANDARD,
    /**
     * An {@link org.arcconv.arc.AdaptiveRotatedConv2d}.
     */
    ADAPTIVE
}
