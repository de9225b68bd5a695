/*
 * package-info.java
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

/**
 * Adaptive rotated convolution: a 3x3 convolution whose kernels are rotated and gated per input sample before
 * they are applied.
 * <p>
 * {@link org.arcconv.arc.AdaptiveRotatedConv2d} is the entry point. Its building blocks,
 * {@link org.arcconv.arc.RoutingFunction}, {@link org.arcconv.arc.RotationOperatorBuilder} and
 * {@link org.arcconv.arc.WeightSynthesizer}, can be used on their own.
 */
package org.arcconv.arc;
