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
 * Layers and functional building blocks over {@link org.arcconv.tensor.Tensor}s: convolution, fully connected
 * layers, normalization, dropout, activations, pooling and weight initialization.
 * <p>
 * All layers are forward-only. Gradients are out of scope; a training loop drives parameter updates through
 * {@link org.arcconv.nn.Layer#loadParameters(java.util.Map)}.
 */
package org.arcconv.nn;
