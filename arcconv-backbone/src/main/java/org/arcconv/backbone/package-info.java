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
 * Residual building blocks that can swap their 3x3 convolution for an adaptive rotated one, block by block.
 */
package org.arcconv.backbone;
