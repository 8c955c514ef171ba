/*
 * Copyright 2026 Google Inc.
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

package dev.narrowc.lowering;

import com.google.common.collect.ImmutableList;
import dev.narrowc.target.TargetNode;

/**
 * The target statements an IR statement list lowers to, and the context that follows them. A
 * single IR statement may lower to zero or more target statements.
 */
public record LoweredStatements(ImmutableList<TargetNode> statements, EmitterContext context) {}
