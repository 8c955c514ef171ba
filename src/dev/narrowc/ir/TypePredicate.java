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

package dev.narrowc.ir;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import dev.narrowc.ir.types.IrType;
import java.io.Serializable;

/**
 * Narrowing descriptor attached by the type checker to a call of a user-defined type predicate
 * ({@code function isCat(p: Pet): p is Cat}). The argument at {@link #getArgIndex} is narrowed to
 * {@link #getTargetType} when the call returns true.
 */
@AutoValue
public abstract class TypePredicate implements Serializable {

  public static TypePredicate create(IrType targetType, int argIndex) {
    checkArgument(argIndex >= 0, "negative argument index: %s", argIndex);
    return new AutoValue_TypePredicate(targetType, argIndex);
  }

  public abstract IrType getTargetType();

  public abstract int getArgIndex();
}
