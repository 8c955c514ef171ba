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

package dev.narrowc.ir.types;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/** An ordered union of alternatives. Member order is significant: it fixes member indices. */
@AutoValue
public abstract class UnionType extends IrType {

  public static UnionType create(ImmutableList<IrType> alternates) {
    checkArgument(!alternates.isEmpty(), "empty union");
    return new AutoValue_UnionType(alternates);
  }

  public abstract ImmutableList<IrType> getAlternates();

  /** Whether any alternate is {@code null} or {@code undefined}. */
  public boolean hasNullishMember() {
    for (IrType alternate : getAlternates()) {
      if (alternate.isNullish()) {
        return true;
      }
    }
    return false;
  }

  @Override
  public final Kind getKind() {
    return Kind.UNION;
  }

  @Override
  public final String toString() {
    return "(" + Joiner.on(" | ").join(getAlternates()) + ")";
  }
}
