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
import com.google.common.base.Ascii;

/** A payload-free keyword type such as {@code void} or {@code any}. */
@AutoValue
public abstract class KeywordType extends IrType {

  static KeywordType create(Kind kind) {
    checkArgument(
        kind == Kind.VOID || kind == Kind.NEVER || kind == Kind.UNKNOWN || kind == Kind.ANY,
        "not a keyword type: %s",
        kind);
    return new AutoValue_KeywordType(kind);
  }

  @Override
  public abstract Kind getKind();

  @Override
  public final String toString() {
    return Ascii.toLowerCase(getKind().name());
  }
}
