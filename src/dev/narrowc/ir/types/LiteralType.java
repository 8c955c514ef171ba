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

/**
 * A singleton type inhabited by one literal value. The value is a {@link String}, a {@link Double}
 * or a {@link Boolean}.
 */
@AutoValue
public abstract class LiteralType extends IrType {

  public static LiteralType create(Object value) {
    checkArgument(
        value instanceof String || value instanceof Double || value instanceof Boolean,
        "unsupported literal value: %s",
        value);
    return new AutoValue_LiteralType(value);
  }

  public abstract Object getValue();

  public boolean isStringLiteral() {
    return getValue() instanceof String;
  }

  public boolean isNumberLiteral() {
    return getValue() instanceof Double;
  }

  public boolean isBooleanLiteral() {
    return getValue() instanceof Boolean;
  }

  @Override
  public final Kind getKind() {
    return Kind.LITERAL;
  }

  @Override
  public final String toString() {
    return isStringLiteral() ? "\"" + getValue() + "\"" : String.valueOf(getValue());
  }
}
