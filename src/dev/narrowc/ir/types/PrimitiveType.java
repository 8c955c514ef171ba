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

import com.google.auto.value.AutoValue;

/** A built-in scalar type: {@code number}, {@code string}, {@code null} and the like. */
@AutoValue
public abstract class PrimitiveType extends IrType {
  public static final String NUMBER_NAME = "number";
  public static final String INT_NAME = "int";
  public static final String STRING_NAME = "string";
  public static final String BOOLEAN_NAME = "boolean";
  public static final String CHAR_NAME = "char";
  public static final String NULL_NAME = "null";
  public static final String UNDEFINED_NAME = "undefined";

  public static PrimitiveType create(String name) {
    return new AutoValue_PrimitiveType(name);
  }

  public abstract String getName();

  @Override
  public final Kind getKind() {
    return Kind.PRIMITIVE;
  }

  @Override
  public final String toString() {
    return getName();
  }
}
