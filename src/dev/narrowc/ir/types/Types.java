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

import com.google.common.collect.ImmutableList;

/** Shared type constants and terse constructors for building typed IR. */
public final class Types {
  public static final PrimitiveType NUMBER = PrimitiveType.create(PrimitiveType.NUMBER_NAME);
  public static final PrimitiveType INT = PrimitiveType.create(PrimitiveType.INT_NAME);
  public static final PrimitiveType STRING = PrimitiveType.create(PrimitiveType.STRING_NAME);
  public static final PrimitiveType BOOLEAN = PrimitiveType.create(PrimitiveType.BOOLEAN_NAME);
  public static final PrimitiveType CHAR = PrimitiveType.create(PrimitiveType.CHAR_NAME);
  public static final PrimitiveType NULL = PrimitiveType.create(PrimitiveType.NULL_NAME);
  public static final PrimitiveType UNDEFINED = PrimitiveType.create(PrimitiveType.UNDEFINED_NAME);

  public static final KeywordType VOID = KeywordType.create(IrType.Kind.VOID);
  public static final KeywordType NEVER = KeywordType.create(IrType.Kind.NEVER);
  public static final KeywordType UNKNOWN = KeywordType.create(IrType.Kind.UNKNOWN);
  public static final KeywordType ANY = KeywordType.create(IrType.Kind.ANY);

  private Types() {}

  public static UnionType union(IrType... alternates) {
    return UnionType.create(ImmutableList.copyOf(alternates));
  }

  /** {@code type | undefined}. */
  public static UnionType optional(IrType type) {
    return union(type, UNDEFINED);
  }

  public static ReferenceType ref(String name, IrType... typeArguments) {
    return ReferenceType.create(name, ImmutableList.copyOf(typeArguments), null);
  }

  /** A reference to an external target type, e.g. {@code clrRef("DateTime", "System.DateTime")}. */
  public static ReferenceType clrRef(String name, String clrName) {
    return ReferenceType.create(name, ImmutableList.of(), clrName);
  }

  public static LiteralType literal(String value) {
    return LiteralType.create(value);
  }

  public static LiteralType literal(double value) {
    return LiteralType.create(value);
  }

  public static LiteralType literal(boolean value) {
    return LiteralType.create(value);
  }

  public static PropertySignature prop(String name, IrType type) {
    return PropertySignature.create(name, type, false);
  }

  public static PropertySignature optionalProp(String name, IrType type) {
    return PropertySignature.create(name, type, true);
  }

  public static ObjectType object(PropertySignature... members) {
    return ObjectType.create(ImmutableList.copyOf(members));
  }

  public static ArrayType array(IrType elementType) {
    return ArrayType.create(elementType);
  }

  public static DictionaryType dictionary(IrType keyType, IrType valueType) {
    return DictionaryType.create(keyType, valueType);
  }

  public static TypeParameterType typeParameter(String name) {
    return TypeParameterType.create(name);
  }
}
