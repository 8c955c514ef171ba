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

import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * The inferred type of an IR node, as computed by the upstream type checker.
 *
 * <p>Types are immutable values; two structurally identical types are {@link Object#equals}.
 * Optional and nullable types are represented as unions containing the {@code null} or {@code
 * undefined} primitive.
 */
public abstract class IrType implements Serializable {

  /** The variant of a type. */
  public enum Kind {
    PRIMITIVE,
    LITERAL,
    REFERENCE,
    UNION,
    OBJECT,
    ARRAY,
    DICTIONARY,
    TYPE_PARAMETER,
    VOID,
    NEVER,
    UNKNOWN,
    ANY
  }

  IrType() {}

  public abstract Kind getKind();

  public boolean isPrimitiveType() {
    return getKind() == Kind.PRIMITIVE;
  }

  /** Whether this is the given primitive, e.g. {@code isPrimitive("number")}. */
  public boolean isPrimitive(String name) {
    return isPrimitiveType() && ((PrimitiveType) this).getName().equals(name);
  }

  /** Whether this is the {@code null} or {@code undefined} primitive. */
  public boolean isNullish() {
    return isPrimitive(PrimitiveType.NULL_NAME) || isPrimitive(PrimitiveType.UNDEFINED_NAME);
  }

  public boolean isLiteralType() {
    return getKind() == Kind.LITERAL;
  }

  public boolean isReferenceType() {
    return getKind() == Kind.REFERENCE;
  }

  public boolean isUnionType() {
    return getKind() == Kind.UNION;
  }

  public boolean isObjectType() {
    return getKind() == Kind.OBJECT;
  }

  public boolean isArrayType() {
    return getKind() == Kind.ARRAY;
  }

  public boolean isDictionaryType() {
    return getKind() == Kind.DICTIONARY;
  }

  public boolean isTypeParameterType() {
    return getKind() == Kind.TYPE_PARAMETER;
  }

  public boolean isVoidType() {
    return getKind() == Kind.VOID;
  }

  public boolean isNeverType() {
    return getKind() == Kind.NEVER;
  }

  /** Whether nothing useful is known statically about values of this type. */
  public boolean isUnknownOrAny() {
    return getKind() == Kind.UNKNOWN || getKind() == Kind.ANY;
  }

  public @Nullable PrimitiveType toMaybePrimitiveType() {
    return isPrimitiveType() ? (PrimitiveType) this : null;
  }

  public @Nullable LiteralType toMaybeLiteralType() {
    return isLiteralType() ? (LiteralType) this : null;
  }

  public @Nullable ReferenceType toMaybeReferenceType() {
    return isReferenceType() ? (ReferenceType) this : null;
  }

  public @Nullable UnionType toMaybeUnionType() {
    return isUnionType() ? (UnionType) this : null;
  }

  public @Nullable ObjectType toMaybeObjectType() {
    return isObjectType() ? (ObjectType) this : null;
  }

  public @Nullable ArrayType toMaybeArrayType() {
    return isArrayType() ? (ArrayType) this : null;
  }

  public @Nullable DictionaryType toMaybeDictionaryType() {
    return isDictionaryType() ? (DictionaryType) this : null;
  }

  public @Nullable TypeParameterType toMaybeTypeParameterType() {
    return isTypeParameterType() ? (TypeParameterType) this : null;
  }
}
