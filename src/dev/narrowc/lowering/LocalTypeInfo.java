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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import dev.narrowc.ir.types.IrType;
import dev.narrowc.ir.types.PropertySignature;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/** The shape of a class, interface or type alias declared in a module. */
@AutoValue
public abstract class LocalTypeInfo implements Serializable {

  /** What kind of declaration introduced the type. */
  public enum Kind {
    CLASS,
    INTERFACE,
    TYPE_ALIAS
  }

  public static LocalTypeInfo classInfo(String name, PropertySignature... properties) {
    return new AutoValue_LocalTypeInfo(
        Kind.CLASS, name, ImmutableList.of(), ImmutableList.copyOf(properties),
        ImmutableList.of(), null);
  }

  public static LocalTypeInfo interfaceInfo(
      String name, ImmutableList<IrType> extendsTypes, PropertySignature... properties) {
    return new AutoValue_LocalTypeInfo(
        Kind.INTERFACE, name, ImmutableList.of(), ImmutableList.copyOf(properties),
        extendsTypes, null);
  }

  public static LocalTypeInfo genericInterfaceInfo(
      String name,
      ImmutableList<String> typeParameters,
      ImmutableList<IrType> extendsTypes,
      PropertySignature... properties) {
    return new AutoValue_LocalTypeInfo(
        Kind.INTERFACE, name, typeParameters, ImmutableList.copyOf(properties),
        extendsTypes, null);
  }

  public static LocalTypeInfo typeAlias(
      String name, ImmutableList<String> typeParameters, IrType aliasedType) {
    return new AutoValue_LocalTypeInfo(
        Kind.TYPE_ALIAS, name, typeParameters, ImmutableList.of(), ImmutableList.of(),
        aliasedType);
  }

  public abstract Kind getKind();

  public abstract String getName();

  public abstract ImmutableList<String> getTypeParameters();

  /** Own property members; empty for type aliases. */
  public abstract ImmutableList<PropertySignature> getProperties();

  /** Base interfaces of an interface. */
  public abstract ImmutableList<IrType> getExtendsTypes();

  /** The right-hand side of a type alias; null otherwise. */
  public abstract @Nullable IrType getAliasedType();

  public @Nullable PropertySignature getOwnProperty(String name) {
    for (PropertySignature property : getProperties()) {
      if (property.getName().equals(name)) {
        return property;
      }
    }
    return null;
  }
}
