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
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * A nominal type reference such as {@code Cat} or {@code Map<string, number>}.
 *
 * <p>{@link #getResolvedClrType} is set upstream when the reference names an external target type
 * (for instance {@code System.DateTime}); it is the fully-qualified target name.
 */
@AutoValue
public abstract class ReferenceType extends IrType {

  public static ReferenceType create(String name) {
    return create(name, ImmutableList.of(), null);
  }

  public static ReferenceType create(
      String name, ImmutableList<IrType> typeArguments, @Nullable String resolvedClrType) {
    return new AutoValue_ReferenceType(name, typeArguments, resolvedClrType);
  }

  public abstract String getName();

  public abstract ImmutableList<IrType> getTypeArguments();

  public abstract @Nullable String getResolvedClrType();

  /** The last dotted segment of the name: {@code Shape} for {@code geo.Shape}. */
  public String getSimpleName() {
    String name = getName();
    return name.substring(name.lastIndexOf('.') + 1);
  }

  @Override
  public final Kind getKind() {
    return Kind.REFERENCE;
  }

  @Override
  public final String toString() {
    if (getTypeArguments().isEmpty()) {
      return getName();
    }
    return getName() + "<" + Joiner.on(", ").join(getTypeArguments()) + ">";
  }
}
