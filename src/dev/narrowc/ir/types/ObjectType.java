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

/** A structural object type literal: {@code { kind: "circle"; radius: number }}. */
@AutoValue
public abstract class ObjectType extends IrType {

  public static ObjectType create(ImmutableList<PropertySignature> members) {
    return new AutoValue_ObjectType(members);
  }

  public abstract ImmutableList<PropertySignature> getMembers();

  public @Nullable PropertySignature getMember(String name) {
    for (PropertySignature member : getMembers()) {
      if (member.getName().equals(name)) {
        return member;
      }
    }
    return null;
  }

  @Override
  public final Kind getKind() {
    return Kind.OBJECT;
  }

  @Override
  public final String toString() {
    return "{" + Joiner.on("; ").join(getMembers()) + "}";
  }
}
