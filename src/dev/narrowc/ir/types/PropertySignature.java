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
import java.io.Serializable;

/** One named member of an object type, class or interface. */
@AutoValue
public abstract class PropertySignature implements Serializable {

  public static PropertySignature create(String name, IrType type, boolean optional) {
    return new AutoValue_PropertySignature(name, type, optional);
  }

  public abstract String getName();

  public abstract IrType getType();

  public abstract boolean isOptional();

  @Override
  public final String toString() {
    return getName() + (isOptional() ? "?: " : ": ") + getType();
  }
}
