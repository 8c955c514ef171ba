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
import com.google.common.collect.ImmutableMap;
import java.io.Serializable;

/** The target namespace of a module and the types it declares, keyed by simple name. */
@AutoValue
public abstract class ModuleInfo implements Serializable {

  public static ModuleInfo create(String namespace, LocalTypeInfo... localTypes) {
    ImmutableMap.Builder<String, LocalTypeInfo> types = ImmutableMap.builder();
    for (LocalTypeInfo info : localTypes) {
      types.put(info.getName(), info);
    }
    return new AutoValue_ModuleInfo(namespace, types.buildOrThrow());
  }

  public abstract String getNamespace();

  public abstract ImmutableMap<String, LocalTypeInfo> getLocalTypes();
}
