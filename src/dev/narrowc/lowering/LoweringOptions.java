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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import java.io.Serializable;

/**
 * Options for one lowering run. A context copies the options it is created with, so later
 * mutation of this object does not affect lowering already in progress.
 */
public class LoweringOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  public static final String DEFAULT_RUNTIME_NAMESPACE = "global::Narrowc.Runtime";

  private String runtimeNamespace = DEFAULT_RUNTIME_NAMESPACE;

  /** Module path to module info, for types declared outside the module being lowered. */
  private ImmutableMap<String, ModuleInfo> moduleTypes = ImmutableMap.of();

  /** Fully-qualified target type name to the member names it declares. */
  private ImmutableSetMultimap<String, String> typeMemberIndex = ImmutableSetMultimap.of();

  private ImmutableSet<String> extraValueTypes = ImmutableSet.of();

  private boolean logNarrowing = false;

  public LoweringOptions() {}

  LoweringOptions(LoweringOptions other) {
    this.runtimeNamespace = other.runtimeNamespace;
    this.moduleTypes = other.moduleTypes;
    this.typeMemberIndex = other.typeMemberIndex;
    this.extraValueTypes = other.extraValueTypes;
    this.logNarrowing = other.logNarrowing;
  }

  public String getRuntimeNamespace() {
    return runtimeNamespace;
  }

  /** Namespace holding the {@code Union<T1..Tn>} runtime type and the {@code Operators} helpers. */
  public void setRuntimeNamespace(String runtimeNamespace) {
    checkArgument(!runtimeNamespace.isEmpty(), "empty runtime namespace");
    this.runtimeNamespace = runtimeNamespace;
  }

  public ImmutableMap<String, ModuleInfo> getModuleTypes() {
    return moduleTypes;
  }

  public void setModuleTypes(ImmutableMap<String, ModuleInfo> moduleTypes) {
    this.moduleTypes = checkNotNull(moduleTypes);
  }

  public ImmutableSetMultimap<String, String> getTypeMemberIndex() {
    return typeMemberIndex;
  }

  public void setTypeMemberIndex(ImmutableSetMultimap<String, String> typeMemberIndex) {
    this.typeMemberIndex = checkNotNull(typeMemberIndex);
  }

  public ImmutableSet<String> getExtraValueTypes() {
    return extraValueTypes;
  }

  /**
   * Additional fully-qualified target struct types whose nullable form must be unwrapped with
   * {@code .Value}.
   */
  public void setExtraValueTypes(ImmutableSet<String> extraValueTypes) {
    this.extraValueTypes = checkNotNull(extraValueTypes);
  }

  public boolean shouldLogNarrowing() {
    return logNarrowing;
  }

  /** Log each applied narrowing at INFO instead of FINE. */
  public void setLogNarrowing(boolean logNarrowing) {
    this.logNarrowing = logNarrowing;
  }
}
