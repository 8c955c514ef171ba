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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import dev.narrowc.ir.types.IrType;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The immutable state threaded through lowering.
 *
 * <p>Every lowering step takes a context and returns the context that follows it; a context is
 * never changed in place, so restoring an enclosing scope's view is a matter of copying fields
 * back from the context that was current when the scope was entered.
 */
@AutoValue
public abstract class EmitterContext {

  public static EmitterContext create(LoweringOptions options) {
    return builder()
        .setOptions(new LoweringOptions(options))
        .setNarrowedBindings(ImmutableMap.of())
        .setLocalNameMap(ImmutableMap.of())
        .setUsedLocalNames(ImmutableSet.of())
        .setTempVarId(0)
        .setIntLoopVars(ImmutableSet.of())
        .setAsyncFunction(false)
        .setStaticContext(false)
        .setReturnType(null)
        .setLocalTypes(ImmutableMap.of())
        .build();
  }

  static Builder builder() {
    return new AutoValue_EmitterContext.Builder();
  }

  public abstract LoweringOptions getOptions();

  /** Source name (or dotted narrowing key) to the binding that currently narrows it. */
  public abstract ImmutableMap<String, NarrowedBinding> getNarrowedBindings();

  /** Source name to the target identifier it was declared as in the current scope. */
  public abstract ImmutableMap<String, String> getLocalNameMap();

  /** Every target local name already taken in the function being lowered. */
  public abstract ImmutableSet<String> getUsedLocalNames();

  /** The last temporary id handed out. */
  public abstract long getTempVarId();

  /** Emitted names of canonical integer loop counters currently in scope. */
  public abstract ImmutableSet<String> getIntLoopVars();

  public abstract boolean isAsyncFunction();

  public abstract boolean isStaticContext();

  /** Declared return type of the enclosing function, when known. */
  public abstract @Nullable IrType getReturnType();

  /** Types declared in the module being lowered, keyed by simple name. */
  public abstract ImmutableMap<String, LocalTypeInfo> getLocalTypes();

  public abstract Builder toBuilder();

  public @Nullable NarrowedBinding getBinding(String key) {
    return getNarrowedBindings().get(key);
  }

  public boolean isNarrowed(String key) {
    return getNarrowedBindings().containsKey(key);
  }

  /** Returns a context where {@code key} is narrowed by {@code binding} instead of before. */
  public EmitterContext withBinding(String key, NarrowedBinding binding) {
    return withNarrowedBindings(put(getNarrowedBindings(), key, binding));
  }

  /**
   * Returns a context where neither {@code name} nor any access path rooted at it is narrowed.
   * A new declaration of {@code name} hides the outer variable those bindings were about.
   */
  public EmitterContext withoutBindingsRootedAt(String name) {
    ImmutableMap<String, NarrowedBinding> bindings = getNarrowedBindings();
    String prefix = name + ".";
    ImmutableMap<String, NarrowedBinding> kept =
        ImmutableMap.copyOf(
            Maps.filterKeys(bindings, key -> !key.equals(name) && !key.startsWith(prefix)));
    return kept.size() == bindings.size() ? this : withNarrowedBindings(kept);
  }

  public EmitterContext withNarrowedBindings(ImmutableMap<String, NarrowedBinding> bindings) {
    if (bindings == getNarrowedBindings()) {
      return this;
    }
    return toBuilder().setNarrowedBindings(bindings).build();
  }

  /** Returns a context whose local name map is {@code localNameMap}. */
  public EmitterContext withLocalNameMap(ImmutableMap<String, String> localNameMap) {
    if (localNameMap == getLocalNameMap()) {
      return this;
    }
    return toBuilder().setLocalNameMap(localNameMap).build();
  }

  public EmitterContext withIntLoopVars(ImmutableSet<String> intLoopVars) {
    return toBuilder().setIntLoopVars(intLoopVars).build();
  }

  public EmitterContext withLocalTypes(ImmutableMap<String, LocalTypeInfo> localTypes) {
    return toBuilder().setLocalTypes(localTypes).build();
  }

  /** Returns a context whose temp id is one past this one's. The counter never wraps. */
  public EmitterContext withNextTempVarId() {
    return toBuilder().setTempVarId(Math.addExact(getTempVarId(), 1)).build();
  }

  /**
   * Returns this context's non-narrowing state combined with the narrowing state of {@code
   * scope}: the view of an enclosing region after lowering a nested one.
   */
  EmitterContext restoreScope(EmitterContext scope) {
    return toBuilder()
        .setNarrowedBindings(scope.getNarrowedBindings())
        .setLocalNameMap(scope.getLocalNameMap())
        .build();
  }

  static <K, V> ImmutableMap<K, V> put(ImmutableMap<K, V> map, K key, V value) {
    checkNotNull(value);
    if (value.equals(map.get(key))) {
      return map;
    }
    ImmutableMap.Builder<K, V> builder = ImmutableMap.builderWithExpectedSize(map.size() + 1);
    for (Map.Entry<K, V> entry : map.entrySet()) {
      if (!entry.getKey().equals(key)) {
        builder.put(entry);
      }
    }
    return builder.put(key, value).buildOrThrow();
  }

  /** Builder for {@link EmitterContext}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setOptions(LoweringOptions options);

    public abstract Builder setNarrowedBindings(ImmutableMap<String, NarrowedBinding> bindings);

    public abstract Builder setLocalNameMap(ImmutableMap<String, String> localNameMap);

    public abstract Builder setUsedLocalNames(ImmutableSet<String> usedLocalNames);

    public abstract Builder setTempVarId(long tempVarId);

    public abstract Builder setIntLoopVars(ImmutableSet<String> intLoopVars);

    public abstract Builder setAsyncFunction(boolean asyncFunction);

    public abstract Builder setStaticContext(boolean staticContext);

    public abstract Builder setReturnType(@Nullable IrType returnType);

    public abstract Builder setLocalTypes(ImmutableMap<String, LocalTypeInfo> localTypes);

    public abstract EmitterContext build();
  }
}
