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

import com.google.common.collect.ImmutableSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Allocates target local names.
 *
 * <p>The target language rejects a local that shadows another local of the same function, so a
 * source declaration whose name is already taken is emitted under a suffixed name ({@code x__1},
 * {@code x__2}, ...). Reads of the source name then go through the scope's local name map.
 */
public final class LocalNames {
  private static final Logger logger = Logger.getLogger(LocalNames.class.getName());

  /** An allocated name and the context that records it. */
  public record Allocation(String emittedName, EmitterContext context) {}

  private LocalNames() {}

  /**
   * Returns a collision-free target name for the source declaration {@code candidate}, with a
   * context mapping {@code candidate} to it and marking it used. Narrowing of the outer {@code
   * candidate} no longer applies in that context.
   */
  public static Allocation allocate(String candidate, EmitterContext context) {
    Allocation reserved = reserve(candidate, context);
    EmitterContext declared = reserved.context().withoutBindingsRootedAt(candidate);
    return new Allocation(
        reserved.emittedName(),
        declared.withLocalNameMap(
            EmitterContext.put(declared.getLocalNameMap(), candidate, reserved.emittedName())));
  }

  /**
   * Returns a collision-free target name based on {@code candidate} and marks it used, without
   * mapping any source name to it. Used for synthesized locals.
   */
  public static Allocation reserve(String candidate, EmitterContext context) {
    ImmutableSet<String> used = context.getUsedLocalNames();
    String emitted = Identifiers.escape(candidate);
    for (int suffix = 1; used.contains(emitted); suffix++) {
      emitted = Identifiers.escape(candidate + "__" + suffix);
    }
    if (!emitted.equals(Identifiers.escape(candidate)) && logger.isLoggable(Level.FINER)) {
      logger.finer("Renamed local " + candidate + " to " + emitted + " to avoid shadowing");
    }
    return new Allocation(emitted, markUsed(emitted, context));
  }

  /**
   * Maps {@code sourceName} to {@code emittedName} without checking for collisions. The caller
   * guarantees uniqueness (function parameters, for instance).
   */
  public static EmitterContext register(
      String sourceName, String emittedName, EmitterContext context) {
    EmitterContext marked = markUsed(emittedName, context);
    return marked.withLocalNameMap(
        EmitterContext.put(marked.getLocalNameMap(), sourceName, emittedName));
  }

  /** The target identifier a read of {@code sourceName} resolves to, ignoring narrowing. */
  public static String remappedLocalName(String sourceName, EmitterContext context) {
    String mapped = context.getLocalNameMap().get(sourceName);
    return mapped != null ? mapped : Identifiers.escape(sourceName);
  }

  private static EmitterContext markUsed(String emittedName, EmitterContext context) {
    if (context.getUsedLocalNames().contains(emittedName)) {
      return context;
    }
    return context.toBuilder()
        .setUsedLocalNames(
            ImmutableSet.<String>builder()
                .addAll(context.getUsedLocalNames())
                .add(emittedName)
                .build())
        .build();
  }
}
