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

/** Target-language identifier rules. Only reserved keywords are escaped. */
public final class Identifiers {

  private static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "abstract", "as", "base", "bool", "break", "byte", "case", "catch", "char", "checked",
          "class", "const", "continue", "decimal", "default", "delegate", "do", "double", "else",
          "enum", "event", "explicit", "extern", "false", "finally", "fixed", "float", "for",
          "foreach", "goto", "if", "implicit", "in", "int", "interface", "internal", "is", "lock",
          "long", "namespace", "new", "null", "object", "operator", "out", "override", "params",
          "private", "protected", "public", "readonly", "ref", "return", "sbyte", "sealed", "short",
          "sizeof", "stackalloc", "static", "string", "struct", "switch", "this", "throw", "true",
          "try", "typeof", "uint", "ulong", "unchecked", "unsafe", "ushort", "using", "virtual",
          "void", "volatile", "while");

  private Identifiers() {}

  public static boolean isKeyword(String name) {
    return KEYWORDS.contains(name);
  }

  /** Prefixes {@code name} with {@code @} when it is a target keyword. */
  public static String escape(String name) {
    return isKeyword(name) ? "@" + name : name;
  }
}
