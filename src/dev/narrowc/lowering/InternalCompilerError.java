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

import dev.narrowc.ir.Node;
import dev.narrowc.ir.Token;

/**
 * Thrown when the lowering engine meets a shape it has no typed lowering for. This is a compiler
 * bug or an unsupported construct, never a user error; the whole lowering of the enclosing
 * statement fails.
 */
public final class InternalCompilerError extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final Token token;

  InternalCompilerError(Token token, String message) {
    super("INTERNAL COMPILER ERROR.\nPlease report this problem.\n\n" + token + ": " + message);
    this.token = token;
  }

  static InternalCompilerError unsupported(Node n, String what) {
    return new InternalCompilerError(
        n.getToken(), "no typed lowering for " + what + ". Add a lowering rule.\n" + n);
  }

  /** The kind of the IR node that could not be lowered. */
  public Token getToken() {
    return token;
  }
}
