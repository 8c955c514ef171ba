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

import dev.narrowc.ir.types.IrType;
import dev.narrowc.target.TargetIR;
import dev.narrowc.target.TargetNode;
import org.jspecify.annotations.Nullable;

/** How reads of a narrowed source name are rewritten inside the region the narrowing covers. */
public interface NarrowedBinding {

  /** The two ways a narrowing can be expressed. */
  enum Kind {
    /** Reads go through a new, strongly-typed local. */
    RENAME,
    /** Reads are replaced by a re-evaluable accessor expression. */
    EXPR
  }

  static Rename rename(String name, @Nullable IrType type) {
    return new Rename(name, type);
  }

  static Expr expr(TargetNode expression, @Nullable IrType type) {
    return new Expr(expression, type);
  }

  Kind kind();

  /** The narrowed type, when known. */
  @Nullable IrType type();

  /** The target expression that replaces a read of the narrowed name. */
  TargetNode toExpression();

  /** Narrowing through a materialized local. */
  record Rename(String name, @Nullable IrType type) implements NarrowedBinding {
    public Rename {
      checkArgument(!name.isEmpty(), "empty rename target");
    }

    @Override
    public Kind kind() {
      return Kind.RENAME;
    }

    @Override
    public TargetNode toExpression() {
      return TargetIR.identifier(name);
    }
  }

  /** Narrowing through an inline substitution. */
  record Expr(TargetNode expression, @Nullable IrType type) implements NarrowedBinding {
    @Override
    public Kind kind() {
      return Kind.EXPR;
    }

    @Override
    public TargetNode toExpression() {
      return expression;
    }
  }
}
