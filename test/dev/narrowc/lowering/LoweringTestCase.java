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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import dev.narrowc.ir.IR;
import dev.narrowc.ir.Node;
import dev.narrowc.ir.TypePredicate;
import dev.narrowc.ir.types.IrType;
import dev.narrowc.ir.types.Types;
import dev.narrowc.ir.types.UnionType;
import dev.narrowc.target.TargetPrinter;
import org.junit.Before;

/**
 * Base class for tests that lower IR statements and compare the printed target source.
 *
 * <p>Statements are lowered as one statement list starting from {@link #context}. The expected
 * output is in the compact single-line form {@link TargetPrinter} produces.
 */
public abstract class LoweringTestCase {

  protected static final IrType CAT = Types.ref("Cat");
  protected static final IrType DOG = Types.ref("Dog");
  protected static final UnionType PET = Types.union(CAT, DOG);

  protected LoweringOptions options;

  /** The context lowering starts from. Tests may replace it in their own setup. */
  protected EmitterContext context;

  /** The context after the most recent {@link #lower} call. */
  protected EmitterContext lastContext;

  @Before
  public void setUp() throws Exception {
    options = new LoweringOptions();
    context = null;
    lastContext = null;
  }

  protected EmitterContext context() {
    if (context == null) {
      context = EmitterContext.create(options);
    }
    return context;
  }

  protected void setLocalTypes(LocalTypeInfo... types) {
    ImmutableMap.Builder<String, LocalTypeInfo> builder = ImmutableMap.builder();
    for (LocalTypeInfo type : types) {
      builder.put(type.getName(), type);
    }
    context = context().withLocalTypes(builder.buildOrThrow());
  }

  protected String lower(Node... statements) {
    LoweredStatements lowered =
        StatementLowering.lowerStatements(ImmutableList.copyOf(statements), context());
    lastContext = lowered.context();
    return TargetPrinter.print(lowered.statements());
  }

  protected void test(String expected, Node... statements) {
    assertThat(lower(statements)).isEqualTo(expected);
  }

  protected InternalCompilerError testError(Node... statements) {
    InternalCompilerError e = assertThrows(InternalCompilerError.class, () -> lower(statements));
    assertThat(e)
        .hasMessageThat()
        .startsWith("INTERNAL COMPILER ERROR.\nPlease report this problem.");
    return e;
  }

  // IR shorthands used across the lowering tests.

  protected static Node name(String name, IrType type) {
    return IR.name(name).setInferredType(type);
  }

  protected static Node call(String callee, Node... args) {
    return IR.call(IR.name(callee), args);
  }

  protected static Node callStatement(String callee, Node... args) {
    return IR.exprResult(call(callee, args));
  }

  /** {@code predicate(arg)} where {@code predicate} is declared {@code arg is target}. */
  protected static Node predicateCall(String predicate, Node arg, IrType target) {
    return call(predicate, arg).setTypePredicate(TypePredicate.create(target, 0));
  }
}
