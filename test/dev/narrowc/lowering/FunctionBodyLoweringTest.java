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

import dev.narrowc.ir.IR;
import dev.narrowc.ir.Node;
import dev.narrowc.ir.Token;
import dev.narrowc.ir.types.Types;
import dev.narrowc.target.TargetPrinter;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class FunctionBodyLoweringTest extends LoweringTestCase {

  private Lowered lowered;

  private String lowerFunction(Node function, boolean isStatic) {
    lowered = FunctionBodyLowering.lowerFunction(function, isStatic, context());
    return TargetPrinter.print(lowered.node());
  }

  private static Node function(Node params, Node... body) {
    return IR.function(IR.name("f"), params, IR.block(body));
  }

  @Test
  public void testLocalShadowingParameterIsRenamed() {
    Node f =
        function(
            IR.paramList(IR.name("x")),
            IR.let(IR.name("x"), IR.number(1)),
            callStatement("use", IR.name("x")));
    assertThat(lowerFunction(f, false)).isEqualTo("{ var x__1 = 1; use(x__1); }");
  }

  @Test
  public void testParametersKeepTheirNames() {
    Node f =
        function(
            IR.paramList(IR.name("string"), IR.name("n")),
            callStatement("use", IR.name("string"), IR.name("n")));
    assertThat(lowerFunction(f, false)).isEqualTo("{ use(@string, n); }");
  }

  @Test
  public void testOuterNarrowingDoesNotLeakIn() {
    context = context().withBinding("pet", NarrowedBinding.rename("pet__1_1", CAT));
    Node f = function(IR.paramList(IR.name("pet")), callStatement("feed", IR.name("pet")));
    assertThat(lowerFunction(f, false)).isEqualTo("{ feed(pet); }");
  }

  @Test
  public void testOnlyTempVarIdFlowsOut() {
    context = context().toBuilder().setTempVarId(3).build();
    Node f =
        function(
            IR.paramList(IR.name("pet")),
            IR.ifNode(
                predicateCall("isCat", name("pet", PET), CAT),
                IR.block(callStatement("feed", IR.name("pet")))));

    assertThat(lowerFunction(f, false))
        .isEqualTo("{ if (pet.Is1()) { var pet__1_4 = pet.As1(); feed(pet__1_4); } }");
    assertThat(lowered.context().getTempVarId()).isEqualTo(4);
    assertThat(lowered.context().getUsedLocalNames()).isEmpty();
    assertThat(lowered.context().getLocalNameMap()).isEmpty();
    assertThat(lowered.context().getReturnType()).isNull();
  }

  @Test
  public void testNamesAreReusableAcrossFunctions() {
    Node first = function(IR.paramList(), IR.let(IR.name("x"), IR.number(1)));
    lowerFunction(first, false);
    context = lowered.context();
    Node second = function(IR.paramList(), IR.let(IR.name("x"), IR.number(2)));
    assertThat(lowerFunction(second, false)).isEqualTo("{ var x = 2; }");
  }

  @Test
  public void testVoidFunctionReturnsNothing() {
    Node f =
        function(IR.paramList(), IR.returnNode(IR.voidNode(call("log"))))
            .setDeclaredType(Types.VOID);
    assertThat(lowerFunction(f, false)).isEqualTo("{ log(); return; }");
  }

  @Test
  public void testReturnTypeIsScopedToTheFunction() {
    Node f = function(IR.paramList(), IR.returnNode(IR.name("undefined")));
    assertThat(lowerFunction(f, false)).isEqualTo("{ return default; }");
  }

  @Test
  public void testAsyncFunctionMayAwait() {
    Node f =
        function(IR.paramList(), IR.exprResult(IR.await(call("load"))))
            .setIsAsyncFunction(true);
    assertThat(lowerFunction(f, false)).isEqualTo("{ await load(); }");
  }

  @Test
  public void testAwaitInSyncFunctionIsAnError() {
    Node f = function(IR.paramList(), IR.exprResult(IR.await(call("load"))));
    InternalCompilerError e =
        assertThrows(InternalCompilerError.class, () -> lowerFunction(f, false));
    assertThat(e.getToken()).isEqualTo(Token.AWAIT);
  }

  @Test
  public void testThisInStaticMethodIsAnError() {
    Node f =
        function(IR.paramList(), callStatement("use", IR.getprop(IR.thisNode(), "count")));
    assertThat(lowerFunction(f.cloneTree(), false)).isEqualTo("{ use(this.count); }");
    InternalCompilerError e =
        assertThrows(InternalCompilerError.class, () -> lowerFunction(f, true));
    assertThat(e.getToken()).isEqualTo(Token.THIS);
  }

  @Test
  public void testNonFunctionIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> FunctionBodyLowering.lowerFunction(IR.block(), false, context()));
  }
}
