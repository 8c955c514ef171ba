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

package dev.narrowc.target;

import static com.google.common.truth.Truth.assertThat;
import static dev.narrowc.target.TargetIR.binary;
import static dev.narrowc.target.TargetIR.identifier;
import static dev.narrowc.target.TargetIR.numberLiteral;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TargetPrinterTest {

  private static final TargetNode A = identifier("a");
  private static final TargetNode B = identifier("b");
  private static final TargetNode C = identifier("c");

  private static void assertPrints(String expected, TargetNode n) {
    assertThat(TargetPrinter.print(n)).isEqualTo(expected);
  }

  private static TargetNode call(String callee, TargetNode... args) {
    return TargetIR.invocation(identifier(callee), args);
  }

  private static TargetNode callStatement(String callee, TargetNode... args) {
    return TargetIR.expressionStatement(call(callee, args));
  }

  // Precedence

  @Test
  public void testBinaryPrecedence() {
    assertPrints("a + b * c", binary("+", A, binary("*", B, C)));
    assertPrints("(a + b) * c", binary("*", binary("+", A, B), C));
    assertPrints("a - b - c", binary("-", binary("-", A, B), C));
    assertPrints("a - (b - c)", binary("-", A, binary("-", B, C)));
    assertPrints("a || b && c", binary("||", A, binary("&&", B, C)));
    assertPrints("(a || b) && c", binary("&&", binary("||", A, B), C));
  }

  @Test
  public void testCoalesceIsRightAssociative() {
    assertPrints("a ?? b ?? c", binary("??", A, binary("??", B, C)));
    assertPrints("(a ?? b) ?? c", binary("??", binary("??", A, B), C));
    TargetNode zero = numberLiteral(0);
    assertPrints("(a ?? 0) != 0", binary("!=", binary("??", A, zero), zero));
  }

  @Test
  public void testUnaryOperands() {
    assertPrints("!a", TargetIR.not(A));
    assertPrints("!(a && b)", TargetIR.not(binary("&&", A, B)));
    assertPrints("-a.b", TargetIR.prefixUnary("-", TargetIR.memberAccess(A, "b")));
    assertPrints("a++", TargetIR.postfixUnary("++", A));
    assertPrints("await f()", TargetIR.await(call("f")));
  }

  @Test
  public void testNegatedIsPatternIsParenthesized() {
    TargetNode pattern = TargetIR.isPattern(A, TargetIR.type("Foo"), "a__is_1");
    assertPrints("a is Foo a__is_1", pattern);
    assertPrints("!(a is Foo a__is_1)", TargetIR.not(pattern));
    assertPrints(
        "a is Foo && b", binary("&&", TargetIR.isPattern(A, TargetIR.type("Foo"), null), B));
  }

  @Test
  public void testConditionalAndAssignment() {
    assertPrints("a ? b : c", TargetIR.conditional(A, B, C));
    assertPrints("(a ? b : c).d", TargetIR.memberAccess(TargetIR.conditional(A, B, C), "d"));
    assertPrints("a = b = c", TargetIR.assignment("=", A, TargetIR.assignment("=", B, C)));
    assertPrints("a += b ?? c", TargetIR.assignment("+=", A, binary("??", B, C)));
  }

  @Test
  public void testExplicitParenthesesAreKept() {
    TargetNode member = TargetIR.invocation(TargetIR.memberAccess(A, "As1"));
    assertPrints("(a.As1()).b", TargetIR.memberAccess(TargetIR.parenthesized(member), "b"));
  }

  // Primary expressions

  @Test
  public void testLiterals() {
    assertPrints("1", numberLiteral(1));
    assertPrints("0.5", numberLiteral(0.5));
    assertPrints("-3", numberLiteral(-3));
    assertPrints("\"a\\\"b\\n\"", TargetIR.stringLiteral("a\"b\n"));
    assertPrints("true", TargetIR.booleanLiteral(true));
    assertPrints("null", TargetIR.nullLiteral());
    assertPrints("default", TargetIR.defaultExpression());
  }

  @Test
  public void testAccessAndCreation() {
    assertPrints("a?.b", TargetIR.conditionalMemberAccess(A, "b"));
    assertPrints("a[b]", TargetIR.elementAccess(A, B, false));
    assertPrints("a?[b]", TargetIR.elementAccess(A, B, true));
    assertPrints("f(a, b = c)", call("f", A, TargetIR.assignment("=", B, C)));
    assertPrints(
        "new Box<int>(a)", TargetIR.objectCreation(TargetIR.type("Box<int>"), ImmutableList.of(A)));
    assertPrints(
        "new int[] { 1, 2 }",
        TargetIR.arrayCreation(
            TargetIR.type("int"), ImmutableList.of(numberLiteral(1), numberLiteral(2))));
    assertPrints(
        "new string[0]", TargetIR.arrayCreation(TargetIR.type("string"), ImmutableList.of()));
  }

  // Statements

  @Test
  public void testBlocks() {
    assertPrints("{ }", TargetIR.block());
    assertPrints("{ f(); g(); }", TargetIR.block(callStatement("f"), callStatement("g")));
    assertThat(TargetPrinter.print(ImmutableList.of(callStatement("f"), callStatement("g"))))
        .isEqualTo("f(); g();");
  }

  @Test
  public void testDeclarations() {
    assertPrints(
        "var x = 1;", TargetIR.localDeclaration(TargetIR.varType(), "x", numberLiteral(1)));
    assertPrints("double? x;", TargetIR.localDeclaration(TargetIR.type("double?"), "x", null));
  }

  @Test
  public void testIfElse() {
    assertPrints(
        "if (a) { f(); } else if (b) { g(); }",
        TargetIR.ifStatement(
            A,
            TargetIR.block(callStatement("f")),
            TargetIR.ifStatement(B, TargetIR.block(callStatement("g")), null)));
  }

  @Test
  public void testLoops() {
    assertPrints("while (a) { }", TargetIR.whileStatement(A, TargetIR.block()));
    assertPrints(
        "for (int i = 0; i < n; i++) { }",
        TargetIR.forStatement(
            TargetIR.localDeclaration(TargetIR.type("int"), "i", numberLiteral(0)),
            binary("<", identifier("i"), identifier("n")),
            ImmutableList.of(TargetIR.postfixUnary("++", identifier("i"))),
            TargetIR.block()));
    assertPrints(
        "for (;;) { break; }",
        TargetIR.forStatement(
            null, null, ImmutableList.of(), TargetIR.block(TargetIR.breakStatement())));
    assertPrints(
        "await foreach (var x in a) { continue; }",
        TargetIR.foreach(
            TargetIR.varType(), "x", A, TargetIR.block(TargetIR.continueStatement()), true));
  }

  @Test
  public void testSwitch() {
    assertPrints(
        "switch (a) { case 1: case 2: f(); break; default: break; }",
        TargetIR.switchStatement(
            A,
            ImmutableList.of(
                TargetIR.switchSection(
                    ImmutableList.of(
                        TargetIR.caseLabel(numberLiteral(1)), TargetIR.caseLabel(numberLiteral(2))),
                    ImmutableList.of(callStatement("f"), TargetIR.breakStatement())),
                TargetIR.switchSection(
                    ImmutableList.of(TargetIR.defaultLabel()),
                    ImmutableList.of(TargetIR.breakStatement())))));
  }

  @Test
  public void testJumps() {
    assertPrints("return;", TargetIR.returnStatement(null));
    assertPrints("return a;", TargetIR.returnStatement(A));
    assertPrints("throw;", TargetIR.throwStatement(null));
    assertPrints(";", TargetIR.emptyStatement());
  }

  // Construction checks

  @Test
  public void testBlockRejectsExpressions() {
    assertThrows(IllegalStateException.class, () -> TargetIR.block(A));
  }

  @Test
  public void testExpressionStatementRejectsStatements() {
    assertThrows(
        IllegalStateException.class,
        () -> TargetIR.expressionStatement(TargetIR.breakStatement()));
  }

  @Test
  public void testUnknownOperatorIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> binary("===", A, B));
    assertThrows(IllegalArgumentException.class, () -> TargetIR.assignment("+", A, B));
  }

  @Test
  public void testSharedSubtreesPrintAtEachUse() {
    TargetNode unwrapped = TargetIR.memberAccess(A, "Value");
    assertPrints("a.Value + a.Value", binary("+", unwrapped, unwrapped));
  }
}
