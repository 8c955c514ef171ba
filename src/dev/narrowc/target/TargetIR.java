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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Construction helpers for the target syntax tree. Each factory checks the layout it produces. */
public final class TargetIR {

  private TargetIR() {}

  // Statements

  public static TargetNode block(List<TargetNode> statements) {
    for (TargetNode statement : statements) {
      checkState(isStatement(statement), "Block cannot contain %s", statement.getToken());
    }
    return TargetNode.create(TargetToken.BLOCK, null, ImmutableList.copyOf(statements));
  }

  public static TargetNode block(TargetNode... statements) {
    return block(ImmutableList.copyOf(statements));
  }

  /** {@code type name = initializer;} with an optional initializer. */
  public static TargetNode localDeclaration(
      TargetNode type, String name, @Nullable TargetNode initializer) {
    checkState(type.getToken() == TargetToken.TYPE, type);
    ImmutableList<TargetNode> children =
        initializer == null ? ImmutableList.of(type) : ImmutableList.of(type, expr(initializer));
    return TargetNode.create(TargetToken.LOCAL_DECLARATION, name, children);
  }

  public static TargetNode expressionStatement(TargetNode expression) {
    return TargetNode.create(
        TargetToken.EXPRESSION_STATEMENT, null, ImmutableList.of(expr(expression)));
  }

  public static TargetNode ifStatement(
      TargetNode condition, TargetNode then, @Nullable TargetNode elseStatement) {
    checkState(isStatement(then), then);
    if (elseStatement == null) {
      return TargetNode.create(TargetToken.IF, null, ImmutableList.of(expr(condition), then));
    }
    checkState(isStatement(elseStatement), elseStatement);
    return TargetNode.create(
        TargetToken.IF, null, ImmutableList.of(expr(condition), then, elseStatement));
  }

  public static TargetNode whileStatement(TargetNode condition, TargetNode body) {
    checkState(isStatement(body), body);
    return TargetNode.create(TargetToken.WHILE, null, ImmutableList.of(expr(condition), body));
  }

  /**
   * FOR(initializer, condition, body, iterators...). An absent initializer or condition is an
   * EMPTY node.
   */
  public static TargetNode forStatement(
      @Nullable TargetNode initializer,
      @Nullable TargetNode condition,
      List<TargetNode> iterators,
      TargetNode body) {
    checkState(isStatement(body), body);
    ImmutableList.Builder<TargetNode> children = ImmutableList.builder();
    if (initializer == null) {
      children.add(emptyStatement());
    } else {
      checkState(
          initializer.getToken() == TargetToken.LOCAL_DECLARATION
              || initializer.getToken() == TargetToken.EXPRESSION_STATEMENT,
          initializer);
      children.add(initializer);
    }
    children.add(condition == null ? emptyStatement() : expr(condition));
    children.add(body);
    for (TargetNode iterator : iterators) {
      children.add(expr(iterator));
    }
    return TargetNode.create(TargetToken.FOR, null, children.build());
  }

  /** {@code [await] foreach (type identifier in expression) body}. */
  public static TargetNode foreach(
      TargetNode type,
      String identifier,
      TargetNode expression,
      TargetNode body,
      boolean isAwait) {
    checkState(type.getToken() == TargetToken.TYPE, type);
    checkState(isStatement(body), body);
    return TargetNode.create(
        TargetToken.FOREACH, identifier, ImmutableList.of(type, expr(expression), body), isAwait);
  }

  public static TargetNode switchStatement(TargetNode expression, List<TargetNode> sections) {
    ImmutableList.Builder<TargetNode> children = ImmutableList.builder();
    children.add(expr(expression));
    for (TargetNode section : sections) {
      checkState(section.getToken() == TargetToken.SWITCH_SECTION, section);
      children.add(section);
    }
    return TargetNode.create(TargetToken.SWITCH, null, children.build());
  }

  /** A run of case labels followed by the statements they select. */
  public static TargetNode switchSection(List<TargetNode> labels, List<TargetNode> statements) {
    checkArgument(!labels.isEmpty(), "switch section without labels");
    ImmutableList.Builder<TargetNode> children = ImmutableList.builder();
    for (TargetNode label : labels) {
      checkState(
          label.getToken() == TargetToken.CASE_LABEL
              || label.getToken() == TargetToken.DEFAULT_LABEL,
          label);
      children.add(label);
    }
    for (TargetNode statement : statements) {
      checkState(isStatement(statement), statement);
      children.add(statement);
    }
    return TargetNode.create(TargetToken.SWITCH_SECTION, null, children.build());
  }

  public static TargetNode caseLabel(TargetNode value) {
    return TargetNode.create(TargetToken.CASE_LABEL, null, ImmutableList.of(expr(value)));
  }

  public static TargetNode defaultLabel() {
    return TargetNode.create(TargetToken.DEFAULT_LABEL, null, ImmutableList.of());
  }

  /** TRY(block, catch clauses..., [FINALLY_CLAUSE(block)]). */
  public static TargetNode tryStatement(
      TargetNode block, List<TargetNode> catches, @Nullable TargetNode finallyBlock) {
    checkState(block.isBlock(), block);
    checkArgument(
        !catches.isEmpty() || finallyBlock != null, "try without catch or finally clause");
    ImmutableList.Builder<TargetNode> children = ImmutableList.builder();
    children.add(block);
    for (TargetNode catchClause : catches) {
      checkState(catchClause.getToken() == TargetToken.CATCH_CLAUSE, catchClause);
      children.add(catchClause);
    }
    if (finallyBlock != null) {
      checkState(finallyBlock.isBlock(), finallyBlock);
      children.add(
          TargetNode.create(TargetToken.FINALLY_CLAUSE, null, ImmutableList.of(finallyBlock)));
    }
    return TargetNode.create(TargetToken.TRY, null, children.build());
  }

  /** {@code catch (type identifier) block}, or {@code catch block} when type is null. */
  public static TargetNode catchClause(
      @Nullable TargetNode type, @Nullable String identifier, TargetNode block) {
    checkState(block.isBlock(), block);
    if (type == null) {
      checkArgument(identifier == null, "catch identifier without a type");
      return TargetNode.create(TargetToken.CATCH_CLAUSE, null, ImmutableList.of(block));
    }
    return TargetNode.create(TargetToken.CATCH_CLAUSE, identifier, ImmutableList.of(type, block));
  }

  public static TargetNode throwStatement(@Nullable TargetNode expression) {
    return TargetNode.create(
        TargetToken.THROW,
        null,
        expression == null ? ImmutableList.of() : ImmutableList.of(expr(expression)));
  }

  public static TargetNode returnStatement(@Nullable TargetNode expression) {
    return TargetNode.create(
        TargetToken.RETURN,
        null,
        expression == null ? ImmutableList.of() : ImmutableList.of(expr(expression)));
  }

  public static TargetNode breakStatement() {
    return TargetNode.create(TargetToken.BREAK, null, ImmutableList.of());
  }

  public static TargetNode continueStatement() {
    return TargetNode.create(TargetToken.CONTINUE, null, ImmutableList.of());
  }

  public static TargetNode emptyStatement() {
    return TargetNode.create(TargetToken.EMPTY, null, ImmutableList.of());
  }

  // Expressions

  public static TargetNode identifier(String name) {
    checkArgument(!name.isEmpty(), "empty identifier");
    return TargetNode.create(TargetToken.IDENTIFIER, name, ImmutableList.of());
  }

  /** A literal whose source text is already in target syntax. */
  public static TargetNode literal(String text) {
    return TargetNode.create(TargetToken.LITERAL, text, ImmutableList.of());
  }

  public static TargetNode stringLiteral(String value) {
    return literal(quote(value));
  }

  public static TargetNode numberLiteral(double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
      return literal(Long.toString((long) value));
    }
    return literal(Double.toString(value));
  }

  public static TargetNode booleanLiteral(boolean value) {
    return literal(value ? "true" : "false");
  }

  public static TargetNode nullLiteral() {
    return literal("null");
  }

  public static TargetNode defaultExpression() {
    return TargetNode.create(TargetToken.DEFAULT, null, ImmutableList.of());
  }

  public static TargetNode memberAccess(TargetNode expression, String member) {
    return TargetNode.create(
        TargetToken.MEMBER_ACCESS, member, ImmutableList.of(expr(expression)), false);
  }

  /** {@code expression?.member}. */
  public static TargetNode conditionalMemberAccess(TargetNode expression, String member) {
    return TargetNode.create(
        TargetToken.MEMBER_ACCESS, member, ImmutableList.of(expr(expression)), true);
  }

  public static TargetNode elementAccess(
      TargetNode expression, TargetNode index, boolean conditional) {
    return TargetNode.create(
        TargetToken.ELEMENT_ACCESS,
        null,
        ImmutableList.of(expr(expression), expr(index)),
        conditional);
  }

  public static TargetNode invocation(TargetNode callee, List<TargetNode> arguments) {
    ImmutableList.Builder<TargetNode> children = ImmutableList.builder();
    children.add(expr(callee));
    for (TargetNode argument : arguments) {
      children.add(expr(argument));
    }
    return TargetNode.create(TargetToken.INVOCATION, null, children.build());
  }

  public static TargetNode invocation(TargetNode callee, TargetNode... arguments) {
    return invocation(callee, ImmutableList.copyOf(arguments));
  }

  public static TargetNode objectCreation(TargetNode type, List<TargetNode> arguments) {
    checkState(type.getToken() == TargetToken.TYPE, type);
    ImmutableList.Builder<TargetNode> children = ImmutableList.builder();
    children.add(type);
    for (TargetNode argument : arguments) {
      children.add(expr(argument));
    }
    return TargetNode.create(TargetToken.OBJECT_CREATION, null, children.build());
  }

  /** {@code new elementType[] { elements... }}. */
  public static TargetNode arrayCreation(TargetNode elementType, List<TargetNode> elements) {
    checkState(elementType.getToken() == TargetToken.TYPE, elementType);
    ImmutableList.Builder<TargetNode> children = ImmutableList.builder();
    children.add(elementType);
    for (TargetNode element : elements) {
      children.add(expr(element));
    }
    return TargetNode.create(TargetToken.ARRAY_CREATION, null, children.build());
  }

  public static TargetNode parenthesized(TargetNode expression) {
    return TargetNode.create(TargetToken.PARENTHESIZED, null, ImmutableList.of(expr(expression)));
  }

  public static TargetNode prefixUnary(String operator, TargetNode operand) {
    return TargetNode.create(TargetToken.PREFIX_UNARY, operator, ImmutableList.of(expr(operand)));
  }

  public static TargetNode postfixUnary(String operator, TargetNode operand) {
    return TargetNode.create(
        TargetToken.POSTFIX_UNARY, operator, ImmutableList.of(expr(operand)));
  }

  public static TargetNode not(TargetNode operand) {
    return prefixUnary("!", operand);
  }

  public static TargetNode binary(String operator, TargetNode left, TargetNode right) {
    checkArgument(TargetPrinter.binaryPrecedence(operator) > 0, "unknown operator %s", operator);
    return TargetNode.create(
        TargetToken.BINARY, operator, ImmutableList.of(expr(left), expr(right)));
  }

  public static TargetNode conditional(
      TargetNode condition, TargetNode whenTrue, TargetNode whenFalse) {
    return TargetNode.create(
        TargetToken.CONDITIONAL,
        null,
        ImmutableList.of(expr(condition), expr(whenTrue), expr(whenFalse)));
  }

  public static TargetNode assignment(String operator, TargetNode left, TargetNode right) {
    checkArgument(operator.endsWith("="), "not an assignment operator: %s", operator);
    return TargetNode.create(
        TargetToken.ASSIGNMENT, operator, ImmutableList.of(expr(left), expr(right)));
  }

  /** {@code expression is type [designation]}. */
  public static TargetNode isPattern(
      TargetNode expression, TargetNode type, @Nullable String designation) {
    checkState(type.getToken() == TargetToken.TYPE, type);
    return TargetNode.create(
        TargetToken.IS_PATTERN, designation, ImmutableList.of(expr(expression), type));
  }

  public static TargetNode await(TargetNode expression) {
    return TargetNode.create(TargetToken.AWAIT, null, ImmutableList.of(expr(expression)));
  }

  public static TargetNode type(String text) {
    checkArgument(!text.isEmpty(), "empty type");
    return TargetNode.create(TargetToken.TYPE, text, ImmutableList.of());
  }

  public static TargetNode varType() {
    return type("var");
  }

  public static boolean isStatement(TargetNode n) {
    switch (n.getToken()) {
      case BLOCK:
      case LOCAL_DECLARATION:
      case EXPRESSION_STATEMENT:
      case IF:
      case WHILE:
      case FOR:
      case FOREACH:
      case SWITCH:
      case TRY:
      case THROW:
      case RETURN:
      case BREAK:
      case CONTINUE:
      case EMPTY:
        return true;
      default:
        return false;
    }
  }

  public static boolean isExpression(TargetNode n) {
    switch (n.getToken()) {
      case IDENTIFIER:
      case LITERAL:
      case MEMBER_ACCESS:
      case ELEMENT_ACCESS:
      case INVOCATION:
      case OBJECT_CREATION:
      case ARRAY_CREATION:
      case PARENTHESIZED:
      case PREFIX_UNARY:
      case POSTFIX_UNARY:
      case BINARY:
      case CONDITIONAL:
      case ASSIGNMENT:
      case IS_PATTERN:
      case AWAIT:
      case DEFAULT:
      case TYPE:
        return true;
      default:
        return false;
    }
  }

  private static TargetNode expr(TargetNode n) {
    checkState(isExpression(n), "expected an expression: %s", n.getToken());
    return n;
  }

  private static String quote(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 2);
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\0':
          sb.append("\\0");
          break;
        default:
          if (c < 0x20 || c == '\u2028' || c == '\u2029') {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.append('"').toString();
  }
}
