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

import com.google.common.collect.ImmutableMap;
import java.util.List;

/**
 * Prints a target syntax tree as compact single-line source text.
 *
 * <p>Statements are separated by single spaces and blocks print as {@code { a b }}. Parentheses are
 * inserted only where operator precedence requires them; explicit PARENTHESIZED nodes are always
 * kept.
 */
public final class TargetPrinter {

  private static final int PRIMARY = 16;
  private static final int UNARY = 15;
  private static final int RELATIONAL = 11;
  private static final int CONDITIONAL = 3;
  private static final int ASSIGNMENT = 2;

  private static final ImmutableMap<String, Integer> BINARY_PRECEDENCE =
      ImmutableMap.<String, Integer>builder()
          .put("*", 14)
          .put("/", 14)
          .put("%", 14)
          .put("+", 13)
          .put("-", 13)
          .put("<<", 12)
          .put(">>", 12)
          .put(">>>", 12)
          .put("<", RELATIONAL)
          .put(">", RELATIONAL)
          .put("<=", RELATIONAL)
          .put(">=", RELATIONAL)
          .put("as", RELATIONAL)
          .put("==", 10)
          .put("!=", 10)
          .put("&", 9)
          .put("^", 8)
          .put("|", 7)
          .put("&&", 6)
          .put("||", 5)
          .put("??", 4)
          .buildOrThrow();

  private final StringBuilder sb = new StringBuilder();

  private TargetPrinter() {}

  public static String print(TargetNode n) {
    TargetPrinter printer = new TargetPrinter();
    if (TargetIR.isStatement(n)) {
      printer.statement(n);
    } else {
      printer.expression(n, 0);
    }
    return printer.sb.toString();
  }

  /** Prints a statement list the way a block body prints, without the braces. */
  public static String print(List<TargetNode> statements) {
    TargetPrinter printer = new TargetPrinter();
    printer.statements(statements);
    return printer.sb.toString();
  }

  /** The binding power of a binary operator, or 0 when it is not a binary operator. */
  static int binaryPrecedence(String operator) {
    Integer precedence = BINARY_PRECEDENCE.get(operator);
    return precedence == null ? 0 : precedence;
  }

  private void statements(List<TargetNode> statements) {
    for (int i = 0; i < statements.size(); i++) {
      if (i > 0) {
        sb.append(' ');
      }
      statement(statements.get(i));
    }
  }

  private void statement(TargetNode n) {
    List<TargetNode> children = n.getChildren();
    switch (n.getToken()) {
      case BLOCK:
        if (children.isEmpty()) {
          sb.append("{ }");
        } else {
          sb.append("{ ");
          statements(children);
          sb.append(" }");
        }
        break;
      case LOCAL_DECLARATION:
        localDeclaration(n);
        sb.append(';');
        break;
      case EXPRESSION_STATEMENT:
        expression(n.getFirstChild(), 0);
        sb.append(';');
        break;
      case IF:
        sb.append("if (");
        expression(n.getChild(0), 0);
        sb.append(") ");
        statement(n.getChild(1));
        if (children.size() > 2) {
          sb.append(" else ");
          statement(n.getChild(2));
        }
        break;
      case WHILE:
        sb.append("while (");
        expression(n.getChild(0), 0);
        sb.append(") ");
        statement(n.getChild(1));
        break;
      case FOR:
        forStatement(n);
        break;
      case FOREACH:
        if (n.hasModifier()) {
          sb.append("await ");
        }
        sb.append("foreach (");
        type(n.getChild(0));
        sb.append(' ').append(n.getText()).append(" in ");
        expression(n.getChild(1), 0);
        sb.append(") ");
        statement(n.getChild(2));
        break;
      case SWITCH:
        sb.append("switch (");
        expression(n.getChild(0), 0);
        sb.append(") {");
        for (TargetNode section : children.subList(1, children.size())) {
          sb.append(' ');
          switchSection(section);
        }
        sb.append(" }");
        break;
      case TRY:
        sb.append("try ");
        statement(n.getChild(0));
        for (TargetNode clause : children.subList(1, children.size())) {
          sb.append(' ');
          tryClause(clause);
        }
        break;
      case THROW:
        keywordWithOptionalExpression("throw", n);
        break;
      case RETURN:
        keywordWithOptionalExpression("return", n);
        break;
      case BREAK:
        sb.append("break;");
        break;
      case CONTINUE:
        sb.append("continue;");
        break;
      case EMPTY:
        sb.append(';');
        break;
      default:
        throw new IllegalStateException("not a statement: " + n.getToken());
    }
  }

  private void localDeclaration(TargetNode n) {
    type(n.getChild(0));
    sb.append(' ').append(n.getText());
    if (n.getChildCount() > 1) {
      sb.append(" = ");
      expression(n.getChild(1), ASSIGNMENT);
    }
  }

  private void forStatement(TargetNode n) {
    sb.append("for (");
    TargetNode init = n.getChild(0);
    if (init.getToken() == TargetToken.LOCAL_DECLARATION) {
      localDeclaration(init);
    } else if (init.getToken() == TargetToken.EXPRESSION_STATEMENT) {
      expression(init.getFirstChild(), 0);
    }
    sb.append(';');
    TargetNode cond = n.getChild(1);
    if (!cond.isEmpty()) {
      sb.append(' ');
      expression(cond, 0);
    }
    sb.append(';');
    List<TargetNode> iterators = n.getChildren().subList(3, n.getChildCount());
    for (int i = 0; i < iterators.size(); i++) {
      sb.append(i == 0 ? " " : ", ");
      expression(iterators.get(i), 0);
    }
    sb.append(") ");
    statement(n.getChild(2));
  }

  private void switchSection(TargetNode section) {
    boolean first = true;
    for (TargetNode child : section.getChildren()) {
      if (!first) {
        sb.append(' ');
      }
      first = false;
      if (child.getToken() == TargetToken.CASE_LABEL) {
        sb.append("case ");
        expression(child.getFirstChild(), 0);
        sb.append(':');
      } else if (child.getToken() == TargetToken.DEFAULT_LABEL) {
        sb.append("default:");
      } else {
        statement(child);
      }
    }
  }

  private void tryClause(TargetNode clause) {
    if (clause.getToken() == TargetToken.FINALLY_CLAUSE) {
      sb.append("finally ");
      statement(clause.getFirstChild());
      return;
    }
    sb.append("catch ");
    if (clause.getChildCount() > 1) {
      sb.append('(');
      type(clause.getChild(0));
      if (clause.getText() != null) {
        sb.append(' ').append(clause.getText());
      }
      sb.append(") ");
    }
    statement(clause.getLastChild());
  }

  private void keywordWithOptionalExpression(String keyword, TargetNode n) {
    sb.append(keyword);
    if (n.getChildCount() > 0) {
      sb.append(' ');
      expression(n.getFirstChild(), 0);
    }
    sb.append(';');
  }

  private void type(TargetNode n) {
    sb.append(n.getText());
  }

  private static int precedence(TargetNode n) {
    switch (n.getToken()) {
      case PREFIX_UNARY:
      case AWAIT:
        return UNARY;
      case BINARY:
        return binaryPrecedence(n.getText());
      case IS_PATTERN:
        return RELATIONAL;
      case CONDITIONAL:
        return CONDITIONAL;
      case ASSIGNMENT:
        return ASSIGNMENT;
      default:
        return PRIMARY;
    }
  }

  private void expression(TargetNode n, int minPrecedence) {
    boolean parens = precedence(n) < minPrecedence;
    if (parens) {
      sb.append('(');
    }
    switch (n.getToken()) {
      case IDENTIFIER:
      case LITERAL:
      case TYPE:
        sb.append(n.getText());
        break;
      case DEFAULT:
        sb.append("default");
        break;
      case MEMBER_ACCESS:
        expression(n.getFirstChild(), PRIMARY);
        sb.append(n.hasModifier() ? "?." : ".").append(n.getText());
        break;
      case ELEMENT_ACCESS:
        expression(n.getChild(0), PRIMARY);
        sb.append(n.hasModifier() ? "?[" : "[");
        expression(n.getChild(1), 0);
        sb.append(']');
        break;
      case INVOCATION:
        expression(n.getChild(0), PRIMARY);
        sb.append('(');
        commaSeparated(n.getChildren().subList(1, n.getChildCount()));
        sb.append(')');
        break;
      case OBJECT_CREATION:
        sb.append("new ");
        type(n.getChild(0));
        sb.append('(');
        commaSeparated(n.getChildren().subList(1, n.getChildCount()));
        sb.append(')');
        break;
      case ARRAY_CREATION:
        sb.append("new ");
        type(n.getChild(0));
        if (n.getChildCount() == 1) {
          sb.append("[0]");
        } else {
          sb.append("[] { ");
          commaSeparated(n.getChildren().subList(1, n.getChildCount()));
          sb.append(" }");
        }
        break;
      case PARENTHESIZED:
        sb.append('(');
        expression(n.getFirstChild(), 0);
        sb.append(')');
        break;
      case PREFIX_UNARY:
        sb.append(n.getText());
        expression(n.getFirstChild(), UNARY);
        break;
      case POSTFIX_UNARY:
        expression(n.getFirstChild(), PRIMARY);
        sb.append(n.getText());
        break;
      case AWAIT:
        sb.append("await ");
        expression(n.getFirstChild(), UNARY);
        break;
      case BINARY:
        binary(n);
        break;
      case IS_PATTERN:
        expression(n.getChild(0), RELATIONAL);
        sb.append(" is ");
        type(n.getChild(1));
        if (n.getText() != null) {
          sb.append(' ').append(n.getText());
        }
        break;
      case CONDITIONAL:
        expression(n.getChild(0), CONDITIONAL + 1);
        sb.append(" ? ");
        expression(n.getChild(1), CONDITIONAL);
        sb.append(" : ");
        expression(n.getChild(2), CONDITIONAL);
        break;
      case ASSIGNMENT:
        expression(n.getChild(0), UNARY);
        sb.append(' ').append(n.getText()).append(' ');
        expression(n.getChild(1), ASSIGNMENT);
        break;
      default:
        throw new IllegalStateException("not an expression: " + n.getToken());
    }
    if (parens) {
      sb.append(')');
    }
  }

  private void binary(TargetNode n) {
    String op = n.getText();
    int p = binaryPrecedence(op);
    boolean rightAssociative = op.equals("??");
    expression(n.getChild(0), rightAssociative ? p + 1 : p);
    sb.append(' ').append(op).append(' ');
    expression(n.getChild(1), rightAssociative ? p : p + 1);
  }

  private void commaSeparated(List<TargetNode> nodes) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      expression(nodes.get(i), ASSIGNMENT);
    }
  }
}
