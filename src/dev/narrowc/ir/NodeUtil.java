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

package dev.narrowc.ir;

import org.jspecify.annotations.Nullable;

/** Static shape queries over IR nodes. */
public final class NodeUtil {

  private NodeUtil() {}

  /** Whether {@code n} is the literal {@code null} or the identifier {@code undefined}. */
  public static boolean isNullOrUndefined(Node n) {
    return n.isNull() || (n.isName() && n.getString().equals("undefined"));
  }

  public static boolean isEqualityOp(Token token) {
    switch (token) {
      case EQ:
      case NE:
      case SHEQ:
      case SHNE:
        return true;
      default:
        return false;
    }
  }

  /** Whether {@code token} is {@code !=} or {@code !==}. */
  public static boolean isInequalityOp(Token token) {
    return token == Token.NE || token == Token.SHNE;
  }

  /** Maps each equality operator to its logical negation. */
  public static Token negateEqualityOp(Token token) {
    switch (token) {
      case EQ:
        return Token.NE;
      case NE:
        return Token.EQ;
      case SHEQ:
        return Token.SHNE;
      case SHNE:
        return Token.SHEQ;
      default:
        throw new IllegalArgumentException("not an equality operator: " + token);
    }
  }

  public static boolean isAssignmentOp(Node n) {
    switch (n.getToken()) {
      case ASSIGN:
      case ASSIGN_ADD:
      case ASSIGN_SUB:
      case ASSIGN_MUL:
      case ASSIGN_DIV:
      case ASSIGN_MOD:
        return true;
      default:
        return false;
    }
  }

  /** Whether evaluating {@code n} as a statement is meaningful on its own. */
  public static boolean isStatementExpressionShape(Node n) {
    switch (n.getToken()) {
      case CALL:
      case NEW:
      case INC:
      case DEC:
      case AWAIT:
        return true;
      default:
        return isAssignmentOp(n);
    }
  }

  /** Whether the value of {@code n} is a boolean regardless of its operands' types. */
  public static boolean isBooleanResult(Node n) {
    switch (n.getToken()) {
      case TRUE:
      case FALSE:
      case NOT:
      case EQ:
      case NE:
      case SHEQ:
      case SHNE:
      case LT:
      case LE:
      case GT:
      case GE:
      case IN:
      case INSTANCEOF:
        return true;
      case AND:
      case OR:
        return isBooleanResult(n.getFirstChild()) && isBooleanResult(n.getLastChild());
      default:
        return false;
    }
  }

  /**
   * The key under which a read of {@code n} may be narrowed: {@code x} for a name, {@code a.b.c}
   * for a non-optional property chain rooted at a name or {@code this}, otherwise null.
   */
  public static @Nullable String getNarrowingKey(Node n) {
    switch (n.getToken()) {
      case NAME:
        return n.getString();
      case THIS:
        return "this";
      case GETPROP:
        if (n.isOptionalChain()) {
          return null;
        }
        String prefix = getNarrowingKey(n.getFirstChild());
        return prefix == null ? null : prefix + "." + n.getLastChild().getString();
      default:
        return null;
    }
  }

  /** The dotted name of a NAME or GETPROP chain, or null for any other shape. */
  public static @Nullable String getQualifiedName(Node n) {
    switch (n.getToken()) {
      case NAME:
        return n.getString();
      case GETPROP:
        String left = getQualifiedName(n.getFirstChild());
        return left == null ? null : left + "." + n.getLastChild().getString();
      default:
        return null;
    }
  }

  /** The argument list of a CALL or NEW, as the first argument node (or null). */
  public static @Nullable Node getFirstArgument(Node call) {
    return call.getSecondChild();
  }
}
