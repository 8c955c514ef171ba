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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.List;

/** An AST construction helper class. Each factory checks the child layout it produces. */
public class IR {

  private IR() {}

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  public static Node function(Node name, Node params, Node body) {
    checkState(name.isName());
    checkState(params.isParamList());
    checkState(body.isBlock());
    return new Node(Token.FUNCTION, name, params, body);
  }

  public static Node paramList(Node... params) {
    Node paramList = new Node(Token.PARAM_LIST);
    for (Node param : params) {
      checkState(param.isName(), param);
      paramList.addChildToBack(param);
    }
    return paramList;
  }

  public static Node block() {
    return new Node(Token.BLOCK);
  }

  public static Node block(Node... stmts) {
    Node block = block();
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node block(List<Node> stmts) {
    return block(stmts.toArray(new Node[0]));
  }

  public static Node var(Node lhs) {
    return declaration(Token.VAR, lhs);
  }

  public static Node var(Node lhs, Node value) {
    return declaration(Token.VAR, lhs, value);
  }

  public static Node let(Node lhs) {
    return declaration(Token.LET, lhs);
  }

  public static Node let(Node lhs, Node value) {
    return declaration(Token.LET, lhs, value);
  }

  public static Node constNode(Node lhs, Node value) {
    return declaration(Token.CONST, lhs, value);
  }

  /** A single-declarator VAR, LET or CONST. The initializer, if any, hangs off the target. */
  public static Node declaration(Token type, Node lhs, Node value) {
    checkState(mayBeExpression(value), value);
    Node decl = declaration(type, lhs);
    lhs.addChildToBack(value);
    return decl;
  }

  public static Node declaration(Token type, Node lhs) {
    checkState(
        type == Token.VAR || type == Token.LET || type == Token.CONST, "Invalid type: %s", type);
    checkState(lhs.isName() || lhs.isDestructuringPattern(), lhs);
    return new Node(type, lhs);
  }

  /** A multi-declarator VAR, LET or CONST: {@code let a = 1, b = 2}. */
  public static Node multiDeclaration(Token type, Node... lhs) {
    checkArgument(lhs.length > 0);
    Node decl = declaration(type, lhs[0]);
    for (int i = 1; i < lhs.length; i++) {
      checkState(lhs[i].isName() || lhs[i].isDestructuringPattern(), lhs[i]);
      decl.addChildToBack(lhs[i]);
    }
    return decl;
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.RETURN, expr);
  }

  public static Node throwNode(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.THROW, expr);
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node ifNode(Node cond, Node then) {
    checkState(mayBeExpression(cond));
    checkState(mayBeStatement(then));
    return new Node(Token.IF, cond, then);
  }

  public static Node ifNode(Node cond, Node then, Node elseNode) {
    checkState(mayBeExpression(cond));
    checkState(mayBeStatement(then));
    checkState(mayBeStatement(elseNode));
    return new Node(Token.IF, cond, then, elseNode);
  }

  public static Node whileNode(Node cond, Node body) {
    checkState(mayBeExpression(cond));
    checkState(mayBeStatement(body));
    return new Node(Token.WHILE, cond, body);
  }

  /** {@code for (init; cond; incr) body}; absent clauses are EMPTY nodes. */
  public static Node forNode(Node init, Node cond, Node incr, Node body) {
    checkState(init.isNameDeclaration() || mayBeExpressionOrEmpty(init), init);
    checkState(mayBeExpressionOrEmpty(cond));
    checkState(mayBeExpressionOrEmpty(incr));
    checkState(mayBeStatement(body));
    return new Node(Token.FOR, init, cond, incr, body);
  }

  public static Node forOf(Node target, Node iterable, Node body) {
    return forLoop(Token.FOR_OF, target, iterable, body);
  }

  public static Node forAwaitOf(Node target, Node iterable, Node body) {
    return forLoop(Token.FOR_AWAIT_OF, target, iterable, body);
  }

  public static Node forIn(Node target, Node object, Node body) {
    return forLoop(Token.FOR_IN, target, object, body);
  }

  private static Node forLoop(Token token, Node target, Node subject, Node body) {
    checkState(
        target.isNameDeclaration() || target.isName() || target.isDestructuringPattern(), target);
    checkState(mayBeExpression(subject));
    checkState(mayBeStatement(body));
    return new Node(token, target, subject, body);
  }

  public static Node switchNode(Node cond, Node... cases) {
    checkState(mayBeExpression(cond));
    Node switchNode = new Node(Token.SWITCH, cond);
    for (Node caseNode : cases) {
      checkState(caseNode.isCase() || caseNode.isDefaultCase());
      switchNode.addChildToBack(caseNode);
    }
    return switchNode;
  }

  public static Node caseNode(Node expr, Node body) {
    checkState(mayBeExpression(expr));
    checkState(body.isBlock());
    return new Node(Token.CASE, expr, body);
  }

  public static Node defaultCase(Node body) {
    checkState(body.isBlock());
    return new Node(Token.DEFAULT_CASE, body);
  }

  /** TRY(BLOCK, BLOCK of zero or one CATCH, [finally BLOCK]). */
  public static Node tryCatch(Node tryBody, Node catchNode) {
    checkState(tryBody.isBlock());
    checkState(catchNode.isCatch());
    return new Node(Token.TRY, tryBody, new Node(Token.BLOCK, catchNode));
  }

  public static Node tryFinally(Node tryBody, Node finallyBody) {
    checkState(tryBody.isBlock());
    checkState(finallyBody.isBlock());
    return new Node(Token.TRY, tryBody, block(), finallyBody);
  }

  public static Node tryCatchFinally(Node tryBody, Node catchNode, Node finallyBody) {
    checkState(finallyBody.isBlock());
    Node tryNode = tryCatch(tryBody, catchNode);
    tryNode.addChildToBack(finallyBody);
    return tryNode;
  }

  /** A catch clause; {@code param} is a NAME, a pattern, or EMPTY for {@code catch {}}. */
  public static Node catchNode(Node param, Node body) {
    checkState(param.isName() || param.isEmpty() || param.isDestructuringPattern());
    checkState(body.isBlock());
    return new Node(Token.CATCH, param, body);
  }

  public static Node breakNode() {
    return new Node(Token.BREAK);
  }

  public static Node continueNode() {
    return new Node(Token.CONTINUE);
  }

  public static Node yieldNode(Node expr) {
    return new Node(Token.YIELD, expr);
  }

  // Expressions

  public static Node name(String name) {
    checkState(name.indexOf('.') == -1, "Invalid name '%s'. Did you mean to use NodeUtil?", name);
    return Node.newString(Token.NAME, name);
  }

  public static Node string(String s) {
    return Node.newString(s);
  }

  public static Node number(double d) {
    return Node.newNumber(d);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node nullNode() {
    return new Node(Token.NULL);
  }

  public static Node thisNode() {
    return new Node(Token.THIS);
  }

  public static Node superNode() {
    return new Node(Token.SUPER);
  }

  public static Node getprop(Node target, String prop, String... moreProps) {
    checkState(mayBeExpression(target));
    Node result = new Node(Token.GETPROP, target, string(prop));
    for (String moreProp : moreProps) {
      result = new Node(Token.GETPROP, result, string(moreProp));
    }
    return result;
  }

  public static Node getelem(Node target, Node elem) {
    checkState(mayBeExpression(target));
    checkState(mayBeExpression(elem));
    return new Node(Token.GETELEM, target, elem);
  }

  public static Node call(Node target, Node... args) {
    checkState(mayBeExpression(target));
    Node call = new Node(Token.CALL, target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg) || arg.isSpread(), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node newNode(Node target, Node... args) {
    checkState(mayBeExpression(target));
    Node newcall = new Node(Token.NEW, target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg) || arg.isSpread(), arg);
      newcall.addChildToBack(arg);
    }
    return newcall;
  }

  public static Node not(Node expr) {
    return unaryOp(Token.NOT, expr);
  }

  public static Node neg(Node expr) {
    return unaryOp(Token.NEG, expr);
  }

  public static Node typeof(Node expr) {
    return unaryOp(Token.TYPEOF, expr);
  }

  public static Node voidNode(Node expr) {
    return unaryOp(Token.VOID, expr);
  }

  public static Node await(Node expr) {
    return unaryOp(Token.AWAIT, expr);
  }

  public static Node spread(Node expr) {
    return unaryOp(Token.SPREAD, expr);
  }

  public static Node inc(Node exp, boolean isPostfix) {
    checkState(exp.isName() || exp.isGetProp() || exp.isGetElem(), exp);
    return unaryOp(Token.INC, exp).setPostfix(isPostfix);
  }

  public static Node dec(Node exp, boolean isPostfix) {
    checkState(exp.isName() || exp.isGetProp() || exp.isGetElem(), exp);
    return unaryOp(Token.DEC, exp).setPostfix(isPostfix);
  }

  public static Node unaryOp(Token token, Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(token, expr);
  }

  public static Node and(Node expr1, Node expr2) {
    return binaryOp(Token.AND, expr1, expr2);
  }

  public static Node or(Node expr1, Node expr2) {
    return binaryOp(Token.OR, expr1, expr2);
  }

  public static Node coalesce(Node expr1, Node expr2) {
    return binaryOp(Token.COALESCE, expr1, expr2);
  }

  public static Node hook(Node cond, Node expr1, Node expr2) {
    checkState(mayBeExpression(cond));
    checkState(mayBeExpression(expr1));
    checkState(mayBeExpression(expr2));
    return new Node(Token.HOOK, cond, expr1, expr2);
  }

  public static Node eq(Node expr1, Node expr2) {
    return binaryOp(Token.EQ, expr1, expr2);
  }

  public static Node ne(Node expr1, Node expr2) {
    return binaryOp(Token.NE, expr1, expr2);
  }

  public static Node sheq(Node expr1, Node expr2) {
    return binaryOp(Token.SHEQ, expr1, expr2);
  }

  public static Node shne(Node expr1, Node expr2) {
    return binaryOp(Token.SHNE, expr1, expr2);
  }

  public static Node lt(Node expr1, Node expr2) {
    return binaryOp(Token.LT, expr1, expr2);
  }

  public static Node add(Node expr1, Node expr2) {
    return binaryOp(Token.ADD, expr1, expr2);
  }

  public static Node in(Node expr1, Node expr2) {
    return binaryOp(Token.IN, expr1, expr2);
  }

  public static Node instanceOf(Node expr1, Node expr2) {
    return binaryOp(Token.INSTANCEOF, expr1, expr2);
  }

  public static Node assign(Node target, Node expr) {
    return binaryOp(Token.ASSIGN, target, expr);
  }

  public static Node binaryOp(Token token, Node expr1, Node expr2) {
    checkState(mayBeExpression(expr1), expr1);
    checkState(mayBeExpression(expr2), expr2);
    return new Node(token, expr1, expr2);
  }

  public static Node arraylit(Node... exprs) {
    Node arraylit = new Node(Token.ARRAYLIT);
    for (Node expr : exprs) {
      checkState(mayBeExpression(expr) || expr.isSpread(), expr);
      arraylit.addChildToBack(expr);
    }
    return arraylit;
  }

  public static Node objectlit() {
    return new Node(Token.OBJECTLIT);
  }

  public static Node arrayPattern(Node... targets) {
    Node pattern = new Node(Token.ARRAY_PATTERN);
    for (Node target : targets) {
      pattern.addChildToBack(target);
    }
    return pattern;
  }

  public static Node objectPattern(Node... targets) {
    Node pattern = new Node(Token.OBJECT_PATTERN);
    for (Node target : targets) {
      pattern.addChildToBack(target);
    }
    return pattern;
  }

  /**
   * It isn't possible to always determine if a detached node is a expression, so make a best guess.
   */
  public static boolean mayBeStatement(Node n) {
    switch (n.getToken()) {
      case EMPTY:
      case FUNCTION:
        // EMPTY and FUNCTION are used both in expression and statement
        // contexts
        return true;

      case BLOCK:
      case BREAK:
      case CLASS:
      case CONST:
      case CONTINUE:
      case ENUM:
      case EXPR_RESULT:
      case FOR:
      case FOR_IN:
      case FOR_OF:
      case FOR_AWAIT_OF:
      case IF:
      case INTERFACE:
      case LET:
      case RETURN:
      case SWITCH:
      case THROW:
      case TRY:
      case TYPE_ALIAS:
      case VAR:
      case WHILE:
      case YIELD:
        return true;

      default:
        return false;
    }
  }

  /**
   * It isn't possible to always determine if a detached node is a expression, so make a best guess.
   */
  public static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case FUNCTION:
      case CLASS:
        // FUNCTION and CLASS are used both in expression and statement
        // contexts.
        return true;

      case BLOCK:
      case BREAK:
      case CASE:
      case CATCH:
      case CONST:
      case CONTINUE:
      case DEFAULT_CASE:
      case EMPTY:
      case ENUM:
      case EXPR_RESULT:
      case FOR:
      case FOR_IN:
      case FOR_OF:
      case FOR_AWAIT_OF:
      case IF:
      case INTERFACE:
      case LET:
      case PARAM_LIST:
      case RETURN:
      case SPREAD:
      case SWITCH:
      case THROW:
      case TRY:
      case TYPE_ALIAS:
      case VAR:
      case WHILE:
      case YIELD:
      case ARRAY_PATTERN:
      case OBJECT_PATTERN:
        return false;

      default:
        return true;
    }
  }

  private static boolean mayBeExpressionOrEmpty(Node n) {
    return n.isEmpty() || mayBeExpression(n);
  }
}
