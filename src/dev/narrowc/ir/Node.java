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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import dev.narrowc.ir.types.IrType;
import java.io.Serializable;
import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * A node of the typed intermediate representation handed to the lowering engine.
 *
 * <p>The tree is a uniform {@link Token}-tagged structure; the child layout of each kind is fixed
 * by the {@link IR} factory methods. Type information computed upstream is carried on the node
 * itself: {@link #getInferredType} on expressions, {@link #getDeclaredType} on declared names and
 * {@link #getTypePredicate} on calls to user-defined type guards.
 */
public class Node implements Serializable {
  private static final long serialVersionUID = 1L;

  private final Token token;

  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node last;
  private @Nullable Node next;

  private @Nullable String str;
  private double number;

  private @Nullable IrType inferredType;
  private @Nullable IrType declaredType;
  private @Nullable TypePredicate typePredicate;

  private boolean optionalChain;
  private boolean postfix;
  private boolean asyncFunction;

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, Node child) {
    this(token);
    addChildToBack(child);
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(right);
  }

  public Node(Token token, Node... children) {
    this(token);
    for (Node child : children) {
      addChildToBack(child);
    }
  }

  public static Node newString(String str) {
    return newString(Token.STRING, str);
  }

  public static Node newString(Token token, String str) {
    Node n = new Node(token);
    n.str = checkNotNull(str);
    return n;
  }

  public static Node newNumber(double number) {
    Node n = new Node(Token.NUMBER);
    n.number = number;
    return n;
  }

  public final Token getToken() {
    return token;
  }

  public final boolean hasChildren() {
    return first != null;
  }

  public final boolean hasOneChild() {
    return first != null && first == last;
  }

  public final boolean hasTwoChildren() {
    return first != null && first.next != null && first.next == last;
  }

  public final Node getOnlyChild() {
    checkState(hasOneChild(), this);
    return first;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public final @Nullable Node getLastChild() {
    return last;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   *
   * @param i The index
   * @return The ith child, or null if there are not that many children
   */
  public final @Nullable Node getChildAtIndex(int i) {
    Node n = first;
    while (n != null && i > 0) {
      n = n.next;
      i--;
    }
    return n;
  }

  public final int getChildCount() {
    int count = 0;
    for (Node n = first; n != null; n = n.next) {
      count++;
    }
    return count;
  }

  public final void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    checkArgument(child.next == null);
    if (first == null) {
      first = child;
    } else {
      last.next = child;
    }
    last = child;
    child.parent = this;
  }

  /**
   * <p>Return an iterable object that iterates over this node's children. The iterator does not
   * support the optional operation {@link Iterator#remove()}.
   */
  public final Iterable<Node> children() {
    if (first == null) {
      return Collections.emptySet();
    }
    Node start = first;
    return () -> new SiblingNodeIterator(start);
  }

  private static final class SiblingNodeIterator implements Iterator<Node> {
    private @Nullable Node current;

    SiblingNodeIterator(Node start) {
      this.current = start;
    }

    @Override
    public boolean hasNext() {
      return current != null;
    }

    @Override
    public Node next() {
      if (current == null) {
        throw new NoSuchElementException();
      }
      Node n = current;
      current = current.getNext();
      return n;
    }
  }

  // ==========================================================================
  // Payloads

  /** The identifier of a NAME, the value of a STRING, or the name of a declaration. */
  public final String getString() {
    checkState(str != null, "%s has no string payload", token);
    return str;
  }

  public final boolean hasString() {
    return str != null;
  }

  public final double getDouble() {
    checkState(token == Token.NUMBER, "%s is not a number", token);
    return number;
  }

  public final @Nullable IrType getInferredType() {
    return inferredType;
  }

  @CanIgnoreReturnValue
  public final Node setInferredType(@Nullable IrType type) {
    this.inferredType = type;
    return this;
  }

  /** The type annotation written on a declared name or a parameter, if any. */
  public final @Nullable IrType getDeclaredType() {
    return declaredType;
  }

  @CanIgnoreReturnValue
  public final Node setDeclaredType(@Nullable IrType type) {
    this.declaredType = type;
    return this;
  }

  public final @Nullable TypePredicate getTypePredicate() {
    return typePredicate;
  }

  @CanIgnoreReturnValue
  public final Node setTypePredicate(@Nullable TypePredicate predicate) {
    checkState(token == Token.CALL, "type predicates are only attached to calls: %s", token);
    this.typePredicate = predicate;
    return this;
  }

  /** Whether a GETPROP, GETELEM or CALL was written with {@code ?.}. */
  public final boolean isOptionalChain() {
    return optionalChain;
  }

  @CanIgnoreReturnValue
  public final Node setIsOptionalChain(boolean value) {
    this.optionalChain = value;
    return this;
  }

  /** Whether an INC or DEC is written after its operand. */
  public final boolean isPostfix() {
    return postfix;
  }

  @CanIgnoreReturnValue
  public final Node setPostfix(boolean value) {
    checkState(token == Token.INC || token == Token.DEC, token);
    this.postfix = value;
    return this;
  }

  public final boolean isAsyncFunction() {
    return asyncFunction;
  }

  @CanIgnoreReturnValue
  public final Node setIsAsyncFunction(boolean value) {
    checkState(token == Token.FUNCTION, token);
    this.asyncFunction = value;
    return this;
  }

  /** Returns a detached deep copy of this subtree, payloads and types included. */
  public final Node cloneTree() {
    Node copy = cloneNode();
    for (Node child = first; child != null; child = child.next) {
      copy.addChildToBack(child.cloneTree());
    }
    return copy;
  }

  /** Returns a detached copy of this node without its children. */
  public final Node cloneNode() {
    Node copy = new Node(token);
    copy.str = str;
    copy.number = number;
    copy.inferredType = inferredType;
    copy.declaredType = declaredType;
    copy.typePredicate = typePredicate;
    copy.optionalChain = optionalChain;
    copy.postfix = postfix;
    copy.asyncFunction = asyncFunction;
    return copy;
  }

  // ==========================================================================
  // Token predicates

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public final boolean isExprResult() {
    return token == Token.EXPR_RESULT;
  }

  public final boolean isVar() {
    return token == Token.VAR;
  }

  public final boolean isLet() {
    return token == Token.LET;
  }

  public final boolean isConst() {
    return token == Token.CONST;
  }

  /** Whether this is a VAR, LET or CONST declaration. */
  public final boolean isNameDeclaration() {
    return token == Token.VAR || token == Token.LET || token == Token.CONST;
  }

  public final boolean isIf() {
    return token == Token.IF;
  }

  public final boolean isReturn() {
    return token == Token.RETURN;
  }

  public final boolean isThrow() {
    return token == Token.THROW;
  }

  public final boolean isCase() {
    return token == Token.CASE;
  }

  public final boolean isDefaultCase() {
    return token == Token.DEFAULT_CASE;
  }

  public final boolean isCatch() {
    return token == Token.CATCH;
  }

  public final boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public final boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public final boolean isDestructuringPattern() {
    return token == Token.ARRAY_PATTERN || token == Token.OBJECT_PATTERN;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isThis() {
    return token == Token.THIS;
  }

  public final boolean isString() {
    return token == Token.STRING;
  }

  public final boolean isNumber() {
    return token == Token.NUMBER;
  }

  public final boolean isNull() {
    return token == Token.NULL;
  }

  public final boolean isGetProp() {
    return token == Token.GETPROP;
  }

  public final boolean isGetElem() {
    return token == Token.GETELEM;
  }

  public final boolean isCall() {
    return token == Token.CALL;
  }

  public final boolean isNew() {
    return token == Token.NEW;
  }

  public final boolean isNot() {
    return token == Token.NOT;
  }

  public final boolean isVoid() {
    return token == Token.VOID;
  }

  public final boolean isAnd() {
    return token == Token.AND;
  }

  public final boolean isOr() {
    return token == Token.OR;
  }

  public final boolean isIn() {
    return token == Token.IN;
  }

  public final boolean isInstanceOf() {
    return token == Token.INSTANCEOF;
  }

  public final boolean isHook() {
    return token == Token.HOOK;
  }

  public final boolean isAssign() {
    return token == Token.ASSIGN;
  }

  public final boolean isSpread() {
    return token == Token.SPREAD;
  }

  public final boolean isAwait() {
    return token == Token.AWAIT;
  }

  // ==========================================================================
  // Debugging

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (str != null) {
      sb.append(' ').append(str);
    } else if (token == Token.NUMBER) {
      sb.append(' ').append(number);
    }
    if (inferredType != null) {
      sb.append(" : ").append(inferredType);
    }
    return sb.toString();
  }

  /** A multi-line dump of the subtree, one node per line. */
  public final String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int level) {
    for (int i = 0; i < level; i++) {
      sb.append("    ");
    }
    sb.append(this).append('\n');
    for (Node child = first; child != null; child = child.next) {
      child.appendStringTree(sb, level + 1);
    }
  }
}
