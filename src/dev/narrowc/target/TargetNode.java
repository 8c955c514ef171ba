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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * An immutable node of the lowered target syntax tree.
 *
 * <p>Nodes never change after construction, so one subtree may appear at several places of the
 * output (a narrowed read substituted at every use site, for instance). The meaning of {@link
 * #getText} depends on the token: the identifier of an IDENTIFIER, the source text of a LITERAL or
 * TYPE, the operator of a unary, binary or assignment node, the member name of a MEMBER_ACCESS,
 * the declared name of a LOCAL_DECLARATION, FOREACH or CATCH_CLAUSE, and the designation of an
 * IS_PATTERN.
 */
@AutoValue
public abstract class TargetNode {

  static TargetNode create(
      TargetToken token, @Nullable String text, ImmutableList<TargetNode> children) {
    return create(token, text, children, false);
  }

  static TargetNode create(
      TargetToken token,
      @Nullable String text,
      ImmutableList<TargetNode> children,
      boolean modifier) {
    return new AutoValue_TargetNode(token, text, children, modifier);
  }

  public abstract TargetToken getToken();

  public abstract @Nullable String getText();

  public abstract ImmutableList<TargetNode> getChildren();

  /** {@code ?.} on a MEMBER_ACCESS or ELEMENT_ACCESS, {@code await} on a FOREACH. */
  public abstract boolean hasModifier();

  public final TargetNode getChild(int index) {
    return getChildren().get(index);
  }

  public final TargetNode getFirstChild() {
    return getChildren().get(0);
  }

  public final TargetNode getLastChild() {
    return getChildren().get(getChildren().size() - 1);
  }

  public final int getChildCount() {
    return getChildren().size();
  }

  public final boolean isBlock() {
    return getToken() == TargetToken.BLOCK;
  }

  public final boolean isIdentifier() {
    return getToken() == TargetToken.IDENTIFIER;
  }

  public final boolean isEmpty() {
    return getToken() == TargetToken.EMPTY;
  }

  @Override
  public final String toString() {
    return TargetPrinter.print(this);
  }
}
