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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeUtilTest {

  @Test
  public void testIsNullOrUndefined() {
    assertThat(NodeUtil.isNullOrUndefined(IR.nullNode())).isTrue();
    assertThat(NodeUtil.isNullOrUndefined(IR.name("undefined"))).isTrue();
    assertThat(NodeUtil.isNullOrUndefined(IR.name("nil"))).isFalse();
    assertThat(NodeUtil.isNullOrUndefined(IR.string("undefined"))).isFalse();
  }

  @Test
  public void testEqualityOperators() {
    assertThat(NodeUtil.isEqualityOp(Token.SHEQ)).isTrue();
    assertThat(NodeUtil.isEqualityOp(Token.LT)).isFalse();
    assertThat(NodeUtil.isInequalityOp(Token.NE)).isTrue();
    assertThat(NodeUtil.isInequalityOp(Token.EQ)).isFalse();
    assertThat(NodeUtil.negateEqualityOp(Token.SHEQ)).isEqualTo(Token.SHNE);
    assertThat(NodeUtil.negateEqualityOp(Token.NE)).isEqualTo(Token.EQ);
    assertThrows(IllegalArgumentException.class, () -> NodeUtil.negateEqualityOp(Token.LT));
  }

  @Test
  public void testIsBooleanResult() {
    assertThat(NodeUtil.isBooleanResult(IR.not(IR.name("x")))).isTrue();
    assertThat(NodeUtil.isBooleanResult(IR.in(IR.string("k"), IR.name("o")))).isTrue();
    assertThat(NodeUtil.isBooleanResult(IR.and(IR.trueNode(), IR.lt(IR.name("a"), IR.name("b")))))
        .isTrue();
    assertThat(NodeUtil.isBooleanResult(IR.and(IR.trueNode(), IR.name("x")))).isFalse();
    assertThat(NodeUtil.isBooleanResult(IR.name("x"))).isFalse();
  }

  @Test
  public void testNarrowingKey() {
    assertThat(NodeUtil.getNarrowingKey(IR.name("x"))).isEqualTo("x");
    assertThat(NodeUtil.getNarrowingKey(IR.getprop(IR.thisNode(), "a", "b")))
        .isEqualTo("this.a.b");
    assertThat(NodeUtil.getNarrowingKey(IR.getprop(IR.name("o"), "a").setIsOptionalChain(true)))
        .isNull();
    assertThat(NodeUtil.getNarrowingKey(IR.getelem(IR.name("o"), IR.number(0)))).isNull();
    assertThat(NodeUtil.getNarrowingKey(IR.getprop(IR.call(IR.name("f")), "a"))).isNull();
  }

  @Test
  public void testQualifiedName() {
    assertThat(NodeUtil.getQualifiedName(IR.getprop(IR.name("geo"), "Circle")))
        .isEqualTo("geo.Circle");
    assertThat(NodeUtil.getQualifiedName(IR.getprop(IR.thisNode(), "x"))).isNull();
  }

  @Test
  public void testStatementExpressionShape() {
    assertThat(NodeUtil.isStatementExpressionShape(IR.call(IR.name("f")))).isTrue();
    assertThat(NodeUtil.isStatementExpressionShape(IR.assign(IR.name("a"), IR.number(1))))
        .isTrue();
    assertThat(NodeUtil.isStatementExpressionShape(IR.add(IR.name("a"), IR.number(1))))
        .isFalse();
  }
}
