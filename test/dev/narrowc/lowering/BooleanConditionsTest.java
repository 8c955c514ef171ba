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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import dev.narrowc.ir.IR;
import dev.narrowc.ir.Node;
import dev.narrowc.ir.types.IrType;
import dev.narrowc.ir.types.Types;
import dev.narrowc.target.TargetPrinter;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class BooleanConditionsTest extends LoweringTestCase {

  private static final IrType DATE = Types.clrRef("DateTime", "System.DateTime");

  private void testCondition(String expected, Node condition) {
    assertThat(TargetPrinter.print(BooleanConditions.lowerCondition(condition, context())))
        .isEqualTo(expected);
  }

  @Test
  public void testBooleanIsUnchanged() {
    testCondition("ready", name("ready", Types.BOOLEAN));
    testCondition("a < b", IR.lt(name("a", Types.NUMBER), name("b", Types.NUMBER)));
  }

  @Test
  public void testOptionalBooleanComparesWithTrue() {
    testCondition("b == true", name("b", Types.optional(Types.BOOLEAN)));
  }

  @Test
  public void testString() {
    testCondition("!string.IsNullOrEmpty(s)", name("s", Types.STRING));
    testCondition("!string.IsNullOrEmpty(s)", name("s", Types.optional(Types.STRING)));
    testCondition("!string.IsNullOrEmpty(k)", name("k", Types.literal("circle")));
  }

  @Test
  public void testNumber() {
    testCondition("n != 0", name("n", Types.NUMBER));
    testCondition("i != 0", name("i", Types.INT));
  }

  @Test
  public void testOptionalNumberDefaultsToZero() {
    testCondition("(n ?? 0) != 0", name("n", Types.optional(Types.NUMBER)));
  }

  @Test
  public void testReferenceComparesWithNull() {
    testCondition("o != null", name("o", CAT));
    testCondition("xs != null", name("xs", Types.array(Types.STRING)));
    testCondition("m != null", name("m", Types.dictionary(Types.STRING, Types.NUMBER)));
    testCondition("p != null", name("p", Types.object(Types.prop("x", Types.NUMBER))));
  }

  @Test
  public void testUnionUsesRuntimeTruthiness() {
    testCondition("global::Narrowc.Runtime.Operators.IsTruthy(pet)", name("pet", PET));
  }

  @Test
  public void testUntypedUsesRuntimeTruthiness() {
    testCondition("global::Narrowc.Runtime.Operators.IsTruthy(u)", IR.name("u"));
    testCondition("global::Narrowc.Runtime.Operators.IsTruthy(a)", name("a", Types.ANY));
  }

  @Test
  public void testValueTypeStruct() {
    testCondition("global::Narrowc.Runtime.Operators.IsTruthy(d)", name("d", DATE));
    testCondition("d != null", name("d", Types.optional(DATE)));
  }

  @Test
  public void testExtraValueTypes() {
    options.setExtraValueTypes(ImmutableSet.of("Geo.Point"));
    testCondition(
        "global::Narrowc.Runtime.Operators.IsTruthy(p)",
        name("p", Types.clrRef("Point", "global::Geo.Point")));
  }

  @Test
  public void testOrConvertsEachOperand() {
    testCondition(
        "!string.IsNullOrEmpty(a) || n != 0",
        IR.or(name("a", Types.STRING), name("n", Types.NUMBER)));
  }

  @Test
  public void testNotOfStringIsNegatedTruthiness() {
    testCondition("!!string.IsNullOrEmpty(s)", IR.not(name("s", Types.STRING)));
  }

  @Test
  public void testNarrowedBindingTypeWins() {
    context = context().withBinding("pet", NarrowedBinding.rename("pet__1_1", Types.STRING));
    testCondition("!string.IsNullOrEmpty(pet__1_1)", name("pet", PET));
  }

  @Test
  public void testTypeAliasIsResolved() {
    setLocalTypes(LocalTypeInfo.typeAlias("Label", ImmutableList.of(), Types.STRING));
    testCondition("!string.IsNullOrEmpty(l)", name("l", Types.ref("Label")));
  }

  @Test
  public void testIsBoolean() {
    assertThat(BooleanConditions.isBoolean(name("f", Types.BOOLEAN), context())).isTrue();
    assertThat(BooleanConditions.isBoolean(name("f", Types.literal(true)), context())).isTrue();
    assertThat(BooleanConditions.isBoolean(IR.not(IR.name("x")), context())).isTrue();
    assertThat(BooleanConditions.isBoolean(name("s", Types.STRING), context())).isFalse();
    assertThat(BooleanConditions.isBoolean(IR.name("u"), context())).isFalse();
  }
}
