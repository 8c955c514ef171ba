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
import com.google.common.collect.ImmutableSetMultimap;
import dev.narrowc.ir.IR;
import dev.narrowc.ir.Node;
import dev.narrowc.ir.Token;
import dev.narrowc.ir.types.IrType;
import dev.narrowc.ir.types.Types;
import dev.narrowc.ir.types.UnionType;
import dev.narrowc.target.TargetIR;
import dev.narrowc.target.TargetNode;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class IfStatementLoweringTest extends LoweringTestCase {

  private static final IrType BIRD = Types.ref("Bird");
  private static final IrType CIRCLE = Types.ref("Circle");
  private static final IrType SQUARE = Types.ref("Square");
  private static final UnionType SHAPE = Types.union(CIRCLE, SQUARE);

  private static final LocalTypeInfo CIRCLE_INFO =
      LocalTypeInfo.interfaceInfo(
          "Circle",
          ImmutableList.of(),
          Types.prop("kind", Types.literal("circle")),
          Types.prop("radius", Types.NUMBER));
  private static final LocalTypeInfo SQUARE_INFO =
      LocalTypeInfo.interfaceInfo(
          "Square",
          ImmutableList.of(),
          Types.prop("kind", Types.literal("square")),
          Types.prop("side", Types.NUMBER));

  private static Node isCat(Node pet) {
    return predicateCall("isCat", pet, CAT);
  }

  private static Node kindOf(String name) {
    return IR.getprop(name(name, SHAPE), "kind");
  }

  private static Node read(String name, String property) {
    return IR.getprop(IR.name(name), property);
  }

  // Type predicates

  @Test
  public void testPredicateNarrowsThenBranch() {
    test(
        "if (pet.Is1()) { var pet__1_1 = pet.As1(); feed(pet__1_1); }",
        IR.ifNode(isCat(name("pet", PET)), IR.block(callStatement("feed", IR.name("pet")))));

    assertThat(lastContext.getNarrowedBindings()).isEmpty();
    assertThat(lastContext.getTempVarId()).isEqualTo(1);
    assertThat(lastContext.getUsedLocalNames()).contains("pet__1_1");
  }

  @Test
  public void testDeclarationInNarrowedBranchHidesNarrowing() {
    test(
        "if (pet.Is1()) { var pet__1_1 = pet.As1(); var pet = 1; feed(pet); }",
        IR.ifNode(
            isCat(name("pet", PET)),
            IR.block(
                IR.let(IR.name("pet"), IR.number(1)), callStatement("feed", IR.name("pet")))));
  }

  @Test
  public void testNarrowingResumesAfterShadowingBlock() {
    test(
        "if (pet.Is1()) { var pet__1_1 = pet.As1();"
            + " { var pet = 1; feed(pet); } feed(pet__1_1); }",
        IR.ifNode(
            isCat(name("pet", PET)),
            IR.block(
                IR.block(
                    IR.let(IR.name("pet"), IR.number(1)),
                    callStatement("feed", IR.name("pet"))),
                callStatement("feed", IR.name("pet")))));
  }

  @Test
  public void testLoopVariableInNarrowedBranchHidesNarrowing() {
    test(
        "if (pet.Is1()) { var pet__1_1 = pet.As1();"
            + " foreach (var pet in pets) { feed(pet); } feed(pet__1_1); }",
        IR.ifNode(
            isCat(name("pet", PET)),
            IR.block(
                IR.forOf(
                    IR.declaration(Token.CONST, IR.name("pet")),
                    IR.name("pets"),
                    IR.block(callStatement("feed", IR.name("pet")))),
                callStatement("feed", IR.name("pet")))));
  }

  @Test
  public void testCatchParameterInNarrowedBranchHidesNarrowing() {
    test(
        "if (pet.Is1()) { var pet__1_1 = pet.As1();"
            + " try { } catch (global::System.Exception pet) { feed(pet); } }",
        IR.ifNode(
            isCat(name("pet", PET)),
            IR.block(
                IR.tryCatch(
                    IR.block(),
                    IR.catchNode(
                        IR.name("pet"), IR.block(callStatement("feed", IR.name("pet"))))))));
  }

  @Test
  public void testPredicateNarrowsElseToComplement() {
    test(
        "if (pet.Is1()) { var pet__1_1 = pet.As1(); feed(pet__1_1); }"
            + " else { walk((pet.As2())); }",
        IR.ifNode(
            isCat(name("pet", PET)),
            IR.block(callStatement("feed", IR.name("pet"))),
            IR.block(callStatement("walk", IR.name("pet")))));
  }

  @Test
  public void testPredicateOnSecondMember() {
    test(
        "if (pet.Is2()) { var pet__2_1 = pet.As2(); walk(pet__2_1); }",
        IR.ifNode(
            predicateCall("isDog", name("pet", PET), DOG),
            IR.block(callStatement("walk", IR.name("pet")))));
  }

  @Test
  public void testNegatedPredicateSwapsBranches() {
    test(
        "if (!pet.Is1()) { walk((pet.As2())); }"
            + " else { var pet__1_1 = pet.As1(); feed(pet__1_1); }",
        IR.ifNode(
            IR.not(isCat(name("pet", PET))),
            IR.block(callStatement("walk", IR.name("pet"))),
            IR.block(callStatement("feed", IR.name("pet")))));
  }

  @Test
  public void testDoubleNegationIsPositive() {
    test(
        "if (pet.Is1()) { var pet__1_1 = pet.As1(); feed(pet__1_1); }",
        IR.ifNode(
            IR.not(IR.not(isCat(name("pet", PET)))),
            IR.block(callStatement("feed", IR.name("pet")))));
  }

  @Test
  public void testEarlyReturnNarrowsFollowingStatements() {
    test(
        "if (!pet.Is1()) { return; } feed((pet.As1()));",
        IR.ifNode(IR.not(isCat(name("pet", PET))), IR.block(IR.returnNode())),
        callStatement("feed", IR.name("pet")));

    assertThat(lastContext.getBinding("pet"))
        .isEqualTo(NarrowedBinding.expr(parenthesizedAs("pet", 1), CAT));
  }

  @Test
  public void testEarlyReturnFromMemberBranchLeavesComplement() {
    test(
        "if (pet.Is1()) { var pet__1_1 = pet.As1(); return; } walk((pet.As2()));",
        IR.ifNode(isCat(name("pet", PET)), IR.block(IR.returnNode())),
        callStatement("walk", IR.name("pet")));
  }

  @Test
  public void testThrowTerminatesToo() {
    test(
        "if (!pet.Is1()) { throw new Error(\"not a cat\"); } feed((pet.As1()));",
        IR.ifNode(
            IR.not(isCat(name("pet", PET))),
            IR.block(IR.throwNode(IR.newNode(IR.name("Error"), IR.string("not a cat"))))),
        callStatement("feed", IR.name("pet")));
  }

  @Test
  public void testNonTerminatingThenDoesNotNarrowAfterwards() {
    test(
        "if (!pet.Is1()) { log(); } feed(pet);",
        IR.ifNode(IR.not(isCat(name("pet", PET))), IR.block(callStatement("log"))),
        callStatement("feed", IR.name("pet")));
  }

  @Test
  public void testThreeMemberUnionHasNoComplement() {
    UnionType pets = Types.union(CAT, DOG, BIRD);
    test(
        "if (pet.Is1()) { var pet__1_1 = pet.As1(); feed(pet__1_1); } else { walk(pet); }",
        IR.ifNode(
            isCat(name("pet", pets)),
            IR.block(callStatement("feed", IR.name("pet"))),
            IR.block(callStatement("walk", IR.name("pet")))));
  }

  @Test
  public void testThreeMemberUnionDoesNotNarrowAfterEarlyReturn() {
    UnionType pets = Types.union(CAT, DOG, BIRD);
    test(
        "if (pet.Is1()) { var pet__1_1 = pet.As1(); return; } walk(pet);",
        IR.ifNode(isCat(name("pet", pets)), IR.block(IR.returnNode())),
        callStatement("walk", IR.name("pet")));
  }

  @Test
  public void testNegatedThreeMemberGuardDoesNotNarrowAfterEarlyReturn() {
    UnionType pets = Types.union(CAT, DOG, BIRD);
    test(
        "if (!pet.Is1()) { return; } feed(pet);",
        IR.ifNode(IR.not(isCat(name("pet", pets))), IR.block(IR.returnNode())),
        callStatement("feed", IR.name("pet")));
  }

  @Test
  public void testNullableUnionHasNoComplement() {
    UnionType pets = Types.union(CAT, DOG, Types.UNDEFINED);
    test(
        "if (pet.Is1()) { var pet__1_1 = pet.As1(); feed(pet__1_1); } else { walk(pet); }",
        IR.ifNode(
            isCat(name("pet", pets)),
            IR.block(callStatement("feed", IR.name("pet"))),
            IR.block(callStatement("walk", IR.name("pet")))));
  }

  @Test
  public void testUnionAboveMaximumArityIsNotNarrowed() {
    List<IrType> members = new ArrayList<>();
    for (char c = 'A'; c <= 'I'; c++) {
      members.add(Types.ref(String.valueOf(c)));
    }
    UnionType wide = Types.union(members.toArray(new IrType[0]));
    test(
        "if (isA(x)) { use(x); }",
        IR.ifNode(
            predicateCall("isA", name("x", wide), Types.ref("A")).setInferredType(Types.BOOLEAN),
            IR.block(callStatement("use", IR.name("x")))));
  }

  @Test
  public void testPredicateForNonMemberIsNotNarrowed() {
    test(
        "if (isBird(pet)) { use(pet); }",
        IR.ifNode(
            predicateCall("isBird", name("pet", PET), BIRD).setInferredType(Types.BOOLEAN),
            IR.block(callStatement("use", IR.name("pet")))));
  }

  @Test
  public void testPredicateOnPropertyArgumentIsNotNarrowed() {
    test(
        "if (isCat(owner.pet)) { use(owner.pet); }",
        IR.ifNode(
            isCat(IR.getprop(IR.name("owner"), "pet").setInferredType(PET))
                .setInferredType(Types.BOOLEAN),
            IR.block(callStatement("use", read("owner", "pet")))));
  }

  @Test
  public void testNarrowingEndsWithTheStatement() {
    test(
        "if (pet.Is1()) { var pet__1_1 = pet.As1(); feed(pet__1_1); } walk(pet);",
        IR.ifNode(isCat(name("pet", PET)), IR.block(callStatement("feed", IR.name("pet")))),
        callStatement("walk", IR.name("pet")));

    assertThat(lastContext.getNarrowedBindings()).isEmpty();
    assertThat(lastContext.getLocalNameMap()).isEmpty();
  }

  @Test
  public void testSequentialGuardsGetDistinctNames() {
    test(
        "if (pet.Is1()) { var pet__1_1 = pet.As1(); feed(pet__1_1); }"
            + " if (pet.Is1()) { var pet__1_2 = pet.As1(); feed(pet__1_2); }",
        IR.ifNode(isCat(name("pet", PET)), IR.block(callStatement("feed", IR.name("pet")))),
        IR.ifNode(isCat(name("pet", PET)), IR.block(callStatement("feed", IR.name("pet")))));
  }

  @Test
  public void testNestedGuards() {
    test(
        "if (a.Is1()) { var a__1_1 = a.As1();"
            + " if (b.Is2()) { var b__2_2 = b.As2(); both(a__1_1, b__2_2); } }",
        IR.ifNode(
            isCat(name("a", PET)),
            IR.block(
                IR.ifNode(
                    predicateCall("isDog", name("b", PET), DOG),
                    IR.block(callStatement("both", IR.name("a"), IR.name("b")))))));
  }

  @Test
  public void testAssignmentTargetIsNotRenamed() {
    test(
        "if (pet.Is1()) { var pet__1_1 = pet.As1(); pet = adopt(); }",
        IR.ifNode(
            isCat(name("pet", PET)),
            IR.block(IR.exprResult(IR.assign(IR.name("pet"), call("adopt"))))));
  }

  @Test
  public void testSingleStatementBranchIsWrappedWithItsDeclaration() {
    test(
        "if (pet.Is1()) { var pet__1_1 = pet.As1(); feed(pet__1_1); }",
        IR.ifNode(isCat(name("pet", PET)), callStatement("feed", IR.name("pet"))));
  }

  @Test
  public void testNarrowingIsLoggedWhenRequested() {
    options.setLogNarrowing(true);
    List<LogRecord> records = new ArrayList<>();
    Handler handler =
        new Handler() {
          @Override
          public void publish(LogRecord record) {
            records.add(record);
          }

          @Override
          public void flush() {}

          @Override
          public void close() {}
        };
    Logger logger = Logger.getLogger(GuardAnalysis.class.getName());
    logger.addHandler(handler);
    try {
      lower(IR.ifNode(isCat(name("pet", PET)), IR.block(callStatement("feed", IR.name("pet")))));
    } finally {
      logger.removeHandler(handler);
    }
    assertThat(records).hasSize(1);
    assertThat(records.get(0).getMessage())
        .startsWith("Narrowed pet by PREDICATE guard in if statement");
  }

  // Discriminant equality

  @Test
  public void testDiscriminantEqualityNarrowsBothBranches() {
    setLocalTypes(CIRCLE_INFO, SQUARE_INFO);
    test(
        "if (shape.Is1()) { var shape__1_1 = shape.As1(); draw(shape__1_1.radius); }"
            + " else { fill((shape.As2()).side); }",
        IR.ifNode(
            IR.sheq(kindOf("shape"), IR.string("circle")),
            IR.block(callStatement("draw", read("shape", "radius"))),
            IR.block(callStatement("fill", read("shape", "side")))));
  }

  @Test
  public void testDiscriminantInequalityWithEarlyReturn() {
    setLocalTypes(CIRCLE_INFO, SQUARE_INFO);
    test(
        "if (!shape.Is1()) { return; } use((shape.As1()).radius);",
        IR.ifNode(IR.shne(kindOf("shape"), IR.string("circle")), IR.block(IR.returnNode())),
        callStatement("use", read("shape", "radius")));
  }

  @Test
  public void testDiscriminantLiteralOnTheLeft() {
    setLocalTypes(CIRCLE_INFO, SQUARE_INFO);
    test(
        "if (shape.Is2()) { var shape__2_1 = shape.As2(); fill(shape__2_1.side); }",
        IR.ifNode(
            IR.eq(IR.string("square"), kindOf("shape")),
            IR.block(callStatement("fill", read("shape", "side")))));
  }

  @Test
  public void testNotAroundDiscriminantEqualityFlipsOperator() {
    setLocalTypes(CIRCLE_INFO, SQUARE_INFO);
    test(
        "if (!shape.Is1()) { fill((shape.As2()).side); }"
            + " else { var shape__1_1 = shape.As1(); draw(shape__1_1.radius); }",
        IR.ifNode(
            IR.not(IR.sheq(kindOf("shape"), IR.string("circle"))),
            IR.block(callStatement("fill", read("shape", "side"))),
            IR.block(callStatement("draw", read("shape", "radius")))));
  }

  @Test
  public void testDiscriminantShapesFromTypeAlias() {
    setLocalTypes(
        CIRCLE_INFO,
        SQUARE_INFO,
        LocalTypeInfo.typeAlias("Shape", ImmutableList.of(), SHAPE));
    test(
        "if (shape.Is1()) { var shape__1_1 = shape.As1(); draw(shape__1_1.radius); }",
        IR.ifNode(
            IR.sheq(IR.getprop(name("shape", Types.ref("Shape")), "kind"), IR.string("circle")),
            IR.block(callStatement("draw", read("shape", "radius")))));
  }

  @Test
  public void testDiscriminantMatchingSeveralMembersIsNotNarrowed() {
    setLocalTypes(
        LocalTypeInfo.interfaceInfo(
            "Circle", ImmutableList.of(), Types.prop("kind", Types.STRING)),
        LocalTypeInfo.interfaceInfo(
            "Square", ImmutableList.of(), Types.prop("kind", Types.STRING)));
    test(
        "if (shape.kind == \"circle\") { draw(shape); }",
        IR.ifNode(
            IR.sheq(kindOf("shape"), IR.string("circle")),
            IR.block(callStatement("draw", IR.name("shape")))));
  }

  @Test
  public void testDiscriminantWithUnknownLiteralIsNotNarrowed() {
    setLocalTypes(CIRCLE_INFO, SQUARE_INFO);
    test(
        "if (shape.kind == \"triangle\") { draw(shape); }",
        IR.ifNode(
            IR.sheq(kindOf("shape"), IR.string("triangle")),
            IR.block(callStatement("draw", IR.name("shape")))));
  }

  @Test
  public void testNumericDiscriminant() {
    setLocalTypes(
        LocalTypeInfo.interfaceInfo(
            "Circle", ImmutableList.of(), Types.prop("kind", Types.literal(1))),
        LocalTypeInfo.interfaceInfo(
            "Square", ImmutableList.of(), Types.prop("kind", Types.literal(2))));
    test(
        "if (shape.Is2()) { var shape__2_1 = shape.As2(); fill(shape__2_1); }",
        IR.ifNode(
            IR.sheq(kindOf("shape"), IR.number(2)),
            IR.block(callStatement("fill", IR.name("shape")))));
  }

  // in

  @Test
  public void testInGuardSelectsTheDeclaringMember() {
    setLocalTypes(
        LocalTypeInfo.interfaceInfo(
            "Success", ImmutableList.of(), Types.prop("value", Types.NUMBER)),
        LocalTypeInfo.interfaceInfo(
            "Failure", ImmutableList.of(), Types.prop("error", Types.STRING)));
    UnionType result = Types.union(Types.ref("Success"), Types.ref("Failure"));
    test(
        "if (result.Is2()) { var result__2_1 = result.As2(); log(result__2_1.error); }"
            + " else { use((result.As1()).value); }",
        IR.ifNode(
            IR.in(IR.string("error"), name("result", result)),
            IR.block(callStatement("log", read("result", "error"))),
            IR.block(callStatement("use", read("result", "value")))));
  }

  @Test
  public void testAmbiguousInGuardIsNotNarrowed() {
    setLocalTypes(
        LocalTypeInfo.interfaceInfo("A", ImmutableList.of(), Types.prop("name", Types.STRING)),
        LocalTypeInfo.interfaceInfo("B", ImmutableList.of(), Types.prop("name", Types.STRING)),
        LocalTypeInfo.interfaceInfo("C", ImmutableList.of(), Types.prop("id", Types.NUMBER)));
    UnionType abc = Types.union(Types.ref("A"), Types.ref("B"), Types.ref("C"));
    test(
        "if (global::Narrowc.Runtime.Operators.@in(\"name\", x)) { f(x); }",
        IR.ifNode(
            IR.in(IR.string("name"), name("x", abc)),
            IR.block(callStatement("f", IR.name("x")))));
  }

  @Test
  public void testInGuardThroughTypeMemberIndex() {
    options.setTypeMemberIndex(
        ImmutableSetMultimap.of(
            "App.Models.Card", "Number", "App.Models.Cash", "Amount"));
    UnionType payment = Types.union(Types.ref("Card"), Types.ref("Cash"));
    test(
        "if (p.Is2()) { var p__2_1 = p.As2(); pay(p__2_1); }",
        IR.ifNode(
            IR.in(IR.string("Amount"), name("p", payment)),
            IR.block(callStatement("pay", IR.name("p")))));
  }

  // instanceof

  @Test
  public void testInstanceofUsesPatternVariable() {
    test(
        "if (x is Foo x__is_1) { x__is_1.bar(); }",
        IR.ifNode(
            IR.instanceOf(IR.name("x"), IR.name("Foo")),
            IR.block(IR.exprResult(IR.call(read("x", "bar"))))));
  }

  @Test
  public void testInstanceofElseIsNotNarrowed() {
    test(
        "if (x is Foo x__is_1) { x__is_1.bar(); } else { other(x); }",
        IR.ifNode(
            IR.instanceOf(IR.name("x"), IR.name("Foo")),
            IR.block(IR.exprResult(IR.call(read("x", "bar")))),
            IR.block(callStatement("other", IR.name("x")))));
  }

  @Test
  public void testNegatedInstanceofNarrowsElse() {
    test(
        "if (!(x is Foo x__is_1)) { other(x); } else { x__is_1.bar(); }",
        IR.ifNode(
            IR.not(IR.instanceOf(IR.name("x"), IR.name("Foo"))),
            IR.block(callStatement("other", IR.name("x"))),
            IR.block(IR.exprResult(IR.call(read("x", "bar"))))));
  }

  @Test
  public void testNegatedInstanceofWithoutElseIsPlainTest() {
    test(
        "if (!(x is Foo)) { return; }",
        IR.ifNode(
            IR.not(IR.instanceOf(IR.name("x"), IR.name("Foo"))), IR.block(IR.returnNode())));
  }

  @Test
  public void testInstanceofQualifiedType() {
    test(
        "if (x is ns.Foo x__is_1) { use(x__is_1); }",
        IR.ifNode(
            IR.instanceOf(IR.name("x"), IR.getprop(IR.name("ns"), "Foo")),
            IR.block(callStatement("use", IR.name("x")))));
  }

  // &&

  @Test
  public void testAndWithUnionGuardNestsTheRest() {
    test(
        "if (pet.Is1()) { var pet__1_1 = pet.As1();"
            + " if (pet__1_1.hungry) { feed(pet__1_1); } else { play(); } }"
            + " else { play(); }",
        IR.ifNode(
            IR.and(
                isCat(name("pet", PET)),
                IR.getprop(name("pet", PET), "hungry").setInferredType(Types.BOOLEAN)),
            IR.block(callStatement("feed", IR.name("pet"))),
            IR.block(callStatement("play"))));
  }

  @Test
  public void testAndWithUnionGuardWithoutElse() {
    test(
        "if (pet.Is1()) { var pet__1_1 = pet.As1(); if (pet__1_1.hungry) { feed(pet__1_1); } }",
        IR.ifNode(
            IR.and(
                isCat(name("pet", PET)),
                IR.getprop(name("pet", PET), "hungry").setInferredType(Types.BOOLEAN)),
            IR.block(callStatement("feed", IR.name("pet")))));

    assertThat(lastContext.getNarrowedBindings()).isEmpty();
  }

  @Test
  public void testAndWithInstanceofGuard() {
    test(
        "if (x is Foo x__is_1 && x__is_1.ready) { x__is_1.go(); }",
        IR.ifNode(
            IR.and(
                IR.instanceOf(IR.name("x"), IR.name("Foo")),
                read("x", "ready").setInferredType(Types.BOOLEAN)),
            IR.block(IR.exprResult(IR.call(read("x", "go"))))));
  }

  // Nullable value types

  @Test
  public void testNullableValueReadThroughValue() {
    test(
        "if (id != null) { use(id.Value); }",
        IR.ifNode(
            IR.shne(name("id", Types.optional(Types.NUMBER)), IR.name("undefined")),
            IR.block(callStatement("use", name("id", Types.optional(Types.NUMBER))))));
  }

  @Test
  public void testNullableValueNarrowsElseOfEqualityCheck() {
    test(
        "if (id == null) { reset(); } else { use(id.Value); }",
        IR.ifNode(
            IR.eq(name("id", Types.optional(Types.NUMBER)), IR.nullNode()),
            IR.block(callStatement("reset")),
            IR.block(callStatement("use", IR.name("id")))));
  }

  @Test
  public void testNullCheckWithEarlyReturnNarrowsFollowingStatements() {
    test(
        "if (n == null) { return; } use(n.Value);",
        IR.ifNode(
            IR.eq(name("n", Types.optional(Types.NUMBER)), IR.nullNode()),
            IR.block(IR.returnNode())),
        callStatement("use", IR.name("n")));
  }

  @Test
  public void testNullableGuardInAnd() {
    test(
        "if (n != null && n.Value > 0) { use(n.Value); }",
        IR.ifNode(
            IR.and(
                IR.ne(name("n", Types.optional(Types.NUMBER)), IR.nullNode()),
                IR.binaryOp(Token.GT, IR.name("n"), IR.number(0))),
            IR.block(callStatement("use", IR.name("n")))));
  }

  @Test
  public void testNullableReferenceIsNotUnwrapped() {
    test(
        "if (s != null) { use(s); }",
        IR.ifNode(
            IR.ne(name("s", Types.optional(Types.STRING)), IR.nullNode()),
            IR.block(callStatement("use", IR.name("s")))));
  }

  @Test
  public void testNullablePropertyPath() {
    Node count = IR.getprop(IR.thisNode(), "count").setInferredType(Types.optional(Types.NUMBER));
    test(
        "if (this.count != null) { use(this.count.Value); }",
        IR.ifNode(
            IR.shne(count, IR.name("undefined")),
            IR.block(callStatement("use", IR.getprop(IR.thisNode(), "count")))));
  }

  @Test
  public void testNullableDateTimeIsAValueType() {
    IrType date = Types.optional(Types.clrRef("Date", "global::System.DateTime"));
    test(
        "if (d != null) { use(d.Value); }",
        IR.ifNode(
            IR.ne(name("d", date), IR.nullNode()),
            IR.block(callStatement("use", IR.name("d")))));
  }

  @Test
  public void testConfiguredValueTypeIsUnwrapped() {
    options.setExtraValueTypes(ImmutableSet.of("App.Money"));
    IrType money = Types.optional(Types.clrRef("Money", "App.Money"));
    test(
        "if (m != null) { use(m.Value); }",
        IR.ifNode(
            IR.ne(name("m", money), IR.nullNode()),
            IR.block(callStatement("use", IR.name("m")))));
  }

  // Plain conditions

  @Test
  public void testUnguardedConditionIsLoweredUnchanged() {
    test(
        "if (a < b) { go(); } else if (ready) { wait(); }",
        IR.ifNode(
            IR.lt(IR.name("a"), IR.name("b")),
            IR.block(callStatement("go")),
            IR.ifNode(name("ready", Types.BOOLEAN), IR.block(callStatement("wait")))));
  }

  private static TargetNode parenthesizedAs(String receiver, int n) {
    return TargetIR.parenthesized(
        TargetIR.invocation(TargetIR.memberAccess(TargetIR.identifier(receiver), "As" + n)));
  }
}
