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

import dev.narrowc.ir.Node;
import dev.narrowc.ir.NodeUtil;
import dev.narrowc.ir.Token;
import dev.narrowc.ir.types.IrType;
import dev.narrowc.target.TargetIR;
import dev.narrowc.target.TargetNode;
import org.jspecify.annotations.Nullable;

/**
 * A recognized narrowing guard. Produced by {@link GuardAnalysis} for one condition and consumed
 * immediately by the lowering step that asked for it.
 */
interface GuardInfo {

  /** Which guard shape matched. */
  enum Kind {
    PREDICATE,
    IN,
    DISCRIMINANT_EQUALITY,
    INSTANCEOF,
    NULLABLE
  }

  Kind kind();

  /** The narrowed source identifier, or the dotted narrowing key of a nullable guard. */
  String originalName();

  /** The context to continue with: the input context plus any temp id and name the guard took. */
  EmitterContext context();

  /** The binding that narrows {@link #originalName} where the guard holds. */
  NarrowedBinding binding();

  /**
   * A guard that selects one member of a tagged union. The union value is tested with {@code
   * IsN()} and read with {@code AsN()}.
   */
  interface UnionMemberGuard extends GuardInfo {

    /** Number of non-nullish union members, 2 to 8. */
    int unionArity();

    /** 1-based index of the member the guard selects. */
    int memberN();

    @Nullable IrType memberType();

    /** The local the selected member is materialized into. */
    String narrowedName();

    /** The lowered union value. */
    TargetNode receiver();

    /** Whether the guard holds when the condition is false. */
    boolean negated();

    /**
     * Whether failing the guard proves the other member: true for a two-member union with no
     * nullish member.
     */
    boolean complementAllowed();

    default int complementMemberN() {
      return memberN() == 1 ? 2 : 1;
    }

    /** {@code receiver.IsN()}. */
    default TargetNode isMember(int n) {
      return TargetIR.invocation(TargetIR.memberAccess(receiver(), "Is" + n));
    }

    /** {@code receiver.AsN()}. */
    default TargetNode asMember(int n) {
      return TargetIR.invocation(TargetIR.memberAccess(receiver(), "As" + n));
    }

    /** The condition as written: the member test, negated when the guard is. */
    default TargetNode condition() {
      TargetNode test = isMember(memberN());
      return negated() ? TargetIR.not(test) : test;
    }

    /** {@code var narrowedName = receiver.AsN();} */
    default TargetNode materialize() {
      return TargetIR.localDeclaration(TargetIR.varType(), narrowedName(), asMember(memberN()));
    }

    /** An inline {@code (receiver.AsN())} binding for member {@code n}. */
    default NarrowedBinding memberExpression(int n, @Nullable IrType type) {
      return NarrowedBinding.expr(TargetIR.parenthesized(asMember(n)), type);
    }

    @Override
    default NarrowedBinding binding() {
      return NarrowedBinding.rename(narrowedName(), memberType());
    }
  }

  /** {@code isT(x)} where {@code isT} is declared {@code x is T}. */
  record PredicateGuard(
      String originalName,
      int unionArity,
      int memberN,
      @Nullable IrType memberType,
      String narrowedName,
      TargetNode receiver,
      boolean negated,
      boolean complementAllowed,
      EmitterContext context)
      implements UnionMemberGuard {
    @Override
    public Kind kind() {
      return Kind.PREDICATE;
    }
  }

  /** {@code "prop" in x} where exactly one member declares {@code prop}. */
  record InGuard(
      String originalName,
      String propertyName,
      int unionArity,
      int memberN,
      @Nullable IrType memberType,
      String narrowedName,
      TargetNode receiver,
      boolean negated,
      boolean complementAllowed,
      EmitterContext context)
      implements UnionMemberGuard {
    @Override
    public Kind kind() {
      return Kind.IN;
    }
  }

  /**
   * {@code x.prop OP literal} where exactly one member's {@code prop} may hold {@code literal}.
   * The operator already has any enclosing {@code !} folded in.
   */
  record DiscriminantEqualityGuard(
      String originalName,
      String propertyName,
      Object literal,
      Token operator,
      int unionArity,
      int memberN,
      @Nullable IrType memberType,
      String narrowedName,
      TargetNode receiver,
      boolean complementAllowed,
      EmitterContext context)
      implements UnionMemberGuard {
    @Override
    public Kind kind() {
      return Kind.DISCRIMINANT_EQUALITY;
    }

    @Override
    public boolean negated() {
      return NodeUtil.isInequalityOp(operator);
    }
  }

  /** {@code x instanceof T}, lowered to the type pattern {@code x is T narrowedName}. */
  record InstanceofGuard(
      String originalName,
      TargetNode targetType,
      @Nullable IrType narrowedType,
      String narrowedName,
      TargetNode receiver,
      EmitterContext context)
      implements GuardInfo {
    @Override
    public Kind kind() {
      return Kind.INSTANCEOF;
    }

    @Override
    public NarrowedBinding binding() {
      return NarrowedBinding.rename(narrowedName, narrowedType);
    }

    /** {@code receiver is T narrowedName}. */
    TargetNode pattern() {
      return TargetIR.isPattern(receiver, targetType, narrowedName);
    }
  }

  /**
   * {@code x != null} (or {@code == null}, either operand order, {@code undefined} alike) on a
   * nullable value type. The binding reads the value through {@code .Value}.
   */
  record NullableGuard(
      String originalName,
      Node target,
      TargetNode unwrapped,
      IrType valueType,
      boolean narrowsInThen,
      EmitterContext context)
      implements GuardInfo {
    @Override
    public Kind kind() {
      return Kind.NULLABLE;
    }

    @Override
    public NarrowedBinding binding() {
      return NarrowedBinding.expr(unwrapped, valueType);
    }
  }
}
