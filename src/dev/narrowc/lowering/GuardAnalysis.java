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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import dev.narrowc.ir.Node;
import dev.narrowc.ir.NodeUtil;
import dev.narrowc.ir.Token;
import dev.narrowc.ir.TypePredicate;
import dev.narrowc.ir.types.IrType;
import dev.narrowc.ir.types.ReferenceType;
import dev.narrowc.ir.types.UnionType;
import dev.narrowc.lowering.GuardInfo.DiscriminantEqualityGuard;
import dev.narrowc.lowering.GuardInfo.InGuard;
import dev.narrowc.lowering.GuardInfo.InstanceofGuard;
import dev.narrowc.lowering.GuardInfo.NullableGuard;
import dev.narrowc.lowering.GuardInfo.PredicateGuard;
import dev.narrowc.lowering.GuardInfo.UnionMemberGuard;
import dev.narrowc.target.TargetIR;
import dev.narrowc.target.TargetNode;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Recognizes the condition shapes that narrow a variable.
 *
 * <p>Every recognizer is a pure function of the condition and the context. It returns null
 * whenever a precondition does not hold: the operand is not a plain name, the union arity is out
 * of range, type information is missing, or more than one union member would satisfy the guard.
 * Declining is the normal outcome and is never reported as an error.
 */
final class GuardAnalysis {
  private static final Logger logger = Logger.getLogger(GuardAnalysis.class.getName());

  static final int MIN_UNION_ARITY = 2;
  static final int MAX_UNION_ARITY = 8;

  private GuardAnalysis() {}

  /** The non-nullish members of a union a guard can select from. */
  record UnionShape(ImmutableList<IrType> members, boolean nullable) {
    int arity() {
      return members.size();
    }

    /** Whether a failed guard proves the remaining member. */
    boolean complementAllowed() {
      return members.size() == 2 && !nullable;
    }
  }

  /**
   * Resolves {@code type} to the union a tagged-union guard operates on. {@code T | undefined} is
   * stripped and aliases are followed first. Returns null for anything but a union of 2 to 8
   * non-nullish members.
   */
  static @Nullable UnionShape resolveUnion(@Nullable IrType type, EmitterContext context) {
    if (type == null) {
      return null;
    }
    IrType resolved = TypeResolution.resolveTypeAlias(TypeResolution.stripNullish(type), context);
    UnionType union = resolved.toMaybeUnionType();
    if (union == null) {
      return null;
    }
    ImmutableList<IrType> members = TypeResolution.nonNullishAlternates(union);
    if (members.size() < MIN_UNION_ARITY || members.size() > MAX_UNION_ARITY) {
      return null;
    }
    return new UnionShape(
        members, TypeResolution.isNullable(type) || union.hasNullishMember());
  }

  /**
   * Tries the tagged-union guards in priority order: type predicate, {@code in}, discriminant
   * equality. Leading {@code !} operators are folded into the guard's polarity.
   */
  static @Nullable UnionMemberGuard tryResolveUnionGuard(Node condition, EmitterContext context) {
    boolean negated = false;
    Node inner = condition;
    while (inner.isNot()) {
      negated = !negated;
      inner = inner.getFirstChild();
    }
    UnionMemberGuard guard = null;
    if (inner.isCall()) {
      guard = tryResolvePredicateGuard(inner, negated, context);
    } else if (inner.isIn()) {
      guard = tryResolveInGuard(inner, negated, context);
    }
    if (guard == null) {
      guard = tryResolveDiscriminantEqualityGuard(condition, context);
    }
    return guard;
  }

  /** {@code pred(x)} where the callee carries an upstream type predicate for argument x. */
  static @Nullable PredicateGuard tryResolvePredicateGuard(
      Node call, boolean negated, EmitterContext context) {
    TypePredicate predicate = call.getTypePredicate();
    if (predicate == null) {
      return null;
    }
    Node argument = call.getChildAtIndex(predicate.getArgIndex() + 1);
    if (argument == null || !argument.isName()) {
      return declined(call, "predicate argument is not a plain name");
    }
    String name = argument.getString();
    UnionShape union = resolveUnion(argument.getInferredType(), context);
    if (union == null) {
      return declined(call, "argument " + name + " is not a union of supported arity");
    }
    int index =
        TypeResolution.findUnionMemberIndex(union.members(), predicate.getTargetType(), context);
    if (index < 0) {
      return declined(call, "predicate target " + predicate.getTargetType() + " is not a member");
    }
    int memberN = index + 1;
    NarrowedName narrowed = allocateMemberName(name, memberN, context);
    return new PredicateGuard(
        name,
        union.arity(),
        memberN,
        union.members().get(index),
        narrowed.name(),
        ExpressionLowering.lowerName(argument, context),
        negated,
        union.complementAllowed(),
        narrowed.context());
  }

  /** {@code "prop" in x} where exactly one reference member of x's union declares prop. */
  static @Nullable InGuard tryResolveInGuard(Node in, boolean negated, EmitterContext context) {
    Node key = in.getFirstChild();
    Node subject = in.getLastChild();
    if (!key.isString() || !subject.isName()) {
      return null;
    }
    String name = subject.getString();
    String property = key.getString();
    UnionShape union = resolveUnion(subject.getInferredType(), context);
    if (union == null) {
      return declined(in, name + " is not a union of supported arity");
    }
    int match = -1;
    for (int i = 0; i < union.arity(); i++) {
      IrType member = TypeResolution.resolveTypeAlias(union.members().get(i), context);
      ReferenceType ref = member.toMaybeReferenceType();
      if (ref == null || !TypeResolution.hasProperty(ref, property, context, in.getToken())) {
        continue;
      }
      if (match >= 0) {
        return declined(in, "several members of " + name + " declare '" + property + "'");
      }
      match = i;
    }
    if (match < 0) {
      return declined(in, "no member of " + name + " declares '" + property + "'");
    }
    int memberN = match + 1;
    NarrowedName narrowed = allocateMemberName(name, memberN, context);
    return new InGuard(
        name,
        property,
        union.arity(),
        memberN,
        union.members().get(match),
        narrowed.name(),
        ExpressionLowering.lowerName(subject, context),
        negated,
        union.complementAllowed(),
        narrowed.context());
  }

  /**
   * {@code x.prop OP literal} or {@code literal OP x.prop}, OP one of {@code === !== == !=},
   * optionally under {@code !} operators, which flip OP.
   */
  static @Nullable DiscriminantEqualityGuard tryResolveDiscriminantEqualityGuard(
      Node condition, EmitterContext context) {
    boolean flip = false;
    Node comparison = condition;
    while (comparison.isNot()) {
      flip = !flip;
      comparison = comparison.getFirstChild();
    }
    if (!NodeUtil.isEqualityOp(comparison.getToken())) {
      return null;
    }
    Node access = comparison.getFirstChild();
    Node literalNode = comparison.getLastChild();
    if (!access.isGetProp()) {
      access = comparison.getLastChild();
      literalNode = comparison.getFirstChild();
    }
    if (!access.isGetProp() || access.isOptionalChain() || !access.getFirstChild().isName()) {
      return null;
    }
    Object literal = literalValue(literalNode);
    if (literal == null) {
      return null;
    }
    Node subject = access.getFirstChild();
    String name = subject.getString();
    String property = access.getLastChild().getString();
    if (context.isNarrowed(name)) {
      return declined(condition, name + " is already narrowed");
    }
    UnionShape union = resolveUnion(subject.getInferredType(), context);
    if (union == null) {
      return declined(condition, name + " is not a union of supported arity");
    }
    int match = -1;
    for (int i = 0; i < union.arity(); i++) {
      IrType member = TypeResolution.resolveTypeAlias(union.members().get(i), context);
      IrType propertyType = TypeResolution.getPropertyType(member, property, context);
      if (propertyType == null) {
        continue;
      }
      ImmutableSet<Object> values = TypeResolution.tryGetLiteralSet(propertyType, context);
      if (values == null || !values.contains(literal)) {
        continue;
      }
      if (match >= 0) {
        return declined(condition, "several members of " + name + " admit " + literal);
      }
      match = i;
    }
    if (match < 0) {
      return declined(condition, "no member of " + name + " admits " + literal);
    }
    Token operator =
        flip ? NodeUtil.negateEqualityOp(comparison.getToken()) : comparison.getToken();
    int memberN = match + 1;
    NarrowedName narrowed = allocateMemberName(name, memberN, context);
    return new DiscriminantEqualityGuard(
        name,
        property,
        literal,
        operator,
        union.arity(),
        memberN,
        union.members().get(match),
        narrowed.name(),
        ExpressionLowering.lowerName(subject, context),
        union.complementAllowed(),
        narrowed.context());
  }

  /** {@code x instanceof T} with a plain name on the left and a qualified name on the right. */
  static @Nullable InstanceofGuard tryResolveInstanceofGuard(
      Node condition, EmitterContext context) {
    if (!condition.isInstanceOf()) {
      return null;
    }
    Node subject = condition.getFirstChild();
    Node typeNode = condition.getLastChild();
    String typeName = NodeUtil.getQualifiedName(typeNode);
    if (!subject.isName() || typeName == null) {
      return null;
    }
    String name = subject.getString();
    EmitterContext withId = context.withNextTempVarId();
    LocalNames.Allocation allocation =
        LocalNames.reserve(name + "__is_" + withId.getTempVarId(), withId);
    return new InstanceofGuard(
        name,
        TargetIR.type(typeName),
        ReferenceType.create(typeName),
        allocation.emittedName(),
        ExpressionLowering.lowerName(subject, context),
        allocation.context());
  }

  /**
   * A comparison of a name or property path with {@code null} or {@code undefined}, optionally
   * under {@code !}. Only a nullable value type yields a guard: a reference type needs no unwrap.
   */
  static @Nullable NullableGuard tryResolveNullableGuard(Node condition, EmitterContext context) {
    boolean flip = false;
    Node comparison = condition;
    while (comparison.isNot()) {
      flip = !flip;
      comparison = comparison.getFirstChild();
    }
    if (!NodeUtil.isEqualityOp(comparison.getToken())) {
      return null;
    }
    Node target = comparison.getFirstChild();
    Node other = comparison.getLastChild();
    if (NodeUtil.isNullOrUndefined(target)) {
      target = comparison.getLastChild();
      other = comparison.getFirstChild();
    }
    if (!NodeUtil.isNullOrUndefined(other)) {
      return null;
    }
    String key = NodeUtil.getNarrowingKey(target);
    IrType type = target.getInferredType();
    if (key == null || type == null || !TypeResolution.isNullable(type)) {
      return null;
    }
    IrType valueType = TypeResolution.stripNullish(type);
    if (valueType.isUnionType() || !TypeResolution.isDefinitelyValueType(valueType, context)) {
      return null;
    }
    boolean narrowsInThen = NodeUtil.isInequalityOp(comparison.getToken()) != flip;
    TargetNode unwrapped =
        TargetIR.memberAccess(ExpressionLowering.lowerNarrowingTarget(target, context), "Value");
    return new NullableGuard(key, target, unwrapped, valueType, narrowsInThen, context);
  }

  /**
   * A nullable guard that is one operand of {@code a && b}, left operand first. Only the "not
   * null" polarity is returned: the "is null" polarity says nothing about the {@code then} branch.
   */
  static @Nullable NullableGuard tryResolveNullableGuardInAnd(
      Node and, EmitterContext context) {
    if (!and.isAnd()) {
      return null;
    }
    for (Node operand : and.children()) {
      NullableGuard guard = tryResolveNullableGuard(operand, context);
      if (guard != null && guard.narrowsInThen()) {
        return guard;
      }
    }
    return null;
  }

  /** Whether {@code statement} is a return, a throw, or a block ending in one. */
  static boolean isDefinitelyTerminating(Node statement) {
    switch (statement.getToken()) {
      case RETURN:
      case THROW:
        return true;
      case BLOCK:
        Node last = statement.getLastChild();
        return last != null && isDefinitelyTerminating(last);
      default:
        return false;
    }
  }

  /** Logs an applied narrowing at FINE, or at INFO when the options ask for it. */
  static void logNarrowing(EmitterContext context, GuardInfo guard, String where) {
    Level level = context.getOptions().shouldLogNarrowing() ? Level.INFO : Level.FINE;
    if (logger.isLoggable(level)) {
      logger.log(
          level,
          "Narrowed " + guard.originalName() + " by " + guard.kind() + " guard in " + where
              + " to " + guard.binding());
    }
  }

  private record NarrowedName(String name, EmitterContext context) {}

  private static NarrowedName allocateMemberName(
      String name, int memberN, EmitterContext context) {
    EmitterContext withId = context.withNextTempVarId();
    LocalNames.Allocation allocation =
        LocalNames.reserve(name + "__" + memberN + "_" + withId.getTempVarId(), withId);
    return new NarrowedName(allocation.emittedName(), allocation.context());
  }

  private static @Nullable Object literalValue(Node n) {
    switch (n.getToken()) {
      case STRING:
        return n.getString();
      case NUMBER:
        return n.getDouble();
      case TRUE:
        return Boolean.TRUE;
      case FALSE:
        return Boolean.FALSE;
      default:
        return null;
    }
  }

  private static <T> @Nullable T declined(Node condition, String reason) {
    if (logger.isLoggable(Level.FINER)) {
      logger.finer("Declined guard " + condition.getToken() + ": " + reason);
    }
    return null;
  }
}
