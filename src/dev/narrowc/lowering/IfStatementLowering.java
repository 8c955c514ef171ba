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
import dev.narrowc.ir.Node;
import dev.narrowc.lowering.GuardInfo.InstanceofGuard;
import dev.narrowc.lowering.GuardInfo.NullableGuard;
import dev.narrowc.lowering.GuardInfo.UnionMemberGuard;
import dev.narrowc.target.TargetIR;
import dev.narrowc.target.TargetNode;
import org.jspecify.annotations.Nullable;

/**
 * Lowers {@code if} statements, narrowing the guarded variable in each branch.
 *
 * <p>Guards are tried in a fixed order: tagged-union guards on the whole condition (type
 * predicate, {@code in}, discriminant equality), {@code instanceof}, a union or {@code
 * instanceof} guard on the left of {@code &&}, and finally nullable value checks. A condition no
 * guard matches is lowered unchanged.
 *
 * <p>Narrowing installed for a branch ends with the branch. The only narrowing that outlives the
 * statement is the one proven by a {@code then} branch that cannot complete normally and has no
 * {@code else}: the statements that follow see the other member of a two-member union, or the
 * unwrapped value after {@code if (x == null) return;}.
 */
final class IfStatementLowering {

  private IfStatementLowering() {}

  static Lowered lowerIf(Node n, EmitterContext context) {
    Node condition = n.getFirstChild();

    UnionMemberGuard unionGuard = GuardAnalysis.tryResolveUnionGuard(condition, context);
    if (unionGuard != null) {
      return lowerUnionGuard(n, unionGuard, context);
    }

    InstanceofGuard instanceofGuard = GuardAnalysis.tryResolveInstanceofGuard(condition, context);
    if (instanceofGuard != null) {
      return lowerInstanceofGuard(n, instanceofGuard, false);
    }
    if (condition.isNot() && elseBranch(n) != null) {
      instanceofGuard = GuardAnalysis.tryResolveInstanceofGuard(condition.getFirstChild(), context);
      if (instanceofGuard != null) {
        return lowerInstanceofGuard(n, instanceofGuard, true);
      }
    }

    if (condition.isAnd()) {
      Node left = condition.getFirstChild();
      UnionMemberGuard leftGuard = GuardAnalysis.tryResolveUnionGuard(left, context);
      if (leftGuard != null && !leftGuard.negated()) {
        return lowerAndUnionGuard(n, leftGuard, context);
      }
      InstanceofGuard leftInstanceof = GuardAnalysis.tryResolveInstanceofGuard(left, context);
      if (leftInstanceof != null) {
        return lowerAndInstanceofGuard(n, leftInstanceof, context);
      }
    }

    NullableGuard nullableGuard =
        condition.isAnd()
            ? GuardAnalysis.tryResolveNullableGuardInAnd(condition, context)
            : GuardAnalysis.tryResolveNullableGuard(condition, context);
    if (nullableGuard != null) {
      return lowerNullableGuard(n, nullableGuard, context);
    }

    TargetNode test = BooleanConditions.lowerCondition(condition, context);
    Lowered then = lowerBranch(n.getSecondChild(), null, null, null, context);
    Lowered otherwise = lowerElse(n, null, null, null, then.context());
    return finish(test, then, otherwise, context);
  }

  /**
   * {@code if (x.IsN()) { var x__N_k = x.AsN(); ... } else ...}, or {@code if (!x.IsN())} for a
   * negated guard, where the member branch is the {@code else}. With a complement the opposite
   * branch reads {@code x} as {@code (x.AsM())}.
   *
   * <p>Narrowing survives a terminating {@code then} without an {@code else} only for two-member
   * unions without a nullish member, even when a negated guard would prove the member itself.
   */
  private static Lowered lowerUnionGuard(Node n, UnionMemberGuard guard, EmitterContext context) {
    String key = guard.originalName();
    NarrowedBinding complement =
        guard.complementAllowed()
            ? guard.memberExpression(guard.complementMemberN(), null)
            : null;
    EmitterContext guarded = guard.context();
    Lowered then;
    Lowered otherwise;
    if (guard.negated()) {
      then = lowerBranch(n.getSecondChild(), key, complement, null, guarded);
      otherwise = lowerElse(n, key, guard.binding(), guard.materialize(), then.context());
    } else {
      then = lowerBranch(n.getSecondChild(), key, guard.binding(), guard.materialize(), guarded);
      otherwise = lowerElse(n, key, complement, null, then.context());
    }
    GuardAnalysis.logNarrowing(context, guard, "if statement");

    EmitterContext after = otherwise != null ? otherwise.context() : then.context();
    if (otherwise == null
        && guard.complementAllowed()
        && GuardAnalysis.isDefinitelyTerminating(n.getSecondChild())) {
      NarrowedBinding survivor =
          guard.negated()
              ? guard.memberExpression(guard.memberN(), guard.memberType())
              : complement;
      after = after.withBinding(key, survivor);
    }
    return new Lowered(
        TargetIR.ifStatement(
            guard.condition(), then.node(), otherwise == null ? null : otherwise.node()),
        after);
  }

  /**
   * {@code if (x is T x__is_k)} with the pattern variable read in the {@code then} branch. A
   * negated test {@code if (!(x is T x__is_k))} reads it in the {@code else} branch.
   */
  private static Lowered lowerInstanceofGuard(Node n, InstanceofGuard guard, boolean negated) {
    String key = guard.originalName();
    EmitterContext guarded = guard.context();
    TargetNode test = negated ? TargetIR.not(guard.pattern()) : guard.pattern();
    Lowered then =
        lowerBranch(n.getSecondChild(), key, negated ? null : guard.binding(), null, guarded);
    Lowered otherwise = lowerElse(n, key, negated ? guard.binding() : null, null, then.context());
    GuardAnalysis.logNarrowing(guarded, guard, "if statement");
    return finish(test, then, otherwise, guarded);
  }

  /**
   * {@code if (guard(x) && rest) A else B} becomes
   *
   * <pre>
   * if (x.IsN()) { var x__N_k = x.AsN(); if (rest) A else B } else B
   * </pre>
   *
   * so that {@code rest} is evaluated only when the guard holds and reads the narrowed local.
   */
  private static Lowered lowerAndUnionGuard(
      Node n, UnionMemberGuard guard, EmitterContext context) {
    String key = guard.originalName();
    EmitterContext guarded = guard.context();
    TargetNode innerTest =
        BooleanConditions.lowerCondition(
            n.getFirstChild().getLastChild(), guarded.withBinding(key, guard.binding()));
    Lowered innerThen = lowerBranch(n.getSecondChild(), key, guard.binding(), null, guarded);
    Lowered innerElse = lowerElse(n, key, guard.binding(), null, innerThen.context());
    TargetNode outerThen =
        TargetIR.block(
            guard.materialize(),
            TargetIR.ifStatement(
                innerTest, innerThen.node(), innerElse == null ? null : innerElse.node()));
    EmitterContext afterInner = innerElse != null ? innerElse.context() : innerThen.context();
    Lowered outerElse = lowerElse(n, null, null, null, afterInner);
    GuardAnalysis.logNarrowing(context, guard, "&& condition");
    EmitterContext after = outerElse != null ? outerElse.context() : afterInner;
    return new Lowered(
        TargetIR.ifStatement(
            guard.condition(), outerThen, outerElse == null ? null : outerElse.node()),
        after.restoreScope(context));
  }

  /** {@code if (x is T x__is_k && rest)}, with {@code rest} and the then branch narrowed. */
  private static Lowered lowerAndInstanceofGuard(
      Node n, InstanceofGuard guard, EmitterContext context) {
    String key = guard.originalName();
    EmitterContext guarded = guard.context();
    TargetNode test =
        TargetIR.binary(
            "&&",
            guard.pattern(),
            BooleanConditions.lowerCondition(
                n.getFirstChild().getLastChild(), guarded.withBinding(key, guard.binding())));
    Lowered then = lowerBranch(n.getSecondChild(), key, guard.binding(), null, guarded);
    Lowered otherwise = lowerElse(n, null, null, null, then.context());
    GuardAnalysis.logNarrowing(context, guard, "&& condition");
    return finish(test, then, otherwise, context);
  }

  /**
   * A null check on a nullable value type. The branch where the value is present reads it
   * through {@code .Value}; after {@code if (x == null) return;} the following statements do
   * too.
   */
  private static Lowered lowerNullableGuard(
      Node n, NullableGuard guard, EmitterContext context) {
    String key = guard.originalName();
    TargetNode test = BooleanConditions.lowerCondition(n.getFirstChild(), context);
    boolean inThen = guard.narrowsInThen();
    Lowered then =
        lowerBranch(n.getSecondChild(), key, inThen ? guard.binding() : null, null, context);
    Lowered otherwise = lowerElse(n, key, inThen ? null : guard.binding(), null, then.context());
    GuardAnalysis.logNarrowing(context, guard, "if statement");
    Lowered result = finish(test, then, otherwise, context);
    if (!inThen
        && otherwise == null
        && GuardAnalysis.isDefinitelyTerminating(n.getSecondChild())) {
      return new Lowered(result.node(), result.context().withBinding(key, guard.binding()));
    }
    return result;
  }

  private static Lowered finish(
      TargetNode test, Lowered then, @Nullable Lowered otherwise, EmitterContext scope) {
    EmitterContext after = otherwise != null ? otherwise.context() : then.context();
    return new Lowered(
        TargetIR.ifStatement(test, then.node(), otherwise == null ? null : otherwise.node()),
        after.restoreScope(scope));
  }

  private static @Nullable Node elseBranch(Node n) {
    return n.getChildCount() > 2 ? n.getLastChild() : null;
  }

  private static @Nullable Lowered lowerElse(
      Node n,
      @Nullable String key,
      @Nullable NarrowedBinding binding,
      @Nullable TargetNode prefix,
      EmitterContext context) {
    Node otherwise = elseBranch(n);
    return otherwise == null ? null : lowerBranch(otherwise, key, binding, prefix, context);
  }

  /**
   * Lowers one branch with {@code key} narrowed by {@code binding}, if given. A {@code prefix}
   * statement forces the branch into a block that starts with it. The returned context has the
   * narrowing and names of {@code context} again.
   */
  private static Lowered lowerBranch(
      Node branch,
      @Nullable String key,
      @Nullable NarrowedBinding binding,
      @Nullable TargetNode prefix,
      EmitterContext context) {
    EmitterContext branchContext = binding == null ? context : context.withBinding(key, binding);
    if (prefix == null) {
      Lowered lowered = StatementLowering.lowerEmbedded(branch, branchContext);
      return new Lowered(lowered.node(), lowered.context().restoreScope(context));
    }
    LoweredStatements body =
        branch.isBlock()
            ? StatementLowering.lowerStatements(branch.children(), branchContext)
            : StatementLowering.lowerStatement(branch, branchContext);
    TargetNode block =
        TargetIR.block(
            ImmutableList.<TargetNode>builder().add(prefix).addAll(body.statements()).build());
    return new Lowered(block, body.context().restoreScope(context));
  }
}
