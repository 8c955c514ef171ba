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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import dev.narrowc.ir.Node;
import dev.narrowc.ir.NodeUtil;
import dev.narrowc.ir.Token;
import dev.narrowc.ir.types.ArrayType;
import dev.narrowc.ir.types.IrType;
import dev.narrowc.lowering.GuardInfo.NullableGuard;
import dev.narrowc.lowering.GuardInfo.UnionMemberGuard;
import dev.narrowc.target.TargetIR;
import dev.narrowc.target.TargetNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Lowers IR expressions to target expressions, reading narrowed names through the bindings in
 * the context.
 *
 * <p>Expressions never declare locals, so lowering an expression does not change the context.
 * Guards recognized inside {@code &&} and {@code ?:} narrow through inline {@code Expr} bindings
 * only; the temp ids and names such a guard reserves are discarded with its context.
 */
public final class ExpressionLowering {

  private static final ImmutableMap<Token, String> BINARY_OPERATORS =
      ImmutableMap.<Token, String>builder()
          .put(Token.EQ, "==")
          .put(Token.NE, "!=")
          .put(Token.SHEQ, "==")
          .put(Token.SHNE, "!=")
          .put(Token.LT, "<")
          .put(Token.LE, "<=")
          .put(Token.GT, ">")
          .put(Token.GE, ">=")
          .put(Token.ADD, "+")
          .put(Token.SUB, "-")
          .put(Token.MUL, "*")
          .put(Token.DIV, "/")
          .put(Token.MOD, "%")
          .put(Token.BITAND, "&")
          .put(Token.BITOR, "|")
          .put(Token.BITXOR, "^")
          .put(Token.LSH, "<<")
          .put(Token.RSH, ">>")
          .put(Token.URSH, ">>>")
          .put(Token.COALESCE, "??")
          .buildOrThrow();

  private static final ImmutableMap<Token, String> ASSIGNMENT_OPERATORS =
      ImmutableMap.<Token, String>builder()
          .put(Token.ASSIGN, "=")
          .put(Token.ASSIGN_ADD, "+=")
          .put(Token.ASSIGN_SUB, "-=")
          .put(Token.ASSIGN_MUL, "*=")
          .put(Token.ASSIGN_DIV, "/=")
          .put(Token.ASSIGN_MOD, "%=")
          .buildOrThrow();

  private static final String LINQ_ENUMERABLE = "global::System.Linq.Enumerable";
  private static final String CONVERT = "global::System.Convert";

  private ExpressionLowering() {}

  public static TargetNode lower(Node n, EmitterContext context) {
    switch (n.getToken()) {
      case NAME:
        return lowerName(n, context);
      case THIS:
        if (context.isStaticContext()) {
          throw InternalCompilerError.unsupported(n, "this in a static context");
        }
        NarrowedBinding thisBinding = context.getBinding("this");
        return thisBinding != null ? thisBinding.toExpression() : TargetIR.identifier("this");
      case SUPER:
        return TargetIR.identifier("base");
      case STRING:
        return TargetIR.stringLiteral(n.getString());
      case NUMBER:
        return TargetIR.numberLiteral(n.getDouble());
      case TRUE:
        return TargetIR.booleanLiteral(true);
      case FALSE:
        return TargetIR.booleanLiteral(false);
      case NULL:
        return TargetIR.nullLiteral();
      case GETPROP:
        return lowerGetProp(n, context);
      case GETELEM:
        return TargetIR.elementAccess(
            lower(n.getFirstChild(), context),
            lowerIndex(n.getLastChild(), context),
            n.isOptionalChain());
      case CALL:
        return lowerCall(n, context);
      case NEW:
        return lowerNew(n, context);
      case NOT:
        return TargetIR.not(BooleanConditions.lowerCondition(n.getFirstChild(), context));
      case NEG:
        return TargetIR.prefixUnary("-", lower(n.getFirstChild(), context));
      case POS:
        return TargetIR.prefixUnary("+", lower(n.getFirstChild(), context));
      case BITNOT:
        return TargetIR.prefixUnary("~", lower(n.getFirstChild(), context));
      case TYPEOF:
        return runtimeOperator("@typeof", context, lower(n.getFirstChild(), context));
      case INC:
      case DEC:
        String update = n.getToken() == Token.INC ? "++" : "--";
        TargetNode operand = lowerAssignmentTarget(n.getFirstChild(), context);
        return n.isPostfix()
            ? TargetIR.postfixUnary(update, operand)
            : TargetIR.prefixUnary(update, operand);
      case AND:
        return lowerAnd(n, context);
      case OR:
        return lowerOr(n, context);
      case HOOK:
        return lowerHook(n, context);
      case IN:
        return runtimeOperator(
            "@in",
            context,
            lower(n.getFirstChild(), context),
            lower(n.getLastChild(), context));
      case INSTANCEOF:
        return TargetIR.isPattern(
            lower(n.getFirstChild(), context), instanceofType(n.getLastChild()), null);
      case ARRAYLIT:
        return lowerArrayLiteral(n, context);
      case AWAIT:
        if (!context.isAsyncFunction()) {
          throw InternalCompilerError.unsupported(n, "await outside an async function");
        }
        return TargetIR.await(lower(n.getFirstChild(), context));
      case VOID:
        throw InternalCompilerError.unsupported(n, "void outside an expression statement");
      case SPREAD:
        throw InternalCompilerError.unsupported(n, "spread outside an array literal");
      case OBJECTLIT:
        throw InternalCompilerError.unsupported(n, "object literal");
      case FUNCTION:
        throw InternalCompilerError.unsupported(n, "function expression");
      default:
        break;
    }
    String assignment = ASSIGNMENT_OPERATORS.get(n.getToken());
    if (assignment != null) {
      return TargetIR.assignment(
          assignment,
          lowerAssignmentTarget(n.getFirstChild(), context),
          lower(n.getLastChild(), context));
    }
    String binary = BINARY_OPERATORS.get(n.getToken());
    if (binary != null) {
      if (NodeUtil.isEqualityOp(n.getToken())) {
        return TargetIR.binary(
            binary,
            lowerComparisonOperand(n.getFirstChild(), context),
            lowerComparisonOperand(n.getLastChild(), context));
      }
      return TargetIR.binary(
          binary, lower(n.getFirstChild(), context), lower(n.getLastChild(), context));
    }
    throw InternalCompilerError.unsupported(n, "expression " + n.getToken());
  }

  /**
   * A read of a name: its narrowed binding if there is one, otherwise the local it was declared
   * as. {@code undefined} reads as {@code default}.
   */
  static TargetNode lowerName(Node n, EmitterContext context) {
    checkArgument(n.isName(), n);
    String name = n.getString();
    NarrowedBinding binding = context.getBinding(name);
    if (binding != null) {
      return binding.toExpression();
    }
    if (name.equals("undefined")) {
      return TargetIR.defaultExpression();
    }
    return TargetIR.identifier(LocalNames.remappedLocalName(name, context));
  }

  /** Both {@code null} and {@code undefined} compare as {@code null}. */
  private static TargetNode lowerComparisonOperand(Node n, EmitterContext context) {
    return NodeUtil.isNullOrUndefined(n) ? TargetIR.nullLiteral() : lower(n, context);
  }

  /**
   * The narrowing target of a nullable guard, without its own binding: a name, {@code this} or a
   * property path whose object part is lowered normally.
   */
  static TargetNode lowerNarrowingTarget(Node n, EmitterContext context) {
    switch (n.getToken()) {
      case NAME:
        return TargetIR.identifier(LocalNames.remappedLocalName(n.getString(), context));
      case THIS:
        return TargetIR.identifier("this");
      case GETPROP:
        return TargetIR.memberAccess(
            lower(n.getFirstChild(), context), Identifiers.escape(n.getLastChild().getString()));
      default:
        throw InternalCompilerError.unsupported(n, "narrowing target " + n.getToken());
    }
  }

  /** The left side of an assignment or update. Narrowing bindings never apply to it. */
  static TargetNode lowerAssignmentTarget(Node n, EmitterContext context) {
    switch (n.getToken()) {
      case NAME:
      case THIS:
        return lowerNarrowingTarget(n, context);
      case GETPROP:
        return TargetIR.memberAccess(
            lower(n.getFirstChild(), context), Identifiers.escape(n.getLastChild().getString()));
      case GETELEM:
        return TargetIR.elementAccess(
            lower(n.getFirstChild(), context), lowerIndex(n.getLastChild(), context), false);
      case ARRAY_PATTERN:
      case OBJECT_PATTERN:
        throw InternalCompilerError.unsupported(n, "destructuring assignment");
      default:
        throw InternalCompilerError.unsupported(n, "assignment target " + n.getToken());
    }
  }

  private static TargetNode lowerGetProp(Node n, EmitterContext context) {
    String key = NodeUtil.getNarrowingKey(n);
    if (key != null) {
      NarrowedBinding binding = context.getBinding(key);
      if (binding != null) {
        return binding.toExpression();
      }
    }
    TargetNode object = lower(n.getFirstChild(), context);
    String member = Identifiers.escape(n.getLastChild().getString());
    return n.isOptionalChain()
        ? TargetIR.conditionalMemberAccess(object, member)
        : TargetIR.memberAccess(object, member);
  }

  /**
   * An element index. Numeric indices that are not known to be integers are converted, since
   * target indexers take {@code int}.
   */
  private static TargetNode lowerIndex(Node index, EmitterContext context) {
    TargetNode lowered = lower(index, context);
    IrType type = index.getInferredType();
    if (type == null || !type.isPrimitive("number")) {
      return lowered;
    }
    if (index.isNumber() && index.getDouble() == Math.rint(index.getDouble())) {
      return lowered;
    }
    if (lowered.isIdentifier() && context.getIntLoopVars().contains(lowered.getText())) {
      return lowered;
    }
    return TargetIR.invocation(
        TargetIR.memberAccess(TargetIR.identifier(CONVERT), "ToInt32"), lowered);
  }

  private static TargetNode lowerCall(Node n, EmitterContext context) {
    TargetNode callee = lower(n.getFirstChild(), context);
    if (n.isOptionalChain()) {
      callee = TargetIR.conditionalMemberAccess(callee, "Invoke");
    }
    return TargetIR.invocation(callee, lowerArguments(n, context));
  }

  private static TargetNode lowerNew(Node n, EmitterContext context) {
    IrType type = n.getInferredType();
    TargetNode targetType;
    if (type != null && type.isReferenceType()) {
      targetType = TargetTypes.toTargetType(type, n, context);
    } else {
      String name = NodeUtil.getQualifiedName(n.getFirstChild());
      if (name == null) {
        throw InternalCompilerError.unsupported(n, "construction of a computed type");
      }
      targetType = TargetIR.type(name);
    }
    return TargetIR.objectCreation(targetType, lowerArguments(n, context));
  }

  private static ImmutableList<TargetNode> lowerArguments(Node call, EmitterContext context) {
    ImmutableList.Builder<TargetNode> arguments = ImmutableList.builder();
    for (Node arg = call.getSecondChild(); arg != null; arg = arg.getNext()) {
      arguments.add(lower(arg, context));
    }
    return arguments.build();
  }

  /**
   * {@code a && b}. A guard on {@code a} narrows {@code b}: a union guard becomes {@code
   * x.IsN() && ...} with {@code x} read as {@code (x.AsN())} on the right, and a non-null check
   * on a nullable value type reads the value through {@code .Value} on the right.
   */
  static TargetNode lowerAnd(Node n, EmitterContext context) {
    Node left = n.getFirstChild();
    Node right = n.getLastChild();
    UnionMemberGuard guard = GuardAnalysis.tryResolveUnionGuard(left, context);
    if (guard != null && !guard.negated()) {
      NarrowedBinding binding = guard.memberExpression(guard.memberN(), guard.memberType());
      GuardAnalysis.logNarrowing(context, guard, "&& operand");
      return TargetIR.binary(
          "&&",
          guard.condition(),
          BooleanConditions.lowerCondition(
              right, context.withBinding(guard.originalName(), binding)));
    }
    NullableGuard nullable = GuardAnalysis.tryResolveNullableGuard(left, context);
    if (nullable != null && nullable.narrowsInThen()) {
      return TargetIR.binary(
          "&&",
          BooleanConditions.lowerCondition(left, context),
          BooleanConditions.lowerCondition(
              right, context.withBinding(nullable.originalName(), nullable.binding())));
    }
    return TargetIR.binary(
        "&&",
        BooleanConditions.lowerCondition(left, context),
        BooleanConditions.lowerCondition(right, context));
  }

  /** {@code a || b} is a logical or on booleans and a null-coalescing default otherwise. */
  private static TargetNode lowerOr(Node n, EmitterContext context) {
    Node left = n.getFirstChild();
    Node right = n.getLastChild();
    if (BooleanConditions.isBoolean(left, context)) {
      return TargetIR.binary(
          "||",
          BooleanConditions.lowerCondition(left, context),
          BooleanConditions.lowerCondition(right, context));
    }
    return TargetIR.binary("??", lower(left, context), lower(right, context));
  }

  /** {@code c ? a : b}, narrowing {@code a} and {@code b} the way an if statement would. */
  private static TargetNode lowerHook(Node n, EmitterContext context) {
    Node condition = n.getFirstChild();
    Node whenTrue = n.getSecondChild();
    Node whenFalse = n.getLastChild();
    EmitterContext trueContext = context;
    EmitterContext falseContext = context;
    TargetNode test;
    UnionMemberGuard guard = GuardAnalysis.tryResolveUnionGuard(condition, context);
    if (guard != null) {
      String name = guard.originalName();
      NarrowedBinding member = guard.memberExpression(guard.memberN(), guard.memberType());
      NarrowedBinding complement =
          guard.complementAllowed()
              ? guard.memberExpression(guard.complementMemberN(), null)
              : null;
      if (guard.negated()) {
        falseContext = context.withBinding(name, member);
        if (complement != null) {
          trueContext = context.withBinding(name, complement);
        }
      } else {
        trueContext = context.withBinding(name, member);
        if (complement != null) {
          falseContext = context.withBinding(name, complement);
        }
      }
      GuardAnalysis.logNarrowing(context, guard, "conditional expression");
      test = guard.condition();
    } else {
      NullableGuard nullable = GuardAnalysis.tryResolveNullableGuard(condition, context);
      if (nullable != null) {
        if (nullable.narrowsInThen()) {
          trueContext = context.withBinding(nullable.originalName(), nullable.binding());
        } else {
          falseContext = context.withBinding(nullable.originalName(), nullable.binding());
        }
      }
      test = BooleanConditions.lowerCondition(condition, context);
    }
    return TargetIR.conditional(
        test, lower(whenTrue, trueContext), lower(whenFalse, falseContext));
  }

  /**
   * An array literal. Spread elements are concatenated with {@code Enumerable.Concat} and the
   * result materialized with {@code Enumerable.ToArray}.
   */
  private static TargetNode lowerArrayLiteral(Node n, EmitterContext context) {
    IrType type = n.getInferredType();
    ArrayType arrayType = type == null ? null : type.toMaybeArrayType();
    TargetNode elementType =
        arrayType != null
            ? TargetTypes.toTargetType(arrayType.getElementType(), n, context)
            : TargetIR.type("object");
    List<TargetNode> segments = new ArrayList<>();
    List<TargetNode> pending = new ArrayList<>();
    boolean hasSpread = false;
    for (Node element : n.children()) {
      if (element.isSpread()) {
        hasSpread = true;
        if (!pending.isEmpty()) {
          segments.add(TargetIR.arrayCreation(elementType, pending));
          pending = new ArrayList<>();
        }
        segments.add(lower(element.getFirstChild(), context));
      } else {
        pending.add(lower(element, context));
      }
    }
    if (!hasSpread) {
      return TargetIR.arrayCreation(elementType, pending);
    }
    if (!pending.isEmpty()) {
      segments.add(TargetIR.arrayCreation(elementType, pending));
    }
    TargetNode enumerable = TargetIR.identifier(LINQ_ENUMERABLE);
    TargetNode result = segments.get(0);
    for (TargetNode segment : segments.subList(1, segments.size())) {
      result =
          TargetIR.invocation(TargetIR.memberAccess(enumerable, "Concat"), result, segment);
    }
    return TargetIR.invocation(TargetIR.memberAccess(enumerable, "ToArray"), result);
  }

  private static TargetNode instanceofType(Node typeNode) {
    String name = NodeUtil.getQualifiedName(typeNode);
    if (name == null) {
      throw InternalCompilerError.unsupported(typeNode, "instanceof with a computed type");
    }
    return TargetIR.type(name);
  }

  /** {@code <runtime>.Operators.name(arguments)}. */
  static TargetNode runtimeOperator(String name, EmitterContext context, TargetNode... arguments) {
    TargetNode operators =
        TargetIR.identifier(context.getOptions().getRuntimeNamespace() + ".Operators");
    return TargetIR.invocation(TargetIR.memberAccess(operators, name), arguments);
  }
}
