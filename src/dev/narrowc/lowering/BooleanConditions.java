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
import dev.narrowc.ir.types.IrType;
import dev.narrowc.ir.types.LiteralType;
import dev.narrowc.ir.types.PrimitiveType;
import dev.narrowc.target.TargetIR;
import dev.narrowc.target.TargetNode;
import org.jspecify.annotations.Nullable;

/**
 * Lowers an expression used as a condition. The target language only accepts {@code bool}
 * conditions, so a value of another type is turned into its truthiness test.
 */
final class BooleanConditions {

  private BooleanConditions() {}

  static TargetNode lowerCondition(Node n, EmitterContext context) {
    switch (n.getToken()) {
      case AND:
        return ExpressionLowering.lowerAnd(n, context);
      case OR:
        return TargetIR.binary(
            "||",
            lowerCondition(n.getFirstChild(), context),
            lowerCondition(n.getLastChild(), context));
      default:
        break;
    }
    TargetNode lowered = ExpressionLowering.lower(n, context);
    if (NodeUtil.isBooleanResult(n)) {
      return lowered;
    }
    return toBoolean(lowered, effectiveType(n, context), context);
  }

  /** Whether {@code n} is known to produce a {@code bool}. */
  static boolean isBoolean(Node n, EmitterContext context) {
    if (NodeUtil.isBooleanResult(n)) {
      return true;
    }
    IrType type = effectiveType(n, context);
    return type != null && isBooleanType(type);
  }

  /**
   * The type a read of {@code n} has after narrowing: the type recorded on its binding when there
   * is one, otherwise the inferred type.
   */
  private static @Nullable IrType effectiveType(Node n, EmitterContext context) {
    String key = NodeUtil.getNarrowingKey(n);
    if (key != null) {
      NarrowedBinding binding = context.getBinding(key);
      if (binding != null && binding.type() != null) {
        return binding.type();
      }
    }
    return n.getInferredType();
  }

  private static TargetNode toBoolean(
      TargetNode value, @Nullable IrType type, EmitterContext context) {
    if (type == null || type.isUnknownOrAny()) {
      return isTruthy(value, context);
    }
    boolean nullable = TypeResolution.isNullable(type);
    IrType base = TypeResolution.resolveTypeAlias(TypeResolution.stripNullish(type), context);
    if (isBooleanType(base)) {
      return nullable ? TargetIR.binary("==", value, TargetIR.booleanLiteral(true)) : value;
    }
    if (isStringType(base)) {
      return TargetIR.not(
          TargetIR.invocation(
              TargetIR.memberAccess(TargetIR.identifier("string"), "IsNullOrEmpty"), value));
    }
    if (isNumericType(base)) {
      TargetNode zero = TargetIR.numberLiteral(0);
      TargetNode operand = nullable ? TargetIR.binary("??", value, zero) : value;
      return TargetIR.binary("!=", operand, zero);
    }
    switch (base.getKind()) {
      case REFERENCE:
        if (!nullable && TypeResolution.isDefinitelyValueType(base, context)) {
          return isTruthy(value, context);
        }
        return TargetIR.binary("!=", value, TargetIR.nullLiteral());
      case ARRAY:
      case DICTIONARY:
      case OBJECT:
        return TargetIR.binary("!=", value, TargetIR.nullLiteral());
      default:
        return isTruthy(value, context);
    }
  }

  private static TargetNode isTruthy(TargetNode value, EmitterContext context) {
    return ExpressionLowering.runtimeOperator("IsTruthy", context, value);
  }

  private static boolean isBooleanType(IrType type) {
    LiteralType literal = type.toMaybeLiteralType();
    return type.isPrimitive(PrimitiveType.BOOLEAN_NAME)
        || (literal != null && literal.isBooleanLiteral());
  }

  private static boolean isStringType(IrType type) {
    LiteralType literal = type.toMaybeLiteralType();
    return type.isPrimitive(PrimitiveType.STRING_NAME)
        || (literal != null && literal.isStringLiteral());
  }

  private static boolean isNumericType(IrType type) {
    LiteralType literal = type.toMaybeLiteralType();
    return type.isPrimitive(PrimitiveType.NUMBER_NAME)
        || type.isPrimitive(PrimitiveType.INT_NAME)
        || (literal != null && literal.isNumberLiteral());
  }
}
