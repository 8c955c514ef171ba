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
import dev.narrowc.ir.types.IrType;
import dev.narrowc.ir.types.LiteralType;
import dev.narrowc.ir.types.PrimitiveType;
import dev.narrowc.ir.types.ReferenceType;
import dev.narrowc.ir.types.UnionType;
import dev.narrowc.target.TargetIR;
import dev.narrowc.target.TargetNode;
import java.util.ArrayList;
import java.util.List;

/** Spells IR types as target type syntax for declarations, patterns and casts. */
final class TargetTypes {

  static final String EXCEPTION_TYPE = "global::System.Exception";

  private static final String DICTIONARY_TYPE = "global::System.Collections.Generic.Dictionary";

  private TargetTypes() {}

  /**
   * Returns the TYPE node for {@code type}. Anonymous object types, {@code void} and {@code
   * never} have no nominal spelling; asking for one is reported against {@code site}.
   */
  static TargetNode toTargetType(IrType type, Node site, EmitterContext context) {
    return TargetIR.type(spell(type, site, context));
  }

  private static String spell(IrType type, Node site, EmitterContext context) {
    switch (type.getKind()) {
      case PRIMITIVE:
        return spellPrimitive(type.toMaybePrimitiveType(), site);
      case LITERAL:
        LiteralType literal = type.toMaybeLiteralType();
        if (literal.isStringLiteral()) {
          return "string";
        }
        return literal.isNumberLiteral() ? "double" : "bool";
      case REFERENCE:
        return spellReference(type.toMaybeReferenceType(), site, context);
      case UNION:
        return spellUnion(type.toMaybeUnionType(), site, context);
      case ARRAY:
        return spell(type.toMaybeArrayType().getElementType(), site, context) + "[]";
      case DICTIONARY:
        return DICTIONARY_TYPE
            + "<"
            + spell(type.toMaybeDictionaryType().getKeyType(), site, context)
            + ", "
            + spell(type.toMaybeDictionaryType().getValueType(), site, context)
            + ">";
      case TYPE_PARAMETER:
        return Identifiers.escape(type.toMaybeTypeParameterType().getName());
      case UNKNOWN:
      case ANY:
        return "object";
      case OBJECT:
      case VOID:
      case NEVER:
        throw new InternalCompilerError(
            site.getToken(),
            "no target type for " + type.getKind() + " type. Add a lowering rule.");
    }
    throw new AssertionError(type.getKind());
  }

  private static String spellPrimitive(PrimitiveType primitive, Node site) {
    switch (primitive.getName()) {
      case PrimitiveType.NUMBER_NAME:
        return "double";
      case PrimitiveType.INT_NAME:
        return "int";
      case PrimitiveType.STRING_NAME:
        return "string";
      case PrimitiveType.BOOLEAN_NAME:
        return "bool";
      case PrimitiveType.CHAR_NAME:
        return "char";
      default:
        // null and undefined on their own carry no information.
        return "object";
    }
  }

  private static String spellReference(ReferenceType ref, Node site, EmitterContext context) {
    if (ref.getResolvedClrType() != null) {
      return ref.getResolvedClrType();
    }
    if (ref.getTypeArguments().isEmpty()) {
      return ref.getName();
    }
    List<String> arguments = new ArrayList<>();
    for (IrType argument : ref.getTypeArguments()) {
      arguments.add(spell(argument, site, context));
    }
    return ref.getName() + "<" + String.join(", ", arguments) + ">";
  }

  private static String spellUnion(UnionType union, Node site, EmitterContext context) {
    ImmutableList<IrType> members = TypeResolution.nonNullishAlternates(union);
    if (members.isEmpty()) {
      return "object";
    }
    if (members.size() == 1) {
      return spell(members.get(0), site, context) + "?";
    }
    if (members.size() > GuardAnalysis.MAX_UNION_ARITY) {
      throw new InternalCompilerError(
          site.getToken(),
          "union of " + members.size() + " members exceeds the runtime Union arity limit of "
              + GuardAnalysis.MAX_UNION_ARITY);
    }
    List<String> spelled = new ArrayList<>();
    for (IrType member : members) {
      spelled.add(spell(member, site, context));
    }
    String unionType =
        context.getOptions().getRuntimeNamespace() + ".Union<" + String.join(", ", spelled) + ">";
    return union.hasNullishMember() ? unionType + "?" : unionType;
  }
}
