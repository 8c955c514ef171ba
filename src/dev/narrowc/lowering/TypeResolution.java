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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import dev.narrowc.ir.Token;
import dev.narrowc.ir.types.ArrayType;
import dev.narrowc.ir.types.DictionaryType;
import dev.narrowc.ir.types.IrType;
import dev.narrowc.ir.types.LiteralType;
import dev.narrowc.ir.types.ObjectType;
import dev.narrowc.ir.types.PropertySignature;
import dev.narrowc.ir.types.ReferenceType;
import dev.narrowc.ir.types.UnionType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Type queries used by guard analysis: nullish stripping, alias chasing, union member lookup and
 * property resolution through local and cross-module type tables.
 */
final class TypeResolution {

  private static final ImmutableSet<String> VALUE_PRIMITIVES =
      ImmutableSet.of("number", "int", "boolean", "char");

  private static final ImmutableSet<String> CLR_VALUE_TYPES =
      ImmutableSet.of(
          "System.DateTime",
          "System.DateOnly",
          "System.TimeOnly",
          "System.TimeSpan",
          "System.Guid",
          "System.Decimal");

  private static final String GLOBAL_PREFIX = "global::";

  private static final int MAX_ALIAS_DEPTH = 32;

  private TypeResolution() {}

  /**
   * Removes {@code null} and {@code undefined} from a union that has exactly one other member.
   * Any other type is returned unchanged (the same instance).
   */
  static IrType stripNullish(IrType type) {
    UnionType union = type.toMaybeUnionType();
    if (union == null) {
      return type;
    }
    List<IrType> nonNullish = nonNullishAlternates(union);
    return nonNullish.size() == 1 ? nonNullish.get(0) : type;
  }

  /** Whether {@code type} is a union including {@code null} or {@code undefined}. */
  static boolean isNullable(IrType type) {
    UnionType union = type.toMaybeUnionType();
    return union != null && union.hasNullishMember();
  }

  static ImmutableList<IrType> nonNullishAlternates(UnionType union) {
    ImmutableList.Builder<IrType> out = ImmutableList.builder();
    for (IrType alternate : union.getAlternates()) {
      if (!alternate.isNullish()) {
        out.add(alternate);
      }
    }
    return out.build();
  }

  /**
   * Whether a non-null value of {@code type} is a target value type, which is wrapped in {@code
   * Nullable<T>} when optional and read through {@code .Value}.
   */
  static boolean isDefinitelyValueType(IrType type, EmitterContext context) {
    IrType base = stripNullish(type);
    if (base.isPrimitiveType()) {
      return VALUE_PRIMITIVES.contains(base.toMaybePrimitiveType().getName());
    }
    if (base.isLiteralType()) {
      return !base.toMaybeLiteralType().isStringLiteral();
    }
    ReferenceType ref = base.toMaybeReferenceType();
    if (ref != null && ref.getResolvedClrType() != null) {
      String clr = stripGlobalPrefix(ref.getResolvedClrType());
      return CLR_VALUE_TYPES.contains(clr)
          || context.getOptions().getExtraValueTypes().contains(clr);
    }
    return false;
  }

  /**
   * Follows a reference to a type alias, declared locally or in another module, to the aliased
   * type, substituting type arguments. Non-alias types are returned unchanged.
   */
  static IrType resolveTypeAlias(IrType type, EmitterContext context) {
    IrType current = type;
    for (int depth = 0; depth < MAX_ALIAS_DEPTH; depth++) {
      ReferenceType ref = current.toMaybeReferenceType();
      if (ref == null) {
        return current;
      }
      LocalTypeInfo alias = findAlias(ref, context);
      if (alias == null) {
        return current;
      }
      current =
          substitute(alias.getAliasedType(), alias.getTypeParameters(), ref.getTypeArguments());
    }
    return current;
  }

  private static @Nullable LocalTypeInfo findAlias(ReferenceType ref, EmitterContext context) {
    LocalTypeInfo local = context.getLocalTypes().get(ref.getName());
    if (local != null) {
      return local.getKind() == LocalTypeInfo.Kind.TYPE_ALIAS ? local : null;
    }
    String name = stripGlobalPrefix(ref.getName());
    List<String> candidates = new ArrayList<>();
    LocalTypeInfo found = null;
    for (ModuleInfo module : context.getOptions().getModuleTypes().values()) {
      String simpleName = name.substring(name.lastIndexOf('.') + 1);
      LocalTypeInfo info = module.getLocalTypes().get(simpleName);
      if (info == null || info.getKind() != LocalTypeInfo.Kind.TYPE_ALIAS) {
        continue;
      }
      String fqn = module.getNamespace() + "." + simpleName;
      if (name.indexOf('.') != -1 && !fqn.equals(name)) {
        continue;
      }
      candidates.add(fqn);
      found = info;
    }
    if (candidates.size() > 1) {
      candidates.sort(null);
      throw new InternalCompilerError(
          Token.NAME,
          "ambiguous type alias reference '" + name + "'. Candidates: "
              + String.join(", ", candidates));
    }
    return found;
  }

  /** Replaces type parameters named in {@code names} by the matching {@code arguments}. */
  static IrType substitute(IrType type, List<String> names, List<IrType> arguments) {
    if (names.isEmpty() || arguments.isEmpty()) {
      return type;
    }
    ImmutableMap.Builder<String, IrType> mapping = ImmutableMap.builder();
    for (int i = 0; i < names.size() && i < arguments.size(); i++) {
      mapping.put(names.get(i), arguments.get(i));
    }
    return substitute(type, mapping.buildKeepingLast());
  }

  private static IrType substitute(IrType type, ImmutableMap<String, IrType> mapping) {
    switch (type.getKind()) {
      case TYPE_PARAMETER:
        IrType replacement = mapping.get(type.toMaybeTypeParameterType().getName());
        return replacement != null ? replacement : type;
      case REFERENCE:
        ReferenceType ref = type.toMaybeReferenceType();
        if (ref.getTypeArguments().isEmpty()) {
          IrType byName = mapping.get(ref.getName());
          return byName != null ? byName : type;
        }
        return ReferenceType.create(
            ref.getName(), substituteAll(ref.getTypeArguments(), mapping),
            ref.getResolvedClrType());
      case UNION:
        return UnionType.create(substituteAll(type.toMaybeUnionType().getAlternates(), mapping));
      case ARRAY:
        return ArrayType.create(substitute(type.toMaybeArrayType().getElementType(), mapping));
      case DICTIONARY:
        DictionaryType dict = type.toMaybeDictionaryType();
        return DictionaryType.create(
            substitute(dict.getKeyType(), mapping), substitute(dict.getValueType(), mapping));
      case OBJECT:
        ImmutableList.Builder<PropertySignature> members = ImmutableList.builder();
        for (PropertySignature member : type.toMaybeObjectType().getMembers()) {
          members.add(
              PropertySignature.create(
                  member.getName(), substitute(member.getType(), mapping), member.isOptional()));
        }
        return ObjectType.create(members.build());
      default:
        return type;
    }
  }

  private static ImmutableList<IrType> substituteAll(
      List<IrType> types, ImmutableMap<String, IrType> mapping) {
    ImmutableList.Builder<IrType> out = ImmutableList.builder();
    for (IrType type : types) {
      out.add(substitute(type, mapping));
    }
    return out.build();
  }

  /**
   * The 0-based index of {@code target} among {@code alternates}, matching reference types by
   * name, or -1. Only reference-type targets are supported.
   */
  static int findUnionMemberIndex(
      List<IrType> alternates, IrType target, EmitterContext context) {
    IrType resolvedTarget = resolveTypeAlias(stripNullish(target), context);
    ReferenceType targetRef = resolvedTarget.toMaybeReferenceType();
    if (targetRef == null) {
      return -1;
    }
    for (int i = 0; i < alternates.size(); i++) {
      ReferenceType member = alternates.get(i).toMaybeReferenceType();
      if (member != null && member.getName().equals(targetRef.getName())) {
        return i;
      }
    }
    return -1;
  }

  /**
   * The declared type of property {@code name} on {@code type}: an object type member, a
   * class or interface property (interfaces searched through their base interfaces), or a
   * property of an aliased type. Returns null when it cannot be determined.
   */
  static @Nullable IrType getPropertyType(IrType type, String name, EmitterContext context) {
    return resolvePropertyType(type, name, context, new HashSet<>());
  }

  private static @Nullable IrType resolvePropertyType(
      IrType type, String name, EmitterContext context, Set<String> visited) {
    ObjectType object = type.toMaybeObjectType();
    if (object != null) {
      PropertySignature member = object.getMember(name);
      return member == null ? null : member.getType();
    }
    ReferenceType ref = type.toMaybeReferenceType();
    if (ref == null) {
      return null;
    }
    LocalTypeInfo info = resolveLocalTypeInfo(ref, context);
    if (info == null) {
      return null;
    }
    String cycleKey = ref.getResolvedClrType() != null ? ref.getResolvedClrType() : ref.getName();
    if (!visited.add(cycleKey)) {
      return null;
    }
    switch (info.getKind()) {
      case TYPE_ALIAS:
        return resolvePropertyType(
            substitute(info.getAliasedType(), info.getTypeParameters(), ref.getTypeArguments()),
            name,
            context,
            visited);
      case CLASS:
      case INTERFACE:
        PropertySignature own = info.getOwnProperty(name);
        if (own != null) {
          return substitute(own.getType(), info.getTypeParameters(), ref.getTypeArguments());
        }
        for (IrType base : info.getExtendsTypes()) {
          IrType inherited = resolvePropertyType(base, name, context, visited);
          if (inherited != null) {
            return substitute(inherited, info.getTypeParameters(), ref.getTypeArguments());
          }
        }
        return null;
    }
    throw new AssertionError(info.getKind());
  }

  /**
   * Finds the declaration of a reference type in the current module's types or, failing that,
   * in exactly one other module. Several candidate modules are disambiguated by the namespace of
   * the target type name; if that does not settle it the lookup declines.
   */
  static @Nullable LocalTypeInfo resolveLocalTypeInfo(ReferenceType ref, EmitterContext context) {
    String simpleName = ref.getSimpleName();
    LocalTypeInfo local = context.getLocalTypes().get(simpleName);
    if (local != null) {
      return local;
    }
    List<ModuleInfo> matches = new ArrayList<>();
    for (ModuleInfo module : context.getOptions().getModuleTypes().values()) {
      if (module.getLocalTypes().containsKey(simpleName)) {
        matches.add(module);
      }
    }
    if (matches.isEmpty()) {
      return null;
    }
    if (matches.size() == 1) {
      return matches.get(0).getLocalTypes().get(simpleName);
    }
    String fqn = null;
    if (ref.getResolvedClrType() != null) {
      fqn = stripGlobalPrefix(ref.getResolvedClrType());
    } else if (ref.getName().indexOf('.') != -1) {
      fqn = ref.getName();
    }
    if (fqn != null && fqn.indexOf('.') != -1) {
      String namespace = fqn.substring(0, fqn.lastIndexOf('.'));
      LocalTypeInfo scoped = null;
      int scopedCount = 0;
      for (ModuleInfo module : matches) {
        if (module.getNamespace().equals(namespace)) {
          scoped = module.getLocalTypes().get(simpleName);
          scopedCount++;
        }
      }
      if (scopedCount == 1) {
        return scoped;
      }
    }
    return null;
  }

  /**
   * Whether reference type {@code type} declares property {@code name}, consulting local and
   * cross-module declarations and then the external type member index. A simple type name that
   * suffix-matches several fully-qualified names in the member index is a compiler error; one
   * that matches none declines.
   */
  static boolean hasProperty(
      ReferenceType type, String name, EmitterContext context, Token guardToken) {
    LocalTypeInfo info = resolveLocalTypeInfo(type, context);
    if (info != null && info.getKind() != LocalTypeInfo.Kind.TYPE_ALIAS) {
      if (collectProperties(type, context).contains(name)) {
        return true;
      }
    }
    Map<String, Collection<String>> index =
        context.getOptions().getTypeMemberIndex().asMap();
    if (index.isEmpty()) {
      return false;
    }
    String fqn;
    if (type.getResolvedClrType() != null) {
      fqn = stripGlobalPrefix(type.getResolvedClrType());
    } else if (type.getName().indexOf('.') != -1) {
      fqn = type.getName();
    } else {
      List<String> matches = new ArrayList<>();
      for (String key : index.keySet()) {
        if (key.endsWith("." + type.getName()) || key.endsWith("." + type.getName() + "__Alias")) {
          matches.add(key);
        }
      }
      if (matches.isEmpty()) {
        return false;
      }
      if (matches.size() > 1) {
        matches.sort(null);
        throw new InternalCompilerError(
            guardToken,
            "ambiguous union member type '" + type.getName() + "' for `in` narrowing. Candidates: "
                + String.join(", ", matches));
      }
      fqn = matches.get(0);
    }
    return context.getOptions().getTypeMemberIndex().containsEntry(fqn, name);
  }

  /** All property names of a class or interface, including inherited interface members. */
  static ImmutableSet<String> collectProperties(ReferenceType type, EmitterContext context) {
    Set<String> out = new LinkedHashSet<>();
    collectProperties(type, context, out, new HashSet<>());
    return ImmutableSet.copyOf(out);
  }

  private static void collectProperties(
      ReferenceType type, EmitterContext context, Set<String> out, Set<String> visited) {
    if (!visited.add(type.getName())) {
      return;
    }
    LocalTypeInfo info = resolveLocalTypeInfo(type, context);
    if (info == null || info.getKind() == LocalTypeInfo.Kind.TYPE_ALIAS) {
      return;
    }
    for (PropertySignature property : info.getProperties()) {
      out.add(property.getName());
    }
    if (info.getKind() == LocalTypeInfo.Kind.INTERFACE) {
      for (IrType base : info.getExtendsTypes()) {
        ReferenceType baseRef = base.toMaybeReferenceType();
        if (baseRef != null) {
          collectProperties(baseRef, context, out, visited);
        }
      }
    }
  }

  /**
   * The set of literal values a discriminant property may hold: the value of a literal type, or
   * the values of a union made only of literals. Any non-literal member (null and undefined
   * included) disqualifies the property and yields null.
   */
  static @Nullable ImmutableSet<Object> tryGetLiteralSet(IrType type, EmitterContext context) {
    IrType resolved = resolveTypeAlias(type, context);
    LiteralType literal = resolved.toMaybeLiteralType();
    if (literal != null) {
      return ImmutableSet.of(literal.getValue());
    }
    UnionType union = resolved.toMaybeUnionType();
    if (union == null) {
      return null;
    }
    ImmutableSet.Builder<Object> out = ImmutableSet.builder();
    for (IrType alternate : union.getAlternates()) {
      LiteralType member = resolveTypeAlias(alternate, context).toMaybeLiteralType();
      if (member == null) {
        return null;
      }
      out.add(member.getValue());
    }
    return out.build();
  }

  static String stripGlobalPrefix(String name) {
    return name.startsWith(GLOBAL_PREFIX) ? name.substring(GLOBAL_PREFIX.length()) : name;
  }
}
