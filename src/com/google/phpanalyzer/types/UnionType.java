/*
 * Copyright 2026 The Closure Compiler Authors.
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
package com.google.phpanalyzer.types;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The set of types an expression may hold, such as {@code int|string|null}.
 *
 * <p>Members are kept in insertion order and are unique by canonical name; adding a type that is
 * already present does nothing. The {@linkplain #toString string form} sorts the members instead,
 * so two unions with the same members always print, compare and serialize the same way.
 *
 * <p>The empty union stands for "unknown" and can be cast to and from anything.
 *
 * <p>A union is typically built up by repeated {@link #addType} calls while the analyzer works out
 * an expression's type and only read afterwards. Instances are not thread-safe.
 *
 * <p>{@link #equals} and {@link #hashCode} follow the current members, so a union must not be
 * changed while it is a key in a hash-based collection.
 */
public final class UnionType {
  private static final Splitter TYPE_SPLITTER = Splitter.on('|');
  private static final Joiner TYPE_JOINER = Joiner.on('|');

  private final Map<String, AtomicType> types = new LinkedHashMap<>();

  public UnionType() {}

  /** Returns a new, empty union. */
  public static UnionType empty() {
    return new UnionType();
  }

  public static UnionType of(AtomicType... types) {
    return fromTypeList(ImmutableList.copyOf(types));
  }

  public static UnionType fromTypeList(Iterable<AtomicType> typeList) {
    UnionType union = new UnionType();
    for (AtomicType type : typeList) {
      union.addType(type);
    }
    return union;
  }

  /**
   * Parses a {@code |}-delimited type string such as {@code "int|string|null|ClassName"}.
   * Unparsable members are logged and become {@code none}.
   *
   * @see #fromString(String, TypeParseErrorReporter)
   */
  public static UnionType fromString(@Nullable String typeString) {
    return fromString(typeString, TypeParseErrorReporter.LOGGING);
  }

  /**
   * Parses a {@code |}-delimited type string. A null or empty string is the empty union. Each
   * member that cannot be parsed is reported to {@code reporter} and added as {@code none}, and the
   * remaining members are kept.
   */
  public static UnionType fromString(
      @Nullable String typeString, TypeParseErrorReporter reporter) {
    checkNotNull(reporter);
    UnionType union = new UnionType();
    if (Strings.isNullOrEmpty(typeString)) {
      return union;
    }
    for (String segment : TYPE_SPLITTER.split(typeString)) {
      union.addType(AtomicType.parse(typeString, segment, reporter));
    }
    return union;
  }

  /**
   * Returns the type of {@code value}. Syntax nodes are handed to {@code inference}; null is the
   * empty union; anything else is treated as a literal.
   */
  public static UnionType fromLiteralOrNode(NodeTypeInference inference, @Nullable Object value) {
    if (value == null) {
      return new UnionType();
    }
    if (value instanceof SyntaxNode) {
      return checkNotNull(
          inference.inferType((SyntaxNode) value), "No type inferred for %s", value);
    }
    return AtomicType.fromLiteralValue(value).toUnionType();
  }

  /** Inverse of {@link #serialize}. */
  public static UnionType deserialize(String serialized) {
    return fromString(serialized);
  }

  /** Adds {@code type} unless a type with the same canonical name is already present. */
  public void addType(AtomicType type) {
    checkNotNull(type);
    types.putIfAbsent(type.getCanonicalName(), type);
  }

  /** Adds every member of {@code unionType}. */
  public void addUnionType(UnionType unionType) {
    for (AtomicType type : unionType.types.values()) {
      addType(type);
    }
  }

  /**
   * Returns the first type added to this union. Only meaningful when {@link #typeCount} is one;
   * with more members this is just one of them.
   */
  public AtomicType head() {
    checkState(!types.isEmpty(), "head() of the empty union");
    return types.values().iterator().next();
  }

  public boolean hasType(AtomicType type) {
    return types.containsKey(type.getCanonicalName());
  }

  /** Returns true if this union contains any of {@code typeList}. */
  public boolean hasAnyType(Iterable<AtomicType> typeList) {
    for (AtomicType type : typeList) {
      if (hasType(type)) {
        return true;
      }
    }
    return false;
  }

  /** Returns true if {@code type} is the one and only member of this union. */
  public boolean isType(AtomicType type) {
    return types.size() == 1 && head().equals(type);
  }

  /** Returns true iff both unions have exactly the same members. */
  public boolean isEqualTo(UnionType unionType) {
    return toString().equals(unionType.toString());
  }

  public int typeCount() {
    return types.size();
  }

  public boolean isEmpty() {
    return types.isEmpty();
  }

  /** Returns the members in insertion order. */
  public ImmutableList<AtomicType> getTypeList() {
    return ImmutableList.copyOf(types.values());
  }

  /** Returns true if any member refers to the enclosing class, such as {@code self}. */
  public boolean hasSelfType() {
    for (AtomicType type : types.values()) {
      if (type.isSelfLike()) {
        return true;
      }
    }
    return false;
  }

  /** Returns true if this union has exactly one member and that member is a keyword type. */
  public boolean isScalar() {
    return types.size() == 1 && head().isScalar();
  }

  /**
   * Returns true if a value of this type may be used where {@code target} is expected.
   *
   * @see #canCastTo(UnionType, ClassHierarchy)
   */
  public boolean canCastTo(UnionType target) {
    return canCastTo(target, ClassHierarchy.EMPTY);
  }

  /**
   * Returns true if a value of this type may be used where {@code target} is expected. The check
   * errs on the side of allowing the cast:
   *
   * <ol>
   *   <li>identical unions cast;
   *   <li>an empty (unknown) union on either side casts;
   *   <li>a union of just {@code null} on either side casts;
   *   <li>{@code mixed} anywhere on either side casts;
   *   <li>{@code int} casts to {@code float}, but not the other way around;
   *   <li>otherwise the cast is allowed if any source member can cast to any target member.
   * </ol>
   */
  public boolean canCastTo(UnionType target, ClassHierarchy hierarchy) {
    if (isEqualTo(target)) {
      return true;
    }
    if (isEmpty() || target.isEmpty()) {
      return true;
    }
    if (isType(AtomicType.NULL) || target.isType(AtomicType.NULL)) {
      return true;
    }
    if (hasType(AtomicType.MIXED) || target.hasType(AtomicType.MIXED)) {
      return true;
    }
    if (isType(AtomicType.INT) && target.isType(AtomicType.FLOAT)) {
      return true;
    }
    for (AtomicType sourceType : types.values()) {
      for (AtomicType targetType : target.types.values()) {
        if (sourceType.canCastTo(targetType, hierarchy)) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Takes {@code "a|b[]|c|d[]|e"} and returns {@code "b|d"}. A plain {@code array}, {@code ?array}
   * or {@code mixed} member can hold anything, in which case the result is just {@code mixed}.
   */
  public UnionType genericTypes() {
    for (AtomicType type : types.values()) {
      if (type.asNonNullable().isKind(ScalarKind.ARRAY) || type.isKind(ScalarKind.MIXED)) {
        return AtomicType.MIXED.toUnionType();
      }
    }
    UnionType result = new UnionType();
    for (AtomicType type : types.values()) {
      AtomicType elementType = type.getElementType();
      if (elementType != null) {
        result.addType(elementType);
      }
    }
    return result;
  }

  /** Takes {@code "int|float"} and returns {@code "int[]|float[]"}. */
  public UnionType asGenericTypes() {
    UnionType result = new UnionType();
    for (AtomicType type : types.values()) {
      result.addType(type.asGenericType());
    }
    return result;
  }

  /** Takes {@code "a|b[]|c|d[]|e"} and returns {@code "a|c|e"}. */
  public UnionType nonGenericTypes() {
    UnionType result = new UnionType();
    for (AtomicType type : types.values()) {
      if (!type.isGeneric()) {
        result.addType(type);
      }
    }
    return result;
  }

  /** Returns the canonical string form, which {@link #deserialize} turns back into this union. */
  public String serialize() {
    return toString();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof UnionType && isEqualTo((UnionType) o);
  }

  @Override
  public int hashCode() {
    return toString().hashCode();
  }

  /** Returns the members in natural order, joined by {@code |}. */
  @Override
  public String toString() {
    List<String> names = new ArrayList<>(types.keySet());
    names.sort(NaturalOrdering.INSTANCE);
    return TYPE_JOINER.join(names);
  }
}
