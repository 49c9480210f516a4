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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.jspecify.annotations.Nullable;

/**
 * A single concrete type: a keyword type such as {@code int}, a class reference, an array of some
 * other atomic type, or one of the class-relative types {@code self}, {@code static} and {@code
 * $this}.
 *
 * <p>Instances are interned by their canonical name, so there is exactly one {@code AtomicType}
 * for {@code "?int[]"} in the process and it may be compared with {@code ==}. The canonical name
 * follows the grammar
 *
 * <pre>
 *   type := "?"? base ("[]")*
 * </pre>
 *
 * where the {@code ?} makes the base type nullable. {@code ?int[]} is therefore an array of
 * nullable ints, and arrays themselves are never nullable.
 */
public abstract class AtomicType {
  // Must be initialized before any of the constants below.
  private static final ConcurrentMap<String, AtomicType> INTERNED = new ConcurrentHashMap<>();

  public static final AtomicType INT = forKind(ScalarKind.INT);
  public static final AtomicType FLOAT = forKind(ScalarKind.FLOAT);
  public static final AtomicType STRING = forKind(ScalarKind.STRING);
  public static final AtomicType BOOL = forKind(ScalarKind.BOOL);
  public static final AtomicType ARRAY = forKind(ScalarKind.ARRAY);
  public static final AtomicType NULL = forKind(ScalarKind.NULL);
  public static final AtomicType MIXED = forKind(ScalarKind.MIXED);
  public static final AtomicType NONE = forKind(ScalarKind.NONE);
  public static final AtomicType CALLABLE = forKind(ScalarKind.CALLABLE);
  public static final AtomicType OBJECT = forKind(ScalarKind.OBJECT);
  public static final AtomicType RESOURCE = forKind(ScalarKind.RESOURCE);
  public static final AtomicType VOID = forKind(ScalarKind.VOID);

  public static final AtomicType SELF = selfLike(SelfKind.SELF);
  public static final AtomicType STATIC = selfLike(SelfKind.STATIC);
  public static final AtomicType THIS = selfLike(SelfKind.THIS);

  /** The class-relative types, resolved against the enclosing class by the caller. */
  public enum SelfKind {
    SELF("self"),
    STATIC("static"),
    THIS("$this");

    private final String keyword;

    SelfKind(String keyword) {
      this.keyword = keyword;
    }

    public String getKeyword() {
      return keyword;
    }
  }

  private final String canonicalName;

  private AtomicType(String canonicalName) {
    this.canonicalName = canonicalName;
  }

  private static AtomicType intern(AtomicType type) {
    AtomicType existing = INTERNED.putIfAbsent(type.canonicalName, type);
    return existing != null ? existing : type;
  }

  public static AtomicType forKind(ScalarKind kind) {
    return forKind(kind, false);
  }

  /**
   * Returns the keyword type for {@code kind}. The nullable flag is ignored for kinds that cannot
   * carry a {@code ?}.
   */
  public static AtomicType forKind(ScalarKind kind, boolean nullable) {
    return intern(new ScalarType(kind, nullable && kind.acceptsNullablePrefix()));
  }

  public static AtomicType classReference(QualifiedName name) {
    return classReference(name, false);
  }

  public static AtomicType classReference(QualifiedName name, boolean nullable) {
    return intern(new ClassReferenceType(checkNotNull(name), nullable));
  }

  public static AtomicType selfLike(SelfKind kind) {
    return selfLike(kind, false);
  }

  public static AtomicType selfLike(SelfKind kind, boolean nullable) {
    return intern(new SelfLikeType(kind, nullable));
  }

  /**
   * Parses a single type name. Failures are logged and yield {@link #NONE}.
   *
   * @see #parse(String, TypeParseErrorReporter)
   */
  public static AtomicType parse(String name) {
    return parse(name, TypeParseErrorReporter.LOGGING);
  }

  /**
   * Parses a single type name, which must not contain {@code |}. Anything that is neither a keyword
   * nor a class-relative type but is a well-formed {@link QualifiedName} is a class reference.
   * Anything else is reported to {@code reporter} and parsed as {@link #NONE}.
   */
  public static AtomicType parse(String name, TypeParseErrorReporter reporter) {
    return parse(name, name, reporter);
  }

  static AtomicType parse(String typeString, String segment, TypeParseErrorReporter reporter) {
    String base = segment.trim();
    boolean nullable = base.startsWith("?");
    if (nullable) {
      base = base.substring(1);
    }
    int depth = 0;
    while (base.endsWith("[]")) {
      depth++;
      base = base.substring(0, base.length() - 2);
    }

    AtomicType type = parseBase(base, nullable);
    if (type == null) {
      reporter.unparsableType(typeString, segment, describeFailure(base));
      return NONE;
    }
    for (int i = 0; i < depth; i++) {
      type = type.asGenericType();
    }
    return type;
  }

  private static @Nullable AtomicType parseBase(String base, boolean nullable) {
    ScalarKind kind = ScalarKind.forKeyword(base);
    if (kind != null) {
      return forKind(kind, nullable);
    }
    for (SelfKind selfKind : SelfKind.values()) {
      if (selfKind.keyword.equals(base)) {
        return selfLike(selfKind, nullable);
      }
    }
    if (QualifiedName.isValid(base)) {
      return classReference(QualifiedName.of(base), nullable);
    }
    return null;
  }

  private static String describeFailure(String base) {
    if (base.isEmpty()) {
      return "missing type name";
    } else if (base.startsWith("?")) {
      return "repeated nullable prefix";
    } else if (base.contains("[") || base.contains("]")) {
      return "malformed array suffix";
    }
    return "not a valid type name";
  }

  /**
   * Returns the type of a literal value. Java numbers, strings, booleans, collections and maps map
   * onto the corresponding keyword types; any other object becomes a reference to its class.
   */
  public static AtomicType fromLiteralValue(@Nullable Object value) {
    if (value == null) {
      return NULL;
    } else if (value instanceof Integer
        || value instanceof Long
        || value instanceof Short
        || value instanceof Byte
        || value instanceof BigInteger) {
      return INT;
    } else if (value instanceof Float || value instanceof Double || value instanceof BigDecimal) {
      return FLOAT;
    } else if (value instanceof CharSequence || value instanceof Character) {
      return STRING;
    } else if (value instanceof Boolean) {
      return BOOL;
    } else if (value instanceof Collection
        || value instanceof Map
        || value.getClass().isArray()) {
      return ARRAY;
    }
    String javaName = value.getClass().getName();
    return classReference(QualifiedName.of("\\" + javaName.replace('.', '\\').replace('$', '_')));
  }

  /** Returns the name this type is interned under. */
  public final String getCanonicalName() {
    return canonicalName;
  }

  /** True for every keyword type, including {@code array}, {@code mixed} and {@code none}. */
  public boolean isScalar() {
    return false;
  }

  /** True only for {@code T[]}. */
  public boolean isGeneric() {
    return false;
  }

  /** True for {@code self}, {@code static} and {@code $this}. */
  public boolean isSelfLike() {
    return false;
  }

  public boolean isClassReference() {
    return false;
  }

  public boolean isNullable() {
    return false;
  }

  public @Nullable ScalarKind getScalarKind() {
    return null;
  }

  public @Nullable QualifiedName getClassName() {
    return null;
  }

  /** For {@code T[]}, returns {@code T}. */
  public @Nullable AtomicType getElementType() {
    return null;
  }

  public @Nullable SelfKind getSelfKind() {
    return null;
  }

  /** Returns this type without its {@code ?} prefix. */
  public AtomicType asNonNullable() {
    return this;
  }

  /** Returns {@code T[]} for this type {@code T}. */
  public AtomicType asGenericType() {
    return intern(new GenericArrayType(this));
  }

  public UnionType toUnionType() {
    return UnionType.of(this);
  }

  final boolean isKind(ScalarKind kind) {
    return getScalarKind() == kind;
  }

  /**
   * Returns true if a value of this type may be used where {@code other} is expected, without
   * consulting any class hierarchy.
   */
  public boolean canCastTo(AtomicType other) {
    return canCastTo(other, ClassHierarchy.EMPTY);
  }

  /**
   * Returns true if a value of this type may be used where {@code other} is expected. Only {@code
   * int} to {@code float} and subclass to superclass are one-way; every other rule holds in both
   * directions.
   */
  public boolean canCastTo(AtomicType other, ClassHierarchy hierarchy) {
    checkNotNull(other);
    checkNotNull(hierarchy);
    if (this == other || canonicalName.equals(other.canonicalName)) {
      return true;
    }
    if (isKind(ScalarKind.NONE)
        || other.isKind(ScalarKind.NONE)
        || isKind(ScalarKind.MIXED)
        || other.isKind(ScalarKind.MIXED)) {
      return true;
    }
    if (isKind(ScalarKind.NULL)) {
      return other.isNullable();
    }
    if (other.isKind(ScalarKind.NULL)) {
      return isNullable();
    }
    if (isNullable() || other.isNullable()) {
      return asNonNullable().canCastTo(other.asNonNullable(), hierarchy);
    }
    return canCastToNonNullable(other, hierarchy);
  }

  /** Called with two distinct types, neither nullable, {@code null}, {@code mixed} nor unknown. */
  abstract boolean canCastToNonNullable(AtomicType other, ClassHierarchy hierarchy);

  @Override
  public final boolean equals(Object o) {
    return o instanceof AtomicType && ((AtomicType) o).canonicalName.equals(canonicalName);
  }

  @Override
  public final int hashCode() {
    return canonicalName.hashCode();
  }

  @Override
  public final String toString() {
    return canonicalName;
  }

  private static final class ScalarType extends AtomicType {
    private final ScalarKind kind;
    private final boolean nullable;

    ScalarType(ScalarKind kind, boolean nullable) {
      super((nullable ? "?" : "") + kind.getKeyword());
      this.kind = kind;
      this.nullable = nullable;
    }

    @Override
    public boolean isScalar() {
      return true;
    }

    @Override
    public boolean isNullable() {
      return nullable;
    }

    @Override
    public ScalarKind getScalarKind() {
      return kind;
    }

    @Override
    public AtomicType asNonNullable() {
      return nullable ? forKind(kind) : this;
    }

    @Override
    boolean canCastToNonNullable(AtomicType other, ClassHierarchy hierarchy) {
      switch (kind) {
        case INT:
          return other.isKind(ScalarKind.FLOAT);
        case ARRAY:
          return other.isGeneric();
        case OBJECT:
          return other.isSelfLike() || other.isClassReference();
        default:
          return false;
      }
    }
  }

  private static final class ClassReferenceType extends AtomicType {
    private final QualifiedName name;
    private final boolean nullable;

    ClassReferenceType(QualifiedName name, boolean nullable) {
      super((nullable ? "?" : "") + name.join());
      this.name = name;
      this.nullable = nullable;
    }

    @Override
    public boolean isClassReference() {
      return true;
    }

    @Override
    public boolean isNullable() {
      return nullable;
    }

    @Override
    public QualifiedName getClassName() {
      return name;
    }

    @Override
    public AtomicType asNonNullable() {
      return nullable ? classReference(name) : this;
    }

    @Override
    boolean canCastToNonNullable(AtomicType other, ClassHierarchy hierarchy) {
      if (other.isKind(ScalarKind.OBJECT) || other.isSelfLike()) {
        return true;
      }
      if (other.isClassReference()) {
        QualifiedName target = other.getClassName();
        return name.equalsIgnoreCase(target) || hierarchy.isSubclassOf(name, target);
      }
      return false;
    }
  }

  private static final class GenericArrayType extends AtomicType {
    private final AtomicType elementType;

    GenericArrayType(AtomicType elementType) {
      super(elementType.getCanonicalName() + "[]");
      this.elementType = elementType;
    }

    @Override
    public boolean isGeneric() {
      return true;
    }

    @Override
    public AtomicType getElementType() {
      return elementType;
    }

    @Override
    boolean canCastToNonNullable(AtomicType other, ClassHierarchy hierarchy) {
      if (other.isKind(ScalarKind.ARRAY)) {
        return true;
      }
      return other.isGeneric() && elementType.canCastTo(other.getElementType(), hierarchy);
    }
  }

  private static final class SelfLikeType extends AtomicType {
    private final SelfKind kind;
    private final boolean nullable;

    SelfLikeType(SelfKind kind, boolean nullable) {
      super((nullable ? "?" : "") + kind.getKeyword());
      this.kind = kind;
      this.nullable = nullable;
    }

    @Override
    public boolean isSelfLike() {
      return true;
    }

    @Override
    public boolean isNullable() {
      return nullable;
    }

    @Override
    public SelfKind getSelfKind() {
      return kind;
    }

    @Override
    public AtomicType asNonNullable() {
      return nullable ? selfLike(kind) : this;
    }

    // Which class these stand for is decided by the caller, so any class-like target is accepted.
    @Override
    boolean canCastToNonNullable(AtomicType other, ClassHierarchy hierarchy) {
      return other.isSelfLike() || other.isClassReference() || other.isKind(ScalarKind.OBJECT);
    }
  }
}
