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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only tables describing the classes and functions that ship with the language: the declared
 * type of every builtin class property and the signature of every builtin function.
 *
 * <p>Class names are looked up case-insensitively and function names case-sensitively, matching
 * the data the tables are built from.
 *
 * <p>Lookups of a property or return type that is not in the tables are programming errors and
 * throw {@link IllegalArgumentException}; callers check {@link #hasClassProperty} or {@link
 * #signatureExists} first. {@link #functionParameterTypes} is the exception and answers an unknown
 * function with an empty map.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class BuiltinRegistry {
  private final ImmutableMap<String, ImmutableMap<String, String>> classProperties;
  private final ImmutableMap<String, FunctionSignature> functionSignatures;

  private BuiltinRegistry(Builder builder) {
    ImmutableMap.Builder<String, ImmutableMap<String, String>> classes = ImmutableMap.builder();
    for (Map.Entry<String, Map<String, String>> entry : builder.classProperties.entrySet()) {
      classes.put(entry.getKey(), ImmutableMap.copyOf(entry.getValue()));
    }
    this.classProperties = classes.buildOrThrow();
    this.functionSignatures = ImmutableMap.copyOf(builder.functionSignatures);
  }

  /** Returns the registry built from the tables bundled with this library. */
  public static BuiltinRegistry getDefault() {
    return DefaultHolder.INSTANCE;
  }

  // Loaded by the first call to getDefault(); class initialization publishes it safely.
  private static final class DefaultHolder {
    static final BuiltinRegistry INSTANCE = BuiltinRegistryLoader.loadDefault();
  }

  public static Builder builder() {
    return new Builder();
  }

  private static String classKey(String className) {
    return className.toLowerCase(Locale.ROOT);
  }

  public boolean hasClass(String className) {
    return classProperties.containsKey(classKey(className));
  }

  public boolean hasClassProperty(String className, String propertyName) {
    ImmutableMap<String, String> properties = classProperties.get(classKey(className));
    return properties != null && properties.containsKey(propertyName);
  }

  /**
   * Returns the declared type of a builtin class property.
   *
   * @throws IllegalArgumentException if the class or the property is unknown; check {@link
   *     #hasClassProperty} first
   */
  public UnionType classPropertyType(String className, String propertyName) {
    ImmutableMap<String, String> properties = classProperties.get(classKey(className));
    checkArgument(
        properties != null,
        "%s is not a builtin class; guard the lookup with hasClassProperty()",
        className);
    String typeName = properties.get(propertyName);
    checkArgument(
        typeName != null,
        "%s::%s is not a builtin property; guard the lookup with hasClassProperty()",
        className,
        propertyName);
    return UnionType.fromString(typeName);
  }

  /**
   * Returns the types of the parameters of a builtin function, by name and in declaration order.
   * The return type is not included. An unknown function has no parameters.
   */
  public ImmutableMap<String, UnionType> functionParameterTypes(QualifiedName functionName) {
    FunctionSignature signature = functionSignatures.get(functionName.join());
    if (signature == null || signature.isEmpty()) {
      return ImmutableMap.of();
    }
    ImmutableMap.Builder<String, UnionType> parameterTypes = ImmutableMap.builder();
    for (Map.Entry<String, String> parameter : signature.parameterTypes().entrySet()) {
      parameterTypes.put(parameter.getKey(), UnionType.fromString(parameter.getValue()));
    }
    return parameterTypes.buildOrThrow();
  }

  /**
   * Returns the declared return type of a builtin function.
   *
   * @throws IllegalArgumentException if the function is unknown; check {@link #signatureExists}
   *     first
   */
  public UnionType functionReturnType(QualifiedName functionName) {
    checkArgument(
        signatureExists(functionName),
        "%s is not a builtin function; guard the lookup with signatureExists()",
        functionName);
    return UnionType.fromString(functionSignatures.get(functionName.join()).returnType().get());
  }

  /** Returns true if the tables hold a non-empty signature for the function. */
  public boolean signatureExists(QualifiedName functionName) {
    FunctionSignature signature = functionSignatures.get(functionName.join());
    return signature != null && !signature.isEmpty();
  }

  public int getClassCount() {
    return classProperties.size();
  }

  public int getFunctionCount() {
    return functionSignatures.size();
  }

  /** Collects the tables before they are frozen into a {@link BuiltinRegistry}. */
  public static final class Builder {
    private final Map<String, Map<String, String>> classProperties = new LinkedHashMap<>();
    private final Map<String, FunctionSignature> functionSignatures = new LinkedHashMap<>();

    private Builder() {}

    /** Declares a builtin class, which may have no properties. */
    @CanIgnoreReturnValue
    public Builder addClass(String className) {
      classProperties.computeIfAbsent(classKey(className), k -> new LinkedHashMap<>());
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addClassProperty(String className, String propertyName, String typeName) {
      checkNotNull(propertyName);
      checkNotNull(typeName);
      classProperties
          .computeIfAbsent(classKey(className), k -> new LinkedHashMap<>())
          .put(propertyName, typeName);
      return this;
    }

    /** Registers a function under its fully qualified name, such as {@code \strlen}. */
    @CanIgnoreReturnValue
    public Builder addFunction(String qualifiedName, FunctionSignature signature) {
      checkNotNull(signature);
      functionSignatures.put(QualifiedName.of(qualifiedName).join(), signature);
      return this;
    }

    public BuiltinRegistry build() {
      return new BuiltinRegistry(this);
    }
  }
}
