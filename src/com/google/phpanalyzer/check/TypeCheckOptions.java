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
package com.google.phpanalyzer.check;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Splitter;
import com.google.phpanalyzer.types.BuiltinRegistry;
import com.google.phpanalyzer.types.ClassHierarchy;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Settings for {@link TypeValidator}. */
public class TypeCheckOptions {
  private static final Splitter LEVEL_SPLITTER = Splitter.on('=').trimResults();

  // Keyed by DiagnosticType.key.
  private final Map<String, CheckLevel> warningLevels = new HashMap<>();

  private ClassHierarchy classHierarchy = ClassHierarchy.EMPTY;

  private @Nullable BuiltinRegistry builtinRegistry = null;

  /** Reports {@code type} at {@code level} instead of its default level. */
  public void setWarningLevel(DiagnosticType type, CheckLevel level) {
    warningLevels.put(type.key, checkNotNull(level));
  }

  /**
   * Applies overrides written as {@code key=level}, for example {@code TypeMismatch=error} or
   * {@code UnparsableType=off}.
   *
   * @throws IllegalArgumentException if an entry is malformed or names an unknown diagnostic
   *     type or level
   */
  public void setWarningLevels(Iterable<String> overrides) {
    for (String override : overrides) {
      List<String> parts = LEVEL_SPLITTER.splitToList(override);
      checkArgument(
          parts.size() == 2 && !parts.get(0).isEmpty(),
          "Expected key=level but got: %s",
          override);
      String key = parts.get(0);
      checkArgument(
          TypeValidator.DIAGNOSTIC_TYPES.containsKey(key), "Unknown diagnostic type: %s", key);
      warningLevels.put(key, CheckLevel.parse(parts.get(1)));
    }
  }

  public CheckLevel getWarningLevel(DiagnosticType type) {
    return warningLevels.getOrDefault(type.key, type.defaultLevel);
  }

  /** Sets the class relations used when a class reference is cast to another class. */
  public void setClassHierarchy(ClassHierarchy classHierarchy) {
    this.classHierarchy = checkNotNull(classHierarchy);
  }

  public ClassHierarchy getClassHierarchy() {
    return classHierarchy;
  }

  /** Replaces the bundled builtin tables. */
  public void setBuiltinRegistry(BuiltinRegistry builtinRegistry) {
    this.builtinRegistry = checkNotNull(builtinRegistry);
  }

  public BuiltinRegistry getBuiltinRegistry() {
    return builtinRegistry != null ? builtinRegistry : BuiltinRegistry.getDefault();
  }
}
