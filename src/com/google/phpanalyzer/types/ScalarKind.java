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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * The keyword types of the language. Keywords match regardless of case, so {@code NULL} and {@code
 * Int} are keyword types; the canonical spelling is always lowercase.
 */
public enum ScalarKind {
  INT("int"),
  FLOAT("float"),
  STRING("string"),
  BOOL("bool"),
  ARRAY("array"),
  NULL("null"),
  MIXED("mixed"),
  /** The unknown type. Produced for anything the parser could not make sense of. */
  NONE("none"),
  CALLABLE("callable"),
  OBJECT("object"),
  RESOURCE("resource"),
  VOID("void");

  private static final ImmutableMap<String, ScalarKind> BY_KEYWORD;

  static {
    ImmutableMap.Builder<String, ScalarKind> builder = ImmutableMap.builder();
    for (ScalarKind kind : values()) {
      builder.put(kind.keyword, kind);
    }
    BY_KEYWORD = builder.buildOrThrow();
  }

  private final String keyword;

  ScalarKind(String keyword) {
    this.keyword = keyword;
  }

  public String getKeyword() {
    return keyword;
  }

  /**
   * Whether a {@code ?} prefix means anything for this kind. The types that already admit null, and
   * {@code void}, cannot be made nullable.
   */
  boolean acceptsNullablePrefix() {
    switch (this) {
      case NULL:
      case MIXED:
      case NONE:
      case VOID:
        return false;
      default:
        return true;
    }
  }

  /** Returns the kind spelled by {@code keyword} in any case, or null if it is not a keyword. */
  static @Nullable ScalarKind forKeyword(String keyword) {
    return BY_KEYWORD.get(Ascii.toLowerCase(keyword));
  }
}
