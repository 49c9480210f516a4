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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The declared types of a builtin function, as type strings. A signature is stored as a row whose
 * first element is the return type and whose remaining elements are the parameters in declaration
 * order, each paired with its name.
 */
@AutoValue
public abstract class FunctionSignature {
  private static final FunctionSignature EMPTY =
      new AutoValue_FunctionSignature(Optional.empty(), ImmutableMap.of());

  /** Absent only for an empty row. */
  public abstract Optional<String> returnType();

  /** Parameter name to type string, in declaration order. */
  public abstract ImmutableMap<String, String> parameterTypes();

  public static FunctionSignature create(String returnType, Map<String, String> parameterTypes) {
    return new AutoValue_FunctionSignature(
        Optional.of(returnType), ImmutableMap.copyOf(parameterTypes));
  }

  /**
   * Builds a signature from a row. The key of the first entry is ignored; its value is the return
   * type.
   */
  public static FunctionSignature fromRow(List<Map.Entry<String, String>> row) {
    if (row.isEmpty()) {
      return EMPTY;
    }
    Iterator<Map.Entry<String, String>> entries = row.iterator();
    String returnType = entries.next().getValue();
    Map<String, String> parameterTypes = new LinkedHashMap<>();
    while (entries.hasNext()) {
      Map.Entry<String, String> parameter = entries.next();
      parameterTypes.put(parameter.getKey(), parameter.getValue());
    }
    return create(returnType, parameterTypes);
  }

  /** True for a row with no elements at all, which does not count as a known builtin. */
  public boolean isEmpty() {
    return returnType().isEmpty() && parameterTypes().isEmpty();
  }
}
