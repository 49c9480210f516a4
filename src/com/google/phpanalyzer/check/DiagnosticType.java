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

import static com.google.common.base.Preconditions.checkNotNull;

import java.text.MessageFormat;

/**
 * A kind of problem the type checks can find. The key doubles as the check name in reports. The
 * description is a {@link MessageFormat} pattern filled in with the arguments of each issue.
 */
public final class DiagnosticType implements Comparable<DiagnosticType> {
  public final String key;

  public final String format;

  /** The level used unless the options say otherwise. */
  public final CheckLevel defaultLevel;

  public static DiagnosticType error(String key, String descriptionFormat) {
    return new DiagnosticType(key, CheckLevel.ERROR, descriptionFormat);
  }

  public static DiagnosticType warning(String key, String descriptionFormat) {
    return new DiagnosticType(key, CheckLevel.WARNING, descriptionFormat);
  }

  public static DiagnosticType disabled(String key, String descriptionFormat) {
    return new DiagnosticType(key, CheckLevel.OFF, descriptionFormat);
  }

  private DiagnosticType(String key, CheckLevel defaultLevel, String format) {
    this.key = checkNotNull(key);
    this.defaultLevel = checkNotNull(defaultLevel);
    this.format = checkNotNull(format);
  }

  /** Fills in the description for one occurrence. */
  String format(Object... arguments) {
    return new MessageFormat(format).format(arguments);
  }

  @Override
  public boolean equals(Object type) {
    return type instanceof DiagnosticType && ((DiagnosticType) type).key.equals(key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public int compareTo(DiagnosticType diagnosticType) {
    return key.compareTo(diagnosticType.key);
  }

  @Override
  public String toString() {
    return key + ": " + format;
  }
}
