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

import static java.util.Objects.requireNonNull;

/**
 * One problem found by the type checks.
 *
 * @param type the kind of problem
 * @param description the filled-in message
 * @param path the file the problem is in, relative to the analysis root
 * @param line one-indexed line of the problem, or -1 if unknown
 * @param level the level it was reported at, after the options were applied
 */
public record TypeIssue(
    DiagnosticType type, String description, String path, int line, CheckLevel level) {
  public TypeIssue {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(path, "path");
    requireNonNull(level, "level");
  }

  /** The name of the check that found the problem. */
  public String checkName() {
    return type.key;
  }

  @Override
  public String toString() {
    return path + ":" + line + ": " + level + " - [" + type.key + "] " + description;
  }
}
