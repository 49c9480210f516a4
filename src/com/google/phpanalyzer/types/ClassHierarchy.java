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

/**
 * Answers class-hierarchy questions for the cast checks. Building the hierarchy is not the job of
 * this package; the analyzer supplies whatever it has resolved so far.
 */
public interface ClassHierarchy {
  /** A hierarchy that knows of no relations between classes. */
  ClassHierarchy EMPTY = (subclass, superclass) -> false;

  /**
   * Returns true if {@code subclass} extends or implements {@code superclass}, directly or
   * transitively.
   */
  boolean isSubclassOf(QualifiedName subclass, QualifiedName superclass);
}
