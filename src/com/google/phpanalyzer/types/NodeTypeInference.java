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
 * Infers the union type of a syntax node. Implementations walk the AST and are bound to the lexical
 * context in which the node appears.
 *
 * @see UnionType#fromLiteralOrNode
 */
@FunctionalInterface
public interface NodeTypeInference {
  /** Returns the inferred type of {@code node}. Never null; unknown is the empty union. */
  UnionType inferType(SyntaxNode node);
}
