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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.phpanalyzer.types.BuiltinRegistry;
import com.google.phpanalyzer.types.ClassHierarchy;
import com.google.phpanalyzer.types.QualifiedName;
import com.google.phpanalyzer.types.SyntaxNode;
import com.google.phpanalyzer.types.UnionType;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Turns cast judgments into issues. Every check answers whether the code passed it, and reports an
 * issue through the {@link IssueHandler} when it did not and the issue's level is on.
 *
 * <p>The checks inherit the leniency of {@link UnionType#canCastTo}: unknown types, {@code null}
 * and {@code mixed} never cause a mismatch.
 */
public class TypeValidator {
  private static final Logger logger = Logger.getLogger(TypeValidator.class.getName());

  static final DiagnosticType TYPE_MISMATCH =
      DiagnosticType.warning("TypeMismatch", "{0} is {1} but {2} is expected");

  static final DiagnosticType TYPE_MISMATCH_ARGUMENT_INTERNAL =
      DiagnosticType.warning(
          "TypeMismatchArgumentInternal", "Argument {0} ({1}) is {2} but {3}() takes {4}");

  static final DiagnosticType TYPE_MISMATCH_PROPERTY =
      DiagnosticType.warning(
          "TypeMismatchProperty", "Assigning {0} to property {1}::{2} which is {3}");

  static final DiagnosticType UNPARSABLE_TYPE =
      DiagnosticType.warning("UnparsableType", "Unparsable type \"{0}\" in \"{1}\": {2}");

  /** Every diagnostic this validator can report, by key. */
  static final ImmutableMap<String, DiagnosticType> DIAGNOSTIC_TYPES =
      Maps.uniqueIndex(
          ImmutableList.of(
              TYPE_MISMATCH,
              TYPE_MISMATCH_ARGUMENT_INTERNAL,
              TYPE_MISMATCH_PROPERTY,
              UNPARSABLE_TYPE),
          type -> type.key);

  private final TypeCheckOptions options;
  private final IssueHandler issueHandler;

  public TypeValidator(TypeCheckOptions options, IssueHandler issueHandler) {
    this.options = checkNotNull(options);
    this.issueHandler = checkNotNull(issueHandler);
  }

  /**
   * Expects {@code found} to be usable where {@code required} is.
   *
   * @param what describes the value, for example "Return value of foo()"
   * @return true if the cast is allowed
   */
  public boolean expectCanCast(
      String path, int line, UnionType found, UnionType required, String what) {
    if (found.canCastTo(required, options.getClassHierarchy())) {
      return true;
    }
    report(path, line, TYPE_MISMATCH, what, found, required);
    return false;
  }

  public boolean expectCanCast(
      String path, SyntaxNode node, UnionType found, UnionType required, String what) {
    return expectCanCast(path, node.getLineNumber(), found, required, what);
  }

  /**
   * Expects the arguments of a call to a builtin function to match its declared parameters. Calls
   * to functions without a known signature pass, and so do surplus arguments.
   *
   * @param argumentTypes the types of the arguments, in call order
   * @return true if every argument with a matching parameter can be cast to it
   */
  public boolean expectArgumentsMatch(
      String path, int line, QualifiedName function, List<UnionType> argumentTypes) {
    BuiltinRegistry registry = options.getBuiltinRegistry();
    if (!registry.signatureExists(function)) {
      return true;
    }
    ClassHierarchy hierarchy = options.getClassHierarchy();
    boolean matches = true;
    int index = 0;
    for (Map.Entry<String, UnionType> parameter :
        registry.functionParameterTypes(function).entrySet()) {
      if (index >= argumentTypes.size()) {
        break;
      }
      UnionType argument = argumentTypes.get(index);
      if (!argument.canCastTo(parameter.getValue(), hierarchy)) {
        report(
            path,
            line,
            TYPE_MISMATCH_ARGUMENT_INTERNAL,
            index + 1,
            parameter.getKey(),
            argument,
            function.join(),
            parameter.getValue());
        matches = false;
      }
      index++;
    }
    return matches;
  }

  /**
   * Expects {@code assigned} to fit the declared type of a builtin class property. Properties the
   * builtin tables do not know pass.
   */
  public boolean expectPropertyAssignable(
      String path, int line, String className, String propertyName, UnionType assigned) {
    BuiltinRegistry registry = options.getBuiltinRegistry();
    if (!registry.hasClassProperty(className, propertyName)) {
      return true;
    }
    UnionType declared = registry.classPropertyType(className, propertyName);
    if (assigned.canCastTo(declared, options.getClassHierarchy())) {
      return true;
    }
    report(path, line, TYPE_MISMATCH_PROPERTY, assigned, className, propertyName, declared);
    return false;
  }

  /**
   * Parses a type written in the source, such as a doc comment type. Members that cannot be parsed
   * are reported as issues and become {@code none}.
   */
  public UnionType parseDeclaredType(String path, int line, String typeString) {
    return UnionType.fromString(
        typeString,
        (string, segment, reason) -> report(path, line, UNPARSABLE_TYPE, segment, string, reason));
  }

  private void report(String path, int line, DiagnosticType type, Object... arguments) {
    CheckLevel level = options.getWarningLevel(type);
    if (!level.isOn()) {
      return;
    }
    TypeIssue issue = new TypeIssue(type, type.format(arguments), path, line, level);
    logger.fine(issue.toString());
    issueHandler.report(issue);
  }
}
