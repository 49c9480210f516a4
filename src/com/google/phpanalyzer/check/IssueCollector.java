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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Collects issues and hands them back in a stable order: by path, then line, then check name. */
public final class IssueCollector implements IssueHandler {
  private static final Comparator<TypeIssue> ISSUE_ORDER =
      Comparator.comparing(TypeIssue::path)
          .thenComparingInt(TypeIssue::line)
          .thenComparing(TypeIssue::type)
          .thenComparing(TypeIssue::description);

  private final List<TypeIssue> issues = new ArrayList<>();
  private int errorCount = 0;
  private int warningCount = 0;

  @Override
  public void report(TypeIssue issue) {
    issues.add(issue);
    if (issue.level() == CheckLevel.ERROR) {
      errorCount++;
    } else if (issue.level() == CheckLevel.WARNING) {
      warningCount++;
    }
  }

  public ImmutableList<TypeIssue> getSortedIssues() {
    return ImmutableList.sortedCopyOf(ISSUE_ORDER, issues);
  }

  public int getErrorCount() {
    return errorCount;
  }

  public int getWarningCount() {
    return warningCount;
  }
}
