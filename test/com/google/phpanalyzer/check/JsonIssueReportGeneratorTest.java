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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class JsonIssueReportGeneratorTest {
  private static final DiagnosticType MISMATCH =
      DiagnosticType.warning("TypeMismatch", "{0} is {1} but {2} is expected");

  @Test
  public void testNoIssues() {
    assertThat(JsonIssueReportGenerator.toJson(ImmutableList.of()))
        .isEqualTo("{\"status\":\"ok\",\"issues\":[]}");
  }

  @Test
  public void testIssueLayout() {
    TypeIssue issue =
        new TypeIssue(
            MISMATCH, MISMATCH.format("$x", "string", "int"), "src/a.php", 3, CheckLevel.WARNING);

    assertThat(JsonIssueReportGenerator.toJson(ImmutableList.of(issue)))
        .isEqualTo(
            "{\"status\":\"ok\",\"issues\":[{\"type\":\"issue\",\"check_name\":\"TypeMismatch\","
                + "\"description\":\"$x is string but int is expected\","
                + "\"location\":{\"path\":\"src/a.php\",\"lines\":{\"begin\":3}}}]}");
  }

  @Test
  public void testGenerateReportPrintsSortedIssues() {
    IssueCollector collector = new IssueCollector();
    collector.report(new TypeIssue(MISMATCH, "second", "b.php", 1, CheckLevel.WARNING));
    collector.report(new TypeIssue(MISMATCH, "first", "a.php", 5, CheckLevel.ERROR));
    ByteArrayOutputStream out = new ByteArrayOutputStream();

    try (PrintStream stream = new PrintStream(out, true, UTF_8)) {
      new JsonIssueReportGenerator(stream).generateReport(collector);
    }

    String report = out.toString(UTF_8);
    assertThat(report).startsWith("{\"status\":\"ok\",\"issues\":[");
    assertThat(report.indexOf("\"first\"")).isLessThan(report.indexOf("\"second\""));
    assertThat(collector.getErrorCount()).isEqualTo(1);
    assertThat(collector.getWarningCount()).isEqualTo(1);
  }
}
