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

import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringWriter;

/**
 * Prints issues as the JSON response of an {@code analyze_files} request:
 *
 * <pre>
 *   {"status": "ok",
 *    "issues": [{"type": "issue", "check_name": "TypeMismatch", "description": "...",
 *                "location": {"path": "src/a.php", "lines": {"begin": 3}}}]}
 * </pre>
 */
public class JsonIssueReportGenerator {
  private final PrintStream stream;

  /**
   * @param stream where the report is printed. This class does not close the stream
   */
  public JsonIssueReportGenerator(PrintStream stream) {
    this.stream = stream;
  }

  public void generateReport(IssueCollector collector) {
    stream.append(toJson(collector.getSortedIssues()));
  }

  static String toJson(Iterable<TypeIssue> issues) {
    StringWriter buffer = new StringWriter();
    try (JsonWriter jsonWriter = new JsonWriter(buffer)) {
      jsonWriter.beginObject();
      jsonWriter.name("status").value("ok");
      jsonWriter.name("issues").beginArray();
      for (TypeIssue issue : issues) {
        jsonWriter.beginObject();
        jsonWriter.name("type").value("issue");
        jsonWriter.name("check_name").value(issue.checkName());
        jsonWriter.name("description").value(issue.description());
        jsonWriter.name("location").beginObject();
        jsonWriter.name("path").value(issue.path());
        jsonWriter.name("lines").beginObject();
        jsonWriter.name("begin").value(issue.line());
        jsonWriter.endObject();
        jsonWriter.endObject();
        jsonWriter.endObject();
      }
      jsonWriter.endArray();
      jsonWriter.endObject();
      jsonWriter.flush();
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
    return buffer.toString();
  }
}
