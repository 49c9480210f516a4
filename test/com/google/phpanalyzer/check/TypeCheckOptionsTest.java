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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.phpanalyzer.types.BuiltinRegistry;
import com.google.phpanalyzer.types.ClassHierarchy;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TypeCheckOptionsTest {

  @Test
  public void testDefaults() {
    TypeCheckOptions options = new TypeCheckOptions();

    assertThat(options.getWarningLevel(TypeValidator.TYPE_MISMATCH)).isEqualTo(CheckLevel.WARNING);
    assertThat(options.getClassHierarchy()).isSameInstanceAs(ClassHierarchy.EMPTY);
    assertThat(options.getBuiltinRegistry()).isSameInstanceAs(BuiltinRegistry.getDefault());
  }

  @Test
  public void testWarningLevelsFromStrings() {
    TypeCheckOptions options = new TypeCheckOptions();
    options.setWarningLevels(ImmutableList.of("TypeMismatch=error", " UnparsableType = Off "));

    assertThat(options.getWarningLevel(TypeValidator.TYPE_MISMATCH)).isEqualTo(CheckLevel.ERROR);
    assertThat(options.getWarningLevel(TypeValidator.UNPARSABLE_TYPE)).isEqualTo(CheckLevel.OFF);
    assertThat(options.getWarningLevel(TypeValidator.TYPE_MISMATCH_PROPERTY))
        .isEqualTo(CheckLevel.WARNING);
  }

  @Test
  public void testMalformedWarningLevels() {
    TypeCheckOptions options = new TypeCheckOptions();

    assertThrows(
        IllegalArgumentException.class,
        () -> options.setWarningLevels(ImmutableList.of("TypeMismatch")));
    assertThrows(
        IllegalArgumentException.class,
        () -> options.setWarningLevels(ImmutableList.of("=error")));
    assertThrows(
        IllegalArgumentException.class,
        () -> options.setWarningLevels(ImmutableList.of("TypeMismatch=loud")));
  }

  @Test
  public void testUnknownDiagnosticTypeIsRejected() {
    TypeCheckOptions options = new TypeCheckOptions();

    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> options.setWarningLevels(ImmutableList.of("TypeMismach=off")));

    assertThat(e).hasMessageThat().contains("TypeMismach");
    assertThat(options.getWarningLevel(TypeValidator.TYPE_MISMATCH)).isEqualTo(CheckLevel.WARNING);
  }

  @Test
  public void testEveryDiagnosticTypeCanBeConfigured() {
    TypeCheckOptions options = new TypeCheckOptions();
    for (String key : TypeValidator.DIAGNOSTIC_TYPES.keySet()) {
      options.setWarningLevels(ImmutableList.of(key + "=error"));
    }

    for (DiagnosticType type : TypeValidator.DIAGNOSTIC_TYPES.values()) {
      assertThat(options.getWarningLevel(type)).isEqualTo(CheckLevel.ERROR);
    }
  }
}
