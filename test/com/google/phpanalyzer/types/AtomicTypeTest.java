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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Unit tests for {@link AtomicType}. */
@RunWith(JUnit4.class)
public final class AtomicTypeTest {
  private final List<String> parseErrors = new ArrayList<>();

  private final TypeParseErrorReporter reporter =
      (typeString, segment, reason) -> parseErrors.add(segment + ": " + reason);

  private AtomicType parse(String name) {
    return AtomicType.parse(name, reporter);
  }

  @Test
  public void testKeywordsAreInterned() {
    assertThat(parse("int")).isSameInstanceAs(AtomicType.INT);
    assertThat(parse("float")).isSameInstanceAs(AtomicType.FLOAT);
    assertThat(parse("none")).isSameInstanceAs(AtomicType.NONE);
    assertThat(parse(" string ")).isSameInstanceAs(AtomicType.STRING);
    assertThat(parse("$this")).isSameInstanceAs(AtomicType.THIS);
    assertThat(parseErrors).isEmpty();
  }

  @Test
  public void testNullablePrefixAppliesToTheBaseType() {
    AtomicType type = parse("?int[]");

    assertThat(type.isGeneric()).isTrue();
    assertThat(type.isNullable()).isFalse();
    assertThat(type.getElementType()).isSameInstanceAs(parse("?int"));
    assertThat(type.getElementType().isNullable()).isTrue();
    assertThat(type.getElementType().asNonNullable()).isSameInstanceAs(AtomicType.INT);
    assertThat(type.toString()).isEqualTo("?int[]");
  }

  @Test
  public void testNullablePrefixIsDroppedWhereMeaningless() {
    assertThat(parse("?mixed")).isSameInstanceAs(AtomicType.MIXED);
    assertThat(parse("?null")).isSameInstanceAs(AtomicType.NULL);
    assertThat(parse("?void")).isSameInstanceAs(AtomicType.VOID);
  }

  @Test
  public void testNestedArrays() {
    AtomicType type = parse("int[][]");

    assertThat(type.getElementType()).isSameInstanceAs(parse("int[]"));
    assertThat(type.getElementType().getElementType()).isSameInstanceAs(AtomicType.INT);
    assertThat(AtomicType.INT.asGenericType().asGenericType()).isSameInstanceAs(type);
  }

  @Test
  public void testClassReferences() {
    AtomicType type = parse("\\Foo\\Bar");

    assertThat(type.isClassReference()).isTrue();
    assertThat(type.isScalar()).isFalse();
    assertThat(type.getClassName()).isEqualTo(QualifiedName.of("\\Foo\\Bar"));
    assertThat(parse("?Foo").isNullable()).isTrue();
    assertThat(parse("?Foo").asNonNullable()).isSameInstanceAs(parse("Foo"));
  }

  @Test
  public void testSelfLikeTypes() {
    assertThat(parse("self").getSelfKind()).isEqualTo(AtomicType.SelfKind.SELF);
    assertThat(parse("static").isSelfLike()).isTrue();
    assertThat(parse("?static").isNullable()).isTrue();
    assertThat(parse("self[]").isSelfLike()).isFalse();
  }

  @Test
  public void testKeywordsIgnoreCase() {
    assertThat(parse("NULL")).isSameInstanceAs(AtomicType.NULL);
    assertThat(parse("Int")).isSameInstanceAs(AtomicType.INT);
    assertThat(parse("?Array")).isSameInstanceAs(AtomicType.forKind(ScalarKind.ARRAY, true));
    assertThat(parse("STRING[]")).isSameInstanceAs(AtomicType.STRING.asGenericType());
    assertThat(parse("Int").isClassReference()).isFalse();
  }

  @Test
  public void testUnparsableNamesBecomeNone() {
    assertThat(parse("")).isSameInstanceAs(AtomicType.NONE);
    assertThat(parse("[]")).isSameInstanceAs(AtomicType.NONE);
    assertThat(parse("??int")).isSameInstanceAs(AtomicType.NONE);
    assertThat(parse("int[")).isSameInstanceAs(AtomicType.NONE);
    assertThat(parse("Foo-Bar")).isSameInstanceAs(AtomicType.NONE);

    assertThat(parseErrors)
        .containsExactly(
            ": missing type name",
            "[]: missing type name",
            "??int: repeated nullable prefix",
            "int[: malformed array suffix",
            "Foo-Bar: not a valid type name")
        .inOrder();
  }

  @Test
  public void testIsScalar() {
    assertThat(AtomicType.INT.isScalar()).isTrue();
    assertThat(AtomicType.ARRAY.isScalar()).isTrue();
    assertThat(AtomicType.MIXED.isScalar()).isTrue();
    assertThat(AtomicType.INT.asGenericType().isScalar()).isFalse();
    assertThat(AtomicType.SELF.isScalar()).isFalse();
  }

  @Test
  public void testFromLiteralValue() {
    assertThat(AtomicType.fromLiteralValue(42)).isSameInstanceAs(AtomicType.INT);
    assertThat(AtomicType.fromLiteralValue(42L)).isSameInstanceAs(AtomicType.INT);
    assertThat(AtomicType.fromLiteralValue(1.5)).isSameInstanceAs(AtomicType.FLOAT);
    assertThat(AtomicType.fromLiteralValue("text")).isSameInstanceAs(AtomicType.STRING);
    assertThat(AtomicType.fromLiteralValue('c')).isSameInstanceAs(AtomicType.STRING);
    assertThat(AtomicType.fromLiteralValue(true)).isSameInstanceAs(AtomicType.BOOL);
    assertThat(AtomicType.fromLiteralValue(null)).isSameInstanceAs(AtomicType.NULL);
    assertThat(AtomicType.fromLiteralValue(ImmutableList.of(1))).isSameInstanceAs(AtomicType.ARRAY);
    assertThat(AtomicType.fromLiteralValue(new int[0])).isSameInstanceAs(AtomicType.ARRAY);
    assertThat(AtomicType.fromLiteralValue(new Object()).toString())
        .isEqualTo("\\java\\lang\\Object");
  }

  @Test
  public void testCanCastToNumericWideningIsOneWay() {
    assertThat(AtomicType.INT.canCastTo(AtomicType.FLOAT)).isTrue();
    assertThat(AtomicType.FLOAT.canCastTo(AtomicType.INT)).isFalse();
    assertThat(parse("int[]").canCastTo(parse("float[]"))).isTrue();
    assertThat(parse("float[]").canCastTo(parse("int[]"))).isFalse();
  }

  @Test
  public void testCanCastToNullable() {
    assertThat(AtomicType.NULL.canCastTo(parse("?int"))).isTrue();
    assertThat(parse("?int").canCastTo(AtomicType.NULL)).isTrue();
    assertThat(AtomicType.NULL.canCastTo(AtomicType.INT)).isFalse();
    assertThat(parse("?int").canCastTo(AtomicType.INT)).isTrue();
    assertThat(AtomicType.INT.canCastTo(parse("?int"))).isTrue();
    assertThat(parse("?int").canCastTo(AtomicType.STRING)).isFalse();
  }

  @Test
  public void testCanCastToArrays() {
    assertThat(parse("int[]").canCastTo(AtomicType.ARRAY)).isTrue();
    assertThat(AtomicType.ARRAY.canCastTo(parse("int[]"))).isTrue();
    assertThat(parse("int[]").canCastTo(AtomicType.INT)).isFalse();
    assertThat(parse("?int[]").canCastTo(parse("int[]"))).isTrue();
  }

  @Test
  public void testCanCastToClasses() {
    AtomicType child = parse("\\App\\Child");
    AtomicType base = parse("\\App\\Base");
    ClassHierarchy hierarchy =
        (subclass, superclass) ->
            subclass.join().equals("\\App\\Child") && superclass.join().equals("\\App\\Base");

    assertThat(child.canCastTo(base)).isFalse();
    assertThat(child.canCastTo(base, hierarchy)).isTrue();
    assertThat(base.canCastTo(child, hierarchy)).isFalse();
    assertThat(child.canCastTo(AtomicType.OBJECT)).isTrue();
    assertThat(AtomicType.OBJECT.canCastTo(child)).isTrue();
    assertThat(AtomicType.OBJECT.canCastTo(parse("?App\\Child"))).isTrue();
    assertThat(parse("\\app\\child").canCastTo(child)).isTrue();
    assertThat(child.canCastTo(AtomicType.STRING)).isFalse();
  }

  @Test
  public void testCanCastToSelfLike() {
    AtomicType foo = parse("Foo");

    assertThat(AtomicType.SELF.canCastTo(foo)).isTrue();
    assertThat(foo.canCastTo(AtomicType.STATIC)).isTrue();
    assertThat(AtomicType.THIS.canCastTo(AtomicType.SELF)).isTrue();
    assertThat(AtomicType.OBJECT.canCastTo(AtomicType.THIS)).isTrue();
    assertThat(AtomicType.SELF.canCastTo(AtomicType.INT)).isFalse();
  }

  @Test
  public void testCanCastToUnknownAndMixed() {
    assertThat(AtomicType.NONE.canCastTo(parse("Foo"))).isTrue();
    assertThat(AtomicType.STRING.canCastTo(AtomicType.NONE)).isTrue();
    assertThat(AtomicType.MIXED.canCastTo(AtomicType.INT)).isTrue();
    assertThat(parse("Foo[]").canCastTo(AtomicType.MIXED)).isTrue();
    assertThat(AtomicType.STRING.canCastTo(AtomicType.INT)).isFalse();
  }

  @Test
  public void testConcurrentParsesShareOneInstance() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Callable<AtomicType>> tasks = new ArrayList<>();
      for (int i = 0; i < 32; i++) {
        tasks.add(() -> AtomicType.parse("\\Concurrently\\Parsed[]"));
      }
      AtomicType first = null;
      for (Future<AtomicType> result : executor.invokeAll(tasks)) {
        if (first == null) {
          first = result.get();
        }
        assertThat(result.get()).isSameInstanceAs(first);
      }
    } finally {
      executor.shutdownNow();
    }
  }
}
