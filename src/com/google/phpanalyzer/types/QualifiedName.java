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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * A namespace-qualified class or function name, such as {@code \Foo\Bar} or {@code \strlen}.
 * Essentially a list of {@linkplain #getComponent components} separated by backslashes, with an
 * optional leading backslash marking the name as {@linkplain #isFullyQualified fully qualified}.
 *
 * <p>Two names are equal iff their {@linkplain #join joined} forms are identical, so {@code \Foo}
 * and {@code Foo} are different names. Case is significant here; callers that want PHP's
 * case-insensitive class lookup lowercase the joined form themselves.
 */
public final class QualifiedName {
  private static final char SEPARATOR = '\\';

  private static final Pattern IDENTIFIER =
      Pattern.compile("[A-Za-z_\\x{80}-\\x{10FFFF}][A-Za-z0-9_\\x{80}-\\x{10FFFF}]*");

  private final ImmutableList<String> terms;
  private final int size;
  private final boolean fullyQualified;

  private QualifiedName(ImmutableList<String> terms, int size, boolean fullyQualified) {
    this.terms = terms;
    this.size = size;
    this.fullyQualified = fullyQualified;
  }

  /**
   * Parses a backslash-separated name.
   *
   * @throws IllegalArgumentException if {@link #isValid} would return false for the string
   */
  public static QualifiedName of(String string) {
    checkArgument(isValid(string), "Not a qualified name: %s", string);
    boolean fullyQualified = string.charAt(0) == SEPARATOR;
    int lastIndex = fullyQualified ? 1 : 0;
    int index;
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    do {
      index = string.indexOf(SEPARATOR, lastIndex);
      builder.add(string.substring(lastIndex, index < 0 ? string.length() : index).intern());
      lastIndex = index + 1;
    } while (index >= 0);
    ImmutableList<String> terms = builder.build();
    return new QualifiedName(terms, terms.size(), fullyQualified);
  }

  /**
   * Returns true if the string is a sequence of identifiers separated by single backslashes,
   * optionally starting with a backslash.
   */
  public static boolean isValid(@Nullable String string) {
    if (string == null || string.isEmpty()) {
      return false;
    }
    int start = string.charAt(0) == SEPARATOR ? 1 : 0;
    if (start == string.length()) {
      return false;
    }
    int index;
    do {
      index = string.indexOf(SEPARATOR, start);
      String term = string.substring(start, index < 0 ? string.length() : index);
      if (!IDENTIFIER.matcher(term).matches()) {
        return false;
      }
      start = index + 1;
    } while (index >= 0);
    return true;
  }

  /**
   * Returns the enclosing namespace, or null for simple names. For the name {@code \Foo\Bar\Baz},
   * this returns an object representing {@code \Foo\Bar}.
   */
  public @Nullable QualifiedName getOwner() {
    return size > 1 ? new QualifiedName(terms, size - 1, fullyQualified) : null;
  }

  /**
   * Returns the last term of this name, or the entire name for simple names. For the name {@code
   * \Foo\Bar\Baz}, this returns "Baz".
   */
  public String getComponent() {
    return terms.get(size - 1);
  }

  /** Returns true if this name has no namespace. */
  public boolean isSimple() {
    return size == 1;
  }

  public boolean isFullyQualified() {
    return fullyQualified;
  }

  /**
   * Returns the components of this name, starting at the outermost namespace. For the name {@code
   * \Foo\Bar\Baz}, this returns ["Foo", "Bar", "Baz"].
   */
  public ImmutableList<String> components() {
    return terms.subList(0, size);
  }

  /** Returns the name as it would be written in source. */
  public String join() {
    StringBuilder sb = new StringBuilder();
    if (fullyQualified) {
      sb.append(SEPARATOR);
    }
    for (int i = 0; i < size; i++) {
      if (i > 0) {
        sb.append(SEPARATOR);
      }
      sb.append(terms.get(i));
    }
    return sb.toString();
  }

  /** Returns true if both names spell the same class, ignoring case as PHP does. */
  boolean equalsIgnoreCase(QualifiedName other) {
    return join().equalsIgnoreCase(other.join());
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof QualifiedName && ((QualifiedName) o).join().equals(join());
  }

  @Override
  public int hashCode() {
    return join().hashCode();
  }

  @Override
  public String toString() {
    return join();
  }
}
