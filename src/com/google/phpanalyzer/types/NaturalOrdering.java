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

import java.io.Serializable;
import java.util.Comparator;

/**
 * Orders strings the way a person would: runs of digits compare by numeric value, so {@code
 * "Foo2"} sorts before {@code "Foo10"}. Everything else compares by character. Strings that only
 * differ in leading zeros fall back to plain string order, so the ordering stays consistent with
 * {@code equals}.
 */
final class NaturalOrdering implements Comparator<String>, Serializable {
  static final NaturalOrdering INSTANCE = new NaturalOrdering();

  private static final long serialVersionUID = 1L;

  private NaturalOrdering() {}

  @Override
  public int compare(String left, String right) {
    int i = 0;
    int j = 0;
    while (i < left.length() && j < right.length()) {
      char a = left.charAt(i);
      char b = right.charAt(j);
      if (isDigit(a) && isDigit(b)) {
        int endA = endOfDigits(left, i);
        int endB = endOfDigits(right, j);
        int result = compareDigitRuns(left.substring(i, endA), right.substring(j, endB));
        if (result != 0) {
          return result;
        }
        i = endA;
        j = endB;
      } else {
        if (a != b) {
          return a < b ? -1 : 1;
        }
        i++;
        j++;
      }
    }
    int remaining = (left.length() - i) - (right.length() - j);
    if (remaining != 0) {
      return remaining < 0 ? -1 : 1;
    }
    return left.compareTo(right);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static int endOfDigits(String s, int start) {
    int end = start;
    while (end < s.length() && isDigit(s.charAt(end))) {
      end++;
    }
    return end;
  }

  private static int compareDigitRuns(String a, String b) {
    String strippedA = stripLeadingZeros(a);
    String strippedB = stripLeadingZeros(b);
    if (strippedA.length() != strippedB.length()) {
      return strippedA.length() < strippedB.length() ? -1 : 1;
    }
    return strippedA.compareTo(strippedB);
  }

  private static String stripLeadingZeros(String digits) {
    int start = 0;
    while (start < digits.length() - 1 && digits.charAt(start) == '0') {
      start++;
    }
    return digits.substring(start);
  }
}
