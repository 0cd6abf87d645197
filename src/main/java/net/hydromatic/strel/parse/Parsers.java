/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.strel.parse;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableSet;

/** Utilities for parsing. */
public final class Parsers {
  private static final CharMatcher LETTER =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z'));

  private static final CharMatcher LETTER_OR_DIGIT =
      LETTER.or(CharMatcher.inRange('0', '9'));

  /** Words that the lexer reads as keywords, not identifiers. */
  private static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "true",
          "false",
          "X",
          "G",
          "F",
          "U",
          "everywhere",
          "somewhere",
          "escape",
          "reach");

  private Parsers() {}

  /**
   * Given quoted identifier {@code "a b"} returns {@code a b}. Converts escaped
   * double-quote {@code \"} and escaped backslash {@code \\} to the character
   * they stand for; any other backslash is kept.
   */
  public static String unquoteIdentifier(String s) {
    checkArgument(s.length() >= 2);
    checkArgument(s.charAt(0) == '"');
    checkArgument(s.charAt(s.length() - 1) == '"');
    s = s.substring(1, s.length() - 1);
    if (!s.contains("\\")) {
      // There are no escaped characters. Take the quick route.
      return s;
    }
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\\' && i + 1 < s.length()) {
        char c2 = s.charAt(i + 1);
        if (c2 == '"' || c2 == '\\') {
          b.append(c2);
          ++i;
          continue;
        }
      }
      b.append(c);
    }
    return b.toString();
  }

  /**
   * Appends an identifier. Encloses it in double-quotes, escaping double-quote
   * and backslash, unless it is a bare identifier: ASCII letters and digits,
   * starting with a letter, and not a keyword.
   */
  public static StringBuilder appendId(StringBuilder buf, String id) {
    if (isBareId(id)) {
      return buf.append(id);
    }
    buf.append('"');
    for (int i = 0; i < id.length(); i++) {
      char c = id.charAt(i);
      if (c == '"' || c == '\\') {
        buf.append('\\');
      }
      buf.append(c);
    }
    return buf.append('"');
  }

  /**
   * Returns whether an identifier can be written without quotes and read back
   * as the same identifier.
   */
  static boolean isBareId(String id) {
    return !id.isEmpty()
        && LETTER.matches(id.charAt(0))
        && LETTER_OR_DIGIT.matchesAllOf(id)
        && !KEYWORDS.contains(id);
  }

  /**
   * Converts an integer literal, optionally preceded by a minus sign, to an
   * integer. Throws {@link IllegalArgumentException} if it does not fit.
   */
  public static int parseInteger(boolean negative, String s) {
    try {
      return Integer.parseInt(negative ? "-" + s : s);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "Integer literal out of range: " + s, e);
    }
  }

  /**
   * Converts an integer or real literal, optionally preceded by a minus sign,
   * to a double.
   */
  public static double parseReal(boolean negative, String s) {
    try {
      final double d = Double.parseDouble(s);
      return negative ? -d : d;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid real literal: " + s, e);
    }
  }
}

// End Parsers.java
