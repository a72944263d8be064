/*
 * Copyright 2026 The Hintcheck Authors
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

package org.hintcheck.util;

import java.util.function.IntFunction;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/** Static-only class with methods for building and escaping strings. */
public class StringUtil {

  private StringUtil() {}

  /**
   * Constructs a string by calling the given IntFunction for each int from 0 to size-1, calling
   * {@code String.valueOf()} on each element, separating them with {@code ", "}, and adding the
   * given prefix and suffix.
   */
  public static String joinElements(
      String prefix, String suffix, int size, IntFunction<Object> elements) {
    assert size >= 0;
    return IntStream.range(0, size)
        .mapToObj(i -> String.valueOf(elements.apply(i)))
        .collect(Collectors.joining(", ", prefix, suffix));
  }

  /**
   * Matches the characters that must be escaped in a Java string or character literal, plus the
   * first character of each placeholder delimiter ({@code @}, {@code $} and {@code ?}). Escaping
   * the latter as unicode escapes guarantees that no literal embedded in generated code can be
   * mistaken for a placeholder.
   */
  private static final Pattern NEEDS_ESCAPE = Pattern.compile("[\"'\b\t\n\f\r\\\\@$?]");

  private static String escapeChar(MatchResult mr, String s) {
    return switch (s.charAt(mr.start())) {
      case '"' -> "\\\\\"";
      case '\'' -> "\\\\'";
      case '\\' -> "\\\\\\\\";
      case '\b' -> "\\\\b";
      case '\t' -> "\\\\t";
      case '\n' -> "\\\\n";
      case '\f' -> "\\\\f";
      case '\r' -> "\\\\r";
      case '@' -> "\\\\u0040";
      case '$' -> "\\\\u0024";
      case '?' -> "\\\\u003f";
      default -> throw new AssertionError();
    };
  }

  private static String escapeBody(String s) {
    Matcher m = NEEDS_ESCAPE.matcher(s);
    return m.replaceAll(mr -> escapeChar(mr, s));
  }

  /** Given a string, returns an equivalent quoted Java string literal. */
  public static String escape(String s) {
    if (s == null) {
      return "null";
    }
    return "\"" + escapeBody(s) + "\"";
  }

  /** Given a char, returns an equivalent quoted Java character literal. */
  public static String escape(char c) {
    return "'" + escapeBody(String.valueOf(c)) + "'";
  }

  /**
   * Call {@link String#valueOf} but swallow any errors; intended for formatting error messages
   * about values that we know nothing about.
   *
   * <p>If {@code x} is an array of objects, formats as {@link java.util.Arrays#toString} (but uses
   * {@link #safeToString} for each element).
   */
  public static String safeToString(Object x) {
    if (x instanceof Object[] array) {
      return joinElements("[", "]", array.length, i -> safeToString(array[i]));
    }
    try {
      return String.valueOf(x);
    } catch (RuntimeException | AssertionError nested) {
      return "(can't print)";
    }
  }

  private static final int ID_LENGTH = 4;

  /** Returns a short, arbitrary string useful for identifying this object. */
  public static String id(Object x) {
    if (x == null) {
      return "null";
    }
    String hash = Integer.toHexString(System.identityHashCode(x));
    return hash.substring(Math.max(0, hash.length() - ID_LENGTH));
  }
}
