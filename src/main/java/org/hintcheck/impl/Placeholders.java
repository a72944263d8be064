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

package org.hintcheck.impl;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.function.Function;

/**
 * The three families of placeholder that may appear in generated code, each delimited by its own
 * pair of strings so that replacing one family can never disturb another:
 *
 * <ul>
 *   <li>child-slot placeholders ({@code @[n)!}) mark where the code checking a child hint goes;
 *       each is replaced exactly once, as soon as that child's code has been generated;
 *   <li>forward-reference placeholders ({@code ${FORWARDREF:Name]?}) mark where an expression
 *       evaluating to the named class goes, once the caller has resolved it;
 *   <li>the root-name placeholder marks where the name of the checked parameter or return value
 *       goes, and is replaced separately for each call site.
 * </ul>
 *
 * <p>None of the delimiters can appear in code generated from literals, since {@link
 * org.hintcheck.util.StringUtil#escape} escapes the first character of each.
 */
final class Placeholders {

  private Placeholders() {}

  static final String CHILD_PREFIX = "@[";
  static final String CHILD_SUFFIX = ")!";

  static final String FORWARD_REF_PREFIX = "${FORWARDREF:";
  static final String FORWARD_REF_SUFFIX = "]?";

  static final String ROOT_NAME = "?|PITH_ROOT_NAME`^";

  /** The delimiters that no caller-supplied code may contain. */
  static final ImmutableList<String> DELIMITERS =
      ImmutableList.of(CHILD_PREFIX, FORWARD_REF_PREFIX, ROOT_NAME);

  /** Returns the child-slot placeholder with the given index. */
  static String childSlot(int index) {
    Preconditions.checkArgument(index >= 0);
    return CHILD_PREFIX + index + CHILD_SUFFIX;
  }

  /** Returns the placeholder for a forward reference to the named class. */
  static String forwardRef(String className) {
    Preconditions.checkArgument(
        !className.contains(FORWARD_REF_SUFFIX), "Bad class name \"%s\"", className);
    return FORWARD_REF_PREFIX + className + FORWARD_REF_SUFFIX;
  }

  /** Returns true if {@code code} contains the start of any placeholder. */
  static boolean containsDelimiter(String code) {
    return DELIMITERS.stream().anyMatch(code::contains);
  }

  /**
   * Replaces the single occurrence of {@code placeholder} in {@code code} with {@code replacement}.
   *
   * @throws IllegalStateException if {@code placeholder} does not occur exactly once
   */
  static String splice(String code, String placeholder, String replacement) {
    int start = code.indexOf(placeholder);
    Preconditions.checkState(start >= 0, "No placeholder %s", placeholder);
    Preconditions.checkState(
        code.indexOf(placeholder, start + placeholder.length()) < 0,
        "Placeholder %s occurs more than once",
        placeholder);
    return code.substring(0, start) + replacement + code.substring(start + placeholder.length());
  }

  /**
   * Replaces each forward-reference placeholder in {@code code} with the result of calling {@code
   * resolver} on its class name.
   */
  static String replaceForwardRefs(String code, Function<String, String> resolver) {
    StringBuilder result = new StringBuilder(code.length());
    int next = 0;
    for (; ; ) {
      int start = code.indexOf(FORWARD_REF_PREFIX, next);
      if (start < 0) {
        return result.append(code, next, code.length()).toString();
      }
      int nameStart = start + FORWARD_REF_PREFIX.length();
      int end = code.indexOf(FORWARD_REF_SUFFIX, nameStart);
      Preconditions.checkState(end >= 0, "Unterminated forward reference at %s", start);
      result.append(code, next, start);
      result.append(resolver.apply(code.substring(nameStart, end)));
      next = end + FORWARD_REF_SUFFIX.length();
    }
  }
}
