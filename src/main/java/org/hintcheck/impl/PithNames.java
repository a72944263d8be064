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
import com.google.common.base.Strings;

/**
 * Static-only class defining the names of the local variables referenced by generated code.
 *
 * <p>Each composite hint binds the value it checks to a variable named for its depth in the hint
 * tree ({@code pith_0} for the root, {@code pith_1} for its children, and so on). Since the name
 * depends only on the depth, a template refers to the same variables whichever call site it was
 * compiled for. Siblings at the same depth reuse a name, which is safe because each sibling's check
 * is complete before the next one rebinds it.
 */
final class PithNames {

  private PithNames() {}

  /** The prefix of each pith variable name. */
  static final String PITH_VAR_PREFIX = "pith_";

  /** The variable holding the root pith, i.e. the parameter or return value being checked. */
  static final String ROOT_PITH_VAR = pithVar(0);

  /** The variable holding the pseudo-random int drawn once per check call. */
  static final String RANDOM_INT = "random_int";

  /** The variable holding the object whose {@code violation()} method raises on failure. */
  static final String RAISE_EXCEPTION = "raise_exception";

  /** The text added to the indentation for each level of the hint tree. */
  static final String INDENT_UNIT = "    ";

  /** Returns the name of the variable bound by a hint at the given depth. */
  static String pithVar(int depth) {
    Preconditions.checkArgument(depth >= 0);
    return PITH_VAR_PREFIX + depth;
  }

  /** Returns the indentation of code generated for a hint at the given depth. */
  static String indent(int depth) {
    Preconditions.checkArgument(depth >= 0);
    return Strings.repeat(INDENT_UNIT, depth + 2);
  }
}
