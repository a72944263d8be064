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
import com.google.common.collect.ImmutableSet;
import java.util.function.Function;
import org.hintcheck.util.StringUtil;

/**
 * The generated Java code that checks a value against a hint, before it has been specialized for
 * a particular parameter or return value.
 *
 * <p>The code is a statement that assumes it will be embedded in a method that has declared
 * {@code Object} variables {@code pith_0} through {@code pith_<n-1>} (where n is {@link
 * #pithVariableCount}), initialized {@code pith_0} to the value being checked, declared an {@code
 * int random_int} (if {@link #readsRandomInt}), and declared a {@code raise_exception} variable
 * whose {@code violation()} method returns the exception to throw. It may contain two kinds of
 * placeholder (see {@link Placeholders}), replaced by two separate passes:
 *
 * <ul>
 *   <li>{@link #resolveForwardRefs} replaces forward references with class expressions; and
 *   <li>{@link #bindRootName} replaces the root-name placeholder with the (quoted) name of the
 *       parameter or return value, returning the final code.
 * </ul>
 *
 * <p>A CodeTemplate never contains child-slot placeholders; those are all replaced while the
 * template is being generated. CodeTemplates are immutable.
 */
public final class CodeTemplate {
  private final String code;
  private final ImmutableSet<String> forwardRefs;
  private final boolean readsRandomInt;
  private final int pithVariableCount;

  CodeTemplate(
      String code,
      ImmutableSet<String> forwardRefs,
      boolean readsRandomInt,
      int pithVariableCount) {
    Preconditions.checkArgument(
        !code.contains(Placeholders.CHILD_PREFIX), "Unresolved child placeholder in %s", code);
    Preconditions.checkArgument(pithVariableCount > 0);
    this.code = code;
    this.forwardRefs = forwardRefs;
    this.readsRandomInt = readsRandomInt;
    this.pithVariableCount = pithVariableCount;
  }

  /** Returns the code, including any remaining placeholders. */
  public String code() {
    return code;
  }

  /** Returns the names of the classes referenced by unresolved forward-reference placeholders. */
  public ImmutableSet<String> forwardRefs() {
    return forwardRefs;
  }

  /** True if the code reads {@code random_int}, i.e. samples at least one sequence. */
  public boolean readsRandomInt() {
    return readsRandomInt;
  }

  /** The number of {@code pith_<depth>} variables the code uses. */
  public int pithVariableCount() {
    return pithVariableCount;
  }

  /**
   * Returns a CodeTemplate with each forward-reference placeholder replaced by the expression that
   * {@code classExpression} returns for its class name. Returns this CodeTemplate if there are no
   * forward references.
   */
  public CodeTemplate resolveForwardRefs(Function<String, String> classExpression) {
    if (forwardRefs.isEmpty()) {
      return this;
    }
    String resolved = Placeholders.replaceForwardRefs(code, classExpression);
    return new CodeTemplate(resolved, ImmutableSet.of(), readsRandomInt, pithVariableCount);
  }

  /** Equivalent to {@code resolveForwardRefs(resolver::classExpression)}. */
  public CodeTemplate resolveForwardRefs(ForwardRefResolver resolver) {
    return resolveForwardRefs(resolver::classExpression);
  }

  /**
   * Returns the final code for checking the named parameter (or {@code "return"} for a return
   * value). This is a pure string replacement; calling it again with the same name returns the same
   * code, and the template itself is unchanged.
   *
   * @throws IllegalStateException if any forward references are still unresolved
   */
  public String bindRootName(String pithName) {
    Preconditions.checkState(
        forwardRefs.isEmpty(), "Unresolved forward references %s", forwardRefs);
    return code.replace(Placeholders.ROOT_NAME, StringUtil.escape(pithName));
  }

  @Override
  public String toString() {
    return code;
  }
}
