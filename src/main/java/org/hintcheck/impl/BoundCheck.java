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
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * A CompiledHint specialized for a particular parameter or return value: it knows the name to
 * report when a value fails, and how to resolve the hint's forward references.
 *
 * <p>Each call to {@link #check} or {@link #isValid} draws a new random int to choose which items
 * of sequences are sampled, so repeated checks of a sequence with some invalid items may fail on
 * some calls and pass on others. A sequence whose items are all valid always passes, and a
 * non-empty sequence whose items are all invalid always fails.
 */
public final class BoundCheck {
  /** The name used for a return value. */
  public static final String RETURN = "return";

  public final CompiledHint compiled;
  public final String pithName;
  private final ForwardRefResolver resolver;

  /** Forward references are resolved when the code is first asked for. */
  private final Supplier<String> code;

  BoundCheck(CompiledHint compiled, String pithName, ForwardRefResolver resolver) {
    Preconditions.checkArgument(!pithName.isEmpty(), "Empty pith name");
    this.compiled = compiled;
    this.pithName = pithName;
    this.resolver = resolver;
    this.code =
        Suppliers.memoize(
            () -> compiled.template.resolveForwardRefs(resolver).bindRootName(pithName));
  }

  /**
   * Returns the final Java code for this check, with forward references resolved and the pith name
   * in place.
   *
   * @throws UnresolvedForwardRefException if a forward reference can't be resolved
   */
  public String code() {
    return code.get();
  }

  /** Returns true if {@code pith} satisfies the hint, sampling with a freshly drawn random int. */
  public boolean isValid(Object pith) {
    return compiled.check.test(pith, CheckContext.random(resolver));
  }

  /** Returns true if {@code pith} satisfies the hint, sampling with the given random int. */
  public boolean isValid(Object pith, int randomInt) {
    return compiled.check.test(pith, new CheckContext(randomInt, resolver));
  }

  /**
   * Returns {@code pith} if it satisfies the hint, sampling with a freshly drawn random int.
   *
   * @throws HintViolationException if it does not
   */
  @CanIgnoreReturnValue
  public <T> T check(T pith) {
    return check(pith, CheckContext.random(resolver));
  }

  /**
   * Returns {@code pith} if it satisfies the hint in the given context.
   *
   * @throws HintViolationException if it does not
   */
  @CanIgnoreReturnValue
  public <T> T check(T pith, CheckContext context) {
    if (!compiled.check.test(pith, context)) {
      Integer randomInt = compiled.template.readsRandomInt() ? context.randomInt : null;
      throw new HintViolationException(pithName, pith, compiled.hint, randomInt);
    }
    return pith;
  }

  @Override
  public String toString() {
    return pithName + ": " + compiled.hint;
  }
}
