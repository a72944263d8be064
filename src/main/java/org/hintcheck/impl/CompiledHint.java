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

import org.hintcheck.hint.HintNode;

/**
 * The result of compiling a hint tree: the parameter-agnostic code that checks it, and an
 * equivalent PithCheck that can be evaluated directly. CompiledHints are immutable and are what
 * the {@link HintCompiler}'s cache stores.
 */
public final class CompiledHint {
  public final HintNode hint;
  public final CodeTemplate template;
  public final PithCheck check;

  CompiledHint(HintNode hint, CodeTemplate template, PithCheck check) {
    this.hint = hint;
    this.template = template;
    this.check = check;
  }

  /**
   * Returns a BoundCheck for the named parameter (or {@code "return"}), resolving any forward
   * references with {@code resolver}.
   */
  public BoundCheck bind(String pithName, ForwardRefResolver resolver) {
    return new BoundCheck(this, pithName, resolver);
  }

  /** Returns a BoundCheck for a hint that has no forward references. */
  public BoundCheck bind(String pithName) {
    return bind(pithName, ForwardRefResolver.NONE);
  }

  @Override
  public String toString() {
    return hint + " => " + check;
  }
}
