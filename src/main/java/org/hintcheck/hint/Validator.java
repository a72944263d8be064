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

package org.hintcheck.hint;

import com.google.common.base.Preconditions;
import java.util.function.Predicate;

/**
 * A caller-defined constraint attached to an {@link HintKind#ANNOTATED} hint.
 *
 * <p>A Validator has two equivalent forms: a Predicate used when a compiled check is evaluated
 * directly, and the text of a Java boolean expression used in generated code. The expression refers
 * to the value being checked as {@value #PITH_MARKER}; for example a Validator requiring non-empty
 * strings might be created with
 *
 * <pre>{@code
 * Validator.of("!((String) {obj}).isEmpty()", s -> !((String) s).isEmpty())
 * }</pre>
 *
 * <p>Validators use identity equality; two Validators created from the same text are distinct, and
 * hints using them compile separately.
 */
public final class Validator {
  /** The marker replaced by the name of the variable holding the pith. */
  public static final String PITH_MARKER = "{obj}";

  private final String expression;
  private final Predicate<Object> predicate;

  private Validator(String expression, Predicate<Object> predicate) {
    this.expression = expression;
    this.predicate = predicate;
  }

  /**
   * Returns a new Validator. {@code expression} must be a Java boolean expression that is true
   * exactly when {@code predicate} is, with each reference to the value being checked written as
   * {@value #PITH_MARKER}.
   */
  public static Validator of(String expression, Predicate<Object> predicate) {
    Preconditions.checkNotNull(predicate);
    Preconditions.checkArgument(
        expression.contains(PITH_MARKER),
        "Expression \"%s\" never refers to %s",
        expression,
        PITH_MARKER);
    return new Validator(expression, predicate);
  }

  /** Returns the expression text, with each {@value #PITH_MARKER} replaced by {@code pithVar}. */
  public String expressionFor(String pithVar) {
    return expression.replace(PITH_MARKER, pithVar);
  }

  /** Returns the unsubstituted expression text. */
  public String expression() {
    return expression;
  }

  /** Returns true if the given value satisfies this Validator. */
  public boolean test(Object pith) {
    return predicate.test(pith);
  }

  @Override
  public String toString() {
    return "Is[" + expression + "]";
  }
}
