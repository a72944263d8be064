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

import java.util.OptionalInt;
import org.hintcheck.hint.HintNode;
import org.hintcheck.util.StringUtil;
import org.jspecify.annotations.Nullable;

/**
 * Thrown by {@link BoundCheck#check} when a value does not satisfy its hint.
 *
 * <p>If the check sampled any sequences, the exception records the random int that was used, so
 * that the item that failed can be identified.
 */
public class HintViolationException extends RuntimeException {
  public final String pithName;
  public final transient @Nullable Object pithValue;
  public final transient HintNode hint;
  private final @Nullable Integer randomInt;

  public HintViolationException(
      String pithName, @Nullable Object pithValue, HintNode hint, @Nullable Integer randomInt) {
    super(describe(pithName) + " " + StringUtil.safeToString(pithValue) + " violates " + hint);
    this.pithName = pithName;
    this.pithValue = pithValue;
    this.hint = hint;
    this.randomInt = randomInt;
  }

  private static String describe(String pithName) {
    return BoundCheck.RETURN.equals(pithName)
        ? "Return value"
        : "Parameter " + StringUtil.escape(pithName) + " value";
  }

  /** The random int used to sample sequences, if any were sampled. */
  public OptionalInt randomInt() {
    return (randomInt == null) ? OptionalInt.empty() : OptionalInt.of(randomInt);
  }
}
