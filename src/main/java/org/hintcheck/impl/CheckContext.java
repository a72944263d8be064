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

import java.util.concurrent.ThreadLocalRandom;

/**
 * The state shared by every part of a single check call: the pseudo-random int that chooses which
 * item of each sequence is sampled, and the resolver for forward references.
 *
 * <p>Drawing the random int once per call (rather than once per sequence) keeps the choices made
 * for nested sequences consistent with each other and with the value reported when the check
 * fails.
 */
public final class CheckContext {
  public final int randomInt;
  public final ForwardRefResolver resolver;

  public CheckContext(int randomInt, ForwardRefResolver resolver) {
    this.randomInt = randomInt;
    this.resolver = resolver;
  }

  /** Returns a CheckContext with a freshly drawn random int. */
  public static CheckContext random(ForwardRefResolver resolver) {
    return new CheckContext(ThreadLocalRandom.current().nextInt(), resolver);
  }

  @Override
  public String toString() {
    return "CheckContext(randomInt=" + randomInt + ", " + resolver + ")";
  }
}
