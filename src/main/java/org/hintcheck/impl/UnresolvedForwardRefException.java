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

/** Thrown when the class named by a forward-reference hint cannot be found. */
public class UnresolvedForwardRefException extends RuntimeException {
  public final String className;

  public UnresolvedForwardRefException(String className, String detail) {
    super("Can't resolve forward reference \"" + className + "\" (" + detail + ")");
    this.className = className;
  }

  public UnresolvedForwardRefException(String className, String detail, Throwable cause) {
    this(className, detail);
    initCause(cause);
  }
}
