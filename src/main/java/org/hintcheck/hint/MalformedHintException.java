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

import com.google.errorprone.annotations.FormatMethod;

/**
 * Thrown when a hint tree cannot be compiled: a node is missing a required origin or children, has
 * children it should not have, or carries a value (such as an unsupported literal) that cannot be
 * represented in generated code.
 */
public class MalformedHintException extends IllegalArgumentException {

  public MalformedHintException(String message) {
    super(message);
  }

  @FormatMethod
  public MalformedHintException(String format, Object... args) {
    super(String.format(format, args));
  }
}
