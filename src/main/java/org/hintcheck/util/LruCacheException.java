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

package org.hintcheck.util;

import com.google.errorprone.annotations.FormatMethod;

/** Thrown when an {@link LruCache} is configured with an invalid capacity. */
public class LruCacheException extends IllegalArgumentException {

  @FormatMethod
  public LruCacheException(String format, Object... args) {
    super(String.format(format, args));
  }

  public LruCacheException(String message, Throwable cause) {
    super(message, cause);
  }
}
