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

import java.util.Properties;
import org.hintcheck.util.LruCache;
import org.hintcheck.util.LruCacheException;

/** Configuration for a {@link HintCompiler}. */
public final class CompilerConfig {
  /** The property that sets the capacity of the compiled-hint cache. */
  public static final String CACHE_CAPACITY_PROPERTY = "hintcheck.cache.capacity";

  public static final int DEFAULT_CACHE_CAPACITY = 256;

  /** The maximum number of compiled hints kept in the cache. */
  public final int cacheCapacity;

  private CompilerConfig(int cacheCapacity) {
    if (cacheCapacity <= 0) {
      throw new LruCacheException("LRU cache capacity %s not positive.", cacheCapacity);
    }
    this.cacheCapacity = cacheCapacity;
  }

  public static final CompilerConfig DEFAULT = new CompilerConfig(DEFAULT_CACHE_CAPACITY);

  /**
   * Returns a config with the given cache capacity.
   *
   * @throws LruCacheException if {@code cacheCapacity} is not positive
   */
  public static CompilerConfig withCacheCapacity(int cacheCapacity) {
    return new CompilerConfig(cacheCapacity);
  }

  /**
   * Returns a config read from the given properties; properties that are not set take their
   * default values.
   *
   * @throws LruCacheException if the cache capacity is set to anything other than a positive
   *     integer
   */
  public static CompilerConfig fromProperties(Properties properties) {
    String capacity = properties.getProperty(CACHE_CAPACITY_PROPERTY);
    return (capacity == null) ? DEFAULT : new CompilerConfig(LruCache.parseCapacity(capacity));
  }

  /** Returns a config read from the system properties. */
  public static CompilerConfig fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  @Override
  public String toString() {
    return "CompilerConfig(cacheCapacity=" + cacheCapacity + ")";
  }
}
