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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.hintcheck.hint.HintNode;
import org.hintcheck.hint.MalformedHintException;
import org.hintcheck.util.LruCache;

/**
 * Compiles hint trees, remembering the most recently used results.
 *
 * <p>Results are cached by hint identity, so reusing a HintNode reuses its CompiledHint, while a
 * structurally identical tree built separately is compiled again (producing an identical
 * template). Only the compiled code is cached, never the result of checking a value.
 *
 * <p>A HintCompiler may be shared between threads. Lookups and insertions are synchronized;
 * compilation is not, so two threads that miss on the same hint at the same time may both compile
 * it, in which case the first result to be cached is returned to both.
 */
public final class HintCompiler {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @GuardedBy("this")
  private final LruCache<HintNode, CompiledHint> cache;

  @GuardedBy("this")
  private long hits;

  @GuardedBy("this")
  private long misses;

  public HintCompiler(CompilerConfig config) {
    this.cache = new LruCache<>(config.cacheCapacity);
  }

  /** Returns a HintCompiler configured from the system properties. */
  public static HintCompiler create() {
    return new HintCompiler(CompilerConfig.fromSystemProperties());
  }

  /** Holds the process-wide HintCompiler, created on first use. */
  private static class SharedHolder {
    static final HintCompiler SHARED = create();
  }

  /** Returns a HintCompiler shared by the whole process, configured from the system properties. */
  public static HintCompiler shared() {
    return SharedHolder.SHARED;
  }

  /**
   * Returns the CompiledHint for {@code hint}, compiling it if it is not cached.
   *
   * @throws MalformedHintException if the tree is malformed; nothing is cached in that case
   */
  public CompiledHint compile(HintNode hint) {
    synchronized (this) {
      CompiledHint cached = cache.get(hint);
      if (cached != null) {
        hits++;
        return cached;
      }
      misses++;
    }
    CompiledHint compiled = HintCodeGenerator.compile(hint);
    synchronized (this) {
      CompiledHint raced = cache.get(hint);
      if (raced != null) {
        return raced;
      }
      HintNode evicted = cache.put(hint, compiled);
      if (evicted != null) {
        logger.atFine().log("Evicted %s from %s", evicted, cache);
      }
    }
    return compiled;
  }

  /**
   * Returns a BoundCheck for the named parameter (or {@code "return"}) of a method declared in
   * {@code declaringClass}; forward references in the hint are resolved relative to that class.
   */
  public BoundCheck bind(HintNode hint, String pithName, Class<?> declaringClass) {
    return compile(hint).bind(pithName, ForwardRefResolver.relativeTo(declaringClass));
  }

  /** Returns the number of compiled hints currently cached. */
  public synchronized int cacheSize() {
    return cache.size();
  }

  /** Returns the number of calls to {@link #compile} that found a cached result. */
  public synchronized long hitCount() {
    return hits;
  }

  /** Returns the number of calls to {@link #compile} that did not find a cached result. */
  public synchronized long missCount() {
    return misses;
  }

  /** Returns true if {@code hint} is cached, without marking it as recently used. */
  @VisibleForTesting
  synchronized boolean isCached(HintNode hint) {
    return cache.containsKey(hint);
  }

  @Override
  public synchronized String toString() {
    return "HintCompiler(" + cache + ", " + hits + " hits, " + misses + " misses)";
  }
}
