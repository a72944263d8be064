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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import org.jspecify.annotations.Nullable;

/**
 * A map with a fixed maximum number of entries that, when full, makes room for a new entry by
 * evicting the least recently used one.
 *
 * <p>An entry is used when it is added or replaced by {@link #put} or returned by {@link #get};
 * {@link #containsKey} does not count as a use. Both {@code get()} and {@code put()} take constant
 * time.
 *
 * <p>Keys are compared with {@code equals()}, so a key class that does not override it (such as
 * {@link org.hintcheck.hint.HintNode}) gives an identity-keyed cache. Null keys and values are not
 * allowed.
 *
 * <p>LruCache is not thread-safe; if it is shared between threads, all access must be synchronized
 * externally.
 */
public final class LruCache<K, V> {

  /**
   * The entries are kept in a circular doubly-linked list, from least recently used ({@code
   * head.next}) to most recently used ({@code head.prev}). {@code head} itself is a sentinel with
   * null key and value.
   */
  private static final class Entry<K, V> {
    final K key;
    V value;
    Entry<K, V> prev;
    Entry<K, V> next;

    Entry(K key, V value) {
      this.key = key;
      this.value = value;
      this.prev = this;
      this.next = this;
    }

    void unlink() {
      prev.next = next;
      next.prev = prev;
    }

    /** Links this entry in just before {@code successor}. */
    void linkBefore(Entry<K, V> successor) {
      prev = successor.prev;
      next = successor;
      prev.next = this;
      successor.prev = this;
    }
  }

  private final int capacity;
  private final HashMap<K, Entry<K, V>> entries;
  private final Entry<K, V> head = new Entry<>(null, null);

  /**
   * Creates an empty LruCache that will hold at most {@code capacity} entries.
   *
   * @throws LruCacheException if {@code capacity} is not positive
   */
  public LruCache(int capacity) {
    if (capacity <= 0) {
      throw new LruCacheException("LRU cache capacity %s not positive.", capacity);
    }
    this.capacity = capacity;
    // Sized so that the map never needs to be resized.
    this.entries = new HashMap<>(Math.min(capacity, 1 << 16) * 4 / 3 + 1);
  }

  /**
   * Creates an empty LruCache with a capacity given as text (e.g. from a configuration property).
   *
   * @throws LruCacheException if {@code capacity} is not an integer or not positive
   */
  public static <K, V> LruCache<K, V> withCapacity(String capacity) {
    return new LruCache<>(parseCapacity(capacity));
  }

  /**
   * Parses a capacity given as text.
   *
   * @throws LruCacheException if {@code capacity} is not an integer or not positive
   */
  public static int parseCapacity(String capacity) {
    int parsed;
    try {
      parsed = Integer.parseInt(capacity.trim());
    } catch (NumberFormatException e) {
      throw new LruCacheException("LRU cache capacity \"" + capacity + "\" not integer.", e);
    }
    if (parsed <= 0) {
      throw new LruCacheException("LRU cache capacity %s not positive.", parsed);
    }
    return parsed;
  }

  /** The maximum number of entries this cache will hold. */
  public int capacity() {
    return capacity;
  }

  /** The number of entries currently in this cache. */
  public int size() {
    return entries.size();
  }

  /**
   * Returns the value cached for {@code key} and marks it as the most recently used, or returns
   * null if there is none.
   */
  public @Nullable V get(K key) {
    Entry<K, V> entry = entries.get(Preconditions.checkNotNull(key));
    if (entry == null) {
      return null;
    }
    entry.unlink();
    entry.linkBefore(head);
    return entry.value;
  }

  /** Returns true if this cache has a value for {@code key}, without marking it as used. */
  public boolean containsKey(K key) {
    return entries.containsKey(Preconditions.checkNotNull(key));
  }

  /**
   * Caches {@code value} for {@code key}, replacing any previous value, and marks it as the most
   * recently used. If that leaves the cache with more than {@link #capacity} entries, the least
   * recently used one is removed and its key returned; otherwise returns null.
   */
  @CanIgnoreReturnValue
  public @Nullable K put(K key, V value) {
    Preconditions.checkNotNull(key);
    Preconditions.checkNotNull(value);
    Entry<K, V> entry = entries.get(key);
    if (entry != null) {
      entry.value = value;
      entry.unlink();
      entry.linkBefore(head);
      return null;
    }
    entry = new Entry<>(key, value);
    entries.put(key, entry);
    entry.linkBefore(head);
    if (entries.size() <= capacity) {
      return null;
    }
    Entry<K, V> eldest = head.next;
    eldest.unlink();
    entries.remove(eldest.key);
    return eldest.key;
  }

  /** Returns this cache's keys, from least to most recently used. */
  public ImmutableList<K> keysInRecencyOrder() {
    ImmutableList.Builder<K> builder = ImmutableList.builderWithExpectedSize(entries.size());
    for (Entry<K, V> e = head.next; e != head; e = e.next) {
      builder.add(e.key);
    }
    return builder.build();
  }

  @Override
  public String toString() {
    return "LruCache(" + entries.size() + "/" + capacity + ")";
  }
}
