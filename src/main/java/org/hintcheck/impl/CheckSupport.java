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

import java.lang.reflect.Array;
import java.util.List;
import org.hintcheck.util.Classes;

/**
 * Static methods called by generated checks, and by the {@link PithCheck}s that evaluate them
 * directly.
 *
 * <p>The sequence accessors accept Lists and arrays (of objects or primitives); generated code only
 * calls them after checking that the pith is an instance of a List or array type.
 */
public final class CheckSupport {

  private CheckSupport() {}

  /**
   * Returns true if {@code pith} is an instance of any of {@code types}. A null pith is only an
   * instance of {@code Void.class}.
   */
  public static boolean isInstance(Object pith, Class<?>... types) {
    if (pith == null) {
      for (Class<?> type : types) {
        if (type == Void.class) {
          return true;
        }
      }
      return false;
    }
    for (Class<?> type : types) {
      if (type.isInstance(pith)) {
        return true;
      }
    }
    return false;
  }

  /** Returns true if {@code cls} is a class that is the same as or a subclass of {@code base}. */
  public static boolean isSubclass(Object cls, Class<?> base) {
    return Classes.isSubclass(cls, base);
  }

  /** Returns the number of items in a List or array. */
  public static int size(Object sequence) {
    if (sequence instanceof List<?> list) {
      return list.size();
    } else if (sequence instanceof Object[] array) {
      return array.length;
    } else {
      // Throws IllegalArgumentException if this isn't an array.
      return Array.getLength(sequence);
    }
  }

  /** Returns true if a List or array has no items. */
  public static boolean isEmpty(Object sequence) {
    return size(sequence) == 0;
  }

  /** Returns the item at {@code index} in a List or array; primitives are boxed. */
  public static Object item(Object sequence, int index) {
    if (sequence instanceof List<?> list) {
      return list.get(index);
    } else if (sequence instanceof Object[] array) {
      return array[index];
    } else {
      return Array.get(sequence, index);
    }
  }

  /**
   * Returns the index of the item sampled from a non-empty sequence of the given size, given the
   * random int drawn for the current check.
   */
  public static int sampleIndex(int randomInt, int size) {
    assert size > 0;
    return Math.floorMod(randomInt, size);
  }

  /** Returns the item sampled from a non-empty List or array for the current check. */
  public static Object sample(Object sequence, int randomInt) {
    return item(sequence, sampleIndex(randomInt, size(sequence)));
  }
}
