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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.function.Function;

/** Static-only class with unmemoized tests of classes. */
public class Classes {

  private Classes() {}

  /**
   * Returns {@code cls} as a Class, or throws an exception created by {@code exception} (called
   * with a description of the problem) if it is not one.
   */
  @CanIgnoreReturnValue
  public static <X extends RuntimeException> Class<?> checkIsClass(
      Object cls, Function<String, X> exception) {
    if (cls instanceof Class<?> c) {
      return c;
    }
    throw exception.apply(StringUtil.safeToString(cls) + " not class.");
  }

  /**
   * Returns true if {@code cls} is a class that is the same as or a subclass of at least one of
   * {@code bases}. Unlike {@link Class#isAssignableFrom}, returns false rather than failing if
   * {@code cls} is not a class.
   */
  public static boolean isSubclass(Object cls, Class<?>... bases) {
    Preconditions.checkArgument(bases.length > 0, "No base classes");
    if (!(cls instanceof Class<?> c)) {
      return false;
    }
    for (Class<?> base : bases) {
      if (base.isAssignableFrom(c)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns true if the given class is defined in {@code java.lang} and so can be referenced from
   * generated code by its simple name, without an import or qualification.
   *
   * <p>Nested classes, arrays and primitives are never considered implicitly visible.
   */
  public static boolean isImplicitlyVisible(Class<?> cls) {
    return !cls.isArray()
        && !cls.isPrimitive()
        && cls.getEnclosingClass() == null
        && "java.lang".equals(cls.getPackageName());
  }

  /**
   * Returns a Java expression that evaluates to the given class, e.g. {@code Integer.class} or
   * {@code java.util.List.class}.
   */
  public static String classLiteral(Class<?> cls) {
    String name = isImplicitlyVisible(cls) ? cls.getSimpleName() : cls.getCanonicalName();
    Preconditions.checkArgument(name != null, "%s has no canonical name", cls);
    return name + ".class";
  }
}
