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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.hintcheck.hint.MalformedHintException;
import org.hintcheck.util.Classes;

/**
 * Resolves the class names in forward-reference hints.
 *
 * <p>Forward references are left unresolved when a hint is compiled, so that the compiled check can
 * be cached and shared; each {@link BoundCheck} resolves them relative to the class that declared
 * it.
 */
public interface ForwardRefResolver {

  /**
   * Returns the class with the given name.
   *
   * @throws UnresolvedForwardRefException if there is no such class
   */
  Class<?> resolve(String className);

  /**
   * Returns a Java expression evaluating to the class with the given name.
   *
   * @throws UnresolvedForwardRefException if there is no such class, or it is a local or anonymous
   *     class that generated code can't name
   */
  default String classExpression(String className) {
    Class<?> cls = resolve(className);
    if (cls.getCanonicalName() == null) {
      throw new UnresolvedForwardRefException(
          className, cls.getName() + " has no canonical name");
    }
    return Classes.classLiteral(cls);
  }

  /** A resolver for hints that contain no forward references; fails if asked to resolve any. */
  ForwardRefResolver NONE =
      className -> {
        throw new UnresolvedForwardRefException(className, "no resolver");
      };

  /**
   * Returns a resolver that looks up names the way Java source code in {@code declaringClass}
   * would: a simple name is tried as a class nested in {@code declaringClass}, then as a class in
   * the same package, then as a class in {@code java.lang}; a qualified name is tried as is and
   * then relative to the package.
   */
  static ForwardRefResolver relativeTo(Class<?> declaringClass) {
    return new RelativeResolver(declaringClass);
  }

  /**
   * Returns a resolver that looks names up in the given map. Each value found must be a Class;
   * anything else causes a {@link MalformedHintException}.
   */
  static ForwardRefResolver fromScope(Map<String, ?> scope) {
    ImmutableMap<String, ?> copy = ImmutableMap.copyOf(scope);
    return className -> {
      Object found = copy.get(className);
      if (found == null) {
        throw new UnresolvedForwardRefException(className, "not in scope");
      }
      return Classes.checkIsClass(found, MalformedHintException::new);
    };
  }

  /** The implementation of {@link ForwardRefResolver#relativeTo}, with a cache of past results. */
  final class RelativeResolver implements ForwardRefResolver {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    private final Class<?> declaringClass;
    private final Map<String, Class<?>> resolved = new ConcurrentHashMap<>();

    private RelativeResolver(Class<?> declaringClass) {
      this.declaringClass = declaringClass;
    }

    private ImmutableList<String> candidates(String className) {
      String pkg = declaringClass.getPackageName();
      String inPackage = pkg.isEmpty() ? className : pkg + "." + className;
      if (className.indexOf('.') >= 0) {
        return ImmutableList.of(className, inPackage);
      }
      return ImmutableList.of(
          declaringClass.getName() + "$" + className, inPackage, "java.lang." + className);
    }

    @Override
    public Class<?> resolve(String className) {
      Class<?> result = resolved.get(className);
      if (result == null) {
        result = load(className);
        resolved.putIfAbsent(className, result);
      }
      return result;
    }

    private Class<?> load(String className) {
      ClassLoader loader = declaringClass.getClassLoader();
      for (String candidate : candidates(className)) {
        try {
          Class<?> result = Class.forName(candidate, false, loader);
          logger.atFine().log(
              "Resolved \"%s\" from %s to %s", className, declaringClass.getName(), result);
          return result;
        } catch (ClassNotFoundException e) {
          logger.atFinest().log("No class %s", candidate);
        }
      }
      throw new UnresolvedForwardRefException(
          className, "not found relative to " + declaringClass.getName());
    }

    @Override
    public String toString() {
      return "relativeTo(" + declaringClass.getName() + ")";
    }
  }
}
