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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import org.hintcheck.hint.Validator;
import org.hintcheck.util.StringUtil;

/**
 * The executable form of a compiled hint: a tree of predicates with the same structure, evaluation
 * order, and sampling behavior as the code in the corresponding {@link CodeTemplate}.
 *
 * <p>There are exactly nine classes that implement PithCheck, all defined in this file. Each is
 * immutable and may be shared between threads; all per-call state is in the {@link CheckContext}.
 */
public sealed interface PithCheck {

  /** Returns true if {@code pith} satisfies this check. */
  boolean test(Object pith, CheckContext context);

  /** Satisfied by instances of any of a fixed list of classes ({@code Void.class} matches null). */
  final class InstanceOf implements PithCheck {
    final ImmutableList<Class<?>> types;
    private final Class<?>[] typesArray;

    InstanceOf(List<Class<?>> types) {
      Preconditions.checkArgument(!types.isEmpty());
      this.types = ImmutableList.copyOf(types);
      this.typesArray = this.types.toArray(new Class<?>[0]);
    }

    @Override
    public boolean test(Object pith, CheckContext context) {
      return CheckSupport.isInstance(pith, typesArray);
    }

    @Override
    public String toString() {
      return StringUtil.joinElements(
          "isInstance(", ")", types.size(), i -> types.get(i).getSimpleName());
    }
  }

  /** Satisfied if any of its choices is; choices are tested in order. */
  final class AnyOf implements PithCheck {
    final ImmutableList<PithCheck> choices;

    AnyOf(List<PithCheck> choices) {
      Preconditions.checkArgument(!choices.isEmpty());
      this.choices = ImmutableList.copyOf(choices);
    }

    @Override
    public boolean test(Object pith, CheckContext context) {
      for (PithCheck choice : choices) {
        if (choice.test(pith, context)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public String toString() {
      return StringUtil.joinElements("anyOf(", ")", choices.size(), choices::get);
    }
  }

  /** Satisfied if all of its parts are; parts are tested in order. */
  final class AllOf implements PithCheck {
    final ImmutableList<PithCheck> parts;

    AllOf(List<PithCheck> parts) {
      Preconditions.checkArgument(!parts.isEmpty());
      this.parts = ImmutableList.copyOf(parts);
    }

    @Override
    public boolean test(Object pith, CheckContext context) {
      for (PithCheck part : parts) {
        if (!part.test(pith, context)) {
          return false;
        }
      }
      return true;
    }

    @Override
    public String toString() {
      return StringUtil.joinElements("allOf(", ")", parts.size(), parts::get);
    }
  }

  /**
   * Satisfied by values equal to one of its literals. The cheaper test against the literals' types
   * is done first.
   */
  final class LiteralIn implements PithCheck {
    final InstanceOf types;
    final List<Object> literals;

    LiteralIn(InstanceOf types, List<Object> literals) {
      Preconditions.checkArgument(!literals.isEmpty());
      this.types = types;
      this.literals = literals;
    }

    @Override
    public boolean test(Object pith, CheckContext context) {
      if (!types.test(pith, context)) {
        return false;
      }
      for (Object literal : literals) {
        if (Objects.equals(pith, literal)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public String toString() {
      return StringUtil.joinElements("in(", ")", literals.size(), literals::get);
    }
  }

  /**
   * Satisfied by an instance of the origin (a List or array type) that is either empty or whose
   * sampled item satisfies the item check. Which item is sampled depends only on the context's
   * random int, so items other than that one are never checked.
   */
  final class SampledItems implements PithCheck {
    final InstanceOf origin;
    final PithCheck item;

    SampledItems(InstanceOf origin, PithCheck item) {
      this.origin = origin;
      this.item = item;
    }

    @Override
    public boolean test(Object pith, CheckContext context) {
      if (!origin.test(pith, context)) {
        return false;
      }
      return CheckSupport.isEmpty(pith)
          || item.test(CheckSupport.sample(pith, context.randomInt), context);
    }

    @Override
    public String toString() {
      return "sampled(" + origin + ", " + item + ")";
    }
  }

  /**
   * Satisfied by an instance of the origin (a List or array type) with exactly one item for each
   * item check, each satisfying the corresponding check.
   */
  final class FixedItems implements PithCheck {
    final InstanceOf origin;
    final ImmutableList<PithCheck> items;

    FixedItems(InstanceOf origin, List<PithCheck> items) {
      this.origin = origin;
      this.items = ImmutableList.copyOf(items);
    }

    @Override
    public boolean test(Object pith, CheckContext context) {
      if (!origin.test(pith, context) || CheckSupport.size(pith) != items.size()) {
        return false;
      }
      for (int i = 0; i < items.size(); i++) {
        if (!items.get(i).test(CheckSupport.item(pith, i), context)) {
          return false;
        }
      }
      return true;
    }

    @Override
    public String toString() {
      return StringUtil.joinElements("items(" + origin + "; ", ")", items.size(), items::get);
    }
  }

  /** Satisfied by classes that are the same as or a subclass of a fixed superclass. */
  final class SubclassOf implements PithCheck {
    final Class<?> superclass;

    SubclassOf(Class<?> superclass) {
      this.superclass = superclass;
    }

    @Override
    public boolean test(Object pith, CheckContext context) {
      return CheckSupport.isSubclass(pith, superclass);
    }

    @Override
    public String toString() {
      return "isSubclass(" + superclass.getSimpleName() + ")";
    }
  }

  /** Satisfied by values that satisfy a wrapped check and then each of a list of validators. */
  final class Validated implements PithCheck {
    final PithCheck wrapped;
    final ImmutableList<Validator> validators;

    Validated(PithCheck wrapped, List<Validator> validators) {
      Preconditions.checkArgument(!validators.isEmpty());
      this.wrapped = wrapped;
      this.validators = ImmutableList.copyOf(validators);
    }

    @Override
    public boolean test(Object pith, CheckContext context) {
      if (!wrapped.test(pith, context)) {
        return false;
      }
      for (Validator validator : validators) {
        if (!validator.test(pith)) {
          return false;
        }
      }
      return true;
    }

    @Override
    public String toString() {
      return StringUtil.joinElements(
          "validated(" + wrapped + "; ", ")", validators.size(), validators::get);
    }
  }

  /**
   * Satisfied by instances of a class that is named but not resolved until the check is run, using
   * the context's resolver.
   */
  final class ForwardRefTo implements PithCheck {
    final String className;

    ForwardRefTo(String className) {
      this.className = className;
    }

    @Override
    public boolean test(Object pith, CheckContext context) {
      return CheckSupport.isInstance(pith, context.resolver.resolve(className));
    }

    @Override
    public String toString() {
      return "isInstance(" + className + "?)";
    }
  }
}
