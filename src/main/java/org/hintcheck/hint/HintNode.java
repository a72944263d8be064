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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import org.hintcheck.util.StringUtil;
import org.jspecify.annotations.Nullable;

/**
 * A node in a hint tree, the structural form of a type specification that is compiled into a
 * check.
 *
 * <p>HintNodes are immutable and deliberately do not override {@code equals()} or {@code
 * hashCode()}: compiled checks are cached by node identity, so two structurally identical trees
 * built separately are compiled separately, while reusing the same tree always finds the cached
 * check.
 *
 * <p>The factory methods only reject nulls; the remaining structural requirements of each kind
 * (such as a union having at least one child) are enforced when the tree is compiled, which throws
 * {@link MalformedHintException} if they are not met.
 */
public final class HintNode {
  public final HintKind kind;

  /** The class associated with this node, or null for kinds that have none. */
  public final @Nullable Class<?> origin;

  public final ImmutableList<HintNode> children;

  /** The literals of a LITERAL node, in declaration order and without duplicates; may hold null. */
  private final List<Object> literals;

  /** The validators of an ANNOTATED node, in declaration order. */
  public final ImmutableList<Validator> validators;

  /** The unresolved class name of a FORWARD_REF node. */
  public final @Nullable String forwardRefName;

  private HintNode(
      HintKind kind,
      @Nullable Class<?> origin,
      ImmutableList<HintNode> children,
      List<Object> literals,
      ImmutableList<Validator> validators,
      @Nullable String forwardRefName) {
    this.kind = Preconditions.checkNotNull(kind);
    this.origin = origin;
    this.children = children;
    this.literals = literals;
    this.validators = validators;
    this.forwardRefName = forwardRefName;
  }

  /** A hint matched only by {@code null}. */
  public static final HintNode NONE = instanceOf(Void.class);

  /**
   * Returns a node of the given kind with no literals, validators, or forward reference name. The
   * result is not checked for consistency with {@code kind} until it is compiled.
   */
  public static HintNode of(HintKind kind, @Nullable Class<?> origin, List<HintNode> children) {
    return new HintNode(
        kind, origin, ImmutableList.copyOf(children), List.of(), ImmutableList.of(), null);
  }

  /** Returns a hint satisfied by instances of {@code cls}; {@code Void.class} matches null. */
  public static HintNode instanceOf(Class<?> cls) {
    return of(HintKind.INSTANCE, Preconditions.checkNotNull(cls), ImmutableList.of());
  }

  /** Returns a hint satisfied by any value that satisfies at least one of {@code choices}. */
  public static HintNode unionOf(HintNode... choices) {
    return of(HintKind.UNION, null, Arrays.asList(choices));
  }

  /** Returns a hint satisfied by {@code hint} or null. */
  public static HintNode optional(HintNode hint) {
    return unionOf(hint, NONE);
  }

  /**
   * Returns a hint satisfied by values equal to one of {@code values}. Duplicates are dropped;
   * {@code null} is allowed.
   */
  public static HintNode literalOf(Object... values) {
    List<Object> literals =
        Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(Arrays.asList(values))));
    return new HintNode(
        HintKind.LITERAL, null, ImmutableList.of(), literals, ImmutableList.of(), null);
  }

  /**
   * Returns a hint satisfied by instances of {@code origin} that also satisfy each of {@code
   * superHints}.
   */
  public static HintNode genericOf(Class<?> origin, HintNode... superHints) {
    return of(HintKind.GENERIC, Preconditions.checkNotNull(origin), Arrays.asList(superHints));
  }

  /**
   * Returns a hint satisfied by instances of {@code origin} (a List type or an array type) whose
   * items satisfy {@code item}.
   */
  public static HintNode sequenceOf(Class<?> origin, HintNode item) {
    return of(HintKind.SEQUENCE, Preconditions.checkNotNull(origin), ImmutableList.of(item));
  }

  /** Equivalent to {@code sequenceOf(List.class, item)}. */
  public static HintNode listOf(HintNode item) {
    return sequenceOf(List.class, item);
  }

  /**
   * Returns a hint satisfied by Lists with one item for each of {@code items}, each satisfying the
   * corresponding hint. With no arguments, returns the empty-tuple hint.
   */
  public static HintNode tupleOf(HintNode... items) {
    return of(HintKind.FIXED_TUPLE, List.class, Arrays.asList(items));
  }

  /** Returns the hint satisfied only by empty Lists. */
  public static HintNode emptyTuple() {
    return tupleOf();
  }

  /** Like {@link #tupleOf}, but for piths that are instances of {@code origin}. */
  public static HintNode fixedTupleOf(Class<?> origin, HintNode... items) {
    return of(HintKind.FIXED_TUPLE, Preconditions.checkNotNull(origin), Arrays.asList(items));
  }

  /** Returns a hint satisfied by {@code superclass} and its subclasses. */
  public static HintNode subclassOf(Class<?> superclass) {
    return of(HintKind.SUBCLASS, Preconditions.checkNotNull(superclass), ImmutableList.of());
  }

  /** Returns a hint satisfied by values satisfying {@code hint} and each of {@code validators}. */
  public static HintNode annotated(HintNode hint, Validator... validators) {
    return new HintNode(
        HintKind.ANNOTATED,
        null,
        ImmutableList.of(hint),
        List.of(),
        ImmutableList.copyOf(validators),
        null);
  }

  /**
   * Returns a hint satisfied by instances of the named class. The name may be fully qualified or
   * relative to the class that declares the check; it is resolved when the check is bound.
   */
  public static HintNode forwardRef(String className) {
    Preconditions.checkArgument(!className.isEmpty(), "Empty forward reference");
    return new HintNode(
        HintKind.FORWARD_REF,
        null,
        ImmutableList.of(),
        List.of(),
        ImmutableList.of(),
        className);
  }

  /** Returns the literals of a LITERAL node; the result may contain null. */
  public List<Object> literals() {
    return literals;
  }

  /** Returns true if this is an INSTANCE node, i.e. one that can be checked by a single test. */
  public boolean isPlain() {
    return kind == HintKind.INSTANCE;
  }

  private static String name(@Nullable Class<?> cls) {
    return (cls == null) ? "?" : cls.getSimpleName();
  }

  private String childrenToString() {
    return StringUtil.joinElements("[", "]", children.size(), children::get);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case INSTANCE -> (origin == Void.class) ? "None" : name(origin);
      case UNION -> "Union" + childrenToString();
      case LITERAL ->
          StringUtil.joinElements(
              "Literal[",
              "]",
              literals.size(),
              i ->
                  (literals.get(i) instanceof String s)
                      ? StringUtil.escape(s)
                      : StringUtil.safeToString(literals.get(i)));
      case GENERIC, SEQUENCE -> name(origin) + childrenToString();
      case FIXED_TUPLE -> name(origin) + (children.isEmpty() ? "[()]" : childrenToString());
      case SUBCLASS -> "Type[" + name(origin) + "]";
      case ANNOTATED ->
          StringUtil.joinElements(
              "Annotated[" + (children.isEmpty() ? "?" : children.get(0)) + ", ",
              "]",
              validators.size(),
              validators::get);
      case FORWARD_REF -> "ForwardRef(" + StringUtil.escape(forwardRefName) + ")";
    };
  }
}
