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

import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.hintcheck.hint.HintNode;
import org.hintcheck.hint.MalformedHintException;
import org.hintcheck.hint.Validator;

/**
 * Compiles a hint tree into a {@link CompiledHint}.
 *
 * <p>Generation is recursive. The code for each composite hint is first built with a child-slot
 * placeholder where each child's code belongs; each child is then compiled in turn and its
 * finished code spliced into its slot, so that when a hint's code is returned it contains no
 * child-slot placeholders. The PithCheck for a hint is assembled from its children's PithChecks at
 * the same time.
 *
 * <p>The first operand of each composite binds the value being checked to that depth's pith
 * variable; later operands and children read the variable rather than re-evaluating the
 * expression that produced the value, which may be expensive (e.g. sampling a sequence).
 *
 * <p>The generated code depends only on the structure of the hint tree, so compiling the same tree
 * twice produces identical templates. A malformed tree causes a {@link MalformedHintException};
 * values that don't satisfy the hint are never an error here, only a false result when checked.
 *
 * <p>Each instance of HintCodeGenerator is used for a single compilation.
 */
public final class HintCodeGenerator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Used to number the child-slot placeholders of this compilation. */
  private int nextSlot;

  /** The names of the forward references found so far, in the order they were found. */
  private final Set<String> forwardRefs = new LinkedHashSet<>();

  private boolean readsRandomInt;

  private int maxDepth;

  private HintCodeGenerator() {}

  /** Generated code and the equivalent PithCheck. */
  private record Fragment(String code, PithCheck check) {}

  /**
   * A child-slot placeholder in the code for a composite hint, along with the child hint that will
   * fill it and the expression for the child's pith.
   */
  private record ChildSlot(String placeholder, HintNode hint, String pithExpr) {}

  /**
   * Compiles the given hint tree.
   *
   * @throws MalformedHintException if the tree is malformed
   */
  public static CompiledHint compile(HintNode root) {
    HintCodeGenerator generator = new HintCodeGenerator();
    Fragment fragment = generator.generate(root, PithNames.ROOT_PITH_VAR, DepthContext.ROOT);
    CodeTemplate template =
        new CodeTemplate(
            Snippets.rootCheck(fragment.code, generator.readsRandomInt),
            ImmutableSet.copyOf(generator.forwardRefs),
            generator.readsRandomInt,
            generator.maxDepth + 1);
    logger.atFine().log("Compiled %s:\n%s", root, lazy(template::code));
    return new CompiledHint(root, template, fragment.check);
  }

  private Fragment generate(HintNode hint, String pithExpr, DepthContext context) {
    maxDepth = Math.max(maxDepth, context.depth);
    return switch (hint.kind) {
      case INSTANCE -> instance(hint, pithExpr);
      case UNION -> union(hint, pithExpr, context);
      case LITERAL -> literal(hint, pithExpr, context);
      case GENERIC -> generic(hint, pithExpr, context);
      case SEQUENCE -> sequence(hint, pithExpr, context);
      case FIXED_TUPLE -> fixedTuple(hint, pithExpr, context);
      case SUBCLASS -> subclass(hint, pithExpr, context);
      case ANNOTATED -> annotated(hint, pithExpr, context);
      case FORWARD_REF -> forwardRef(hint, pithExpr);
    };
  }

  /** Returns a new child slot for {@code child}, whose pith is given by {@code pithExpr}. */
  private ChildSlot newSlot(HintNode child, String pithExpr) {
    return new ChildSlot(Placeholders.childSlot(nextSlot++), child, pithExpr);
  }

  /**
   * Compiles the hint for each slot, replaces the slot's placeholder in {@code code} with the
   * result, and adds the resulting PithChecks to {@code checks}. Returns the updated code.
   */
  private String fillSlots(
      String code, List<ChildSlot> slots, DepthContext context, List<PithCheck> checks) {
    DepthContext childContext = context.child();
    for (ChildSlot slot : slots) {
      Fragment child = generate(slot.hint, slot.pithExpr, childContext);
      code = Placeholders.splice(code, slot.placeholder, child.code);
      checks.add(child.check);
    }
    return code;
  }

  private Fragment instance(HintNode hint, String pithExpr) {
    Class<?> origin = requireOrigin(hint);
    requireNoChildren(hint);
    ImmutableList<Class<?>> types = ImmutableList.of(origin);
    return new Fragment(
        Snippets.isInstanceOfClasses(pithExpr, types), new PithCheck.InstanceOf(types));
  }

  /**
   * The plain (INSTANCE) choices of a union are combined into a single test that comes first; the
   * others follow in declaration order.
   */
  private Fragment union(HintNode hint, String pithExpr, DepthContext context) {
    requireChildren(hint, 1);
    Set<Class<?>> plainTypes = new LinkedHashSet<>();
    List<HintNode> others = new ArrayList<>();
    for (HintNode child : hint.children) {
      if (child.isPlain()) {
        plainTypes.add(requireOrigin(child));
        requireNoChildren(child);
      } else {
        others.add(child);
      }
    }
    ImmutableList<Class<?>> plain = ImmutableList.copyOf(plainTypes);
    if (others.isEmpty()) {
      return new Fragment(
          Snippets.isInstanceOfClasses(pithExpr, plain), new PithCheck.InstanceOf(plain));
    }
    List<String> operands = new ArrayList<>();
    List<PithCheck> checks = new ArrayList<>();
    if (!plain.isEmpty()) {
      operands.add(Snippets.isInstanceOfClasses(context.assignExpr(pithExpr), plain));
      checks.add(new PithCheck.InstanceOf(plain));
    }
    List<ChildSlot> slots = new ArrayList<>();
    for (HintNode child : others) {
      // Only the first operand binds the pith variable.
      String childPith = operands.isEmpty() ? context.assignExpr(pithExpr) : context.pithVar();
      ChildSlot slot = newSlot(child, childPith);
      slots.add(slot);
      operands.add(slot.placeholder);
    }
    String code = fillSlots(Snippets.or(context, operands), slots, context, checks);
    return new Fragment(code, new PithCheck.AnyOf(checks));
  }

  private Fragment literal(HintNode hint, String pithExpr, DepthContext context) {
    requireNoChildren(hint);
    List<Object> literals = hint.literals();
    if (literals.isEmpty()) {
      throw new MalformedHintException("%s has no literals", hint);
    }
    Set<Class<?>> literalTypes = new LinkedHashSet<>();
    List<String> comparisons = new ArrayList<>();
    String pithVar = context.pithVar();
    for (Object literal : literals) {
      literalTypes.add(literalType(literal));
      comparisons.add(Snippets.equalsLiteral(pithVar, literal));
    }
    ImmutableList<Class<?>> types = ImmutableList.copyOf(literalTypes);
    List<String> operands =
        List.of(
            Snippets.isInstanceOfClasses(context.assignExpr(pithExpr), types),
            Snippets.join(context.indent + PithNames.INDENT_UNIT, "||", comparisons));
    return new Fragment(
        Snippets.and(context, operands),
        new PithCheck.LiteralIn(new PithCheck.InstanceOf(types), literals));
  }

  /** Returns the class that a value must be an instance of to equal {@code literal}. */
  private static Class<?> literalType(Object literal) {
    if (literal == null) {
      return Void.class;
    } else if (literal instanceof Enum<?> e) {
      return requireNameable(e.getDeclaringClass());
    }
    return literal.getClass();
  }

  private Fragment generic(HintNode hint, String pithExpr, DepthContext context) {
    Class<?> origin = requireOrigin(hint);
    ImmutableList<Class<?>> types = ImmutableList.of(origin);
    if (hint.children.isEmpty()) {
      return new Fragment(
          Snippets.isInstanceOfClasses(pithExpr, types), new PithCheck.InstanceOf(types));
    }
    List<String> operands = new ArrayList<>();
    operands.add(Snippets.isInstanceOfClasses(context.assignExpr(pithExpr), types));
    List<ChildSlot> slots = new ArrayList<>();
    for (HintNode child : hint.children) {
      ChildSlot slot = newSlot(child, context.pithVar());
      slots.add(slot);
      operands.add(slot.placeholder);
    }
    List<PithCheck> checks = new ArrayList<>();
    checks.add(new PithCheck.InstanceOf(types));
    String code = fillSlots(Snippets.and(context, operands), slots, context, checks);
    return new Fragment(code, new PithCheck.AllOf(checks));
  }

  private Fragment sequence(HintNode hint, String pithExpr, DepthContext context) {
    Class<?> origin = requireListOrArray(hint);
    if (hint.children.size() != 1) {
      throw new MalformedHintException(
          "%s should have exactly one child, not %s", hint, hint.children.size());
    }
    readsRandomInt = true;
    String pithVar = context.pithVar();
    ChildSlot slot = newSlot(hint.children.get(0), Snippets.sampledItem(pithVar));
    List<String> operands =
        List.of(
            Snippets.isInstanceOfClasses(context.assignExpr(pithExpr), ImmutableList.of(origin)),
            Snippets.emptyOrSampled(pithVar, slot.placeholder));
    List<PithCheck> checks = new ArrayList<>();
    String code = fillSlots(Snippets.and(context, operands), List.of(slot), context, checks);
    return new Fragment(
        code,
        new PithCheck.SampledItems(
            new PithCheck.InstanceOf(ImmutableList.of(origin)), checks.get(0)));
  }

  private Fragment fixedTuple(HintNode hint, String pithExpr, DepthContext context) {
    Class<?> origin = requireListOrArray(hint);
    String pithVar = context.pithVar();
    List<String> operands = new ArrayList<>();
    operands.add(
        Snippets.isInstanceOfClasses(context.assignExpr(pithExpr), ImmutableList.of(origin)));
    int size = hint.children.size();
    operands.add((size == 0) ? Snippets.isEmpty(pithVar) : Snippets.hasSize(pithVar, size));
    List<ChildSlot> slots = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      ChildSlot slot = newSlot(hint.children.get(i), Snippets.item(pithVar, i));
      slots.add(slot);
      operands.add(slot.placeholder);
    }
    List<PithCheck> checks = new ArrayList<>();
    String code = fillSlots(Snippets.and(context, operands), slots, context, checks);
    return new Fragment(
        code, new PithCheck.FixedItems(new PithCheck.InstanceOf(ImmutableList.of(origin)), checks));
  }

  private Fragment subclass(HintNode hint, String pithExpr, DepthContext context) {
    Class<?> origin = requireOrigin(hint);
    requireNoChildren(hint);
    String isClass =
        Snippets.isInstanceOfClasses(context.assignExpr(pithExpr), ImmutableList.of(Class.class));
    List<String> operands = List.of(isClass, Snippets.isSubclass(context.pithVar(), origin));
    return new Fragment(Snippets.and(context, operands), new PithCheck.SubclassOf(origin));
  }

  /** The wrapped hint is checked first, then each validator in declaration order. */
  private Fragment annotated(HintNode hint, String pithExpr, DepthContext context) {
    if (hint.children.size() != 1) {
      throw new MalformedHintException(
          "%s should wrap exactly one hint, not %s", hint, hint.children.size());
    }
    if (hint.validators.isEmpty()) {
      throw new MalformedHintException("%s has no validators", hint);
    }
    ChildSlot slot = newSlot(hint.children.get(0), context.assignExpr(pithExpr));
    List<String> operands = new ArrayList<>();
    operands.add(slot.placeholder);
    for (Validator validator : hint.validators) {
      if (Placeholders.containsDelimiter(validator.expression())) {
        throw new MalformedHintException(
            "Validator expression \"%s\" contains a reserved delimiter", validator.expression());
      }
      // Each validator is a single operand, whatever operators its expression uses.
      operands.add("(" + validator.expressionFor(context.pithVar()) + ")");
    }
    List<PithCheck> checks = new ArrayList<>();
    String code = fillSlots(Snippets.and(context, operands), List.of(slot), context, checks);
    return new Fragment(code, new PithCheck.Validated(checks.get(0), hint.validators));
  }

  private Fragment forwardRef(HintNode hint, String pithExpr) {
    requireNoChildren(hint);
    String className = hint.forwardRefName;
    if (className == null
        || className.isEmpty()
        || Placeholders.containsDelimiter(className)
        || className.contains(Placeholders.FORWARD_REF_SUFFIX)) {
      throw new MalformedHintException("%s has an invalid class name", hint);
    }
    forwardRefs.add(className);
    return new Fragment(
        Snippets.isInstance(pithExpr, List.of(Placeholders.forwardRef(className))),
        new PithCheck.ForwardRefTo(className));
  }

  private static Class<?> requireOrigin(HintNode hint) {
    if (hint.origin == null) {
      throw new MalformedHintException("%s hint has no origin", hint.kind);
    }
    return requireNameable(hint.origin);
  }

  /** Generated code can only refer to classes with a canonical name. */
  private static Class<?> requireNameable(Class<?> cls) {
    if (cls.getCanonicalName() == null) {
      throw new MalformedHintException("%s has no canonical name", cls.getName());
    }
    return cls;
  }

  private static Class<?> requireListOrArray(HintNode hint) {
    Class<?> origin = requireOrigin(hint);
    if (!List.class.isAssignableFrom(origin) && !origin.isArray()) {
      throw new MalformedHintException(
          "%s origin %s is neither a List nor an array type", hint.kind, origin.getName());
    }
    return origin;
  }

  private static void requireNoChildren(HintNode hint) {
    if (!hint.children.isEmpty()) {
      throw new MalformedHintException("%s hint should have no children: %s", hint.kind, hint);
    }
  }

  private static void requireChildren(HintNode hint, int min) {
    if (hint.children.size() < min) {
      throw new MalformedHintException(
          "%s hint needs at least %s children, has %s", hint.kind, min, hint.children.size());
    }
  }

  @Override
  public String toString() {
    return "HintCodeGenerator(" + nextSlot + " slots, max depth " + maxDepth + ")";
  }
}
