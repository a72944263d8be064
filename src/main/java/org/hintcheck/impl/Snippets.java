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
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.hintcheck.hint.MalformedHintException;
import org.hintcheck.util.Classes;
import org.hintcheck.util.StringUtil;

/**
 * Static-only class with the snippets of Java code from which checks are generated.
 *
 * <p>Each method returns the text of a boolean expression (or, for {@link #rootCheck}, a
 * statement). Composite snippets are laid out one operand per line, indented according to the
 * depth of the hint they check; the layout has no effect on the meaning of the code.
 */
final class Snippets {

  private Snippets() {}

  /** The prefix used to call the static methods of {@link CheckSupport} from generated code. */
  static final String SUPPORT = CheckSupport.class.getName() + ".";

  static final String OBJECTS = Objects.class.getName() + ".";

  /** Returns an expression testing whether the pith is an instance of any of the given types. */
  static String isInstance(String pithExpr, List<String> typeExprs) {
    Preconditions.checkArgument(!typeExprs.isEmpty());
    return SUPPORT + "isInstance(" + pithExpr + ", " + String.join(", ", typeExprs) + ")";
  }

  /** Like {@link #isInstance(String, List)}, but with types given as classes. */
  static String isInstanceOfClasses(String pithExpr, List<Class<?>> types) {
    return isInstance(
        pithExpr, types.stream().map(Classes::classLiteral).collect(Collectors.toList()));
  }

  /** Returns an expression testing whether the pith is a subclass of {@code superclass}. */
  static String isSubclass(String pithVar, Class<?> superclass) {
    return SUPPORT + "isSubclass(" + pithVar + ", " + Classes.classLiteral(superclass) + ")";
  }

  /** Returns an expression testing whether the pith (a List or array) is empty. */
  static String isEmpty(String pithVar) {
    return SUPPORT + "isEmpty(" + pithVar + ")";
  }

  /** Returns an expression testing whether the pith (a List or array) has the given size. */
  static String hasSize(String pithVar, int size) {
    return SUPPORT + "size(" + pithVar + ") == " + size;
  }

  /** Returns an expression for the item at a fixed index of the pith (a List or array). */
  static String item(String pithVar, int index) {
    return SUPPORT + "item(" + pithVar + ", " + index + ")";
  }

  /** Returns an expression for the item sampled from the pith (a non-empty List or array). */
  static String sampledItem(String pithVar) {
    return SUPPORT + "sample(" + pithVar + ", " + PithNames.RANDOM_INT + ")";
  }

  /** Returns an expression that is true if the pith is empty or its sampled item is valid. */
  static String emptyOrSampled(String pithVar, String itemCheck) {
    return "(" + isEmpty(pithVar) + " || " + itemCheck + ")";
  }

  /** Returns an expression testing whether the pith equals a literal. */
  static String equalsLiteral(String pithVar, Object literal) {
    return OBJECTS + "equals(" + pithVar + ", " + literal(literal) + ")";
  }

  /**
   * Returns a Java expression that evaluates to (a value equal to) the given literal.
   *
   * @throws MalformedHintException if the literal is not null, a Boolean, Character, String,
   *     integral boxed number or enum constant
   */
  static String literal(Object literal) {
    if (literal == null) {
      return "null";
    } else if (literal instanceof String s) {
      return StringUtil.escape(s);
    } else if (literal instanceof Character c) {
      return "Character.valueOf(" + StringUtil.escape(c) + ")";
    } else if (literal instanceof Boolean b) {
      return b ? "Boolean.TRUE" : "Boolean.FALSE";
    } else if (literal instanceof Integer i) {
      return "Integer.valueOf(" + i + ")";
    } else if (literal instanceof Long l) {
      return "Long.valueOf(" + l + "L)";
    } else if (literal instanceof Short sh) {
      return "Short.valueOf((short) " + sh + ")";
    } else if (literal instanceof Byte by) {
      return "Byte.valueOf((byte) " + by + ")";
    } else if (literal instanceof Enum<?> e) {
      String enumClass = Classes.classLiteral(e.getDeclaringClass());
      return enumClass.substring(0, enumClass.length() - ".class".length()) + "." + e.name();
    }
    throw new MalformedHintException(
        "Literal %s (%s) is not null, a boolean, char, string, integer or enum constant",
        StringUtil.safeToString(literal),
        literal.getClass().getName());
  }

  /**
   * Returns a composite expression joining {@code operands} with {@code operator} ({@code "&&"} or
   * {@code "||"}), one operand per line at the given indentation.
   */
  static String join(String indent, String operator, List<String> operands) {
    Preconditions.checkArgument(!operands.isEmpty());
    StringBuilder sb = new StringBuilder("(");
    for (int i = 0; i < operands.size(); i++) {
      sb.append('\n').append(indent).append(PithNames.INDENT_UNIT).append(operands.get(i));
      if (i < operands.size() - 1) {
        sb.append(' ').append(operator);
      }
    }
    return sb.append('\n').append(indent).append(')').toString();
  }

  /** Returns a conjunction of {@code operands} for a hint at the given depth. */
  static String and(DepthContext context, List<String> operands) {
    return join(context.indent, "&&", operands);
  }

  /** Returns a disjunction of {@code operands} for a hint at the given depth. */
  static String or(DepthContext context, List<String> operands) {
    return join(context.indent, "||", operands);
  }

  /**
   * Returns the statement that checks the root pith and raises if it fails. The statement refers
   * to the name of the pith only through the root-name placeholder.
   */
  static String rootCheck(String expression, boolean readsRandomInt) {
    String indent = PithNames.INDENT_UNIT;
    return indent
        + "if (!"
        + expression
        + ") {\n"
        + indent
        + PithNames.INDENT_UNIT
        + "throw "
        + PithNames.RAISE_EXCEPTION
        + ".violation("
        + Placeholders.ROOT_NAME
        + ", "
        + PithNames.ROOT_PITH_VAR
        + (readsRandomInt ? ", " + PithNames.RANDOM_INT : "")
        + ");\n"
        + indent
        + "}\n";
  }
}
