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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.hintcheck.hint.HintKind;
import org.hintcheck.hint.HintNode;
import org.hintcheck.hint.MalformedHintException;
import org.hintcheck.hint.Validator;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class HintCodeGeneratorTest {

  private static final String S = "org.hintcheck.impl.CheckSupport.";

  private static final HintNode INT = HintNode.instanceOf(Integer.class);
  private static final HintNode STRING = HintNode.instanceOf(String.class);

  enum Color {
    RED,
    GREEN
  }

  /** Returns the boolean expression inside the root check statement. */
  private static String expression(CompiledHint compiled) {
    String code = compiled.template.code();
    String prefix = "    if (!";
    assertWithMessage(code).that(code).startsWith(prefix);
    int end = code.indexOf(") {\n        throw ");
    return code.substring(prefix.length(), end);
  }

  @Test
  public void instanceAtRoot() {
    CompiledHint compiled = HintCodeGenerator.compile(INT);
    assertThat(compiled.template.code())
        .isEqualTo(
            "    if (!"
                + S
                + "isInstance(pith_0, Integer.class)) {\n"
                + "        throw raise_exception.violation(?|PITH_ROOT_NAME`^, pith_0);\n"
                + "    }\n");
    assertThat(compiled.template.readsRandomInt()).isFalse();
    assertThat(compiled.template.forwardRefs()).isEmpty();
    assertThat(compiled.template.pithVariableCount()).isEqualTo(1);
    assertThat(compiled.hint).isSameInstanceAs(INT);
  }

  @Test
  public void fixedTuple() {
    CompiledHint compiled = HintCodeGenerator.compile(HintNode.tupleOf(INT, STRING));
    assertThat(expression(compiled))
        .isEqualTo(
            "(\n"
                + "            "
                + S
                + "isInstance(pith_0, java.util.List.class) &&\n"
                + "            "
                + S
                + "size(pith_0) == 2 &&\n"
                + "            "
                + S
                + "isInstance("
                + S
                + "item(pith_0, 0), Integer.class) &&\n"
                + "            "
                + S
                + "isInstance("
                + S
                + "item(pith_0, 1), String.class)\n"
                + "        )");
  }

  @Test
  public void emptyTuple() {
    CompiledHint compiled = HintCodeGenerator.compile(HintNode.emptyTuple());
    assertThat(expression(compiled))
        .isEqualTo(
            "(\n"
                + "            "
                + S
                + "isInstance(pith_0, java.util.List.class) &&\n"
                + "            "
                + S
                + "isEmpty(pith_0)\n"
                + "        )");
  }

  @Test
  public void nestedSequenceBindsPithVariables() {
    CompiledHint compiled = HintCodeGenerator.compile(HintNode.listOf(HintNode.listOf(INT)));
    String code = compiled.template.code();
    assertThat(code)
        .contains(
            S
                + "isInstance((pith_1 = "
                + S
                + "sample(pith_0, random_int)), java.util.List.class)");
    assertThat(code)
        .contains(S + "isInstance(" + S + "sample(pith_1, random_int), Integer.class)");
    assertThat(code).contains("(" + S + "isEmpty(pith_1) || ");
    assertThat(code).endsWith("violation(?|PITH_ROOT_NAME`^, pith_0, random_int);\n    }\n");
    assertThat(compiled.template.readsRandomInt()).isTrue();
    assertThat(compiled.template.pithVariableCount()).isEqualTo(3);
    // Children are indented one level more than their parents.
    assertThat(code).contains("\n                " + S + "isInstance((pith_1 = ");
  }

  @Test
  public void unionTestsPlainTypesFirst() {
    HintNode hint =
        HintNode.unionOf(
            HintNode.listOf(INT), INT, HintNode.subclassOf(Number.class), STRING, INT);
    String expression = expression(HintCodeGenerator.compile(hint));

    int plain = expression.indexOf(S + "isInstance(pith_0, Integer.class, String.class) ||");
    int list = expression.indexOf(S + "isInstance((pith_1 = pith_0), java.util.List.class)");
    int subclass = expression.indexOf(S + "isInstance((pith_1 = pith_0), Class.class)");
    assertThat(plain).isAtLeast(0);
    assertThat(list).isGreaterThan(plain);
    assertThat(subclass).isGreaterThan(list);
  }

  @Test
  public void unionOfPlainTypesIsSingleTest() {
    CompiledHint compiled =
        HintCodeGenerator.compile(HintNode.listOf(HintNode.unionOf(INT, STRING, INT)));
    assertThat(compiled.template.code())
        .contains(
            S + "isInstance(" + S + "sample(pith_0, random_int), Integer.class, String.class)");
    assertThat(compiled.check).isInstanceOf(PithCheck.SampledItems.class);
    PithCheck item = ((PithCheck.SampledItems) compiled.check).item;
    assertThat(((PithCheck.InstanceOf) item).types)
        .containsExactly(Integer.class, String.class)
        .inOrder();
  }

  @Test
  public void unionWithoutPlainTypesBindsInFirstChild() {
    HintNode hint = HintNode.tupleOf(HintNode.unionOf(HintNode.listOf(INT), HintNode.emptyTuple()));
    String code = HintCodeGenerator.compile(hint).template.code();
    assertThat(code)
        .contains(
            S + "isInstance((pith_2 = (pith_1 = " + S + "item(pith_0, 0))), java.util.List.class)");
    assertThat(code).contains(S + "isInstance((pith_2 = pith_1), java.util.List.class)");
  }

  @Test
  public void literal() {
    CompiledHint compiled =
        HintCodeGenerator.compile(HintNode.literalOf(1, "a", 2L, Color.RED, null, 'c', true));
    String expression = expression(compiled);
    assertThat(expression)
        .contains(
            S
                + "isInstance(pith_0, Integer.class, String.class, Long.class,"
                + " org.hintcheck.impl.HintCodeGeneratorTest.Color.class, Void.class,"
                + " Character.class, Boolean.class) &&");
    assertThat(expression).contains("java.util.Objects.equals(pith_0, Integer.valueOf(1)) ||");
    assertThat(expression).contains("java.util.Objects.equals(pith_0, \"a\") ||");
    assertThat(expression).contains("java.util.Objects.equals(pith_0, Long.valueOf(2L)) ||");
    assertThat(expression)
        .contains(
            "java.util.Objects.equals(pith_0,"
                + " org.hintcheck.impl.HintCodeGeneratorTest.Color.RED) ||");
    assertThat(expression).contains("java.util.Objects.equals(pith_0, null) ||");
    assertThat(expression)
        .contains("java.util.Objects.equals(pith_0, Character.valueOf('c')) ||");
    assertThat(expression).contains("java.util.Objects.equals(pith_0, Boolean.TRUE)\n");
  }

  @Test
  public void literalStringsCannotForgePlaceholders() {
    CompiledHint compiled =
        HintCodeGenerator.compile(HintNode.literalOf("@[0)!", "${FORWARDREF:X]?"));
    assertThat(compiled.template.forwardRefs()).isEmpty();
    assertThat(compiled.template.code()).contains("\"\\u0040[0)!\"");
    assertThat(Placeholders.containsDelimiter(compiled.template.bindRootName("x"))).isFalse();
  }

  @Test
  public void generic() {
    HintNode hint =
        HintNode.genericOf(ArrayList.class, HintNode.genericOf(List.class, HintNode.listOf(INT)));
    String expression = expression(HintCodeGenerator.compile(hint));
    assertThat(expression).contains(S + "isInstance(pith_0, java.util.ArrayList.class) &&");
    assertThat(expression).contains(S + "isInstance((pith_1 = pith_0), java.util.List.class) &&");
    assertThat(expression).contains(S + "isInstance((pith_2 = pith_1), java.util.List.class) &&");
    assertThat(expression).contains(S + "sample(pith_2, random_int)");
  }

  @Test
  public void genericWithoutSuperHintsIsInstanceTest() {
    CompiledHint compiled = HintCodeGenerator.compile(HintNode.genericOf(Number.class));
    assertThat(expression(compiled)).isEqualTo(S + "isInstance(pith_0, Number.class)");
    assertThat(compiled.check).isInstanceOf(PithCheck.InstanceOf.class);
  }

  @Test
  public void subclass() {
    String expression = expression(HintCodeGenerator.compile(HintNode.subclassOf(Number.class)));
    assertThat(expression)
        .isEqualTo(
            "(\n"
                + "            "
                + S
                + "isInstance(pith_0, Class.class) &&\n"
                + "            "
                + S
                + "isSubclass(pith_0, Number.class)\n"
                + "        )");
  }

  @Test
  public void annotated() {
    Validator positive = Validator.of("((Integer) {obj}) > 0", x -> (Integer) x > 0);
    Validator small = Validator.of("((Integer) {obj}) < 10", x -> (Integer) x < 10);
    HintNode hint = HintNode.listOf(HintNode.annotated(INT, positive, small));
    String code = HintCodeGenerator.compile(hint).template.code();
    assertThat(code)
        .contains(
            S
                + "isInstance((pith_1 = "
                + S
                + "sample(pith_0, random_int)), Integer.class) &&\n"
                + "                (((Integer) pith_1) > 0) &&\n"
                + "                (((Integer) pith_1) < 10)\n");
  }

  @Test
  public void validatorWithDisjunctionStaysOneOperand() {
    Validator validator =
        Validator.of("{obj} == null || {obj}.hashCode() != 0", x -> x == null || x.hashCode() != 0);
    String expression = expression(HintCodeGenerator.compile(HintNode.annotated(INT, validator)));
    assertThat(expression)
        .isEqualTo(
            "(\n"
                + "            "
                + S
                + "isInstance(pith_0, Integer.class) &&\n"
                + "            (pith_0 == null || pith_0.hashCode() != 0)\n"
                + "        )");
  }

  @Test
  public void forwardRef() {
    HintNode hint = HintNode.tupleOf(HintNode.forwardRef("Foo"), HintNode.forwardRef("a.b.Bar"));
    CodeTemplate template = HintCodeGenerator.compile(hint).template;
    assertThat(template.forwardRefs()).containsExactly("Foo", "a.b.Bar").inOrder();
    assertThat(template.code())
        .contains(S + "isInstance(" + S + "item(pith_0, 0), ${FORWARDREF:Foo]?)");
    assertThat(template.code())
        .contains(S + "isInstance(" + S + "item(pith_0, 1), ${FORWARDREF:a.b.Bar]?)");
  }

  @Test
  public void deterministic() {
    HintNode hint =
        HintNode.unionOf(
            HintNode.tupleOf(INT, HintNode.listOf(HintNode.optional(STRING))),
            HintNode.literalOf("x", 3),
            HintNode.subclassOf(CharSequence.class));
    CompiledHint first = HintCodeGenerator.compile(hint);
    CompiledHint second = HintCodeGenerator.compile(hint);
    assertThat(second).isNotSameInstanceAs(first);
    assertThat(second.template.code()).isEqualTo(first.template.code());

    // A structurally identical tree compiles to the same code.
    HintNode copy =
        HintNode.unionOf(
            HintNode.tupleOf(INT, HintNode.listOf(HintNode.optional(STRING))),
            HintNode.literalOf("x", 3),
            HintNode.subclassOf(CharSequence.class));
    assertThat(HintCodeGenerator.compile(copy).template.code()).isEqualTo(first.template.code());
  }

  @Test
  public void childCodeIsSplicedIntoParent() {
    // The code for a child hint appears verbatim (apart from indentation) in its parent's code.
    HintNode child = HintNode.tupleOf(INT, STRING);
    String childExpression = expression(HintCodeGenerator.compile(child));
    String parentCode =
        HintCodeGenerator.compile(HintNode.genericOf(List.class, child)).template.code();
    String reindented =
        childExpression
            .replace("\n        ", "\n            ")
            .replace("pith_0", "pith_1")
            .replaceFirst("isInstance\\(pith_1,", "isInstance((pith_1 = pith_0),");
    assertThat(parentCode).contains(reindented);
  }

  @Test
  public void noChildPlaceholdersRemain() {
    HintNode hint =
        HintNode.listOf(
            HintNode.unionOf(
                HintNode.tupleOf(INT, HintNode.listOf(STRING), HintNode.forwardRef("Foo")),
                HintNode.literalOf(1),
                HintNode.annotated(
                    HintNode.genericOf(List.class, HintNode.listOf(INT)),
                    Validator.of("{obj} != null", x -> x != null))));
    String code = HintCodeGenerator.compile(hint).template.code();
    assertThat(code).doesNotContain(Placeholders.CHILD_PREFIX);
    assertThat(code).contains(Placeholders.forwardRef("Foo"));
  }

  @Test
  public void malformedHints() {
    List<HintNode> malformed =
        ImmutableList.of(
            HintNode.unionOf(),
            HintNode.of(HintKind.INSTANCE, null, ImmutableList.of()),
            HintNode.of(HintKind.INSTANCE, Integer.class, ImmutableList.of(STRING)),
            HintNode.of(HintKind.SEQUENCE, List.class, ImmutableList.of()),
            HintNode.of(HintKind.SEQUENCE, List.class, ImmutableList.of(INT, STRING)),
            HintNode.of(HintKind.SEQUENCE, String.class, ImmutableList.of(INT)),
            HintNode.of(HintKind.FIXED_TUPLE, null, ImmutableList.of(INT)),
            HintNode.of(HintKind.SUBCLASS, Number.class, ImmutableList.of(INT)),
            HintNode.of(HintKind.GENERIC, null, ImmutableList.of(INT)),
            HintNode.of(HintKind.ANNOTATED, null, ImmutableList.of(INT)),
            HintNode.of(HintKind.LITERAL, null, ImmutableList.of()),
            HintNode.of(HintKind.FORWARD_REF, null, ImmutableList.of()),
            HintNode.literalOf(1.5),
            HintNode.literalOf(new Object()),
            HintNode.annotated(INT, Validator.of("{obj}.equals(\"@[0)!\")", x -> true)),
            HintNode.forwardRef("Foo]?"),
            HintNode.instanceOf(new Object() {}.getClass()),
            // Malformed children are found too.
            HintNode.listOf(HintNode.tupleOf(HintNode.unionOf())));
    for (HintNode hint : malformed) {
      assertThrows(
          hint.toString(), MalformedHintException.class, () -> HintCodeGenerator.compile(hint));
    }
  }
}
