/*
 * Copyright (C) 2026 Google, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.escapedjango;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.truth.Expect;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class IfParserTest {
  @Rule public Expect expect = Expect.create();

  private final Engine engine = Engine.builder().build();

  private ExpressionNode parse(String condition) {
    Parser parser = new Parser(engine, null, ImmutableList.of(), DefaultFilters.library());
    ImmutableList<String> words =
        ImmutableList.copyOf(Splitter.on(' ').omitEmptyStrings().split(condition));
    return IfParser.parse(parser, words);
  }

  private String parsed(String condition) {
    return parse(condition).toString();
  }

  private boolean evaluate(String condition, Map<String, ?> vars) {
    String rendered =
        engine
            .fromString("{% if " + condition + " %}yes{% else %}no{% endif %}")
            .render(vars);
    return rendered.equals("yes");
  }

  private boolean evaluate(String condition) {
    return evaluate(condition, ImmutableMap.of());
  }

  @Test
  public void precedence() {
    expect.that(parsed("a or b and c")).isEqualTo("(a or (b and c))");
    expect.that(parsed("a and b or c")).isEqualTo("((a and b) or c)");
    expect.that(parsed("not a or b")).isEqualTo("((not a) or b)");
    expect.that(parsed("not a == b")).isEqualTo("(not (a == b))");
    expect.that(parsed("a in b and c not in d")).isEqualTo("((a in b) and (c not in d))");
    expect.that(parsed("a is not None")).isEqualTo("(a is not None)");
    expect.that(parsed("x|length >= 3")).isEqualTo("(x|length >= 3)");
  }

  @Test
  public void parentheses() {
    expect.that(parsed("(a or b) and c")).isEqualTo("((a or b) and c)");
    expect.that(parsed("not (a and b)")).isEqualTo("(not (a and b))");
    expect.that(parsed("((a))")).isEqualTo("a");
    expect.that(parsed("x == \"(\"")).isEqualTo("(x == \"(\")");
  }

  @Test
  public void booleanOperators() {
    Map<String, Object> vars = ImmutableMap.of("t", true, "f", false);
    expect.that(evaluate("t and t", vars)).isTrue();
    expect.that(evaluate("t and f", vars)).isFalse();
    expect.that(evaluate("f or t", vars)).isTrue();
    expect.that(evaluate("f or f", vars)).isFalse();
    expect.that(evaluate("not f", vars)).isTrue();
    expect.that(evaluate("t or f and f", vars)).isTrue();
    expect.that(evaluate("(t or f) and f", vars)).isFalse();
  }

  @Test
  public void shortCircuit() {
    AtomicInteger calls = new AtomicInteger();
    Supplier<Boolean> counted =
        () -> {
          calls.incrementAndGet();
          return true;
        };
    Map<String, Object> vars = ImmutableMap.of("t", true, "f", false, "counted", counted);
    expect.that(evaluate("f and counted", vars)).isFalse();
    expect.that(evaluate("t or counted", vars)).isTrue();
    expect.that(calls.get()).isEqualTo(0);
    expect.that(evaluate("t and counted", vars)).isTrue();
    expect.that(calls.get()).isEqualTo(1);
  }

  @Test
  public void andWithElse() {
    Map<String, Object> vars = ImmutableMap.of("a", true, "b", false);
    assertThat(engine.fromString("{% if a and b %}yes{% else %}no{% endif %}").render(vars))
        .isEqualTo("no");
  }

  @Test
  public void andOrReturnOperands() {
    Context context = new Context(ImmutableMap.of("a", "", "b", "B"));
    expect.that(parse("a or b").evaluate(context)).isEqualTo("B");
    expect.that(parse("b or a").evaluate(context)).isEqualTo("B");
    expect.that(parse("a and b").evaluate(context)).isEqualTo("");
    expect.that(parse("b and a").evaluate(context)).isEqualTo("");
  }

  @Test
  public void truthiness() {
    Map<String, Object> vars = new HashMap<>();
    vars.put("zero", 0);
    vars.put("zeroPoint", 0.0);
    vars.put("emptyString", "");
    vars.put("emptyList", ImmutableList.of());
    vars.put("emptyMap", ImmutableMap.of());
    vars.put("emptyArray", new int[0]);
    vars.put("nothing", null);
    vars.put("one", 1);
    vars.put("text", "x");
    vars.put("list", ImmutableList.of(0));
    vars.put("falsy", (Truthy) () -> false);
    for (String falsy :
        ImmutableList.of(
            "zero", "zeroPoint", "emptyString", "emptyList", "emptyMap", "emptyArray", "nothing",
            "missing", "falsy", "False", "None")) {
      expect.withMessage(falsy).that(evaluate(falsy, vars)).isFalse();
    }
    for (String truthy : ImmutableList.of("one", "text", "list", "True")) {
      expect.withMessage(truthy).that(evaluate(truthy, vars)).isTrue();
    }
  }

  @Test
  public void comparisons() {
    Map<String, Object> vars = ImmutableMap.of("x", 3, "s", "abc");
    expect.that(evaluate("x == 3", vars)).isTrue();
    expect.that(evaluate("x == 3.0", vars)).isTrue();
    expect.that(evaluate("x != 4", vars)).isTrue();
    expect.that(evaluate("x > 2", vars)).isTrue();
    expect.that(evaluate("x >= 3", vars)).isTrue();
    expect.that(evaluate("x < 3", vars)).isFalse();
    expect.that(evaluate("x <= 2.5", vars)).isFalse();
    expect.that(evaluate("s == \"abc\"", vars)).isTrue();
    expect.that(evaluate("s < \"abd\"", vars)).isTrue();
    expect.that(evaluate("s|length == 3", vars)).isTrue();
  }

  @Test
  public void incomparableValuesAreFalse() {
    Map<String, Object> vars = ImmutableMap.of("x", 3, "s", "abc");
    expect.that(evaluate("x > s", vars)).isFalse();
    expect.that(evaluate("x < s", vars)).isFalse();
    expect.that(evaluate("missing > 1", vars)).isFalse();
    expect.that(evaluate("x in x", vars)).isFalse();
    expect.that(evaluate("x not in x", vars)).isFalse();
  }

  @Test
  public void membership() {
    Map<String, Object> vars =
        ImmutableMap.of(
            "list", ImmutableList.of("a", 2),
            "map", ImmutableMap.of("key", "value"),
            "s", "abcd",
            "array", new String[] {"z"});
    expect.that(evaluate("\"a\" in list", vars)).isTrue();
    expect.that(evaluate("2 in list", vars)).isTrue();
    expect.that(evaluate("2.0 in list", vars)).isTrue();
    expect.that(evaluate("\"b\" in list", vars)).isFalse();
    expect.that(evaluate("\"b\" not in list", vars)).isTrue();
    expect.that(evaluate("\"key\" in map", vars)).isTrue();
    expect.that(evaluate("\"value\" in map", vars)).isFalse();
    expect.that(evaluate("\"bc\" in s", vars)).isTrue();
    expect.that(evaluate("\"z\" in array", vars)).isTrue();
  }

  @Test
  public void identity() {
    Map<String, Object> vars = Collections.singletonMap("n", null);
    expect.that(evaluate("n is None", vars)).isTrue();
    expect.that(evaluate("missing is None", vars)).isTrue();
    expect.that(evaluate("n is not None", vars)).isFalse();
    expect.that(evaluate("True is True")).isTrue();
  }

  @Test
  public void elifChain() {
    Template template =
        engine.fromString(
            "{% if x == 1 %}one{% elif x == 2 %}two{% elif x == 3 %}three"
                + "{% else %}many{% endif %}");
    expect.that(template.render(ImmutableMap.of("x", 1))).isEqualTo("one");
    expect.that(template.render(ImmutableMap.of("x", 2))).isEqualTo("two");
    expect.that(template.render(ImmutableMap.of("x", 3))).isEqualTo("three");
    expect.that(template.render(ImmutableMap.of("x", 4))).isEqualTo("many");
  }

  @Test
  public void ifWithoutElse() {
    Template template = engine.fromString("[{% if x %}x{% endif %}]");
    expect.that(template.render(ImmutableMap.of("x", true))).isEqualTo("[x]");
    expect.that(template.render(ImmutableMap.of("x", false))).isEqualTo("[]");
  }

  private void expectSyntaxError(String condition, String expectedMessageSubstring) {
    ParseException e =
        assertThrows(
            condition,
            ParseException.class,
            () -> engine.fromString("{% if " + condition + " %}{% endif %}"));
    expect.withMessage(condition).that(e).hasMessageThat().contains(expectedMessageSubstring);
  }

  @Test
  public void syntaxErrors() {
    expectSyntaxError("a b", "Unused 'b' at end of if expression");
    expectSyntaxError("(a", "Unmatched '(' in if expression");
    expectSyntaxError("a and", "Unexpected end of expression in if tag");
    expectSyntaxError("and a", "Not expecting 'and' in this position in if tag");
    expectSyntaxError("a == == b", "Not expecting '==' in this position in if tag");
    expectSyntaxError("a )", "Unused ')' at end of if expression");
  }

  @Test
  public void emptyCondition() {
    ParseException e =
        assertThrows(ParseException.class, () -> engine.fromString("{% if %}{% endif %}"));
    assertThat(e).hasMessageThat().contains("Unexpected end of expression in if tag");
  }

  @Test
  public void malformedEnd() {
    ParseException e =
        assertThrows(
            ParseException.class,
            () -> engine.fromString("{% if a %}{% else %}{% else %}{% endif %}"));
    assertThat(e).hasMessageThat().contains("Invalid block tag 'else', expected 'endif'");
  }
}
