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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.truth.Expect;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.Map;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class IncludeTest {
  @Rule public Expect expect = Expect.create();

  private static final ImmutableMap<String, String> RESOURCES =
      ImmutableMap.<String, String>builder()
          .put("hello.html", "Hi {{ name }}")
          .put("cycle.html", "{% cycle 'x' 'y' %}")
          .put("broken.html", "{% if %}")
          .put(
              "tree.html",
              "{{ node.name }}"
                  + "{% for child in node.children %}"
                  + "({% include 'tree.html' with node=child %})"
                  + "{% endfor %}")
          .build();

  private final Engine engine =
      Engine.builder().resourceOpener(TemplateTest.openerFor(RESOURCES)).build();

  private String render(String template, Map<String, ?> vars) {
    return engine.fromString(template).render(vars);
  }

  @Test
  public void include() {
    assertThat(render("[{% include 'hello.html' %}]", ImmutableMap.of("name", "Ann")))
        .isEqualTo("[Hi Ann]");
  }

  @Test
  public void includeWith() {
    Map<String, Object> vars = ImmutableMap.of("name", "Ann");
    expect
        .that(render("{% include 'hello.html' with name='Bob' %}/{{ name }}", vars))
        .isEqualTo("Hi Bob/Ann");
    expect
        .that(render("{% include \"hello.html\" with name=name|upper %}", vars))
        .isEqualTo("Hi ANN");
  }

  @Test
  public void includeOnly() {
    Map<String, Object> vars = ImmutableMap.of("name", "Ann");
    expect.that(render("{% include 'hello.html' only %}", vars)).isEqualTo("Hi ");
    expect
        .that(render("{% include 'hello.html' with name='Zed' only %}", vars))
        .isEqualTo("Hi Zed");
    expect
        .that(render("{% include 'hello.html' only with name='Zed' %}", vars))
        .isEqualTo("Hi Zed");
  }

  @Test
  public void includeNameFromVariable() throws IOException {
    expect
        .that(render("{% include which %}", ImmutableMap.of("which", "hello.html", "name", "V")))
        .isEqualTo("Hi V");
    Template template = engine.fromString("<{{ name }}>");
    expect
        .that(render("{% include which %}", ImmutableMap.of("which", template, "name", "T")))
        .isEqualTo("<T>");
  }

  @Test
  public void recursiveInclude() {
    Map<String, Object> leaf1 = ImmutableMap.of("name", "b", "children", ImmutableList.of());
    Map<String, Object> leaf2 = ImmutableMap.of("name", "c", "children", ImmutableList.of());
    Map<String, Object> root =
        ImmutableMap.of("name", "a", "children", ImmutableList.of(leaf1, leaf2));
    assertThat(render("{% include 'tree.html' %}", ImmutableMap.of("node", root)))
        .isEqualTo("a(b)(c)");
  }

  @Test
  public void includedTemplateStateIsSeparate() {
    Map<String, Object> vars = ImmutableMap.of("items", ImmutableList.of(1, 2, 3));
    String rendered =
        render(
            "{% for i in items %}{% cycle 'a' 'b' %}{% include 'cycle.html' %}{% endfor %}", vars);
    assertThat(rendered).isEqualTo("axbxax");
  }

  @Test
  public void missingInclude() {
    Template template = engine.fromString("x\n{% include 'missing.html' %}");
    EvaluationException e =
        assertThrows(EvaluationException.class, () -> template.render(ImmutableMap.of()));
    assertThat(e).hasMessageThat().startsWith("In tag on line 2:");
    assertThat(e).hasCauseThat().isInstanceOf(FileNotFoundException.class);
  }

  @Test
  public void brokenInclude() {
    Template template = engine.fromString("{% include 'broken.html' %}");
    EvaluationException e =
        assertThrows(EvaluationException.class, () -> template.render(ImmutableMap.of()));
    assertThat(e).hasCauseThat().isInstanceOf(ParseException.class);
  }

  @Test
  public void invalidIncludeName() {
    Template template = engine.fromString("{% include which %}");
    EvaluationException e =
        assertThrows(
            EvaluationException.class, () -> template.render(ImmutableMap.of("which", 5)));
    assertThat(e)
        .hasMessageThat()
        .contains("Argument to include must be a template name or a Template, not Integer");
  }

  private void expectSyntaxError(String template, String expectedMessageSubstring) {
    ParseException e = assertThrows(ParseException.class, () -> engine.fromString(template));
    expect.withMessage(template).that(e).hasMessageThat().contains(expectedMessageSubstring);
  }

  @Test
  public void syntaxErrors() {
    expectSyntaxError("{% include %}", "'include' tag takes at least one argument");
    expectSyntaxError(
        "{% include 'x' only only %}", "The 'only' option was specified more than once.");
    expectSyntaxError(
        "{% include 'x' with %}", "\"with\" in 'include' tag needs at least one keyword argument.");
    expectSyntaxError("{% include 'x' foo %}", "Unknown argument for 'include' tag: 'foo'.");
  }
}
