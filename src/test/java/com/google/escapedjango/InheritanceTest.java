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
public class InheritanceTest {
  @Rule public Expect expect = Expect.create();

  private static final ImmutableMap<String, String> RESOURCES =
      ImmutableMap.<String, String>builder()
          .put(
              "base.html",
              "<title>{% block title %}Base{% endblock %}</title>"
                  + "{% block body %}base body{% endblock %}")
          .put(
              "child.html",
              "{% extends \"base.html\" %}ignored{% block title %}Child{% endblock %}")
          .put(
              "grandchild.html",
              "{% extends 'child.html' %}{% block title %}{{ block.super }} + GC{% endblock %}")
          .put("a.html", "{% block x %}A{% endblock %}")
          .put("b.html", "{% extends 'a.html' %}{% block x %}{{ block.super }}B{% endblock %}")
          .put("c.html", "{% extends 'b.html' %}{% block x %}{{ block.super }}C{% endblock %}")
          .put(
              "nested.html",
              "{% block outer %}O[{% block inner %}i{% endblock %}]{% endblock %}")
          .put("innerOnly.html", "{% extends 'nested.html' %}{% block inner %}I{% endblock %}")
          .put("outerOnly.html", "{% extends 'nested.html' %}{% block outer %}X{% endblock %}")
          .put("variable.html", "{% extends parent %}{% block title %}V{% endblock %}")
          .put("loop1.html", "{% extends 'loop2.html' %}")
          .put("loop2.html", "{% extends 'loop1.html' %}")
          .put("self.html", "{% extends 'self.html' %}")
          .put("orphan.html", "{% extends 'missing.html' %}")
          .put(
              "context.html",
              "{% extends 'base.html' %}{% block body %}Hello {{ name }}{% endblock %}")
          .put(
              "includer.html",
              "{% extends 'base.html' %}"
                  + "{% block title %}T{% endblock %}"
                  + "{% block body %}{% include 'included.html' %}{% endblock %}")
          .put("included.html", "{% block title %}included{% endblock %}")
          .build();

  private final Engine engine =
      Engine.builder().resourceOpener(TemplateTest.openerFor(RESOURCES)).build();

  private String render(String name) throws IOException {
    return render(name, ImmutableMap.of());
  }

  private String render(String name, Map<String, ?> vars) throws IOException {
    return engine.getTemplate(name).render(vars);
  }

  @Test
  public void blockWithoutInheritance() throws IOException {
    assertThat(render("base.html")).isEqualTo("<title>Base</title>base body");
  }

  @Test
  public void childOverridesBlock() throws IOException {
    assertThat(render("child.html")).isEqualTo("<title>Child</title>base body");
  }

  @Test
  public void blockSuper() throws IOException {
    assertThat(render("grandchild.html")).isEqualTo("<title>Child + GC</title>base body");
  }

  @Test
  public void blockSuperThroughThreeLevels() throws IOException {
    expect.that(render("a.html")).isEqualTo("A");
    expect.that(render("b.html")).isEqualTo("AB");
    expect.that(render("c.html")).isEqualTo("ABC");
  }

  @Test
  public void blockSuperWithoutParentIsEmpty() {
    Template template = engine.fromString("{% block x %}[{{ block.super }}]{% endblock %}");
    assertThat(template.render(ImmutableMap.of())).isEqualTo("[]");
  }

  @Test
  public void blockName() {
    Template template = engine.fromString("{% block x %}{{ block.name }}{% endblock x %}");
    assertThat(template.render(ImmutableMap.of())).isEqualTo("x");
  }

  @Test
  public void nestedBlocks() throws IOException {
    expect.that(render("nested.html")).isEqualTo("O[i]");
    expect.that(render("innerOnly.html")).isEqualTo("O[I]");
    expect.that(render("outerOnly.html")).isEqualTo("X");
  }

  @Test
  public void parentFromVariable() throws IOException {
    expect
        .that(render("variable.html", ImmutableMap.of("parent", "base.html")))
        .isEqualTo("<title>V</title>base body");
    Template parent = engine.fromString("[{% block title %}P{% endblock %}]");
    expect.that(render("variable.html", ImmutableMap.of("parent", parent))).isEqualTo("[V]");
  }

  @Test
  public void invalidParentName() {
    TemplateStructureException e =
        assertThrows(
            TemplateStructureException.class,
            () -> render("variable.html", ImmutableMap.of("parent", 23)));
    assertThat(e)
        .hasMessageThat()
        .startsWith("Invalid template name in 'extends' tag on line 1 of variable.html: 23");
  }

  @Test
  public void blocksSeeTheContext() throws IOException {
    assertThat(render("context.html", ImmutableMap.of("name", "<Ann>")))
        .isEqualTo("<title>Base</title>Hello &lt;Ann&gt;");
  }

  @Test
  public void includedTemplateBlocksAreNotOverridden() throws IOException {
    assertThat(render("includer.html")).isEqualTo("<title>T</title>included");
  }

  @Test
  public void inheritanceLoop() {
    TemplateStructureException e =
        assertThrows(TemplateStructureException.class, () -> render("loop1.html"));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("Template inheritance loop: loop1.html -> loop2.html -> loop1.html");
    e = assertThrows(TemplateStructureException.class, () -> render("self.html"));
    assertThat(e).hasMessageThat().isEqualTo("Template inheritance loop: self.html -> self.html");
  }

  @Test
  public void missingParent() {
    TemplateStructureException e =
        assertThrows(TemplateStructureException.class, () -> render("orphan.html"));
    assertThat(e)
        .hasMessageThat()
        .startsWith("Cannot load template 'missing.html' extended on line 1 of orphan.html");
    assertThat(e).hasCauseThat().isInstanceOf(FileNotFoundException.class);
  }

  @Test
  public void extendsMustBeFirst() {
    ParseException e =
        assertThrows(
            ParseException.class,
            () -> engine.fromString("{% if x %}{% endif %}{% extends 'base.html' %}"));
    assertThat(e).hasMessageThat().contains("'extends' must be the first tag in the template");
    // Text before it is fine.
    engine.fromString("\n  {% extends 'base.html' %}");
  }

  @Test
  public void extendsOnlyOnce() {
    ParseException e =
        assertThrows(
            ParseException.class,
            () -> engine.fromString("{% extends 'a.html' %}{% extends 'b.html' %}"));
    assertThat(e)
        .hasMessageThat()
        .contains("'extends' cannot appear more than once in the same template");
  }

  @Test
  public void duplicateBlockName() {
    ParseException e =
        assertThrows(
            ParseException.class,
            () -> engine.fromString("{% block a %}{% endblock %}\n{% block a %}{% endblock %}"));
    assertThat(e).hasMessageThat().contains("'block' tag with name 'a' appears more than once");
    assertThat(e.lineNumber()).isEqualTo(2);
  }

  @Test
  public void wrongEndBlockName() {
    ParseException e =
        assertThrows(
            ParseException.class, () -> engine.fromString("{% block a %}{% endblock b %}"));
    assertThat(e).hasMessageThat().contains("Invalid block tag 'endblock b'");
  }
}
