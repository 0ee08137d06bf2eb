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
import com.google.common.base.Splitter;
import com.google.common.truth.Expect;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DefaultTagsTest {
  @Rule public Expect expect = Expect.create();

  private static final Library SHOUT =
      Library.builder()
          .filter("shout", value -> Values.toDisplayString(value).toUpperCase() + "!")
          .filter("whisper", value -> Values.toDisplayString(value).toLowerCase())
          .build();

  private final Engine engine = Engine.builder().addLibrary("shout", SHOUT).build();

  private String render(String template) {
    return render(template, ImmutableMap.of());
  }

  private String render(String template, Map<String, ?> vars) {
    return engine.fromString(template).render(vars);
  }

  private void expectSyntaxError(String template, String expectedMessageSubstring) {
    ParseException e = assertThrows(ParseException.class, () -> engine.fromString(template));
    expect.withMessage(template).that(e).hasMessageThat().contains(expectedMessageSubstring);
  }

  @Test
  public void with() {
    expect
        .that(render("{% with a=1 b='x' %}{{ a }}{{ b }}{% endwith %}[{{ a }}]"))
        .isEqualTo("1x[]");
    expect
        .that(render("{% with total as t %}{{ t }}{% endwith %}", ImmutableMap.of("total", 5)))
        .isEqualTo("5");
    expect
        .that(render("{% with n=name|upper %}{{ n }}{% endwith %}", ImmutableMap.of("name", "x")))
        .isEqualTo("X");
  }

  @Test
  public void withErrors() {
    expectSyntaxError(
        "{% with %}{% endwith %}", "'with' expected at least one variable assignment");
    expectSyntaxError(
        "{% with a=1 junk %}{% endwith %}", "'with' received an invalid token: 'junk'");
  }

  @Test
  public void autoescape() {
    Map<String, Object> vars = ImmutableMap.of("s", "<b>");
    expect
        .that(render("{% autoescape off %}{{ s }}{% endautoescape %}{{ s }}", vars))
        .isEqualTo("<b>&lt;b&gt;");
    Engine plain = Engine.builder().autoescape(false).build();
    expect
        .that(plain.fromString("{% autoescape on %}{{ s }}{% endautoescape %}").render(vars))
        .isEqualTo("&lt;b&gt;");
    expectSyntaxError("{% autoescape %}{% endautoescape %}", "requires exactly one argument");
    expectSyntaxError(
        "{% autoescape maybe %}{% endautoescape %}",
        "'autoescape' argument should be 'on' or 'off'");
  }

  @Test
  public void comment() {
    expect.that(render("a{% comment %}{{ x }}{% if %}{% endcomment %}b")).isEqualTo("ab");
    expect.that(render("a{% comment \"why\" %}x{% endcomment %}b")).isEqualTo("ab");
    expect.that(render("a{# {{ x }} #}b")).isEqualTo("ab");
  }

  @Test
  public void cycle() {
    Map<String, Object> vars = ImmutableMap.of("l", ImmutableList.of(1, 2, 3));
    expect
        .that(render("{% for i in l %}{% cycle 'odd' 'even' %} {% endfor %}", vars))
        .isEqualTo("odd even odd ");
    expect
        .that(render("{% for i in l %}{% cycle 'a' 'b' as c %}{{ c }}{% endfor %}", vars))
        .isEqualTo("aabbaa");
    expect
        .that(
            render(
                "{% cycle 'a' 'b' as c silent %}{% for i in l %}{% cycle c %}{{ c }}{% endfor %}",
                vars))
        .isEqualTo("bab");
  }

  @Test
  public void cycleStartsOverForEachRender() {
    Template template = engine.fromString("{% cycle 'a' 'b' %}{% cycle 'x' 'y' %}");
    expect.that(template.render(ImmutableMap.of())).isEqualTo("ax");
    expect.that(template.render(ImmutableMap.of())).isEqualTo("ax");
  }

  @Test
  public void resetcycle() {
    Map<String, Object> vars = ImmutableMap.of("l", ImmutableList.of(1, 2, 3, 4));
    expect
        .that(
            render(
                "{% for i in l %}{% cycle 'a' 'b' 'c' %}"
                    + "{% if i == 2 %}{% resetcycle %}{% endif %}{% endfor %}",
                vars))
        .isEqualTo("abab");
    expect
        .that(
            render(
                "{% cycle 'x' 'y' as named silent %}"
                    + "{% for i in l %}"
                    + "{% cycle named %}{{ named }}{% resetcycle named %}"
                    + "{% endfor %}",
                vars))
        .isEqualTo("yxxx");
  }

  @Test
  public void cycleErrors() {
    expectSyntaxError("{% cycle %}", "'cycle' tag requires at least two arguments");
    expectSyntaxError("{% cycle nope %}", "Named cycle 'nope' does not exist");
    expectSyntaxError("{% cycle 'a' 'b' as c loud %}", "Only 'silent' flag is allowed");
    expectSyntaxError("{% resetcycle %}", "No cycles in template.");
    expectSyntaxError("{% cycle 'a' 'b' %}{% resetcycle nope %}", "Named cycle 'nope'");
  }

  @Test
  public void filter() {
    expect
        .that(
            render(
                "{% filter upper|cut:' ' %}a b {{ s }}{% endfilter %}", ImmutableMap.of("s", "c")))
        .isEqualTo("ABC");
    expect
        .that(render("{% filter lower %}{{ s }}{% endfilter %}", ImmutableMap.of("s", "<B>")))
        .isEqualTo("&lt;b&gt;");
    expectSyntaxError(
        "{% filter escape %}{% endfilter %}",
        "'filter escape' is not permitted. Use the 'autoescape' tag instead.");
    expectSyntaxError("{% filter upper|safe %}{% endfilter %}", "'filter safe' is not permitted");
  }

  @Test
  public void firstof() {
    Map<String, Object> vars = ImmutableMap.of("a", "", "b", "<B>");
    expect.that(render("{% firstof a b 'fallback' %}", vars)).isEqualTo("&lt;B&gt;");
    expect.that(render("{% firstof a missing 'fallback' %}", vars)).isEqualTo("fallback");
    expect.that(render("[{% firstof a missing %}]", vars)).isEqualTo("[]");
    expect.that(render("{% firstof a b as x %}[{{ x }}]", vars)).isEqualTo("[&lt;B&gt;]");
    expectSyntaxError("{% firstof %}", "'firstof' statement requires at least one argument");
  }

  @Test
  public void firstofIgnoresStrictVariables() {
    Engine strict = Engine.builder().strictVariables(true).build();
    assertThat(strict.fromString("{% firstof missing 'x' %}").render(ImmutableMap.of()))
        .isEqualTo("x");
  }

  @Test
  public void ifchanged() {
    Map<String, Object> vars = ImmutableMap.of("l", ImmutableList.of(1, 1, 2, 2, 1));
    expect
        .that(render("{% for i in l %}{% ifchanged %}{{ i }}{% endifchanged %}{% endfor %}", vars))
        .isEqualTo("121");
    expect
        .that(
            render(
                "{% for i in l %}"
                    + "{% ifchanged i %}[{{ i }}]{% else %}.{% endifchanged %}"
                    + "{% endfor %}",
                vars))
        .isEqualTo("[1].[2].[1]");
  }

  @Test
  public void ifchangedResetsWithOuterLoop() {
    Map<String, Object> vars =
        ImmutableMap.of("outer", ImmutableList.of(1, 2), "inner", ImmutableList.of("x", "x"));
    assertThat(
            render(
                "{% for o in outer %}{% for i in inner %}"
                    + "{% ifchanged %}{{ i }}{% endifchanged %}"
                    + "{% endfor %}|{% endfor %}",
                vars))
        .isEqualTo("x|x|");
  }

  @Test
  public void load() {
    expect.that(render("{% load shout %}{{ 'hi'|shout }}")).isEqualTo("HI!");
    expect.that(render("{% load shout from shout %}{{ 'hi'|shout }}")).isEqualTo("HI!");
    assertThrows(
        FilterDoesNotExistException.class,
        () -> engine.fromString("{% load shout from shout %}{{ 'HI'|whisper }}"));
    assertThrows(FilterDoesNotExistException.class, () -> engine.fromString("{{ 'hi'|shout }}"));
  }

  @Test
  public void loadErrors() {
    expectSyntaxError(
        "{% load missing %}", "'missing' is not a registered tag library. Must be one of: shout");
    expectSyntaxError(
        "{% load nope from shout %}", "'nope' is not a valid tag or filter in tag library 'shout'");
  }

  @Test
  public void spaceless() {
    assertThat(render("{% spaceless %} <p>\n  <a>x y</a> </p> {% endspaceless %}"))
        .isEqualTo("<p><a>x y</a></p>");
  }

  @Test
  public void templatetag() {
    expect
        .that(render("{% templatetag openblock %} x {% templatetag closevariable %}"))
        .isEqualTo("{% x }}");
    expect
        .that(render("{% templatetag opencomment %}{% templatetag closebrace %}"))
        .isEqualTo("{#}");
    expectSyntaxError("{% templatetag nope %}", "Invalid templatetag argument: 'nope'");
  }

  @Test
  public void verbatim() {
    expect
        .that(render("{% verbatim %}{{ x }}{% if %}{% endverbatim %}!"))
        .isEqualTo("{{ x }}{% if %}!");
    expect
        .that(render("{% verbatim v %}{% endverbatim %}{% endverbatim v %}"))
        .isEqualTo("{% endverbatim %}");
  }

  @Test
  public void widthratio() {
    expect.that(render("{% widthratio 175 200 100 %}")).isEqualTo("88");
    expect.that(render("{% widthratio v 0 100 %}", ImmutableMap.of("v", 5))).isEqualTo("0");
    expect.that(render("[{% widthratio 'x' 10 100 %}]")).isEqualTo("[]");
    expect.that(render("{% widthratio 50 100 10 as w %}[{{ w }}]")).isEqualTo("[5]");
    expectSyntaxError("{% widthratio 1 2 %}", "widthratio takes at least three arguments");
    expectSyntaxError("{% widthratio 1 2 3 to w %}", "Expecting 'as' keyword");
    Template template = engine.fromString("{% widthratio 1 2 'x' %}");
    EvaluationException e =
        assertThrows(EvaluationException.class, () -> template.render(ImmutableMap.of()));
    assertThat(e).hasMessageThat().contains("widthratio final argument must be a number");
  }

  private static final ImmutableList<ImmutableMap<String, String>> PEOPLE =
      ImmutableList.of(
          ImmutableMap.of("name", "Ann", "city", "Paris"),
          ImmutableMap.of("name", "Bob", "city", "Paris"),
          ImmutableMap.of("name", "Cy", "city", "Rome"),
          ImmutableMap.of("name", "Di", "city", "Paris"));

  @Test
  public void regroup() {
    Map<String, Object> vars = ImmutableMap.of("people", PEOPLE);
    expect
        .that(
            render(
                "{% regroup people by city as groups %}"
                    + "{% for group in groups %}{{ group.grouper }}:"
                    + "{% for p in group.list %}{{ p.name }} {% endfor %};"
                    + "{% endfor %}",
                vars))
        .isEqualTo("Paris:Ann Bob ;Rome:Cy ;Paris:Di ;");
    expect
        .that(
            render(
                "{% regroup people by city as groups %}"
                    + "{% for city, members in groups %}"
                    + "{{ city }}={{ members|length }} "
                    + "{% endfor %}",
                vars))
        .isEqualTo("Paris=2 Rome=1 Paris=1 ");
    expect
        .that(render("[{% regroup missing by city as groups %}{{ groups|length }}]"))
        .isEqualTo("[0]");
  }

  @Test
  public void regroupErrors() {
    expectSyntaxError("{% regroup people by city %}", "'regroup' tag takes five arguments");
    expectSyntaxError(
        "{% regroup people with city as g %}", "second argument to 'regroup' tag must be 'by'");
    expectSyntaxError(
        "{% regroup people by city to g %}",
        "next-to-last argument to 'regroup' tag must be 'as'");
  }

  @Test
  public void now() {
    Clock clock = Clock.fixed(Instant.parse("2026-10-18T23:30:00Z"), ZoneOffset.UTC);
    Engine fixed = Engine.builder().clock(clock).build();
    expect.that(fixed.fromString("{% now 'yyyy' %}").render(ImmutableMap.of())).isEqualTo("2026");
    expect
        .that(fixed.fromString("{% now \"d MMMM yyyy\" %}").render(ImmutableMap.of()))
        .isEqualTo("18 October 2026");
    expect
        .that(
            fixed
                .fromString("{% now 'yyyy' as year %}The year is {{ year }}.")
                .render(ImmutableMap.of()))
        .isEqualTo("The year is 2026.");
    Engine tokyo =
        Engine.builder().clock(clock).useTz(true).timeZone(ZoneId.of("Asia/Tokyo")).build();
    expect
        .that(tokyo.fromString("{% now 'yyyy-MM-dd HH:mm' %}").render(ImmutableMap.of()))
        .isEqualTo("2026-10-19 08:30");
  }

  @Test
  public void nowErrors() {
    expectSyntaxError("{% now %}", "'now' statement takes one argument");
    expectSyntaxError("{% now yyyy %}", "'now' statement takes one argument");
    expectSyntaxError("{% now 'yyyy' as %}", "'now' statement takes one argument");
    expectSyntaxError("{% now 'bbb' %}", "Invalid 'now' format 'bbb'");
  }

  @Test
  public void lorem() {
    expect.that(render("{% lorem %}")).isEqualTo(LoremIpsum.COMMON_PARAGRAPH);
    expect.that(render("{% lorem 3 w %}")).isEqualTo("lorem ipsum dolor");
    expect.that(render("{% lorem n w %}", ImmutableMap.of("n", 2))).isEqualTo("lorem ipsum");
    expect.that(render("{% lorem 'x' w %}")).isEqualTo("lorem");
    String paragraphs = render("{% lorem 2 p %}");
    expect.that(paragraphs).startsWith("<p>" + LoremIpsum.COMMON_PARAGRAPH + "</p>\n\n<p>");
    expect.that(paragraphs).endsWith("</p>");
    List<String> words = Splitter.on(' ').splitToList(render("{% lorem 25 w %}"));
    expect.that(words).hasSize(25);
    expect.that(words.subList(0, 19)).isEqualTo(LoremIpsum.COMMON_WORDS);
    List<String> random = Splitter.on(' ').splitToList(render("{% lorem 4 w random %}"));
    expect.that(random).hasSize(4);
    for (String word : random) {
      expect.that(word).matches("[a-z]+");
    }
    expectSyntaxError("{% lorem 1 2 w %}", "Incorrect format for 'lorem' tag");
  }

  @Test
  public void debug() {
    Map<String, Object> vars = ImmutableMap.of("a", "<x>");
    expect.that(render("[{% debug %}]", vars)).isEqualTo("[]");
    Engine debugEngine = Engine.builder().debug(true).build();
    expect
        .that(
            debugEngine
                .fromString("{% with b=1 %}{% debug %}{% endwith %}")
                .render(vars))
        .isEqualTo("{b=1}\n{a=&lt;x&gt;}");
  }

  @Test
  public void partials() {
    expect
        .that(
            render(
                "{% partialdef card %}[{{ x }}]{% endpartialdef %}"
                    + "{% partial card %}{% partial card %}",
                ImmutableMap.of("x", 1)))
        .isEqualTo("[1][1]");
    expect
        .that(render("{% partialdef p inline %}A{% endpartialdef %}-{% partial p %}"))
        .isEqualTo("A-A");
    expect
        .that(render("{% partial p %}{% partialdef p %}B{% endpartialdef p %}"))
        .isEqualTo("B");
    expect
        .that(
            render(
                "{% partialdef item %}<{{ i }}>{% endpartialdef %}"
                    + "{% for i in items %}{% partial item %}{% endfor %}",
                ImmutableMap.of("items", ImmutableList.of(1, 2))))
        .isEqualTo("<1><2>");
    Template undefined = engine.fromString("{% partial nope %}");
    EvaluationException e =
        assertThrows(EvaluationException.class, () -> undefined.render(ImmutableMap.of()));
    assertThat(e)
        .hasMessageThat()
        .contains("Partial 'nope' is not defined in the current template.");
  }

  @Test
  public void partialErrors() {
    expectSyntaxError("{% partialdef %}", "'partialdef' tag requires a name");
    expectSyntaxError(
        "{% partialdef a b %}{% endpartialdef %}",
        "The 'inline' argument does not have any parameters");
    expectSyntaxError("{% partialdef a inline b %}", "'partialdef' tag takes at most 2 arguments");
    expectSyntaxError(
        "{% partialdef a %}{% endpartialdef %}{% partialdef a %}{% endpartialdef %}",
        "Partial 'a' is already defined in the '<string>' template.");
    expectSyntaxError(
        "{% partialdef a %}{% endpartialdef b %}",
        "Invalid block tag 'endpartialdef b', expected 'endpartialdef'");
    expectSyntaxError("{% partial %}", "'partial' tag requires a single argument");
  }
}
