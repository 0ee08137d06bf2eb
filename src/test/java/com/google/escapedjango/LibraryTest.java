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
import java.math.RoundingMode;
import java.util.Locale;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LibraryTest {
  @Rule public Expect expect = Expect.create();

  /** Compiles <code>{% upper %}...{% endupper %}</code>, which renders its body in upper case. */
  private static final TagCompiler UPPER =
      (parser, token) -> {
        NodeList body = parser.parse("endupper");
        parser.deleteFirstToken();
        return new Node(parser.resourceName(), token.lineNumber()) {
          @Override
          public void render(Context context, StringBuilder output) {
            output.append(body.render(context).toUpperCase(Locale.ROOT));
          }
        };
      };

  /** Compiles <code>{% repeat n %}...{% endrepeat %}</code>. */
  private static final TagCompiler REPEAT =
      (parser, token) -> {
        ImmutableList<String> bits = token.splitContents();
        if (bits.size() != 2) {
          throw parser.syntaxError(token, "'repeat' takes one argument");
        }
        FilterExpression count = parser.compileFilter(bits.get(1));
        NodeList body = parser.parse("endrepeat");
        parser.deleteFirstToken();
        return new Node(parser.resourceName(), token.lineNumber()) {
          @Override
          public void render(Context context, StringBuilder output) {
            long n = Values.toLong(count.resolve(context));
            for (long i = 0; i < n; i++) {
              body.render(context, output);
            }
          }
        };
      };

  @Test
  public void customTags() {
    Library library = Library.builder().tag("upper", UPPER).tag("repeat", REPEAT).build();
    Engine engine = Engine.builder().addBuiltin(library).build();
    Template upper = engine.fromString("{% upper %}a{{ b }}{% endupper %}");
    expect.that(upper.render(ImmutableMap.of("b", "x"))).isEqualTo("AX");
    Template repeat = engine.fromString("{% repeat n|add:1 %}ab{% endrepeat %}");
    expect.that(repeat.render(ImmutableMap.of("n", 2))).isEqualTo("ababab");
    ParseException e =
        assertThrows(
            ParseException.class, () -> engine.fromString("\n{% repeat %}{% endrepeat %}"));
    assertThat(e).hasMessageThat().isEqualTo("'repeat' takes one argument, on line 2");
  }

  @Test
  public void customTagEndTagIsRequired() {
    Engine engine =
        Engine.builder().addBuiltin(Library.builder().tag("upper", UPPER).build()).build();
    ParseException e = assertThrows(ParseException.class, () -> engine.fromString("{% upper %}x"));
    assertThat(e).hasMessageThat().contains("endupper");
  }

  @Test
  public void builtinReplacesDefault() {
    Library library = Library.builder().filter("upper", value -> "replaced").build();
    Engine engine = Engine.builder().addBuiltin(library).build();
    assertThat(engine.fromString("{{ 'a'|upper }}{{ 'b'|lower }}").render(ImmutableMap.of()))
        .isEqualTo("replacedb");
  }

  @Test
  public void loadedLibraryReplacesBuiltin() {
    Library library = Library.builder().filter("upper", value -> "loaded").build();
    Engine engine = Engine.builder().addLibrary("mine", library).build();
    Template template = engine.fromString("{{ 'a'|upper }}{% load mine %}{{ 'a'|upper }}");
    assertThat(template.render(ImmutableMap.of())).isEqualTo("Aloaded");
  }

  @Test
  public void laterRegistrationWins() {
    Library library =
        Library.builder().filter("f", value -> "first").filter("f", value -> "second").build();
    Engine engine = Engine.builder().addBuiltin(library).build();
    assertThat(engine.fromString("{{ 1|f }}").render(ImmutableMap.of())).isEqualTo("second");
  }

  @Test
  public void addAll() {
    Library base = Library.builder().tag("upper", UPPER).filter("f", value -> "f").build();
    Library combined = Library.builder().addAll(base).filter("g", value -> "g").build();
    assertThat(combined.tags().keySet()).containsExactly("upper");
    assertThat(combined.filters().keySet()).containsExactly("f", "g").inOrder();
  }

  @Test
  public void arity() {
    Library library =
        Library.builder()
            .filter("none", value -> "none")
            .filter("required", (value, arg) -> "required " + arg)
            .filter(
                "optional",
                Filter.Arity.OPTIONAL,
                (value, arg, autoescape) -> "optional " + (arg == null ? "-" : arg))
            .build();
    expect.that(library.filters().get("none").arity()).isEqualTo(Filter.Arity.NONE);
    expect.that(library.filters().get("required").arity()).isEqualTo(Filter.Arity.REQUIRED);
    Engine engine = Engine.builder().addBuiltin(library).build();
    expect
        .that(engine.fromString("{{ 1|optional }}/{{ 1|optional:2 }}").render(ImmutableMap.of()))
        .isEqualTo("optional -/optional 2");
    expect
        .that(engine.fromString("{{ 1|required:'x' }}").render(ImmutableMap.of()))
        .isEqualTo("required x");
    assertThrows(ParseException.class, () -> engine.fromString("{{ 1|required }}"));
    assertThrows(ParseException.class, () -> engine.fromString("{{ 1|none:2 }}"));
  }

  @Test
  public void needsAutoescape() {
    Library library =
        Library.builder()
            .filter(
                "told",
                Filter.Arity.NONE,
                (value, arg, autoescape) -> autoescape ? "on" : "off",
                Filter.Flag.NEEDS_AUTOESCAPE)
            .filter(
                "untold",
                Filter.Arity.NONE,
                (value, arg, autoescape) -> autoescape ? "on" : "off")
            .build();
    Engine engine = Engine.builder().addBuiltin(library).build();
    String template =
        "{{ 1|told }}{{ 1|untold }}"
            + "{% autoescape off %} {{ 1|told }}{{ 1|untold }}{% endautoescape %}";
    assertThat(engine.fromString(template).render(ImmutableMap.of())).isEqualTo("onon offon");
  }

  @Test
  public void isSafe() {
    Library library =
        Library.builder()
            .filter("bold", value -> "<b>" + value + "</b>", Filter.Flag.IS_SAFE)
            .filter("bolder", value -> "<b>" + value + "</b>")
            .build();
    Engine engine = Engine.builder().addBuiltin(library).build();
    Template template = engine.fromString("{{ s|bold }} {{ s|safe|bold }} {{ s|safe|bolder }}");
    assertThat(template.render(ImmutableMap.of("s", "x")))
        .isEqualTo("&lt;b&gt;x&lt;/b&gt; <b>x</b> &lt;b&gt;x&lt;/b&gt;");
  }

  @Test
  public void expectsLocaltime() {
    Library library =
        Library.builder()
            .filter("zone", value -> value.getClass().getSimpleName())
            .filter(
                "localzone",
                Filter.Arity.NONE,
                (value, arg, autoescape) -> value.getClass().getSimpleName(),
                Filter.Flag.EXPECTS_LOCALTIME)
            .build();
    Engine engine = Engine.builder().addBuiltin(library).useTz(true).build();
    Template template = engine.fromString("{{ t|zone }} {{ t|localzone }}");
    assertThat(template.render(ImmutableMap.of("t", java.time.Instant.EPOCH)))
        .isEqualTo("Instant ZonedDateTime");
  }

  private static final ImmutableMap<String, String> INCLUDED =
      ImmutableMap.of(
          "_badge.html", "<span class=\"badge badge-{{ kind }}\">{{ label }}</span>",
          "_user_card.html", "<div>{{ user_name }} ({{ role }}){{ label }}</div>");

  private static Object contextValue(Context context, String name, Object defaultValue) {
    return context.contains(name) ? context.get(name) : defaultValue;
  }

  private static final Library CUSTOM =
      Library.builder()
          .simpleTag("greeting", (context, args, kwargs) -> "Hello, " + args.get(0) + "!")
          .simpleTag(
              "add_numbers",
              (context, args, kwargs) -> Values.toLong(args.get(0)) + Values.toLong(args.get(1)))
          .simpleTag(
              "current_user_greeting",
              (context, args, kwargs) ->
                  "Welcome back, " + contextValue(context, "user_name", "Anonymous"))
          .simpleTag(
              "format_price",
              (context, args, kwargs) ->
                  kwargs.getOrDefault("currency", "$")
                      + Values.toBigDecimal(args.get(0))
                          .setScale(2, RoundingMode.HALF_UP)
                          .toPlainString())
          .inclusionTag(
              "badge",
              "_badge.html",
              (context, args, kwargs) ->
                  ImmutableMap.of(
                      "label", args.get(0), "kind", kwargs.getOrDefault("kind", "info")))
          .inclusionTag(
              "user_card",
              "_user_card.html",
              (context, args, kwargs) ->
                  ImmutableMap.of(
                      "user_name", contextValue(context, "user_name", "Anonymous"),
                      "role", contextValue(context, "role", "guest")))
          .inclusionTag("broken", "missing.html", (context, args, kwargs) -> ImmutableMap.of())
          .build();

  private final Engine customEngine =
      Engine.builder()
          .resourceOpener(TemplateTest.openerFor(INCLUDED))
          .addLibrary("custom", CUSTOM)
          .build();

  private String renderCustom(String template, Object... namesAndValues) {
    ImmutableMap.Builder<String, Object> vars = ImmutableMap.builder();
    for (int i = 0; i < namesAndValues.length; i += 2) {
      vars.put((String) namesAndValues[i], namesAndValues[i + 1]);
    }
    return customEngine.fromString("{% load custom %}" + template).render(vars.build());
  }

  @Test
  public void simpleTags() {
    expect.that(renderCustom("{% greeting 'World' %}")).isEqualTo("Hello, World!");
    expect.that(renderCustom("{% add_numbers 2 3 %}")).isEqualTo("5");
    expect
        .that(renderCustom("{% current_user_greeting %}", "user_name", "Ann"))
        .isEqualTo("Welcome back, Ann");
    expect
        .that(renderCustom("{% current_user_greeting %}"))
        .isEqualTo("Welcome back, Anonymous");
    expect.that(renderCustom("{% format_price 3.5 %}")).isEqualTo("$3.50");
    expect.that(renderCustom("{% format_price p currency='EUR ' %}", "p", 2)).isEqualTo("EUR 2.00");
  }

  @Test
  public void simpleTagEscapesResult() {
    expect.that(renderCustom("{% greeting name %}", "name", "<b>")).isEqualTo("Hello, &lt;b&gt;!");
    String unescaped = "{% autoescape off %}{% greeting name %}{% endautoescape %}";
    expect.that(renderCustom(unescaped, "name", "<b>")).isEqualTo("Hello, <b>!");
  }

  @Test
  public void simpleTagAsVariable() {
    expect
        .that(renderCustom("{% greeting 'x' as g %}[{{ g|upper }}]"))
        .isEqualTo("[HELLO, X!]");
  }

  @Test
  public void simpleTagArgumentErrors() {
    ParseException e =
        assertThrows(
            ParseException.class,
            () -> renderCustom("{% format_price currency='x' 3 %}"));
    assertThat(e)
        .hasMessageThat()
        .contains(
            "'format_price' received some positional argument(s) after some keyword argument(s)");
    e =
        assertThrows(
            ParseException.class,
            () -> renderCustom("{% format_price 1 currency='a' currency='b' %}"));
    assertThat(e)
        .hasMessageThat()
        .contains("'format_price' received multiple values for keyword argument 'currency'");
  }

  @Test
  public void inclusionTags() {
    expect
        .that(renderCustom("{% badge 'New' %}"))
        .isEqualTo("<span class=\"badge badge-info\">New</span>");
    expect
        .that(renderCustom("{% badge label kind='warn' %}", "label", "<i>"))
        .isEqualTo("<span class=\"badge badge-warn\">&lt;i&gt;</span>");
    expect
        .that(renderCustom("{% user_card %}", "user_name", "Ann", "role", "admin", "label", "L"))
        .isEqualTo("<div>Ann (admin)</div>");
    expect.that(renderCustom("{% user_card %}")).isEqualTo("<div>Anonymous (guest)</div>");
  }

  @Test
  public void inclusionTagWithMissingTemplate() {
    Template template = customEngine.fromString("{% load custom %}\n{% broken %}");
    EvaluationException e =
        assertThrows(EvaluationException.class, () -> template.render(ImmutableMap.of()));
    assertThat(e).hasMessageThat().startsWith("In tag on line 2:");
    assertThat(e).hasCauseThat().isInstanceOf(FileNotFoundException.class);
  }
}
