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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.google.escapedjango.DirectiveNode.AutoescapeNode;
import com.google.escapedjango.DirectiveNode.CycleNode;
import com.google.escapedjango.DirectiveNode.DebugNode;
import com.google.escapedjango.DirectiveNode.EmptyNode;
import com.google.escapedjango.DirectiveNode.FilterNode;
import com.google.escapedjango.DirectiveNode.FirstOfNode;
import com.google.escapedjango.DirectiveNode.IfChangedNode;
import com.google.escapedjango.DirectiveNode.LiteralNode;
import com.google.escapedjango.DirectiveNode.LoremNode;
import com.google.escapedjango.DirectiveNode.NowNode;
import com.google.escapedjango.DirectiveNode.PartialDefNode;
import com.google.escapedjango.DirectiveNode.PartialNode;
import com.google.escapedjango.DirectiveNode.RegroupNode;
import com.google.escapedjango.DirectiveNode.ResetCycleNode;
import com.google.escapedjango.DirectiveNode.SpacelessNode;
import com.google.escapedjango.DirectiveNode.WidthRatioNode;
import com.google.escapedjango.DirectiveNode.WithNode;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/** The built-in tags, which every template can use without loading a library. */
public final class DefaultTags {
  private static final Splitter LOOP_VARIABLE_SPLITTER =
      Splitter.on(Pattern.compile(" *, *"));

  private static final ImmutableMap<String, String> TEMPLATE_TAGS =
      ImmutableMap.<String, String>builder()
          .put("openblock", "{%")
          .put("closeblock", "%}")
          .put("openvariable", "{{")
          .put("closevariable", "}}")
          .put("openbrace", "{")
          .put("closebrace", "}")
          .put("opencomment", "{#")
          .put("closecomment", "#}")
          .build();

  // Keys for Parser.extraData().
  private static final Object BLOCK_NAMES = new Object();
  private static final Object NAMED_CYCLES = new Object();
  private static final Object LAST_CYCLE = new Object();
  private static final Object PARTIALS = new Object();

  private static final Library LIBRARY =
      Library.builder()
          .tag("autoescape", DefaultTags::autoescape)
          .tag("block", DefaultTags::block)
          .tag("comment", DefaultTags::comment)
          .tag("cycle", DefaultTags::cycle)
          .tag("debug", DefaultTags::debug)
          .tag("extends", DefaultTags::extendsTag)
          .tag("filter", DefaultTags::filter)
          .tag("firstof", DefaultTags::firstOf)
          .tag("for", DefaultTags::forTag)
          .tag("if", DefaultTags::ifTag)
          .tag("ifchanged", DefaultTags::ifChanged)
          .tag("include", DefaultTags::include)
          .tag("load", DefaultTags::load)
          .tag("lorem", DefaultTags::lorem)
          .tag("now", DefaultTags::now)
          .tag("partial", DefaultTags::partial)
          .tag("partialdef", DefaultTags::partialDef)
          .tag("regroup", DefaultTags::regroup)
          .tag("resetcycle", DefaultTags::resetCycle)
          .tag("spaceless", DefaultTags::spaceless)
          .tag("templatetag", DefaultTags::templateTag)
          .tag("verbatim", DefaultTags::verbatim)
          .tag("widthratio", DefaultTags::widthRatio)
          .tag("with", DefaultTags::with)
          .build();

  private DefaultTags() {}

  public static Library library() {
    return LIBRARY;
  }

  private static Node autoescape(Parser parser, Token token) {
    ImmutableList<String> bits = token.splitContents();
    if (bits.size() != 2) {
      throw parser.syntaxError(token, "'autoescape' tag requires exactly one argument.");
    }
    String arg = bits.get(1);
    if (!arg.equals("on") && !arg.equals("off")) {
      throw parser.syntaxError(token, "'autoescape' argument should be 'on' or 'off'");
    }
    NodeList nodeList = parser.parse("endautoescape");
    parser.deleteFirstToken();
    return new AutoescapeNode(
        parser.resourceName(), token.lineNumber(), arg.equals("on"), nodeList);
  }

  private static Node block(Parser parser, Token token) {
    ImmutableList<String> bits = token.splitContents();
    if (bits.size() != 2) {
      throw parser.syntaxError(token, "'block' tag takes only one argument");
    }
    String name = bits.get(1);
    Set<String> seen = blockNames(parser);
    if (!seen.add(name)) {
      throw parser.syntaxError(
          token, "'block' tag with name '" + name + "' appears more than once");
    }
    NodeList nodeList = parser.parse("endblock");
    Token endBlock = parser.nextToken();
    if (!endBlock.contents().equals("endblock")
        && !endBlock.contents().equals("endblock " + name)) {
      throw parser.syntaxError(
          endBlock, "Invalid block tag '" + endBlock.contents() + "', expected 'endblock'");
    }
    return new BlockNode(parser.resourceName(), token.lineNumber(), name, nodeList);
  }

  private static Node comment(Parser parser, Token token) {
    parser.skipPast("endcomment");
    return new EmptyNode(parser.resourceName(), token.lineNumber());
  }

  private static Node cycle(Parser parser, Token token) {
    List<String> args = new ArrayList<>(token.splitContents());
    if (args.size() < 2) {
      throw parser.syntaxError(token, "'cycle' tag requires at least two arguments");
    }
    Map<String, CycleNode> namedCycles = namedCycles(parser);
    if (args.size() == 2) {
      String name = args.get(1);
      CycleNode named = namedCycles.get(name);
      if (named == null) {
        throw parser.syntaxError(token, "Named cycle '" + name + "' does not exist");
      }
      return named;
    }
    boolean asForm = false;
    boolean silent = false;
    if (args.size() > 4) {
      if (args.get(args.size() - 3).equals("as")) {
        String flag = args.get(args.size() - 1);
        if (!flag.equals("silent")) {
          throw parser.syntaxError(
              token, "Only 'silent' flag is allowed after cycle's name, not '" + flag + "'.");
        }
        asForm = true;
        silent = true;
        args.remove(args.size() - 1);
      } else if (args.get(args.size() - 2).equals("as")) {
        asForm = true;
      }
    }
    CycleNode node;
    if (asForm) {
      String name = args.get(args.size() - 1);
      node =
          new CycleNode(
              parser.resourceName(),
              token.lineNumber(),
              compileAll(parser, args.subList(1, args.size() - 2)),
              name,
              silent);
      namedCycles.put(name, node);
    } else {
      node =
          new CycleNode(
              parser.resourceName(),
              token.lineNumber(),
              compileAll(parser, args.subList(1, args.size())),
              null,
              false);
    }
    parser.extraData().put(LAST_CYCLE, node);
    return node;
  }

  private static Node debug(Parser parser, Token token) {
    return new DebugNode(parser.resourceName(), token.lineNumber());
  }

  private static Node extendsTag(Parser parser, Token token) {
    ImmutableList<String> bits = token.splitContents();
    if (bits.size() != 2) {
      throw parser.syntaxError(token, "'extends' takes one argument");
    }
    FilterExpression parentName = parser.compileFilter(bits.get(1));
    NodeList nodeList = parser.parse();
    if (!nodeList.getNodesByType(ExtendsNode.class).isEmpty()) {
      throw parser.syntaxError(
          token, "'extends' cannot appear more than once in the same template");
    }
    return new ExtendsNode(parser.resourceName(), token.lineNumber(), parentName, nodeList);
  }

  private static Node filter(Parser parser, Token token) {
    String contents = token.contents();
    int space = contents.indexOf(' ');
    if (space < 0) {
      throw parser.syntaxError(token, "'filter' tag requires a filter");
    }
    FilterExpression expression =
        parser.compileFilter("var|" + contents.substring(space + 1).trim());
    for (String forbidden : ImmutableList.of("escape", "safe")) {
      if (expression.usesFilter(forbidden)) {
        throw parser.syntaxError(
            token,
            "'filter " + forbidden + "' is not permitted. Use the 'autoescape' tag instead.");
      }
    }
    NodeList nodeList = parser.parse("endfilter");
    parser.deleteFirstToken();
    return new FilterNode(parser.resourceName(), token.lineNumber(), expression, nodeList);
  }

  private static Node firstOf(Parser parser, Token token) {
    List<String> bits = token.splitContents().subList(1, token.splitContents().size());
    if (bits.isEmpty()) {
      throw parser.syntaxError(token, "'firstof' statement requires at least one argument");
    }
    String asVariable = null;
    if (bits.size() >= 2 && bits.get(bits.size() - 2).equals("as")) {
      asVariable = bits.get(bits.size() - 1);
      bits = bits.subList(0, bits.size() - 2);
    }
    return new FirstOfNode(
        parser.resourceName(), token.lineNumber(), compileAll(parser, bits), asVariable);
  }

  private static Node forTag(Parser parser, Token token) {
    ImmutableList<String> bits = token.splitContents();
    if (bits.size() < 4) {
      throw parser.syntaxError(
          token, "'for' statements should have at least four words: " + token.contents());
    }
    boolean reversed = Iterables.getLast(bits).equals("reversed");
    int inIndex = bits.size() - (reversed ? 3 : 2);
    if (!bits.get(inIndex).equals("in")) {
      throw parser.syntaxError(
          token, "'for' statements should use the format 'for x in y': " + token.contents());
    }
    ImmutableList<String> loopVariables =
        ImmutableList.copyOf(
            LOOP_VARIABLE_SPLITTER.split(Joiner.on(' ').join(bits.subList(1, inIndex))));
    for (String variable : loopVariables) {
      if (variable.isEmpty() || variable.matches(".*[ \"'|].*")) {
        throw parser.syntaxError(
            token, "'for' tag received an invalid argument: " + token.contents());
      }
    }
    FilterExpression sequence = parser.compileFilter(bits.get(inIndex + 1));
    NodeList body = parser.parse("empty", "endfor");
    Token next = parser.nextToken();
    NodeList empty = NodeList.EMPTY;
    if (next.contents().equals("empty")) {
      empty = parser.parse("endfor");
      parser.deleteFirstToken();
    }
    return new ForNode(
        parser.resourceName(), token.lineNumber(), loopVariables, sequence, reversed, body, empty);
  }

  private static Node ifTag(Parser parser, Token token) {
    ImmutableList.Builder<IfNode.Branch> branches = ImmutableList.builder();
    ExpressionNode condition = IfParser.parse(parser, tail(token.splitContents()));
    NodeList nodeList = parser.parse("elif", "else", "endif");
    branches.add(new IfNode.Branch(condition, nodeList));
    Token next = parser.nextToken();
    while (next.command().equals("elif")) {
      condition = IfParser.parse(parser, tail(next.splitContents()));
      nodeList = parser.parse("elif", "else", "endif");
      branches.add(new IfNode.Branch(condition, nodeList));
      next = parser.nextToken();
    }
    if (next.contents().equals("else")) {
      nodeList = parser.parse("endif");
      branches.add(new IfNode.Branch(null, nodeList));
      next = parser.nextToken();
    }
    if (!next.contents().equals("endif")) {
      throw parser.syntaxError(
          next, "Malformed template tag '" + next.contents() + "', expected 'endif'");
    }
    return new IfNode(parser.resourceName(), token.lineNumber(), branches.build());
  }

  private static Node ifChanged(Parser parser, Token token) {
    ImmutableList<String> bits = token.splitContents();
    NodeList nodeListTrue = parser.parse("else", "endifchanged");
    Token next = parser.nextToken();
    NodeList nodeListFalse = NodeList.EMPTY;
    if (next.contents().equals("else")) {
      nodeListFalse = parser.parse("endifchanged");
      parser.deleteFirstToken();
    }
    return new IfChangedNode(
        parser.resourceName(),
        token.lineNumber(),
        nodeListTrue,
        nodeListFalse,
        compileAll(parser, tail(bits)));
  }

  private static Node include(Parser parser, Token token) {
    ImmutableList<String> bits = token.splitContents();
    if (bits.size() < 2) {
      throw parser.syntaxError(
          token,
          "'include' tag takes at least one argument: the name of the template to be included.");
    }
    Deque<String> remaining = new ArrayDeque<>(bits.subList(2, bits.size()));
    Set<String> options = new HashSet<>();
    ImmutableMap<String, FilterExpression> extraContext = ImmutableMap.of();
    while (!remaining.isEmpty()) {
      String option = remaining.removeFirst();
      if (!options.add(option)) {
        throw parser.syntaxError(
            token, "The '" + option + "' option was specified more than once.");
      }
      if (option.equals("with")) {
        extraContext = parser.keywordArguments(remaining, false);
        if (extraContext.isEmpty()) {
          throw parser.syntaxError(
              token, "\"with\" in 'include' tag needs at least one keyword argument.");
        }
      } else if (!option.equals("only")) {
        throw parser.syntaxError(token, "Unknown argument for 'include' tag: '" + option + "'.");
      }
    }
    return new IncludeNode(
        parser.resourceName(),
        token.lineNumber(),
        parser.compileFilter(bits.get(1)),
        extraContext,
        options.contains("only"));
  }

  private static Node load(Parser parser, Token token) {
    List<String> bits = Splitter.on(' ').omitEmptyStrings().splitToList(token.contents());
    if (bits.size() >= 4 && bits.get(bits.size() - 2).equals("from")) {
      String name = bits.get(bits.size() - 1);
      Library library = findLibrary(parser, token, name);
      List<String> names = bits.subList(1, bits.size() - 2);
      Library.Builder subset = Library.builder();
      for (String item : names) {
        try {
          subset.addNamed(library, ImmutableList.of(item));
        } catch (IllegalArgumentException e) {
          throw parser.syntaxError(
              token,
              "'" + item + "' is not a valid tag or filter in tag library '" + name + "'");
        }
      }
      parser.addLibrary(subset.build());
    } else {
      for (String name : tail(bits)) {
        parser.addLibrary(findLibrary(parser, token, name));
      }
    }
    return new EmptyNode(parser.resourceName(), token.lineNumber());
  }

  private static Library findLibrary(Parser parser, Token token, String name) {
    Library library = parser.engine().library(name);
    if (library == null) {
      throw parser.syntaxError(
          token,
          "'"
              + name
              + "' is not a registered tag library. Must be one of: "
              + Joiner.on(", ").join(parser.engine().libraries().keySet()));
    }
    return library;
  }

  private static Node lorem(Parser parser, Token token) {
    List<String> bits = new ArrayList<>(token.splitContents());
    boolean common = !Iterables.getLast(bits).equals("random");
    if (!common) {
      bits.remove(bits.size() - 1);
    }
    String method = "b";
    if (ImmutableList.of("w", "p", "b").contains(Iterables.getLast(bits))) {
      method = bits.remove(bits.size() - 1);
    }
    String count = bits.size() > 1 ? bits.remove(bits.size() - 1) : "1";
    if (bits.size() != 1) {
      throw parser.syntaxError(token, "Incorrect format for 'lorem' tag");
    }
    return new LoremNode(
        parser.resourceName(), token.lineNumber(), parser.compileFilter(count), method, common);
  }

  private static Node now(Parser parser, Token token) {
    List<String> bits = token.splitContents();
    String asVariable = null;
    if (bits.size() == 4 && bits.get(2).equals("as")) {
      asVariable = bits.get(3);
      bits = bits.subList(0, 2);
    }
    if (bits.size() != 2 || !isQuoted(bits.get(1))) {
      throw parser.syntaxError(token, "'now' statement takes one argument");
    }
    String pattern = bits.get(1).substring(1, bits.get(1).length() - 1);
    DateTimeFormatter formatter;
    try {
      formatter = DateTimeFormatter.ofPattern(pattern, Locale.US);
    } catch (IllegalArgumentException e) {
      throw parser.syntaxError(token, "Invalid 'now' format '" + pattern + "': " + e.getMessage());
    }
    return new NowNode(parser.resourceName(), token.lineNumber(), formatter, asVariable);
  }

  private static boolean isQuoted(String bit) {
    return bit.length() >= 2
        && (bit.charAt(0) == '"' || bit.charAt(0) == '\'')
        && bit.charAt(bit.length() - 1) == bit.charAt(0);
  }

  private static Node partial(Parser parser, Token token) {
    ImmutableList<String> bits = token.splitContents();
    if (bits.size() != 2) {
      throw parser.syntaxError(token, "'partial' tag requires a single argument");
    }
    return new PartialNode(
        parser.resourceName(), token.lineNumber(), bits.get(1), partials(parser));
  }

  private static Node partialDef(Parser parser, Token token) {
    ImmutableList<String> bits = token.splitContents();
    boolean inline = false;
    if (bits.size() == 3) {
      if (!bits.get(2).equals("inline")) {
        throw parser.syntaxError(
            token,
            "The 'inline' argument does not have any parameters; either use 'inline' or remove"
                + " it completely.");
      }
      inline = true;
    } else if (bits.size() == 1) {
      throw parser.syntaxError(token, "'partialdef' tag requires a name");
    } else if (bits.size() != 2) {
      throw parser.syntaxError(token, "'partialdef' tag takes at most 2 arguments");
    }
    String name = bits.get(1);
    NodeList nodeList = parser.parse("endpartialdef");
    Token end = parser.nextToken();
    if (!end.contents().equals("endpartialdef")
        && !end.contents().equals("endpartialdef " + name)) {
      throw parser.syntaxError(
          end, "Invalid block tag '" + end.contents() + "', expected 'endpartialdef'");
    }
    Map<String, PartialDefNode> partials = partials(parser);
    if (partials.containsKey(name)) {
      throw parser.syntaxError(
          token,
          "Partial '"
              + name
              + "' is already defined in the '"
              + (parser.resourceName() == null ? "<string>" : parser.resourceName())
              + "' template.");
    }
    PartialDefNode node =
        new PartialDefNode(parser.resourceName(), token.lineNumber(), inline, nodeList);
    partials.put(name, node);
    return node;
  }

  private static Node regroup(Parser parser, Token token) {
    ImmutableList<String> bits = token.splitContents();
    if (bits.size() != 6) {
      throw parser.syntaxError(token, "'regroup' tag takes five arguments");
    }
    FilterExpression target = parser.compileFilter(bits.get(1));
    if (!bits.get(2).equals("by")) {
      throw parser.syntaxError(token, "second argument to 'regroup' tag must be 'by'");
    }
    if (!bits.get(4).equals("as")) {
      throw parser.syntaxError(token, "next-to-last argument to 'regroup' tag must be 'as'");
    }
    String variableName = bits.get(5);
    FilterExpression expression = parser.compileFilter(variableName + "." + bits.get(3));
    return new RegroupNode(
        parser.resourceName(), token.lineNumber(), target, expression, variableName);
  }

  private static Node resetCycle(Parser parser, Token token) {
    ImmutableList<String> bits = token.splitContents();
    if (bits.size() > 2) {
      throw parser.syntaxError(token, "'resetcycle' tag accepts at most one argument.");
    }
    CycleNode cycle;
    if (bits.size() == 2) {
      Map<String, CycleNode> namedCycles = namedCycles(parser);
      cycle = namedCycles.get(bits.get(1));
      if (cycle == null) {
        throw parser.syntaxError(token, "Named cycle '" + bits.get(1) + "' does not exist.");
      }
    } else {
      cycle = (CycleNode) parser.extraData().get(LAST_CYCLE);
      if (cycle == null) {
        throw parser.syntaxError(token, "No cycles in template.");
      }
    }
    return new ResetCycleNode(parser.resourceName(), token.lineNumber(), cycle);
  }

  private static Node spaceless(Parser parser, Token token) {
    NodeList nodeList = parser.parse("endspaceless");
    parser.deleteFirstToken();
    return new SpacelessNode(parser.resourceName(), token.lineNumber(), nodeList);
  }

  private static Node templateTag(Parser parser, Token token) {
    ImmutableList<String> bits = token.splitContents();
    if (bits.size() != 2) {
      throw parser.syntaxError(token, "'templatetag' statement takes one argument");
    }
    String text = TEMPLATE_TAGS.get(bits.get(1));
    if (text == null) {
      throw parser.syntaxError(
          token,
          "Invalid templatetag argument: '"
              + bits.get(1)
              + "'. Must be one of: "
              + Joiner.on(", ").join(TEMPLATE_TAGS.keySet()));
    }
    return new LiteralNode(parser.resourceName(), token.lineNumber(), text);
  }

  private static Node verbatim(Parser parser, Token token) {
    NodeList nodeList = parser.parse("endverbatim");
    parser.deleteFirstToken();
    // The lexer turns everything up to the end tag into text, so the list is all text.
    return new LiteralNode(parser.resourceName(), token.lineNumber(), nodeList.text());
  }

  private static Node widthRatio(Parser parser, Token token) {
    ImmutableList<String> bits = token.splitContents();
    String asVariable = null;
    if (bits.size() == 6) {
      if (!bits.get(4).equals("as")) {
        throw parser.syntaxError(
            token, "Invalid syntax in widthratio tag. Expecting 'as' keyword");
      }
      asVariable = bits.get(5);
    } else if (bits.size() != 4) {
      throw parser.syntaxError(token, "widthratio takes at least three arguments");
    }
    return new WidthRatioNode(
        parser.resourceName(),
        token.lineNumber(),
        parser.compileFilter(bits.get(1)),
        parser.compileFilter(bits.get(2)),
        parser.compileFilter(bits.get(3)),
        asVariable);
  }

  private static Node with(Parser parser, Token token) {
    Deque<String> remaining = new ArrayDeque<>(tail(token.splitContents()));
    ImmutableMap<String, FilterExpression> extraContext = parser.keywordArguments(remaining, true);
    if (extraContext.isEmpty()) {
      throw parser.syntaxError(token, "'with' expected at least one variable assignment");
    }
    if (!remaining.isEmpty()) {
      throw parser.syntaxError(
          token, "'with' received an invalid token: '" + remaining.peekFirst() + "'");
    }
    NodeList nodeList = parser.parse("endwith");
    parser.deleteFirstToken();
    return new WithNode(parser.resourceName(), token.lineNumber(), extraContext, nodeList);
  }

  private static ImmutableList<FilterExpression> compileAll(Parser parser, List<String> bits) {
    ImmutableList.Builder<FilterExpression> expressions = ImmutableList.builder();
    for (String bit : bits) {
      expressions.add(parser.compileFilter(bit));
    }
    return expressions.build();
  }

  private static ImmutableList<String> tail(List<String> bits) {
    return ImmutableList.copyOf(bits.subList(1, bits.size()));
  }

  @SuppressWarnings("unchecked")
  private static Set<String> blockNames(Parser parser) {
    return (Set<String>) parser.extraData().computeIfAbsent(BLOCK_NAMES, k -> new HashSet<>());
  }

  @SuppressWarnings("unchecked")
  private static Map<String, PartialDefNode> partials(Parser parser) {
    return (Map<String, PartialDefNode>)
        parser.extraData().computeIfAbsent(PARTIALS, k -> new HashMap<>());
  }

  @SuppressWarnings("unchecked")
  private static Map<String, CycleNode> namedCycles(Parser parser) {
    return (Map<String, CycleNode>)
        parser.extraData().computeIfAbsent(NAMED_CYCLES, k -> new HashMap<>());
  }
}
