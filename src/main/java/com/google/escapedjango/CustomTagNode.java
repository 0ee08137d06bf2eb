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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node for a tag registered with {@link Library.Builder#simpleTag} or {@link
 * Library.Builder#inclusionTag}. The arguments of the tag are compiled as filter expressions:
 * positional arguments first, then {@code key=value} arguments.
 */
abstract class CustomTagNode extends Node {
  private final String tagName;
  private final ImmutableList<FilterExpression> args;
  private final ImmutableMap<String, FilterExpression> kwargs;

  CustomTagNode(
      String resourceName,
      int lineNumber,
      String tagName,
      ImmutableList<FilterExpression> args,
      ImmutableMap<String, FilterExpression> kwargs) {
    super(resourceName, lineNumber);
    this.tagName = tagName;
    this.args = args;
    this.kwargs = kwargs;
  }

  static Node simpleTag(Parser parser, Token token, Library.SimpleTag function) {
    List<String> bits = token.splitContents();
    String asVariable = null;
    if (bits.size() >= 3 && bits.get(bits.size() - 2).equals("as")) {
      asVariable = bits.get(bits.size() - 1);
      bits = bits.subList(0, bits.size() - 2);
    }
    Map<String, FilterExpression> kwargs = new LinkedHashMap<>();
    ImmutableList<FilterExpression> args = parseArguments(parser, token, bits, kwargs);
    return new SimpleTagNode(
        parser.resourceName(),
        token.lineNumber(),
        bits.get(0),
        args,
        ImmutableMap.copyOf(kwargs),
        function,
        asVariable);
  }

  static Node inclusionTag(
      Parser parser, Token token, String templateName, Library.InclusionTag function) {
    List<String> bits = token.splitContents();
    Map<String, FilterExpression> kwargs = new LinkedHashMap<>();
    ImmutableList<FilterExpression> args = parseArguments(parser, token, bits, kwargs);
    return new InclusionTagNode(
        parser.resourceName(),
        token.lineNumber(),
        bits.get(0),
        args,
        ImmutableMap.copyOf(kwargs),
        function,
        templateName);
  }

  private static ImmutableList<FilterExpression> parseArguments(
      Parser parser, Token token, List<String> bits, Map<String, FilterExpression> kwargs) {
    String name = bits.get(0);
    ImmutableList.Builder<FilterExpression> args = ImmutableList.builder();
    for (String bit : bits.subList(1, bits.size())) {
      ImmutableMap<String, FilterExpression> kwarg =
          parser.keywordArguments(new ArrayDeque<>(ImmutableList.of(bit)), false);
      if (kwarg.isEmpty()) {
        if (!kwargs.isEmpty()) {
          throw parser.syntaxError(
              token,
              "'"
                  + name
                  + "' received some positional argument(s) after some keyword argument(s)");
        }
        args.add(parser.compileFilter(bit));
      } else {
        Map.Entry<String, FilterExpression> entry = kwarg.entrySet().iterator().next();
        if (kwargs.containsKey(entry.getKey())) {
          throw parser.syntaxError(
              token,
              "'"
                  + name
                  + "' received multiple values for keyword argument '"
                  + entry.getKey()
                  + "'");
        }
        kwargs.put(entry.getKey(), entry.getValue());
      }
    }
    return args.build();
  }

  List<Object> resolveArgs(Context context) {
    List<Object> values = new ArrayList<>();
    for (FilterExpression arg : args) {
      values.add(arg.resolve(context));
    }
    return Collections.unmodifiableList(values);
  }

  Map<String, Object> resolveKwargs(Context context) {
    Map<String, Object> values = new LinkedHashMap<>();
    kwargs.forEach((name, expression) -> values.put(name, expression.resolve(context)));
    return Collections.unmodifiableMap(values);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" + tagName + " " + args + " " + kwargs + "}";
  }

  /** A tag whose function returns the value to render. */
  static final class SimpleTagNode extends CustomTagNode {
    private final Library.SimpleTag function;
    private final String asVariable;

    SimpleTagNode(
        String resourceName,
        int lineNumber,
        String tagName,
        ImmutableList<FilterExpression> args,
        ImmutableMap<String, FilterExpression> kwargs,
        Library.SimpleTag function,
        String asVariable) {
      super(resourceName, lineNumber, tagName, args, kwargs);
      this.function = function;
      this.asVariable = asVariable;
    }

    @Override
    public void render(Context context, StringBuilder output) {
      Object result = function.call(context, resolveArgs(context), resolveKwargs(context));
      if (asVariable != null) {
        context.set(asVariable, result);
      } else if (context.isAutoescape()) {
        output.append(Html.conditionalEscape(result));
      } else {
        output.append(Values.toDisplayString(result));
      }
    }
  }

  /** A tag that renders a template with the variables its function returns. */
  static final class InclusionTagNode extends CustomTagNode {
    private final Library.InclusionTag function;
    private final String templateName;

    InclusionTagNode(
        String resourceName,
        int lineNumber,
        String tagName,
        ImmutableList<FilterExpression> args,
        ImmutableMap<String, FilterExpression> kwargs,
        Library.InclusionTag function,
        String templateName) {
      super(resourceName, lineNumber, tagName, args, kwargs);
      this.function = function;
      this.templateName = templateName;
    }

    @Override
    public void render(Context context, StringBuilder output) {
      Template template;
      try {
        template = context.engine().getTemplate(templateName);
      } catch (ParseException | IOException e) {
        throw evaluationException(e);
      }
      Map<String, ?> values = function.call(context, resolveArgs(context), resolveKwargs(context));
      if (values == null) {
        values = ImmutableMap.of();
      }
      template.render(context.newContext(values), output);
    }
  }
}
