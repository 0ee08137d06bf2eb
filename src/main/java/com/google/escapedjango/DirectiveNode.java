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
import java.math.BigDecimal;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A node in the parse tree that is one of the simpler built-in block tags, such as <code>
 * {% with %}</code> or <code>{% cycle %}</code>. The tags that control flow, {@code if}, {@code
 * for}, {@code include}, {@code extends} and {@code block}, have their own classes.
 */
abstract class DirectiveNode extends Node {
  DirectiveNode(String resourceName, int lineNumber) {
    super(resourceName, lineNumber);
  }

  /**
   * A node representing <code>{% with name=value %}...{% endwith %}</code>. The names are defined
   * in a new scope for the body only.
   */
  static final class WithNode extends DirectiveNode {
    private final ImmutableMap<String, FilterExpression> extraContext;
    private final NodeList nodeList;

    WithNode(
        String resourceName,
        int lineNumber,
        ImmutableMap<String, FilterExpression> extraContext,
        NodeList nodeList) {
      super(resourceName, lineNumber);
      this.extraContext = extraContext;
      this.nodeList = nodeList;
    }

    @Override
    public void render(Context context, StringBuilder output) {
      Map<String, Object> values = new LinkedHashMap<>();
      extraContext.forEach((name, expression) -> values.put(name, expression.resolve(context)));
      try (Context.Scope scope = context.push(values)) {
        nodeList.render(context, output);
      }
    }

    @Override
    public ImmutableList<NodeList> childNodeLists() {
      return ImmutableList.of(nodeList);
    }
  }

  /** A node representing <code>{% autoescape on|off %}...{% endautoescape %}</code>. */
  static final class AutoescapeNode extends DirectiveNode {
    private final boolean setting;
    private final NodeList nodeList;

    AutoescapeNode(String resourceName, int lineNumber, boolean setting, NodeList nodeList) {
      super(resourceName, lineNumber);
      this.setting = setting;
      this.nodeList = nodeList;
    }

    @Override
    public void render(Context context, StringBuilder output) {
      boolean old = context.isAutoescape();
      context.setAutoescape(setting);
      try {
        nodeList.render(context, output);
      } finally {
        context.setAutoescape(old);
      }
    }

    @Override
    public ImmutableList<NodeList> childNodeLists() {
      return ImmutableList.of(nodeList);
    }
  }

  /**
   * A node that renders nothing, for <code>{% comment %}...{% endcomment %}</code> and for
   * <code>{% load %}</code>, whose work is done at compile time.
   */
  static final class EmptyNode extends DirectiveNode {
    EmptyNode(String resourceName, int lineNumber) {
      super(resourceName, lineNumber);
    }

    @Override
    public void render(Context context, StringBuilder output) {}
  }

  /**
   * A node representing <code>{% cycle a b c %}</code>, which renders the next of its values each
   * time it is rendered. The position in the cycle is kept in the {@link RenderContext}, so it
   * starts over for each render of the template.
   */
  static final class CycleNode extends DirectiveNode {
    private final ImmutableList<FilterExpression> values;
    private final String variableName;
    private final boolean silent;

    CycleNode(
        String resourceName,
        int lineNumber,
        ImmutableList<FilterExpression> values,
        String variableName,
        boolean silent) {
      super(resourceName, lineNumber);
      this.values = values;
      this.variableName = variableName;
      this.silent = silent;
    }

    @Override
    public void render(Context context, StringBuilder output) {
      Integer index = (Integer) context.renderContext().get(this);
      int current = index == null ? 0 : index;
      context.renderContext().put(this, (current + 1) % values.size());
      Object value = values.get(current).resolve(context);
      if (variableName != null) {
        context.setUpward(variableName, value);
      }
      if (!silent) {
        VariableNode.renderValue(value, context, output);
      }
    }

    void reset(Context context) {
      context.renderContext().put(this, 0);
    }
  }

  /** A node representing <code>{% resetcycle %}</code>. */
  static final class ResetCycleNode extends DirectiveNode {
    private final CycleNode cycle;

    ResetCycleNode(String resourceName, int lineNumber, CycleNode cycle) {
      super(resourceName, lineNumber);
      this.cycle = cycle;
    }

    @Override
    public void render(Context context, StringBuilder output) {
      cycle.reset(context);
    }
  }

  /**
   * A node representing <code>{% filter upper|cut:" " %}...{% endfilter %}</code>, which renders
   * its body and passes the result through the filters.
   */
  static final class FilterNode extends DirectiveNode {
    private final FilterExpression expression;
    private final NodeList nodeList;

    FilterNode(
        String resourceName, int lineNumber, FilterExpression expression, NodeList nodeList) {
      super(resourceName, lineNumber);
      this.expression = expression;
      this.nodeList = nodeList;
    }

    @Override
    public void render(Context context, StringBuilder output) {
      SafeString body = SafeString.of(nodeList.render(context));
      try (Context.Scope scope = context.push(ImmutableMap.of("var", body))) {
        output.append(Values.toDisplayString(expression.resolve(context)));
      }
    }

    @Override
    public ImmutableList<NodeList> childNodeLists() {
      return ImmutableList.of(nodeList);
    }
  }

  /** A node representing <code>{% firstof a b "default" %}</code>. */
  static final class FirstOfNode extends DirectiveNode {
    private final ImmutableList<FilterExpression> candidates;
    private final String asVariable;

    FirstOfNode(
        String resourceName,
        int lineNumber,
        ImmutableList<FilterExpression> candidates,
        String asVariable) {
      super(resourceName, lineNumber);
      this.candidates = candidates;
      this.asVariable = asVariable;
    }

    @Override
    public void render(Context context, StringBuilder output) {
      StringBuilder first = new StringBuilder();
      for (FilterExpression candidate : candidates) {
        Object value = candidate.resolve(context, true);
        if (Truthiness.isTrue(value)) {
          VariableNode.renderValue(value, context, first);
          break;
        }
      }
      if (asVariable != null) {
        context.set(asVariable, SafeString.of(first));
      } else {
        output.append(first);
      }
    }
  }

  /**
   * A node representing <code>{% ifchanged %}...{% else %}...{% endifchanged %}</code>. Inside a
   * loop, the last value seen is kept in the {@link LoopState} of the innermost loop, so it resets
   * each time an outer loop moves on.
   */
  static final class IfChangedNode extends DirectiveNode {
    private final NodeList nodeListTrue;
    private final NodeList nodeListFalse;
    private final ImmutableList<FilterExpression> watched;

    IfChangedNode(
        String resourceName,
        int lineNumber,
        NodeList nodeListTrue,
        NodeList nodeListFalse,
        ImmutableList<FilterExpression> watched) {
      super(resourceName, lineNumber);
      this.nodeListTrue = nodeListTrue;
      this.nodeListFalse = nodeListFalse;
      this.watched = watched;
    }

    @Override
    public void render(Context context, StringBuilder output) {
      String renderedTrue = null;
      Object compareTo;
      if (watched.isEmpty()) {
        compareTo = renderedTrue = nodeListTrue.render(context);
      } else {
        List<Object> values = new ArrayList<>();
        for (FilterExpression expression : watched) {
          values.add(expression.resolve(context, true));
        }
        compareTo = values;
      }
      Object loop = context.get("forloop");
      Object previous;
      if (loop instanceof LoopState) {
        previous = ((LoopState) loop).annotation(this);
      } else {
        previous = context.renderContext().get(this);
      }
      if (!Objects.equals(compareTo, previous)) {
        if (loop instanceof LoopState) {
          ((LoopState) loop).annotate(this, compareTo);
        } else {
          context.renderContext().put(this, compareTo);
        }
        if (renderedTrue != null) {
          output.append(renderedTrue);
        } else {
          nodeListTrue.render(context, output);
        }
      } else {
        nodeListFalse.render(context, output);
      }
    }

    @Override
    public ImmutableList<NodeList> childNodeLists() {
      return ImmutableList.of(nodeListTrue, nodeListFalse);
    }
  }

  /**
   * A node representing <code>{% spaceless %}...{% endspaceless %}</code>, which removes
   * whitespace between HTML tags in its output.
   */
  static final class SpacelessNode extends DirectiveNode {
    private static final Pattern SPACE_BETWEEN_TAGS = Pattern.compile(">\\s+<");

    private final NodeList nodeList;

    SpacelessNode(String resourceName, int lineNumber, NodeList nodeList) {
      super(resourceName, lineNumber);
      this.nodeList = nodeList;
    }

    @Override
    public void render(Context context, StringBuilder output) {
      String rendered = nodeList.render(context).strip();
      output.append(SPACE_BETWEEN_TAGS.matcher(rendered).replaceAll("><"));
    }

    @Override
    public ImmutableList<NodeList> childNodeLists() {
      return ImmutableList.of(nodeList);
    }
  }

  /**
   * A node that renders fixed text, for <code>{% templatetag openblock %}</code> and for the
   * contents of <code>{% verbatim %}...{% endverbatim %}</code>.
   */
  static final class LiteralNode extends DirectiveNode {
    private final String text;

    LiteralNode(String resourceName, int lineNumber, String text) {
      super(resourceName, lineNumber);
      this.text = text;
    }

    @Override
    public void render(Context context, StringBuilder output) {
      output.append(text);
    }
  }

  /**
   * A node representing <code>{% widthratio value max width %}</code>, which renders {@code
   * value / max * width} rounded to the nearest integer, for example to size a bar in a chart.
   */
  static final class WidthRatioNode extends DirectiveNode {
    private final FilterExpression value;
    private final FilterExpression max;
    private final FilterExpression maxWidth;
    private final String asVariable;

    WidthRatioNode(
        String resourceName,
        int lineNumber,
        FilterExpression value,
        FilterExpression max,
        FilterExpression maxWidth,
        String asVariable) {
      super(resourceName, lineNumber);
      this.value = value;
      this.max = max;
      this.maxWidth = maxWidth;
      this.asVariable = asVariable;
    }

    @Override
    public void render(Context context, StringBuilder output) {
      Object maxValue = max.resolve(context);
      Long width = Values.toLong(maxWidth.resolve(context));
      if (width == null) {
        throw evaluationException("widthratio final argument must be a number");
      }
      String result = ratio(value.resolve(context), maxValue, width);
      if (asVariable != null) {
        context.set(asVariable, result);
      } else {
        output.append(result);
      }
    }

    private static String ratio(Object value, Object maxValue, long width) {
      BigDecimal numerator = Values.toBigDecimal(value);
      BigDecimal denominator = Values.toBigDecimal(maxValue);
      if (numerator == null || denominator == null) {
        return "";
      }
      if (denominator.signum() == 0) {
        return "0";
      }
      double ratio = numerator.doubleValue() / denominator.doubleValue() * width;
      if (Double.isNaN(ratio) || Double.isInfinite(ratio)) {
        return "";
      }
      return Long.toString((long) Math.rint(ratio));
    }
  }

  /**
   * A node representing <code>{% regroup people by gender as groups %}</code>, which sets {@code
   * groups} to a list of {@link GroupedResult}, one for each run of consecutive items with the
   * same value of the grouping expression.
   */
  static final class RegroupNode extends DirectiveNode {
    private final FilterExpression target;
    private final FilterExpression expression;
    private final String variableName;

    RegroupNode(
        String resourceName,
        int lineNumber,
        FilterExpression target,
        FilterExpression expression,
        String variableName) {
      super(resourceName, lineNumber);
      this.target = target;
      this.expression = expression;
      this.variableName = variableName;
    }

    @Override
    public void render(Context context, StringBuilder output) {
      Object items = target.resolve(context, true);
      List<GroupedResult> groups = new ArrayList<>();
      if (items != null) {
        List<?> list;
        try {
          list = Values.toList(items);
        } catch (IllegalArgumentException e) {
          throw evaluationException(e.getMessage());
        }
        Object grouper = null;
        List<Object> group = null;
        for (Object item : list) {
          // The expression is compiled as "variableName.attribute", so it reads the item from here.
          context.set(variableName, item);
          Object key = expression.resolve(context, true);
          if (group == null || !Values.equal(key, grouper)) {
            if (group != null) {
              groups.add(new GroupedResult(grouper, group));
            }
            grouper = key;
            group = new ArrayList<>();
          }
          group.add(item);
        }
        if (group != null) {
          groups.add(new GroupedResult(grouper, group));
        }
      }
      context.set(variableName, groups);
    }
  }

  /**
   * A node representing <code>{% now "pattern" %}</code>, which renders the current date and time
   * with a {@link DateTimeFormatter} pattern, or stores it in a variable with <code>
   * {% now "pattern" as name %}</code>.
   */
  static final class NowNode extends DirectiveNode {
    private final DateTimeFormatter formatter;
    private final String asVariable;

    NowNode(
        String resourceName, int lineNumber, DateTimeFormatter formatter, String asVariable) {
      super(resourceName, lineNumber);
      this.formatter = formatter;
      this.asVariable = asVariable;
    }

    @Override
    public void render(Context context, StringBuilder output) {
      ZonedDateTime now = ZonedDateTime.now(context.engine().clock());
      if (context.isUseTz()) {
        now = now.withZoneSameInstant(context.timeZone());
      }
      String formatted = formatter.format(now);
      if (asVariable != null) {
        context.set(asVariable, formatted);
      } else {
        output.append(formatted);
      }
    }
  }

  /**
   * A node representing <code>{% lorem [count] [w|p|b] [random] %}</code>, which renders
   * placeholder Latin text.
   */
  static final class LoremNode extends DirectiveNode {
    private final FilterExpression count;
    private final String method;
    private final boolean common;

    LoremNode(
        String resourceName,
        int lineNumber,
        FilterExpression count,
        String method,
        boolean common) {
      super(resourceName, lineNumber);
      this.count = count;
      this.method = method;
      this.common = common;
    }

    @Override
    public void render(Context context, StringBuilder output) {
      Long n = Values.toLong(count.resolve(context));
      int repeat = n == null ? 1 : (int) Math.max(Math.min(n, Integer.MAX_VALUE), 0);
      if (method.equals("w")) {
        output.append(LoremIpsum.words(repeat, common));
        return;
      }
      List<String> paragraphs = LoremIpsum.paragraphs(repeat, common);
      if (method.equals("p")) {
        paragraphs.replaceAll(paragraph -> "<p>" + paragraph + "</p>");
      }
      output.append(String.join("\n\n", paragraphs));
    }
  }

  /**
   * A node representing <code>{% debug %}</code>, which renders the variables of every scope,
   * innermost first, if the engine is in debug mode, and nothing otherwise.
   */
  static final class DebugNode extends DirectiveNode {
    DebugNode(String resourceName, int lineNumber) {
      super(resourceName, lineNumber);
    }

    @Override
    public void render(Context context, StringBuilder output) {
      if (!context.engine().isDebug()) {
        return;
      }
      List<String> scopes = new ArrayList<>();
      for (Map<String, Object> scope : context.scopesInnermostFirst()) {
        scopes.add(Html.escape(scope.toString()).toString());
      }
      output.append(String.join("\n", scopes));
    }
  }

  /**
   * A node representing <code>{% partialdef name [inline] %}...{% endpartialdef %}</code>. The
   * body is rendered here only if the tag says {@code inline}; otherwise it is rendered wherever
   * <code>{% partial name %}</code> appears.
   */
  static final class PartialDefNode extends DirectiveNode {
    private final boolean inline;
    private final NodeList nodeList;

    PartialDefNode(String resourceName, int lineNumber, boolean inline, NodeList nodeList) {
      super(resourceName, lineNumber);
      this.inline = inline;
      this.nodeList = nodeList;
    }

    NodeList nodeList() {
      return nodeList;
    }

    @Override
    public void render(Context context, StringBuilder output) {
      if (inline) {
        nodeList.render(context, output);
      }
    }

    @Override
    public ImmutableList<NodeList> childNodeLists() {
      return ImmutableList.of(nodeList);
    }
  }

  /**
   * A node representing <code>{% partial name %}</code>. The partial can be defined anywhere in
   * the same template, so it is looked up when the tag is rendered.
   */
  static final class PartialNode extends DirectiveNode {
    private final String name;
    private final Map<String, PartialDefNode> partials;

    PartialNode(
        String resourceName, int lineNumber, String name, Map<String, PartialDefNode> partials) {
      super(resourceName, lineNumber);
      this.name = name;
      this.partials = partials;
    }

    @Override
    public void render(Context context, StringBuilder output) {
      PartialDefNode partial = partials.get(name);
      if (partial == null) {
        throw evaluationException(
            "Partial '" + name + "' is not defined in the current template.");
      }
      partial.nodeList().render(context, output);
    }
  }
}
