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
import com.google.escapedjango.ExpressionNode.BinaryExpressionNode;
import com.google.escapedjango.ExpressionNode.NotExpressionNode;
import com.google.escapedjango.ExpressionNode.OperandNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses the condition of an {@code if} or {@code elif} tag into an {@link ExpressionNode}, using
 * top-down operator precedence. The condition has already been split into words by {@link
 * Token#splitContents()}. The two-word operators {@code not in} and {@code is not} are recognized
 * as single operators, and parentheses can be used for grouping.
 */
final class IfParser {
  /** The operators of {@code if} conditions, with their binding power. Higher binds tighter. */
  enum Operator {
    OR("or", 6),
    AND("and", 7),
    NOT("not", 8),
    IN("in", 9),
    NOT_IN("not in", 9),
    IS("is", 10),
    IS_NOT("is not", 10),
    EQUAL("==", 10),
    NOT_EQUAL("!=", 10),
    GREATER(">", 10),
    GREATER_OR_EQUAL(">=", 10),
    LESS("<", 10),
    LESS_OR_EQUAL("<=", 10);

    final String symbol;
    final int bindingPower;

    Operator(String symbol, int bindingPower) {
      this.symbol = symbol;
      this.bindingPower = bindingPower;
    }

    @Override
    public String toString() {
      return symbol;
    }
  }

  private static final ImmutableMap<String, Operator> OPERATORS;

  static {
    ImmutableMap.Builder<String, Operator> builder = ImmutableMap.builder();
    for (Operator operator : Operator.values()) {
      builder.put(operator.symbol, operator);
    }
    OPERATORS = builder.build();
  }

  /** One lexical element of a condition: an operator, an operand, a parenthesis, or the end. */
  private static final class Element {
    static final Element OPEN = new Element(null, null, "(");
    static final Element CLOSE = new Element(null, null, ")");
    static final Element END = new Element(null, null, "end of expression");

    final Operator operator;
    final ExpressionNode operand;
    final String display;

    Element(Operator operator, ExpressionNode operand, String display) {
      this.operator = operator;
      this.operand = operand;
      this.display = display;
    }

    int leftBindingPower() {
      // "not" is only ever a prefix operator, so it never binds to its left.
      return operator == null || operator == Operator.NOT ? 0 : operator.bindingPower;
    }
  }

  private final Parser parser;
  private final List<Element> elements;
  private int pos;

  IfParser(Parser parser, List<String> words) {
    this.parser = parser;
    this.elements = lex(parser, words);
  }

  private static List<Element> lex(Parser parser, List<String> words) {
    List<Element> elements = new ArrayList<>();
    List<String> split = splitParentheses(words);
    for (int i = 0; i < split.size(); i++) {
      String word = split.get(i);
      String next = i + 1 < split.size() ? split.get(i + 1) : null;
      if (word.equals("is") && "not".equals(next)) {
        elements.add(new Element(Operator.IS_NOT, null, "is not"));
        i++;
      } else if (word.equals("not") && "in".equals(next)) {
        elements.add(new Element(Operator.NOT_IN, null, "not in"));
        i++;
      } else if (word.equals("(")) {
        elements.add(Element.OPEN);
      } else if (word.equals(")")) {
        elements.add(Element.CLOSE);
      } else if (OPERATORS.containsKey(word)) {
        elements.add(new Element(OPERATORS.get(word), null, word));
      } else {
        elements.add(new Element(null, new OperandNode(parser.compileFilter(word)), word));
      }
    }
    elements.add(Element.END);
    return elements;
  }

  /**
   * Separates parentheses from the words they are attached to, so {@code (a or b)} becomes
   * {@code ( a or b )}. Parentheses inside quoted strings, and those of a translation marker like
   * {@code _("text")}, are left alone.
   */
  private static List<String> splitParentheses(List<String> words) {
    List<String> split = new ArrayList<>();
    for (String word : words) {
      int start = 0;
      while (start < word.length() && word.charAt(start) == '(') {
        split.add("(");
        start++;
      }
      int end = word.length();
      int closing = 0;
      while (end > start && word.charAt(end - 1) == ')' && unbalancedClose(word, start, end)) {
        end--;
        closing++;
      }
      if (end > start) {
        split.add(word.substring(start, end));
      }
      for (int i = 0; i < closing; i++) {
        split.add(")");
      }
    }
    return split;
  }

  /**
   * True if the parentheses in {@code word[start, end)} that are outside quotes include more
   * closing than opening ones.
   */
  private static boolean unbalancedClose(String word, int start, int end) {
    int depth = 0;
    char quote = 0;
    for (int i = start; i < end; i++) {
      char c = word.charAt(i);
      if (quote != 0) {
        if (c == '\\') {
          i++;
        } else if (c == quote) {
          quote = 0;
        }
      } else if (c == '"' || c == '\'') {
        quote = c;
      } else if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
      }
    }
    return depth < 0;
  }

  ExpressionNode parse() {
    ExpressionNode result = expression(0);
    Element element = current();
    if (element != Element.END) {
      throw parser.syntaxError("Unused '" + element.display + "' at end of if expression");
    }
    return result;
  }

  private Element current() {
    return elements.get(pos);
  }

  private Element advance() {
    Element element = elements.get(pos);
    if (element != Element.END) {
      pos++;
    }
    return element;
  }

  private ExpressionNode expression(int rightBindingPower) {
    ExpressionNode left = prefix(advance());
    while (rightBindingPower < current().leftBindingPower()) {
      left = infix(advance(), left);
    }
    return left;
  }

  private ExpressionNode prefix(Element element) {
    if (element.operand != null) {
      return element.operand;
    } else if (element == Element.OPEN) {
      ExpressionNode inner = expression(0);
      if (advance() != Element.CLOSE) {
        throw parser.syntaxError("Unmatched '(' in if expression");
      }
      return inner;
    } else if (element == Element.END) {
      throw parser.syntaxError("Unexpected end of expression in if tag");
    } else if (element.operator == Operator.NOT) {
      return new NotExpressionNode(expression(Operator.NOT.bindingPower));
    }
    throw parser.syntaxError("Not expecting '" + element.display + "' in this position in if tag");
  }

  private ExpressionNode infix(Element element, ExpressionNode left) {
    ExpressionNode right = expression(element.operator.bindingPower);
    return new BinaryExpressionNode(left, element.operator, right);
  }

  /** Parses the words of a condition: {@link Token#splitContents()} without the tag name. */
  static ExpressionNode parse(Parser parser, ImmutableList<String> words) {
    return new IfParser(parser, words).parse();
  }
}
