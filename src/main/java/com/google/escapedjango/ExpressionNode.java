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

import com.google.escapedjango.IfParser.Operator;

/**
 * A node in the tree representing the condition of an {@code if} or {@code elif} tag. For
 * example, in <code>{% if not user.is_staff and count &gt; 3 %}</code>, the condition is parsed
 * into a tree that we might describe as<pre>
 * {@link BinaryExpressionNode}(
 *     {@link NotExpressionNode}({@link OperandNode}("user.is_staff")),
 *     {@link Operator#AND},
 *     {@link BinaryExpressionNode}(
 *         {@link OperandNode}("count"),
 *         {@link Operator#GREATER},
 *         {@link OperandNode}("3")))
 * </pre>
 */
abstract class ExpressionNode {
  /**
   * Returns the source form of this node. This may not be exactly how it appears in the template,
   * since parentheses are only shown where they are needed.
   *
   * <p>This method is used in error messages and tests. It is not invoked in normal evaluation.
   */
  @Override
  public abstract String toString();

  /**
   * Returns the result of evaluating this node. The {@code and} and {@code or} operators return
   * one of their operands, as in Python, rather than a boolean.
   */
  abstract Object evaluate(Context context);

  /** True if the value of this expression counts as true, according to {@link Truthiness}. */
  boolean isTrue(Context context) {
    return Truthiness.isTrue(evaluate(context));
  }

  /**
   * An operand, which is a {@link FilterExpression}. A variable that cannot be resolved has the
   * value null here, rather than the invalid-value string.
   */
  static final class OperandNode extends ExpressionNode {
    private final FilterExpression expression;

    OperandNode(FilterExpression expression) {
      this.expression = expression;
    }

    @Override
    public String toString() {
      return expression.toString();
    }

    @Override
    Object evaluate(Context context) {
      return expression.resolve(context, true);
    }
  }

  /** Represents all binary expressions, for example {@code a in b} or {@code x >= 3}. */
  static final class BinaryExpressionNode extends ExpressionNode {
    final ExpressionNode lhs;
    final Operator op;
    final ExpressionNode rhs;

    BinaryExpressionNode(ExpressionNode lhs, Operator op, ExpressionNode rhs) {
      this.lhs = lhs;
      this.op = op;
      this.rhs = rhs;
    }

    @Override
    public String toString() {
      return "(" + lhs + " " + op + " " + rhs + ")";
    }

    @Override
    Object evaluate(Context context) {
      switch (op) {
        case OR:
          {
            Object left = lhs.evaluate(context);
            return Truthiness.isTrue(left) ? left : rhs.evaluate(context);
          }
        case AND:
          {
            Object left = lhs.evaluate(context);
            return Truthiness.isTrue(left) ? rhs.evaluate(context) : left;
          }
        default: // fall out
      }
      Object left = lhs.evaluate(context);
      Object right = rhs.evaluate(context);
      try {
        switch (op) {
          case IN:
            return Values.contains(right, left);
          case NOT_IN:
            return !Values.contains(right, left);
          case IS:
            return left == right;
          case IS_NOT:
            return left != right;
          case EQUAL:
            return Values.equal(left, right);
          case NOT_EQUAL:
            return !Values.equal(left, right);
          case LESS:
            return Values.compare(left, right) < 0;
          case LESS_OR_EQUAL:
            return Values.compare(left, right) <= 0;
          case GREATER:
            return Values.compare(left, right) > 0;
          case GREATER_OR_EQUAL:
            return Values.compare(left, right) >= 0;
          default:
            throw new AssertionError(op);
        }
      } catch (IllegalArgumentException e) {
        // Operands that cannot be compared or searched make the comparison false, as in
        // {% if None > 1 %}.
        return false;
      }
    }
  }

  /** A node in the parse tree representing an expression like {@code not a}. */
  static final class NotExpressionNode extends ExpressionNode {
    private final ExpressionNode expr;

    NotExpressionNode(ExpressionNode expr) {
      this.expr = expr;
    }

    @Override
    public String toString() {
      return "(not " + expr + ")";
    }

    @Override
    Object evaluate(Context context) {
      return !expr.isTrue(context);
    }
  }
}
