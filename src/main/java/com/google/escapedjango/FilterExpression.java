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
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A variable or literal followed by zero or more filters, such as {@code
 * name|lower|default:"nobody"}. This is what appears inside <code>{{ }}</code> and in most tag
 * arguments.
 */
public final class FilterExpression {
  private static final String DOUBLE_QUOTED = "\"[^\"\\\\]*(?:\\\\.[^\"\\\\]*)*\"";
  private static final String SINGLE_QUOTED = "'[^'\\\\]*(?:\\\\.[^'\\\\]*)*'";
  private static final String CONSTANT =
      "(?:_\\("
          + DOUBLE_QUOTED
          + "\\)|_\\("
          + SINGLE_QUOTED
          + "\\)|"
          + DOUBLE_QUOTED
          + "|"
          + SINGLE_QUOTED
          + ")";
  private static final String NUMBER = "[-+.]?\\d[\\d.e]*";
  private static final String VARIABLE = "[\\w.]+";

  private static final Pattern FILTER_PATTERN =
      Pattern.compile(
          "^(?<constant>"
              + CONSTANT
              + ")|^(?<var>"
              + VARIABLE
              + "|"
              + NUMBER
              + ")|(?:\\s*\\|\\s*(?<filterName>\\w+)(?::(?:(?<constantArg>"
              + CONSTANT
              + ")|(?<varArg>"
              + VARIABLE
              + "|"
              + NUMBER
              + ")))?)");

  /** One filter application in the chain, with its argument if it has one. */
  private static final class FilterCall {
    final Filter filter;
    final Variable arg;

    FilterCall(Filter filter, Variable arg) {
      this.filter = filter;
      this.arg = arg;
    }
  }

  private final String token;
  private final Variable var;
  private final ImmutableList<FilterCall> filters;

  private FilterExpression(String token, Variable var, ImmutableList<FilterCall> filters) {
    this.token = token;
    this.var = var;
    this.filters = filters;
  }

  static FilterExpression compile(String token, Parser parser) {
    Matcher matcher = FILTER_PATTERN.matcher(token);
    Variable var = null;
    ImmutableList.Builder<FilterCall> filters = ImmutableList.builder();
    int upto = 0;
    while (matcher.find()) {
      int start = matcher.start();
      if (upto != start) {
        throw parser.syntaxError(
            "Could not parse some characters: "
                + token.substring(0, upto)
                + "|"
                + token.substring(upto, start)
                + "|"
                + token.substring(start));
      }
      if (var == null) {
        String constant = matcher.group("constant");
        String variable = matcher.group("var");
        if (constant != null) {
          var = Variable.parse(constant, parser);
        } else if (variable != null) {
          var = Variable.parse(variable, parser);
        } else {
          throw parser.syntaxError("Could not find variable at start of " + token);
        }
      } else {
        String filterName = matcher.group("filterName");
        String argText =
            matcher.group("constantArg") != null
                ? matcher.group("constantArg")
                : matcher.group("varArg");
        Variable arg = argText == null ? null : Variable.parse(argText, parser);
        Filter filter = parser.findFilter(filterName);
        String argumentError = filter.checkArguments(arg != null);
        if (argumentError != null) {
          throw parser.syntaxError(argumentError);
        }
        filters.add(new FilterCall(filter, arg));
      }
      upto = matcher.end();
    }
    if (var == null) {
      throw parser.syntaxError("Could not find variable at start of " + token);
    }
    if (upto != token.length()) {
      throw parser.syntaxError(
          "Could not parse the remainder: '" + token.substring(upto) + "' from '" + token + "'");
    }
    return new FilterExpression(token, var, filters.build());
  }

  /** Resolves this expression, substituting the invalid-value string if the variable is missing. */
  public Object resolve(Context context) {
    return resolve(context, false);
  }

  /**
   * Resolves this expression. If the variable cannot be resolved and {@code ignoreFailures} is
   * true, null is used as its value and the filters are still applied. If it cannot be resolved and
   * {@code ignoreFailures} is false, the result depends on the engine configuration: with strict
   * variables, a {@link VariableDoesNotExistException} is thrown; otherwise the engine's
   * invalid-value string is returned, with any {@code %s} in it replaced by the variable text.
   */
  public Object resolve(Context context, boolean ignoreFailures) {
    return filtered(var.resolve(context), context, ignoreFailures);
  }

  /**
   * Resolves this expression given the value of the first segment of its variable, which the
   * caller has already looked up. Only valid if {@link #firstSegment()} is present.
   */
  Object resolveGivenFirst(Object first, Context context) {
    return filtered(var.resolveGivenFirst(first, context), context, false);
  }

  private Object filtered(Object value, Context context, boolean ignoreFailures) {
    if (value == Variable.UNRESOLVED) {
      if (ignoreFailures) {
        value = null;
      } else {
        Engine engine = context.engine();
        if (engine.isStrictVariables()) {
          throw new VariableDoesNotExistException(
              var.toString(), context.template() == null ? null : context.template().name());
        }
        String invalid = engine.stringIfInvalid();
        if (!invalid.isEmpty()) {
          return invalid.contains("%s") ? invalid.replace("%s", var.toString()) : invalid;
        }
        value = invalid;
      }
    }
    return applyFilters(value, context);
  }

  private Object applyFilters(Object value, Context context) {
    for (FilterCall call : filters) {
      Object arg = null;
      if (call.arg != null) {
        arg = call.arg.resolve(context);
        if (arg == Variable.UNRESOLVED) {
          arg = context.engine().stringIfInvalid();
        }
      }
      value = call.filter.apply(value, arg, context);
    }
    return value;
  }

  public Variable variable() {
    return var;
  }

  /** The first segment of the variable of this expression, if it is a plain reference. */
  Optional<String> firstSegment() {
    return var.firstSegment();
  }

  /** True if the argument of any filter is a reference whose first segment is {@code name}. */
  boolean argumentsReference(String name) {
    return filters.stream()
        .anyMatch(
            call -> call.arg != null && call.arg.firstSegment().filter(name::equals).isPresent());
  }

  boolean usesFilter(String filterName) {
    return filters.stream().anyMatch(call -> call.filter.name().equals(filterName));
  }

  @Override
  public String toString() {
    return token;
  }
}
