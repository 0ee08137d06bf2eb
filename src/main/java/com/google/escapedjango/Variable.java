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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A variable reference or literal in a template, such as {@code user.name}, {@code 42}, {@code
 * 3.5}, {@code "text"}, or {@code _("text")} for text to be translated.
 *
 * <p>A dotted reference is resolved one segment at a time. For each segment, the current value is
 * tried as a {@link Map} key, then as a property of the object (via {@link MethodFinder}), then as
 * a non-negative index into a {@link List}, array, or map with integer keys. After each segment, a
 * {@link Supplier} or {@link Callable} value is called to obtain the value it stands for, unless
 * its class is annotated {@link DoNotCallInTemplates}.
 */
public final class Variable {
  private static final Logger logger = LoggerFactory.getLogger(Variable.class);

  /** Returned by lookups that fail. Never visible to template code or to filters. */
  static final Object UNRESOLVED =
      new Object() {
        @Override
        public String toString() {
          return "<unresolved>";
        }
      };

  private final String var;
  private final Object literal;
  private final ImmutableList<String> lookups;
  private final boolean translate;

  private Variable(String var, Object literal, ImmutableList<String> lookups, boolean translate) {
    this.var = var;
    this.literal = literal;
    this.lookups = lookups;
    this.translate = translate;
  }

  /**
   * Parses the text of a variable or literal.
   *
   * @throws ParseException via {@link Parser#syntaxError} if the text is not a valid variable.
   */
  static Variable parse(String var, Parser parser) {
    Object number = parseNumber(var);
    if (number != null) {
      return new Variable(var, number, null, false);
    }
    boolean translate = false;
    String text = var;
    if (text.startsWith("_(") && text.endsWith(")")) {
      translate = true;
      text = text.substring(2, text.length() - 1);
    }
    String unescaped = unescapeStringLiteral(text);
    if (unescaped != null) {
      return new Variable(var, SafeString.of(unescaped), null, translate);
    }
    if (text.isEmpty()) {
      throw parser.syntaxError("Empty variable name in '" + var + "'");
    }
    if (text.startsWith("_") || text.contains("._")) {
      throw parser.syntaxError(
          "Variables and attributes may not begin with underscores: '" + text + "'");
    }
    ImmutableList<String> lookups = ImmutableList.copyOf(Splitter.on('.').split(text));
    if (lookups.contains("")) {
      throw parser.syntaxError("Invalid variable name: '" + text + "'");
    }
    return new Variable(var, null, lookups, translate);
  }

  private static Object parseNumber(String var) {
    if (var.contains(".") || var.toLowerCase().contains("e")) {
      if (var.endsWith(".")) {
        return null;
      }
      char first = var.charAt(0);
      if (!Character.isDigit(first) && first != '-' && first != '+' && first != '.') {
        return null;
      }
      return Doubles.tryParse(var);
    }
    Integer i = Ints.tryParse(var);
    if (i != null) {
      return i;
    }
    Long l = Longs.tryParse(var);
    if (l != null) {
      return l;
    }
    if (!var.isEmpty() && var.chars().allMatch(Character::isDigit)) {
      return new BigInteger(var);
    }
    return null;
  }

  private static String unescapeStringLiteral(String s) {
    if (s.length() < 2) {
      return null;
    }
    char quote = s.charAt(0);
    if ((quote != '"' && quote != '\'') || s.charAt(s.length() - 1) != quote) {
      return null;
    }
    return s.substring(1, s.length() - 1)
        .replace("\\" + quote, String.valueOf(quote))
        .replace("\\\\", "\\");
  }

  /** True if this is a literal number or string rather than a reference. */
  public boolean isLiteral() {
    return lookups == null;
  }

  /**
   * If this is a reference that is not a literal and not marked for translation, returns its first
   * segment, like {@code item} for {@code item.name}.
   */
  Optional<String> firstSegment() {
    if (lookups != null && !translate) {
      return Optional.of(lookups.get(0));
    }
    return Optional.empty();
  }

  /**
   * Resolves this variable in the given context.
   *
   * @return the value, or {@link #UNRESOLVED} if a lookup failed.
   */
  Object resolve(Context context) {
    Object value;
    if (lookups == null) {
      value = literal;
    } else {
      Object first = context.lookup(lookups.get(0));
      if (first == UNRESOLVED) {
        logFailure(lookups.get(0), context);
        return UNRESOLVED;
      }
      value = resolveFrom(callIfCallable(first), 1, context);
    }
    if (translate && value != UNRESOLVED) {
      String translated = context.engine().translate(Values.toDisplayString(value));
      value = value instanceof SafeString ? SafeString.of(translated) : translated;
    }
    return value;
  }

  /**
   * Resolves this variable given the value of its first segment, which the caller has already
   * looked up. Only valid if {@link #firstSegment()} is present.
   */
  Object resolveGivenFirst(Object first, Context context) {
    return resolveFrom(callIfCallable(first), 1, context);
  }

  /**
   * Resolves the segments of this variable starting at {@code from}, given that the value of the
   * segments before it is {@code current}.
   */
  private Object resolveFrom(Object current, int from, Context context) {
    for (int i = from; i < lookups.size() && current != UNRESOLVED; i++) {
      String bit = lookups.get(i);
      current = lookupSegment(current, bit, context);
      if (current == UNRESOLVED) {
        logFailure(bit, context);
      } else {
        current = callIfCallable(current);
      }
    }
    return current;
  }

  private Object lookupSegment(Object current, String bit, Context context) {
    if (current == null) {
      return UNRESOLVED;
    }
    if (current instanceof Map<?, ?>) {
      Map<?, ?> map = (Map<?, ?>) current;
      Object value = map.get(bit);
      if (value != null || map.containsKey(bit)) {
        return value;
      }
      if (bit.equals("items")) {
        return map.entrySet();
      } else if (bit.equals("keys")) {
        return map.keySet();
      }
    }
    Optional<MethodFinder.Property> property =
        context.engine().methodFinder().publicProperty(current.getClass(), bit);
    if (property.isPresent()) {
      if (property.get().altersData()) {
        return UNRESOLVED;
      }
      try {
        return property.get().read(current);
      } catch (InvocationTargetException e) {
        throw new EvaluationException(
            "Exception while resolving variable '" + bit + "' in '" + var + "'", e.getCause());
      }
    }
    Integer index = Ints.tryParse(bit);
    if (index != null && index >= 0) {
      if (current instanceof List<?>) {
        List<?> list = (List<?>) current;
        return index < list.size() ? list.get(index) : UNRESOLVED;
      } else if (current.getClass().isArray()) {
        return index < Array.getLength(current) ? Array.get(current, index) : UNRESOLVED;
      } else if (current instanceof Map<?, ?>) {
        Map<?, ?> map = (Map<?, ?>) current;
        Object value = map.get(index);
        return value != null || map.containsKey(index) ? value : UNRESOLVED;
      }
    }
    return UNRESOLVED;
  }

  private Object callIfCallable(Object value) {
    if (!(value instanceof Supplier<?>) && !(value instanceof Callable<?>)) {
      return value;
    }
    Class<?> c = value.getClass();
    if (c.isAnnotationPresent(DoNotCallInTemplates.class)) {
      return value;
    }
    if (c.isAnnotationPresent(AltersData.class)) {
      return UNRESOLVED;
    }
    if (value instanceof Supplier<?>) {
      return ((Supplier<?>) value).get();
    }
    try {
      return ((Callable<?>) value).call();
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new EvaluationException("Exception while resolving variable '" + var + "'", e);
    }
  }

  private void logFailure(String bit, Context context) {
    if (logger.isDebugEnabled()) {
      String templateName = context.template() == null ? null : context.template().name();
      logger.debug(
          "Failed lookup of '{}' while resolving variable '{}' in template '{}'",
          bit,
          var,
          templateName == null ? "unknown" : templateName);
    }
  }

  @Override
  public String toString() {
    return var;
  }
}
