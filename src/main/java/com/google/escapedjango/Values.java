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
import com.google.common.collect.Lists;
import com.google.common.primitives.Longs;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Operations on template values that the template language defines independently of Java: how a
 * value is displayed, how two values compare, what it means to iterate over a value, and so on.
 */
final class Values {
  private Values() {}

  /**
   * Returns the text that represents {@code value} in template output, before any escaping. Null
   * is displayed as {@code None} and booleans as {@code True} and {@code False}.
   */
  static String toDisplayString(Object value) {
    if (value == null) {
      return "None";
    } else if (value instanceof Boolean) {
      return (Boolean) value ? "True" : "False";
    } else if (value instanceof BigDecimal) {
      return ((BigDecimal) value).toPlainString();
    } else if (value instanceof Object[]) {
      return Arrays.deepToString((Object[]) value);
    } else if (value.getClass().isArray()) {
      return toList(value).toString();
    }
    return value.toString();
  }

  static boolean equal(Object a, Object b) {
    if (a instanceof Number && b instanceof Number) {
      return compareNumbers((Number) a, (Number) b) == 0;
    }
    if (a instanceof CharSequence && b instanceof CharSequence) {
      return a.toString().equals(b.toString());
    }
    return Objects.equals(a, b);
  }

  /**
   * Compares two values for the ordering operators of {@code if}. Numbers compare by value
   * whatever their types, strings compare lexicographically, and other values compare only if they
   * are mutually {@link Comparable}.
   *
   * @throws IllegalArgumentException if the values cannot be compared.
   */
  @SuppressWarnings("unchecked")
  static int compare(Object a, Object b) {
    if (a instanceof Number && b instanceof Number) {
      return compareNumbers((Number) a, (Number) b);
    }
    if (a instanceof CharSequence && b instanceof CharSequence) {
      return a.toString().compareTo(b.toString());
    }
    if (a instanceof Comparable && b != null && a.getClass().isInstance(b)) {
      return ((Comparable<Object>) a).compareTo(b);
    }
    throw new IllegalArgumentException(
        "Cannot compare " + typeName(a) + " with " + typeName(b));
  }

  private static int compareNumbers(Number a, Number b) {
    if (isIntegral(a) && isIntegral(b)) {
      return Long.compare(a.longValue(), b.longValue());
    }
    BigDecimal decimalA = toBigDecimal(a);
    BigDecimal decimalB = toBigDecimal(b);
    if (decimalA == null || decimalB == null) {
      // NaN or infinity.
      return Double.compare(a.doubleValue(), b.doubleValue());
    }
    return decimalA.compareTo(decimalB);
  }

  private static boolean isIntegral(Number n) {
    return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
  }

  /**
   * Returns whether {@code element} is in {@code container}: a member of a collection or array, a
   * key of a map, or a substring of a string.
   *
   * @throws IllegalArgumentException if {@code container} is none of those things.
   */
  static boolean contains(Object container, Object element) {
    if (container instanceof Map<?, ?>) {
      Map<?, ?> map = (Map<?, ?>) container;
      if (element instanceof SafeString) {
        element = element.toString();
      }
      return map.containsKey(element);
    }
    if (container instanceof CharSequence) {
      if (!(element instanceof CharSequence)) {
        throw new IllegalArgumentException(
            "'in <string>' requires string as left operand, not " + typeName(element));
      }
      return container.toString().contains(element.toString());
    }
    if (container instanceof Collection<?>
        || (container != null && container.getClass().isArray())) {
      for (Object member : toList(container)) {
        if (equal(member, element)) {
          return true;
        }
      }
      return false;
    }
    throw new IllegalArgumentException(
        "argument of type '" + typeName(container) + "' is not iterable");
  }

  /**
   * Returns the items that a {@code for} tag iterates over. A map yields its keys and a string
   * yields its characters as one-character strings. Null yields nothing.
   *
   * @throws IllegalArgumentException if the value cannot be iterated.
   */
  static List<?> toList(Object value) {
    if (value == null) {
      return ImmutableList.of();
    } else if (value instanceof List<?>) {
      return (List<?>) value;
    } else if (value instanceof Collection<?>) {
      return new ArrayList<>((Collection<?>) value);
    } else if (value instanceof Map<?, ?>) {
      return new ArrayList<>(((Map<?, ?>) value).keySet());
    } else if (value instanceof Iterable<?>) {
      return Lists.newArrayList((Iterable<?>) value);
    } else if (value instanceof Object[]) {
      return Arrays.asList((Object[]) value);
    } else if (value.getClass().isArray()) {
      int length = Array.getLength(value);
      List<Object> list = new ArrayList<>(length);
      for (int i = 0; i < length; i++) {
        list.add(Array.get(value, i));
      }
      return list;
    } else if (value instanceof CharSequence) {
      CharSequence chars = (CharSequence) value;
      List<String> list = new ArrayList<>(chars.length());
      for (int i = 0; i < chars.length(); i++) {
        list.add(String.valueOf(chars.charAt(i)));
      }
      return list;
    }
    throw new IllegalArgumentException("'" + typeName(value) + "' object is not iterable");
  }

  /**
   * Returns the components of a loop item for unpacking into several loop variables. A map entry
   * has two components, its key and value.
   */
  static List<?> unpack(Object item) {
    if (item instanceof Map.Entry<?, ?>) {
      Map.Entry<?, ?> entry = (Map.Entry<?, ?>) item;
      return Arrays.asList(entry.getKey(), entry.getValue());
    }
    if (item instanceof GroupedResult) {
      GroupedResult group = (GroupedResult) item;
      return Arrays.asList(group.getGrouper(), group.getList());
    }
    if (item instanceof Map<?, ?> || item == null) {
      return Collections.singletonList(item);
    }
    try {
      return toList(item);
    } catch (IllegalArgumentException e) {
      return Collections.singletonList(item);
    }
  }

  /** Returns the length of a string, collection, map or array, or -1 if it has no length. */
  static int length(Object value) {
    if (value instanceof CharSequence) {
      return ((CharSequence) value).length();
    } else if (value instanceof Collection<?>) {
      return ((Collection<?>) value).size();
    } else if (value instanceof Map<?, ?>) {
      return ((Map<?, ?>) value).size();
    } else if (value != null && value.getClass().isArray()) {
      return Array.getLength(value);
    }
    return -1;
  }

  /**
   * Converts a value to an integer the way the template language's integer arithmetic does: a
   * number is truncated toward zero and a string is parsed as a decimal integer. Returns null if
   * the value is not convertible.
   */
  static Long toLong(Object value) {
    if (value instanceof Number) {
      return ((Number) value).longValue();
    } else if (value instanceof CharSequence) {
      return Longs.tryParse(value.toString().trim());
    }
    return null;
  }

  /** Converts a number or numeric string to a {@link BigDecimal}, or returns null. */
  static BigDecimal toBigDecimal(Object value) {
    if (value instanceof BigDecimal) {
      return (BigDecimal) value;
    } else if (value instanceof BigInteger) {
      return new BigDecimal((BigInteger) value);
    } else if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return null;
      }
      return new BigDecimal(Double.toString(d));
    } else if (value instanceof Number) {
      return BigDecimal.valueOf(((Number) value).longValue());
    } else if (value instanceof CharSequence) {
      try {
        return new BigDecimal(value.toString().trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  static String typeName(Object value) {
    return value == null ? "None" : value.getClass().getSimpleName();
  }
}
