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

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a value counts as true. Null, {@code false}, numeric zero, and empty strings,
 * collections, maps, iterables, arrays and {@link Optional}s are false. A {@link Truthy} value
 * decides for itself. Everything else is true.
 */
final class Truthiness {
  private Truthiness() {}

  static boolean isTrue(Object value) {
    if (value == null) {
      return false;
    } else if (value instanceof Boolean) {
      return (Boolean) value;
    } else if (value instanceof Truthy) {
      return ((Truthy) value).isTruthy();
    } else if (value instanceof CharSequence) {
      return ((CharSequence) value).length() > 0;
    } else if (value instanceof Number) {
      return !isZero((Number) value);
    } else if (value instanceof Collection<?>) {
      return !((Collection<?>) value).isEmpty();
    } else if (value instanceof Map<?, ?>) {
      return !((Map<?, ?>) value).isEmpty();
    } else if (value instanceof Optional<?>) {
      return ((Optional<?>) value).isPresent();
    } else if (value instanceof Iterable<?>) {
      return ((Iterable<?>) value).iterator().hasNext();
    } else if (value.getClass().isArray()) {
      return Array.getLength(value) > 0;
    } else if (value == Variable.UNRESOLVED) {
      return false;
    }
    return true;
  }

  private static boolean isZero(Number number) {
    if (number instanceof BigDecimal) {
      return ((BigDecimal) number).signum() == 0;
    } else if (number instanceof BigInteger) {
      return ((BigInteger) number).signum() == 0;
    } else if (number instanceof Double || number instanceof Float) {
      return number.doubleValue() == 0;
    }
    return number.longValue() == 0;
  }
}
