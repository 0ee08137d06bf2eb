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

import com.google.common.collect.ImmutableSet;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;

/** A named filter, with the metadata the template core needs in order to apply it. */
public final class Filter {
  /** Properties of a filter that change how it is applied. */
  public enum Flag {
    /**
     * The filter does not introduce unsafe HTML characters, so if its input was a {@link
     * SafeString} its output is treated as safe too.
     */
    IS_SAFE,
    /** The filter is told whether autoescaping is in effect. */
    NEEDS_AUTOESCAPE,
    /**
     * Date-time input is converted to the current time zone before the filter sees it, if time
     * zone support is enabled.
     */
    EXPECTS_LOCALTIME,
  }

  /** Whether a filter takes an argument. */
  public enum Arity {
    NONE,
    OPTIONAL,
    REQUIRED,
  }

  private final String name;
  private final FilterFunction function;
  private final Arity arity;
  private final ImmutableSet<Flag> flags;

  Filter(String name, FilterFunction function, Arity arity, ImmutableSet<Flag> flags) {
    this.name = name;
    this.function = function;
    this.arity = arity;
    this.flags = flags;
  }

  public String name() {
    return name;
  }

  public Arity arity() {
    return arity;
  }

  public ImmutableSet<Flag> flags() {
    return flags;
  }

  /**
   * Returns an error message if this filter cannot be called with the given number of arguments,
   * or null if it can. The count includes the value being filtered.
   */
  String checkArguments(boolean hasArgument) {
    int provided = hasArgument ? 2 : 1;
    int required = arity == Arity.REQUIRED ? 2 : 1;
    int allowed = arity == Arity.NONE ? 1 : 2;
    if (provided < required || provided > allowed) {
      return name + " requires " + required + " arguments, " + provided + " provided";
    }
    return null;
  }

  Object apply(Object value, Object arg, Context context) {
    if (flags.contains(Flag.EXPECTS_LOCALTIME) && context.isUseTz()) {
      value = toLocalTime(value, context);
    }
    boolean autoescape = !flags.contains(Flag.NEEDS_AUTOESCAPE) || context.isAutoescape();
    Object result = function.apply(value, arg, autoescape);
    if (flags.contains(Flag.IS_SAFE)
        && value instanceof SafeString
        && result instanceof CharSequence) {
      return SafeString.of((CharSequence) result);
    }
    return result;
  }

  /** Converts a zoned or offset date-time to the context time zone. Other values are unchanged. */
  static Object toLocalTime(Object value, Context context) {
    if (value instanceof Instant) {
      return ((Instant) value).atZone(context.timeZone());
    } else if (value instanceof ZonedDateTime) {
      return ((ZonedDateTime) value).withZoneSameInstant(context.timeZone());
    } else if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).atZoneSameInstant(context.timeZone());
    }
    return value;
  }

  @Override
  public String toString() {
    return "Filter{" + name + ", " + arity + ", " + flags + "}";
  }
}
