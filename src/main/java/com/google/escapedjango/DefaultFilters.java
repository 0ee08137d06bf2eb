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

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;
import com.google.common.net.PercentEscaper;
import com.google.common.primitives.Ints;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.Normalizer;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** The built-in filters, which every template can use without loading a library. */
public final class DefaultFilters {
  private static final String DEFAULT_DATE_FORMAT = "MMM d, yyyy";
  private static final String DEFAULT_TIME_FORMAT = "h:mm a";
  private static final String ELLIPSIS = "\u2026";
  private static final char NBSP = '\u00a0';

  private static final Pattern TAG = Pattern.compile("<[^<>]*>");
  private static final Pattern NON_SLUG = Pattern.compile("[^\\w\\s-]");
  private static final Pattern SLUG_SEPARATORS = Pattern.compile("[-\\s]+");
  private static final Pattern APOSTROPHE_CAPITAL = Pattern.compile("([a-z])'([A-Z])");
  private static final Pattern DIGIT_CAPITAL = Pattern.compile("\\d([A-Z])");
  private static final Pattern NEWLINES = Pattern.compile("\r\n|\r");
  private static final Splitter WHITESPACE_SPLITTER =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
  private static final Splitter COMMA_SPLITTER = Splitter.on(',');
  private static final Splitter PARAGRAPH_SPLITTER = Splitter.on(Pattern.compile("\n{2,}"));
  private static final CharMatcher ALWAYS_URL_SAFE =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("-_.~"));

  private static final Escaper SLASH_ESCAPER =
      Escapers.builder()
          .addEscape('\\', "\\\\")
          .addEscape('"', "\\\"")
          .addEscape('\'', "\\'")
          .build();

  private static final Escaper JS_ESCAPER = jsEscaper();

  private static final Escaper JSON_SCRIPT_ESCAPER =
      Escapers.builder()
          .addEscape('>', "\\u003E")
          .addEscape('<', "\\u003C")
          .addEscape('&', "\\u0026")
          .build();

  private static final Gson GSON =
      new GsonBuilder()
          .disableHtmlEscaping()
          .serializeNulls()
          .registerTypeHierarchyAdapter(
              CharSequence.class,
              (JsonSerializer<CharSequence>)
                  (src, type, context) -> new JsonPrimitive(src.toString()))
          .create();

  private static Escaper jsEscaper() {
    Escapers.Builder builder = Escapers.builder();
    for (char c : "\\'\"><&=-;`\u2028\u2029".toCharArray()) {
      builder.addEscape(c, String.format("\\u%04X", (int) c));
    }
    for (char c = 0; c < 32; c++) {
      builder.addEscape(c, String.format("\\u%04X", (int) c));
    }
    return builder.build();
  }

  private static final Library LIBRARY =
      Library.builder()
          .filter("add", DefaultFilters::add)
          .filter("addslashes", value -> SLASH_ESCAPER.escape(str(value)), Filter.Flag.IS_SAFE)
          .filter("capfirst", DefaultFilters::capfirst, Filter.Flag.IS_SAFE)
          .filter("center", DefaultFilters::center, Filter.Flag.IS_SAFE)
          .filter("cut", DefaultFilters::cut)
          .filter(
              "date",
              Filter.Arity.OPTIONAL,
              (value, arg, autoescape) -> date(value, arg),
              Filter.Flag.EXPECTS_LOCALTIME)
          .filter("default", (value, arg) -> Truthiness.isTrue(value) ? value : arg)
          .filter("default_if_none", (value, arg) -> value == null ? arg : value)
          .filter("divisibleby", DefaultFilters::divisibleBy, Filter.Flag.IS_SAFE)
          .filter("escape", Html::conditionalEscape, Filter.Flag.IS_SAFE)
          .filter("escapejs", value -> JS_ESCAPER.escape(str(value)))
          .filter("filesizeformat", DefaultFilters::fileSizeFormat, Filter.Flag.IS_SAFE)
          .filter("first", value -> firstOrLast(value, true))
          .filter(
              "floatformat",
              Filter.Arity.OPTIONAL,
              (value, arg, autoescape) -> floatFormat(value, arg),
              Filter.Flag.IS_SAFE)
          .filter("force_escape", Html::escape, Filter.Flag.IS_SAFE)
          .filter(
              "join",
              Filter.Arity.REQUIRED,
              DefaultFilters::join,
              Filter.Flag.IS_SAFE,
              Filter.Flag.NEEDS_AUTOESCAPE)
          .filter("last", value -> firstOrLast(value, false))
          .filter(
              "linebreaks",
              Filter.Arity.NONE,
              (value, arg, autoescape) -> lineBreaks(value, autoescape),
              Filter.Flag.IS_SAFE,
              Filter.Flag.NEEDS_AUTOESCAPE)
          .filter("length", value -> Math.max(Values.length(value), 0), Filter.Flag.IS_SAFE)
          .filter(
              "linebreaksbr",
              Filter.Arity.NONE,
              (value, arg, autoescape) -> lineBreaksBr(value, autoescape),
              Filter.Flag.IS_SAFE,
              Filter.Flag.NEEDS_AUTOESCAPE)
          .filter("ljust", (value, arg) -> justify(value, arg, true), Filter.Flag.IS_SAFE)
          .filter("lower", value -> str(value).toLowerCase(Locale.ROOT), Filter.Flag.IS_SAFE)
          .filter("make_list", DefaultFilters::makeList, Filter.Flag.IS_SAFE)
          .filter(
              "pluralize",
              Filter.Arity.OPTIONAL,
              (value, arg, autoescape) -> pluralize(value, arg),
              Filter.Flag.IS_SAFE)
          .filter("rjust", (value, arg) -> justify(value, arg, false), Filter.Flag.IS_SAFE)
          .filter("safe", Html::markSafe, Filter.Flag.IS_SAFE)
          .filter("safeseq", DefaultFilters::safeSeq, Filter.Flag.IS_SAFE)
          .filter("slice", DefaultFilters::slice, Filter.Flag.IS_SAFE)
          .filter("slugify", DefaultFilters::slugify, Filter.Flag.IS_SAFE)
          .filter("stringformat", DefaultFilters::stringFormat, Filter.Flag.IS_SAFE)
          .filter("striptags", DefaultFilters::stripTags, Filter.Flag.IS_SAFE)
          .filter(
              "time",
              Filter.Arity.OPTIONAL,
              (value, arg, autoescape) -> time(value, arg),
              Filter.Flag.EXPECTS_LOCALTIME)
          .filter("title", DefaultFilters::title, Filter.Flag.IS_SAFE)
          .filter("truncatechars", DefaultFilters::truncateChars, Filter.Flag.IS_SAFE)
          .filter("truncatewords", DefaultFilters::truncateWords, Filter.Flag.IS_SAFE)
          .filter("upper", value -> str(value).toUpperCase(Locale.ROOT))
          .filter(
              "urlencode",
              Filter.Arity.OPTIONAL,
              (value, arg, autoescape) -> urlEncode(value, arg),
              Filter.Flag.IS_SAFE)
          .filter(
              "wordcount",
              value -> WHITESPACE_SPLITTER.splitToList(str(value)).size(),
              Filter.Flag.IS_SAFE)
          .filter("wordwrap", DefaultFilters::wordWrap, Filter.Flag.IS_SAFE)
          .filter(
              "yesno",
              Filter.Arity.OPTIONAL,
              (value, arg, autoescape) -> yesNo(value, arg))
          .build();

  private DefaultFilters() {}

  public static Library library() {
    return LIBRARY;
  }

  private static String str(Object value) {
    return Values.toDisplayString(value);
  }

  /** Returns {@code arg} as an int, or null if it is not an integer. */
  private static Integer intArg(Object arg) {
    Long n = Values.toLong(arg);
    if (n == null || (arg instanceof Number && !(arg instanceof Integer || arg instanceof Long))) {
      return null;
    }
    return Ints.saturatedCast(n);
  }

  private static Object add(Object value, Object arg) {
    Long a = Values.toLong(value);
    Long b = Values.toLong(arg);
    if (a != null && b != null) {
      return a + b;
    }
    if (value instanceof CharSequence && arg instanceof CharSequence) {
      return value.toString() + arg;
    }
    if (value instanceof Collection<?> && arg instanceof Collection<?>) {
      List<Object> result = new ArrayList<>((Collection<?>) value);
      result.addAll((Collection<?>) arg);
      return result;
    }
    return "";
  }

  private static Object capfirst(Object value) {
    String s = str(value);
    if (s.isEmpty()) {
      return s;
    }
    return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1);
  }

  private static Object center(Object value, Object arg) {
    String s = str(value);
    Integer width = intArg(arg);
    if (width == null || width <= s.length()) {
      return s;
    }
    // Same split as Python's str.center: an odd margin puts the extra space on the right, unless
    // the width is odd too.
    int margin = width - s.length();
    int left = margin / 2 + (margin & width & 1);
    return spaces(left) + s + spaces(margin - left);
  }

  private static String spaces(int n) {
    return " ".repeat(n);
  }

  private static Object cut(Object value, Object arg) {
    String result = str(value).replace(str(arg), "");
    if (value instanceof SafeString && !str(arg).equals(";")) {
      return SafeString.of(result);
    }
    return result;
  }

  private static Object date(Object value, Object arg) {
    TemporalAccessor temporal = temporal(value);
    if (temporal == null) {
      return "";
    }
    String pattern = arg == null ? DEFAULT_DATE_FORMAT : str(arg);
    return DateTimeFormatter.ofPattern(pattern, Locale.US).format(temporal);
  }

  private static Object time(Object value, Object arg) {
    TemporalAccessor temporal = temporal(value);
    if (temporal == null || !temporal.isSupported(ChronoField.HOUR_OF_DAY)) {
      return "";
    }
    String pattern = arg == null ? DEFAULT_TIME_FORMAT : str(arg);
    return DateTimeFormatter.ofPattern(pattern, Locale.US).format(temporal);
  }

  /** Returns the value as a date-time, with {@link Date} and {@link Instant} taken as UTC. */
  private static TemporalAccessor temporal(Object value) {
    if (value instanceof Date) {
      value = ((Date) value).toInstant();
    }
    if (value instanceof Instant) {
      value = ((Instant) value).atZone(ZoneOffset.UTC);
    }
    return value instanceof TemporalAccessor ? (TemporalAccessor) value : null;
  }

  private static Object divisibleBy(Object value, Object arg) {
    Long a = Values.toLong(value);
    Long b = Values.toLong(arg);
    if (a == null || b == null) {
      throw new EvaluationException(
          "divisibleby needs integers, got "
              + Values.typeName(value)
              + " and "
              + Values.typeName(arg));
    }
    if (b == 0) {
      throw new EvaluationException("divisibleby zero");
    }
    return a % b == 0;
  }

  private static Object fileSizeFormat(Object value) {
    BigDecimal bytes = Values.toBigDecimal(value);
    if (bytes == null) {
      return "0" + NBSP + "bytes";
    }
    boolean negative = bytes.signum() < 0;
    bytes = bytes.abs();
    String[] units = {"KB", "MB", "GB", "TB", "PB"};
    BigDecimal kb = BigDecimal.valueOf(1024);
    String result;
    if (bytes.compareTo(kb) < 0) {
      long n = bytes.longValue();
      result = n + (n == 1 ? NBSP + "byte" : NBSP + "bytes");
    } else {
      int unit = 0;
      BigDecimal scaled = bytes.divide(kb);
      while (unit < units.length - 1 && scaled.compareTo(kb) >= 0) {
        scaled = scaled.divide(kb);
        unit++;
      }
      result = scaled.setScale(1, RoundingMode.HALF_UP).toPlainString() + NBSP + units[unit];
    }
    return negative ? "-" + result : result;
  }

  private static Object firstOrLast(Object value, boolean first) {
    List<?> list;
    try {
      list = Values.toList(value);
    } catch (IllegalArgumentException e) {
      return "";
    }
    if (list.isEmpty()) {
      return "";
    }
    return first ? list.get(0) : list.get(list.size() - 1);
  }

  /**
   * Rounds to a number of decimal places. With no argument, or a negative one, the result has no
   * decimal places if the value is a whole number, and otherwise has as many as the absolute value
   * of the argument (one by default).
   */
  private static Object floatFormat(Object value, Object arg) {
    BigDecimal decimal = Values.toBigDecimal(value);
    if (decimal == null) {
      return "";
    }
    Integer places = arg == null ? Integer.valueOf(-1) : intArg(arg);
    if (places == null) {
      return value;
    }
    boolean whole = decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0;
    if (places < 0 && whole) {
      return decimal.setScale(0, RoundingMode.HALF_UP);
    }
    return decimal.setScale(Math.abs(places), RoundingMode.HALF_UP);
  }

  private static Object join(Object value, Object arg, boolean autoescape) {
    List<?> list;
    try {
      list = Values.toList(value);
    } catch (IllegalArgumentException e) {
      return value;
    }
    List<String> parts = new ArrayList<>(list.size());
    for (Object item : list) {
      parts.add(autoescape ? Html.conditionalEscape(item).toString() : str(item));
    }
    String separator = autoescape ? Html.conditionalEscape(arg).toString() : str(arg);
    return SafeString.of(Joiner.on(separator).join(parts));
  }

  private static Object jsonScript(Object value, Object elementId) {
    String json = JSON_SCRIPT_ESCAPER.escape(GSON.toJson(value));
    String id = elementId == null ? "" : str(elementId);
    String open =
        id.isEmpty()
            ? "<script type=\"application/json\">"
            : "<script id=\"" + Html.escape(id) + "\" type=\"application/json\">";
    return SafeString.of(open + json + "</script>");
  }

  private static Object lineBreaks(Object value, boolean autoescape) {
    boolean escape = autoescape && !(value instanceof SafeString);
    String s = NEWLINES.matcher(str(value)).replaceAll("\n");
    List<String> paragraphs = new ArrayList<>();
    for (String paragraph : PARAGRAPH_SPLITTER.split(s)) {
      if (escape) {
        paragraph = Html.escape(paragraph).toString();
      }
      paragraphs.add("<p>" + paragraph.replace("\n", "<br>") + "</p>");
    }
    return SafeString.of(Joiner.on("\n\n").join(paragraphs));
  }

  private static Object lineBreaksBr(Object value, boolean autoescape) {
    String s = NEWLINES.matcher(str(value)).replaceAll("\n");
    if (autoescape && !(value instanceof SafeString)) {
      s = Html.escape(s).toString();
    }
    return SafeString.of(s.replace("\n", "<br>"));
  }

  private static Object justify(Object value, Object arg, boolean left) {
    String s = str(value);
    Integer width = intArg(arg);
    if (width == null || width <= s.length()) {
      return s;
    }
    return left ? s + spaces(width - s.length()) : spaces(width - s.length()) + s;
  }

  private static Object makeList(Object value) {
    return Values.toList(str(value));
  }

  private static Object pluralize(Object value, Object arg) {
    List<String> bits = COMMA_SPLITTER.splitToList(arg == null ? "s" : str(arg));
    if (bits.size() > 2) {
      return "";
    }
    String singular = bits.size() == 2 ? bits.get(0) : "";
    String plural = bits.get(bits.size() - 1);
    if (value instanceof Number || value instanceof CharSequence) {
      BigDecimal n = Values.toBigDecimal(value);
      if (n == null) {
        return "";
      }
      return n.compareTo(BigDecimal.ONE) == 0 ? singular : plural;
    }
    int length = Values.length(value);
    if (length < 0) {
      return "";
    }
    return length == 1 ? singular : plural;
  }

  private static Object safeSeq(Object value) {
    List<SafeString> result = new ArrayList<>();
    for (Object item : Values.toList(value)) {
      result.add(Html.markSafe(item));
    }
    return result;
  }

  /** Python slice syntax, {@code start:stop:step}, where each part may be omitted or negative. */
  private static Object slice(Object value, Object arg) {
    List<?> list;
    try {
      list = Values.toList(value);
    } catch (IllegalArgumentException e) {
      return value;
    }
    List<String> parts = Splitter.on(':').splitToList(str(arg));
    if (parts.size() > 3) {
      return value;
    }
    Integer[] bounds = new Integer[3];
    for (int i = 0; i < parts.size(); i++) {
      String part = parts.get(i).trim();
      if (!part.isEmpty()) {
        bounds[i] = Ints.tryParse(part);
        if (bounds[i] == null) {
          return value;
        }
      }
    }
    if (parts.size() == 1) {
      // A single number is a stop, as in "slice:'2'".
      bounds[1] = bounds[0];
      bounds[0] = null;
    }
    int step = bounds[2] == null ? 1 : bounds[2];
    if (step == 0) {
      throw new EvaluationException("slice step cannot be zero");
    }
    int size = list.size();
    int start;
    int stop;
    if (step > 0) {
      start = bounds[0] == null ? 0 : clampIndex(bounds[0], size, 0, size);
      stop = bounds[1] == null ? size : clampIndex(bounds[1], size, 0, size);
    } else {
      start = bounds[0] == null ? size - 1 : clampIndex(bounds[0], size, -1, size - 1);
      stop = bounds[1] == null ? -1 : clampIndex(bounds[1], size, -1, size - 1);
    }
    List<Object> result = new ArrayList<>();
    for (int i = start; step > 0 ? i < stop : i > stop; i += step) {
      result.add(list.get(i));
    }
    if (value instanceof CharSequence) {
      return Joiner.on("").join(result);
    }
    return result;
  }

  private static int clampIndex(int index, int size, int min, int max) {
    if (index < 0) {
      index += size;
    }
    return Math.max(min, Math.min(max, index));
  }

  private static Object slugify(Object value) {
    String s = Normalizer.normalize(str(value), Normalizer.Form.NFKD);
    s = CharMatcher.ascii().retainFrom(s);
    s = NON_SLUG.matcher(Ascii.toLowerCase(s)).replaceAll("");
    s = SLUG_SEPARATORS.matcher(s.trim()).replaceAll("-");
    return CharMatcher.anyOf("-_").trimFrom(s);
  }

  /** Formats the value with a {@code printf}-style conversion, like {@code 03d} or {@code .2f}. */
  private static Object stringFormat(Object value, Object arg) {
    String spec = str(arg);
    if (spec.isEmpty()) {
      return "";
    }
    char conversion = spec.charAt(spec.length() - 1);
    Object formatted;
    switch (conversion) {
      case 'i':
        spec = spec.substring(0, spec.length() - 1) + "d";
        formatted = Values.toLong(value);
        break;
      case 'd':
      case 'o':
      case 'x':
      case 'X':
        formatted = Values.toLong(value);
        break;
      case 'f':
      case 'F':
      case 'e':
      case 'E':
      case 'g':
      case 'G':
        formatted = Values.toBigDecimal(value);
        break;
      case 'r':
        spec = spec.substring(0, spec.length() - 1) + "s";
        formatted = str(value);
        break;
      default:
        formatted = str(value);
        break;
    }
    if (formatted == null) {
      return "";
    }
    try {
      return String.format(Locale.ROOT, "%" + spec, formatted);
    } catch (IllegalFormatException e) {
      return "";
    }
  }

  private static Object stripTags(Object value) {
    String s = str(value);
    String previous;
    do {
      previous = s;
      s = TAG.matcher(s).replaceAll("");
    } while (!s.equals(previous));
    return s;
  }

  private static Object title(Object value) {
    String s = str(value);
    StringBuilder titled = new StringBuilder(s.length());
    boolean previousIsLetter = false;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      titled.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
      previousIsLetter = Character.isLetter(c);
    }
    s = lowerMatches(APOSTROPHE_CAPITAL, titled.toString());
    return lowerMatches(DIGIT_CAPITAL, s);
  }

  private static String lowerMatches(Pattern pattern, String s) {
    Matcher matcher = pattern.matcher(s);
    StringBuilder result = new StringBuilder();
    while (matcher.find()) {
      String lowered = matcher.group().toLowerCase(Locale.ROOT);
      matcher.appendReplacement(result, Matcher.quoteReplacement(lowered));
    }
    matcher.appendTail(result);
    return result.toString();
  }

  private static Object truncateChars(Object value, Object arg) {
    Integer length = intArg(arg);
    if (length == null) {
      return value;
    }
    String s = str(value);
    if (s.length() <= length) {
      return s;
    }
    return s.substring(0, Math.max(length - 1, 0)) + ELLIPSIS;
  }

  private static Object truncateWords(Object value, Object arg) {
    Integer length = intArg(arg);
    if (length == null) {
      return value;
    }
    List<String> words = WHITESPACE_SPLITTER.splitToList(str(value));
    if (words.size() <= length) {
      return Joiner.on(' ').join(words);
    }
    return Joiner.on(' ').join(words.subList(0, Math.max(length, 0))) + " " + ELLIPSIS;
  }

  private static Object urlEncode(Object value, Object arg) {
    String safe = arg == null ? "/" : str(arg);
    return new PercentEscaper("-_.~" + ALWAYS_URL_SAFE.removeFrom(safe), false)
        .escape(str(value));
  }

  /**
   * Breaks lines longer than {@code arg} characters at the last space that keeps them within that
   * length. A word longer than the limit is left on a line of its own. Existing line breaks are
   * kept.
   */
  private static Object wordWrap(Object value, Object arg) {
    Integer width = intArg(arg);
    if (width == null || width <= 0) {
      return value;
    }
    String text = str(value);
    StringBuilder wrapped = new StringBuilder();
    int start = 0;
    while (start < text.length()) {
      int newline = text.indexOf('\n', start);
      int end = newline < 0 ? text.length() : newline + 1;
      wrapLine(text.substring(start, end), width, wrapped);
      start = end;
    }
    return wrapped.toString();
  }

  private static void wrapLine(String line, int width, StringBuilder wrapped) {
    while (line.length() > width) {
      int space = line.lastIndexOf(' ', width) + 1;
      if (space == 0) {
        space = line.indexOf(' ') + 1;
        if (space == 0) {
          break;
        }
      }
      wrapped.append(line, 0, space - 1).append('\n');
      line = line.substring(space);
    }
    wrapped.append(line);
  }

  private static Object yesNo(Object value, Object arg) {
    List<String> bits =
        arg == null ? ImmutableList.of("yes", "no", "maybe") : COMMA_SPLITTER.splitToList(str(arg));
    if (bits.size() < 2) {
      return value;
    }
    if (value == null) {
      return bits.size() > 2 ? bits.get(2) : bits.get(1);
    }
    return Truthiness.isTrue(value) ? bits.get(0) : bits.get(1);
  }
}
