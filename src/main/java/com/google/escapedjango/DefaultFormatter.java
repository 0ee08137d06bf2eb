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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;

/**
 * A {@link Formatter} for a fixed {@link Locale}. Numbers use the locale's decimal separator,
 * without grouping. Dates and times use the locale's medium format. Other values are displayed as
 * they would be without localization.
 */
public final class DefaultFormatter implements Formatter {
  private final Locale locale;

  public DefaultFormatter(Locale locale) {
    this.locale = locale;
  }

  @Override
  public String localize(Object value) {
    if (value instanceof BigDecimal) {
      BigDecimal decimal = (BigDecimal) value;
      return formatNumber(decimal, Math.max(decimal.scale(), 0));
    } else if (value instanceof Double || value instanceof Float) {
      BigDecimal decimal = Values.toBigDecimal(value);
      return decimal == null
          ? value.toString()
          : formatNumber(decimal, Math.max(decimal.scale(), 0));
    } else if (value instanceof LocalDate) {
      return format(DateTimeFormatter.ofLocalizedDate(FormatStyle.MEDIUM), (LocalDate) value);
    } else if (value instanceof LocalTime) {
      return format(DateTimeFormatter.ofLocalizedTime(FormatStyle.MEDIUM), (LocalTime) value);
    } else if (value instanceof LocalDateTime || value instanceof ZonedDateTime) {
      return format(
          DateTimeFormatter.ofLocalizedDateTime(FormatStyle.MEDIUM), (TemporalAccessor) value);
    }
    return Values.toDisplayString(value);
  }

  private String format(DateTimeFormatter formatter, TemporalAccessor value) {
    return formatter.withLocale(locale).format(value);
  }

  @Override
  public String formatNumber(Number value, int decimalPlaces) {
    NumberFormat format = NumberFormat.getNumberInstance(locale);
    format.setGroupingUsed(false);
    format.setMinimumFractionDigits(decimalPlaces);
    format.setMaximumFractionDigits(decimalPlaces);
    format.setRoundingMode(RoundingMode.HALF_UP);
    BigDecimal decimal = Values.toBigDecimal(value);
    return decimal == null ? format.format(value.doubleValue()) : format.format(decimal);
  }
}
