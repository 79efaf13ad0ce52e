/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.realdata.dataset;

import com.realdata.serializer.json.JSONObject;
import com.realdata.utility.NumberUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Objects;

/**
 * Cell value of a row: a number, a text, a date, a boolean or null. Every value converts to text and to number without failing:
 * <ul>
 *   <li>text: numbers without a trailing {@code .0} ({@code 3}, {@code 2.5}, {@code NaN}, {@code Infinity}), dates as ISO-8601 instants,
 *   booleans as {@code true}/{@code false}, null as the empty string</li>
 *   <li>number: booleans and null are 0, dates are epoch milliseconds, texts are parsed from their leading decimal literal
 *   ({@code "12kg"} is 12); whatever does not parse, {@code NaN} included, is 0</li>
 * </ul>
 * Only null and the empty text are empty: 0 and false are regular values.
 */
public final class Value {
  public enum Kind {NULL, NUMBER, TEXT, DATE, BOOLEAN}

  public static final Value NULL  = new Value(Kind.NULL, 0, null, null, false);
  public static final Value TRUE  = new Value(Kind.BOOLEAN, 0, null, null, true);
  public static final Value FALSE = new Value(Kind.BOOLEAN, 0, null, null, false);

  private static final String DATE_TAG   = "@date";
  private static final String NUMBER_TAG = "@number";

  private final Kind    kind;
  private final double  number;
  private final String  text;
  private final Instant date;
  private final boolean bool;

  private Value(final Kind kind, final double number, final String text, final Instant date, final boolean bool) {
    this.kind = kind;
    this.number = number;
    this.text = text;
    this.date = date;
    this.bool = bool;
  }

  public static Value ofNumber(final double number) {
    return new Value(Kind.NUMBER, number, null, null, false);
  }

  public static Value ofText(final String text) {
    return text == null ? NULL : new Value(Kind.TEXT, 0, text, null, false);
  }

  public static Value ofDate(final Instant date) {
    return date == null ? NULL : new Value(Kind.DATE, 0, null, date, false);
  }

  public static Value ofBoolean(final boolean value) {
    return value ? TRUE : FALSE;
  }

  /**
   * Wraps a Java object. Numbers, strings, booleans, {@link Instant}, {@link Date}, {@link LocalDate} and {@link LocalDateTime} (both at
   * UTC) are supported, anything else is stored as its {@code toString()} text.
   */
  public static Value of(final Object value) {
    if (value == null)
      return NULL;
    if (value instanceof Value)
      return (Value) value;
    if (value instanceof Number)
      return ofNumber(((Number) value).doubleValue());
    if (value instanceof String)
      return ofText((String) value);
    if (value instanceof Boolean)
      return ofBoolean((Boolean) value);
    if (value instanceof Instant)
      return ofDate((Instant) value);
    if (value instanceof Date)
      return ofDate(((Date) value).toInstant());
    if (value instanceof LocalDateTime)
      return ofDate(((LocalDateTime) value).toInstant(ZoneOffset.UTC));
    if (value instanceof LocalDate)
      return ofDate(((LocalDate) value).atStartOfDay().toInstant(ZoneOffset.UTC));
    return ofText(value.toString());
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isNull() {
    return kind == Kind.NULL;
  }

  public boolean isEmpty() {
    return kind == Kind.NULL || (kind == Kind.TEXT && text.isEmpty());
  }

  public String asText() {
    switch (kind) {
    case NUMBER:
      return NumberUtils.toText(number);
    case TEXT:
      return text;
    case DATE:
      return date.toString();
    case BOOLEAN:
      return Boolean.toString(bool);
    default:
      return "";
    }
  }

  /**
   * Converts the value to a number, never returning {@code NaN}.
   */
  public double toNumber() {
    final double result;
    switch (kind) {
    case NUMBER:
      result = number;
      break;
    case TEXT:
      result = NumberUtils.parseLeadingDouble(text);
      break;
    case DATE:
      result = date.toEpochMilli();
      break;
    default:
      result = 0;
    }
    return Double.isNaN(result) ? 0 : result;
  }

  /**
   * Returns the wrapped Java object: Double, String, Instant, Boolean or null.
   */
  public Object getRaw() {
    switch (kind) {
    case NUMBER:
      return number;
    case TEXT:
      return text;
    case DATE:
      return date;
    case BOOLEAN:
      return bool;
    default:
      return null;
    }
  }

  /**
   * Converts the value in a JSON compatible object. Dates and non finite numbers, that have no JSON literal, are tagged objects.
   */
  public Object toJSON() {
    switch (kind) {
    case NUMBER:
      if (Double.isNaN(number) || Double.isInfinite(number))
        return new JSONObject().put(NUMBER_TAG, NumberUtils.toText(number));
      if (number == Math.rint(number) && Math.abs(number) < 9.007199254740992E15)
        return (long) number;
      return number;
    case TEXT:
      return text;
    case DATE:
      return new JSONObject().put(DATE_TAG, date.toString());
    case BOOLEAN:
      return bool;
    default:
      return null;
    }
  }

  public static Value fromJSON(final Object json) {
    if (json instanceof JSONObject) {
      final JSONObject tagged = (JSONObject) json;
      if (tagged.has(DATE_TAG)) {
        try {
          return ofDate(Instant.parse(tagged.getString(DATE_TAG)));
        } catch (final DateTimeParseException e) {
          return ofText(tagged.getString(DATE_TAG));
        }
      }
      if (tagged.has(NUMBER_TAG)) {
        final String special = tagged.getString(NUMBER_TAG);
        return ofNumber("NaN".equals(special) ? Double.NaN : NumberUtils.parseLeadingDouble(special));
      }
      return ofText(tagged.toString());
    }
    return of(json);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof Value))
      return false;
    final Value other = (Value) o;
    return kind == other.kind && Double.compare(number, other.number) == 0 && bool == other.bool && Objects.equals(text, other.text)
        && Objects.equals(date, other.date);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, number, text, date, bool);
  }

  @Override
  public String toString() {
    return kind == Kind.TEXT ? "'" + text + "'" : asText();
  }
}
