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
package com.realdata.utility;

import java.math.BigDecimal;

public class NumberUtils {
  private NumberUtils() {
  }

  /**
   * Parses the longest decimal literal at the beginning of the text, after leading white spaces: optional sign, digits, optional
   * fraction and optional exponent, or {@code Infinity}. Trailing characters are ignored ({@code "12.5kg"} is 12.5).
   *
   * @return the parsed value or {@link Double#NaN} if the text does not start with a number. Never throws.
   */
  public static double parseLeadingDouble(final String text) {
    if (text == null)
      return Double.NaN;

    final int length = text.length();
    int pos = 0;
    while (pos < length && Character.isWhitespace(text.charAt(pos)))
      pos++;

    final int start = pos;
    if (pos < length && (text.charAt(pos) == '+' || text.charAt(pos) == '-'))
      pos++;

    if (text.startsWith("Infinity", pos))
      return text.charAt(start) == '-' ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;

    int digits = 0;
    while (pos < length && Character.isDigit(text.charAt(pos))) {
      pos++;
      digits++;
    }

    if (pos < length && text.charAt(pos) == '.') {
      int fractionEnd = pos + 1;
      int fractionDigits = 0;
      while (fractionEnd < length && Character.isDigit(text.charAt(fractionEnd))) {
        fractionEnd++;
        fractionDigits++;
      }
      if (digits + fractionDigits > 0) {
        pos = fractionEnd;
        digits += fractionDigits;
      }
    }

    if (digits == 0)
      return Double.NaN;

    if (pos < length && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
      int exponentEnd = pos + 1;
      if (exponentEnd < length && (text.charAt(exponentEnd) == '+' || text.charAt(exponentEnd) == '-'))
        exponentEnd++;
      final int exponentDigitsStart = exponentEnd;
      while (exponentEnd < length && Character.isDigit(text.charAt(exponentEnd)))
        exponentEnd++;
      if (exponentEnd > exponentDigitsStart)
        pos = exponentEnd;
    }

    try {
      return Double.parseDouble(text.substring(start, pos));
    } catch (final NumberFormatException e) {
      return Double.NaN;
    }
  }

  /**
   * Formats a number in its shortest text form: integral values without fraction ({@code 3} not {@code 3.0}), plain notation
   * between 1e-7 and 1e21, exponent notation outside.
   */
  public static String toText(final double value) {
    if (Double.isNaN(value))
      return "NaN";
    if (Double.isInfinite(value))
      return value > 0 ? "Infinity" : "-Infinity";
    if (value == 0)
      return "0";

    final double abs = Math.abs(value);
    if (abs >= 1e-7 && abs < 1e21) {
      return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    final String java = Double.toString(value).replace(".0E", "E");
    final int e = java.indexOf('E');
    if (e < 0)
      return java;
    final String exponent = java.substring(e + 1);
    return java.substring(0, e) + "e" + (exponent.startsWith("-") ? exponent : "+" + exponent);
  }
}
