/*
 * Copyright (c) 2024 Moataz Abdelnasser
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.mizosoft.middleman.internal;

import static com.github.mizosoft.middleman.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parses human-readable byte sizes like {@code "512"}, {@code "64kb"} or {@code "1.5 MB"}. Units
 * are binary multiples (1kb = 1024 bytes) and are matched case-insensitively.
 */
public final class ByteSizes {
  private static final Pattern SIZE_PATTERN =
      Pattern.compile("^(\\d+(?:\\.\\d+)?) *(b|kb|mb|gb|tb|pb)?$", Pattern.CASE_INSENSITIVE);

  private ByteSizes() {}

  /**
   * Returns the number of bytes the given string denotes, rounded down to a whole byte.
   *
   * @throws IllegalArgumentException if the string is not a recognized size or overflows a long
   */
  public static long parse(String size) {
    requireNonNull(size);
    var matcher = SIZE_PATTERN.matcher(size.trim());
    requireArgument(matcher.matches(), "unrecognized size: '%s'", size);
    var unit = matcher.group(2);
    var bytes =
        new BigDecimal(matcher.group(1))
            .multiply(BigDecimal.valueOf(multiplierOf(unit != null ? unit : "b")))
            .setScale(0, RoundingMode.FLOOR);
    try {
      return bytes.longValueExact();
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("size too large: '" + size + "'", e);
    }
  }

  private static long multiplierOf(String unit) {
    switch (unit.toLowerCase(Locale.ROOT)) {
      case "b":
        return 1L;
      case "kb":
        return 1L << 10;
      case "mb":
        return 1L << 20;
      case "gb":
        return 1L << 30;
      case "tb":
        return 1L << 40;
      case "pb":
        return 1L << 50;
      default:
        throw new AssertionError("unexpected unit: " + unit);
    }
  }
}
