// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.simbo1905.orderkey;

import static com.github.simbo1905.orderkey.OrderKeyException.Reason.ORDERING_VIOLATION;
import static com.github.simbo1905.orderkey.OrderKeyException.Reason.TRAILING_ZERO;

import org.jetbrains.annotations.Nullable;

/// Finds a short string strictly between two fractional parts.
///
/// The arguments are read as base-N fractions: `a` may be empty, which is zero, and a null `b`
/// is one. The result never ends in the zero digit so it can itself be used as a bound later.
public final class Midpoint {

  private Midpoint() {}

  /// @param a the lower bound, possibly empty
  /// @param b the upper bound or null for no upper bound
  /// @param digits the alphabet both bounds are written in
  /// @return a string `m` with `a < m` and, when `b` is given, `m < b`
  /// @throws OrderKeyException if `a >= b` or either argument ends in the zero digit
  public static String midpoint(String a, @Nullable String b, DigitAlphabet digits) {
    if (b != null && a.compareTo(b) >= 0) {
      throw OrderKeyException.of(ORDERING_VIOLATION, "%s >= %s", a, b);
    }
    if (digits.endsWithZero(a) || (b != null && digits.endsWithZero(b))) {
      throw OrderKeyException.of(TRAILING_ZERO, "trailing zero in %s or %s", a, b);
    }
    final StringBuilder out = new StringBuilder();
    between(a, b, digits, out);
    return out.toString();
  }

  private static void between(String a, @Nullable String b, DigitAlphabet digits, StringBuilder out) {
    if (b != null) {
      // a is padded with zero digits; b cannot run out first as a < b
      int n = 0;
      while (n < b.length() && (n < a.length() ? a.charAt(n) : digits.zero()) == b.charAt(n)) {
        n++;
      }
      if (n > 0) {
        out.append(b, 0, n);
        between(a.substring(Math.min(n, a.length())), b.substring(n), digits, out);
        return;
      }
    }

    final int digitA = a.isEmpty() ? 0 : digits.indexOf(a.charAt(0));
    final int digitB = b == null ? digits.size() : digits.indexOf(b.charAt(0));
    if (digitB - digitA > 1) {
      // round half up
      out.append(digits.digit((digitA + digitB + 1) / 2));
    } else if (b != null && b.length() > 1) {
      out.append(b.charAt(0));
    } else {
      // e.g. midpoint("49", "5") is "4" + midpoint("9", null) which is "495"
      out.append(digits.digit(digitA));
      between(a.isEmpty() ? "" : a.substring(1), null, digits, out);
    }
  }
}
