// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.simbo1905.orderkey;

import static com.github.simbo1905.orderkey.OrderKeyException.Reason.EXHAUSTED;
import static com.github.simbo1905.orderkey.OrderKeyException.Reason.INVALID_INTEGER_PART;

import org.jetbrains.annotations.Nullable;

/// Adds or subtracts one unit from an integer part.
///
/// An integer part is a head character followed by big-endian digits. When a carry or borrow runs
/// off the front of the digits the head moves to its neighbour, which changes the length by one.
/// Neither method mutates its input; the result is always a new string.
public final class IntegerArithmetic {

  private IntegerArithmetic() {}

  /// @return the next larger integer part, or null if `x` is the largest `z` integer
  /// @throws OrderKeyException if `x` is not a valid integer part
  public static @Nullable String increment(String x, DigitAlphabet digits) {
    IntegerPartCodec.validateInteger(x);
    final char head = x.charAt(0);
    final char[] digs = x.substring(1).toCharArray();
    boolean carry = true;
    for (int i = digs.length - 1; carry && i >= 0; i--) {
      final int d = indexOf(digs[i], x, digits) + 1;
      if (d == digits.size()) {
        digs[i] = digits.zero();
      } else {
        digs[i] = digits.digit(d);
        carry = false;
      }
    }
    if (!carry) {
      return head + new String(digs);
    }
    if (head == 'Z') {
      return digits.integerZero();
    }
    if (head == 'z') {
      return null;
    }
    final char next = (char) (head + 1);
    final StringBuilder sb = new StringBuilder(digs.length + 2).append(next).append(digs);
    if (next >= 'a') {
      sb.append(digits.zero());
    } else {
      sb.setLength(sb.length() - 1);
    }
    return sb.toString();
  }

  /// @return the next smaller integer part, or null if `x` is the smallest `A` integer
  /// @throws OrderKeyException if `x` is not a valid integer part
  public static @Nullable String decrement(String x, DigitAlphabet digits) {
    IntegerPartCodec.validateInteger(x);
    final char head = x.charAt(0);
    final char[] digs = x.substring(1).toCharArray();
    boolean borrow = true;
    for (int i = digs.length - 1; borrow && i >= 0; i--) {
      final int d = indexOf(digs[i], x, digits) - 1;
      if (d == -1) {
        digs[i] = digits.last();
      } else {
        digs[i] = digits.digit(d);
        borrow = false;
      }
    }
    if (!borrow) {
      return head + new String(digs);
    }
    if (head == 'a') {
      return "Z" + digits.last();
    }
    if (head == 'A') {
      return null;
    }
    final char previous = (char) (head - 1);
    final StringBuilder sb = new StringBuilder(digs.length + 2).append(previous).append(digs);
    if (previous <= 'Z') {
      sb.append(digits.last());
    } else {
      sb.setLength(sb.length() - 1);
    }
    return sb.toString();
  }

  /// As [#increment(String, DigitAlphabet)] but fails instead of returning null.
  public static String incrementOrThrow(String x, DigitAlphabet digits) {
    final String result = increment(x, digits);
    if (result == null) {
      throw OrderKeyException.of(EXHAUSTED, "cannot increment anymore: %s", x);
    }
    return result;
  }

  /// As [#decrement(String, DigitAlphabet)] but fails instead of returning null.
  public static String decrementOrThrow(String x, DigitAlphabet digits) {
    final String result = decrement(x, digits);
    if (result == null) {
      throw OrderKeyException.of(EXHAUSTED, "cannot decrement anymore: %s", x);
    }
    return result;
  }

  private static int indexOf(char c, String x, DigitAlphabet digits) {
    final int index = digits.indexOf(c);
    if (index < 0) {
      throw OrderKeyException.of(
          INVALID_INTEGER_PART, "invalid digit '%s' in integer part %s for alphabet %s", c, x, digits);
    }
    return index;
  }
}
