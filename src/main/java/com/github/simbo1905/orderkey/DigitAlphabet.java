// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.simbo1905.orderkey;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/// The ordered characters used as the digits of order keys. Index 0 is the zero digit.
///
/// The characters must be strictly ascending by code point. That is not checked here as
/// every comparison in this library is a plain `String` comparison; use
/// [KeyGenerator.Builder#strictAlphabet(boolean)] to have it verified up front.
@EqualsAndHashCode(of = "digits")
public final class DigitAlphabet {

  /// Digits, then uppercase, then lowercase. This order is what the head characters rely on.
  public static final DigitAlphabet BASE_62 =
      new DigitAlphabet("0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz");

  /// Decimal digits. Handy in tests as the generated keys are easy to read.
  public static final DigitAlphabet BASE_10 = new DigitAlphabet("0123456789");

  /// Number of zero digits after the `A` head of the smallest integer part.
  static final int SMALLEST_INTEGER_DIGITS = 'Z' - 'A' + 1;

  @Getter private final String digits;
  private final String smallestInteger;
  private final String integerZero;

  private DigitAlphabet(String digits) {
    this.digits = digits;
    this.smallestInteger = "A" + String.valueOf(digits.charAt(0)).repeat(SMALLEST_INTEGER_DIGITS);
    this.integerZero = "a" + digits.charAt(0);
  }

  /// Wraps the given characters as an alphabet.
  ///
  /// @param digits at least two characters, ascending by code point
  /// @return the alphabet
  /// @throws IllegalArgumentException if digits is null or shorter than two characters
  public static DigitAlphabet of(String digits) {
    if (digits == null || digits.length() < 2) {
      throw new IllegalArgumentException(
          String.format("An alphabet needs at least two digits, got %s", digits));
    }
    if (BASE_62.digits.equals(digits)) {
      return BASE_62;
    }
    if (BASE_10.digits.equals(digits)) {
      return BASE_10;
    }
    return new DigitAlphabet(digits);
  }

  /// @return true if every character is strictly greater than the one before it
  public boolean isStrictlyAscending() {
    for (int i = 1; i < digits.length(); i++) {
      if (digits.charAt(i - 1) >= digits.charAt(i)) {
        return false;
      }
    }
    return true;
  }

  /// @return the number of digits, the base of the keys
  public int size() {
    return digits.length();
  }

  /// @return the first digit, which plays the part of zero
  public char zero() {
    return digits.charAt(0);
  }

  /// @return the largest digit
  public char last() {
    return digits.charAt(digits.length() - 1);
  }

  /// @return the digit at the given position
  public char digit(int index) {
    return digits.charAt(index);
  }

  /// @return the position of the character in this alphabet or -1 if it is not a digit
  public int indexOf(char c) {
    return digits.indexOf(c);
  }

  /// The reserved integer part that no key may equal: `A` followed by 26 zero digits.
  public String smallestInteger() {
    return smallestInteger;
  }

  /// The key handed out when there are no neighbours: `a` followed by the zero digit.
  public String integerZero() {
    return integerZero;
  }

  boolean endsWithZero(String s) {
    return !s.isEmpty() && s.charAt(s.length() - 1) == zero();
  }

  @Override
  public String toString() {
    return digits;
  }
}
