// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.simbo1905.orderkey;

import static com.github.simbo1905.orderkey.OrderKeyException.Reason.INVALID_HEAD;
import static com.github.simbo1905.orderkey.OrderKeyException.Reason.INVALID_INTEGER_PART;
import static com.github.simbo1905.orderkey.OrderKeyException.Reason.INVALID_KEY;

/// Parses and validates the self-delimiting integer part at the front of an order key.
///
/// The head character gives both the sign and the total length of the integer part:
/// `a` is two characters long and each later lowercase head adds one; `Z` is two characters
/// long and each earlier uppercase head adds one.
public final class IntegerPartCodec {

  private IntegerPartCodec() {}

  /// @param head the first character of an integer part
  /// @return the total length of an integer part starting with that head
  /// @throws OrderKeyException with [OrderKeyException.Reason#INVALID_HEAD] for any other head
  public static int headLength(char head) {
    if (head >= 'a' && head <= 'z') {
      return head - 'a' + 2;
    }
    if (head >= 'A' && head <= 'Z') {
      return 'Z' - head + 2;
    }
    throw OrderKeyException.of(INVALID_HEAD, "invalid order key head: %s", head);
  }

  /// @return the integer part prefix of the key
  /// @throws OrderKeyException if the key is empty, has a bad head, or is shorter than its head
  ///     implies
  public static String integerPart(String key) {
    if (key.isEmpty()) {
      throw OrderKeyException.of(INVALID_KEY, "invalid order key: empty");
    }
    final int length = headLength(key.charAt(0));
    if (length > key.length()) {
      throw OrderKeyException.of(INVALID_KEY, "invalid order key: %s", key);
    }
    return key.substring(0, length);
  }

  /// @return everything after the integer part, possibly empty
  public static String fractionalPart(String key) {
    return key.substring(integerPart(key).length());
  }

  /// Checks that an integer part is exactly as long as its head says.
  public static void validateInteger(String integer) {
    if (integer.isEmpty() || integer.length() != headLength(integer.charAt(0))) {
      throw OrderKeyException.of(
          INVALID_INTEGER_PART, "invalid integer part of order key: %s", integer);
    }
  }

  /// Checks a complete order key. The reserved smallest integer is rejected as it leaves no
  /// room below it; a fractional part may only hold digits of the alphabet and may not end in
  /// the zero digit.
  public static void validateOrderKey(String key, DigitAlphabet digits) {
    if (key.equals(digits.smallestInteger())) {
      throw OrderKeyException.of(INVALID_KEY, "invalid order key: %s", key);
    }
    // integerPart also rejects a bad head or a key that is too short
    final String fraction = key.substring(integerPart(key).length());
    for (int i = 0; i < fraction.length(); i++) {
      if (digits.indexOf(fraction.charAt(i)) < 0) {
        throw OrderKeyException.of(
            INVALID_KEY, "invalid digit '%s' in order key %s for alphabet %s",
            fraction.charAt(i), key, digits);
      }
    }
    if (digits.endsWithZero(fraction)) {
      throw OrderKeyException.of(INVALID_KEY, "invalid order key: %s", key);
    }
  }

  /// Same checks as [#validateOrderKey(String, DigitAlphabet)] without the exception.
  public static boolean isValidOrderKey(String key, DigitAlphabet digits) {
    try {
      validateOrderKey(key, digits);
      return true;
    } catch (OrderKeyException e) {
      return false;
    }
  }
}
