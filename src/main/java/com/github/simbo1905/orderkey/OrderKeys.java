// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.simbo1905.orderkey;

import static com.github.simbo1905.orderkey.OrderKeyException.Reason.ORDERING_VIOLATION;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.Nullable;

/// Generates order keys: strings whose plain lexicographic order is the order of the items they
/// label, and where a new key can always be found between any two existing ones.
///
/// Example usage:
/// <pre>
/// String first = OrderKeys.generateKeyBetween(null, null);   // "a0"
/// String second = OrderKeys.generateKeyBetween(first, null); // "a1"
/// String before = OrderKeys.generateKeyBetween(null, first); // "Zz"
/// String middle = OrderKeys.generateKeyBetween(first, second); // "a0V"
/// </pre>
///
/// A null bound means "no neighbour on that side". Every method is a pure function and safe to
/// call from any thread. Two writers asking for a key in the same gap will get the same key; that
/// has to be resolved by the caller.
public final class OrderKeys {

  private static final Logger logger = Logger.getLogger(OrderKeys.class.getName());

  /// The reserved smallest integer part of the default alphabet.
  public static final String SMALLEST_INTEGER = DigitAlphabet.BASE_62.smallestInteger();

  /// The first key ever handed out with the default alphabet.
  public static final String INTEGER_ZERO = DigitAlphabet.BASE_62.integerZero();

  private OrderKeys() {}

  /// Generates a key between `a` and `b` using the base 62 alphabet.
  ///
  /// @see #generateKeyBetween(String, String, DigitAlphabet)
  public static String generateKeyBetween(@Nullable String a, @Nullable String b) {
    return generateKeyBetween(a, b, DigitAlphabet.BASE_62);
  }

  /// Generates a key `k` with `a < k < b`.
  ///
  /// Appending after the last key moves to the next integer (`a1`, `a2`, ...) and prepending
  /// before the first key moves to the previous one, so keys at the ends of a list stay short.
  /// Only inserts between keys with the same integer part grow the fractional part.
  ///
  /// @param a the key before the new one or null if it goes first
  /// @param b the key after the new one or null if it goes last
  /// @param digits the alphabet the keys are written in
  /// @return the new key
  /// @throws OrderKeyException if `a >= b`, either key is invalid, or the integer space at the
  ///     relevant end is used up
  public static String generateKeyBetween(
      @Nullable String a, @Nullable String b, DigitAlphabet digits) {
    if (a != null && b != null && a.compareTo(b) >= 0) {
      throw OrderKeyException.of(ORDERING_VIOLATION, "%s >= %s", a, b);
    }
    if (a != null) {
      IntegerPartCodec.validateOrderKey(a, digits);
    }
    if (b != null) {
      IntegerPartCodec.validateOrderKey(b, digits);
    }
    final String key = keyBetween(a, b, digits);
    logger.log(Level.FINEST, () -> String.format("generateKeyBetween(%s, %s) -> %s", a, b, key));
    return key;
  }

  private static String keyBetween(@Nullable String a, @Nullable String b, DigitAlphabet digits) {
    if (a == null) {
      if (b == null) {
        return digits.integerZero();
      }
      final String ib = IntegerPartCodec.integerPart(b);
      final String fb = b.substring(ib.length());
      if (ib.equals(digits.smallestInteger())) {
        return ib + Midpoint.midpoint("", fb, digits);
      }
      if (ib.compareTo(b) < 0) {
        return ib;
      }
      final String previous = IntegerArithmetic.decrementOrThrow(ib, digits);
      // the smallest integer is reserved so step into its fractional space instead
      return previous.equals(digits.smallestInteger())
          ? previous + Midpoint.midpoint("", null, digits)
          : previous;
    }

    final String ia = IntegerPartCodec.integerPart(a);
    final String fa = a.substring(ia.length());
    if (b == null) {
      final String next = IntegerArithmetic.increment(ia, digits);
      return next != null ? next : ia + Midpoint.midpoint(fa, null, digits);
    }

    final String ib = IntegerPartCodec.integerPart(b);
    final String fb = b.substring(ib.length());
    if (ia.equals(ib)) {
      return ia + Midpoint.midpoint(fa, fb, digits);
    }
    final String next = IntegerArithmetic.incrementOrThrow(ia, digits);
    if (next.compareTo(b) < 0) {
      return next;
    }
    return ia + Midpoint.midpoint(fa, null, digits);
  }

  /// Generates `n` keys between `a` and `b` using the base 62 alphabet.
  ///
  /// @see #generateNKeysBetween(String, String, int, DigitAlphabet)
  public static List<String> generateNKeysBetween(@Nullable String a, @Nullable String b, int n) {
    return generateNKeysBetween(a, b, n, DigitAlphabet.BASE_62);
  }

  /// Generates `n` distinct keys in ascending order, all strictly between `a` and `b`.
  ///
  /// With one bound missing the keys are consecutive integers counting away from the other
  /// bound. With both bounds present the gap is split recursively around its midpoint so the
  /// keys stay short however many are asked for.
  ///
  /// @return an unmodifiable list of `n` keys
  /// @throws IllegalArgumentException if `n` is negative
  /// @throws OrderKeyException as for [#generateKeyBetween(String, String, DigitAlphabet)]
  public static List<String> generateNKeysBetween(
      @Nullable String a, @Nullable String b, int n, DigitAlphabet digits) {
    if (n < 0) {
      throw new IllegalArgumentException("n must be non-negative, got " + n);
    }
    final List<String> keys = new ArrayList<>(n);
    fill(a, b, n, digits, keys);
    logger.log(
        Level.FINE,
        () -> String.format("generateNKeysBetween(%s, %s, %d) -> %s", a, b, n, keys));
    return Collections.unmodifiableList(keys);
  }

  private static void fill(
      @Nullable String a, @Nullable String b, int n, DigitAlphabet digits, List<String> keys) {
    if (n == 0) {
      return;
    }
    if (n == 1) {
      keys.add(generateKeyBetween(a, b, digits));
      return;
    }
    if (b == null) {
      String previous = a;
      for (int i = 0; i < n; i++) {
        previous = generateKeyBetween(previous, null, digits);
        keys.add(previous);
      }
      return;
    }
    if (a == null) {
      final int start = keys.size();
      String next = b;
      for (int i = 0; i < n; i++) {
        next = generateKeyBetween(null, next, digits);
        keys.add(next);
      }
      Collections.reverse(keys.subList(start, keys.size()));
      return;
    }
    final int half = n / 2;
    final String c = generateKeyBetween(a, b, digits);
    fill(a, c, half, digits, keys);
    keys.add(c);
    fill(c, b, n - half - 1, digits, keys);
  }

  /// Validates a key written in the base 62 alphabet.
  ///
  /// @throws OrderKeyException if the key is not a valid order key
  public static void validateOrderKey(String key) {
    IntegerPartCodec.validateOrderKey(key, DigitAlphabet.BASE_62);
  }

  /// Validates a key written in the given alphabet.
  public static void validateOrderKey(String key, DigitAlphabet digits) {
    IntegerPartCodec.validateOrderKey(key, digits);
  }

  /// @return true if the key is a valid base 62 order key
  public static boolean isValidOrderKey(String key) {
    return IntegerPartCodec.isValidOrderKey(key, DigitAlphabet.BASE_62);
  }

  /// @return true if the key is a valid order key in the given alphabet
  public static boolean isValidOrderKey(String key, DigitAlphabet digits) {
    return IntegerPartCodec.isValidOrderKey(key, digits);
  }
}
