// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.simbo1905.orderkey;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.jetbrains.annotations.Nullable;

/// An [OrderKeys] generator bound to one alphabet. Instances are immutable and can be shared.
///
/// Example usage:
/// <pre>
/// KeyGenerator keys = KeyGenerator.builder()
///     .base10()
///     .strictAlphabet(true)
///     .build();
/// List&lt;String&gt; five = keys.keysBetween(null, null, 5); // a0 a1 a2 a3 a4
/// String last = keys.keyAfter(five.get(4));               // a5
/// </pre>
@Getter
@ToString
@EqualsAndHashCode
public final class KeyGenerator {

  private final DigitAlphabet digits;

  private KeyGenerator(DigitAlphabet digits) {
    this.digits = digits;
  }

  /// @return a generator using the base 62 alphabet
  public static KeyGenerator base62() {
    return new KeyGenerator(DigitAlphabet.BASE_62);
  }

  public static Builder builder() {
    return new Builder();
  }

  /// @see OrderKeys#generateKeyBetween(String, String, DigitAlphabet)
  public String keyBetween(@Nullable String a, @Nullable String b) {
    return OrderKeys.generateKeyBetween(a, b, digits);
  }

  /// @see OrderKeys#generateNKeysBetween(String, String, int, DigitAlphabet)
  public List<String> keysBetween(@Nullable String a, @Nullable String b, int n) {
    return OrderKeys.generateNKeysBetween(a, b, n, digits);
  }

  /// @return a key after `a` with no upper bound, or the first key if `a` is null
  public String keyAfter(@Nullable String a) {
    return keyBetween(a, null);
  }

  /// @return a key before `b` with no lower bound, or the first key if `b` is null
  public String keyBefore(@Nullable String b) {
    return keyBetween(null, b);
  }

  /// @return true if the key is valid for this generator's alphabet
  public boolean isValid(String key) {
    return IntegerPartCodec.isValidOrderKey(key, digits);
  }

  /// @throws OrderKeyException if the key is not valid for this generator's alphabet
  public void validate(String key) {
    IntegerPartCodec.validateOrderKey(key, digits);
  }

  /// Fluent configuration for a [KeyGenerator]. Defaults to the base 62 alphabet without
  /// checking that the alphabet is ascending.
  public static final class Builder {

    private static final Logger logger = Logger.getLogger(Builder.class.getName());

    private DigitAlphabet digits = DigitAlphabet.BASE_62;
    private boolean strictAlphabet = false;

    private Builder() {}

    /// Sets the alphabet from its characters in ascending order.
    ///
    /// @param digits at least two characters
    /// @return this builder for chaining
    public Builder digits(String digits) {
      this.digits = DigitAlphabet.of(digits);
      return this;
    }

    /// @param digits the alphabet to use
    /// @return this builder for chaining
    public Builder digits(DigitAlphabet digits) {
      if (digits == null) {
        throw new IllegalArgumentException("digits cannot be null");
      }
      this.digits = digits;
      return this;
    }

    /// Uses `0123456789`.
    ///
    /// @return this builder for chaining
    public Builder base10() {
      return digits(DigitAlphabet.BASE_10);
    }

    /// Uses `0-9A-Za-z`.
    ///
    /// @return this builder for chaining
    public Builder base62() {
      return digits(DigitAlphabet.BASE_62);
    }

    /// When enabled [#build()] rejects an alphabet that is not strictly ascending by code point.
    /// Such an alphabet would otherwise generate keys that sort in the wrong order.
    ///
    /// @param strictAlphabet true to check the alphabet
    /// @return this builder for chaining
    public Builder strictAlphabet(boolean strictAlphabet) {
      this.strictAlphabet = strictAlphabet;
      return this;
    }

    /// @return the configured generator
    /// @throws IllegalArgumentException if strict checking is on and the alphabet is not ascending
    public KeyGenerator build() {
      if (strictAlphabet && !digits.isStrictlyAscending()) {
        throw new IllegalArgumentException(
            String.format("digits must be strictly ascending by code point, got %s", digits));
      }
      logger.log(
          Level.FINE,
          () -> String.format("KeyGenerator digits=%s strictAlphabet=%b", digits, strictAlphabet));
      return new KeyGenerator(digits);
    }
  }
}
