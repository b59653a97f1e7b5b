// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.simbo1905.orderkey;

import lombok.Getter;

/// Thrown when an order key or the arguments used to generate one are not valid.
/// These are programming errors or corrupted stored keys; none of them are transient.
public class OrderKeyException extends IllegalArgumentException {

  /// What went wrong.
  public enum Reason {
    /// The first character is not in `A..Z` or `a..z`.
    INVALID_HEAD,
    /// An integer part is not exactly as long as its head says it is.
    INVALID_INTEGER_PART,
    /// Too short for its integer part, a trailing zero digit, or the reserved smallest integer.
    INVALID_KEY,
    /// The lower bound is not strictly less than the upper bound.
    ORDERING_VIOLATION,
    /// A midpoint argument ends in the zero digit.
    TRAILING_ZERO,
    /// There is no larger or smaller integer part to move to.
    EXHAUSTED
  }

  @Getter private final Reason reason;

  public OrderKeyException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  static OrderKeyException of(Reason reason, String format, Object... args) {
    return new OrderKeyException(reason, String.format(format, args));
  }
}
