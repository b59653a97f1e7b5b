package com.github.simbo1905.orderkey;

import static com.github.simbo1905.orderkey.OrderKeyException.Reason.EXHAUSTED;
import static com.github.simbo1905.orderkey.OrderKeyException.Reason.INVALID_HEAD;
import static com.github.simbo1905.orderkey.OrderKeyException.Reason.INVALID_INTEGER_PART;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;

import org.junit.Test;

public class IntegerArithmeticTest extends JulLoggingConfig {

  private static final DigitAlphabet BASE_10 = DigitAlphabet.BASE_10;
  private static final DigitAlphabet BASE_62 = DigitAlphabet.BASE_62;

  private static final String LARGEST_INTEGER = "z" + "z".repeat(26);

  @Test
  public void testIncrementWithoutCarry() {
    assertEquals("a1", IntegerArithmetic.increment("a0", BASE_10));
    assertEquals("b01", IntegerArithmetic.increment("b00", BASE_10));
    assertEquals("Y01", IntegerArithmetic.increment("Y00", BASE_10));
    assertEquals("Z1", IntegerArithmetic.increment("Z0", BASE_10));
    assertEquals("a2", IntegerArithmetic.increment("a1", BASE_62));
  }

  @Test
  public void testIncrementCarryGrowsLowercase() {
    assertEquals("b00", IntegerArithmetic.increment("a9", BASE_10));
    assertEquals("c000", IntegerArithmetic.increment("b99", BASE_10));
    assertEquals("b00", IntegerArithmetic.increment("az", BASE_62));
  }

  @Test
  public void testIncrementCarryShrinksUppercase() {
    assertEquals("Z0", IntegerArithmetic.increment("Y99", BASE_10));
    assertEquals("Z0", IntegerArithmetic.increment("Yzz", BASE_62));
  }

  @Test
  public void testIncrementCrossesIntoLowercase() {
    assertEquals("a0", IntegerArithmetic.increment("Z9", BASE_10));
    assertEquals("a0", IntegerArithmetic.increment("Zz", BASE_62));
  }

  @Test
  public void testIncrementLargestIsNull() {
    assertNull(IntegerArithmetic.increment(LARGEST_INTEGER, BASE_62));
    final var e =
        assertThrows(
            OrderKeyException.class,
            () -> IntegerArithmetic.incrementOrThrow(LARGEST_INTEGER, BASE_62));
    assertThat(e.getReason(), is(EXHAUSTED));
  }

  @Test
  public void testDecrementWithoutBorrow() {
    assertEquals("a8", IntegerArithmetic.decrement("a9", BASE_10));
    assertEquals("b98", IntegerArithmetic.decrement("b99", BASE_10));
    assertEquals("Y98", IntegerArithmetic.decrement("Y99", BASE_10));
    assertEquals("Z8", IntegerArithmetic.decrement("Z9", BASE_10));
  }

  @Test
  public void testDecrementBorrowShrinksLowercase() {
    assertEquals("a9", IntegerArithmetic.decrement("b00", BASE_10));
    assertEquals("az", IntegerArithmetic.decrement("b00", BASE_62));
  }

  @Test
  public void testDecrementBorrowGrowsUppercase() {
    assertEquals("Y99", IntegerArithmetic.decrement("Z0", BASE_10));
    assertEquals("X999", IntegerArithmetic.decrement("Y00", BASE_10));
    assertEquals("Yzz", IntegerArithmetic.decrement("Z0", BASE_62));
  }

  @Test
  public void testDecrementCrossesIntoUppercase() {
    assertEquals("Z9", IntegerArithmetic.decrement("a0", BASE_10));
    assertEquals("Zz", IntegerArithmetic.decrement("a0", BASE_62));
  }

  @Test
  public void testDecrementSmallestIsNull() {
    assertNull(IntegerArithmetic.decrement(OrderKeys.SMALLEST_INTEGER, BASE_62));
    final var e =
        assertThrows(
            OrderKeyException.class,
            () -> IntegerArithmetic.decrementOrThrow(OrderKeys.SMALLEST_INTEGER, BASE_62));
    assertThat(e.getReason(), is(EXHAUSTED));
  }

  @Test
  public void testIncrementThenDecrementWalksBack() {
    String x = "X000";
    for (int i = 0; i < 2000; i++) {
      final String next = IntegerArithmetic.increment(x, BASE_10);
      assertThat(next.compareTo(x) > 0, is(true));
      assertEquals(x, IntegerArithmetic.decrement(next, BASE_10));
      x = next;
    }
    assertEquals("a9", IntegerArithmetic.decrement("b00", BASE_10));
  }

  @Test
  public void testUsesAlphabetDigits() {
    final var letters = DigitAlphabet.of("abcdefghij");
    assertEquals("ab", IntegerArithmetic.increment("aa", letters));
    assertEquals("baa", IntegerArithmetic.increment("aj", letters));
    assertEquals("aa", IntegerArithmetic.increment("Zj", letters));
    assertEquals("Zj", IntegerArithmetic.decrement("aa", letters));
  }

  @Test
  public void testInputIsNotMutated() {
    final String input = "a9";
    IntegerArithmetic.increment(input, BASE_10);
    IntegerArithmetic.decrement(input, BASE_10);
    assertEquals("a9", input);
  }

  @Test
  public void testRejectsInvalidIntegerParts() {
    assertThat(
        assertThrows(OrderKeyException.class, () -> IntegerArithmetic.increment("a00", BASE_10))
            .getReason(),
        is(INVALID_INTEGER_PART));
    assertThat(
        assertThrows(OrderKeyException.class, () -> IntegerArithmetic.decrement("Y0", BASE_10))
            .getReason(),
        is(INVALID_INTEGER_PART));
    assertThat(
        assertThrows(OrderKeyException.class, () -> IntegerArithmetic.increment("aZ", BASE_10))
            .getReason(),
        is(INVALID_INTEGER_PART));
    assertThat(
        assertThrows(OrderKeyException.class, () -> IntegerArithmetic.increment("!0", BASE_10))
            .getReason(),
        is(INVALID_HEAD));
  }
}
