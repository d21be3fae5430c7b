package jp.naoj.pfs.redaction.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(1L, Numbers.requireRange("workers", 1, 1, 256));
    assertEquals(256L, Numbers.requireRange("workers", 256, 1, 256));
  }

  @Test
  void requireRangeNamesKey() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("visit", -1, 0, 999_999));
    assertEquals("visit must be between 0 and 999999 (was -1)", ex.getMessage());
  }

  @Test
  void parseLongRejectsText() {
    assertEquals(42L, Numbers.parseLong("sequenceBase", " 42 "));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseLong("workers", "four"));
    assertEquals("workers must be an integer (was four)", ex.getMessage());
  }

  @Test
  void parseDoubleAcceptsNaN() {
    assertTrue(Double.isNaN(Numbers.parseDouble("fluxFill", "NaN")));
    assertEquals(-99.0, Numbers.parseDouble("mask.ra", "-99"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseDouble("fluxFill", "n/a"));
  }
}
