package ca.gc.cra.units.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(0L, Numbers.requireRange("precision", 0, 0, 17));
    assertEquals(17L, Numbers.requireRange("precision", 17, 0, 17));
  }

  @Test
  void requireRangeRejectsOutOfBounds() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("precision", 18, 0, 17));
    assertEquals("precision must be between 0 and 17 (was 18)", ex.getMessage());
  }

  @Test
  void requirePositiveDuration() {
    assertEquals(Duration.ofSeconds(1), Numbers.requirePositive("timeout", Duration.ofSeconds(1)));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositive("timeout", Duration.ZERO));
    assertThrows(NullPointerException.class, () -> Numbers.requirePositive("timeout", null));
  }

  @Test
  void requireFiniteAcceptsNumbersAndNumericText() {
    assertEquals(12.5, Numbers.requireFinite("depth", 12.5));
    assertEquals(3.0, Numbers.requireFinite("depth", 3));
    assertEquals(7.25, Numbers.requireFinite("depth", " 7.25 "));
  }

  @Test
  void requireFiniteRejectsOtherValues() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireFinite("depth", "deep"));
    assertTrue(ex.getMessage().startsWith("depth must be numeric"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireFinite("depth", null));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireFinite("depth", Boolean.FALSE));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireFinite("depth", Double.NaN));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireFinite("depth", "Infinity"));
  }
}
