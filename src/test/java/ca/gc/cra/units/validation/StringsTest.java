package ca.gc.cra.units.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("depth", Strings.requireNonBlank("field", "  depth  "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("field", "   "));
    assertEquals("field must not be blank", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("field", "bad\u0001"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("field", null));
  }

  @Test
  void normalizeLabelAllowsEmpty() {
    assertEquals("", Strings.normalizeLabel("source", null));
    assertEquals("", Strings.normalizeLabel("source", ""));
    assertEquals("sensor", Strings.normalizeLabel("source", " sensor "));
    assertThrows(IllegalArgumentException.class, () -> Strings.normalizeLabel("source", "a\nb"));
  }
}
