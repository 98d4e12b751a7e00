package ca.gc.cra.units.application.format;

import java.util.Locale;

/**
 * Number notation used by a {@link FormatTemplate}.
 *
 * @since 0.1.0
 */
public enum Notation {
  /** Plain decimal, e.g. {@code 101325.00}. */
  FIXED('f'),
  /** Exponential, e.g. {@code 1.01e+05}. */
  SCIENTIFIC('e');

  private final char conversion;

  Notation(char conversion) {
    this.conversion = conversion;
  }

  String format(double value, int precision) {
    return String.format(Locale.ROOT, "%." + precision + conversion, value);
  }

  /**
   * Parses {@code fixed} or {@code scientific}, ignoring case.
   *
   * @param text notation name
   * @return notation
   * @throws IllegalArgumentException for other names
   */
  public static Notation fromText(String text) {
    if (text != null) {
      for (Notation notation : values()) {
        if (notation.name().equalsIgnoreCase(text.trim())) {
          return notation;
        }
      }
    }
    throw new IllegalArgumentException("Unknown notation '" + text + "'. Use 'fixed' or 'scientific'");
  }
}
