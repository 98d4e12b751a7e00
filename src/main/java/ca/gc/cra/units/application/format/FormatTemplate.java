package ca.gc.cra.units.application.format;

import ca.gc.cra.units.validation.Numbers;
import java.util.Objects;

/**
 * Display rules for one quantity category.
 *
 * @param precision digits after the decimal point, 0 to 17
 * @param notation fixed or scientific
 * @param suffix text appended after the unit, e.g. {@code " (abs)"}; never {@code null}
 * @since 0.1.0
 */
public record FormatTemplate(int precision, Notation notation, String suffix) {
  /** Four decimals, fixed notation, no suffix. */
  public static final FormatTemplate DEFAULT = new FormatTemplate(4, Notation.FIXED, "");

  public FormatTemplate {
    Numbers.requireRange("precision", precision, 0, 17);
    Objects.requireNonNull(notation, "notation");
    suffix = suffix == null ? "" : suffix;
  }

  public static FormatTemplate fixed(int precision) {
    return new FormatTemplate(precision, Notation.FIXED, "");
  }

  public static FormatTemplate scientific(int precision) {
    return new FormatTemplate(precision, Notation.SCIENTIFIC, "");
  }

  /**
   * Returns a copy with a different suffix.
   *
   * @param newSuffix suffix text
   * @return template
   */
  public FormatTemplate withSuffix(String newSuffix) {
    return new FormatTemplate(precision, notation, newSuffix);
  }

  String format(double value) {
    return notation.format(value, precision);
  }
}
